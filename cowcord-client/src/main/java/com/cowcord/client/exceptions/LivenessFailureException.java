package com.cowcord.client.exceptions;

/**
 * The gateway did not acknowledge the previous heartbeat before the next one was due.
 */
public class LivenessFailureException extends RemoteAuthException {
  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public LivenessFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
