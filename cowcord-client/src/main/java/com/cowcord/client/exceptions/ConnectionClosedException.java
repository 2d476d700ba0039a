package com.cowcord.client.exceptions;

/**
 * The gateway connection closed, locally or remotely.
 */
public class ConnectionClosedException extends RemoteAuthException {
  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConnectionClosedException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
