package com.cowcord.client.exceptions;

/**
 * Base type of every failure raised by the remote auth client.
 */
public class RemoteAuthException extends RuntimeException {
  /**
   * Instantiates a new Remote auth exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public RemoteAuthException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
