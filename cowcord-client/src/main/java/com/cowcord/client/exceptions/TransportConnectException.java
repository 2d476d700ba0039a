package com.cowcord.client.exceptions;

/**
 * The gateway connection could not be established.
 */
public class TransportConnectException extends RemoteAuthException {
  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TransportConnectException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
