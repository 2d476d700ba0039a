package com.cowcord.client.exceptions;

/**
 * Key generation, decryption or verification failed.
 */
public class CryptoException extends RemoteAuthException {
  /**
   * Instantiates a new exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
