package com.cowcord.client.exceptions;

/**
 * A decrypted payload did not have the expected shape.
 */
public class MalformedPayloadException extends ProtocolViolationException {
  /**
   * Instantiates a new Malformed payload exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public MalformedPayloadException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
