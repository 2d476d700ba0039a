package com.cowcord.client.exceptions;

/**
 * The gateway sent something the handshake does not allow: a fingerprint that does not match
 * the local key, an undecodable frame, an opcode out of order, or it closed the connection while
 * the client was still waiting.  The session reconnects with a fresh keypair.
 */
public class ProtocolViolationException extends RemoteAuthException {
  /**
   * Instantiates a new Protocol violation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ProtocolViolationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
