package com.cowcord.client.transport;

import com.cowcord.client.exceptions.ConnectionClosedException;
import com.cowcord.client.exceptions.ProtocolViolationException;
import com.cowcord.model.remoteauth.ClientOpcode;
import com.cowcord.model.remoteauth.ServerOpcode;
import java.time.Duration;

/**
 * A message-framed, bidirectional connection to the remote auth gateway.
 * <p>
 * Owned by exactly one session for its lifetime.  {@link #receive(Duration)} is only called from
 * the session loop; {@link #close()} may be called from any thread and wakes a pending receive.
 */
public interface Transport extends AutoCloseable {

  /**
   * Sends one opcode.
   *
   * @param opcode the opcode
   * @throws ConnectionClosedException if the connection is closed or the send fails
   */
  void send(ClientOpcode opcode);

  /**
   * Waits for the next opcode.
   *
   * @param timeout how long to wait, or {@code null} to wait until a message arrives or the
   *                connection closes
   * @return the opcode, or {@code null} if the timeout elapsed first
   * @throws ConnectionClosedException   if the connection is closed
   * @throws ProtocolViolationException  if the next frame cannot be decoded
   * @throws InterruptedException        if the waiting thread is interrupted
   */
  ServerOpcode receive(Duration timeout) throws InterruptedException;

  /**
   * Whether the connection can still carry messages.
   *
   * @return true while open
   */
  boolean isOpen();

  /**
   * Closes the connection.  Idempotent.
   */
  @Override
  void close();
}
