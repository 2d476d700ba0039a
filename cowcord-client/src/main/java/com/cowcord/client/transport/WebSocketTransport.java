package com.cowcord.client.transport;

import com.cowcord.client.exceptions.ConnectionClosedException;
import com.cowcord.client.exceptions.ProtocolViolationException;
import com.cowcord.model.remoteauth.ClientOpcode;
import com.cowcord.model.remoteauth.ServerOpcode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Transport} over a {@code java.net.http} WebSocket.
 * <p>
 * Acts as the socket's listener: complete text messages are queued as they arrive and decoded
 * on the receiving thread.  A close frame or socket error is queued behind any pending messages,
 * so everything the gateway sent before closing is still delivered.
 */
public class WebSocketTransport implements Transport, WebSocket.Listener {

  private static final Logger log = LoggerFactory.getLogger(WebSocketTransport.class);

  private static final Frame CLOSED = new Frame(null);
  private static final Duration MAX_POLL = Duration.ofNanos(Long.MAX_VALUE);

  private final ObjectMapper objectMapper;
  private final ObjectWriter opcodeWriter;
  private final Duration sendTimeout;
  private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();
  private final StringBuilder partial = new StringBuilder();
  private final AtomicBoolean closedLocally = new AtomicBoolean();

  private volatile WebSocket webSocket;
  private volatile boolean closed;
  private volatile String closeReason = "not connected";

  /**
   * Instantiates a new Web socket transport.
   *
   * @param objectMapper the object mapper
   * @param sendTimeout  maximum time to wait for a send to complete
   */
  public WebSocketTransport(final ObjectMapper objectMapper, final Duration sendTimeout) {
    this.objectMapper = objectMapper;
    this.opcodeWriter = objectMapper.writerFor(ClientOpcode.class);
    this.sendTimeout = sendTimeout;
  }

  // ── Listener ──────────────────────────────────────────────────────────────

  @Override
  public void onOpen(final WebSocket webSocket) {
    log.debug("onOpen()");
    this.webSocket = webSocket;
    this.closeReason = "open";
    webSocket.request(1);
  }

  @Override
  public CompletionStage<?> onText(final WebSocket webSocket, final CharSequence data, final boolean last) {
    partial.append(data);
    if (last) {
      frames.add(new Frame(partial.toString()));
      partial.setLength(0);
    }
    webSocket.request(1);
    return null;
  }

  @Override
  public CompletionStage<?> onClose(final WebSocket webSocket, final int statusCode, final String reason) {
    log.debug("onClose(statusCode={}, reason={})", statusCode, reason);
    markClosed("gateway closed the connection (" + statusCode + " " + reason + ")");
    return null;
  }

  @Override
  public void onError(final WebSocket webSocket, final Throwable error) {
    log.debug("onError()", error);
    markClosed("connection failed: " + error);
  }

  // ── Transport ─────────────────────────────────────────────────────────────

  @Override
  public void send(final ClientOpcode opcode) {
    WebSocket socket = webSocket;
    if (closed || socket == null) {
      throw new ConnectionClosedException("Cannot send, " + closeReason, null);
    }
    String json;
    try {
      json = opcodeWriter.writeValueAsString(opcode);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to encode " + opcode.getClass().getSimpleName(), e);
    }
    log.trace("send(op={})", opcode.getClass().getSimpleName());
    try {
      socket.sendText(json, true).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException e) {
      throw new ConnectionClosedException("Send failed", e.getCause());
    } catch (TimeoutException e) {
      throw new ConnectionClosedException("Send timed out after " + sendTimeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConnectionClosedException("Send interrupted", e);
    }
  }

  @Override
  public ServerOpcode receive(final Duration timeout) throws InterruptedException {
    Frame frame = timeout == null
        ? frames.take()
        : frames.poll(timeout.compareTo(MAX_POLL) > 0 ? Long.MAX_VALUE : timeout.toNanos(), TimeUnit.NANOSECONDS);
    if (frame == null) {
      return null;
    }
    if (frame == CLOSED) {
      // Keep the marker queued so every later receive fails the same way.
      frames.add(CLOSED);
      throw new ConnectionClosedException("Connection closed: " + closeReason, null);
    }
    try {
      ServerOpcode opcode = objectMapper.readValue(frame.text(), ServerOpcode.class);
      if (opcode == null) {
        throw new ProtocolViolationException("Undecodable gateway message", null);
      }
      return opcode;
    } catch (JsonProcessingException e) {
      throw new ProtocolViolationException("Undecodable gateway message", e);
    }
  }

  @Override
  public boolean isOpen() {
    return !closed && webSocket != null;
  }

  @Override
  public void close() {
    if (!closedLocally.compareAndSet(false, true)) {
      return;
    }
    log.debug("close()");
    markClosed("closed by client");
    WebSocket socket = webSocket;
    if (socket == null) {
      return;
    }
    if (socket.isOutputClosed()) {
      socket.abort();
      return;
    }
    socket.sendClose(WebSocket.NORMAL_CLOSURE, "")
        .orTimeout(sendTimeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((ignored, error) -> {
          if (error != null) {
            log.debug("Close handshake failed, aborting: {}", error.toString());
            socket.abort();
          }
        });
  }

  private void markClosed(final String reason) {
    if (closed) {
      return;
    }
    closeReason = reason;
    closed = true;
    frames.add(CLOSED);
  }

  private record Frame(String text) {
  }
}
