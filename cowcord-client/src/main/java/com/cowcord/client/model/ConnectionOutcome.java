package com.cowcord.client.model;

import com.cowcord.client.exceptions.RemoteAuthException;
import com.cowcord.model.auth.Token;
import java.util.Objects;

/**
 * How a single gateway connection ended.  The session's outer loop decides what to do next.
 *
 * @param kind   the kind
 * @param token  the token, only for {@link Kind#COMPLETED}
 * @param reason the failure, for {@link Kind#RECONNECT} and {@link Kind#FATAL}
 */
public record ConnectionOutcome(Kind kind, Token token, RemoteAuthException reason) {

  /**
   * The kinds of outcome.
   */
  public enum Kind {
    /** The connection failed; start over with a new connection and keypair. */
    RECONNECT,
    /** The token was obtained. */
    COMPLETED,
    /** The caller cancelled. */
    CANCELLED,
    /** The companion device cancelled. */
    REMOTE_CANCELLED,
    /** The flow cannot continue. */
    FATAL
  }

  public ConnectionOutcome {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.COMPLETED && token == null) {
      throw new IllegalArgumentException("COMPLETED requires a token");
    }
  }

  public static ConnectionOutcome reconnect(final RemoteAuthException reason) {
    return new ConnectionOutcome(Kind.RECONNECT, null, reason);
  }

  public static ConnectionOutcome completed(final Token token) {
    return new ConnectionOutcome(Kind.COMPLETED, token, null);
  }

  public static ConnectionOutcome cancelled() {
    return new ConnectionOutcome(Kind.CANCELLED, null, null);
  }

  public static ConnectionOutcome remoteCancelled() {
    return new ConnectionOutcome(Kind.REMOTE_CANCELLED, null, null);
  }

  public static ConnectionOutcome fatal(final RemoteAuthException reason) {
    return new ConnectionOutcome(Kind.FATAL, null, reason);
  }
}
