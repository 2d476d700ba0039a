package com.cowcord.model.remoteauth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Messages the remote auth gateway sends to the client.
 * <p>
 * Decoded on the {@code op} discriminator.  An {@code op} this client does not know about is
 * decoded as {@link Unknown} rather than failing, so that new gateway messages do not break
 * older clients; a known {@code op} with a malformed body still fails to decode.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op",
    visible = true, defaultImpl = ServerOpcode.Unknown.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerOpcode.Hello.class, name = "hello"),
    @JsonSubTypes.Type(value = ServerOpcode.NonceProof.class, name = "nonce_proof"),
    @JsonSubTypes.Type(value = ServerOpcode.HeartbeatAck.class, name = "heartbeat_ack"),
    @JsonSubTypes.Type(value = ServerOpcode.PendingRemoteInit.class, name = "pending_remote_init"),
    @JsonSubTypes.Type(value = ServerOpcode.PendingTicket.class, name = "pending_ticket"),
    @JsonSubTypes.Type(value = ServerOpcode.PendingLogin.class, name = "pending_login"),
    @JsonSubTypes.Type(value = ServerOpcode.Cancel.class, name = "cancel")
})
public interface ServerOpcode {

  /**
   * First message after connecting; defines heartbeat and session lifetime.
   *
   * @param heartbeatIntervalMs the interval in milliseconds the client should heartbeat at
   * @param timeoutMs           lifespan of the remote auth session in milliseconds before the
   *                            gateway closes the connection, typically a few minutes
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Hello(@JsonProperty(value = "heartbeat_interval", required = true) long heartbeatIntervalMs,
               @JsonProperty(value = "timeout_ms", required = true) long timeoutMs) implements ServerOpcode {
  }

  /**
   * Requests a cryptographic proof of the handshake.
   *
   * @param encryptedNonce base64-encoded nonce encrypted with the client's public key
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record NonceProof(@JsonProperty(value = "encrypted_nonce", required = true) String encryptedNonce)
      implements ServerOpcode {
  }

  /**
   * Acknowledges a client heartbeat.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record HeartbeatAck() implements ServerOpcode {
  }

  /**
   * The handshake succeeded and the gateway waits for the companion device.
   *
   * @param fingerprint base64url-encoded (no padding) SHA-256 digest of the client's public key
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record PendingRemoteInit(@JsonProperty(value = "fingerprint", required = true) String fingerprint)
      implements ServerOpcode {
  }

  /**
   * The companion device scanned the code.
   *
   * @param encryptedUserPayload base64-encoded {@code id:discriminator:avatar:username} string
   *                             encrypted with the client's public key
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record PendingTicket(@JsonProperty(value = "encrypted_user_payload", required = true) String encryptedUserPayload)
      implements ServerOpcode {
  }

  /**
   * The companion device approved the login.
   *
   * @param ticket single-use ticket to exchange for a token
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record PendingLogin(@JsonProperty(value = "ticket", required = true) String ticket) implements ServerOpcode {
  }

  /**
   * The companion device cancelled the login.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Cancel() implements ServerOpcode {
  }

  /**
   * Any {@code op} not listed above.
   *
   * @param op the discriminator as received
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unknown(@JsonProperty("op") String op) implements ServerOpcode {
  }
}
