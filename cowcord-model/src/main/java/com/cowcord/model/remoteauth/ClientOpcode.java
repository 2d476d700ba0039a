package com.cowcord.model.remoteauth;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Messages the client sends to the remote auth gateway.
 * <p>
 * Every message is a JSON object discriminated by its {@code op} field, e.g.
 * {@code {"op":"init","encoded_public_key":"MIIBIjAN..."}}.  Serialize through
 * {@code objectMapper.writerFor(ClientOpcode.class)} so the discriminator is always written.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "op")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientOpcode.Init.class, name = "init"),
    @JsonSubTypes.Type(value = ClientOpcode.Heartbeat.class, name = "heartbeat"),
    @JsonSubTypes.Type(value = ClientOpcode.NonceProof.class, name = "nonce_proof")
})
public interface ClientOpcode {

  /**
   * Starts a new remote auth session by handing the gateway the client's public key.
   *
   * @param encodedPublicKey base64-encoded (standard alphabet, padded) DER SubjectPublicKeyInfo
   *                         of the client's 2048-bit RSA-OAEP public key
   */
  record Init(@JsonProperty("encoded_public_key") String encodedPublicKey) implements ClientOpcode {
  }

  /**
   * Keeps the WebSocket connection alive. Carries no payload.
   */
  record Heartbeat() implements ClientOpcode {
  }

  /**
   * Proves possession of the private key by returning the decrypted nonce.
   *
   * @param nonce the decrypted nonce, base64url-encoded without padding
   */
  record NonceProof(@JsonProperty("nonce") String nonce) implements ClientOpcode {
  }
}
