package com.cowcord.model.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Successful response of {@code POST /users/@me/remote-auth/login}.
 *
 * @param encryptedToken the authentication token encrypted with the client's public key, base64-encoded
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteAuthTicketExchangeResponse(@JsonProperty("encrypted_token") String encryptedToken) {
}
