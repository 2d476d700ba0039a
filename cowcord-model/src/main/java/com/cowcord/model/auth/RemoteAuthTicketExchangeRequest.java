package com.cowcord.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /users/@me/remote-auth/login}.
 *
 * @param ticket the ticket obtained from the remote auth gateway's {@code pending_login} message
 */
public record RemoteAuthTicketExchangeRequest(@JsonProperty("ticket") String ticket) {

  /**
   * Path of the ticket exchange endpoint, relative to the versioned API base.
   */
  public static final String PATH = "/users/@me/remote-auth/login";

  @Override
  public String toString() {
    return "RemoteAuthTicketExchangeRequest[ticket=" + Token.redact(ticket) + "]";
  }
}
