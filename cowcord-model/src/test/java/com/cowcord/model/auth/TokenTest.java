package com.cowcord.model.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class TokenTest {

  @Test
  void toString_neverRevealsValue() {
    Token token = new Token("MTIz.secret.value");

    assertThat(token.toString()).doesNotContain("secret").contains("REDACTED");
    assertThat(token.value()).isEqualTo("MTIz.secret.value");
  }

  @Test
  void blankValue_isRejected() {
    assertThatThrownBy(() -> new Token(" ")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new Token(null)).isInstanceOf(NullPointerException.class);
  }

  @Test
  void redact_handlesNullAndEmpty() {
    assertThat(Token.redact(null)).isNull();
    assertThat(Token.redact("")).isEmpty();
    assertThat(Token.redact("ticket")).isEqualTo("REDACTED");
  }

  @Test
  void ticketExchangeRequest_serializesTicketButRedactsToString() throws Exception {
    RemoteAuthTicketExchangeRequest request = new RemoteAuthTicketExchangeRequest("t-123");

    assertThat(new ObjectMapper().writeValueAsString(request)).isEqualTo("{\"ticket\":\"t-123\"}");
    assertThat(request.toString()).doesNotContain("t-123");
  }

  @Test
  void ticketExchangeResponse_decodesEncryptedToken() throws Exception {
    RemoteAuthTicketExchangeResponse response = new ObjectMapper()
        .readValue("{\"encrypted_token\":\"abc\",\"other\":1}", RemoteAuthTicketExchangeResponse.class);

    assertThat(response.encryptedToken()).isEqualTo("abc");
  }
}
