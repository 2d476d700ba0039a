package com.cowcord.client.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cowcord.client.exceptions.LivenessFailureException;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.model.auth.Token;
import org.junit.jupiter.api.Test;

class ConnectionOutcomeTest {

  @Test
  void completed_requiresToken() {
    assertThatThrownBy(() -> new ConnectionOutcome(ConnectionOutcome.Kind.COMPLETED, null, null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConnectionOutcome(null, null, null))
        .isInstanceOf(NullPointerException.class);
  }

  @Test
  void factories_setKindAndPayload() {
    Token token = new Token("t");
    LivenessFailureException missed = new LivenessFailureException("missed ack", null);
    TicketExchangeException rejected = new TicketExchangeException("rejected", null);

    assertThat(ConnectionOutcome.completed(token))
        .isEqualTo(new ConnectionOutcome(ConnectionOutcome.Kind.COMPLETED, token, null));
    assertThat(ConnectionOutcome.reconnect(missed).reason()).isSameAs(missed);
    assertThat(ConnectionOutcome.fatal(rejected).kind()).isEqualTo(ConnectionOutcome.Kind.FATAL);
    assertThat(ConnectionOutcome.cancelled().kind()).isEqualTo(ConnectionOutcome.Kind.CANCELLED);
    assertThat(ConnectionOutcome.remoteCancelled().token()).isNull();
  }
}
