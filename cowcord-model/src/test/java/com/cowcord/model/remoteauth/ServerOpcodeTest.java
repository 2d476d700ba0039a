package com.cowcord.model.remoteauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ServerOpcodeTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void hello_decodesIntervals() throws Exception {
    ServerOpcode opcode = mapper.readValue(
        "{\"op\":\"hello\",\"heartbeat_interval\":41250,\"timeout_ms\":120000}", ServerOpcode.class);

    assertThat(opcode).isEqualTo(new ServerOpcode.Hello(41250, 120000));
  }

  @Test
  void nonceProof_decodesEncryptedNonce() throws Exception {
    ServerOpcode opcode = mapper.readValue(
        "{\"op\":\"nonce_proof\",\"encrypted_nonce\":\"YWJj\"}", ServerOpcode.class);

    assertThat(opcode).isEqualTo(new ServerOpcode.NonceProof("YWJj"));
  }

  @Test
  void pendingMessages_decode() throws Exception {
    assertThat(mapper.readValue("{\"op\":\"pending_remote_init\",\"fingerprint\":\"abc_-\"}", ServerOpcode.class))
        .isEqualTo(new ServerOpcode.PendingRemoteInit("abc_-"));
    assertThat(mapper.readValue("{\"op\":\"pending_ticket\",\"encrypted_user_payload\":\"eA==\"}", ServerOpcode.class))
        .isEqualTo(new ServerOpcode.PendingTicket("eA=="));
    assertThat(mapper.readValue("{\"op\":\"pending_login\",\"ticket\":\"t-1\"}", ServerOpcode.class))
        .isEqualTo(new ServerOpcode.PendingLogin("t-1"));
  }

  @Test
  void payloadlessMessages_decode() throws Exception {
    assertThat(mapper.readValue("{\"op\":\"heartbeat_ack\"}", ServerOpcode.class))
        .isInstanceOf(ServerOpcode.HeartbeatAck.class);
    assertThat(mapper.readValue("{\"op\":\"cancel\"}", ServerOpcode.class))
        .isInstanceOf(ServerOpcode.Cancel.class);
  }

  @Test
  void extraFields_areIgnored() throws Exception {
    ServerOpcode opcode = mapper.readValue(
        "{\"op\":\"pending_login\",\"ticket\":\"t-1\",\"extra\":true}", ServerOpcode.class);

    assertThat(opcode).isEqualTo(new ServerOpcode.PendingLogin("t-1"));
  }

  @Test
  void unknownOp_decodesAsUnknown() throws Exception {
    ServerOpcode opcode = mapper.readValue("{\"op\":\"something_new\",\"x\":1}", ServerOpcode.class);

    assertThat(opcode).isEqualTo(new ServerOpcode.Unknown("something_new"));
  }

  @Test
  void knownOp_missingRequiredField_fails() {
    assertThatThrownBy(() -> mapper.readValue("{\"op\":\"pending_login\"}", ServerOpcode.class))
        .isInstanceOf(JsonProcessingException.class);
    assertThatThrownBy(() -> mapper.readValue("{\"op\":\"hello\",\"timeout_ms\":1}", ServerOpcode.class))
        .isInstanceOf(JsonProcessingException.class);
  }

  @Test
  void notJson_fails() {
    assertThatThrownBy(() -> mapper.readValue("not json", ServerOpcode.class))
        .isInstanceOf(JsonProcessingException.class);
  }
}
