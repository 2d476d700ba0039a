package com.cowcord.client.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.cowcord.client.accessor.TicketExchangeAccessor;
import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.crypto.KeyMaterialManager;
import com.cowcord.client.crypto.SessionKeyPair;
import com.cowcord.client.exceptions.CryptoException;
import com.cowcord.client.exceptions.MalformedPayloadException;
import com.cowcord.client.exceptions.ProtocolViolationException;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.client.heartbeat.HeartbeatScheduler;
import com.cowcord.client.model.ConnectionOutcome;
import com.cowcord.client.model.SessionPhase;
import com.cowcord.client.testing.CompanionDevice;
import com.cowcord.client.testing.MutableClock;
import com.cowcord.client.transport.Transport;
import com.cowcord.model.auth.RemoteAuthTicketExchangeResponse;
import com.cowcord.model.remoteauth.ClientOpcode;
import com.cowcord.model.remoteauth.ServerOpcode;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RemoteAuthStateMachineTest {

  private static final RemoteAuthClientConfig CONFIG = RemoteAuthClientConfig.forTesting(
      URI.create("ws://localhost:8081"), URI.create("http://localhost:8080/api/v9"));

  private static SessionKeyPair keys;
  private static SessionKeyPair otherKeys;

  @Mock private Transport transport;
  @Mock private TicketExchangeAccessor ticketExchangeAccessor;

  private MutableClock clock;
  private HeartbeatScheduler heartbeat;
  private List<SessionPhase> published;
  private RemoteAuthStateMachine machine;

  @BeforeAll
  static void generateKeys() {
    KeyMaterialManager manager = new KeyMaterialManager(1024, new SecureRandom());
    keys = manager.generate();
    otherKeys = manager.generate();
  }

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    heartbeat = new HeartbeatScheduler(clock);
    published = new ArrayList<>();
    machine = new RemoteAuthStateMachine(transport, keys, heartbeat, published::add, ticketExchangeAccessor, CONFIG);
  }

  private static String encrypt(final String plaintext) {
    return CompanionDevice.encryptFor(keys.encodedPublicKey(), plaintext.getBytes(StandardCharsets.UTF_8));
  }

  private void scanned() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));
    machine.handle(new ServerOpcode.PendingTicket(encrypt("123:4567:hash:name")));
  }

  // ── Handshake ─────────────────────────────────────────────────────────────

  @Test
  void hello_activatesHeartbeatAndSendsInit() {
    Optional<ConnectionOutcome> outcome = machine.handle(new ServerOpcode.Hello(41_250, 120_000));

    assertThat(outcome).isEmpty();
    assertThat(heartbeat.timeUntilNextBeat()).contains(Duration.ofMillis(41_250));
    verify(transport).send(new ClientOpcode.Init(keys.encodedPublicKeyBase64()));
    assertThat(published).isEmpty();
  }

  @Test
  void hello_nonPositiveInterval_violation() {
    assertThatThrownBy(() -> machine.handle(new ServerOpcode.Hello(0, 120_000)))
        .isInstanceOf(ProtocolViolationException.class);
    verifyNoInteractions(transport);
  }

  @Test
  void hello_intervalBeyondCap_violationWithoutActivating() {
    assertThatThrownBy(() -> machine.handle(new ServerOpcode.Hello(9_300_000_000_000_000L, 120_000)))
        .isInstanceOf(ProtocolViolationException.class);
    assertThatThrownBy(() -> machine.handle(
        new ServerOpcode.Hello(RemoteAuthStateMachine.MAX_HEARTBEAT_INTERVAL_MS + 1, 120_000)))
        .isInstanceOf(ProtocolViolationException.class);

    assertThat(heartbeat.isActive()).isFalse();
    verifyNoInteractions(transport);
  }

  @Test
  void hello_intervalAtCap_accepted() {
    machine.handle(new ServerOpcode.Hello(RemoteAuthStateMachine.MAX_HEARTBEAT_INTERVAL_MS, 120_000));

    assertThat(heartbeat.timeUntilNextBeat())
        .contains(Duration.ofMillis(RemoteAuthStateMachine.MAX_HEARTBEAT_INTERVAL_MS));
  }

  @Test
  void nonceProof_sendsDecryptedNonceAsBase64Url() {
    byte[] nonce = new byte[32];
    new SecureRandom().nextBytes(nonce);

    machine.handle(new ServerOpcode.NonceProof(CompanionDevice.encryptFor(keys.encodedPublicKey(), nonce)));

    verify(transport).send(new ClientOpcode.NonceProof(Base64.getUrlEncoder().withoutPadding().encodeToString(nonce)));
  }

  @Test
  void nonceProof_forAnotherKey_cryptoFailure() {
    String ciphertext = CompanionDevice.encryptFor(otherKeys.encodedPublicKey(), new byte[]{1, 2, 3});

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.NonceProof(ciphertext)))
        .isInstanceOf(CryptoException.class);
    verifyNoInteractions(transport);
  }

  @Test
  void heartbeatAck_clearsPendingAck() {
    heartbeat.activate(Duration.ofSeconds(1));
    clock.advance(Duration.ofSeconds(1));
    heartbeat.tick();

    machine.handle(new ServerOpcode.HeartbeatAck());

    assertThat(heartbeat.isAckPending()).isFalse();
  }

  @Test
  void unknownOp_ignored() {
    assertThat(machine.handle(new ServerOpcode.Unknown("something_new"))).isEmpty();
    assertThat(machine.phase()).isEqualTo(SessionPhase.loading());
    verifyNoInteractions(transport);
  }

  // ── Phases ────────────────────────────────────────────────────────────────

  @Test
  void pendingRemoteInit_matchingFingerprint_qrCode() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));

    SessionPhase expected = new SessionPhase.QrCode("https://discord.com/ra/" + keys.fingerprint());
    assertThat(machine.phase()).isEqualTo(expected);
    assertThat(published).containsExactly(expected);
  }

  @Test
  void pendingRemoteInit_mismatch_violationAndStillLoading() {
    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingRemoteInit(otherKeys.fingerprint())))
        .isInstanceOf(ProtocolViolationException.class)
        .hasMessageContaining("Fingerprint mismatch");

    assertThat(machine.phase()).isEqualTo(SessionPhase.loading());
    assertThat(published).isEmpty();
  }

  @Test
  void pendingRemoteInit_twice_violation() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint())))
        .isInstanceOf(ProtocolViolationException.class);
  }

  @Test
  void pendingTicket_beforeQrCode_violation() {
    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingTicket(encrypt("123:4567:hash:name"))))
        .isInstanceOf(ProtocolViolationException.class);
    assertThat(published).isEmpty();
  }

  @Test
  void pendingTicket_accepted() {
    scanned();

    assertThat(machine.phase()).isEqualTo(new SessionPhase.Accepted("123", "4567", "hash", "name"));
    assertThat(published).hasSize(2).last().isEqualTo(machine.phase());
  }

  @Test
  void pendingTicket_malformedPayload_noPartialAccepted() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingTicket(encrypt("123:4567"))))
        .isInstanceOf(MalformedPayloadException.class);

    assertThat(machine.phase()).isInstanceOf(SessionPhase.QrCode.class);
    assertThat(published).noneMatch(phase -> phase instanceof SessionPhase.Accepted);
  }

  @Test
  void pendingTicket_invalidUtf8_malformed() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));
    String ciphertext = CompanionDevice.encryptFor(keys.encodedPublicKey(), new byte[]{'1', ':', (byte) 0xC3, ':', 'a', ':', 'b'});

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingTicket(ciphertext)))
        .isInstanceOf(MalformedPayloadException.class);
  }

  @Test
  void pendingLogin_exchangesTicketOnce_completes() {
    scanned();
    when(ticketExchangeAccessor.exchange("ticket-1"))
        .thenReturn(new RemoteAuthTicketExchangeResponse(encrypt("the-token")));

    Optional<ConnectionOutcome> outcome = machine.handle(new ServerOpcode.PendingLogin("ticket-1"));

    assertThat(outcome).hasValueSatisfying(o -> {
      assertThat(o.kind()).isEqualTo(ConnectionOutcome.Kind.COMPLETED);
      assertThat(o.token().value()).isEqualTo("the-token");
    });
    assertThat(published).last().isEqualTo(new SessionPhase.Completed());
    verify(ticketExchangeAccessor).exchange("ticket-1");
  }

  @Test
  void pendingLogin_beforeAccepted_violationWithoutExchange() {
    machine.handle(new ServerOpcode.PendingRemoteInit(keys.fingerprint()));

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingLogin("ticket-1")))
        .isInstanceOf(ProtocolViolationException.class);
    verify(ticketExchangeAccessor, never()).exchange(anyString());
  }

  @Test
  void pendingLogin_missingTicket_violationWithoutExchange() {
    scanned();

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingLogin(null)))
        .isInstanceOf(ProtocolViolationException.class);
    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingLogin(" ")))
        .isInstanceOf(ProtocolViolationException.class);

    verify(ticketExchangeAccessor, never()).exchange(any());
    assertThat(machine.phase()).isInstanceOf(SessionPhase.Accepted.class);
  }

  @Test
  void pendingLogin_undecryptableToken_ticketExchangeFailure() {
    scanned();
    when(ticketExchangeAccessor.exchange("ticket-1"))
        .thenReturn(new RemoteAuthTicketExchangeResponse(
            CompanionDevice.encryptFor(otherKeys.encodedPublicKey(), new byte[]{1})));

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingLogin("ticket-1")))
        .isInstanceOf(TicketExchangeException.class)
        .hasCauseInstanceOf(CryptoException.class);
    assertThat(published).noneMatch(phase -> phase instanceof SessionPhase.Completed);
  }

  @Test
  void pendingLogin_exchangeRejected_propagates() {
    scanned();
    when(ticketExchangeAccessor.exchange("ticket-1"))
        .thenThrow(new TicketExchangeException("Server returned HTTP 400", null, null, 400));

    assertThatThrownBy(() -> machine.handle(new ServerOpcode.PendingLogin("ticket-1")))
        .isInstanceOf(TicketExchangeException.class);
  }

  @Test
  void cancel_inAnyPhase_cancelled() {
    scanned();

    Optional<ConnectionOutcome> outcome = machine.handle(new ServerOpcode.Cancel());

    assertThat(outcome).map(ConnectionOutcome::kind).contains(ConnectionOutcome.Kind.REMOTE_CANCELLED);
    assertThat(machine.phase()).isEqualTo(new SessionPhase.Cancelled());
    assertThat(published).last().isEqualTo(new SessionPhase.Cancelled());
  }
}
