package com.cowcord.client.manager;

import com.cowcord.client.accessor.TicketExchangeAccessor;
import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.crypto.SessionKeyPair;
import com.cowcord.client.exceptions.CryptoException;
import com.cowcord.client.exceptions.MalformedPayloadException;
import com.cowcord.client.exceptions.ProtocolViolationException;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.client.heartbeat.HeartbeatScheduler;
import com.cowcord.client.model.ConnectionOutcome;
import com.cowcord.client.model.RemoteUser;
import com.cowcord.client.model.SessionPhase;
import com.cowcord.client.state.PhaseSink;
import com.cowcord.client.transport.Transport;
import com.cowcord.model.auth.RemoteAuthTicketExchangeResponse;
import com.cowcord.model.auth.Token;
import com.cowcord.model.remoteauth.ClientOpcode;
import com.cowcord.model.remoteauth.ServerOpcode;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reacts to the opcodes received on one gateway connection.
 * <p>
 * Owns the phase of that connection and drives the handshake:
 * <ol>
 *   <li>{@code hello} starts heartbeating and sends our public key in {@code init}.</li>
 *   <li>{@code nonce_proof} is decrypted and echoed back to prove we hold the private key.</li>
 *   <li>{@code pending_remote_init} carries the fingerprint of the key the gateway received; it
 *   must match ours before the QR code is shown.</li>
 *   <li>{@code pending_ticket} carries the identity of the scanning account.</li>
 *   <li>{@code pending_login} carries the ticket, exchanged once for the encrypted token.</li>
 * </ol>
 * Protocol violations are thrown and end the connection.  A ticket exchange failure is thrown as
 * {@link TicketExchangeException} and ends the whole flow.
 */
public class RemoteAuthStateMachine {

  private static final Logger log = LoggerFactory.getLogger(RemoteAuthStateMachine.class);

  /** Upper bound on the heartbeat interval the gateway may announce. */
  static final long MAX_HEARTBEAT_INTERVAL_MS = Duration.ofMinutes(10).toMillis();

  private final Transport transport;
  private final SessionKeyPair keys;
  private final HeartbeatScheduler heartbeat;
  private final PhaseSink sink;
  private final TicketExchangeAccessor ticketExchangeAccessor;
  private final RemoteAuthClientConfig config;

  private SessionPhase phase = SessionPhase.loading();
  private boolean ticketExchanged;

  /**
   * Instantiates a new state machine for one connection.
   *
   * @param transport              the connection
   * @param keys                   the keypair for this connection
   * @param heartbeat              the heartbeat scheduler for this connection
   * @param sink                   where phase changes are published
   * @param ticketExchangeAccessor the ticket exchange accessor
   * @param config                 the client config
   */
  public RemoteAuthStateMachine(final Transport transport,
                                final SessionKeyPair keys,
                                final HeartbeatScheduler heartbeat,
                                final PhaseSink sink,
                                final TicketExchangeAccessor ticketExchangeAccessor,
                                final RemoteAuthClientConfig config) {
    this.transport = transport;
    this.keys = keys;
    this.heartbeat = heartbeat;
    this.sink = sink;
    this.ticketExchangeAccessor = ticketExchangeAccessor;
    this.config = config;
  }

  /**
   * The current phase of this connection.
   *
   * @return the phase
   */
  public SessionPhase phase() {
    return phase;
  }

  /**
   * Handles one inbound opcode.
   *
   * @param opcode the opcode
   * @return the outcome if the opcode ends the connection, otherwise empty
   * @throws ProtocolViolationException if the opcode is invalid here
   * @throws CryptoException            if a payload cannot be decrypted
   * @throws TicketExchangeException    if the ticket cannot be exchanged
   */
  public Optional<ConnectionOutcome> handle(final ServerOpcode opcode) {
    if (opcode instanceof ServerOpcode.Hello hello) {
      onHello(hello);
    } else if (opcode instanceof ServerOpcode.NonceProof nonceProof) {
      onNonceProof(nonceProof);
    } else if (opcode instanceof ServerOpcode.HeartbeatAck) {
      log.trace("heartbeat_ack");
      heartbeat.acknowledge();
    } else if (opcode instanceof ServerOpcode.PendingRemoteInit pendingRemoteInit) {
      onPendingRemoteInit(pendingRemoteInit);
    } else if (opcode instanceof ServerOpcode.PendingTicket pendingTicket) {
      onPendingTicket(pendingTicket);
    } else if (opcode instanceof ServerOpcode.PendingLogin pendingLogin) {
      return Optional.of(onPendingLogin(pendingLogin));
    } else if (opcode instanceof ServerOpcode.Cancel) {
      log.info("Login cancelled on the companion device");
      transition(new SessionPhase.Cancelled());
      return Optional.of(ConnectionOutcome.remoteCancelled());
    } else if (opcode instanceof ServerOpcode.Unknown unknown) {
      log.debug("Ignoring unknown op {}", unknown.op());
    } else {
      throw new IllegalArgumentException("Unhandled opcode type: " + opcode);
    }
    return Optional.empty();
  }

  // ── Handshake ─────────────────────────────────────────────────────────────

  private void onHello(final ServerOpcode.Hello hello) {
    log.debug("hello(heartbeatInterval={}, timeoutMs={})", hello.heartbeatIntervalMs(), hello.timeoutMs());
    if (hello.heartbeatIntervalMs() <= 0 || hello.heartbeatIntervalMs() > MAX_HEARTBEAT_INTERVAL_MS) {
      throw new ProtocolViolationException("Invalid heartbeat interval " + hello.heartbeatIntervalMs(), null);
    }
    heartbeat.activate(Duration.ofMillis(hello.heartbeatIntervalMs()));
    transport.send(new ClientOpcode.Init(keys.encodedPublicKeyBase64()));
  }

  private void onNonceProof(final ServerOpcode.NonceProof nonceProof) {
    log.debug("nonce_proof()");
    byte[] nonce = keys.decryptBase64(nonceProof.encryptedNonce());
    transport.send(new ClientOpcode.NonceProof(Base64.getUrlEncoder().withoutPadding().encodeToString(nonce)));
  }

  private void onPendingRemoteInit(final ServerOpcode.PendingRemoteInit pendingRemoteInit) {
    log.debug("pending_remote_init(fingerprint={})", pendingRemoteInit.fingerprint());
    requirePhase(SessionPhase.Loading.class, "pending_remote_init");
    if (!keys.fingerprintMatches(pendingRemoteInit.fingerprint())) {
      throw new ProtocolViolationException("Fingerprint mismatch: expected " + keys.fingerprint()
          + " but gateway sent " + pendingRemoteInit.fingerprint(), null);
    }
    transition(new SessionPhase.QrCode(config.qrCodeUrl(pendingRemoteInit.fingerprint())));
  }

  private void onPendingTicket(final ServerOpcode.PendingTicket pendingTicket) {
    log.debug("pending_ticket()");
    requirePhase(SessionPhase.QrCode.class, "pending_ticket");
    byte[] payload = keys.decryptBase64(pendingTicket.encryptedUserPayload());
    RemoteUser user = RemoteUser.parse(decodeUtf8(payload));
    log.info("Scanned by user {}", user.userId());
    transition(SessionPhase.Accepted.from(user));
  }

  private ConnectionOutcome onPendingLogin(final ServerOpcode.PendingLogin pendingLogin) {
    log.debug("pending_login(ticket={})", Token.redact(pendingLogin.ticket()));
    requirePhase(SessionPhase.Accepted.class, "pending_login");
    if (pendingLogin.ticket() == null || pendingLogin.ticket().isBlank()) {
      throw new ProtocolViolationException("pending_login without a ticket", null);
    }
    if (ticketExchanged) {
      throw new ProtocolViolationException("Duplicate pending_login", null);
    }
    ticketExchanged = true;
    RemoteAuthTicketExchangeResponse response = ticketExchangeAccessor.exchange(pendingLogin.ticket());
    Token token;
    try {
      token = new Token(decodeUtf8(keys.decryptBase64(response.encryptedToken())));
    } catch (CryptoException | MalformedPayloadException e) {
      throw new TicketExchangeException("Unable to decrypt the exchanged token", e);
    } catch (IllegalArgumentException e) {
      throw new TicketExchangeException("Exchanged token is empty", e);
    }
    transition(new SessionPhase.Completed());
    return ConnectionOutcome.completed(token);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private void requirePhase(final Class<? extends SessionPhase> expected, final String op) {
    if (!expected.isInstance(phase)) {
      throw new ProtocolViolationException(op + " received in phase " + phase.getClass().getSimpleName()
          + ", expected " + expected.getSimpleName(), null);
    }
  }

  private void transition(final SessionPhase next) {
    log.debug("transition({} -> {})", phase.getClass().getSimpleName(), next.getClass().getSimpleName());
    phase = next;
    sink.publish(next);
  }

  private static String decodeUtf8(final byte[] bytes) {
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new MalformedPayloadException("Payload is not valid UTF-8", e);
    }
  }
}
