package com.cowcord.client.manager;

import com.cowcord.client.accessor.TicketExchangeAccessor;
import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.crypto.KeyMaterialManager;
import com.cowcord.client.crypto.SessionKeyPair;
import com.cowcord.client.exceptions.LivenessFailureException;
import com.cowcord.client.exceptions.RemoteAuthException;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.client.exceptions.TransportConnectException;
import com.cowcord.client.heartbeat.HeartbeatScheduler;
import com.cowcord.client.model.ConnectionOutcome;
import com.cowcord.client.model.SessionPhase;
import com.cowcord.client.state.PhaseSink;
import com.cowcord.client.transport.Transport;
import com.cowcord.client.transport.TransportConnector;
import com.cowcord.model.auth.Token;
import com.cowcord.model.remoteauth.ClientOpcode;
import com.cowcord.model.remoteauth.ServerOpcode;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One remote auth login flow.
 * <p>
 * {@link #run()} blocks the calling thread until the flow ends.  Every connection attempt gets a
 * new transport and a new keypair; both are discarded when the attempt ends.  Protocol violations,
 * closed connections and missed heartbeat acks start a new attempt.  A failed ticket exchange,
 * key generation failure or exhausted connect budget ends the flow with an exception.
 * <p>
 * {@link #cancel()} may be called from any thread.
 */
public class RemoteAuthSession {

  private static final Logger log = LoggerFactory.getLogger(RemoteAuthSession.class);

  private final RemoteAuthClientConfig config;
  private final TransportConnector connector;
  private final KeyMaterialManager keyMaterialManager;
  private final TicketExchangeAccessor ticketExchangeAccessor;
  private final PhaseSink sink;
  private final Clock clock;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CountDownLatch cancelSignal = new CountDownLatch(1);
  private final AtomicReference<Transport> liveTransport = new AtomicReference<>();

  /**
   * Instantiates a new Remote auth session.
   *
   * @param config                 the client config
   * @param connector              opens gateway connections
   * @param keyMaterialManager     generates per-connection keypairs
   * @param ticketExchangeAccessor exchanges the login ticket
   * @param sink                   receives phase changes
   * @param clock                  drives the heartbeat
   */
  public RemoteAuthSession(final RemoteAuthClientConfig config,
                           final TransportConnector connector,
                           final KeyMaterialManager keyMaterialManager,
                           final TicketExchangeAccessor ticketExchangeAccessor,
                           final PhaseSink sink,
                           final Clock clock) {
    this.config = config;
    this.connector = connector;
    this.keyMaterialManager = keyMaterialManager;
    this.ticketExchangeAccessor = ticketExchangeAccessor;
    this.sink = sink;
    this.clock = clock;
  }

  /**
   * Runs the login flow until it completes, is cancelled or fails.  May only be called once.
   *
   * @return the token, or empty if the flow was cancelled locally or on the companion device
   * @throws TransportConnectException if the gateway could not be reached within the retry budget
   * @throws TicketExchangeException   if the ticket exchange failed
   * @throws RemoteAuthException       if a keypair could not be generated
   */
  public Optional<Token> run() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Session already run");
    }
    log.debug("run()");
    int attempt = 0;
    int connectFailures = 0;
    while (!cancelled.get()) {
      attempt++;
      sink.publish(SessionPhase.loading());
      Transport transport;
      try {
        transport = connector.connect();
      } catch (TransportConnectException e) {
        if (cancelled.get()) {
          break;
        }
        connectFailures++;
        if (config.maxConnectAttempts() > 0 && connectFailures >= config.maxConnectAttempts()) {
          log.warn("Giving up after {} failed connection attempts", connectFailures);
          throw e;
        }
        log.warn("Connection attempt {} failed: {}", attempt, e.getMessage());
        pause();
        continue;
      }
      connectFailures = 0;

      ConnectionOutcome outcome;
      try (Transport t = transport) {
        liveTransport.set(t);
        if (cancelled.get()) {
          break;
        }
        outcome = runConnection(t, keyMaterialManager.generate());
      } finally {
        liveTransport.set(null);
      }

      switch (outcome.kind()) {
        case COMPLETED:
          log.info("Login completed after {} attempt(s)", attempt);
          return Optional.of(outcome.token());
        case CANCELLED:
          break;
        case REMOTE_CANCELLED:
          if (!config.restartOnRemoteCancel()) {
            return Optional.empty();
          }
          log.info("Restarting after companion device cancel");
          pause();
          break;
        case FATAL:
          throw outcome.reason();
        case RECONNECT:
        default:
          log.warn("Reconnecting after attempt {}: {}", attempt, outcome.reason().getMessage());
          pause();
          break;
      }
    }
    log.info("Login cancelled");
    sink.publish(new SessionPhase.Cancelled());
    return Optional.empty();
  }

  /**
   * Stops the flow.  Closes the live connection, wakes a pending reconnect delay and prevents
   * further attempts.  {@link #run()} then returns empty.  Safe to call from any thread, any number
   * of times.
   */
  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return;
    }
    log.debug("cancel()");
    cancelSignal.countDown();
    Transport transport = liveTransport.get();
    if (transport != null) {
      transport.close();
    }
  }

  /**
   * Whether {@link #cancel()} was called or the running thread was interrupted.
   *
   * @return true once cancelled
   */
  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Runs the handshake on one connection until it ends.
   *
   * @param transport the connection
   * @param keys      the keypair for this connection
   * @return how the connection ended
   */
  ConnectionOutcome runConnection(final Transport transport, final SessionKeyPair keys) {
    log.debug("runConnection(fingerprint={})", keys.fingerprint());
    HeartbeatScheduler heartbeat = new HeartbeatScheduler(clock);
    RemoteAuthStateMachine machine = new RemoteAuthStateMachine(
        transport, keys, heartbeat, sink, ticketExchangeAccessor, config);
    try {
      while (!cancelled.get()) {
        HeartbeatScheduler.Tick tick = heartbeat.tick();
        if (tick == HeartbeatScheduler.Tick.MISSED_ACK) {
          return ConnectionOutcome.reconnect(
              new LivenessFailureException("No heartbeat_ack before the next heartbeat was due", null));
        }
        if (tick == HeartbeatScheduler.Tick.SEND) {
          log.trace("heartbeat");
          transport.send(new ClientOpcode.Heartbeat());
        }
        ServerOpcode opcode = transport.receive(heartbeat.timeUntilNextBeat().orElse(null));
        if (opcode == null) {
          continue;
        }
        Optional<ConnectionOutcome> outcome = machine.handle(opcode);
        if (outcome.isPresent()) {
          return outcome.get();
        }
      }
      return ConnectionOutcome.cancelled();
    } catch (TicketExchangeException e) {
      return ConnectionOutcome.fatal(e);
    } catch (RemoteAuthException e) {
      if (cancelled.get()) {
        return ConnectionOutcome.cancelled();
      }
      return ConnectionOutcome.reconnect(e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelled.set(true);
      return ConnectionOutcome.cancelled();
    }
  }

  private void pause() {
    if (config.reconnectDelay().isZero()) {
      return;
    }
    try {
      if (cancelSignal.await(config.reconnectDelay().toMillis(), TimeUnit.MILLISECONDS)) {
        log.debug("Reconnect delay cut short by cancel");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelled.set(true);
    }
  }
}
