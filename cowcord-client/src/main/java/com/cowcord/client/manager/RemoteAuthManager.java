package com.cowcord.client.manager;

import com.cowcord.client.accessor.TicketExchangeAccessor;
import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.crypto.KeyMaterialManager;
import com.cowcord.client.state.PhaseSink;
import com.cowcord.client.transport.TransportConnector;
import com.cowcord.model.auth.Token;
import java.time.Clock;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the QR code login flow.
 * <p>
 * The client shows a QR code that an already signed-in mobile app scans.  After the user approves
 * on the phone, the gateway hands over a single-use ticket which is exchanged for the session
 * token.  Each flow is a {@link RemoteAuthSession}; callers that need to cancel from another
 * thread use {@link #newSession(PhaseSink)}, the rest can call {@link #login(PhaseSink)}.
 */
@Singleton
public class RemoteAuthManager {

  private static final Logger log = LoggerFactory.getLogger(RemoteAuthManager.class);

  private final RemoteAuthClientConfig config;
  private final TransportConnector connector;
  private final KeyMaterialManager keyMaterialManager;
  private final TicketExchangeAccessor ticketExchangeAccessor;
  private final Clock clock;

  @Inject
  public RemoteAuthManager(final RemoteAuthClientConfig config,
                           final TransportConnector connector,
                           final KeyMaterialManager keyMaterialManager,
                           final TicketExchangeAccessor ticketExchangeAccessor) {
    this(config, connector, keyMaterialManager, ticketExchangeAccessor, Clock.systemUTC());
  }

  /**
   * Instantiates a new Remote auth manager with an explicit clock for the heartbeat.
   *
   * @param config                 the client config
   * @param connector              opens gateway connections
   * @param keyMaterialManager     generates keypairs
   * @param ticketExchangeAccessor exchanges login tickets
   * @param clock                  the clock
   */
  public RemoteAuthManager(final RemoteAuthClientConfig config,
                           final TransportConnector connector,
                           final KeyMaterialManager keyMaterialManager,
                           final TicketExchangeAccessor ticketExchangeAccessor,
                           final Clock clock) {
    log.info("RemoteAuthManager()");
    this.config = config;
    this.connector = connector;
    this.keyMaterialManager = keyMaterialManager;
    this.ticketExchangeAccessor = ticketExchangeAccessor;
    this.clock = clock;
  }

  /**
   * Creates a session that has not started yet.
   *
   * @param sink receives the phases of the flow
   * @return the session
   */
  public RemoteAuthSession newSession(final PhaseSink sink) {
    log.debug("newSession()");
    return new RemoteAuthSession(config, connector, keyMaterialManager, ticketExchangeAccessor, sink, clock);
  }

  /**
   * Runs a login flow on the calling thread.
   *
   * @param sink receives the phases of the flow
   * @return the token, or empty if the login was cancelled
   */
  public Optional<Token> login(final PhaseSink sink) {
    return newSession(sink).run();
  }
}
