package com.cowcord.cli;

import com.cowcord.client.accessor.TicketExchangeAccessor;
import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.crypto.KeyMaterialManager;
import com.cowcord.client.exceptions.RemoteAuthException;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.client.exceptions.TransportConnectException;
import com.cowcord.client.manager.RemoteAuthManager;
import com.cowcord.client.manager.RemoteAuthSession;
import com.cowcord.client.model.SessionPhase;
import com.cowcord.client.state.LatestPhaseHolder;
import com.cowcord.client.transport.WebSocketTransportConnector;
import com.cowcord.model.auth.Token;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Optional;

/**
 * Command-line QR code login against the live gateway.
 *
 * <pre>
 * Usage:
 *   java -jar cowcord-cli.jar [options]
 *
 * Prints the URL to render as a QR code, then who scanned it, then the token once the login is
 * approved on the phone.  Ctrl-C cancels.
 *
 * Options:
 *   --gateway &lt;uri&gt;              Remote auth gateway      (default: wss://remote-auth-gateway.discord.gg/?v=2)
 *   --api &lt;uri&gt;                  REST API base            (default: https://discord.com/api/v9)
 *   --origin &lt;url&gt;               Origin header            (default: https://discord.com)
 *   --max-connect-attempts &lt;n&gt;    Connect failures allowed (default: 5, 0 = unlimited)
 *   --reconnect-delay-ms &lt;ms&gt;     Pause between attempts   (default: 1000)
 *   --restart-on-cancel           Start over when the phone cancels
 *   --print-token                 Print the token instead of a redacted marker
 *
 * Exit codes: 0 token obtained, 1 cancelled, 2 error.
 * </pre>
 */
public class RemoteAuthCli {

  static final int EXIT_OK = 0;
  static final int EXIT_CANCELLED = 1;
  static final int EXIT_ERROR = 2;

  /**
   * Parsed command line.
   *
   * @param config     the client config
   * @param printToken whether to print the token in clear
   */
  record Options(RemoteAuthClientConfig config, boolean printToken) {
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    Options options;
    try {
      options = parseArgs(args);
    } catch (IllegalArgumentException e) {
      System.err.println("Error: " + e.getMessage());
      printUsage();
      System.exit(EXIT_ERROR);
      return;
    }
    System.exit(run(options));
  }

  static Options parseArgs(String[] args) {
    RemoteAuthClientConfig config = RemoteAuthClientConfig.defaults();
    boolean printToken = false;
    for (int i = 0; i < args.length; i++) {
      switch (args[i]) {
        case "--gateway"              -> config = config.withGatewayUri(URI.create(value(args, ++i)));
        case "--api"                  -> config = config.withApiBaseUri(URI.create(value(args, ++i)));
        case "--origin"               -> config = config.withOrigin(value(args, ++i));
        case "--max-connect-attempts" -> config = config.withMaxConnectAttempts(number(args, ++i));
        case "--reconnect-delay-ms"   -> config = config.withReconnectDelay(Duration.ofMillis(number(args, ++i)));
        case "--restart-on-cancel"    -> config = config.withRestartOnRemoteCancel(true);
        case "--print-token"          -> printToken = true;
        default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
      }
    }
    return new Options(config, printToken);
  }

  static String describe(SessionPhase phase) {
    if (phase instanceof SessionPhase.QrCode qrCode) {
      return "Scan this QR code URL with the mobile app: " + qrCode.displayPayload();
    } else if (phase instanceof SessionPhase.Accepted accepted) {
      return "Scanned by " + accepted.displayName() + " (" + accepted.userId() + "), approve the login on the phone";
    } else if (phase instanceof SessionPhase.Cancelled) {
      return "Login cancelled";
    } else if (phase instanceof SessionPhase.Completed) {
      return "Login approved";
    }
    return "Waiting for the gateway...";
  }

  private static int run(Options options) {
    RemoteAuthClientConfig config = options.config();
    HttpClient httpClient = HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build();
    ObjectMapper objectMapper = new ObjectMapper();
    RemoteAuthManager manager = new RemoteAuthManager(config,
        new WebSocketTransportConnector(httpClient, objectMapper, config),
        new KeyMaterialManager(config),
        new TicketExchangeAccessor(httpClient, objectMapper, config));

    System.out.println("Gateway : " + config.gatewayUri());
    System.out.println("API     : " + config.apiBaseUri());
    System.out.println();

    LatestPhaseHolder phases = new LatestPhaseHolder();
    phases.addListener(phase -> System.out.println(describe(phase)));
    RemoteAuthSession session = manager.newSession(phases);
    Runtime.getRuntime().addShutdownHook(new Thread(session::cancel, "remote-auth-cancel"));

    try {
      Optional<Token> token = session.run();
      if (token.isEmpty()) {
        return EXIT_CANCELLED;
      }
      System.out.println("Token   : " + (options.printToken() ? token.get().value() : Token.redact(token.get().value())));
      return EXIT_OK;
    } catch (TransportConnectException e) {
      System.err.println("Could not reach the gateway: " + e.getMessage());
    } catch (TicketExchangeException e) {
      System.err.println("Ticket exchange failed: " + e.getMessage());
    } catch (RemoteAuthException e) {
      System.err.println("Error: " + e.getMessage());
    }
    return EXIT_ERROR;
  }

  private static String value(String[] args, int i) {
    if (i >= args.length) {
      throw new IllegalArgumentException("Missing value for " + args[i - 1]);
    }
    return args[i];
  }

  private static int number(String[] args, int i) {
    String value = value(args, i);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Not a number for " + args[i - 1] + ": " + value, e);
    }
  }

  private static void printUsage() {
    System.err.println("Usage: RemoteAuthCli [options]");
    System.err.println();
    System.err.println("Options:");
    System.err.println("  --gateway <uri>              Remote auth gateway      (default: " + RemoteAuthClientConfig.DEFAULT_GATEWAY_URI + ")");
    System.err.println("  --api <uri>                  REST API base            (default: " + RemoteAuthClientConfig.DEFAULT_API_BASE_URI + ")");
    System.err.println("  --origin <url>               Origin header            (default: " + RemoteAuthClientConfig.DEFAULT_ORIGIN + ")");
    System.err.println("  --max-connect-attempts <n>   Connect failures allowed (default: 5, 0 = unlimited)");
    System.err.println("  --reconnect-delay-ms <ms>    Pause between attempts   (default: 1000)");
    System.err.println("  --restart-on-cancel          Start over when the phone cancels");
    System.err.println("  --print-token                Print the token instead of a redacted marker");
  }
}
