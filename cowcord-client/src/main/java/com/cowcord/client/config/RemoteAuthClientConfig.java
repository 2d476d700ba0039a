package com.cowcord.client.config;

import com.cowcord.model.api.ApiVersion;
import com.cowcord.model.auth.RemoteAuthTicketExchangeRequest;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Client-side configuration for the remote auth login flow.
 * <p>
 * Use {@link #defaults()} for the production gateway and API.  For tests use
 * {@link #forTesting(URI, URI)}, which points at local endpoints and disables the pause between
 * reconnects.  The {@code with*} methods return modified copies.
 *
 * @param gatewayUri            WebSocket URI of the remote auth gateway
 * @param apiBaseUri            versioned REST API base, e.g. {@code https://discord.com/api/v9}
 * @param origin                value of the {@code Origin} header sent to the gateway and the API
 * @param qrCodeUrlTemplate     URL shown as QR code; {@code {fingerprint}} is replaced by the verified fingerprint
 * @param rsaKeySize            RSA modulus size in bits for the per-connection keypair
 * @param connectTimeout        maximum time to open the WebSocket
 * @param requestTimeout        maximum time for a single send or HTTP request
 * @param maxConnectAttempts    consecutive failed connects before giving up; 0 retries forever
 * @param reconnectDelay        pause between connection attempts
 * @param restartOnRemoteCancel whether a cancel from the companion device starts a fresh attempt
 */
public record RemoteAuthClientConfig(URI gatewayUri,
                                     URI apiBaseUri,
                                     String origin,
                                     String qrCodeUrlTemplate,
                                     int rsaKeySize,
                                     Duration connectTimeout,
                                     Duration requestTimeout,
                                     int maxConnectAttempts,
                                     Duration reconnectDelay,
                                     boolean restartOnRemoteCancel) {

  /**
   * Placeholder replaced by the fingerprint in {@link #qrCodeUrlTemplate()}.
   */
  public static final String FINGERPRINT_PLACEHOLDER = "{fingerprint}";

  public static final URI DEFAULT_GATEWAY_URI = URI.create("wss://remote-auth-gateway.discord.gg/?v=2");
  public static final String DEFAULT_ORIGIN = "https://discord.com";
  public static final URI DEFAULT_API_BASE_URI =
      URI.create(DEFAULT_ORIGIN + "/api/" + ApiVersion.V9.pathSegment());
  public static final String DEFAULT_QR_CODE_URL_TEMPLATE = DEFAULT_ORIGIN + "/ra/" + FINGERPRINT_PLACEHOLDER;
  public static final int DEFAULT_RSA_KEY_SIZE = 2048;

  /**
   * Validates the configuration.
   */
  public RemoteAuthClientConfig {
    Objects.requireNonNull(gatewayUri, "gatewayUri");
    Objects.requireNonNull(apiBaseUri, "apiBaseUri");
    Objects.requireNonNull(origin, "origin");
    Objects.requireNonNull(qrCodeUrlTemplate, "qrCodeUrlTemplate");
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(reconnectDelay, "reconnectDelay");
    if (!qrCodeUrlTemplate.contains(FINGERPRINT_PLACEHOLDER)) {
      throw new IllegalArgumentException("qrCodeUrlTemplate must contain " + FINGERPRINT_PLACEHOLDER);
    }
    if (rsaKeySize < 1024) {
      throw new IllegalArgumentException("rsaKeySize must be at least 1024 bits: " + rsaKeySize);
    }
    if (maxConnectAttempts < 0) {
      throw new IllegalArgumentException("maxConnectAttempts must not be negative: " + maxConnectAttempts);
    }
    if (connectTimeout.isNegative() || connectTimeout.isZero()
        || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("Timeouts must be positive");
    }
    if (reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must not be negative");
    }
  }

  /**
   * Production configuration.
   *
   * @return the remote auth client config
   */
  public static RemoteAuthClientConfig defaults() {
    return new RemoteAuthClientConfig(DEFAULT_GATEWAY_URI, DEFAULT_API_BASE_URI, DEFAULT_ORIGIN,
        DEFAULT_QR_CODE_URL_TEMPLATE, DEFAULT_RSA_KEY_SIZE, Duration.ofSeconds(10), Duration.ofSeconds(30),
        5, Duration.ofSeconds(1), false);
  }

  /**
   * Test configuration against local endpoints with no pause between reconnects.
   *
   * @param gatewayUri the gateway uri
   * @param apiBaseUri the api base uri
   * @return the remote auth client config
   */
  public static RemoteAuthClientConfig forTesting(URI gatewayUri, URI apiBaseUri) {
    return new RemoteAuthClientConfig(gatewayUri, apiBaseUri, DEFAULT_ORIGIN,
        DEFAULT_QR_CODE_URL_TEMPLATE, DEFAULT_RSA_KEY_SIZE, Duration.ofSeconds(5), Duration.ofSeconds(5),
        3, Duration.ZERO, false);
  }

  public RemoteAuthClientConfig withGatewayUri(URI value) {
    return new RemoteAuthClientConfig(value, apiBaseUri, origin, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, maxConnectAttempts, reconnectDelay, restartOnRemoteCancel);
  }

  public RemoteAuthClientConfig withApiBaseUri(URI value) {
    return new RemoteAuthClientConfig(gatewayUri, value, origin, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, maxConnectAttempts, reconnectDelay, restartOnRemoteCancel);
  }

  public RemoteAuthClientConfig withOrigin(String value) {
    return new RemoteAuthClientConfig(gatewayUri, apiBaseUri, value, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, maxConnectAttempts, reconnectDelay, restartOnRemoteCancel);
  }

  public RemoteAuthClientConfig withMaxConnectAttempts(int value) {
    return new RemoteAuthClientConfig(gatewayUri, apiBaseUri, origin, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, value, reconnectDelay, restartOnRemoteCancel);
  }

  public RemoteAuthClientConfig withReconnectDelay(Duration value) {
    return new RemoteAuthClientConfig(gatewayUri, apiBaseUri, origin, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, maxConnectAttempts, value, restartOnRemoteCancel);
  }

  public RemoteAuthClientConfig withRestartOnRemoteCancel(boolean value) {
    return new RemoteAuthClientConfig(gatewayUri, apiBaseUri, origin, qrCodeUrlTemplate, rsaKeySize,
        connectTimeout, requestTimeout, maxConnectAttempts, reconnectDelay, value);
  }

  /**
   * The scannable URL for a verified fingerprint.
   *
   * @param fingerprint the fingerprint as sent by the gateway
   * @return the QR code URL
   */
  public String qrCodeUrl(String fingerprint) {
    return qrCodeUrlTemplate.replace(FINGERPRINT_PLACEHOLDER, fingerprint);
  }

  /**
   * Absolute URI of the ticket exchange endpoint.
   *
   * @return the ticket exchange uri
   */
  public URI ticketExchangeUri() {
    String base = apiBaseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + RemoteAuthTicketExchangeRequest.PATH);
  }
}
