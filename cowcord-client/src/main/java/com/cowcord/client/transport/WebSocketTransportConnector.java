package com.cowcord.client.transport;

import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.exceptions.TransportConnectException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens {@link WebSocketTransport}s to the configured gateway, sending the configured
 * {@code Origin} header the gateway requires.
 */
@Singleton
public class WebSocketTransportConnector implements TransportConnector {

  private static final Logger log = LoggerFactory.getLogger(WebSocketTransportConnector.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RemoteAuthClientConfig config;

  /**
   * Instantiates a new Web socket transport connector.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the client config
   */
  @Inject
  public WebSocketTransportConnector(final HttpClient httpClient,
                                     final ObjectMapper objectMapper,
                                     final RemoteAuthClientConfig config) {
    log.info("WebSocketTransportConnector({})", config.gatewayUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  @Override
  public Transport connect() {
    log.debug("connect(gateway={})", config.gatewayUri());
    WebSocketTransport transport = new WebSocketTransport(objectMapper, config.requestTimeout());
    CompletableFuture<WebSocket> future = httpClient.newWebSocketBuilder()
        .header("Origin", config.origin())
        .connectTimeout(config.connectTimeout())
        .buildAsync(config.gatewayUri(), transport);
    try {
      future.get(config.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
      return transport;
    } catch (ExecutionException e) {
      throw new TransportConnectException("Unable to connect to gateway: " + config.gatewayUri(), e.getCause());
    } catch (TimeoutException e) {
      abortWhenDone(future);
      throw new TransportConnectException("Timed out connecting to gateway: " + config.gatewayUri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      abortWhenDone(future);
      throw new TransportConnectException("Interrupted connecting to gateway: " + config.gatewayUri(), e);
    }
  }

  private static void abortWhenDone(final CompletableFuture<WebSocket> future) {
    future.thenAccept(WebSocket::abort);
  }
}
