package com.cowcord.client.accessor;

import com.cowcord.client.config.RemoteAuthClientConfig;
import com.cowcord.client.exceptions.TicketExchangeException;
import com.cowcord.model.api.ApiError;
import com.cowcord.model.auth.RemoteAuthTicketExchangeRequest;
import com.cowcord.model.auth.RemoteAuthTicketExchangeResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the remote auth ticket exchange endpoint.
 * <p>
 * Posts the ticket received over the gateway and returns the encrypted token.  A 4xx/5xx
 * response is surfaced as a {@link TicketExchangeException} carrying the decoded {@link ApiError}
 * when the body holds one.  I/O errors and interruptions are wrapped the same way.
 */
@Singleton
public class TicketExchangeAccessor {

  private static final Logger log = LoggerFactory.getLogger(TicketExchangeAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RemoteAuthClientConfig config;

  /**
   * Instantiates a new Ticket exchange accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the client config
   */
  @Inject
  public TicketExchangeAccessor(final HttpClient httpClient,
                                final ObjectMapper objectMapper,
                                final RemoteAuthClientConfig config) {
    log.info("TicketExchangeAccessor({})", config.apiBaseUri());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * Exchanges a login ticket for the encrypted token.  Tickets are single-use, so this is never
   * retried.
   *
   * @param ticket the ticket from {@code pending_login}
   * @return the response, with a non-null encrypted token
   * @throws TicketExchangeException if the request fails or the server rejects the ticket
   */
  public RemoteAuthTicketExchangeResponse exchange(final String ticket) {
    URI uri = config.ticketExchangeUri();
    log.debug("exchange(uri={})", uri);
    try {
      String requestBody = objectMapper.writeValueAsString(new RemoteAuthTicketExchangeRequest(ticket));
      HttpRequest request = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(config.requestTimeout())
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .header("Origin", config.origin())
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(uri, response);
      RemoteAuthTicketExchangeResponse result =
          objectMapper.readValue(response.body(), RemoteAuthTicketExchangeResponse.class);
      if (result == null || result.encryptedToken() == null || result.encryptedToken().isBlank()) {
        throw new TicketExchangeException("Ticket exchange response had no encrypted_token", null,
            null, response.statusCode());
      }
      return result;
    } catch (IOException e) {
      throw new TicketExchangeException("Ticket exchange request failed: " + uri, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TicketExchangeException("Ticket exchange request interrupted: " + uri, e);
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private void checkStatus(final URI uri, final HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    ApiError apiError = parseError(response.body());
    String detail = apiError == null
        ? ""
        : ": " + apiError.code() + " " + apiError.message() + " " + apiError.fieldErrors();
    throw new TicketExchangeException("Server returned HTTP " + statusCode + " for " + uri + detail,
        null, apiError, statusCode);
  }

  private ApiError parseError(final String body) {
    if (body == null || body.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(body, ApiError.class);
    } catch (JsonProcessingException e) {
      log.debug("Error body is not an API error object: {}", e.getOriginalMessage());
      return null;
    }
  }
}
