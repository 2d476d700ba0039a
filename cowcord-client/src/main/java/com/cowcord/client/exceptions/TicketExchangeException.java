package com.cowcord.client.exceptions;

import com.cowcord.model.api.ApiError;
import java.util.Optional;

/**
 * The final ticket exchange failed.  Tickets are single-use, so this ends the login flow.
 */
public class TicketExchangeException extends RemoteAuthException {

  private final ApiError apiError;
  private final int statusCode;

  /**
   * Instantiates a new Ticket exchange exception without a server response.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TicketExchangeException(final String message, final Throwable cause) {
    this(message, cause, null, -1);
  }

  /**
   * Instantiates a new Ticket exchange exception for a server response.
   *
   * @param message    the message
   * @param cause      the cause
   * @param apiError   the error object the server returned, or {@code null}
   * @param statusCode the HTTP status, or -1
   */
  public TicketExchangeException(final String message, final Throwable cause,
                                 final ApiError apiError, final int statusCode) {
    super(message, cause);
    this.apiError = apiError;
    this.statusCode = statusCode;
  }

  /**
   * The error object returned by the API, when there was one.
   *
   * @return the api error
   */
  public Optional<ApiError> apiError() {
    return Optional.ofNullable(apiError);
  }

  /**
   * HTTP status of the failed call, or -1 if no response was received.
   *
   * @return the status code
   */
  public int statusCode() {
    return statusCode;
  }
}
