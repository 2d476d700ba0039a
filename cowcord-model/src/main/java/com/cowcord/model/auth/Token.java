package com.cowcord.model.auth;

import java.util.Objects;

/**
 * An authentication token as passed in the {@code Authorization} header.
 * <p>
 * {@link #toString()} never reveals the value; use {@link #value()} where the raw token is needed.
 *
 * @param value the raw token
 */
public record Token(String value) {

  private static final String REDACTED = "REDACTED";

  /**
   * Instantiates a new Token.
   *
   * @param value the raw token, must not be blank
   */
  public Token {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Token must not be blank");
    }
  }

  /**
   * Safe representation of a sensitive value for log output.
   *
   * @param secret the raw value
   * @return {@code null} for {@code null}, the empty string for empty, otherwise {@code REDACTED}
   */
  public static String redact(String secret) {
    if (secret == null) {
      return null;
    }
    if (secret.isEmpty()) {
      return "";
    }
    return REDACTED;
  }

  @Override
  public String toString() {
    return "Token[" + REDACTED + "]";
  }
}
