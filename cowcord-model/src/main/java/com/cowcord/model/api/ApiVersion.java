package com.cowcord.model.api;

import java.util.Locale;

/**
 * Versions of the REST API.  The client targets {@link #V9}.
 */
public enum ApiVersion {
  V10,
  V9,
  @Deprecated
  V8,
  @Deprecated
  V7,
  @Deprecated
  V6;

  /**
   * Path segment for this version, e.g. {@code v9}.
   *
   * @return the path segment
   */
  public String pathSegment() {
    return name().toLowerCase(Locale.ROOT);
  }
}
