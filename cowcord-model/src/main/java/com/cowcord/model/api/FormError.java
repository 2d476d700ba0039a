package com.cowcord.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single validation failure attached to a request field.
 *
 * @param code    machine-readable error code, e.g. {@code BASE_TYPE_REQUIRED}
 * @param message human-readable description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FormError(@JsonProperty("code") String code,
                        @JsonProperty("message") String message) {
}
