package com.cowcord.model.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application-level error object returned by the REST API on failure.
 * <p>
 * The optional {@code errors} member mirrors the request body: objects nest by field name
 * (array elements by index), and leaves carry an {@code _errors} array of {@link FormError}.
 * For example
 * <pre>
 * {"code": 50035, "message": "Invalid Form Body",
 *  "errors": {"ticket": {"_errors": [{"code": "BASE_TYPE_REQUIRED", "message": "Required"}]}}}
 * </pre>
 *
 * @param code    JSON error code
 * @param message human-readable message
 * @param errors  nested form errors, or {@code null}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(@JsonProperty("code") int code,
                       @JsonProperty("message") String message,
                       @JsonProperty("errors") JsonNode errors) {

  private static final String ERRORS_KEY = "_errors";

  /**
   * Flattens the nested form errors into dotted field paths, e.g. {@code ticket} or
   * {@code recipients.0.id}.  Errors attached to the body itself use the empty path.
   *
   * @return field path to the errors reported for it, in document order
   */
  public Map<String, List<FormError>> fieldErrors() {
    if (errors == null || !errors.isObject()) {
      return Collections.emptyMap();
    }
    Map<String, List<FormError>> result = new LinkedHashMap<>();
    collect("", errors, result);
    return result;
  }

  private static void collect(String path, JsonNode node, Map<String, List<FormError>> result) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode value = field.getValue();
      if (ERRORS_KEY.equals(field.getKey())) {
        if (value.isArray()) {
          List<FormError> list = result.computeIfAbsent(path, k -> new ArrayList<>());
          for (JsonNode error : value) {
            list.add(new FormError(error.path("code").asText(null), error.path("message").asText(null)));
          }
        }
      } else if (value.isObject()) {
        collect(path.isEmpty() ? field.getKey() : path + "." + field.getKey(), value, result);
      }
    }
  }
}
