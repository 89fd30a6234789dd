package com.gentoro.responder.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Synthetic HTTP response produced by the model: headers plus body.
 *
 * <p>Constraints are declared on the fields and checked by {@link ResponseValidator}: {@code
 * headers} must be a non-empty object of string values, {@code body} must be present but may be
 * empty.
 */
public final class GeneratedResponse {

  @NotEmpty
  @JsonProperty("headers")
  private final Map<String, @NotNull String> headers;

  @NotNull
  @JsonProperty("body")
  private final String body;

  @JsonCreator
  public GeneratedResponse(
      @JsonProperty("headers") Map<String, String> headers, @JsonProperty("body") String body) {
    this.headers =
        headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.body = body;
  }

  /** Response headers in the order the model listed them. */
  public Map<String, String> headers() {
    return headers;
  }

  public String body() {
    return body;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof GeneratedResponse that)) return false;
    return Objects.equals(headers, that.headers) && Objects.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(headers, body);
  }

  @Override
  public String toString() {
    return "GeneratedResponse{headers=" + headers + ", body=" + body + '}';
  }
}
