package com.gentoro.responder.exception;

import java.util.List;
import java.util.Map;

/**
 * The cleaned model output is valid JSON but does not describe a response: a required field is
 * missing, empty or of the wrong type. The cleaned text stays available for logging.
 */
public class InvalidJsonResponseException extends ResponderException {
  private final String cleanedResponse;
  private final List<String> violations;

  public InvalidJsonResponseException(String cleanedResponse, List<String> violations) {
    super(
        ResponderErrorCode.INVALID_JSON_RESPONSE,
        "invalidJSONResponse: validation error: " + String.join("; ", violations),
        Map.of("violations", List.copyOf(violations)));
    this.cleanedResponse = cleanedResponse;
    this.violations = List.copyOf(violations);
  }

  public InvalidJsonResponseException(String cleanedResponse, Throwable cause) {
    super(
        ResponderErrorCode.INVALID_JSON_RESPONSE,
        "invalidJSONResponse: error unmarshalling JSON: " + cause.getMessage(),
        Map.of(),
        cause);
    this.cleanedResponse = cleanedResponse;
    this.violations = List.of();
  }

  public String getCleanedResponse() {
    return cleanedResponse;
  }

  public List<String> getViolations() {
    return violations;
  }
}
