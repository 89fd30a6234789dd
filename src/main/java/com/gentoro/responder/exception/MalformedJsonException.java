package com.gentoro.responder.exception;

import java.util.Map;

/** The cleaned model output is not syntactically valid JSON. */
public class MalformedJsonException extends ResponderException {
  private final String cleanedResponse;

  public MalformedJsonException(String cleanedResponse, Throwable cause) {
    super(
        ResponderErrorCode.MALFORMED_JSON,
        "invalidJSONResponse: input is not valid JSON",
        Map.of("length", cleanedResponse == null ? 0 : cleanedResponse.length()),
        cause);
    this.cleanedResponse = cleanedResponse;
  }

  public String getCleanedResponse() {
    return cleanedResponse;
  }
}
