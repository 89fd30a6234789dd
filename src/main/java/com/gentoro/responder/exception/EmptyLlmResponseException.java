package com.gentoro.responder.exception;

import java.util.Map;

/** The backend answered, but with nothing usable. */
public class EmptyLlmResponseException extends ResponderException {

  public enum Reason {
    NIL_RESPONSE("response is nil"),
    NO_CHOICES("no choices available"),
    EMPTY_CONTENT("content of first choice is empty");

    private final String description;

    Reason(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final Reason reason;

  public EmptyLlmResponseException(Reason reason) {
    super(
        ResponderErrorCode.EMPTY_RESPONSE,
        "emptyLLMResponse: " + reason.description(),
        Map.of("reason", reason.name()));
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
