package com.gentoro.responder.exception;

/** The caller cancelled the invocation, or its deadline passed, before the backend answered. */
public class GenerationCancelledException extends ResponderException {
  public GenerationCancelledException(boolean deadlineExceeded) {
    super(
        deadlineExceeded ? ResponderErrorCode.DEADLINE_EXCEEDED : ResponderErrorCode.CANCELLED,
        deadlineExceeded
            ? "contentGenerationError: deadline exceeded"
            : "contentGenerationError: invocation cancelled");
  }

  public boolean isDeadlineExceeded() {
    return getCode() == ResponderErrorCode.DEADLINE_EXCEEDED;
  }
}
