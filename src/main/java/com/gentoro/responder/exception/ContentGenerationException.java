package com.gentoro.responder.exception;

/** Transport or backend failure while invoking the model. The caller may retry with backoff. */
public class ContentGenerationException extends ResponderException {
  public ContentGenerationException(String message, Throwable cause) {
    super(ResponderErrorCode.CONTENT_GENERATION, "contentGenerationError: " + message, cause);
  }
}
