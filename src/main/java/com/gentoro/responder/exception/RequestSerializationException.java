package com.gentoro.responder.exception;

/** The captured HTTP request cannot be rendered in wire form. */
public class RequestSerializationException extends ResponderException {
  public RequestSerializationException(String message) {
    super(ResponderErrorCode.INVALID_ARGUMENT, message);
  }

  public RequestSerializationException(String message, Throwable cause) {
    super(ResponderErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
