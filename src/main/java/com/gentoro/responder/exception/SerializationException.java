package com.gentoro.responder.exception;

/** JSON/YAML serialization or deserialization error outside the response pipeline. */
public class SerializationException extends ResponderException {
  public SerializationException(String message, Throwable cause) {
    super(ResponderErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
