package com.gentoro.responder.exception;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends ResponderException {
  public ConfigException(String message) {
    super(ResponderErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ResponderErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
