package com.gentoro.responder.exception;

import java.util.Map;

/** The configured provider is not part of the supported set. Never retried automatically. */
public class UnsupportedProviderException extends ResponderException {
  public UnsupportedProviderException(String provider) {
    super(
        ResponderErrorCode.UNSUPPORTED_PROVIDER,
        "unsupported llm provider: " + provider,
        provider == null ? Map.of() : Map.of("provider", provider));
  }
}
