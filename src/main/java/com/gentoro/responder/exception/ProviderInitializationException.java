package com.gentoro.responder.exception;

import com.gentoro.responder.model.LlmProvider;
import java.util.Map;

/** Provider configuration was incomplete or rejected while building the client. */
public class ProviderInitializationException extends ResponderException {
  public ProviderInitializationException(LlmProvider provider, String message) {
    super(
        ResponderErrorCode.PROVIDER_INITIALIZATION,
        "failed to initialize %s client: %s".formatted(provider.id(), message),
        Map.of("provider", provider.id()));
  }

  public ProviderInitializationException(LlmProvider provider, String message, Throwable cause) {
    super(
        ResponderErrorCode.PROVIDER_INITIALIZATION,
        "failed to initialize %s client: %s".formatted(provider.id(), message),
        Map.of("provider", provider.id()),
        cause);
  }
}
