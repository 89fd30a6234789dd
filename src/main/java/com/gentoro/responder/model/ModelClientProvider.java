package com.gentoro.responder.model;

import com.gentoro.responder.exception.ProviderInitializationException;
import java.util.Optional;

/**
 * Initializer for one {@link LlmProvider}. {@link ProviderFactory} dispatches to exactly one
 * initializer per provider.
 */
public interface ModelClientProvider {

  LlmProvider provider();

  /**
   * Creates a configured {@link ModelClient}.
   *
   * <p>Implementations validate the configuration fields they need and fail with a clear message
   * when one is missing. This method must be side-effect free beyond constructing the client: no
   * generation call is issued.
   *
   * @throws ProviderInitializationException when the configuration is incomplete or rejected
   */
  ModelClient create(ProviderConfig config);

  /** Unwraps a required configuration value or fails initialization naming the missing key. */
  static String require(LlmProvider provider, Optional<String> value, String key) {
    return value.orElseThrow(
        () -> new ProviderInitializationException(provider, "missing llm." + key));
  }
}
