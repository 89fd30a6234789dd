package com.gentoro.responder.model;

import com.gentoro.responder.exception.ProviderInitializationException;
import com.gentoro.responder.exception.ResponderException;
import com.gentoro.responder.exception.UnsupportedProviderException;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a {@link ProviderConfig} into an initialized {@link ModelClient}.
 *
 * <p>Dispatch is a fixed mapping from {@link LlmProvider} to its {@link ModelClientProvider}. A
 * provider without an initializer is rejected with {@link UnsupportedProviderException}; there is
 * no fallback to another backend.
 */
public final class ProviderFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(ProviderFactory.class);

  private final Map<LlmProvider, ModelClientProvider> initializers;

  /** Factory covering every {@link LlmProvider}. */
  public ProviderFactory() {
    this(
        List.of(
            new OpenAiModelClientProvider(),
            new GoogleAiModelClientProvider(),
            new VertexAiModelClientProvider(),
            new AnthropicModelClientProvider(),
            new CohereModelClientProvider(),
            new OllamaModelClientProvider()));
  }

  public ProviderFactory(Collection<? extends ModelClientProvider> providers) {
    Map<LlmProvider, ModelClientProvider> map = new EnumMap<>(LlmProvider.class);
    for (ModelClientProvider p : providers) {
      if (map.put(p.provider(), p) != null) {
        throw new IllegalArgumentException("Duplicate initializer for provider " + p.provider());
      }
    }
    this.initializers = Collections.unmodifiableMap(map);
  }

  /**
   * Creates a client for the configured provider.
   *
   * @throws UnsupportedProviderException when the provider is unset or has no initializer
   * @throws ProviderInitializationException when the provider rejects the configuration
   */
  public ModelClient initialize(ProviderConfig config) {
    Objects.requireNonNull(config, "config");
    LlmProvider provider = config.provider();
    if (provider == null) {
      throw new UnsupportedProviderException(null);
    }
    ModelClientProvider initializer = initializers.get(provider);
    if (initializer == null) {
      throw new UnsupportedProviderException(provider.id());
    }

    log.debug("Initializing LLM client with {}", config);
    try {
      ModelClient client = initializer.create(config);
      log.info("Initialized {} client: {}", provider.displayName(), client);
      return client;
    } catch (ResponderException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new ProviderInitializationException(provider, String.valueOf(e.getMessage()), e);
    }
  }
}
