package com.gentoro.responder.model;

import io.github.ollama4j.OllamaAPI;

/** Initializer for a local or self-hosted Ollama runtime. No API key is involved. */
public final class OllamaModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_ENDPOINT = "http://localhost:11434";
  static final long REQUEST_TIMEOUT_SECONDS = 300;

  @Override
  public LlmProvider provider() {
    return LlmProvider.OLLAMA;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String model = ModelClientProvider.require(provider(), config.model(), "model");
    OllamaAPI ollama = new OllamaAPI(config.endpoint().orElse(DEFAULT_ENDPOINT));
    ollama.setRequestTimeoutSeconds(REQUEST_TIMEOUT_SECONDS);
    return new OllamaModelClient(ollama, model);
  }
}
