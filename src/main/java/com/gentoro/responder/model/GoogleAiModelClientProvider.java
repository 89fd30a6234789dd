package com.gentoro.responder.model;

import com.google.genai.Client;

/** Initializer for the Gemini Developer API (API key authentication). */
public final class GoogleAiModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_MODEL = "gemini-2.0-flash";

  @Override
  public LlmProvider provider() {
    return LlmProvider.GOOGLE_AI;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String apiKey = ModelClientProvider.require(provider(), config.apiKey(), "apiKey");
    Client client = Client.builder().apiKey(apiKey).build();
    return new GeminiModelClient(provider(), client, config.model().orElse(DEFAULT_MODEL));
  }
}
