package com.gentoro.responder.model;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;

/**
 * Initializer for Cohere. Cohere exposes an OpenAI-compatible chat endpoint, so the client is an
 * {@link OpenAiModelClient} pointed at that base URL.
 */
public final class CohereModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_ENDPOINT = "https://api.cohere.ai/compatibility/v1";
  static final String DEFAULT_MODEL = "command-r-plus";

  @Override
  public LlmProvider provider() {
    return LlmProvider.COHERE;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String apiKey = ModelClientProvider.require(provider(), config.apiKey(), "apiKey");
    OpenAIClient client =
        OpenAIOkHttpClient.builder()
            .apiKey(apiKey)
            .baseUrl(config.endpoint().orElse(DEFAULT_ENDPOINT))
            .maxRetries(0)
            .build();
    return new OpenAiModelClient(provider(), client, config.model().orElse(DEFAULT_MODEL));
  }
}
