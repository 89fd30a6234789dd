package com.gentoro.responder.model;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;

/** Initializer for OpenAI and OpenAI-compatible servers ({@code llm.endpoint} as base URL). */
public final class OpenAiModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_MODEL = "gpt-4o-mini";

  @Override
  public LlmProvider provider() {
    return LlmProvider.OPENAI;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String apiKey = ModelClientProvider.require(provider(), config.apiKey(), "apiKey");
    OpenAIOkHttpClient.Builder builder =
        OpenAIOkHttpClient.builder().apiKey(apiKey).maxRetries(0);
    config.endpoint().ifPresent(builder::baseUrl);
    OpenAIClient client = builder.build();
    return new OpenAiModelClient(provider(), client, config.model().orElse(DEFAULT_MODEL));
  }
}
