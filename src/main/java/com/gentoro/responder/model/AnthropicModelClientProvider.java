package com.gentoro.responder.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.client.okhttp.AnthropicOkHttpClient;

/** Initializer for Anthropic. */
public final class AnthropicModelClientProvider implements ModelClientProvider {
  static final String DEFAULT_MODEL = "claude-3-5-sonnet-latest";

  @Override
  public LlmProvider provider() {
    return LlmProvider.ANTHROPIC;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String apiKey = ModelClientProvider.require(provider(), config.apiKey(), "apiKey");
    AnthropicOkHttpClient.Builder builder =
        AnthropicOkHttpClient.builder().apiKey(apiKey).maxRetries(0);
    config.endpoint().ifPresent(builder::baseUrl);
    AnthropicClient client = builder.build();
    return new AnthropicModelClient(client, config.model().orElse(DEFAULT_MODEL));
  }
}
