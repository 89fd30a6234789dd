package com.gentoro.responder.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.core.RequestOptions;
import com.anthropic.models.messages.ContentBlock;
import com.anthropic.models.messages.MessageCreateParams;
import java.util.List;

/**
 * {@link ModelClient} over the Anthropic Messages API. Anthropic has no JSON output switch; the
 * prompt carries that instruction. Every text block of the reply is reported as one choice.
 */
public class AnthropicModelClient extends AbstractModelClient {
  static final long MAX_TOKENS = 4096;

  private final AnthropicClient anthropicClient;

  public AnthropicModelClient(AnthropicClient anthropicClient, String modelName) {
    super(LlmProvider.ANTHROPIC, modelName);
    this.anthropicClient = anthropicClient;
  }

  @Override
  protected ModelResponse runInference(
      List<Message> messages, GenerationOptions options, InvocationContext context) {
    MessageCreateParams.Builder builder =
        MessageCreateParams.builder()
            .model(modelName())
            .maxTokens(MAX_TOKENS)
            .temperature(options.temperature());

    String system = systemInstruction(messages);
    if (system != null) {
      builder.system(system);
    }
    Message.only(messages, Role.HUMAN).forEach(message -> builder.addUserMessage(message.text()));

    RequestOptions.Builder requestOptions = RequestOptions.builder();
    context.remaining().ifPresent(requestOptions::timeout);

    com.anthropic.models.messages.Message reply =
        anthropicClient.messages().create(builder.build(), requestOptions.build());
    return new ModelResponse(
        reply.content().stream()
            .filter(ContentBlock::isText)
            .map(block -> new Choice(block.asText().text()))
            .toList());
  }
}
