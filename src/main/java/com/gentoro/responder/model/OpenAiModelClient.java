package com.gentoro.responder.model;

import com.openai.client.OpenAIClient;
import com.openai.core.RequestOptions;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import java.util.List;

/**
 * {@link ModelClient} over the Chat Completions API of the openai-java SDK. Also used for
 * OpenAI-compatible backends such as Cohere's compatibility endpoint.
 */
public class OpenAiModelClient extends AbstractModelClient {
  private final OpenAIClient openAIClient;

  public OpenAiModelClient(LlmProvider provider, OpenAIClient openAIClient, String modelName) {
    super(provider, modelName);
    this.openAIClient = openAIClient;
  }

  @Override
  protected ModelResponse runInference(
      List<Message> messages, GenerationOptions options, InvocationContext context) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder().model(modelName()).temperature(options.temperature());
    if (options.jsonMode()) {
      builder.responseFormat(ResponseFormatJsonObject.builder().build());
    }

    messages.forEach(
        message -> {
          switch (message.role()) {
            case SYSTEM -> builder.addSystemMessage(message.text());
            case HUMAN -> builder.addUserMessage(message.text());
          }
        });

    RequestOptions.Builder requestOptions = RequestOptions.builder();
    context.remaining().ifPresent(requestOptions::timeout);

    ChatCompletion chatCompletion =
        openAIClient.chat().completions().create(builder.build(), requestOptions.build());
    return new ModelResponse(
        chatCompletion.choices().stream()
            .map(choice -> new Choice(choice.message().content().orElse("")))
            .toList());
  }
}
