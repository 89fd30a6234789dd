package com.gentoro.responder.model;

import io.github.ollama4j.OllamaAPI;
import io.github.ollama4j.models.chat.OllamaChatMessage;
import io.github.ollama4j.models.chat.OllamaChatMessageRole;
import io.github.ollama4j.models.chat.OllamaChatRequestBuilder;
import io.github.ollama4j.models.chat.OllamaChatResult;
import io.github.ollama4j.models.generate.OllamaStreamHandler;
import io.github.ollama4j.utils.Options;
import io.github.ollama4j.utils.OptionsBuilder;
import java.util.List;

/**
 * {@link ModelClient} for a self-hosted Ollama runtime, using ollama4j's chat API. JSON mode maps
 * to Ollama's {@code format: "json"}.
 */
public class OllamaModelClient extends AbstractModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(OllamaModelClient.class);
  private final OllamaAPI ollama;

  public OllamaModelClient(OllamaAPI ollama, String modelName) {
    super(LlmProvider.OLLAMA, modelName);
    this.ollama = ollama;
  }

  @Override
  protected ModelResponse runInference(
      List<Message> messages, GenerationOptions options, InvocationContext context)
      throws Exception {
    Options ollamaOptions =
        new OptionsBuilder().setTemperature((float) options.temperature()).build();

    OllamaChatRequestBuilder builder =
        OllamaChatRequestBuilder.getInstance(modelName()).withOptions(ollamaOptions);
    if (options.jsonMode()) {
      builder.withGetJsonResponse();
    }
    messages.forEach(
        m ->
            builder.withMessage(
                m.role() == Role.SYSTEM ? OllamaChatMessageRole.SYSTEM : OllamaChatMessageRole.USER,
                m.text()));

    OllamaStreamHandler thinkingHandler = token -> log.trace("Thinking: {}", token);
    OllamaStreamHandler responseHandler = token -> log.trace("Generating: {}", token);

    // java.net.http aborts the exchange when the calling thread is interrupted.
    OllamaChatResult chatResult = ollama.chat(builder.build(), thinkingHandler, responseHandler);
    if (chatResult == null || chatResult.getResponseModel() == null) {
      return null;
    }
    OllamaChatMessage message = chatResult.getResponseModel().getMessage();
    if (message == null) {
      return new ModelResponse(List.of());
    }
    return new ModelResponse(List.of(new Choice(message.getContent())));
  }
}
