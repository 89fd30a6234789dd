package com.gentoro.responder.model;

import com.google.genai.Client;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import com.google.genai.types.Part;
import java.util.List;

/**
 * {@link ModelClient} over the Google Gen AI SDK. The same client serves the Gemini Developer API
 * and Vertex AI; only the way the {@link Client} is built differs.
 */
public class GeminiModelClient extends AbstractModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(GeminiModelClient.class);
  private final Client geminiClient;

  public GeminiModelClient(LlmProvider provider, Client geminiClient, String modelName) {
    super(provider, modelName);
    this.geminiClient = geminiClient;
  }

  @Override
  protected ModelResponse runInference(
      List<Message> messages, GenerationOptions options, InvocationContext context) {
    GenerateContentConfig.Builder configBuilder =
        GenerateContentConfig.builder()
            .temperature((float) options.temperature())
            .candidateCount(1);
    if (options.jsonMode()) {
      configBuilder.responseMimeType("application/json");
    }

    context
        .remaining()
        .ifPresent(
            left ->
                configBuilder.httpOptions(
                    HttpOptions.builder().timeout((int) Math.max(1, left.toMillis())).build()));

    String system = systemInstruction(messages);
    if (system != null) {
      configBuilder.systemInstruction(
          Content.builder().role("user").parts(Part.fromText(system)).build());
    }

    List<Content> contents =
        Message.only(messages, Role.HUMAN).stream()
            .map(m -> Content.builder().role("user").parts(Part.fromText(m.text())).build())
            .toList();

    log.trace("Running inference with model: {}", modelName());
    GenerateContentResponse response =
        geminiClient.models.generateContent(modelName(), contents, configBuilder.build());
    if (response == null) {
      return null;
    }
    List<Candidate> candidates = response.candidates().orElse(List.of());
    return new ModelResponse(
        candidates.stream()
            .map(candidate -> new Choice(candidate.content().map(Content::text).orElse("")))
            .toList());
  }
}
