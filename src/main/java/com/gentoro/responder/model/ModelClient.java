package com.gentoro.responder.model;

import java.util.List;
import java.util.Objects;

/**
 * Primary abstraction for generating content with a Large Language Model backend.
 *
 * <p>Implementations encapsulate a provider SDK and are obtained from {@link ProviderFactory}. A
 * client holds no per-call state: everything a call needs travels in its arguments, so a single
 * instance may serve many concurrent calls.
 */
public interface ModelClient {

  /**
   * Sends the ordered messages to the backend and returns its candidate completions untouched.
   *
   * @return the backend response; may be {@code null} or carry no choices when the backend
   *     produced nothing
   * @throws com.gentoro.responder.exception.ContentGenerationException on transport or backend
   *     failures
   */
  ModelResponse generateContent(List<Message> messages, GenerationOptions options);

  /**
   * Same as {@link #generateContent(List, GenerationOptions)}, bounded by {@code context}.
   * Provider clients pass the remaining time to their SDK as the per-request timeout so the
   * network exchange is torn down at the deadline; the default ignores the context.
   */
  default ModelResponse generateContent(
      List<Message> messages, GenerationOptions options, InvocationContext context) {
    return generateContent(messages, options);
  }

  enum Role {
    SYSTEM,
    HUMAN
  }

  record Message(Role role, String text) {
    public Message {
      Objects.requireNonNull(role, "role");
      Objects.requireNonNull(text, "text");
    }

    public static Message system(String text) {
      return new Message(Role.SYSTEM, text);
    }

    public static Message human(String text) {
      return new Message(Role.HUMAN, text);
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role() == role);
    }

    static List<Message> only(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role() == role).toList();
    }
  }

  /**
   * Per-call generation settings.
   *
   * @param jsonMode ask the backend for a JSON document when it has a switch for that
   */
  record GenerationOptions(double temperature, boolean jsonMode) {
    public static GenerationOptions json(double temperature) {
      return new GenerationOptions(temperature, true);
    }
  }

  /** Candidate completions ("choices") returned for a single invocation, in backend order. */
  record ModelResponse(List<Choice> choices) {
    public ModelResponse {
      choices = choices == null ? List.of() : List.copyOf(choices);
    }
  }

  record Choice(String content) {
    public Choice {
      content = content == null ? "" : content;
    }
  }
}
