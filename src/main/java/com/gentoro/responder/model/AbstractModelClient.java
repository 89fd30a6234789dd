package com.gentoro.responder.model;

import com.gentoro.responder.exception.ContentGenerationException;
import com.gentoro.responder.exception.ExceptionUtil;
import java.util.List;
import java.util.Objects;

/**
 * Base {@link ModelClient} with the common plumbing: tracing, latency logging and translation of
 * SDK failures into {@link ContentGenerationException}.
 *
 * <p>Subclasses implement {@link #runInference(List, GenerationOptions, InvocationContext)} with a
 * concrete provider SDK. They must not keep per-call state in fields.
 */
public abstract class AbstractModelClient implements ModelClient {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(AbstractModelClient.class);

  private final LlmProvider provider;
  private final String modelName;

  protected AbstractModelClient(LlmProvider provider, String modelName) {
    this.provider = Objects.requireNonNull(provider, "provider");
    this.modelName = Objects.requireNonNull(modelName, "modelName");
  }

  public LlmProvider provider() {
    return provider;
  }

  public String modelName() {
    return modelName;
  }

  @Override
  public final ModelResponse generateContent(List<Message> messages, GenerationOptions options) {
    return generateContent(messages, options, InvocationContext.none());
  }

  @Override
  public final ModelResponse generateContent(
      List<Message> messages, GenerationOptions options, InvocationContext context) {
    log.trace(
        "generateContent() called with: messages = [{}], temperature = [{}], jsonMode = [{}]",
        messages,
        options.temperature(),
        options.jsonMode());
    long start = System.currentTimeMillis();
    try {
      ModelResponse response = runInference(messages, options, context);
      log.info(
          "[Inference] - {}({}): LLM inference took {} ms, {} choice(s).",
          provider.displayName(),
          modelName,
          System.currentTimeMillis() - start,
          response == null ? 0 : response.choices().size());
      return response;
    } catch (Exception e) {
      log.debug(
          "[Inference] - {}({}) failed after {} ms: {}",
          provider.displayName(),
          modelName,
          System.currentTimeMillis() - start,
          ExceptionUtil.formatCompactStackTrace(e));
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new ContentGenerationException(String.valueOf(ex.getMessage()), ex));
    }
  }

  /**
   * Executes a single generation turn against the provider. Implementations bound the request by
   * {@code context.remaining()} when the SDK has a per-request timeout.
   */
  protected abstract ModelResponse runInference(
      List<Message> messages, GenerationOptions options, InvocationContext context)
      throws Exception;

  /** System messages joined in order, or {@code null} when there are none. */
  protected static String systemInstruction(List<Message> messages) {
    if (!Message.contains(messages, Role.SYSTEM)) {
      return null;
    }
    return String.join(
        "\n", Message.only(messages, Role.SYSTEM).stream().map(Message::text).toList());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{provider=" + provider.id() + ", model=" + modelName + '}';
  }
}
