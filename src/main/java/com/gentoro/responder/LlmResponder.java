package com.gentoro.responder;

import com.gentoro.responder.exception.InvalidJsonResponseException;
import com.gentoro.responder.exception.MalformedJsonException;
import com.gentoro.responder.exception.ResponderException;
import com.gentoro.responder.http.CapturedHttpRequest;
import com.gentoro.responder.logging.LoggingService;
import com.gentoro.responder.model.InvocationContext;
import com.gentoro.responder.model.ModelClient;
import com.gentoro.responder.model.ModelClient.Message;
import com.gentoro.responder.model.ProviderConfig;
import com.gentoro.responder.model.ProviderFactory;
import com.gentoro.responder.prompt.PromptBuilder;
import com.gentoro.responder.prompt.PromptTemplates;
import com.gentoro.responder.response.GeneratedResponse;
import com.gentoro.responder.response.ResponseProcessor;
import com.gentoro.responder.utility.JacksonUtility;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Entry point for the embedding system: one instance per process, shared by every request
 * handler thread.
 *
 * <p>Example configuration:
 *
 * <pre>
 *   llm:
 *     provider: openai
 *     model: gpt-4o-mini
 *     temperature: 1
 *     apiKey: ${env:LLM_API_KEY}
 *     timeoutSeconds: 60
 *   prompts:
 *     system: "You are a web server..."
 *     user: "No talk; just do. Respond to the following HTTP request: %s"
 * </pre>
 */
public class LlmResponder implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LlmResponder.class);

  private final ProviderConfig providerConfig;
  private final PromptTemplates templates;
  private final ModelClient client;
  private final PromptBuilder promptBuilder;
  private final ResponseProcessor processor;
  private final Duration timeout;

  public LlmResponder(
      ProviderConfig providerConfig,
      PromptTemplates templates,
      ModelClient client,
      PromptBuilder promptBuilder,
      ResponseProcessor processor,
      Duration timeout) {
    this.providerConfig = Objects.requireNonNull(providerConfig, "providerConfig");
    this.templates = Objects.requireNonNull(templates, "templates");
    this.client = Objects.requireNonNull(client, "client");
    this.promptBuilder = Objects.requireNonNull(promptBuilder, "promptBuilder");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.timeout = timeout;
  }

  /** Loads the YAML configuration at {@code location} (see {@link ConfigurationProvider}). */
  public static LlmResponder create(String location) {
    return create(new ConfigurationProvider(location).config());
  }

  public static LlmResponder create(Configuration configuration) {
    return create(configuration, new ProviderFactory());
  }

  /**
   * Builds a responder from configuration, initializing the model client with {@code factory}.
   * Logging levels under {@code logging.level} are applied first.
   */
  public static LlmResponder create(Configuration configuration, ProviderFactory factory) {
    LoggingService.applyConfiguration(configuration);
    Configuration llm = configuration.subset("llm");
    ProviderConfig providerConfig = ProviderConfig.fromConfiguration(llm);
    PromptTemplates templates = PromptTemplates.fromConfiguration(configuration);
    long timeoutSeconds = llm.getLong("timeoutSeconds", 0L);

    ModelClient client = factory.initialize(providerConfig);
    return new LlmResponder(
        providerConfig,
        templates,
        client,
        new PromptBuilder(),
        new ResponseProcessor(),
        timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null);
  }

  /** Generates a response bounded by the configured timeout, if any. */
  public GeneratedResponse respond(CapturedHttpRequest request) {
    return respond(
        request,
        timeout == null ? InvocationContext.none() : InvocationContext.withTimeout(timeout));
  }

  public GeneratedResponse respond(CapturedHttpRequest request, InvocationContext context) {
    long start = System.currentTimeMillis();
    try {
      List<Message> messages = promptBuilder.build(request, templates, providerConfig.provider());
      GeneratedResponse response =
          processor.generate(client, providerConfig.temperature(), messages, context);
      log.debug(
          "Generated response for {} in {} ms", request, System.currentTimeMillis() - start);
      if (log.isTraceEnabled()) {
        log.trace("Generated response: {}", JacksonUtility.toJson(response));
      }
      return response;
    } catch (ResponderException e) {
      log.warn(
          "Could not generate response for {} ({}): {}", request, e.getCode(), e.getMessage());
      if (e instanceof InvalidJsonResponseException invalid) {
        log.trace("Rejected model output: {}", invalid.getCleanedResponse());
      } else if (e instanceof MalformedJsonException malformed) {
        log.trace("Rejected model output: {}", malformed.getCleanedResponse());
      }
      throw e;
    }
  }

  public ProviderConfig providerConfig() {
    return providerConfig;
  }

  public ModelClient client() {
    return client;
  }

  @Override
  public void close() {
    processor.close();
  }
}
