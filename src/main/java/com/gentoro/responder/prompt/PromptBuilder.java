package com.gentoro.responder.prompt;

import com.gentoro.responder.exception.RequestSerializationException;
import com.gentoro.responder.http.CapturedHttpRequest;
import com.gentoro.responder.http.HttpRequestSerializer;
import com.gentoro.responder.model.LlmProvider;
import com.gentoro.responder.model.ModelClient.Message;
import java.util.List;
import java.util.Objects;

/**
 * Turns a captured HTTP request into the messages sent to a model.
 *
 * <p>The request is rendered in wire form and substituted into the user template. Providers that
 * honor a system role get {@code [SYSTEM, HUMAN]}; the others get a single HUMAN message holding
 * the system prompt, a newline and the user prompt.
 */
public final class PromptBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.responder.logging.LoggingService.getLogger(PromptBuilder.class);

  private final ProviderCapabilities capabilities;

  public PromptBuilder() {
    this(ProviderCapabilities.defaults());
  }

  public PromptBuilder(ProviderCapabilities capabilities) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  public List<Message> build(
      CapturedHttpRequest request, PromptTemplates templates, LlmProvider provider) {
    return build(request, templates.systemPrompt(), templates.userPrompt(), provider);
  }

  /**
   * @throws RequestSerializationException when the request cannot be rendered in wire form
   */
  public List<Message> build(
      CapturedHttpRequest request,
      String systemPromptTemplate,
      String userPromptTemplate,
      LlmProvider provider) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(provider, "provider");

    String httpRequest = HttpRequestSerializer.toWireFormat(request).strip();
    String userPrompt = substitute(userPromptTemplate, httpRequest);
    String systemPrompt = systemPromptTemplate;

    if (capabilities.supportsSystemPrompt(provider)) {
      return List.of(Message.system(systemPrompt), Message.human(userPrompt));
    }
    return List.of(Message.human(systemPrompt + "\n" + userPrompt));
  }

  /**
   * Replaces the first {@code %s} with {@code value} and {@code %%} with {@code %}. Any later
   * {@code %s} is kept verbatim on purpose; no missing-argument marker is rendered for it.
   */
  static String substitute(String template, String value) {
    StringBuilder sb = new StringBuilder(template.length() + value.length());
    boolean substituted = false;
    for (int i = 0; i < template.length(); i++) {
      char c = template.charAt(i);
      if (c == '%' && i + 1 < template.length()) {
        char next = template.charAt(i + 1);
        if (next == '%') {
          sb.append('%');
          i++;
          continue;
        }
        if (next == 's' && !substituted) {
          sb.append(value);
          substituted = true;
          i++;
          continue;
        }
      }
      sb.append(c);
    }
    if (!substituted) {
      log.warn("User prompt template has no %s placeholder; the HTTP request is not included");
    }
    return sb.toString();
  }
}
