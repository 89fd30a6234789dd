package com.gentoro.responder.prompt;

import com.gentoro.responder.model.LlmProvider;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Read-only table of what each provider honors when a prompt is assembled.
 *
 * <p>{@code supportsSystemPrompt}: whether the provider receives the system prompt as a message of
 * its own. Providers missing from the table are treated as not supporting it.
 */
public final class ProviderCapabilities {
  private static final ProviderCapabilities DEFAULTS;

  static {
    Map<LlmProvider, Boolean> supportsSystemPrompt = new EnumMap<>(LlmProvider.class);
    supportsSystemPrompt.put(LlmProvider.OPENAI, true);
    supportsSystemPrompt.put(LlmProvider.ANTHROPIC, true);
    supportsSystemPrompt.put(LlmProvider.OLLAMA, true);
    supportsSystemPrompt.put(LlmProvider.COHERE, true);
    supportsSystemPrompt.put(LlmProvider.GOOGLE_AI, false);
    supportsSystemPrompt.put(LlmProvider.GCP_VERTEX, false);
    DEFAULTS = new ProviderCapabilities(supportsSystemPrompt);
  }

  private final Map<LlmProvider, Boolean> supportsSystemPrompt;

  private ProviderCapabilities(Map<LlmProvider, Boolean> supportsSystemPrompt) {
    Map<LlmProvider, Boolean> copy = new EnumMap<>(LlmProvider.class);
    copy.putAll(supportsSystemPrompt);
    this.supportsSystemPrompt = Collections.unmodifiableMap(copy);
  }

  public static ProviderCapabilities defaults() {
    return DEFAULTS;
  }

  /** Builds a table from explicit entries, e.g. to describe a provider added to the enum. */
  public static ProviderCapabilities of(Map<LlmProvider, Boolean> supportsSystemPrompt) {
    return new ProviderCapabilities(supportsSystemPrompt);
  }

  public boolean supportsSystemPrompt(LlmProvider provider) {
    return Boolean.TRUE.equals(supportsSystemPrompt.get(provider));
  }

  /** A copy of this table with one entry replaced. */
  public ProviderCapabilities withSystemPromptSupport(LlmProvider provider, boolean supported) {
    Map<LlmProvider, Boolean> copy = new EnumMap<>(LlmProvider.class);
    copy.putAll(supportsSystemPrompt);
    copy.put(provider, supported);
    return new ProviderCapabilities(copy);
  }

  @Override
  public String toString() {
    return "ProviderCapabilities{supportsSystemPrompt=" + supportsSystemPrompt + '}';
  }
}
