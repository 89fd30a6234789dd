package com.gentoro.responder.model;

import com.gentoro.responder.exception.UnsupportedProviderException;
import java.util.Locale;

/** Closed set of LLM backends the responder can talk to, keyed by their configuration id. */
public enum LlmProvider {
  OPENAI("openai", "OpenAI"),
  GOOGLE_AI("googleai", "GoogleAI"),
  GCP_VERTEX("gcp-vertex", "VertexAI"),
  ANTHROPIC("anthropic", "Anthropic"),
  COHERE("cohere", "Cohere"),
  OLLAMA("ollama", "Ollama");

  private final String id;
  private final String displayName;

  LlmProvider(String id, String displayName) {
    this.id = id;
    this.displayName = displayName;
  }

  /** Stable, lowercase identifier used in configuration files (e.g. "gcp-vertex"). */
  public String id() {
    return id;
  }

  public String displayName() {
    return displayName;
  }

  /**
   * Resolves a configuration id, ignoring case and surrounding whitespace.
   *
   * @throws UnsupportedProviderException when the id does not name a supported provider
   */
  public static LlmProvider fromId(String id) {
    if (id != null) {
      String normalized = id.trim().toLowerCase(Locale.ROOT);
      for (LlmProvider provider : values()) {
        if (provider.id.equals(normalized)) {
          return provider;
        }
      }
    }
    throw new UnsupportedProviderException(id);
  }
}
