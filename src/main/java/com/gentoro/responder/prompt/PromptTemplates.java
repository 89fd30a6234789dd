package com.gentoro.responder.prompt;

import com.gentoro.responder.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * System and user prompt templates. The user template carries one {@code %s} placeholder that
 * receives the serialized HTTP request; {@code %%} stands for a literal percent sign.
 */
public record PromptTemplates(String systemPrompt, String userPrompt) {
  public PromptTemplates {
    if (systemPrompt == null) {
      throw new ConfigException("Missing system prompt template");
    }
    if (userPrompt == null || userPrompt.isBlank()) {
      throw new ConfigException("Missing user prompt template");
    }
  }

  /** Reads {@code prompts.system} and {@code prompts.user}. */
  public static PromptTemplates fromConfiguration(Configuration configuration) {
    return new PromptTemplates(
        configuration.getString("prompts.system", null),
        configuration.getString("prompts.user", null));
  }
}
