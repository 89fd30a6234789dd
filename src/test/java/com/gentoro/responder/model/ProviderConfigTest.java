package com.gentoro.responder.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.responder.exception.ConfigException;
import com.gentoro.responder.exception.UnsupportedProviderException;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderConfigTest {

  @Test
  void readsAllFieldsFromConfiguration() {
    BaseConfiguration llm = new BaseConfiguration();
    llm.addProperty("provider", "gcp-vertex");
    llm.addProperty("model", "gemini-1.5-pro");
    llm.addProperty("temperature", "0.2");
    llm.addProperty("cloudProject", "honeypot");
    llm.addProperty("cloudLocation", "europe-west1");

    ProviderConfig config = ProviderConfig.fromConfiguration(llm);

    assertEquals(LlmProvider.GCP_VERTEX, config.provider());
    assertEquals("gemini-1.5-pro", config.model().orElseThrow());
    assertEquals(0.2, config.temperature(), 1e-9);
    assertEquals("honeypot", config.cloudProject().orElseThrow());
    assertEquals("europe-west1", config.cloudLocation().orElseThrow());
    assertTrue(config.apiKey().isEmpty());
    assertTrue(config.endpoint().isEmpty());
  }

  @Test
  void serverUrlIsAcceptedAsEndpoint() {
    BaseConfiguration llm = new BaseConfiguration();
    llm.addProperty("provider", "ollama");
    llm.addProperty("endpoint", "");
    llm.addProperty("serverUrl", "http://ollama:11434");

    assertEquals(
        "http://ollama:11434", ProviderConfig.fromConfiguration(llm).endpoint().orElseThrow());
  }

  @Test
  @DisplayName("an unresolved ${env:...} reference counts as a missing value")
  void unresolvedEnvironmentReferenceIsAbsent() {
    BaseConfiguration llm = new BaseConfiguration();
    llm.addProperty("provider", "openai");
    llm.addProperty("apiKey", "${env:SURELY_NOT_SET_FOR_TESTS}");

    assertTrue(ProviderConfig.fromConfiguration(llm).apiKey().isEmpty());
  }

  @Test
  void missingOrUnknownProviderIsRejected() {
    assertThrows(
        ConfigException.class, () -> ProviderConfig.fromConfiguration(new BaseConfiguration()));

    BaseConfiguration llm = new BaseConfiguration();
    llm.addProperty("provider", "watson");
    assertThrows(UnsupportedProviderException.class, () -> ProviderConfig.fromConfiguration(llm));
  }

  @Test
  void temperatureMustStayWithinRange() {
    assertDoesNotThrow(
        () -> ProviderConfig.builder().provider(LlmProvider.OPENAI).temperature(0).build());
    assertDoesNotThrow(
        () -> ProviderConfig.builder().provider(LlmProvider.OPENAI).temperature(2).build());
    assertThrows(
        ConfigException.class,
        () -> ProviderConfig.builder().provider(LlmProvider.OPENAI).temperature(2.01).build());
    assertThrows(
        ConfigException.class,
        () -> ProviderConfig.builder().provider(LlmProvider.OPENAI).temperature(-0.1).build());
  }

  @Test
  void toStringRedactsApiKey() {
    ProviderConfig config =
        ProviderConfig.builder().provider(LlmProvider.OPENAI).apiKey("sk-secret-value").build();

    assertFalse(config.toString().contains("sk-secret-value"));
    assertTrue(config.toString().contains("<redacted>"));
  }
}
