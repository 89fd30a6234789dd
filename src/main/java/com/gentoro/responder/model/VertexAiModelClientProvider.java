package com.gentoro.responder.model;

import com.gentoro.responder.exception.ProviderInitializationException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.genai.Client;
import java.io.IOException;

/**
 * Initializer for Gemini on Vertex AI. Requires {@code llm.cloudProject} and {@code
 * llm.cloudLocation}; authenticates with Google Application Default Credentials.
 */
public final class VertexAiModelClientProvider implements ModelClientProvider {

  /** Source of Google credentials; Application Default Credentials unless overridden. */
  @FunctionalInterface
  public interface CredentialsSource {
    GoogleCredentials load() throws IOException;
  }

  private final CredentialsSource credentialsSource;

  public VertexAiModelClientProvider() {
    this(GoogleCredentials::getApplicationDefault);
  }

  public VertexAiModelClientProvider(CredentialsSource credentialsSource) {
    this.credentialsSource = credentialsSource;
  }

  @Override
  public LlmProvider provider() {
    return LlmProvider.GCP_VERTEX;
  }

  @Override
  public ModelClient create(ProviderConfig config) {
    String project = ModelClientProvider.require(provider(), config.cloudProject(), "cloudProject");
    String location =
        ModelClientProvider.require(provider(), config.cloudLocation(), "cloudLocation");

    GoogleCredentials credentials;
    try {
      credentials = credentialsSource.load();
    } catch (IOException e) {
      throw new ProviderInitializationException(
          provider(), "could not load Google application default credentials", e);
    }

    Client client =
        Client.builder()
            .vertexAI(true)
            .project(project)
            .location(location)
            .credentials(credentials)
            .build();
    return new GeminiModelClient(
        provider(), client, config.model().orElse(GoogleAiModelClientProvider.DEFAULT_MODEL));
  }
}
