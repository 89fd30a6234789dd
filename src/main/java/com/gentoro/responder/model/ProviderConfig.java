package com.gentoro.responder.model;

import com.gentoro.responder.exception.ConfigException;
import java.util.Objects;
import java.util.Optional;
import org.apache.commons.configuration2.Configuration;

/**
 * Immutable provider selection and credential bundle.
 *
 * <p>Example configuration, read by {@link #fromConfiguration(Configuration)} from the {@code llm}
 * subset:
 *
 * <pre>
 *   llm:
 *     provider: gcp-vertex
 *     model: gemini-2.0-flash
 *     temperature: 1.0
 *     cloudProject: my-project
 *     cloudLocation: us-central1
 * </pre>
 *
 * <p>The API key is never included in {@link #toString()}.
 */
public final class ProviderConfig {
  public static final double MIN_TEMPERATURE = 0.0;
  public static final double MAX_TEMPERATURE = 2.0;
  public static final double DEFAULT_TEMPERATURE = 1.0;

  private final LlmProvider provider;
  private final String apiKey;
  private final String endpoint;
  private final String cloudProject;
  private final String cloudLocation;
  private final String model;
  private final double temperature;

  private ProviderConfig(Builder builder) {
    this.provider = builder.provider;
    this.apiKey = blankToNull(builder.apiKey);
    this.endpoint = blankToNull(builder.endpoint);
    this.cloudProject = blankToNull(builder.cloudProject);
    this.cloudLocation = blankToNull(builder.cloudLocation);
    this.model = blankToNull(builder.model);
    this.temperature = builder.temperature;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads a provider configuration from a subset such as {@code configuration.subset("llm")}.
   * {@code serverUrl} is accepted as an alias of {@code endpoint}.
   */
  public static ProviderConfig fromConfiguration(Configuration llm) {
    String provider = llm.getString("provider", null);
    if (provider == null || provider.isBlank()) {
      throw new ConfigException("Missing llm.provider configuration");
    }
    String endpoint = resolved(llm, "endpoint");
    if (endpoint == null || endpoint.isBlank()) {
      endpoint = resolved(llm, "serverUrl");
    }
    return builder()
        .provider(LlmProvider.fromId(provider))
        .apiKey(resolved(llm, "apiKey"))
        .endpoint(endpoint)
        .cloudProject(resolved(llm, "cloudProject"))
        .cloudLocation(resolved(llm, "cloudLocation"))
        .model(resolved(llm, "model"))
        .temperature(llm.getDouble("temperature", DEFAULT_TEMPERATURE))
        .build();
  }

  // An ${env:...} reference whose variable is unset comes back verbatim; treat it as absent.
  private static String resolved(Configuration llm, String key) {
    String value = llm.getString(key, null);
    if (value != null && value.startsWith("${") && value.endsWith("}")) {
      return null;
    }
    return value;
  }

  public LlmProvider provider() {
    return provider;
  }

  public Optional<String> apiKey() {
    return Optional.ofNullable(apiKey);
  }

  public Optional<String> endpoint() {
    return Optional.ofNullable(endpoint);
  }

  public Optional<String> cloudProject() {
    return Optional.ofNullable(cloudProject);
  }

  public Optional<String> cloudLocation() {
    return Optional.ofNullable(cloudLocation);
  }

  public Optional<String> model() {
    return Optional.ofNullable(model);
  }

  public double temperature() {
    return temperature;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ProviderConfig that)) return false;
    return Double.compare(temperature, that.temperature) == 0
        && provider == that.provider
        && Objects.equals(apiKey, that.apiKey)
        && Objects.equals(endpoint, that.endpoint)
        && Objects.equals(cloudProject, that.cloudProject)
        && Objects.equals(cloudLocation, that.cloudLocation)
        && Objects.equals(model, that.model);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        provider, apiKey, endpoint, cloudProject, cloudLocation, model, temperature);
  }

  @Override
  public String toString() {
    return "ProviderConfig{"
        + "provider="
        + (provider == null ? null : provider.id())
        + ", apiKey="
        + (apiKey == null ? "<unset>" : "<redacted>")
        + ", endpoint="
        + endpoint
        + ", cloudProject="
        + cloudProject
        + ", cloudLocation="
        + cloudLocation
        + ", model="
        + model
        + ", temperature="
        + temperature
        + '}';
  }

  public static final class Builder {
    private LlmProvider provider;
    private String apiKey;
    private String endpoint;
    private String cloudProject;
    private String cloudLocation;
    private String model;
    private double temperature = DEFAULT_TEMPERATURE;

    private Builder() {}

    public Builder provider(LlmProvider provider) {
      this.provider = provider;
      return this;
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder endpoint(String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder cloudProject(String cloudProject) {
      this.cloudProject = cloudProject;
      return this;
    }

    public Builder cloudLocation(String cloudLocation) {
      this.cloudLocation = cloudLocation;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    /**
     * @throws ConfigException when the temperature lies outside [0, 2]
     */
    public ProviderConfig build() {
      if (Double.isNaN(temperature)
          || temperature < MIN_TEMPERATURE
          || temperature > MAX_TEMPERATURE) {
        throw new ConfigException(
            "llm.temperature must be within [%s, %s], got %s"
                .formatted(MIN_TEMPERATURE, MAX_TEMPERATURE, temperature));
      }
      return new ProviderConfig(this);
    }
  }
}
