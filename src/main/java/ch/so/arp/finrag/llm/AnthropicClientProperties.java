package ch.so.arp.finrag.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to connect to the Anthropic
 * Messages API.
 */
@ConfigurationProperties(prefix = "finrag.anthropic")
public class AnthropicClientProperties implements EnvironmentAware {

    /**
     * API key. Falls back to the {@code ANTHROPIC_API_KEY} environment
     * variable.
     */
    private String apiKey;

    /**
     * Base URL for the API.
     */
    private String baseUrl = "https://api.anthropic.com/v1";

    /**
     * Name of the model used for planning and answering.
     */
    private String model = "claude-sonnet-4-20250514";

    /**
     * Value of the {@code anthropic-version} header.
     */
    private String version = "2023-06-01";

    /**
     * Default output token limit.
     */
    private int maxTokens = 2400;

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("ANTHROPIC_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
