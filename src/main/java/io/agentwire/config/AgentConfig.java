package io.agentwire.config;

import java.util.Objects;

/**
 * Settings of one agent process. Holds the name of the environment variable carrying the API
 * key, never the key itself.
 */
public final class AgentConfig {
    public static final String DEFAULT_CONFIG_PATH = "agents_config.yaml";

    private final String agentName;
    private final String provider;
    private final String model;
    private final String apiKeyEnv;
    private final double temperature;
    private final int port;
    private final String endpoint;

    public AgentConfig(
            String agentName,
            String provider,
            String model,
            String apiKeyEnv,
            double temperature,
            int port,
            String endpoint
    ) {
        this.agentName = require(agentName, "agent name");
        this.provider = require(provider, "provider");
        this.model = require(model, "model");
        this.apiKeyEnv = require(apiKeyEnv, "api_key_env");
        this.endpoint = require(endpoint, "endpoint");
        if (!Double.isFinite(temperature)) {
            throw new ConfigurationException("temperature must be a finite number for agent " + agentName);
        }
        if (port < 0 || port > 65_535) {
            throw new ConfigurationException("port out of range for agent " + agentName + ": " + port);
        }
        this.temperature = temperature;
        this.port = port;
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing required setting: " + field);
        }
        return value.trim();
    }

    public String agentName() {
        return agentName;
    }

    public String provider() {
        return provider;
    }

    public String model() {
        return model;
    }

    public String apiKeyEnv() {
        return apiKeyEnv;
    }

    public double temperature() {
        return temperature;
    }

    public int port() {
        return port;
    }

    public String endpoint() {
        return endpoint;
    }

    public AgentConfig withPort(int newPort) {
        return new AgentConfig(agentName, provider, model, apiKeyEnv, temperature, newPort, endpoint);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AgentConfig)) {
            return false;
        }
        AgentConfig that = (AgentConfig) o;
        return Double.compare(that.temperature, temperature) == 0
                && port == that.port
                && agentName.equals(that.agentName)
                && provider.equals(that.provider)
                && model.equals(that.model)
                && apiKeyEnv.equals(that.apiKeyEnv)
                && endpoint.equals(that.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentName, provider, model, apiKeyEnv, temperature, port, endpoint);
    }

    @Override
    public String toString() {
        return "AgentConfig{agentName=" + agentName
                + ", provider=" + provider
                + ", model=" + model
                + ", apiKeyEnv=" + apiKeyEnv
                + ", temperature=" + temperature
                + ", port=" + port
                + ", endpoint=" + endpoint + "}";
    }
}
