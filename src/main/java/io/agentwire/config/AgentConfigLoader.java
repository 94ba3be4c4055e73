package io.agentwire.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.agentwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves an {@link AgentConfig} from environment variables or from the agents file.
 *
 * <p>When every one of {@code PROVIDER, MODEL, API_KEY_ENV, TEMPERATURE, PORT, ENDPOINT} is set
 * the environment wins; otherwise the file named by {@code CONFIG_PATH} (default
 * {@value AgentConfig#DEFAULT_CONFIG_PATH}) is read. Files ending in {@code .json} are parsed as
 * JSON, anything else as YAML. The file holds a top-level {@code agents} map keyed by agent name.
 */
public final class AgentConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AgentConfigLoader.class);

    public static final String ENV_AGENT_NAME = "AGENT_NAME";
    public static final String ENV_CONFIG_PATH = "CONFIG_PATH";

    private static final List<String> ENV_SETTINGS = List.of(
            "PROVIDER", "MODEL", "API_KEY_ENV", "TEMPERATURE", "PORT", "ENDPOINT"
    );

    private static final ObjectMapper YAML = new YAMLMapper();

    private final Map<String, String> env;

    public AgentConfigLoader() {
        this(System.getenv());
    }

    public AgentConfigLoader(Map<String, String> env) {
        this.env = env == null ? Map.of() : Map.copyOf(env);
    }

    public AgentConfig load() {
        return load(null);
    }

    public AgentConfig load(String agentName) {
        String name = agentName;
        if (name == null || name.isBlank()) {
            name = env(ENV_AGENT_NAME);
            if (name == null) {
                throw new ConfigurationException(ENV_AGENT_NAME + " environment variable not set");
            }
        }
        if (hasEnvConfig()) {
            log.info("Loading config for {} from environment variables", name);
            return fromEnv(name);
        }
        String configPath = env(ENV_CONFIG_PATH);
        return fromFile(name, Paths.get(configPath == null ? AgentConfig.DEFAULT_CONFIG_PATH : configPath));
    }

    /**
     * Reads {@code agentName} from an agents file, ignoring environment overrides.
     */
    public AgentConfig fromFile(String agentName, Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException(
                    "Config file not found: " + file + ". Set environment variables or provide " + AgentConfig.DEFAULT_CONFIG_PATH
            );
        }
        log.info("Loading config for {} from {}", agentName, file);
        JsonNode root = readTree(file);
        JsonNode agents = root == null ? null : root.get("agents");
        if (agents == null || !agents.isObject()) {
            throw new ConfigurationException("No agents map in " + file);
        }
        JsonNode entry = agents.get(agentName);
        if (entry == null || !entry.isObject()) {
            List<String> available = new ArrayList<>();
            agents.fieldNames().forEachRemaining(available::add);
            throw new ConfigurationException(
                    "Agent " + agentName + " not found in " + file + ". Available agents: " + available
            );
        }
        return new AgentConfig(
                agentName,
                fileText(entry, "provider", agentName),
                fileText(entry, "model", agentName),
                fileText(entry, "api_key_env", agentName),
                fileNumber(entry, "temperature", agentName).doubleValue(),
                filePort(entry, agentName),
                fileText(entry, "endpoint", agentName)
        );
    }

    /**
     * Value of the environment variable named {@code apiKeyEnv}.
     */
    public String apiKey(String apiKeyEnv) {
        String value = apiKeyEnv == null ? null : env(apiKeyEnv);
        if (value == null) {
            throw new ConfigurationException(
                    "API key not found: " + apiKeyEnv + ". Make sure " + apiKeyEnv + " environment variable is set"
            );
        }
        return value;
    }

    public String apiKey(AgentConfig config) {
        return apiKey(config.apiKeyEnv());
    }

    private boolean hasEnvConfig() {
        for (String key : ENV_SETTINGS) {
            if (env(key) == null) {
                return false;
            }
        }
        return true;
    }

    private AgentConfig fromEnv(String agentName) {
        double temperature;
        int port;
        try {
            temperature = Double.parseDouble(env("TEMPERATURE"));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("TEMPERATURE is not a number: " + env("TEMPERATURE"), e);
        }
        try {
            port = Integer.parseInt(env("PORT"));
        } catch (NumberFormatException e) {
            throw new ConfigurationException("PORT is not an integer: " + env("PORT"), e);
        }
        return new AgentConfig(agentName, env("PROVIDER"), env("MODEL"), env("API_KEY_ENV"), temperature, port, env("ENDPOINT"));
    }

    private String env(String key) {
        String value = env.get(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static JsonNode readTree(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        ObjectMapper mapper = name.endsWith(".json") ? Jsons.mapper() : YAML;
        try {
            return mapper.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid config file " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + file, e);
        }
    }

    private static String fileText(JsonNode entry, String key, String agentName) {
        JsonNode node = entry.get(key);
        if (node == null || node.isNull() || node.isContainerNode()) {
            throw new ConfigurationException("Missing required setting " + key + " for agent " + agentName);
        }
        return node.asText();
    }

    private static Number fileNumber(JsonNode entry, String key, String agentName) {
        JsonNode node = entry.get(key);
        if (node == null || node.isNull()) {
            throw new ConfigurationException("Missing required setting " + key + " for agent " + agentName);
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        try {
            return Double.valueOf(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number for agent " + agentName + ": " + node.asText(), e);
        }
    }

    private static int filePort(JsonNode entry, String agentName) {
        JsonNode node = entry.get("port");
        if (node == null || node.isNull()) {
            throw new ConfigurationException("Missing required setting port for agent " + agentName);
        }
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("port is not an integer for agent " + agentName + ": " + node.asText(), e);
            }
        }
        throw new ConfigurationException("port is not an integer for agent " + agentName + ": " + node.asText());
    }
}
