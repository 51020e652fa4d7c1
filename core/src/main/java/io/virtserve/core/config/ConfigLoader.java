package io.virtserve.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link EngineConfig} from a YAML file with optional environment variable overlay.
 *
 * <pre>
 * matching:
 *   mode: optimized          # or reference
 *   max-regex-steps: 1000000
 * imposters:
 *   dir: ./imposters
 * </pre>
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code virtserve.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Environment variables take precedence over YAML values: {@code VIRTSERVE_MATCH_MODE},
 * {@code VIRTSERVE_MAX_REGEX_STEPS}, {@code VIRTSERVE_IMPOSTERS_DIR}. A variable is considered
 * "set" if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "virtserve.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads an {@link EngineConfig} from the given YAML file path, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the configuration with defaults applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static EngineConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads an {@link EngineConfig} from the given YAML file path, applying environment variable
     * overrides from the supplied lookup function ({@code null} means not defined).
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the configuration with env overrides applied
     * @throws ConfigLoadException if the file is missing or contains invalid YAML or values
     */
    public static EngineConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root != null ? root : YAML_MAPPER.createObjectNode(), envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (RuntimeException e) {
            throw new ConfigLoadException("Failed to load configuration from: " + configPath, e);
        }
    }

    /**
     * Builds a configuration from defaults and environment variables only.
     *
     * @param envLookup environment variable lookup function
     * @return the configuration
     */
    public static EngineConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static EngineConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        EngineConfig.Builder builder = EngineConfig.builder();

        // --- YAML mapping ---

        JsonNode matching = root.path("matching");
        if (matching.has("mode")) builder.matchMode(matching.get("mode").asText());
        if (matching.has("max-regex-steps")) {
            JsonNode steps = matching.get("max-regex-steps");
            if (!steps.canConvertToInt() || !steps.isIntegralNumber()) {
                throw new ConfigLoadException("matching.max-regex-steps must be an integer, got: " + steps);
            }
            builder.maxRegexSteps(steps.intValue());
        }

        JsonNode imposters = root.path("imposters");
        if (imposters.has("dir")) builder.impostersDir(imposters.get("dir").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "VIRTSERVE_MATCH_MODE", builder::matchMode);
        envInt(envLookup, "VIRTSERVE_MAX_REGEX_STEPS", builder::maxRegexSteps);
        envString(envLookup, "VIRTSERVE_IMPOSTERS_DIR", builder::impostersDir);

        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    // --- Env var helpers ---

    /**
     * Returns {@code true} if the env var is "set": defined AND non-blank after trimming.
     */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies an integer env var override if set. */
    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got: '" + value + "'", e);
            }
        }
    }
}
