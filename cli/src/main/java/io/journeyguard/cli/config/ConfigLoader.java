package io.journeyguard.cli.config;

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
import java.util.function.LongConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <p>
 * The file is given with {@code --config /path/to/config.yaml}, or {@code journey-guard.yaml}
 * is looked up in the current directory. A missing default file means all defaults; a missing
 * explicit file is an error.
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable is "set" if and only if
 * it is defined AND its trimmed value is non-empty.
 *
 * <table>
 * <caption>Environment overlay</caption>
 * <tr><th>Variable</th><th>YAML key</th></tr>
 * <tr><td>REGISTRY_PATH</td><td>registry.path</td></tr>
 * <tr><td>AUTO_FIX</td><td>validation.auto-fix</td></tr>
 * <tr><td>MAX_REPAIR_CYCLES</td><td>validation.max-repair-cycles</td></tr>
 * <tr><td>WORKSPACE_FOLDER</td><td>security.workspace-folder</td></tr>
 * <tr><td>USER_CWD</td><td>security.user-cwd</td></tr>
 * <tr><td>MAX_FILE_BYTES</td><td>security.max-file-bytes</td></tr>
 * <tr><td>LOG_FORMAT</td><td>logging.format</td></tr>
 * <tr><td>LOG_LEVEL</td><td>logging.level</td></tr>
 * </table>
 */
public final class ConfigLoader {

    static final String DEFAULT_CONFIG_FILE = "journey-guard.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from an explicit file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from an explicit file, applying overrides from the supplied lookup.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup; {@code null} means undefined
     * @throws ConfigLoadException if the file is missing or contains invalid YAML
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath.getFileName()
                    + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath.getFileName(), e);
        }
        return mapToConfig(root, envLookup);
    }

    /**
     * Loads the configuration named on the command line, or the default file when present, or
     * plain defaults.
     *
     * @param explicitPath the {@code --config} value, or {@code null}
     * @param envLookup    environment variable lookup
     */
    public static CliConfig loadOrDefaults(Path explicitPath, Function<String, String> envLookup) {
        if (explicitPath != null) {
            return load(explicitPath, envLookup);
        }
        Path defaultPath = Path.of(DEFAULT_CONFIG_FILE);
        if (Files.exists(defaultPath)) {
            return load(defaultPath, envLookup);
        }
        return mapToConfig(null, envLookup);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();

        if (root != null) {
            JsonNode registry = root.path("registry");
            if (registry.has("path")) builder.registryPath(registry.get("path").asText());

            JsonNode validation = root.path("validation");
            if (validation.has("auto-fix")) builder.autoFix(validation.get("auto-fix").asBoolean());
            if (validation.has("max-repair-cycles"))
                builder.maxRepairCycles(validation.get("max-repair-cycles").asInt());

            JsonNode security = root.path("security");
            if (security.has("workspace-folder"))
                builder.workspaceFolder(security.get("workspace-folder").asText());
            if (security.has("user-cwd")) builder.userCwd(security.get("user-cwd").asText());
            if (security.has("max-file-bytes"))
                builder.maxFileBytes(security.get("max-file-bytes").asLong());

            JsonNode logging = root.path("logging");
            if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
            if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
        }

        applyEnvOverrides(builder, envLookup);
        return builder.build();
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "REGISTRY_PATH", builder::registryPath);
        envString(envLookup, "WORKSPACE_FOLDER", builder::workspaceFolder);
        envString(envLookup, "USER_CWD", builder::userCwd);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "MAX_REPAIR_CYCLES", builder::maxRepairCycles);
        envLong(envLookup, "MAX_FILE_BYTES", builder::maxFileBytes);

        envBool(envLookup, "AUTO_FIX", builder::autoFix);
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envLong(Function<String, String> envLookup, String envVar, LongConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Long.parseLong(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, got '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
