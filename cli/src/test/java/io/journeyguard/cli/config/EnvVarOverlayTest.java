package io.journeyguard.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay on {@link ConfigLoader}.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var counts as set only when it is defined
 * and its trimmed value is non-empty.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        fullConfigPath = ConfigLoaderTest.fixture("full-config.yaml");
        envVars.clear();
    }

    @Nested
    @DisplayName("String overrides")
    class StringOverrides {

        @Test
        @DisplayName("REGISTRY_PATH, WORKSPACE_FOLDER, USER_CWD, LOG_FORMAT and LOG_LEVEL override YAML")
        void stringKeys_overriddenByEnvVars() {
            envVars.put("REGISTRY_PATH", "/etc/journey-guard/nodes.json");
            envVars.put("WORKSPACE_FOLDER", "/work");
            envVars.put("USER_CWD", "  /cwd  ");
            envVars.put("LOG_FORMAT", "text");
            envVars.put("LOG_LEVEL", "ERROR");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.registryPath()).isEqualTo("/etc/journey-guard/nodes.json");
            assertThat(config.workspaceFolder()).isEqualTo("/work");
            assertThat(config.userCwd()).isEqualTo("/cwd");
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("ERROR");
        }

        @Test
        @DisplayName("Blank env var → YAML value kept")
        void blankEnvVar_isUnset() {
            envVars.put("LOG_LEVEL", "   ");
            envVars.put("WORKSPACE_FOLDER", "");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.workspaceFolder()).isEqualTo("/srv/journeys");
        }
    }

    @Nested
    @DisplayName("Numeric and boolean overrides")
    class TypedOverrides {

        @Test
        @DisplayName("MAX_REPAIR_CYCLES, MAX_FILE_BYTES and AUTO_FIX are parsed")
        void typedKeys_overriddenByEnvVars() {
            envVars.put("MAX_REPAIR_CYCLES", "5");
            envVars.put("MAX_FILE_BYTES", "4096");
            envVars.put("AUTO_FIX", "TRUE");

            CliConfig config = ConfigLoader.load(fullConfigPath, envLookup());

            assertThat(config.maxRepairCycles()).isEqualTo(5);
            assertThat(config.maxFileBytes()).isEqualTo(4096);
            assertThat(config.autoFix()).isTrue();
        }

        @Test
        @DisplayName("Overlay applies without any config file")
        void overlayWithoutFile() {
            envVars.put("AUTO_FIX", "false");

            CliConfig config = ConfigLoader.loadOrDefaults(null, envLookup());

            assertThat(config.autoFix()).isFalse();
        }

        @Test
        @DisplayName("Non-numeric MAX_REPAIR_CYCLES → ConfigLoadException")
        void nonNumericInt_throws() {
            envVars.put("MAX_REPAIR_CYCLES", "many");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("MAX_REPAIR_CYCLES must be an integer, got 'many'")
                    .hasCauseInstanceOf(NumberFormatException.class);
        }

        @Test
        @DisplayName("Negative MAX_FILE_BYTES → rejected by validation")
        void negativeLong_throws() {
            envVars.put("MAX_FILE_BYTES", "-1");

            assertThatThrownBy(() -> ConfigLoader.load(fullConfigPath, envLookup()))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("security.max-file-bytes must be > 0, got -1");
        }
    }
}
