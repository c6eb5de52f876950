package io.journeyguard.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing: key mapping, defaults for missing keys and the
 * error paths.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Load full config → all fields populated")
        void loadFullConfig_allFieldsPopulated() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config.registryPath()).isEqualTo("registry/node-definitions.json");
            assertThat(config.autoFix()).isFalse();
            assertThat(config.maxRepairCycles()).isEqualTo(3);
            assertThat(config.workspaceFolder()).isEqualTo("/srv/journeys");
            assertThat(config.userCwd()).isEqualTo("/home/dev/project");
            assertThat(config.maxFileBytes()).isEqualTo(2048);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Partial config → missing keys take defaults")
        void partialConfig_defaultsForMissingKeys() throws Exception {
            CliConfig config = ConfigLoader.load(fixture("partial-config.yaml"), NO_ENV::get);

            // Explicit
            assertThat(config.maxRepairCycles()).isEqualTo(2);

            // Defaults
            assertThat(config.registryPath()).isNull();
            assertThat(config.autoFix()).isTrue();
            assertThat(config.workspaceFolder()).isNull();
            assertThat(config.userCwd()).isEqualTo(System.getProperty("user.dir"));
            assertThat(config.maxFileBytes()).isEqualTo(10_485_760);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        @DisplayName("No --config and no default file → plain defaults")
        void noConfigFile_plainDefaults() {
            CliConfig config = ConfigLoader.loadOrDefaults(null, NO_ENV::get);

            assertThat(config).isEqualTo(CliConfig.builder().build());
        }

        @Test
        @DisplayName("Explicit --config wins over the default lookup")
        void explicitPath_isUsed() throws Exception {
            CliConfig config = ConfigLoader.loadOrDefaults(fixture("partial-config.yaml"), NO_ENV::get);

            assertThat(config.maxRepairCycles()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing explicit file → ConfigLoadException naming only the file")
        void missingFile_throws(@TempDir Path tempDir) {
            Path missing = tempDir.resolve("absent.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: absent.yaml. Use --config <path> to specify a "
                            + "config file.");
        }

        @Test
        @DisplayName("Invalid YAML → ConfigLoadException with cause")
        void invalidYaml_throws() throws Exception {
            Path invalid = fixture("invalid-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(invalid, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Failed to parse YAML configuration: invalid-config.yaml")
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Out-of-range limits are rejected by the builder")
        void outOfRangeLimits_throw() {
            assertThatThrownBy(() -> CliConfig.builder().maxRepairCycles(-1).build())
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("validation.max-repair-cycles must be >= 0, got -1");
            assertThatThrownBy(() -> CliConfig.builder().maxFileBytes(0).build())
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("security.max-file-bytes must be > 0, got 0");
        }
    }
}
