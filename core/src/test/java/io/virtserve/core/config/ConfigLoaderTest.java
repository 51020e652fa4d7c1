package io.virtserve.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.virtserve.core.engine.ImposterEngine;
import io.virtserve.core.engine.MatchMode;
import io.virtserve.core.model.Request;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: classpath fixtures, defaults, the environment overlay and
 * descriptive failures.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        @DisplayName("Empty config → all defaults")
        void minimalConfigHasDefaults() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), NO_ENV);

            assertThat(config).isEqualTo(EngineConfig.DEFAULT);
            assertThat(config.matchMode()).isEqualTo(MatchMode.OPTIMIZED);
            assertThat(config.maxRegexSteps()).isEqualTo(1_000_000);
            assertThat(config.impostersDir()).isNull();
        }

        @Test
        @DisplayName("Full config → every key mapped")
        void fullConfigMapsEveryKey() throws Exception {
            EngineConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV);

            assertThat(config.matchMode()).isEqualTo(MatchMode.REFERENCE);
            assertThat(config.maxRegexSteps()).isEqualTo(50_000);
            assertThat(config.budget().maxRegexSteps()).isEqualTo(50_000);
            assertThat(config.impostersDir()).isEqualTo("/opt/imposters");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        @DisplayName("Set variables win over YAML values")
        void environmentOverridesYaml() throws Exception {
            Map<String, String> env = Map.of(
                    "VIRTSERVE_MATCH_MODE", " Optimized ",
                    "VIRTSERVE_MAX_REGEX_STEPS", "777",
                    "VIRTSERVE_IMPOSTERS_DIR", "/srv/imposters");

            EngineConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.matchMode()).isEqualTo(MatchMode.OPTIMIZED);
            assertThat(config.maxRegexSteps()).isEqualTo(777);
            assertThat(config.impostersDir()).isEqualTo("/srv/imposters");
        }

        @Test
        @DisplayName("Blank variables are treated as unset")
        void blankVariablesAreIgnored() throws Exception {
            Map<String, String> env = Map.of("VIRTSERVE_MATCH_MODE", "  ", "VIRTSERVE_MAX_REGEX_STEPS", "");

            EngineConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.matchMode()).isEqualTo(MatchMode.REFERENCE);
            assertThat(config.maxRegexSteps()).isEqualTo(50_000);
        }

        @Test
        void environmentOnly() {
            EngineConfig config = ConfigLoader.fromEnvironment(Map.of("VIRTSERVE_MATCH_MODE", "reference")::get);

            assertThat(config.matchMode()).isEqualTo(MatchMode.REFERENCE);
            assertThat(config.impostersDir()).isNull();
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @TempDir
        Path tempDir;

        @Test
        void missingFileIsDescriptive() {
            Path missing = tempDir.resolve("virtserve.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Configuration file not found")
                    .hasMessageContaining("--config");
        }

        @Test
        void invalidModeIsRejected() throws IOException {
            Path config = tempDir.resolve("bad-mode.yaml");
            Files.writeString(config, "matching:\n  mode: fastest\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("fastest");
        }

        @Test
        void nonIntegerStepsAreRejected() throws IOException {
            Path config = tempDir.resolve("bad-steps.yaml");
            Files.writeString(config, "matching:\n  max-regex-steps: lots\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("max-regex-steps");
        }

        @Test
        void nonPositiveStepsAreRejected() {
            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("VIRTSERVE_MAX_REGEX_STEPS", "0")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("maxRegexSteps must be positive");
        }

        @Test
        void nonNumericEnvironmentStepsAreRejected() {
            assertThatThrownBy(() -> ConfigLoader.fromEnvironment(Map.of("VIRTSERVE_MAX_REGEX_STEPS", "1e6")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("VIRTSERVE_MAX_REGEX_STEPS must be an integer, got: '1e6'");
        }

        @Test
        void malformedYamlIsRejected() throws IOException {
            Path config = tempDir.resolve("broken.yaml");
            Files.writeString(config, "matching: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(config, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("broken.yaml");
        }
    }

    @Test
    void resolvesConfigPathFromArguments() {
        assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/vs.yaml"}))
                .isEqualTo(Path.of("/etc/vs.yaml"));
        assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("virtserve.yaml"));
        assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("createEngine loads the configured imposter directory")
    void createEngineLoadsImposters(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("orders.json"), """
                {"port": 4545, "stubs": [{"predicates": [{"equals": {"path": "/orders"}}]}]}
                """);
        EngineConfig config = EngineConfig.builder()
                .matchMode(MatchMode.REFERENCE)
                .impostersDir(dir.toString())
                .build();

        ImposterEngine engine = config.createEngine(null);

        assertThat(engine.mode()).isEqualTo(MatchMode.REFERENCE);
        assertThat(engine.match(4545, Request.builder().path("/orders").build()).isMatched()).isTrue();
    }
}
