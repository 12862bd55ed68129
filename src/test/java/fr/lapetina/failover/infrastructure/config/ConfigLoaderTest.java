package fr.lapetina.failover.infrastructure.config;

import fr.lapetina.failover.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static RouterConfig fromYaml(String yaml, Map<String, String> env) {
        return new ConfigLoader("unused.yaml", env)
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("YAML loading")
    class YamlTests {

        @Test
        @DisplayName("should load configuration from the classpath")
        void shouldLoadFromClasspath() {
            RouterConfig config = new ConfigLoader("test-config.yaml", Map.of()).load();

            assertThat(config.getOrigins()).containsExactly("origin-a:8080", "origin-b:8080", "origin-c:8080");
            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(250);
            assertThat(config.getAttempt().getSuccessStatusCodes()).containsExactly(200);
            assertThat(config.getSelection().getType()).isEqualTo("sequential");
            assertThat(config.getServer().getHost()).isEqualTo("127.0.0.1");
            assertThat(config.getServer().getWorkerThreads()).isEqualTo(4);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("failover_test");
        }

        @Test
        @DisplayName("should prefer a file on disk")
        void shouldLoadFromFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("router.yaml");
            Files.writeString(file, "origins:\n  - disk-origin:9000\nselection:\n  type: random\n");

            RouterConfig config = new ConfigLoader(file.toString(), Map.of()).load();

            assertThat(config.getOrigins()).containsExactly("disk-origin:9000");
            assertThat(config.getSelection().getType()).isEqualTo("random");
            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("should fill defaults for an empty document")
        void shouldDefaultEmptyDocument() {
            RouterConfig config = fromYaml("", Map.of());

            assertThat(config.getOrigins()).isEmpty();
            assertThat(config.getServer().getPort()).isEqualTo(8080);
            assertThat(config.getServer().getAdminPathPrefix()).isEqualTo("/_router");
            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
            assertThat(config.getSelection().getType()).isEqualTo("sequential");
        }

        @Test
        @DisplayName("should reject a missing file")
        void shouldRejectMissingFile() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml", Map.of()).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }

        @Test
        @DisplayName("should reject malformed YAML")
        void shouldRejectMalformedYaml(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("broken.yaml");
            Files.writeString(file, "attempt:\n  timeoutMs: [not, a, number\n");

            assertThatThrownBy(() -> new ConfigLoader(file.toString(), Map.of()).load())
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject a non-numeric timeout in the file but accept one from the environment")
        void shouldBindFileTimeoutStrictly(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("router.yaml");
            Files.writeString(file, "attempt:\n  timeoutMs: abc\n");
            Path valid = dir.resolve("valid.yaml");
            Files.writeString(valid, "attempt:\n  timeoutMs: 900\n");

            assertThatThrownBy(() -> new ConfigLoader(file.toString(), Map.of()).load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("router.yaml");

            RouterConfig config = new ConfigLoader(valid.toString(),
                    Map.of(ConfigLoader.ENV_TIMEOUT_MS, "abc")).load();
            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("should replace a non-positive timeout with the default")
        void shouldReplaceNonPositiveTimeout() {
            RouterConfig config = fromYaml("attempt:\n  timeoutMs: 0\n", Map.of());

            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentTests {

        @Test
        @DisplayName("should replace origins with the ordered environment list")
        void shouldOverlayOrigins() {
            RouterConfig config = new ConfigLoader("test-config.yaml",
                    Map.of(ConfigLoader.ENV_ORIGINS, " x.example:1, ,y.example:2 ,")).load();

            assertThat(config.getOrigins()).containsExactly("x.example:1", "y.example:2");
        }

        @Test
        @DisplayName("should parse a numeric timeout")
        void shouldOverlayTimeout() {
            RouterConfig config = fromYaml("", Map.of(ConfigLoader.ENV_TIMEOUT_MS, "1200"));

            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(1200);
        }

        @Test
        @DisplayName("should fall back to 500 ms for a non-numeric timeout")
        void shouldFallBackOnNonNumericTimeout() {
            RouterConfig config = fromYaml("attempt:\n  timeoutMs: 900\n",
                    Map.of(ConfigLoader.ENV_TIMEOUT_MS, "fast"));

            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("should fall back to 500 ms for a negative timeout")
        void shouldFallBackOnNegativeTimeout() {
            RouterConfig config = fromYaml("", Map.of(ConfigLoader.ENV_TIMEOUT_MS, "-5"));

            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("should switch to random selection for truthy flags only")
        void shouldOverlayRandomFlag() {
            assertThat(fromYaml("", Map.of(ConfigLoader.ENV_RANDOM, "true")).getSelection().getType())
                    .isEqualTo("random");
            assertThat(fromYaml("", Map.of(ConfigLoader.ENV_RANDOM, "YES")).getSelection().getType())
                    .isEqualTo("random");
            assertThat(fromYaml("selection:\n  type: random\n", Map.of(ConfigLoader.ENV_RANDOM, "false"))
                    .getSelection().getType())
                    .isEqualTo("sequential");
        }

        @Test
        @DisplayName("should overlay the port and reject garbage")
        void shouldOverlayPort() {
            assertThat(fromYaml("", Map.of(ConfigLoader.ENV_PORT, "9090")).getServer().getPort())
                    .isEqualTo(9090);
            assertThatThrownBy(() -> fromYaml("", Map.of(ConfigLoader.ENV_PORT, "http")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should leave file values alone when variables are absent")
        void shouldKeepFileValues() {
            RouterConfig config = new ConfigLoader("test-config.yaml", Map.of("UNRELATED", "x")).load();

            assertThat(config.getOrigins()).hasSize(3);
            assertThat(config.getAttempt().getTimeoutMs()).isEqualTo(250);
        }
    }

    @Test
    @DisplayName("should parse timeouts leniently")
    void shouldParseTimeout() {
        assertThat(ConfigLoader.parseTimeoutMs(" 750 ")).isEqualTo(750);
        assertThat(ConfigLoader.parseTimeoutMs("")).isEqualTo(500);
        assertThat(ConfigLoader.parseTimeoutMs("1.5")).isEqualTo(500);
    }
}
