package fr.lapetina.admission.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @Test
    @DisplayName("should load configuration from the classpath")
    void shouldLoadFromClasspath() {
        AdmissionConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getCluster().getRank()).isZero();
        assertThat(config.getCluster().getNumRanks()).isEqualTo(4);
        assertThat(config.getScheduler().getMaxActiveRequestsPerRank()).isEqualTo(3);
        assertThat(config.getScheduler().isRankAwareBalancing()).isTrue();
        assertThat(config.getScheduler().getPlacementStrategy()).isEqualTo("longest-prompt-first");
        assertThat(config.getScheduler().getIdleDrainTimeoutMs()).isEqualTo(20L);
        assertThat(config.getValidation().getMaxBeamWidth()).isEqualTo(2);
        assertThat(config.getValidation().isDisaggregated()).isTrue();
        assertThat(config.getIngress().getRingBufferSize()).isEqualTo(64);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("admission_test");
    }

    @Test
    @DisplayName("should prefer the file system over the classpath")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("admission.yaml");
        Files.writeString(file, "scheduler:\n  maxActiveRequestsPerRank: 5\n");

        AdmissionConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getScheduler().getMaxActiveRequestsPerRank()).isEqualTo(5);
        assertThat(config.getScheduler().getMaxBatchSize()).isEqualTo(8);
    }

    @Test
    @DisplayName("should use defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        AdmissionConfig config = new ConfigLoader("empty-config.yaml").load();

        assertThat(config.getCluster().getNumRanks()).isEqualTo(1);
        assertThat(config.getScheduler().getMaxActiveRequestsPerRank()).isEqualTo(16);
        assertThat(config.getScheduler().getPlacementStrategy()).isEqualTo("least-loaded");
        assertThat(config.getIngress().getRingBufferSize()).isEqualTo(8192);
        assertThat(config.getMetrics().isEnabled()).isTrue();
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new ConfigLoader("invalid-config.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("rank");
    }

    @Test
    @DisplayName("should reject malformed YAML")
    void shouldRejectMalformedYaml() {
        ByteArrayInputStream in = new ByteArrayInputStream(
                "scheduler: [unterminated".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> new ConfigLoader().loadFromStream(in))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    @DisplayName("should fail when the file does not exist")
    void shouldFailWhenMissing() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should validate every section")
    void shouldValidateSections() {
        AdmissionConfig config = ConfigLoader.createDefault();
        config.getIngress().setRingBufferSize(100);
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);

        config = ConfigLoader.createDefault();
        config.getScheduler().setMaxActiveRequestsPerRank(0);
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);

        config = ConfigLoader.createDefault();
        config.getValidation().setMaxBeamWidth(0);
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);

        config = ConfigLoader.createDefault();
        config.getScheduler().setPlacementStrategy(" ");
        assertThatThrownBy(config::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
