package com.jordtransport.manifest.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ManifestProperties")
class ManifestPropertiesTest {

    @Test
    @DisplayName("defaults match the documented limits")
    void defaults() {
        ManifestProperties properties = new ManifestProperties();

        assertThat(properties.getMaxFileSizeBytes()).isEqualTo(10L * 1024 * 1024);
        assertThat(properties.getMaxRows()).isEqualTo(100_000);
        assertThat(properties.getParallelThreshold()).isEqualTo(500);
        assertThat(properties.getDataSheetName()).isEqualTo("Data");
        assertThat(properties.resolveWorkerThreads()).isGreaterThanOrEqualTo(4);
    }

    @Test
    @DisplayName("invalid values fall back to defaults")
    void fallbacks() {
        ManifestProperties properties = new ManifestProperties();
        properties.setMaxFileSizeBytes(0);
        properties.setMaxRows(-1);
        properties.setParallelThreshold(0);
        properties.setWorkerThreads(-3);

        properties.validate();

        assertThat(properties.getMaxFileSizeBytes()).isEqualTo(ManifestProperties.DEFAULT_MAX_FILE_SIZE_BYTES);
        assertThat(properties.getMaxRows()).isEqualTo(ManifestProperties.DEFAULT_MAX_ROWS);
        assertThat(properties.getParallelThreshold()).isEqualTo(ManifestProperties.DEFAULT_PARALLEL_THRESHOLD);
        assertThat(properties.getWorkerThreads()).isZero();
    }

    @Test
    @DisplayName("a size limit too large to buffer is capped")
    void sizeCeiling() {
        ManifestProperties properties = new ManifestProperties();
        properties.setMaxFileSizeBytes(Long.MAX_VALUE);

        properties.validate();

        assertThat(properties.getMaxFileSizeBytes()).isEqualTo(Integer.MAX_VALUE - 9L);
    }

    @Test
    @DisplayName("an explicit worker count is used as given")
    void explicitWorkers() {
        ManifestProperties properties = new ManifestProperties();
        properties.setWorkerThreads(3);

        assertThat(properties.resolveWorkerThreads()).isEqualTo(3);
    }
}
