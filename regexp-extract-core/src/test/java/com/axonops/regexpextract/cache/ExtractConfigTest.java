/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.regexpextract.cache;

import com.axonops.regexpextract.metrics.NoOpMetricsRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ExtractConfig validation and defaults.
 */
@DisplayName("ExtractConfig")
class ExtractConfigTest {

    @Test
    @DisplayName("Defaults")
    void defaults() {
        ExtractConfig config = ExtractConfig.DEFAULT;

        assertThat(config.cacheEnabled()).isTrue();
        assertThat(config.maxCachedPatterns()).isEqualTo(1024);
        assertThat(config.parallelism()).isEqualTo(1);
        assertThat(config.parallelThreshold()).isEqualTo(4096);
        assertThat(config.metricsRegistry()).isSameAs(NoOpMetricsRegistry.INSTANCE);
        assertThat(ExtractConfig.builder().build()).isEqualTo(ExtractConfig.DEFAULT);
    }

    @Test
    @DisplayName("NO_CACHE disables caching only")
    void noCache() {
        assertThat(ExtractConfig.NO_CACHE.cacheEnabled()).isFalse();
        assertThat(ExtractConfig.NO_CACHE.parallelism()).isEqualTo(1);
    }

    @Test
    @DisplayName("Parallel only above the threshold and with more than one worker")
    void isParallel() {
        ExtractConfig config = ExtractConfig.builder().parallelism(2).parallelThreshold(100).build();

        assertThat(config.isParallel(99)).isFalse();
        assertThat(config.isParallel(100)).isTrue();
        assertThat(ExtractConfig.DEFAULT.isParallel(1_000_000)).isFalse();
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void validation() {
        assertThatIllegalArgumentException()
            .isThrownBy(() -> ExtractConfig.builder().parallelism(0).build())
            .withMessageContaining("parallelism");
        assertThatIllegalArgumentException()
            .isThrownBy(() -> ExtractConfig.builder().parallelThreshold(0).build())
            .withMessageContaining("parallelThreshold");
        assertThatIllegalArgumentException()
            .isThrownBy(() -> ExtractConfig.builder().maxCachedPatterns(0).build())
            .withMessageContaining("maxCachedPatterns");
        assertThatNullPointerException()
            .isThrownBy(() -> ExtractConfig.builder().metricsRegistry(null));
    }

    @Test
    @DisplayName("Cache size is not checked when the cache is disabled")
    void disabledCache_sizeIgnored() {
        ExtractConfig config = ExtractConfig.builder().cacheEnabled(false).maxCachedPatterns(0).build();

        assertThat(config.cacheEnabled()).isFalse();
    }
}
