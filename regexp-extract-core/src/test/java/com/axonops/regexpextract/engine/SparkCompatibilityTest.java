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

package com.axonops.regexpextract.engine;

import com.axonops.regexpextract.column.StringColumn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.axonops.regexpextract.engine.Expr.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Results that must agree with Spark SQL's {@code regexp_extract}.
 */
@DisplayName("Spark Compatibility")
class SparkCompatibilityTest {

    private static StringColumn select(StringColumn text, String pattern, long index) {
        RecordBatch batch = RecordBatch.of("text", text);
        Projection projection = Projection.builder()
            .add(call("regexp_extract", col("text"), lit(pattern), lit(index)), "result")
            .build();
        return (StringColumn) projection.project(batch).column("result");
    }

    @Test
    @DisplayName("No match returns empty string")
    void noMatch_returnsEmptyString() {
        assertThat(select(StringColumn.of("abc"), "(\\d+)", 1).toList()).containsExactly("");
    }

    @Test
    @DisplayName("Null input propagates null")
    void nullInput_propagatesNull() {
        assertThat(select(StringColumn.of((String) null), "(\\w+)", 1).toList()).containsExactly((String) null);
    }

    @Test
    @DisplayName("Index out of bounds returns empty string")
    void indexOutOfBounds_returnsEmptyString() {
        assertThat(select(StringColumn.of("a-b"), "(a)-(b)", 3).toList()).containsExactly("");
    }

    @Test
    @DisplayName("Pattern without capture group returns empty string for group 1")
    void noCaptureGroup_returnsEmptyString() {
        assertThat(select(StringColumn.of("abc"), "a.c", 1).toList()).containsExactly("");
    }

    @Test
    @DisplayName("Group 0 returns the whole match")
    void groupZero_wholeMatch() {
        assertThat(select(StringColumn.of("xx100-200yy"), "(\\d+)-(\\d+)", 0).toList()).containsExactly("100-200");
    }
}
