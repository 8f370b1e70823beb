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

package com.axonops.regexpextract.api;

import com.axonops.regexpextract.column.ColumnarValue;
import com.axonops.regexpextract.column.StringColumn;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.axonops.regexpextract.test.TestUtils.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests that scalar arguments behave exactly like columns of repeated values.
 */
@DisplayName("Broadcasting")
class BroadcastingTest {

    private static final String[] TEXT = {"100-200", null, "300-400", "no digits"};
    private static final String PATTERN = "(\\d+)-(\\d+)";

    private RegexpExtract fn;

    @BeforeEach
    void setup() {
        fn = new RegexpExtract();
    }

    @AfterEach
    void cleanup() {
        fn.close();
    }

    @Test
    @DisplayName("Scalar pattern equals a column of the same pattern")
    void scalarPattern_equalsRepeatedColumn() {
        StringColumn broadcast = extract(fn, column(TEXT), scalar(PATTERN), 2);
        StringColumn materialized = extract(fn, column(TEXT),
            ColumnarValue.of(StringColumn.repeat(PATTERN, TEXT.length)), 2);

        assertThat(broadcast).isEqualTo(materialized);
        assertThat(broadcast.toList()).containsExactly("200", null, "400", "");
    }

    @Test
    @DisplayName("Scalar text equals a column of the same text")
    void scalarText_equalsRepeatedColumn() {
        ColumnarValue patterns = column("(\\d+)", "([a-z]+)", "(x)", "(\\d+)-(\\d+)");

        StringColumn broadcast = extract(fn, 4, scalar("abc-123"), patterns, 1);
        StringColumn materialized = extract(fn, 4, ColumnarValue.of(StringColumn.repeat("abc-123", 4)), patterns, 1);

        assertThat(broadcast).isEqualTo(materialized);
        assertThat(broadcast.toList()).containsExactly("123", "abc", "", "123");
    }

    @Test
    @DisplayName("Both text and pattern scalar gives N identical rows")
    void bothScalar_repeatedResult() {
        StringColumn result = extract(fn, 5, scalar("key=value"), scalar("(\\w+)=(\\w+)"), 1);

        assertThat(result.toList()).hasSize(5).containsOnly("key");
    }

    @Test
    @DisplayName("Null scalar text gives N null rows without looking at the pattern")
    void nullScalarText_allNull() {
        StringColumn result = extract(fn, 3, scalar(null), scalar("(broken"), 1);

        assertThat(result.getPositionCount()).isEqualTo(3);
        assertThat(result.nullCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Null scalar pattern fails on the first non-null row")
    void nullScalarPattern_fails() {
        assertThatThrownBy(() -> extract(fn, column("a", "b"), scalar(null), 0))
            .isInstanceOf(PatternCompilationException.class)
            .hasMessageContaining("pattern is null");
    }

    @Test
    @DisplayName("Null pattern on a null-text row is never looked at")
    void nullPatternOnNullText_ignored() {
        StringColumn result = extract(fn, column(null, "x1"), column(null, "(\\d)"), 1);

        assertThat(result.toList()).containsExactly(null, "1");
    }

    @Test
    @DisplayName("Scalar over zero rows gives an empty column")
    void scalar_zeroRows() {
        StringColumn result = extract(fn, 0, scalar("abc"), scalar("(b)"), 1);

        assertThat(result.getPositionCount()).isZero();
    }
}
