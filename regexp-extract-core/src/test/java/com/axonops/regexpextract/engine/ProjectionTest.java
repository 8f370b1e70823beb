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

import com.axonops.regexpextract.api.InvalidArgumentException;
import com.axonops.regexpextract.api.TypeMismatchException;
import com.axonops.regexpextract.column.Int64Column;
import com.axonops.regexpextract.column.StringColumn;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.axonops.regexpextract.engine.Expr.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for calling regexp_extract through a query projection.
 */
@DisplayName("Projection")
class ProjectionTest {

    private static StringColumn project(RecordBatch batch, Expr expr) {
        Projection projection = Projection.builder().add(expr, "out").build();
        return (StringColumn) projection.project(batch).column("out");
    }

    @Test
    @DisplayName("SELECT regexp_extract(text, '([a-z]+)-(\\d+)', 2)")
    void select_literalPatternAndIndex() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("alpha-10", "beta-20", "gamma-30"));

        StringColumn result = project(batch, call("regexp_extract", col("text"), lit("([a-z]+)-(\\d+)"), lit(2L)));

        assertThat(result.toList()).containsExactly("10", "20", "30");
    }

    @Test
    @DisplayName("Pattern taken from a column")
    void select_patternColumn() {
        RecordBatch batch = RecordBatch.of(
            List.of("text", "pattern"),
            List.of(
                StringColumn.of("100-200", "300-400", "no-match", "500-600"),
                StringColumn.of("(\\d+)-(\\d+)", "(\\d+)-(\\d+)", "(\\d+)-(\\d+)", "(\\d+)-(\\d+)")));

        StringColumn result = project(batch, call("regexp_extract", col("text"), col("pattern"), lit(1L)));

        assertThat(result.toList()).containsExactly("100", "300", "", "500");
    }

    @Test
    @DisplayName("Function name is matched case-insensitively")
    void select_upperCaseName() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("x=1"));

        StringColumn result = project(batch, call("REGEXP_EXTRACT", col("text"), lit("(\\w)=(\\d)"), lit(1L)));

        assertThat(result.toList()).containsExactly("x");
    }

    @Test
    @DisplayName("Several output columns, including a pass-through")
    void select_multipleOutputs() {
        RecordBatch batch = RecordBatch.of("email", StringColumn.of("ann@example.com", null, "bob@test.org"));

        Projection projection = Projection.builder()
            .add(col("email"), "email")
            .add(call("regexp_extract", col("email"), lit("([^@]+)@(.+)"), lit(1L)), "user")
            .add(call("regexp_extract", col("email"), lit("([^@]+)@(.+)"), lit(2L)), "domain")
            .registry(FunctionRegistry.withDefaults())
            .build();
        RecordBatch out = projection.project(batch);

        assertThat(out.columnNames()).containsExactly("email", "user", "domain");
        assertThat(((StringColumn) out.column("user")).toList()).containsExactly("ann", null, "bob");
        assertThat(((StringColumn) out.column("domain")).toList()).containsExactly("example.com", null, "test.org");
    }

    @Test
    @DisplayName("Literal output is broadcast to the batch length")
    void select_literal_broadcast() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("a", "b", "c"));

        StringColumn result = project(batch, lit("const"));

        assertThat(result.toList()).containsExactly("const", "const", "const");
    }

    @Test
    @DisplayName("Nested call uses the inner result as text")
    void select_nestedCall() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("id=ab12;", "id=cd34;"));

        Expr inner = call("regexp_extract", col("text"), lit("id=([a-z0-9]+);"), lit(1L));
        StringColumn result = project(batch, call("regexp_extract", inner, lit("(\\d+)"), lit(0L)));

        assertThat(result.toList()).containsExactly("12", "34");
    }

    @Test
    @DisplayName("Unknown function is an invalid argument")
    void unknownFunction_rejected() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("a"));

        assertThatThrownBy(() -> project(batch, call("regexp_substr", col("text"), lit("(a)"), lit(1L))))
            .isInstanceOf(InvalidArgumentException.class)
            .hasMessageContaining("unknown function 'regexp_substr'");
    }

    @Test
    @DisplayName("Wrong argument type is caught before invocation")
    void wrongArgumentType_rejected() {
        RecordBatch batch = RecordBatch.of("n", Int64Column.of(1L, 2L));

        assertThatThrownBy(() -> project(batch, call("regexp_extract", col("n"), lit("(\\d)"), lit(1L))))
            .isInstanceOf(TypeMismatchException.class)
            .hasMessageContaining("regexp_extract argument 1 must be UTF8 but was INT64");
    }

    @Test
    @DisplayName("Wrong argument count is caught before invocation")
    void wrongArity_rejected() {
        RecordBatch batch = RecordBatch.of("text", StringColumn.of("a"));

        assertThatThrownBy(() -> project(batch, call("regexp_extract", col("text"), lit("(a)"))))
            .isInstanceOf(InvalidArgumentException.class)
            .hasMessageContaining("expects 3 arguments but got 2");
    }
}
