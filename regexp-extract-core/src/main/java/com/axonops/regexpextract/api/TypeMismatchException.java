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

import com.axonops.regexpextract.column.DataType;

/**
 * Thrown when an argument does not have the type the signature declares.
 *
 * <p>The host engine type-checks calls against {@link ScalarFunction#signature()}, so this only
 * surfaces when a caller bypasses that check; it is reported instead of miscasting the column.
 *
 * @since 1.0.0
 */
public final class TypeMismatchException extends RegexpExtractException {

    private final DataType expected;
    private final DataType actual;

    public TypeMismatchException(String argument, DataType expected, DataType actual) {
        super(
            "regexp_extract: Type mismatch: "
                + argument
                + " must be "
                + expected
                + " but was "
                + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public DataType getExpected() {
        return expected;
    }

    public DataType getActual() {
        return actual;
    }
}
