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

/**
 * Base exception for all errors raised while invoking {@code regexp_extract}.
 *
 * <p>Sealed class ensuring exhaustive handling of all error types. Every subtype aborts the whole
 * invocation; no partial column is ever returned. A row that simply does not match is not an
 * error and never produces one of these.
 *
 * @since 1.0.0
 */
public sealed class RegexpExtractException extends RuntimeException
    permits ExtractionInterruptedException,
        InvalidArgumentException,
        PatternCompilationException,
        TypeMismatchException {

    RegexpExtractException(String message) {
        super(message);
    }

    RegexpExtractException(String message, Throwable cause) {
        super(message, cause);
    }
}
