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

import com.axonops.regexpextract.util.PatternHasher;

/**
 * Thrown when a row's pattern fails to compile as a regular expression, or is null.
 *
 * @since 1.0.0
 */
public final class PatternCompilationException extends RegexpExtractException {

    private final String pattern;

    public PatternCompilationException(String pattern, String message) {
        super(
            "regexp_extract: Pattern compilation failed: "
                + message
                + " (pattern: "
                + PatternHasher.truncate(pattern)
                + ")");
        this.pattern = pattern;
    }

    public PatternCompilationException(String pattern, String message, Throwable cause) {
        super(
            "regexp_extract: Pattern compilation failed: "
                + message
                + " (pattern: "
                + PatternHasher.truncate(pattern)
                + ")",
            cause);
        this.pattern = pattern;
    }

    /** Returns the pattern that failed, or null if the pattern itself was null. */
    public String getPattern() {
        return pattern;
    }
}
