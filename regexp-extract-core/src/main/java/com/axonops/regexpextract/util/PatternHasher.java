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

package com.axonops.regexpextract.util;

/**
 * Utility for identifying pattern strings in logs without logging them.
 *
 * <p>Patterns arrive from query text or from data columns and may carry sensitive content, so log
 * statements refer to a pattern by a short hash instead. The same pattern always gets the same
 * hash, which keeps log lines greppable.
 *
 * <p>Example: pattern {@code "(\\d+)-(\\d+)"} → hash {@code "5e2a1f0c"}
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern string for logging.
     *
     * @param pattern the regex pattern string
     * @return hex string, or {@code "null"} for a null pattern
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Truncates a pattern for inclusion in exception messages.
     *
     * @param pattern the regex pattern string
     * @return the pattern, cut to 100 characters with a trailing {@code "..."} if longer
     */
    public static String truncate(String pattern) {
        return pattern != null && pattern.length() > 100 ? pattern.substring(0, 97) + "..." : pattern;
    }
}
