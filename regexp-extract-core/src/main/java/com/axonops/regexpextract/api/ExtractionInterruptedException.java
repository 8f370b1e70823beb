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
 * Thrown when the calling thread is interrupted while waiting for row ranges evaluated on worker
 * threads.
 *
 * <p>The thread's interrupt flag is restored before this is thrown.
 *
 * @since 1.0.0
 */
public final class ExtractionInterruptedException extends RegexpExtractException {

    public ExtractionInterruptedException(String message, InterruptedException cause) {
        super("regexp_extract: Interrupted: " + message, cause);
    }
}
