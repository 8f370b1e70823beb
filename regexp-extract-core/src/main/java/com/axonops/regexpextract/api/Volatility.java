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
 * How a function's result depends on its inputs, which tells the host what it may fold or cache.
 *
 * @since 1.0.0
 */
public enum Volatility {
  /** Same inputs always give the same output; safe to constant-fold and cache. */
  IMMUTABLE,

  /** Same output for the same inputs within one query. */
  STABLE,

  /** Output may change on every call. */
  VOLATILE
}
