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

package com.axonops.regexpextract.column;

/**
 * Logical type of a column or scalar value.
 *
 * <p>Only the types the {@code regexp_extract} signature needs are modelled: UTF-8 text for the
 * input and pattern arguments and 64-bit integers for the group index.
 *
 * @since 1.0.0
 */
public enum DataType {
  /** UTF-8 encoded text, held as {@link String}. */
  UTF8,

  /** Signed 64-bit integer, held as {@link Long}. */
  INT64
}
