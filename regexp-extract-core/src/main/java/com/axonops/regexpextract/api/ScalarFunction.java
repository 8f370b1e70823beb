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
import com.axonops.regexpextract.column.DataType;
import java.util.List;

/**
 * A scalar function the host engine can register and invoke once per batch.
 *
 * <p>Implementations must be thread-safe: the host may invoke the same instance for different
 * batches concurrently.
 *
 * @since 1.0.0
 */
public interface ScalarFunction {

  /** Returns the name the function is registered and called under. */
  String name();

  /** Returns additional names the function may be called under. */
  default List<String> aliases() {
    return List.of();
  }

  /** Returns the declared argument signature. */
  Signature signature();

  /**
   * Returns the result type for a call with the given argument types.
   *
   * @param argumentTypes the argument types of the call
   * @return the result type
   */
  DataType returnType(List<DataType> argumentTypes);

  /**
   * Evaluates the function over one batch.
   *
   * @param args the arguments and batch row count
   * @return the result, one value per row
   * @throws RegexpExtractException if the invocation is aborted
   */
  ColumnarValue invoke(FunctionArgs args);
}
