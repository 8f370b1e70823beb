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
import java.util.List;
import java.util.Objects;

/**
 * Fixed positional signature of a scalar function.
 *
 * @param argumentTypes the exact type of each argument, in order
 * @param volatility how the result depends on the inputs
 * @since 1.0.0
 */
public record Signature(List<DataType> argumentTypes, Volatility volatility) {

  public Signature {
    argumentTypes = List.copyOf(Objects.requireNonNull(argumentTypes, "argumentTypes cannot be null"));
    Objects.requireNonNull(volatility, "volatility cannot be null");
  }

  /**
   * Creates a signature that accepts exactly the given argument types.
   *
   * @param argumentTypes the argument types, in order
   * @param volatility the function's volatility
   * @return new signature
   */
  public static Signature exact(List<DataType> argumentTypes, Volatility volatility) {
    return new Signature(argumentTypes, volatility);
  }

  /** Returns the number of arguments. */
  public int arity() {
    return argumentTypes.size();
  }

  /**
   * Checks whether a call with the given argument types matches this signature.
   *
   * @param actualTypes the types of the call's arguments
   * @return true if arity and every type match
   */
  public boolean accepts(List<DataType> actualTypes) {
    return argumentTypes.equals(actualTypes);
  }
}
