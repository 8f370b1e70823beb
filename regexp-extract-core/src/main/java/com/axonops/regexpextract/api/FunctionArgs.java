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
import java.util.List;
import java.util.Objects;

/**
 * Arguments of one batch invocation: the argument values and the batch row count.
 *
 * <p>The row count is carried separately because every argument may be a scalar, in which case it
 * cannot be derived from the arguments.
 *
 * @param args the argument values, in signature order
 * @param numRows the batch row count N (must be non-negative)
 * @since 1.0.0
 */
public record FunctionArgs(List<ColumnarValue> args, int numRows) {

  public FunctionArgs {
    Objects.requireNonNull(args, "args cannot be null");
    args = List.copyOf(args);
    if (numRows < 0) {
      throw new IllegalArgumentException("numRows must be non-negative: " + numRows);
    }
  }

  public static FunctionArgs of(int numRows, ColumnarValue... args) {
    return new FunctionArgs(List.of(args), numRows);
  }

  public int size() {
    return args.size();
  }

  public ColumnarValue get(int index) {
    return args.get(index);
  }
}
