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

package com.axonops.regexpextract.engine;

import com.axonops.regexpextract.column.Column;
import com.axonops.regexpextract.column.DataType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A batch of named columns that all have the same number of rows.
 *
 * <p>Column order is preserved.
 *
 * @since 1.0.0
 */
public final class RecordBatch {

  private final Map<String, Column> columns;
  private final int rowCount;

  private RecordBatch(Map<String, Column> columns, int rowCount) {
    this.columns = columns;
    this.rowCount = rowCount;
  }

  /**
   * Creates a batch from parallel lists of names and columns.
   *
   * @param names column names (unique)
   * @param columns columns, all of the same length
   * @return the batch
   * @throws IllegalArgumentException on duplicate names, mismatched lengths or list sizes
   */
  public static RecordBatch of(List<String> names, List<? extends Column> columns) {
    Objects.requireNonNull(names, "names cannot be null");
    Objects.requireNonNull(columns, "columns cannot be null");
    if (names.size() != columns.size()) {
      throw new IllegalArgumentException(
          names.size() + " names given for " + columns.size() + " columns");
    }
    if (columns.isEmpty()) {
      return new RecordBatch(Collections.emptyMap(), 0);
    }

    int rowCount = columns.get(0).getPositionCount();
    Map<String, Column> byName = new LinkedHashMap<>();
    for (int i = 0; i < names.size(); i++) {
      String name = Objects.requireNonNull(names.get(i), "column name cannot be null");
      Column column = Objects.requireNonNull(columns.get(i), "column cannot be null");
      if (column.getPositionCount() != rowCount) {
        throw new IllegalArgumentException(
            "Column '"
                + name
                + "' has "
                + column.getPositionCount()
                + " rows, expected "
                + rowCount);
      }
      if (byName.putIfAbsent(name, column) != null) {
        throw new IllegalArgumentException("Duplicate column name: " + name);
      }
    }
    return new RecordBatch(Collections.unmodifiableMap(byName), rowCount);
  }

  /** Creates a single-column batch. */
  public static RecordBatch of(String name, Column column) {
    return of(List.of(name), List.of(column));
  }

  public int getRowCount() {
    return rowCount;
  }

  /**
   * Returns the named column.
   *
   * @throws IllegalArgumentException if there is no such column
   */
  public Column column(String name) {
    Column column = columns.get(name);
    if (column == null) {
      throw new IllegalArgumentException("No column named '" + name + "'; columns: " + columns.keySet());
    }
    return column;
  }

  public List<String> columnNames() {
    return new ArrayList<>(columns.keySet());
  }

  /** Returns column name to type, in column order. */
  public Map<String, DataType> schema() {
    Map<String, DataType> schema = new LinkedHashMap<>();
    columns.forEach((name, column) -> schema.put(name, column.getType()));
    return Collections.unmodifiableMap(schema);
  }

  @Override
  public String toString() {
    return "RecordBatch[rows=" + rowCount + ", columns=" + columns + "]";
  }
}
