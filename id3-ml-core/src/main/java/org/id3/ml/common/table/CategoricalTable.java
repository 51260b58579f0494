/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.id3.ml.common.table;

import org.id3.ml.common.exception.AmbiguousLabelException;
import org.id3.ml.common.exception.InvalidInputException;

import org.apache.flink.util.Preconditions;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable, column-oriented table of categorical values.
 *
 * <p>Columns keep their insertion order and all have the same number of rows. Every operation that
 * changes the shape of the table ({@link #filter}, {@link #withColumn}, {@link #withoutColumn})
 * returns a new instance and leaves this one untouched.
 */
public class CategoricalTable implements Serializable {
    private static final long serialVersionUID = 1L;

    private final LinkedHashMap<String, List<String>> columns;
    private final int numRows;

    private CategoricalTable(LinkedHashMap<String, List<String>> columns, int numRows) {
        this.columns = columns;
        this.numRows = numRows;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getNumRows() {
        return numRows;
    }

    public int getNumColumns() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns the values of a column in row order.
     *
     * @throws InvalidInputException if the table has no column with this name.
     */
    public List<String> getColumn(String name) {
        List<String> values = columns.get(name);
        if (values == null) {
            throw new InvalidInputException(
                    String.format(
                            "Column '%s' does not exist. Available columns: %s.",
                            name, columns.keySet()));
        }
        return Collections.unmodifiableList(values);
    }

    /** Returns the number of rows whose value in {@code column} equals {@code value}. */
    public long countOf(String column, String value) {
        long count = 0;
        for (String v : getColumn(column)) {
            if (v.equals(value)) {
                count++;
            }
        }
        return count;
    }

    /** Returns the number of rows per distinct value of a column, in first-seen order. */
    public LinkedHashMap<String, Long> valueCounts(String column) {
        LinkedHashMap<String, Long> counts = new LinkedHashMap<>();
        for (String v : getColumn(column)) {
            counts.merge(v, 1L, Long::sum);
        }
        return counts;
    }

    /** Returns the distinct values of a column, in first-seen order. */
    public List<String> distinctValues(String column) {
        return new ArrayList<>(valueCounts(column).keySet());
    }

    /** Returns the rows whose value in {@code column} equals {@code value}, in their original order. */
    public CategoricalTable filter(String column, String value) {
        List<String> key = getColumn(column);
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < numRows; i++) {
            if (key.get(i).equals(value)) {
                selected.add(i);
            }
        }

        LinkedHashMap<String, List<String>> filtered = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : columns.entrySet()) {
            List<String> source = entry.getValue();
            List<String> values = new ArrayList<>(selected.size());
            for (int index : selected) {
                values.add(source.get(index));
            }
            filtered.put(entry.getKey(), values);
        }
        return new CategoricalTable(filtered, selected.size());
    }

    /**
     * Returns a copy of this table with the label attached as a new column at {@code position}. Rows
     * are not reordered.
     *
     * @throws AmbiguousLabelException if a column with the label's name already exists.
     * @throws InvalidInputException if the label length differs from the row count or the position
     *     is out of range.
     */
    public CategoricalTable withColumn(int position, LabelColumn label) {
        Preconditions.checkNotNull(label);
        if (columns.containsKey(label.getName())) {
            throw new AmbiguousLabelException(label.getName());
        }
        if (position < 0 || position > columns.size()) {
            throw new InvalidInputException(
                    String.format(
                            "Cannot insert column at position %d of a table with %d columns.",
                            position, columns.size()));
        }
        if (!columns.isEmpty() && label.size() != numRows) {
            throw new InvalidInputException(
                    String.format(
                            "Label column '%s' has %d values but the table has %d rows.",
                            label.getName(), label.size(), numRows));
        }

        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
        int index = 0;
        for (Map.Entry<String, List<String>> entry : columns.entrySet()) {
            if (index++ == position) {
                copy.put(label.getName(), label.getValues());
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        if (position == columns.size()) {
            copy.put(label.getName(), label.getValues());
        }
        return new CategoricalTable(copy, label.size());
    }

    /** Returns a copy of this table without the named column, or this table if it has no such column. */
    public CategoricalTable withoutColumn(String name) {
        if (!columns.containsKey(name)) {
            return this;
        }
        LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return new CategoricalTable(copy, copy.isEmpty() ? 0 : numRows);
    }

    @Override
    public String toString() {
        return String.format("CategoricalTable{columns=%s, numRows=%d}", columns.keySet(), numRows);
    }

    /** Builder for {@link CategoricalTable}. Columns are kept in the order they are added. */
    public static class Builder {
        private final LinkedHashMap<String, List<String>> columns = new LinkedHashMap<>();

        private Builder() {}

        public Builder column(String name, String... values) {
            return column(name, Arrays.asList(values));
        }

        public Builder column(String name, List<String> values) {
            if (name == null) {
                throw new InvalidInputException("Column name must not be null.");
            }
            if (columns.containsKey(name)) {
                throw new InvalidInputException("Duplicate column '" + name + "'.");
            }
            Preconditions.checkNotNull(values);
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i) == null) {
                    throw new InvalidInputException(
                            String.format("Column '%s' has a null value at row %d.", name, i));
                }
            }
            columns.put(name, new ArrayList<>(values));
            return this;
        }

        public CategoricalTable build() {
            int numRows = -1;
            for (Map.Entry<String, List<String>> entry : columns.entrySet()) {
                int size = entry.getValue().size();
                if (numRows == -1) {
                    numRows = size;
                } else if (size != numRows) {
                    throw new InvalidInputException(
                            String.format(
                                    "Column '%s' has %d values while previous columns have %d.",
                                    entry.getKey(), size, numRows));
                }
            }
            return new CategoricalTable(new LinkedHashMap<>(columns), Math.max(numRows, 0));
        }
    }
}
