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

import org.id3.ml.common.exception.InvalidInputException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A named sequence of categorical label values, aligned by row position with a {@link
 * CategoricalTable}. The name becomes the column name when the label is attached to a table.
 */
public class LabelColumn implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final List<String> values;

    public LabelColumn(String name, List<String> values) {
        if (name == null) {
            throw new InvalidInputException("Label column name must not be null.");
        }
        if (values == null) {
            throw new InvalidInputException("Label column '" + name + "' has no values.");
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new InvalidInputException(
                        String.format("Label column '%s' has a null value at row %d.", name, i));
            }
        }
        this.name = name;
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static LabelColumn of(String name, String... values) {
        return new LabelColumn(name, Arrays.asList(values));
    }

    public String getName() {
        return name;
    }

    public List<String> getValues() {
        return values;
    }

    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return String.format("LabelColumn{name=%s, size=%d}", name, values.size());
    }
}
