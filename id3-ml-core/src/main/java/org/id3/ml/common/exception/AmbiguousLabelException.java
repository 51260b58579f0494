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

package org.id3.ml.common.exception;

/**
 * Thrown when the name of a label column collides with a column that already exists in the table,
 * so attaching the label would overwrite a feature.
 */
public class AmbiguousLabelException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final String labelName;

    public AmbiguousLabelException(String labelName) {
        super(
                String.format(
                        "Label column '%s' collides with an existing column of the table.",
                        labelName));
        this.labelName = labelName;
    }

    /** Returns the name shared by the label and the existing column. */
    public String getLabelName() {
        return labelName;
    }
}
