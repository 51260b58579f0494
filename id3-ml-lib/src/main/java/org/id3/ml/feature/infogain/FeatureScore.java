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

package org.id3.ml.feature.infogain;

import java.io.Serializable;
import java.util.Objects;

/** The conditional entropy and information gain of one candidate feature, with its rank. */
public class FeatureScore implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String feature;
    private final double entropy;
    private final double infoGain;
    private final int rank;

    public FeatureScore(String feature, double entropy, double infoGain, int rank) {
        this.feature = feature;
        this.entropy = entropy;
        this.infoGain = infoGain;
        this.rank = rank;
    }

    public String getFeature() {
        return feature;
    }

    /** Weighted entropy of the label after splitting on the feature. */
    public double getEntropy() {
        return entropy;
    }

    /** Entropy of the label before the split minus {@link #getEntropy()}. */
    public double getInfoGain() {
        return infoGain;
    }

    /** Position in the ascending entropy order, 0 for the best feature. */
    public int getRank() {
        return rank;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FeatureScore that = (FeatureScore) o;
        return Double.compare(that.entropy, entropy) == 0
                && Double.compare(that.infoGain, infoGain) == 0
                && rank == that.rank
                && feature.equals(that.feature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(feature, entropy, infoGain, rank);
    }

    @Override
    public String toString() {
        return String.format(
                "%s -> entropy=%.4f, infoGain=%.4f, rank=%d", feature, entropy, infoGain, rank);
    }
}
