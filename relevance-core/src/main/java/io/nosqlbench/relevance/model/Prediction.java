/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.relevance.model;

import java.util.Optional;

/// Predictive distribution at a set of inputs.
///
/// @param mean predicted target per sample
/// @param variance predictive variance per sample, or null when it was not requested
public record Prediction(double[] mean, double[] variance) {

    public int size() {
        return mean.length;
    }

    public boolean hasVariance() {
        return variance != null;
    }

    public Optional<double[]> varianceIfPresent() {
        return Optional.ofNullable(variance);
    }
}
