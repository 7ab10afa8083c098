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

/// One retained basis function of a fitted model, as shown in a sparse model report.
///
/// @param label basis function label, or `bias` for the intercept
/// @param column index of the basis function in the matrix originally passed to the fit
/// @param weight posterior mean weight
/// @param stdDev posterior standard deviation of the weight, `sqrt(sigma_ii)`
/// @param alpha final precision hyperparameter
public record LabeledWeight(String label, int column, double weight, double stdDev, double alpha) {

    public boolean isBias() {
        return RelevanceSet.BIAS_LABEL.equals(label);
    }
}
