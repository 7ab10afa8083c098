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

package io.nosqlbench.relevance.trace;

import io.nosqlbench.relevance.model.FitState;

import java.util.Arrays;

/// Structured diagnostic event describing the fit after a hyperparameter update.
///
/// @param iteration zero-based iteration index
/// @param alpha re-estimated precisions
/// @param beta noise precision
/// @param gamma well-determinedness factors
/// @param mean posterior mean weights
/// @param relevanceVectors number of basis functions retained at that point
public record FitDiagnostic(
    int iteration,
    double[] alpha,
    double beta,
    double[] gamma,
    double[] mean,
    int relevanceVectors
) {

    /// Captures a diagnostic from a snapshot; arrays are copied.
    public static FitDiagnostic of(FitState state) {
        return new FitDiagnostic(
            state.iteration(),
            state.alpha().clone(),
            state.beta(),
            state.gamma().clone(),
            state.posterior().mean().toArray(),
            state.size()
        );
    }

    @Override
    public String toString() {
        return "FitDiagnostic{iteration=" + iteration
            + ", alpha=" + Arrays.toString(alpha)
            + ", beta=" + beta
            + ", gamma=" + Arrays.toString(gamma)
            + ", mean=" + Arrays.toString(mean)
            + ", relevanceVectors=" + relevanceVectors + "}";
    }
}
