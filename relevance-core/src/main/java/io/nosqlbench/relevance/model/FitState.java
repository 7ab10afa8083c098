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

import org.apache.commons.math3.linear.RealMatrix;

/// Immutable snapshot of the fit at one iteration boundary.
///
/// Each stage of an iteration produces a new snapshot instead of mutating the previous
/// one, so the posterior, hyperparameters and retained basis functions always describe
/// the same set of columns.
///
/// @param iteration zero-based iteration that produced this snapshot
/// @param alpha per-basis-function precision hyperparameters
/// @param beta noise precision
/// @param gamma per-basis-function well-determinedness, `1 - alpha_i * sigma_ii`
/// @param posterior posterior over the weights of the retained basis functions
/// @param relevance the retained basis functions
/// @param basis the basis matrix restricted to the retained columns
public record FitState(
    int iteration,
    double[] alpha,
    double beta,
    double[] gamma,
    PosteriorState posterior,
    RelevanceSet relevance,
    RealMatrix basis
) {

    public FitState {
        int k = relevance.size();
        if (alpha.length != k || gamma.length != k || posterior.dimension() != k || basis.getColumnDimension() != k) {
            throw new IllegalStateException(String.format(
                "Inconsistent fit state: alpha=%d gamma=%d posterior=%d basis columns=%d relevance=%d",
                alpha.length, gamma.length, posterior.dimension(), basis.getColumnDimension(), k));
        }
    }

    /// Number of retained basis functions.
    public int size() {
        return relevance.size();
    }

    /// Returns the snapshot restricted to the kept positions.
    ///
    /// @param keep one entry per current position, at least one true
    /// @return a new snapshot holding only the kept basis functions
    public FitState retain(boolean[] keep) {
        int[] kept = keptPositions(keep);
        double[] keptAlpha = new double[kept.length];
        double[] keptGamma = new double[kept.length];
        for (int i = 0; i < kept.length; i++) {
            keptAlpha[i] = alpha[kept[i]];
            keptGamma[i] = gamma[kept[i]];
        }
        int[] rows = new int[basis.getRowDimension()];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = r;
        }
        return new FitState(
            iteration,
            keptAlpha,
            beta,
            keptGamma,
            posterior.retain(kept),
            relevance.retain(keep),
            basis.getSubMatrix(rows, kept)
        );
    }

    /// Converts a keep mask into ascending kept positions.
    public static int[] keptPositions(boolean[] keep) {
        int count = 0;
        for (boolean k : keep) {
            if (k) {
                count++;
            }
        }
        int[] kept = new int[count];
        int next = 0;
        for (int i = 0; i < keep.length; i++) {
            if (keep[i]) {
                kept[next++] = i;
            }
        }
        return kept;
    }
}
