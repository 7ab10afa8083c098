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

package io.nosqlbench.relevance.fit;

import io.nosqlbench.relevance.model.FitState;

import java.util.List;

/// Removes basis functions whose precision implies a weight indistinguishable from zero.
///
/// A basis function is kept while `alpha_i < thresholdAlpha`. If that would remove
/// everything, the first basis function is kept, together with the bias column when
/// the bias is in use. Dropping the bias column clears the bias flag for the rest of
/// the fit.
///
/// The keep mask is applied to every per-basis-function quantity of the snapshot at
/// once (alpha, gamma, the posterior mean, rows and columns of the covariance, the
/// basis matrix columns and the relevance set), so their sizes always agree. Pruning
/// an already pruned snapshot with the same alphas changes nothing.
public final class Pruner {

    /// Result of a pruning pass.
    ///
    /// @param state the pruned snapshot, the input instance itself when nothing was removed
    /// @param keep the mask that was applied, one entry per position of the input
    /// @param removedLabels labels of the removed basis functions
    public record PruneResult(FitState state, boolean[] keep, List<String> removedLabels) {

        public boolean changed() {
            return !removedLabels.isEmpty();
        }
    }

    private final double thresholdAlpha;

    public Pruner(double thresholdAlpha) {
        this.thresholdAlpha = thresholdAlpha;
    }

    /// Computes the keep mask for a set of precisions.
    ///
    /// @param alpha current precisions
    /// @param biasUsed whether the last position is the bias column
    /// @return the keep mask, with at least one entry set
    public boolean[] keepMask(double[] alpha, boolean biasUsed) {
        boolean[] keep = new boolean[alpha.length];
        boolean any = false;
        for (int i = 0; i < alpha.length; i++) {
            keep[i] = alpha[i] < thresholdAlpha;
            any |= keep[i];
        }
        if (!any && alpha.length > 0) {
            keep[0] = true;
            if (biasUsed) {
                keep[alpha.length - 1] = true;
            }
        }
        return keep;
    }

    /// Prunes a snapshot.
    ///
    /// @param state the snapshot after the hyperparameter update
    /// @return the pruned snapshot with the applied mask and removed labels
    public PruneResult prune(FitState state) {
        boolean[] keep = keepMask(state.alpha(), state.relevance().biasUsed());
        List<String> removed = state.relevance().removedLabels(keep);
        if (removed.isEmpty()) {
            return new PruneResult(state, keep, List.of());
        }
        return new PruneResult(state.retain(keep), keep, List.copyOf(removed));
    }

    public double thresholdAlpha() {
        return thresholdAlpha;
    }
}
