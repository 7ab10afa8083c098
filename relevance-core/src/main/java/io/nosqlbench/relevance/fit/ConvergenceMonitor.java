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

import java.util.Arrays;

/// Tracks the change of alpha between iterations and decides when the fit has settled.
///
/// The fit stops once the largest absolute change of any retained alpha is below the
/// tolerance, but never before [#WARM_UP_ITERATIONS] iterations have completed. The
/// previous alphas are pruned with the same masks as the current ones so that both
/// vectors always cover the same basis functions.
public final class ConvergenceMonitor {

    /// Iterations that must complete before convergence can be declared.
    public static final int WARM_UP_ITERATIONS = 2;

    private final double tolerance;
    private double[] alphaOld;
    private double lastDelta = Double.POSITIVE_INFINITY;

    /// @param tolerance stop threshold for the max absolute alpha change
    /// @param initialAlpha the alphas the fit starts from
    public ConvergenceMonitor(double tolerance, double[] initialAlpha) {
        this.tolerance = tolerance;
        this.alphaOld = initialAlpha.clone();
    }

    /// Applies a pruning mask to the previous alphas.
    public void retain(boolean[] keep) {
        if (keep.length != alphaOld.length) {
            throw new IllegalStateException(
                "Mask length " + keep.length + " does not match tracked alpha length " + alphaOld.length);
        }
        double[] kept = new double[alphaOld.length];
        int next = 0;
        for (int i = 0; i < keep.length; i++) {
            if (keep[i]) {
                kept[next++] = alphaOld[i];
            }
        }
        alphaOld = Arrays.copyOf(kept, next);
    }

    /// Compares the current alphas with the previous ones.
    ///
    /// When the fit has not converged, the current alphas become the previous ones.
    ///
    /// @param alpha the pruned alphas of this iteration
    /// @param iteration zero-based iteration index
    /// @return true if the fit should stop
    public boolean hasConverged(double[] alpha, int iteration) {
        lastDelta = maxAbsoluteChange(alpha, alphaOld);
        if (lastDelta < tolerance && iteration >= WARM_UP_ITERATIONS) {
            return true;
        }
        alphaOld = alpha.clone();
        return false;
    }

    /// Max absolute change from the last comparison, infinite before the first one.
    public double lastDelta() {
        return lastDelta;
    }

    static double maxAbsoluteChange(double[] current, double[] previous) {
        if (current.length != previous.length) {
            throw new IllegalStateException(
                "Cannot compare alpha of length " + current.length + " with previous length " + previous.length);
        }
        double delta = 0.0;
        for (int i = 0; i < current.length; i++) {
            // equal infinities count as no change
            double change = current[i] == previous[i] ? 0.0 : Math.abs(current[i] - previous[i]);
            if (Double.isNaN(change)) {
                return Double.POSITIVE_INFINITY;
            }
            delta = Math.max(delta, change);
        }
        return delta;
    }
}
