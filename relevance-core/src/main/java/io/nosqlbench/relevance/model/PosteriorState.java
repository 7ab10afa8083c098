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

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// Gaussian posterior over the regression weights of the retained basis functions.
///
/// @param mean posterior mean `m`, one entry per retained basis function
/// @param covariance posterior covariance `sigma`, square and symmetric
public record PosteriorState(RealVector mean, RealMatrix covariance) {

    public PosteriorState {
        if (covariance.getRowDimension() != mean.getDimension()
            || covariance.getColumnDimension() != mean.getDimension()) {
            throw new IllegalArgumentException("Covariance " + covariance.getRowDimension() + "x"
                + covariance.getColumnDimension() + " does not match mean length " + mean.getDimension());
        }
    }

    public int dimension() {
        return mean.getDimension();
    }

    /// Returns the posterior restricted to the kept positions.
    ///
    /// The same index selection is applied to the rows and the columns of the
    /// covariance, so the result stays symmetric.
    ///
    /// @param kept non-empty, ascending positions to keep
    /// @return the restricted posterior
    public PosteriorState retain(int[] kept) {
        RealVector selected = new ArrayRealVector(kept.length);
        for (int i = 0; i < kept.length; i++) {
            selected.setEntry(i, mean.getEntry(kept[i]));
        }
        return new PosteriorState(selected, covariance.getSubMatrix(kept, kept));
    }
}
