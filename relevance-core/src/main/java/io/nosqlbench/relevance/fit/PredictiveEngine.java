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

import io.nosqlbench.relevance.model.Prediction;
import io.nosqlbench.relevance.model.RelevanceSet;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// Applies a fitted posterior to new inputs.
///
/// ```text
///   mean_j     = Phi'_j · m
///   variance_j = 1/beta + Phi'_j · sigma · Phi'_jᵗ
/// ```
///
/// `Phi'` must hold exactly the retained basis functions, in the order of the
/// relevance set. [#predictFromFull(RealMatrix, boolean)] accepts a matrix with all
/// of the originally fitted columns and selects the retained ones itself.
public final class PredictiveEngine {

    private final RealVector mean;
    private final RealMatrix covariance;
    private final double beta;
    private final RelevanceSet relevance;
    private final int basisCount;

    public PredictiveEngine(FittedModel model) {
        this.mean = model.mean();
        this.covariance = model.covariance();
        this.beta = model.beta();
        this.relevance = model.relevance();
        this.basisCount = model.basisCount();
    }

    /// Predicts from a matrix holding only the retained basis functions.
    ///
    /// @param basis n' x k matrix, k the number of relevance vectors
    /// @param returnVariance whether to compute the predictive variance
    /// @return the predictions
    /// @throws ShapeMismatchException if the column count differs from k
    public Prediction predict(RealMatrix basis, boolean returnVariance) {
        if (basis.getColumnDimension() != mean.getDimension()) {
            throw new ShapeMismatchException("relevance vector columns", mean.getDimension(),
                basis.getColumnDimension());
        }
        double[] predicted = basis.operate(mean).toArray();
        if (!returnVariance) {
            return new Prediction(predicted, null);
        }
        double noise = 1.0 / beta;
        double[] variance = new double[basis.getRowDimension()];
        for (int row = 0; row < variance.length; row++) {
            RealVector x = basis.getRowVector(row);
            variance[row] = noise + x.dotProduct(covariance.operate(x));
        }
        return new Prediction(predicted, variance);
    }

    /// Predicts from a matrix with every originally fitted column.
    ///
    /// @param fullBasis n' x K matrix, K the column count passed to the fit
    /// @param returnVariance whether to compute the predictive variance
    /// @return the predictions
    /// @throws ShapeMismatchException if the column count differs from K
    public Prediction predictFromFull(RealMatrix fullBasis, boolean returnVariance) {
        if (fullBasis.getColumnDimension() != basisCount) {
            throw new ShapeMismatchException("basis columns", basisCount, fullBasis.getColumnDimension());
        }
        return predict(PosteriorSolver.selectColumns(fullBasis, relevance.columns()), returnVariance);
    }

    /// Coefficient of determination on a matrix with every originally fitted column.
    ///
    /// @see #score(RealMatrix, RealVector)
    public double scoreFromFull(RealMatrix fullBasis, RealVector target) {
        if (fullBasis.getColumnDimension() != basisCount) {
            throw new ShapeMismatchException("basis columns", basisCount, fullBasis.getColumnDimension());
        }
        return score(PosteriorSolver.selectColumns(fullBasis, relevance.columns()), target);
    }

    /// Coefficient of determination of the mean predictions.
    ///
    /// A constant target gives 1.0 for a perfect prediction and 0.0 otherwise.
    ///
    /// @param basis matrix of the retained basis functions
    /// @param target observed targets
    /// @return R², at most 1.0
    public double score(RealMatrix basis, RealVector target) {
        if (basis.getRowDimension() != target.getDimension()) {
            throw new ShapeMismatchException("target length", basis.getRowDimension(), target.getDimension());
        }
        if (target.getDimension() == 0) {
            throw new IllegalArgumentException("Cannot score an empty sample");
        }
        double[] predicted = predict(basis, false).mean();
        double targetMean = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            targetMean += target.getEntry(i);
        }
        targetMean /= predicted.length;

        double residual = 0.0;
        double total = 0.0;
        for (int i = 0; i < predicted.length; i++) {
            double y = target.getEntry(i);
            residual += (y - predicted[i]) * (y - predicted[i]);
            total += (y - targetMean) * (y - targetMean);
        }
        if (total == 0.0) {
            return residual == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - residual / total;
    }
}
