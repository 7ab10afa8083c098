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

import io.nosqlbench.relevance.model.PosteriorState;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Re-estimates the precision hyperparameters from the current posterior.
///
/// ## Update rules
///
/// ```text
///   gamma_i = 1 - alpha_i * sigma_ii
///   alpha_i = gamma_i / m_i²
///   beta    = (n - Σ gamma) / ‖y - Phi m‖²       (unless beta is fixed)
/// ```
///
/// ## Guards
///
/// - `m_i == 0` yields `alpha_i = +∞`; the pruner removes it on the next pass.
/// - An alpha that is already infinite stays infinite with `gamma_i = 0`.
/// - Beta is left unchanged when the residual sum of squares is zero or when
///   `n - Σ gamma` is not positive.
public final class HyperparameterUpdater {

    private static final Logger logger = LogManager.getLogger(HyperparameterUpdater.class);

    /// Result of one hyperparameter update.
    ///
    /// @param alpha re-estimated precisions
    /// @param gamma well-determinedness factors used for the update
    /// @param beta re-estimated (or unchanged) noise precision
    public record HyperparameterUpdate(double[] alpha, double[] gamma, double beta) {}

    private final boolean betaFixed;

    public HyperparameterUpdater(boolean betaFixed) {
        this.betaFixed = betaFixed;
    }

    /// Computes new alpha, gamma and beta.
    ///
    /// @param alpha precisions the posterior was computed with
    /// @param beta noise precision the posterior was computed with
    /// @param posterior current posterior
    /// @param basis basis matrix of the retained columns
    /// @param target target vector
    /// @return the updated hyperparameters
    public HyperparameterUpdate update(double[] alpha, double beta, PosteriorState posterior,
                                       RealMatrix basis, RealVector target) {
        int k = alpha.length;
        if (posterior.dimension() != k) {
            throw new ShapeMismatchException("posterior dimension", k, posterior.dimension());
        }
        RealVector mean = posterior.mean();
        RealMatrix covariance = posterior.covariance();

        double[] gamma = new double[k];
        double[] nextAlpha = new double[k];
        for (int i = 0; i < k; i++) {
            if (Double.isInfinite(alpha[i])) {
                gamma[i] = 0.0;
                nextAlpha[i] = Double.POSITIVE_INFINITY;
                continue;
            }
            gamma[i] = 1.0 - alpha[i] * covariance.getEntry(i, i);
            double m = mean.getEntry(i);
            nextAlpha[i] = m == 0.0 ? Double.POSITIVE_INFINITY : gamma[i] / (m * m);
        }

        double nextBeta = betaFixed ? beta : reestimateBeta(beta, gamma, mean, basis, target);
        return new HyperparameterUpdate(nextAlpha, gamma, nextBeta);
    }

    private static double reestimateBeta(double beta, double[] gamma, RealVector mean,
                                         RealMatrix basis, RealVector target) {
        double gammaSum = 0.0;
        for (double g : gamma) {
            gammaSum += g;
        }
        double numerator = target.getDimension() - gammaSum;
        RealVector residual = target.subtract(basis.operate(mean));
        double residualSquares = residual.dotProduct(residual);

        if (residualSquares == 0.0 || !(numerator > 0.0) || !Double.isFinite(residualSquares)) {
            logger.debug("Keeping beta={} (n - Σgamma={}, residual sum of squares={})",
                beta, numerator, residualSquares);
            return beta;
        }
        return numerator / residualSquares;
    }
}
