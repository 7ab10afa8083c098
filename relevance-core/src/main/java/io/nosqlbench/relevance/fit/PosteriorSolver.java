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
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Computes the Gaussian posterior over the regression weights.
///
/// ## Computation
///
/// ```text
///   A     = diag(alpha) + beta * PhiᵗPhi      posterior precision
///   sigma = A⁻¹                               posterior covariance
///   m     = beta * sigma * Phiᵗy              posterior mean
/// ```
///
/// `A` is inverted through a Cholesky decomposition. When the decomposition rejects
/// `A` (not positive definite, typically from near-duplicate basis functions) the
/// solver can fall back to the Moore-Penrose pseudo-inverse from a singular value
/// decomposition. If neither yields a finite inverse a [SingularSystemException] is
/// thrown; NaN results are never returned.
///
/// A basis function whose alpha is infinite has its weight pinned at zero: it gets a
/// zero mean and zero (co)variance, and the system is solved over the remaining
/// basis functions only.
///
/// Instances hold no per-fit state and can be reused.
public final class PosteriorSolver {

    private static final Logger logger = LogManager.getLogger(PosteriorSolver.class);

    /// Relative tolerance for the Cholesky symmetry check.
    static final double SYMMETRY_TOLERANCE = 1e-12;

    /// Pivots below this fraction of the largest diagonal entry are treated as zero.
    static final double RELATIVE_PIVOT_TOLERANCE = 1e-13;

    private final boolean pseudoInverseFallback;

    public PosteriorSolver(boolean pseudoInverseFallback) {
        this.pseudoInverseFallback = pseudoInverseFallback;
    }

    /// Solves for the posterior given the current hyperparameters.
    ///
    /// @param alpha per-basis-function precisions, positive or infinite
    /// @param beta noise precision, positive
    /// @param basis basis matrix of the retained columns, n x k
    /// @param target target vector, n
    /// @return the posterior mean and covariance
    /// @throws SingularSystemException if the posterior precision cannot be inverted
    public PosteriorState solve(double[] alpha, double beta, RealMatrix basis, RealVector target) {
        int k = alpha.length;
        if (basis.getColumnDimension() != k) {
            throw new ShapeMismatchException("basis columns", k, basis.getColumnDimension());
        }
        if (basis.getRowDimension() != target.getDimension()) {
            throw new ShapeMismatchException("target length", basis.getRowDimension(), target.getDimension());
        }

        int[] active = finitePositions(alpha);
        RealVector mean = new ArrayRealVector(k);
        RealMatrix covariance = new Array2DRowRealMatrix(k, k);
        if (active.length == 0) {
            return new PosteriorState(mean, covariance);
        }

        RealMatrix activeBasis = active.length == k ? basis : selectColumns(basis, active);
        RealMatrix precision = activeBasis.transpose().multiply(activeBasis).scalarMultiply(beta);
        for (int i = 0; i < active.length; i++) {
            precision.addToEntry(i, i, alpha[active[i]]);
        }

        RealMatrix activeCovariance = symmetrize(invert(precision));
        RealVector activeMean = activeCovariance.operate(activeBasis.transpose().operate(target)).mapMultiply(beta);
        if (!isFinite(activeMean)) {
            throw new SingularSystemException(active.length, "posterior mean is not finite");
        }

        for (int i = 0; i < active.length; i++) {
            mean.setEntry(active[i], activeMean.getEntry(i));
            for (int j = 0; j < active.length; j++) {
                covariance.setEntry(active[i], active[j], activeCovariance.getEntry(i, j));
            }
        }
        return new PosteriorState(mean, covariance);
    }

    private RealMatrix invert(RealMatrix precision) {
        int k = precision.getRowDimension();
        if (!isFinite(precision)) {
            throw new SingularSystemException(k, "precision matrix has non-finite entries");
        }
        try {
            double pivotTolerance = maxDiagonal(precision) * RELATIVE_PIVOT_TOLERANCE;
            RealMatrix inverse = new CholeskyDecomposition(precision, SYMMETRY_TOLERANCE, pivotTolerance)
                .getSolver()
                .getInverse();
            if (isFinite(inverse)) {
                return inverse;
            }
            if (!pseudoInverseFallback) {
                throw new SingularSystemException(k, "Cholesky inverse is not finite");
            }
            logger.warn("Cholesky inverse of {}x{} posterior precision is not finite, using pseudo-inverse", k, k);
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            if (!pseudoInverseFallback) {
                throw new SingularSystemException(k, e.getMessage(), e);
            }
            logger.warn("Cholesky decomposition of {}x{} posterior precision failed ({}), using pseudo-inverse",
                k, k, e.getMessage());
        }
        return pseudoInverse(precision);
    }

    private RealMatrix pseudoInverse(RealMatrix precision) {
        int k = precision.getRowDimension();
        try {
            SingularValueDecomposition svd = new SingularValueDecomposition(precision);
            if (svd.getRank() == 0) {
                throw new SingularSystemException(k, "precision matrix has rank 0");
            }
            RealMatrix inverse = svd.getSolver().getInverse();
            if (!isFinite(inverse)) {
                throw new SingularSystemException(k, "pseudo-inverse is not finite");
            }
            logger.debug("Pseudo-inverse of {}x{} posterior precision has rank {}", k, k, svd.getRank());
            return inverse;
        } catch (MathIllegalArgumentException e) {
            throw new SingularSystemException(k, "singular value decomposition failed: " + e.getMessage(), e);
        }
    }

    static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5);
    }

    static RealMatrix selectColumns(RealMatrix matrix, int[] columns) {
        int[] rows = new int[matrix.getRowDimension()];
        for (int r = 0; r < rows.length; r++) {
            rows[r] = r;
        }
        return matrix.getSubMatrix(rows, columns);
    }

    private static int[] finitePositions(double[] alpha) {
        int count = 0;
        for (double a : alpha) {
            if (!Double.isInfinite(a)) {
                count++;
            }
        }
        int[] positions = new int[count];
        int next = 0;
        for (int i = 0; i < alpha.length; i++) {
            if (!Double.isInfinite(alpha[i])) {
                positions[next++] = i;
            }
        }
        return positions;
    }

    private static double maxDiagonal(RealMatrix matrix) {
        double max = 0.0;
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            max = Math.max(max, Math.abs(matrix.getEntry(i, i)));
        }
        return max;
    }

    private static boolean isFinite(RealMatrix matrix) {
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                if (!Double.isFinite(matrix.getEntry(i, j))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean isFinite(RealVector vector) {
        for (int i = 0; i < vector.getDimension(); i++) {
            if (!Double.isFinite(vector.getEntry(i))) {
                return false;
            }
        }
        return true;
    }
}
