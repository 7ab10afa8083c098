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
import io.nosqlbench.relevance.model.LabeledWeight;
import io.nosqlbench.relevance.model.Prediction;
import io.nosqlbench.relevance.model.RelevanceSet;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/// The frozen result of a fit: the retained basis functions and the posterior over
/// their weights.
///
/// ## Usage
///
/// ```java
/// FittedModel model = regressor.fit(basis, target, labels);
/// for (LabeledWeight w : model.weights()) {
///     System.out.printf("%s = %.4f%n", w.label(), w.weight());
/// }
/// Prediction p = model.predictFromFull(newBasis, true);
/// ```
///
/// Instances are immutable and safe to share between threads. The fields are plain
/// arrays so the model serializes directly with Gson, see
/// [io.nosqlbench.relevance.persist.ModelStore].
public final class FittedModel {

    private final double[] weights;
    private final double[][] covariance;
    private final double[] alpha;
    private final double[] gamma;
    private final double beta;
    private final RelevanceSet relevance;
    private final Double bias;
    private final int basisCount;
    private final int iterations;
    private final double lastDelta;
    private final FitPhase termination;
    private final transient SingularSystemException failure;

    private FittedModel(FitState state, int basisCount, int iterations, double lastDelta,
                        FitPhase termination, SingularSystemException failure) {
        if (!termination.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal phase: " + termination);
        }
        this.weights = state.posterior().mean().toArray();
        this.covariance = state.posterior().covariance().getData();
        this.alpha = state.alpha().clone();
        this.gamma = state.gamma().clone();
        this.beta = state.beta();
        this.relevance = state.relevance();
        this.bias = relevance.biasUsed() ? weights[weights.length - 1] : null;
        this.basisCount = basisCount;
        this.iterations = iterations;
        this.lastDelta = lastDelta;
        this.termination = termination;
        this.failure = failure;
    }

    /// Freezes the last valid snapshot of a fit.
    ///
    /// @param state last valid (pruned) snapshot
    /// @param basisCount column count of the matrix passed to the fit
    /// @param iterations number of iterations that completed
    /// @param lastDelta last max absolute alpha change
    /// @param termination why the iteration stopped
    /// @param failure the solver failure for [FitPhase#ABORTED], otherwise null
    static FittedModel freeze(FitState state, int basisCount, int iterations, double lastDelta,
                              FitPhase termination, SingularSystemException failure) {
        return new FittedModel(state, basisCount, iterations, lastDelta, termination, failure);
    }

    /// Predicts from a matrix holding only the retained basis functions.
    public Prediction predict(RealMatrix basis, boolean returnVariance) {
        return new PredictiveEngine(this).predict(basis, returnVariance);
    }

    /// Predicts from a matrix with every originally fitted column.
    public Prediction predictFromFull(RealMatrix fullBasis, boolean returnVariance) {
        return new PredictiveEngine(this).predictFromFull(fullBasis, returnVariance);
    }

    /// Coefficient of determination on a matrix of the retained basis functions.
    public double score(RealMatrix basis, RealVector target) {
        return new PredictiveEngine(this).score(basis, target);
    }

    /// Coefficient of determination on a matrix with every originally fitted column.
    public double scoreFromFull(RealMatrix fullBasis, RealVector target) {
        return new PredictiveEngine(this).scoreFromFull(fullBasis, target);
    }

    /// Retained basis functions with their weights, in relevance set order.
    ///
    /// The bias, when still in use, is the last entry and labelled `bias`.
    public List<LabeledWeight> weights() {
        int[] columns = relevance.columns();
        List<LabeledWeight> labeled = new ArrayList<>(weights.length);
        for (int i = 0; i < weights.length; i++) {
            labeled.add(new LabeledWeight(
                relevance.labelAt(i),
                columns[i],
                weights[i],
                Math.sqrt(Math.max(0.0, covariance[i][i])),
                alpha[i]));
        }
        return Collections.unmodifiableList(labeled);
    }

    /// Weight of a retained basis function by label.
    public OptionalDouble weight(String label) {
        for (LabeledWeight w : weights()) {
            if (w.label().equals(label)) {
                return OptionalDouble.of(w.weight());
            }
        }
        return OptionalDouble.empty();
    }

    public RealVector mean() {
        return new ArrayRealVector(weights);
    }

    public RealMatrix covariance() {
        return new Array2DRowRealMatrix(covariance);
    }

    public double[] alpha() {
        return alpha.clone();
    }

    public double[] gamma() {
        return gamma.clone();
    }

    public double beta() {
        return beta;
    }

    /// Intercept weight, present only when the bias column survived pruning.
    public OptionalDouble bias() {
        return bias == null ? OptionalDouble.empty() : OptionalDouble.of(bias);
    }

    public RelevanceSet relevance() {
        return relevance;
    }

    public int relevanceVectorCount() {
        return weights.length;
    }

    /// Column count of the basis matrix the model was fitted on.
    public int basisCount() {
        return basisCount;
    }

    public int iterations() {
        return iterations;
    }

    public double lastDelta() {
        return lastDelta;
    }

    public FitPhase termination() {
        return termination;
    }

    public boolean converged() {
        return termination == FitPhase.CONVERGED;
    }

    /// The solver failure that aborted the fit, if any.
    public Optional<SingularSystemException> failure() {
        return Optional.ofNullable(failure);
    }

    /// Verifies a model that was not produced by a fit, such as one read back from a
    /// model file, so that prediction cannot fail on missing or mis-sized arrays.
    ///
    /// @throws IllegalStateException if a field is missing or the sizes disagree
    public void checkIntegrity() {
        if (relevance == null || termination == null) {
            throw new IllegalStateException("model is missing its relevance set or termination");
        }
        if (!termination.isTerminal()) {
            throw new IllegalStateException("termination " + termination + " is not a terminal phase");
        }
        if (weights == null || covariance == null || alpha == null || gamma == null) {
            throw new IllegalStateException("model is missing its weights, covariance, alpha or gamma");
        }
        relevance.checkIntegrity(basisCount);
        int size = relevance.size();
        if (size == 0) {
            throw new IllegalStateException("model retains no basis functions");
        }
        requireLength("weights", weights.length, size);
        requireLength("alpha", alpha.length, size);
        requireLength("gamma", gamma.length, size);
        requireLength("covariance rows", covariance.length, size);
        for (int i = 0; i < size; i++) {
            if (covariance[i] == null) {
                throw new IllegalStateException("covariance row " + i + " is missing");
            }
            requireLength("covariance row " + i, covariance[i].length, size);
        }
        if (!(beta > 0.0)) {
            throw new IllegalStateException("beta must be positive, got " + beta);
        }
        if (relevance.biasUsed() != (bias != null)) {
            throw new IllegalStateException("bias weight does not match the relevance set's bias flag");
        }
    }

    private static void requireLength(String name, int actual, int expected) {
        if (actual != expected) {
            throw new IllegalStateException(name + " has " + actual + " entries, expected " + expected);
        }
    }

    @Override
    public String toString() {
        return String.format("FittedModel{termination=%s, iterations=%d, relevanceVectors=%d, beta=%.5g, bias=%s}",
            termination, iterations, weights.length, beta, bias);
    }
}
