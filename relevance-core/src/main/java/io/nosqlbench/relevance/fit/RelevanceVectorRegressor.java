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

import io.nosqlbench.relevance.fit.HyperparameterUpdater.HyperparameterUpdate;
import io.nosqlbench.relevance.fit.Pruner.PruneResult;
import io.nosqlbench.relevance.model.FitState;
import io.nosqlbench.relevance.model.PosteriorState;
import io.nosqlbench.relevance.model.Prediction;
import io.nosqlbench.relevance.model.RelevanceSet;
import io.nosqlbench.relevance.trace.FitDiagnostic;
import io.nosqlbench.relevance.trace.FitObserver;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/// Relevance vector regression: sparse Bayesian linear regression over a matrix of
/// evaluated basis functions.
///
/// ## Algorithm
///
/// Each iteration runs the evidence-approximation fixed point:
///
/// ```text
///   ┌──────────────────┐   ┌──────────────────────┐   ┌────────────┐   ┌────────┐   ┌─────────────┐
///   │ PosteriorSolver  │──►│ HyperparameterUpdater│──►│ diagnostic │──►│ Pruner │──►│ Convergence │
///   │ sigma, m         │   │ alpha, gamma, beta   │   │ (verbFreq) │   │        │   │ Monitor     │
///   └──────────────────┘   └──────────────────────┘   └────────────┘   └────────┘   └─────────────┘
/// ```
///
/// until the largest alpha change drops below the tolerance (after at least two
/// iterations) or the iteration budget runs out. Every stage produces a fresh
/// [FitState] snapshot; the last valid one becomes the [FittedModel].
///
/// ## Usage
///
/// ```java
/// RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(
///     RegressorConfig.builder().biasUsed(true).build(),
///     new LoggingFitObserver());
///
/// FittedModel model = regressor.fit(basis, target, List.of("x1", "x2"));
/// Prediction prediction = regressor.predict(retainedBasis, true);
/// ```
///
/// ## Errors
///
/// - [ShapeMismatchException] before any iteration when the inputs disagree in size.
/// - [SingularSystemException] when the very first posterior cannot be solved. A
///   failure in a later iteration ends the fit as [FitPhase#ABORTED] with the last
///   valid state and the exception attached to the model.
/// - [UnfittedModelException] from [#predict] or [#score] before a successful fit.
///
/// ## Thread Safety
///
/// This class is NOT thread-safe. Use separate instances, or serialize access, when
/// fitting from several threads. The returned [FittedModel] is immutable.
public final class RelevanceVectorRegressor {

    private static final Logger logger = LogManager.getLogger(RelevanceVectorRegressor.class);

    private final RegressorConfig config;
    private final FitObserver observer;

    private FitPhase phase = FitPhase.INIT;
    private FittedModel fitted;

    public RelevanceVectorRegressor() {
        this(RegressorConfig.defaults());
    }

    public RelevanceVectorRegressor(RegressorConfig config) {
        this(config, FitObserver.NOOP);
    }

    public RelevanceVectorRegressor(RegressorConfig config, FitObserver observer) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.observer = Objects.requireNonNull(observer, "observer cannot be null");
    }

    /// Fits the model to row-major arrays.
    ///
    /// @see #fit(RealMatrix, RealVector, List)
    public FittedModel fit(double[][] basis, double[] target, List<String> labels) {
        if (basis.length == 0) {
            throw new IllegalArgumentException("basis has no rows");
        }
        return fit(new Array2DRowRealMatrix(basis), new ArrayRealVector(target), labels);
    }

    /// Fits the model.
    ///
    /// @param basis n x k matrix of evaluated basis functions; with the bias in use the
    ///              last column is the intercept
    /// @param target n targets
    /// @param labels one label per basis column, the bias column excluded
    /// @return the fitted model
    /// @throws ShapeMismatchException if the dimensions disagree
    /// @throws SingularSystemException if the first posterior cannot be solved
    public FittedModel fit(RealMatrix basis, RealVector target, List<String> labels) {
        return fit(basis, target, labels, () -> false);
    }

    /// Fits the model, checking for cancellation at every iteration boundary.
    ///
    /// A cancelled fit ends as [FitPhase#CANCELLED] with the last valid state. If
    /// cancellation is requested before the first iteration completes there is no
    /// valid state and a [CancellationException] is thrown.
    ///
    /// @param cancelled polled once per iteration, never during a solve
    public FittedModel fit(RealMatrix basis, RealVector target, List<String> labels, BooleanSupplier cancelled) {
        validate(basis, target, labels);

        int samples = basis.getRowDimension();
        int basisCount = basis.getColumnDimension();
        double[] alpha = new double[basisCount];
        Arrays.fill(alpha, config.initialAlpha());
        double beta = config.beta();
        RelevanceSet relevance = RelevanceSet.full(basisCount, labels, config.biasUsed());
        RealMatrix currentBasis = basis.copy();

        PosteriorSolver solver = new PosteriorSolver(config.pseudoInverseFallback());
        HyperparameterUpdater updater = new HyperparameterUpdater(config.betaFixed());
        Pruner pruner = new Pruner(config.thresholdAlpha());
        ConvergenceMonitor monitor = new ConvergenceMonitor(config.tolerance(), alpha);

        phase = FitPhase.INIT;
        observer.onFitStart(samples, basisCount);
        logger.debug("Fitting {} basis functions to {} samples with {}", basisCount, samples, config);

        FitState lastValid = null;
        FitPhase termination = FitPhase.EXHAUSTED;
        SingularSystemException failure = null;
        int completed = 0;

        phase = FitPhase.ITERATING;
        for (int i = 0; i < config.iterations(); i++) {
            if (cancelled.getAsBoolean()) {
                if (lastValid == null) {
                    phase = fitted == null ? FitPhase.INIT : FitPhase.DONE;
                    throw new CancellationException("Fit cancelled before the first iteration");
                }
                logger.info("Fit: cancelled @ iteration {}", i);
                termination = FitPhase.CANCELLED;
                break;
            }

            PosteriorState posterior;
            try {
                posterior = solver.solve(alpha, beta, currentBasis, target);
            } catch (SingularSystemException e) {
                if (lastValid == null) {
                    phase = fitted == null ? FitPhase.INIT : FitPhase.DONE;
                    throw e;
                }
                logger.error("Fit: aborting @ iteration {}, keeping state of iteration {}: {}",
                    i, lastValid.iteration(), e.getMessage());
                termination = FitPhase.ABORTED;
                failure = e;
                break;
            }

            HyperparameterUpdate update = updater.update(alpha, beta, posterior, currentBasis, target);
            FitState updated = new FitState(i, update.alpha(), update.beta(), update.gamma(),
                posterior, relevance, currentBasis);

            if (config.verbose() && (i + 1) % config.verbFreq() == 0) {
                observer.onIteration(FitDiagnostic.of(updated));
            }

            PruneResult pruned = pruner.prune(updated);
            FitState state = pruned.state();
            monitor.retain(pruned.keep());
            if (pruned.changed()) {
                logger.debug("Fit: pruned {} @ iteration {}, {} relevance vectors remain",
                    pruned.removedLabels(), i, state.size());
                observer.onPrune(i, pruned.removedLabels());
            }
            observer.onIterationState(state);

            alpha = state.alpha();
            beta = state.beta();
            relevance = state.relevance();
            currentBasis = state.basis();
            lastValid = state;
            completed = i + 1;

            if (monitor.hasConverged(alpha, i)) {
                logger.info("Fit: delta < tol @ iteration {}, finished.", i);
                termination = FitPhase.CONVERGED;
                break;
            }
            logger.trace("Fit: iteration {} delta={} relevance vectors={}", i, monitor.lastDelta(), state.size());
        }

        if (termination == FitPhase.EXHAUSTED) {
            logger.info("Fit: iteration budget of {} exhausted, last delta {}", config.iterations(), monitor.lastDelta());
        }
        FittedModel model = FittedModel.freeze(lastValid, basisCount, completed, monitor.lastDelta(), termination,
            failure);
        fitted = model;
        phase = FitPhase.DONE;
        observer.onFitComplete(model);
        return model;
    }

    /// Predicts from a matrix holding only the retained basis functions.
    ///
    /// @throws UnfittedModelException if no fit has completed
    /// @throws ShapeMismatchException if the column count differs from the relevance vector count
    public Prediction predict(RealMatrix basis, boolean returnVariance) {
        return requireFitted("predict").predict(basis, returnVariance);
    }

    /// Predicts from row-major arrays holding only the retained basis functions.
    public Prediction predict(double[][] basis, boolean returnVariance) {
        FittedModel model = requireFitted("predict");
        if (basis.length == 0) {
            return new Prediction(new double[0], returnVariance ? new double[0] : null);
        }
        return model.predict(new Array2DRowRealMatrix(basis), returnVariance);
    }

    /// Coefficient of determination on a matrix of the retained basis functions.
    ///
    /// @throws UnfittedModelException if no fit has completed
    public double score(RealMatrix basis, RealVector target) {
        return requireFitted("score").score(basis, target);
    }

    /// The model of the last completed fit, if any.
    public Optional<FittedModel> fittedModel() {
        return Optional.ofNullable(fitted);
    }

    public FitPhase phase() {
        return phase;
    }

    public RegressorConfig config() {
        return config;
    }

    private FittedModel requireFitted(String operation) {
        if (fitted == null) {
            throw new UnfittedModelException(operation);
        }
        return fitted;
    }

    private void validate(RealMatrix basis, RealVector target, List<String> labels) {
        Objects.requireNonNull(basis, "basis cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(labels, "labels cannot be null");

        if (basis.getRowDimension() != target.getDimension()) {
            throw new ShapeMismatchException("target length", basis.getRowDimension(), target.getDimension());
        }
        int labelled = config.biasUsed() ? basis.getColumnDimension() - 1 : basis.getColumnDimension();
        if (labelled < 0) {
            throw new ShapeMismatchException("basis columns (bias column required)", 1, basis.getColumnDimension());
        }
        if (labels.size() != labelled) {
            throw new ShapeMismatchException(config.biasUsed() ? "labels (bias column excluded)" : "labels",
                labelled, labels.size());
        }
        for (int r = 0; r < basis.getRowDimension(); r++) {
            for (int c = 0; c < basis.getColumnDimension(); c++) {
                if (!Double.isFinite(basis.getEntry(r, c))) {
                    throw new IllegalArgumentException("Basis matrix entry (" + r + "," + c + ") is not finite");
                }
            }
            if (!Double.isFinite(target.getEntry(r))) {
                throw new IllegalArgumentException("Target entry " + r + " is not finite");
            }
        }
    }
}
