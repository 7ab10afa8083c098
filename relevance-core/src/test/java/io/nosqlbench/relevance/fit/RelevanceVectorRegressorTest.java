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

import io.nosqlbench.relevance.fit.SyntheticData.Problem;
import io.nosqlbench.relevance.model.FitState;
import io.nosqlbench.relevance.model.LabeledWeight;
import io.nosqlbench.relevance.model.Prediction;
import io.nosqlbench.relevance.trace.FitDiagnostic;
import io.nosqlbench.relevance.trace.FitObserver;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RelevanceVectorRegressorTest {

    private static final RegressorConfig QUIET = RegressorConfig.builder().verbose(false).build();

    /// Records every event of a fit.
    private static final class RecordingObserver implements FitObserver {
        final List<int[]> starts = new ArrayList<>();
        final List<FitDiagnostic> diagnostics = new ArrayList<>();
        final List<List<String>> prunes = new ArrayList<>();
        final List<FitState> states = new ArrayList<>();
        final List<FittedModel> completed = new ArrayList<>();

        @Override
        public void onFitStart(int samples, int basisFunctions) {
            starts.add(new int[]{samples, basisFunctions});
        }

        @Override
        public void onIteration(FitDiagnostic diagnostic) {
            diagnostics.add(diagnostic);
        }

        @Override
        public void onPrune(int iteration, List<String> removedLabels) {
            prunes.add(removedLabels);
        }

        @Override
        public void onFitComplete(FittedModel model) {
            completed.add(model);
        }

        @Override
        public void onIterationState(FitState state) {
            states.add(state);
        }
    }

    @Tag("accuracy")
    @ParameterizedTest(name = "seed={0}")
    @ValueSource(longs = {42L, 7L, 1234L})
    void recoversTheRelevantBasisFunction(long seed) {
        Problem problem = SyntheticData.linear(seed, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        FittedModel model = regressor.fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(model.termination()).isEqualTo(FitPhase.CONVERGED);
        assertThat(model.converged()).isTrue();
        assertThat(model.weight("x1")).hasValueCloseTo(3.0, within(0.2));
        assertThat(model.weight("x2")).isEmpty();
        assertThat(model.relevance().columns()).containsExactly(0, 2);
        assertThat(model.bias()).isPresent();
        assertThat(model.bias().getAsDouble()).isCloseTo(0.0, within(0.2));
        assertThat(model.iterations()).isLessThan(100);
        assertThat(regressor.phase()).isEqualTo(FitPhase.DONE);
        assertThat(regressor.fittedModel()).containsSame(model);
    }

    @Tag("unit")
    @Test
    void everyIterationBoundaryIsConsistent() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RecordingObserver observer = new RecordingObserver();

        new RelevanceVectorRegressor(QUIET, observer).fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(observer.states).isNotEmpty();
        int previousSize = Integer.MAX_VALUE;
        boolean biasCleared = false;
        for (FitState state : observer.states) {
            int k = state.relevance().size();
            assertThat(k).isGreaterThanOrEqualTo(1).isLessThanOrEqualTo(previousSize);
            assertThat(state.alpha()).hasSize(k);
            assertThat(state.gamma()).hasSize(k);
            assertThat(state.posterior().mean().getDimension()).isEqualTo(k);
            assertThat(state.posterior().covariance().getRowDimension()).isEqualTo(k);
            assertThat(state.posterior().covariance().getColumnDimension()).isEqualTo(k);
            assertThat(state.basis().getColumnDimension()).isEqualTo(k);

            RealMatrix sigma = state.posterior().covariance();
            for (int i = 0; i < k; i++) {
                for (int j = 0; j < k; j++) {
                    assertThat(sigma.getEntry(i, j)).isEqualTo(sigma.getEntry(j, i));
                }
            }
            if (biasCleared) {
                assertThat(state.relevance().biasUsed()).isFalse();
            }
            biasCleared |= !state.relevance().biasUsed();
            previousSize = k;
        }
    }

    @Tag("unit")
    @Test
    void predictionsMatchTheTrainingTargets() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);
        FittedModel model = regressor.fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        RealMatrix retained = PosteriorSolver.selectColumns(problem.basis(), model.relevance().columns());
        Prediction prediction = regressor.predict(retained, true);
        Prediction fromFull = model.predictFromFull(problem.basis(), true);

        assertThat(prediction.size()).isEqualTo(60);
        assertThat(prediction.hasVariance()).isTrue();
        assertThat(fromFull.mean()).containsExactly(prediction.mean());
        for (int i = 0; i < 60; i++) {
            assertThat(prediction.mean()[i]).isCloseTo(problem.target().getEntry(i), within(0.4));
            assertThat(prediction.variance()[i]).isGreaterThanOrEqualTo(1.0 / model.beta());
        }
        assertThat(regressor.score(retained, problem.target())).isGreaterThan(0.99).isLessThanOrEqualTo(1.0);
        assertThat(model.scoreFromFull(problem.basis(), problem.target()))
            .isEqualTo(regressor.score(retained, problem.target()));
    }

    @Tag("unit")
    @Test
    void predictionWithoutVarianceLeavesItAbsent() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);
        FittedModel model = regressor.fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        Prediction prediction = model.predictFromFull(problem.basis(), false);
        assertThat(prediction.hasVariance()).isFalse();
        assertThat(prediction.varianceIfPresent()).isEmpty();
    }

    @Tag("unit")
    @Test
    void predictionRejectsWrongWidth() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);
        regressor.fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThatThrownBy(() -> regressor.predict(problem.basis(), false))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("relevance vector columns");
        assertThatThrownBy(() -> regressor.fittedModel().orElseThrow()
            .predictFromFull(new Array2DRowRealMatrix(3, 2), false))
            .isInstanceOf(ShapeMismatchException.class);
    }

    @Tag("unit")
    @Test
    void degenerateThresholdKeepsFirstAndBias() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RegressorConfig config = QUIET.toBuilder().thresholdAlpha(1e-12).iterations(200).build();
        RecordingObserver observer = new RecordingObserver();

        FittedModel model = new RelevanceVectorRegressor(config, observer)
            .fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(model.relevance().columns()).containsExactly(0, 2);
        assertThat(model.relevance().biasUsed()).isTrue();
        assertThat(model.weights()).extracting(LabeledWeight::label).containsExactly("x1", "bias");
        assertThat(observer.prunes).containsExactly(List.of("x2"));
        assertThat(observer.states).allSatisfy(state -> assertThat(state.size()).isEqualTo(2));
    }

    @Tag("unit")
    @Test
    void diagnosticsFollowTheConfiguredCadence() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RegressorConfig config = RegressorConfig.builder().verbFreq(5).tolerance(0.0).iterations(30).build();
        RecordingObserver observer = new RecordingObserver();

        FittedModel model = new RelevanceVectorRegressor(config, observer)
            .fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(model.termination()).isEqualTo(FitPhase.EXHAUSTED);
        assertThat(model.iterations()).isEqualTo(30);
        assertThat(observer.starts).hasSize(1);
        assertThat(observer.starts.get(0)).containsExactly(60, 3);
        assertThat(observer.diagnostics).extracting(FitDiagnostic::iteration).containsExactly(4, 9, 14, 19, 24, 29);
        assertThat(observer.diagnostics.get(0).relevanceVectors()).isEqualTo(3);
        assertThat(observer.diagnostics.get(5).relevanceVectors()).isEqualTo(2);
        assertThat(observer.prunes).containsExactly(List.of("x2"));
        assertThat(observer.states).hasSize(30);
        assertThat(observer.completed).containsExactly(model);
    }

    @Tag("unit")
    @Test
    void quietFitEmitsNoDiagnostics() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RecordingObserver observer = new RecordingObserver();

        new RelevanceVectorRegressor(QUIET, observer).fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(observer.diagnostics).isEmpty();
        assertThat(observer.completed).hasSize(1);
    }

    @Tag("unit")
    @Test
    void fitWithoutBiasHasNoIntercept() {
        Problem problem = SyntheticData.linear(42L, 60, false);
        RegressorConfig config = QUIET.toBuilder().biasUsed(false).build();

        FittedModel model = new RelevanceVectorRegressor(config)
            .fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(model.bias()).isEmpty();
        assertThat(model.weight("x1")).hasValueCloseTo(3.0, within(0.2));
        assertThat(model.weights()).noneMatch(LabeledWeight::isBias);
    }

    @Tag("unit")
    @Test
    void shapeMismatchesAreRejectedBeforeFitting() {
        Problem problem = SyntheticData.linear(42L, 20, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        assertThatThrownBy(() -> regressor.fit(problem.basis(), new ArrayRealVector(19), SyntheticData.LABELS))
            .isInstanceOf(ShapeMismatchException.class)
            .hasMessageContaining("target length");
        assertThatThrownBy(() -> regressor.fit(problem.basis(), problem.target(), List.of("x1")))
            .isInstanceOf(ShapeMismatchException.class);
        assertThatThrownBy(() -> regressor.fit(problem.basis(), problem.target(), List.of("x1", "x2", "x3")))
            .isInstanceOf(ShapeMismatchException.class);
        assertThat(regressor.phase()).isEqualTo(FitPhase.INIT);
        assertThat(regressor.fittedModel()).isEmpty();
    }

    @Tag("unit")
    @Test
    void emptyBasisIsRejected() {
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        assertThatThrownBy(() -> regressor.fit(new double[0][], new double[0], List.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("basis has no rows");
        assertThat(regressor.phase()).isEqualTo(FitPhase.INIT);
    }

    @Tag("unit")
    @Test
    void nonFiniteInputsAreRejected() {
        Problem problem = SyntheticData.linear(42L, 20, true);
        RealMatrix basis = problem.basis().copy();
        basis.setEntry(3, 1, Double.NaN);

        assertThatThrownBy(() -> new RelevanceVectorRegressor(QUIET).fit(basis, problem.target(), SyntheticData.LABELS))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("(3,1)");
    }

    @Tag("unit")
    @Test
    void predictAndScoreRequireAFit() {
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        assertThatThrownBy(() -> regressor.predict(new double[][]{{1.0, 1.0}}, false))
            .isInstanceOf(UnfittedModelException.class);
        assertThatThrownBy(() -> regressor.score(new Array2DRowRealMatrix(1, 2), new ArrayRealVector(1)))
            .isInstanceOf(UnfittedModelException.class);
    }

    @Tag("unit")
    @Test
    void singularFirstSolvePropagates() {
        double[][] data = new double[10][2];
        for (int r = 0; r < 10; r++) {
            data[r][0] = 1e6 * (r + 1);
            data[r][1] = 1e6 * (r + 1);
        }
        RealMatrix basis = new Array2DRowRealMatrix(data);
        RegressorConfig config = QUIET.toBuilder().biasUsed(false).beta(1.0).pseudoInverseFallback(false).build();
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(config);

        assertThatThrownBy(() -> regressor.fit(basis, basis.getColumnVector(0), List.of("a", "b")))
            .isInstanceOf(SingularSystemException.class);
        assertThat(regressor.fittedModel()).isEmpty();
        assertThat(regressor.phase()).isEqualTo(FitPhase.INIT);
    }

    @Tag("unit")
    @Test
    void laterSingularSolveAbortsWithLastValidState() {
        Problem problem = SyntheticData.duplicatedColumns(11L, 20);
        RegressorConfig config = QUIET.toBuilder()
            .biasUsed(false)
            .tolerance(0.0)
            .iterations(50)
            .pseudoInverseFallback(false)
            .build();
        RecordingObserver observer = new RecordingObserver();

        FittedModel model = new RelevanceVectorRegressor(config, observer)
            .fit(problem.basis(), problem.target(), List.of("a", "b"));

        assertThat(model.termination()).isEqualTo(FitPhase.ABORTED);
        assertThat(model.failure()).isPresent();
        assertThat(model.iterations()).isPositive().isLessThan(50).isEqualTo(observer.states.size());
        for (double w : model.mean().toArray()) {
            assertThat(w).isFinite();
        }
        assertThat(observer.completed).containsExactly(model);
    }

    @Tag("unit")
    @Test
    void cancellationKeepsTheLastCompletedIteration() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        AtomicInteger polls = new AtomicInteger();

        FittedModel model = new RelevanceVectorRegressor(QUIET)
            .fit(problem.basis(), problem.target(), SyntheticData.LABELS, () -> polls.incrementAndGet() > 3);

        assertThat(model.termination()).isEqualTo(FitPhase.CANCELLED);
        assertThat(model.iterations()).isEqualTo(3);
    }

    @Tag("unit")
    @Test
    void cancellationBeforeTheFirstIterationThrows() {
        Problem problem = SyntheticData.linear(42L, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        assertThatThrownBy(() -> regressor.fit(problem.basis(), problem.target(), SyntheticData.LABELS, () -> true))
            .isInstanceOf(CancellationException.class);
        assertThat(regressor.fittedModel()).isEmpty();
    }

    @Tag("unit")
    @Test
    void fittedModelIsIndependentOfLaterFits() {
        Problem first = SyntheticData.linear(42L, 60, true);
        Problem second = SyntheticData.linear(7L, 60, true);
        RelevanceVectorRegressor regressor = new RelevanceVectorRegressor(QUIET);

        FittedModel model = regressor.fit(first.basis(), first.target(), SyntheticData.LABELS);
        double[] weights = model.mean().toArray();
        FittedModel next = regressor.fit(second.basis(), second.target(), SyntheticData.LABELS);

        assertThat(model.mean().toArray()).containsExactly(weights);
        assertThat(regressor.fittedModel()).containsSame(next);
    }
}
