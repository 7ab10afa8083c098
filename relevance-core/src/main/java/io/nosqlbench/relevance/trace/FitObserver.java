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

package io.nosqlbench.relevance.trace;

import io.nosqlbench.relevance.fit.FittedModel;
import io.nosqlbench.relevance.model.FitState;
import io.nosqlbench.relevance.persist.RelevanceGsonConfig;

import java.util.List;

/// Observer interface for monitoring the progress of a fit.
///
/// ## Lifecycle
///
/// ```text
///   onFitStart
///       │
///       ▼
///   ┌─────────────────────────── per iteration ───────────────────────────┐
///   │ onIteration         every verbFreq iterations, when verbose is set  │
///   │ onPrune             when the pruning pass removed basis functions   │
///   │ onIterationState    every iteration, after pruning                  │
///   └─────────────────────────────────────────────────────────────────────┘
///       │
///       ▼
///   onFitComplete
/// ```
///
/// The fit loop only produces these events; rendering them is up to the observer.
///
/// @see LoggingFitObserver
/// @see NdjsonTraceObserver
public interface FitObserver {

    /// Observer that ignores every event.
    FitObserver NOOP = new FitObserver() {
        @Override
        public void onFitStart(int samples, int basisFunctions) {
        }

        @Override
        public void onIteration(FitDiagnostic diagnostic) {
        }

        @Override
        public void onPrune(int iteration, List<String> removedLabels) {
        }

        @Override
        public void onFitComplete(FittedModel model) {
        }
    };

    /// Called once before the first iteration.
    ///
    /// @param samples number of rows of the basis matrix
    /// @param basisFunctions number of columns of the basis matrix, bias included
    void onFitStart(int samples, int basisFunctions);

    /// Called every `verbFreq` iterations after the hyperparameter update.
    void onIteration(FitDiagnostic diagnostic);

    /// Called when a pruning pass removed at least one basis function.
    ///
    /// @param iteration zero-based iteration index
    /// @param removedLabels labels of the removed basis functions
    void onPrune(int iteration, List<String> removedLabels);

    /// Called once with the final model, whatever the termination reason.
    void onFitComplete(FittedModel model);

    /// Called at every iteration boundary with the pruned snapshot.
    default void onIterationState(FitState state) {
    }

    /// Formats an object as a single-line JSON string.
    static String toCompactJson(Object state) {
        return RelevanceGsonConfig.compactGson().toJson(state);
    }
}
