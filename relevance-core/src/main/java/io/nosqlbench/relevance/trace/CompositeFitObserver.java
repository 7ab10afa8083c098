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

import java.util.List;

/// Forwards every event to a fixed list of observers, in order.
public final class CompositeFitObserver implements FitObserver {

    private final List<FitObserver> observers;

    private CompositeFitObserver(List<FitObserver> observers) {
        this.observers = observers;
    }

    public static FitObserver of(FitObserver... observers) {
        if (observers.length == 1) {
            return observers[0];
        }
        return new CompositeFitObserver(List.of(observers));
    }

    @Override
    public void onFitStart(int samples, int basisFunctions) {
        for (FitObserver observer : observers) {
            observer.onFitStart(samples, basisFunctions);
        }
    }

    @Override
    public void onIteration(FitDiagnostic diagnostic) {
        for (FitObserver observer : observers) {
            observer.onIteration(diagnostic);
        }
    }

    @Override
    public void onPrune(int iteration, List<String> removedLabels) {
        for (FitObserver observer : observers) {
            observer.onPrune(iteration, removedLabels);
        }
    }

    @Override
    public void onFitComplete(FittedModel model) {
        for (FitObserver observer : observers) {
            observer.onFitComplete(model);
        }
    }

    @Override
    public void onIterationState(FitState state) {
        for (FitObserver observer : observers) {
            observer.onIterationState(state);
        }
    }
}
