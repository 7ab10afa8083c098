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
import io.nosqlbench.relevance.fit.RegressorConfig;
import io.nosqlbench.relevance.fit.RelevanceVectorRegressor;
import io.nosqlbench.relevance.fit.SyntheticData;
import io.nosqlbench.relevance.fit.SyntheticData.Problem;
import io.nosqlbench.relevance.model.FitState;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CompositeFitObserverTest {

    /// Appends the name of each callback to a shared log.
    private static final class NamedObserver implements FitObserver {
        private final String name;
        private final List<String> log;

        NamedObserver(String name, List<String> log) {
            this.name = name;
            this.log = log;
        }

        @Override
        public void onFitStart(int samples, int basisFunctions) {
            log.add(name + ":start");
        }

        @Override
        public void onIteration(FitDiagnostic diagnostic) {
            log.add(name + ":iteration");
        }

        @Override
        public void onPrune(int iteration, List<String> removedLabels) {
            log.add(name + ":prune");
        }

        @Override
        public void onFitComplete(FittedModel model) {
            log.add(name + ":complete");
        }

        @Override
        public void onIterationState(FitState state) {
            log.add(name + ":state");
        }
    }

    @Test
    void forwardsEveryEventInOrder() {
        List<String> log = new ArrayList<>();
        FitObserver composite = CompositeFitObserver.of(new NamedObserver("a", log), new NamedObserver("b", log));
        Problem problem = SyntheticData.linear(42L, 60, true);

        new RelevanceVectorRegressor(RegressorConfig.builder().verbFreq(1).iterations(5).tolerance(0.0).build(),
            composite).fit(problem.basis(), problem.target(), SyntheticData.LABELS);

        assertThat(log.subList(0, 6)).containsExactly(
            "a:start", "b:start",
            "a:iteration", "b:iteration",
            "a:state", "b:state");
        assertThat(log.subList(log.size() - 2, log.size())).containsExactly("a:complete", "b:complete");
        assertThat(log).filteredOn(s -> s.endsWith(":state")).hasSize(10);
    }

    @Test
    void singleObserverIsReturnedUnwrapped() {
        FitObserver only = new LoggingFitObserver();
        assertThat(CompositeFitObserver.of(only)).isSameAs(only);
    }
}
