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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class FitStateTest {

    private static FitState threeColumnState() {
        RealMatrix covariance = new Array2DRowRealMatrix(new double[][]{
            {1.0, 0.1, 0.2},
            {0.1, 2.0, 0.3},
            {0.2, 0.3, 3.0}
        });
        PosteriorState posterior = new PosteriorState(new ArrayRealVector(new double[]{10, 20, 30}), covariance);
        RealMatrix basis = new Array2DRowRealMatrix(new double[][]{
            {1, 2, 1},
            {3, 4, 1}
        });
        return new FitState(4, new double[]{0.5, 1e12, 0.7}, 2.0, new double[]{0.9, 0.0, 0.8},
            posterior, RelevanceSet.full(3, List.of("x1", "x2"), true), basis);
    }

    @Test
    void retainAppliesOneMaskToEveryQuantity() {
        FitState pruned = threeColumnState().retain(new boolean[]{true, false, true});

        assertThat(pruned.size()).isEqualTo(2);
        assertThat(pruned.iteration()).isEqualTo(4);
        assertThat(pruned.alpha()).containsExactly(0.5, 0.7);
        assertThat(pruned.gamma()).containsExactly(0.9, 0.8);
        assertThat(pruned.posterior().mean().toArray()).containsExactly(10, 30);
        assertThat(pruned.posterior().covariance().getData())
            .isDeepEqualTo(new double[][]{{1.0, 0.2}, {0.2, 3.0}});
        assertThat(pruned.basis().getData()).isDeepEqualTo(new double[][]{{1, 1}, {3, 1}});
        assertThat(pruned.relevance().columns()).containsExactly(0, 2);
        assertThat(pruned.relevance().biasUsed()).isTrue();
        assertThat(pruned.beta()).isEqualTo(2.0);
    }

    @Test
    void inconsistentSizesAreRejected() {
        FitState state = threeColumnState();
        assertThatThrownBy(() -> new FitState(0, new double[]{1, 2}, 1.0, state.gamma(),
            state.posterior(), state.relevance(), state.basis()))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("alpha=2");
    }

    @Test
    void keptPositionsAreAscending() {
        assertThat(FitState.keptPositions(new boolean[]{false, true, true, false, true}))
            .containsExactly(1, 2, 4);
        assertThat(FitState.keptPositions(new boolean[]{false})).isEmpty();
    }
}
