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

/// Lifecycle of a fit.
///
/// ```text
///   INIT ──► ITERATING ──┬──► CONVERGED ──┐
///                        ├──► EXHAUSTED ──┤
///                        ├──► ABORTED ────┼──► DONE
///                        └──► CANCELLED ──┘
/// ```
public enum FitPhase {
    /// Inputs validated, state initialized, no iteration run yet.
    INIT,
    /// Solve, update, prune and convergence check are running.
    ITERATING,
    /// Max alpha change fell below the tolerance.
    CONVERGED,
    /// Iteration budget used up without convergence.
    EXHAUSTED,
    /// The posterior precision could not be inverted; the last valid state was kept.
    ABORTED,
    /// Cancellation was requested at an iteration boundary.
    CANCELLED,
    /// Fitted state frozen and available for prediction.
    DONE;

    /// Returns true for the phases that end the iteration.
    public boolean isTerminal() {
        return this == CONVERGED || this == EXHAUSTED || this == ABORTED || this == CANCELLED;
    }
}
