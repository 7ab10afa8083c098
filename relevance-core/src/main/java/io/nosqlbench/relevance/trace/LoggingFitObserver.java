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
import io.nosqlbench.relevance.fit.SparseModelReport;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;

/// Renders fit events through log4j2.
///
/// Diagnostics and pruning are logged at the configured level (INFO by default); the
/// final sparse model report is logged when the fit completes.
public final class LoggingFitObserver implements FitObserver {

    private static final Logger logger = LogManager.getLogger(LoggingFitObserver.class);

    private final Level level;

    public LoggingFitObserver() {
        this(Level.INFO);
    }

    public LoggingFitObserver(Level level) {
        this.level = level;
    }

    @Override
    public void onFitStart(int samples, int basisFunctions) {
        logger.log(level, "Fitting {} basis functions to {} samples", basisFunctions, samples);
    }

    @Override
    public void onIteration(FitDiagnostic diagnostic) {
        if (!logger.isEnabled(level)) {
            return;
        }
        logger.log(level, "Fit @ iteration {}:\n--Alpha {}\n--Beta {}\n--Gamma {}\n--m {}\n--Relevance Vectors {}",
            diagnostic.iteration(),
            Arrays.toString(diagnostic.alpha()),
            diagnostic.beta(),
            Arrays.toString(diagnostic.gamma()),
            Arrays.toString(diagnostic.mean()),
            diagnostic.relevanceVectors());
    }

    @Override
    public void onPrune(int iteration, List<String> removedLabels) {
        logger.log(level, "Pruned {} basis function(s) @ iteration {}: {}",
            removedLabels.size(), iteration, removedLabels);
    }

    @Override
    public void onFitComplete(FittedModel model) {
        if (!logger.isEnabled(level)) {
            return;
        }
        logger.log(level, "Fit {} after {} iterations, {} relevance vectors:\n{}",
            model.termination(), model.iterations(), model.relevanceVectorCount(),
            SparseModelReport.format(model));
    }
}
