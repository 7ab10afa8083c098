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

package io.nosqlbench.relevance.command.subcommands;

import io.nosqlbench.relevance.command.csv.CsvDesignMatrix;
import io.nosqlbench.relevance.fit.FitPhase;
import io.nosqlbench.relevance.fit.FittedModel;
import io.nosqlbench.relevance.fit.RegressorConfig;
import io.nosqlbench.relevance.fit.RelevanceVectorRegressor;
import io.nosqlbench.relevance.fit.ShapeMismatchException;
import io.nosqlbench.relevance.fit.SingularSystemException;
import io.nosqlbench.relevance.fit.SparseModelReport;
import io.nosqlbench.relevance.persist.ModelStore;
import io.nosqlbench.relevance.trace.CompositeFitObserver;
import io.nosqlbench.relevance.trace.FitObserver;
import io.nosqlbench.relevance.trace.LoggingFitObserver;
import io.nosqlbench.relevance.trace.NdjsonTraceObserver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.Callable;

/// Fit a relevance vector regression model to a CSV design matrix
///
/// Every column of the file except the target is a basis function. The fitted sparse
/// model is printed as a table of the retained basis functions, or as JSON with `--json`.
///
/// # Usage
/// ```
/// fit data.csv --target y --bias
/// fit data.csv --config rvr.properties --trace trace.ndjson --save model.json
/// ```
@CommandLine.Command(name = "fit",
    header = "Fit a sparse Bayesian regression model to a CSV design matrix",
    description = "Reads a CSV file with a header row, treats every column except the target as an "
        + "evaluated basis function, and prunes the basis functions that do not explain the target.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:input error", "2:fit aborted by a singular posterior"})
public class CMD_rvr_fit implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_rvr_fit.class);

    /// Exit code for unreadable or inconsistent input
    public static final int EXIT_INPUT_ERROR = 1;
    /// Exit code for a fit that was aborted by the solver
    public static final int EXIT_ABORTED = 2;

    @CommandLine.Parameters(index = "0", description = "CSV file with a header row")
    private Path input;

    @CommandLine.Option(names = {"--target"},
        description = "Header of the target column (default: last column)")
    private String target;

    @CommandLine.Option(names = {"--bias"},
        description = "Append a constant intercept basis function")
    private boolean bias = false;

    @CommandLine.Option(names = {"--config"},
        description = "Properties file with rvr.* settings; explicit options take precedence")
    private Path configFile;

    @CommandLine.Option(names = {"--iterations"}, description = "Iteration budget (default: 3000)")
    private Integer iterations;

    @CommandLine.Option(names = {"--tolerance"}, description = "Convergence tolerance on alpha (default: 1e-3)")
    private Double tolerance;

    @CommandLine.Option(names = {"--alpha"}, description = "Initial precision of every basis function (default: 1e-6)")
    private Double alpha;

    @CommandLine.Option(names = {"--threshold-alpha"}, description = "Pruning cutoff for alpha (default: 1e9)")
    private Double thresholdAlpha;

    @CommandLine.Option(names = {"--beta"}, description = "Initial noise precision (default: 1e-6)")
    private Double beta;

    @CommandLine.Option(names = {"--beta-fixed"}, description = "Keep the noise precision fixed")
    private Boolean betaFixed;

    @CommandLine.Option(names = {"--verbose"}, description = "Log diagnostics while fitting")
    private Boolean verbose;

    @CommandLine.Option(names = {"--verb-freq"}, description = "Iterations between diagnostics (default: 10)")
    private Integer verbFreq;

    @CommandLine.Option(names = {"--no-pseudo-inverse"},
        description = "Abort instead of falling back to a pseudo-inverse when Cholesky fails")
    private boolean noPseudoInverse = false;

    @CommandLine.Option(names = {"--trace"}, description = "Write an NDJSON trace of the fit to this file")
    private Path traceFile;

    @CommandLine.Option(names = {"--save"}, description = "Save the fitted model as JSON to this file")
    private Path saveFile;

    @CommandLine.Option(names = {"--json"}, description = "Print the fitted model as JSON instead of a table")
    private boolean json = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// Create the default fit command
    public CMD_rvr_fit() {
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            RegressorConfig config = buildConfig();
            CsvDesignMatrix design = CsvDesignMatrix.readTraining(input, target, bias);
            logger.info("Read {} samples and {} basis functions from {}",
                design.samples(), design.basis().getColumnDimension(), input);

            FittedModel model = fit(config, design);

            if (json) {
                out.println(ModelStore.toJson(model));
            } else {
                out.printf(Locale.ROOT, "Fit %s after %d iterations, beta=%.6g, %d relevance vectors%n",
                    model.termination(), model.iterations(), model.beta(), model.relevanceVectorCount());
                out.print(SparseModelReport.format(model));
            }
            out.flush();

            if (saveFile != null) {
                ModelStore.save(saveFile, model);
                logger.info("Saved model to {}", saveFile);
            }

            if (model.termination() == FitPhase.ABORTED) {
                model.failure().ifPresent(e -> logger.error("Fit aborted: {}", e.getMessage()));
                return EXIT_ABORTED;
            }
            return 0;
        } catch (SingularSystemException e) {
            logger.error("Fit aborted: {}", e.getMessage());
            return EXIT_ABORTED;
        } catch (ShapeMismatchException | IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IOException e) {
            logger.error("Error reading or writing files", e);
            return EXIT_INPUT_ERROR;
        } catch (UncheckedIOException e) {
            logger.error("Error writing trace to {}", traceFile, e.getCause());
            return EXIT_INPUT_ERROR;
        }
    }

    private FittedModel fit(RegressorConfig config, CsvDesignMatrix design) throws IOException {
        RelevanceVectorRegressor regressor;
        if (traceFile == null) {
            regressor = new RelevanceVectorRegressor(config, new LoggingFitObserver());
            return regressor.fit(design.basis(), design.target(), design.labels());
        }
        try (NdjsonTraceObserver trace = new NdjsonTraceObserver(traceFile)) {
            FitObserver observer = CompositeFitObserver.of(new LoggingFitObserver(), trace);
            regressor = new RelevanceVectorRegressor(config, observer);
            return regressor.fit(design.basis(), design.target(), design.labels());
        }
    }

    RegressorConfig buildConfig() throws IOException {
        RegressorConfig.Builder builder;
        if (configFile != null) {
            Properties properties = new Properties();
            try (InputStream in = Files.newInputStream(configFile)) {
                properties.load(in);
            }
            builder = RegressorConfig.fromProperties(properties).toBuilder();
        } else {
            builder = RegressorConfig.builder().verbose(false);
        }
        builder.biasUsed(bias);
        if (iterations != null) {
            builder.iterations(iterations);
        }
        if (tolerance != null) {
            builder.tolerance(tolerance);
        }
        if (alpha != null) {
            builder.initialAlpha(alpha);
        }
        if (thresholdAlpha != null) {
            builder.thresholdAlpha(thresholdAlpha);
        }
        if (beta != null) {
            builder.beta(beta);
        }
        if (betaFixed != null) {
            builder.betaFixed(betaFixed);
        }
        if (verbose != null) {
            builder.verbose(verbose);
        }
        if (verbFreq != null) {
            builder.verbFreq(verbFreq);
        }
        if (noPseudoInverse) {
            builder.pseudoInverseFallback(false);
        }
        return builder.build();
    }
}
