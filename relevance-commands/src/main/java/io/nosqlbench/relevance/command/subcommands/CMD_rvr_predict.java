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
import io.nosqlbench.relevance.fit.FittedModel;
import io.nosqlbench.relevance.fit.ShapeMismatchException;
import io.nosqlbench.relevance.model.Prediction;
import io.nosqlbench.relevance.persist.ModelStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/// Predict targets with a model saved by `fit --save`
///
/// The input CSV must hold the same basis columns that the model was fitted on, in the
/// same order. If `--target` names a column in the file, it is split off and the R²
/// score of the predictions is printed after them.
@CommandLine.Command(name = "predict",
    header = "Predict targets for a CSV design matrix with a saved model",
    description = "Prints one prediction per input row, followed by its predictive variance "
        + "when --variance is given.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "1:input error"})
public class CMD_rvr_predict implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_rvr_predict.class);

    @CommandLine.Option(names = {"--model"}, required = true, description = "Model JSON written by fit --save")
    private Path modelFile;

    @CommandLine.Parameters(index = "0", description = "CSV file with a header row")
    private Path input;

    @CommandLine.Option(names = {"--target"}, description = "Header of a target column to score against")
    private String target;

    @CommandLine.Option(names = {"--bias"},
        description = "Append a constant intercept column, as the model was fitted with --bias")
    private boolean bias = false;

    @CommandLine.Option(names = {"--variance"}, description = "Print the predictive variance of each row")
    private boolean variance = false;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            FittedModel model = ModelStore.load(modelFile);
            CsvDesignMatrix design = CsvDesignMatrix.readInputs(input, target, bias);
            logger.debug("Predicting {} rows with {} relevance vectors", design.samples(),
                model.relevanceVectorCount());

            Prediction prediction = model.predictFromFull(design.basis(), variance);
            double[] mean = prediction.mean();
            for (int i = 0; i < mean.length; i++) {
                if (variance) {
                    out.printf(Locale.ROOT, "%.6g,%.6g%n", mean[i], prediction.variance()[i]);
                } else {
                    out.printf(Locale.ROOT, "%.6g%n", mean[i]);
                }
            }
            if (design.hasTarget()) {
                double r2 = model.scoreFromFull(design.basis(), design.target());
                out.printf(Locale.ROOT, "R2=%.6f%n", r2);
            } else if (target != null) {
                logger.warn("Target column '{}' not found in {}, not scoring", target, input);
            }
            out.flush();
            return 0;
        } catch (ModelStore.ModelStoreException e) {
            logger.error("Cannot load model: {}", e.getMessage());
            return CMD_rvr_fit.EXIT_INPUT_ERROR;
        } catch (ShapeMismatchException | IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return CMD_rvr_fit.EXIT_INPUT_ERROR;
        } catch (IOException e) {
            logger.error("Error reading files", e);
            return CMD_rvr_fit.EXIT_INPUT_ERROR;
        }
    }
}
