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

package io.nosqlbench.relevance.command;

import io.nosqlbench.relevance.command.subcommands.CMD_rvr_fit;
import io.nosqlbench.relevance.command.subcommands.CMD_rvr_predict;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

/// Relevance vector regression from the command line
///
/// - `fit`: fit a sparse model to a CSV design matrix and print the retained basis functions
/// - `predict`: apply a saved model to a CSV file of inputs
@CommandLine.Command(name = "rvr",
    header = "Sparse Bayesian linear regression over evaluated basis functions",
    mixinStandardHelpOptions = true,
    subcommands = {CMD_rvr_fit.class, CMD_rvr_predict.class, CommandLine.HelpCommand.class})
public class CMD_rvr {
    private static final Logger logger = LogManager.getLogger(CMD_rvr.class);

    /// Create the default rvr command
    public CMD_rvr() {
    }

    /// Builds the configured command line for this command.
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_rvr())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setOptionsCaseInsensitive(true);
    }

    /// Run an rvr command
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        logger.debug("Exiting main with code: {}", exitCode);
        System.exit(exitCode);
    }
}
