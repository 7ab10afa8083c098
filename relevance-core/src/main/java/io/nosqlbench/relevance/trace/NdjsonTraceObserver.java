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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// FitObserver that writes NDJSON (newline-delimited JSON) trace files.
///
/// ## Output Format
///
/// Each line is a JSON object representing one event:
///
/// ```json
/// {"event":"fit_start","samples":60,"basis_functions":3,"timestamp":1234567890}
/// {"event":"iteration","iteration":9,"alpha":[...],"beta":101.2,"gamma":[...],"m":[...],"relevance_vectors":3,"timestamp":1234567891}
/// {"event":"prune","iteration":12,"removed":["x2"],"timestamp":1234567892}
/// {"event":"fit_complete","termination":"CONVERGED","iterations":40,"beta":99.7,"weights":[...],"timestamp":1234567893}
/// ```
///
/// Infinite alphas are written as `Infinity`.
///
/// ## Usage
///
/// ```java
/// try (NdjsonTraceObserver observer = new NdjsonTraceObserver(Path.of("trace.ndjson"))) {
///     FittedModel model = new RelevanceVectorRegressor(config, observer).fit(basis, target, labels);
/// }
/// ```
public final class NdjsonTraceObserver implements FitObserver, Closeable {

    private final BufferedWriter writer;

    /// Creates an NDJSON trace observer that writes to a file.
    ///
    /// @param outputPath path to write trace output
    /// @throws IOException if the file cannot be opened for writing
    public NdjsonTraceObserver(Path outputPath) throws IOException {
        this.writer = Files.newBufferedWriter(outputPath,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE);
    }

    /// Creates an NDJSON trace observer that writes to a Writer.
    ///
    /// @param writer the writer to use (caller retains ownership)
    public NdjsonTraceObserver(Writer writer) {
        this.writer = (writer instanceof BufferedWriter bw)
            ? bw
            : new BufferedWriter(writer);
    }

    @Override
    public void onFitStart(int samples, int basisFunctions) {
        Map<String, Object> event = event("fit_start");
        event.put("samples", samples);
        event.put("basis_functions", basisFunctions);
        writeEvent(event);
    }

    @Override
    public void onIteration(FitDiagnostic diagnostic) {
        Map<String, Object> event = event("iteration");
        event.put("iteration", diagnostic.iteration());
        event.put("alpha", diagnostic.alpha());
        event.put("beta", diagnostic.beta());
        event.put("gamma", diagnostic.gamma());
        event.put("m", diagnostic.mean());
        event.put("relevance_vectors", diagnostic.relevanceVectors());
        writeEvent(event);
    }

    @Override
    public void onPrune(int iteration, List<String> removedLabels) {
        Map<String, Object> event = event("prune");
        event.put("iteration", iteration);
        event.put("removed", removedLabels);
        writeEvent(event);
    }

    @Override
    public void onFitComplete(FittedModel model) {
        Map<String, Object> event = event("fit_complete");
        event.put("termination", model.termination().name());
        event.put("iterations", model.iterations());
        event.put("beta", model.beta());
        event.put("weights", model.weights());
        writeEvent(event);
    }

    private static Map<String, Object> event(String name) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("event", name);
        return event;
    }

    private void writeEvent(Map<String, Object> event) {
        event.put("timestamp", System.currentTimeMillis());
        try {
            writer.write(FitObserver.toCompactJson(event));
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write trace event", e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
