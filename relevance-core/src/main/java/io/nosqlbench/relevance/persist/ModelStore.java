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

package io.nosqlbench.relevance.persist;

import com.google.gson.JsonParseException;
import io.nosqlbench.relevance.fit.FittedModel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/// Saves and loads fitted models as JSON.
///
/// ## Atomic Writes
///
/// ```text
///   1. Write JSON to a temporary sibling file (model.json.tmp)
///   2. Rename the temporary file to the final name
/// ```
///
/// An interrupted save leaves any existing model file intact, and a failed save removes
/// the temporary file. A loaded model is checked for missing or mis-sized arrays before
/// it is returned; the solver failure of an aborted fit is not persisted.
///
/// ## Usage
///
/// ```java
/// ModelStore.save(Path.of("model.json"), model);
/// FittedModel restored = ModelStore.load(Path.of("model.json"));
/// ```
public final class ModelStore {

    private static final Logger logger = LogManager.getLogger(ModelStore.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private ModelStore() {
        // Utility class
    }

    /// Serializes a model to a JSON string.
    public static String toJson(FittedModel model) {
        return RelevanceGsonConfig.gson().toJson(Objects.requireNonNull(model, "model cannot be null"));
    }

    /// Parses a model from a JSON string.
    ///
    /// @throws ModelStoreException if the JSON is malformed or incomplete
    public static FittedModel fromJson(String json) throws ModelStoreException {
        FittedModel model;
        try {
            model = RelevanceGsonConfig.gson().fromJson(json, FittedModel.class);
        } catch (JsonParseException e) {
            throw new ModelStoreException("Invalid model JSON: " + e.getMessage(), e);
        }
        if (model == null) {
            throw new ModelStoreException("Model JSON is empty");
        }
        try {
            model.checkIntegrity();
        } catch (IllegalStateException e) {
            throw new ModelStoreException("Incomplete model JSON: " + e.getMessage(), e);
        }
        return model;
    }

    /// Saves a model to a file atomically.
    ///
    /// @param path the path to save the model to
    /// @param model the model to save
    /// @throws IOException if writing fails
    public static void save(Path path, FittedModel model) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        String json = toJson(model);

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                writer.write(json);
            }
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        logger.debug("Saved model with {} relevance vectors to {}", model.relevanceVectorCount(), path);
    }

    /// Loads a model from a file.
    ///
    /// @param path the path to load the model from
    /// @return the loaded model
    /// @throws IOException if reading fails
    /// @throws ModelStoreException if the file is missing or does not hold a model
    public static FittedModel load(Path path) throws IOException, ModelStoreException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new ModelStoreException("Model file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                sb.append(buffer, 0, read);
            }
            return fromJson(sb.toString());
        }
    }

    /// Exception thrown when a model file cannot be loaded.
    public static class ModelStoreException extends Exception {
        public ModelStoreException(String message) {
            super(message);
        }

        public ModelStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
