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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for fitted models, configurations and trace events.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()] only) | Human-readable model files |
/// | HTML escaping | Disabled | Cleaner labels |
/// | Special floating point values | Serialized | Infinite alphas survive a round trip |
///
/// ## Thread Safety
///
/// The [Gson] instances are thread-safe and can be shared across threads.
///
/// @see ModelStore
public final class RelevanceGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private RelevanceGsonConfig() {
        // Utility class
    }

    /// Returns the shared pretty-printing Gson instance.
    public static Gson gson() {
        return INSTANCE;
    }

    /// Returns the shared single-line Gson instance, suitable for NDJSON output.
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with the relevance defaults.
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues();
    }
}
