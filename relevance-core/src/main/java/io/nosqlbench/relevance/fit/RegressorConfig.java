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

import java.util.Properties;

/// Immutable configuration of a relevance vector regression fit.
///
/// ## Settings
///
/// | Setting                 | Default | Meaning                                          |
/// |-------------------------|---------|--------------------------------------------------|
/// | `iterations`            | 3000    | iteration budget                                 |
/// | `tolerance`             | 1e-3    | stop when max alpha change falls below this      |
/// | `initialAlpha`          | 1e-6    | precision every basis function starts with       |
/// | `thresholdAlpha`        | 1e9     | basis functions at or above this are pruned      |
/// | `beta`                  | 1e-6    | initial (or fixed) noise precision               |
/// | `betaFixed`             | false   | keep beta at its initial value                   |
/// | `biasUsed`              | true    | treat the last basis column as the intercept     |
/// | `verbose`               | true    | emit periodic diagnostic events                  |
/// | `verbFreq`              | 10      | iterations between diagnostic events             |
/// | `pseudoInverseFallback` | true    | fall back to an SVD pseudo-inverse when Cholesky fails |
///
/// ## Usage
///
/// ```java
/// RegressorConfig config = RegressorConfig.builder()
///     .iterations(500)
///     .tolerance(1e-4)
///     .biasUsed(false)
///     .build();
/// ```
///
/// The same settings can be read from [Properties] with the `rvr.` prefix, see
/// [#fromProperties(Properties)].
public final class RegressorConfig {

    /// Prefix of the property keys understood by [#fromProperties(Properties)].
    public static final String PROPERTY_PREFIX = "rvr.";

    private final int iterations;
    private final double tolerance;
    private final double initialAlpha;
    private final double thresholdAlpha;
    private final double beta;
    private final boolean betaFixed;
    private final boolean biasUsed;
    private final boolean verbose;
    private final int verbFreq;
    private final boolean pseudoInverseFallback;

    private RegressorConfig(Builder builder) {
        this.iterations = builder.iterations;
        this.tolerance = builder.tolerance;
        this.initialAlpha = builder.initialAlpha;
        this.thresholdAlpha = builder.thresholdAlpha;
        this.beta = builder.beta;
        this.betaFixed = builder.betaFixed;
        this.biasUsed = builder.biasUsed;
        this.verbose = builder.verbose;
        this.verbFreq = builder.verbFreq;
        this.pseudoInverseFallback = builder.pseudoInverseFallback;
    }

    /// Creates a builder with the default settings.
    public static Builder builder() {
        return new Builder();
    }

    /// Returns a configuration with every setting at its default.
    public static RegressorConfig defaults() {
        return builder().build();
    }

    /// Reads a configuration from properties, falling back to defaults for absent keys.
    ///
    /// Keys are the setting names prefixed with [#PROPERTY_PREFIX], for example
    /// `rvr.iterations=500` or `rvr.betaFixed=true`.
    ///
    /// @param properties the property source
    /// @return the configuration
    /// @throws IllegalArgumentException if a value cannot be parsed or is out of range
    public static RegressorConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String value;
        if ((value = property(properties, "iterations")) != null) {
            builder.iterations(parseInt("iterations", value));
        }
        if ((value = property(properties, "tolerance")) != null) {
            builder.tolerance(parseDouble("tolerance", value));
        }
        if ((value = property(properties, "initialAlpha")) != null) {
            builder.initialAlpha(parseDouble("initialAlpha", value));
        }
        if ((value = property(properties, "thresholdAlpha")) != null) {
            builder.thresholdAlpha(parseDouble("thresholdAlpha", value));
        }
        if ((value = property(properties, "beta")) != null) {
            builder.beta(parseDouble("beta", value));
        }
        if ((value = property(properties, "betaFixed")) != null) {
            builder.betaFixed(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "biasUsed")) != null) {
            builder.biasUsed(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "verbose")) != null) {
            builder.verbose(Boolean.parseBoolean(value));
        }
        if ((value = property(properties, "verbFreq")) != null) {
            builder.verbFreq(parseInt("verbFreq", value));
        }
        if ((value = property(properties, "pseudoInverseFallback")) != null) {
            builder.pseudoInverseFallback(Boolean.parseBoolean(value));
        }
        return builder.build();
    }

    private static String property(Properties properties, String name) {
        String value = properties.getProperty(PROPERTY_PREFIX + name);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    private static double parseDouble(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + PROPERTY_PREFIX + name + ": " + value, e);
        }
    }

    public int iterations() {
        return iterations;
    }

    public double tolerance() {
        return tolerance;
    }

    public double initialAlpha() {
        return initialAlpha;
    }

    public double thresholdAlpha() {
        return thresholdAlpha;
    }

    public double beta() {
        return beta;
    }

    public boolean betaFixed() {
        return betaFixed;
    }

    public boolean biasUsed() {
        return biasUsed;
    }

    public boolean verbose() {
        return verbose;
    }

    public int verbFreq() {
        return verbFreq;
    }

    public boolean pseudoInverseFallback() {
        return pseudoInverseFallback;
    }

    /// Returns a builder pre-populated with this configuration.
    public Builder toBuilder() {
        return builder()
            .iterations(iterations)
            .tolerance(tolerance)
            .initialAlpha(initialAlpha)
            .thresholdAlpha(thresholdAlpha)
            .beta(beta)
            .betaFixed(betaFixed)
            .biasUsed(biasUsed)
            .verbose(verbose)
            .verbFreq(verbFreq)
            .pseudoInverseFallback(pseudoInverseFallback);
    }

    @Override
    public String toString() {
        return String.format("RegressorConfig{iterations=%d, tolerance=%g, initialAlpha=%g, thresholdAlpha=%g, "
                + "beta=%g, betaFixed=%s, biasUsed=%s, verbose=%s, verbFreq=%d, pseudoInverseFallback=%s}",
            iterations, tolerance, initialAlpha, thresholdAlpha, beta, betaFixed, biasUsed, verbose, verbFreq,
            pseudoInverseFallback);
    }

    /// Builder for [RegressorConfig].
    public static final class Builder {
        private int iterations = 3000;
        private double tolerance = 1e-3;
        private double initialAlpha = 1e-6;
        private double thresholdAlpha = 1e9;
        private double beta = 1e-6;
        private boolean betaFixed = false;
        private boolean biasUsed = true;
        private boolean verbose = true;
        private int verbFreq = 10;
        private boolean pseudoInverseFallback = true;

        /// Sets the iteration budget.
        public Builder iterations(int iterations) {
            this.iterations = iterations;
            return this;
        }

        /// Sets the convergence tolerance on the max absolute alpha change.
        public Builder tolerance(double tolerance) {
            this.tolerance = tolerance;
            return this;
        }

        /// Sets the precision every basis function starts with.
        public Builder initialAlpha(double alpha) {
            this.initialAlpha = alpha;
            return this;
        }

        /// Sets the pruning cutoff.
        public Builder thresholdAlpha(double threshold) {
            this.thresholdAlpha = threshold;
            return this;
        }

        /// Sets the initial noise precision.
        public Builder beta(double beta) {
            this.beta = beta;
            return this;
        }

        /// Keeps beta fixed at its initial value instead of re-estimating it.
        public Builder betaFixed(boolean fixed) {
            this.betaFixed = fixed;
            return this;
        }

        /// Treats the last basis column as the intercept.
        public Builder biasUsed(boolean biasUsed) {
            this.biasUsed = biasUsed;
            return this;
        }

        /// Enables periodic diagnostic events.
        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        /// Sets the number of iterations between diagnostic events.
        public Builder verbFreq(int verbFreq) {
            this.verbFreq = verbFreq;
            return this;
        }

        /// Enables the SVD pseudo-inverse fallback for a failed Cholesky solve.
        public Builder pseudoInverseFallback(boolean enabled) {
            this.pseudoInverseFallback = enabled;
            return this;
        }

        /// Builds the configuration.
        ///
        /// @throws IllegalArgumentException if any setting is out of range
        public RegressorConfig build() {
            if (iterations <= 0) {
                throw new IllegalArgumentException("iterations must be positive, got " + iterations);
            }
            if (!(tolerance >= 0.0)) {
                throw new IllegalArgumentException("tolerance must be non-negative, got " + tolerance);
            }
            if (!(initialAlpha > 0.0) || Double.isInfinite(initialAlpha)) {
                throw new IllegalArgumentException("initialAlpha must be positive and finite, got " + initialAlpha);
            }
            if (!(thresholdAlpha > 0.0)) {
                throw new IllegalArgumentException("thresholdAlpha must be positive, got " + thresholdAlpha);
            }
            if (!(beta > 0.0) || Double.isInfinite(beta)) {
                throw new IllegalArgumentException("beta must be positive and finite, got " + beta);
            }
            if (verbFreq <= 0) {
                throw new IllegalArgumentException("verbFreq must be positive, got " + verbFreq);
            }
            return new RegressorConfig(this);
        }
    }
}
