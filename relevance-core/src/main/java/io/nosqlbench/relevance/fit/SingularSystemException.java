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

/// Thrown when the posterior precision matrix cannot be inverted, neither by
/// Cholesky decomposition nor by the pseudo-inverse fallback.
public class SingularSystemException extends RuntimeException {

    private final int dimension;

    public SingularSystemException(int dimension, String reason) {
        super(String.format("Posterior precision matrix (%dx%d) is not invertible: %s", dimension, dimension, reason));
        this.dimension = dimension;
    }

    public SingularSystemException(int dimension, String reason, Throwable cause) {
        super(String.format("Posterior precision matrix (%dx%d) is not invertible: %s", dimension, dimension, reason),
            cause);
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }
}
