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

/// Thrown when the basis matrix, target vector or basis labels handed to a fit or
/// prediction disagree in size. Raised before any iteration runs.
public class ShapeMismatchException extends RuntimeException {

    private final String quantity;
    private final int expected;
    private final int actual;

    public ShapeMismatchException(String quantity, int expected, int actual) {
        super(String.format("Shape mismatch for %s: expected %d but was %d", quantity, expected, actual));
        this.quantity = quantity;
        this.expected = expected;
        this.actual = actual;
    }

    public String getQuantity() {
        return quantity;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
