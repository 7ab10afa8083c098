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

package io.nosqlbench.relevance.command.csv;

import java.nio.file.Path;

/// Thrown when a CSV design matrix file is malformed.
public class CsvFormatException extends IllegalArgumentException {

    private final Path path;
    private final int line;

    public CsvFormatException(Path path, int line, String problem) {
        super(String.format("%s:%d: %s", path, line, problem));
        this.path = path;
        this.line = line;
    }

    public Path getPath() {
        return path;
    }

    public int getLine() {
        return line;
    }
}
