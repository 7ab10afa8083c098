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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/// A basis matrix and optional target vector read from a CSV file.
///
/// ## Format
///
/// ```text
/// # comment lines and blank lines are skipped
/// x1,x2,x3,y
/// 0.12,1.50,-0.3,2.41
/// ...
/// ```
///
/// The first non-comment line is the header. Every column except the target becomes a
/// basis function labelled by its header. With `appendBias` a constant 1.0 column is
/// appended as the last (unlabelled) basis column.
///
/// @param labels labels of the basis columns read from the file, bias excluded
/// @param basis basis matrix, bias column last when appended
/// @param target target vector, or null when the file has no target column
public record CsvDesignMatrix(List<String> labels, RealMatrix basis, RealVector target) {

    /// Reads a training file, which must contain a target column.
    ///
    /// @param path CSV file
    /// @param targetColumn header of the target column, or null for the last column
    /// @param appendBias whether to append a constant intercept column
    /// @return the design matrix with its target
    /// @throws IOException if the file cannot be read
    /// @throws CsvFormatException if the file is malformed or the target column is missing
    public static CsvDesignMatrix readTraining(Path path, String targetColumn, boolean appendBias) throws IOException {
        Table table = readTable(path);
        int targetIndex = targetColumn == null
            ? table.header.size() - 1
            : table.header.indexOf(targetColumn);
        if (targetIndex < 0) {
            throw new CsvFormatException(path, 1, "target column '" + targetColumn + "' not in header " + table.header);
        }
        if (table.header.size() < 2 && !appendBias) {
            throw new CsvFormatException(path, 1, "need at least one basis column besides the target");
        }
        return split(table, targetIndex, appendBias);
    }

    /// Reads an input file for prediction; the target column is optional.
    ///
    /// @param path CSV file
    /// @param targetColumn header of a target column to split off if present, or null
    /// @param appendBias whether to append a constant intercept column
    /// @return the design matrix, with a target only if the column was present
    /// @throws IOException if the file cannot be read
    public static CsvDesignMatrix readInputs(Path path, String targetColumn, boolean appendBias) throws IOException {
        Table table = readTable(path);
        int targetIndex = targetColumn == null ? -1 : table.header.indexOf(targetColumn);
        return split(table, targetIndex, appendBias);
    }

    public int samples() {
        return basis.getRowDimension();
    }

    public boolean hasTarget() {
        return target != null;
    }

    private static CsvDesignMatrix split(Table table, int targetIndex, boolean appendBias) {
        List<String> labels = new ArrayList<>(table.header);
        if (targetIndex >= 0) {
            labels.remove(targetIndex);
        }
        int columns = labels.size() + (appendBias ? 1 : 0);
        double[][] basis = new double[table.rows.size()][columns];
        double[] target = targetIndex >= 0 ? new double[table.rows.size()] : null;

        for (int r = 0; r < table.rows.size(); r++) {
            double[] row = table.rows.get(r);
            int c = 0;
            for (int i = 0; i < row.length; i++) {
                if (i == targetIndex) {
                    target[r] = row[i];
                } else {
                    basis[r][c++] = row[i];
                }
            }
            if (appendBias) {
                basis[r][c] = 1.0;
            }
        }
        return new CsvDesignMatrix(
            List.copyOf(labels),
            new Array2DRowRealMatrix(basis, false),
            target == null ? null : new ArrayRealVector(target, false));
    }

    private static Table readTable(Path path) throws IOException {
        List<String> header = null;
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] cells = trimmed.split(",", -1);
                if (header == null) {
                    header = new ArrayList<>(cells.length);
                    for (String cell : cells) {
                        header.add(cell.trim());
                    }
                    continue;
                }
                if (cells.length != header.size()) {
                    throw new CsvFormatException(path, lineNumber,
                        "expected " + header.size() + " values but found " + cells.length);
                }
                double[] values = new double[cells.length];
                for (int i = 0; i < cells.length; i++) {
                    try {
                        values[i] = Double.parseDouble(cells[i].trim());
                    } catch (NumberFormatException e) {
                        throw new CsvFormatException(path, lineNumber,
                            "column '" + header.get(i) + "' is not a number: " + cells[i].trim());
                    }
                }
                rows.add(values);
            }
        }
        if (header == null) {
            throw new CsvFormatException(path, 0, "file has no header");
        }
        if (rows.isEmpty()) {
            throw new CsvFormatException(path, 0, "file has no data rows");
        }
        return new Table(header, rows);
    }

    private record Table(List<String> header, List<double[]> rows) {}

    @Override
    public String toString() {
        return "CsvDesignMatrix{samples=" + basis.getRowDimension()
            + ", columns=" + basis.getColumnDimension()
            + ", labels=" + labels
            + ", target=" + (target != null) + "}";
    }
}
