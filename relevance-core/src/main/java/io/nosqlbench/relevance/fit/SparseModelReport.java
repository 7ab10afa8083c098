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

import io.nosqlbench.relevance.model.LabeledWeight;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Formats the retained basis functions of a fitted model as an aligned ASCII table.
 *
 * <h2>Output</h2>
 *
 * <pre>{@code
 * basis   weight   std dev     alpha
 * -----  -------  --------  --------
 * x1      3.0121  0.014203    0.1102
 * bias    0.4988  0.014011    4.0190
 * }</pre>
 *
 * <p>Rows follow the order of the relevance set, so the bias (when still in use) comes last.
 */
public final class SparseModelReport {

    private static final String[] HEADERS = {"basis", "weight", "std dev", "alpha"};
    private static final String NA = "N/A";
    private static final String INFINITY = "---";

    private SparseModelReport() {
    }

    /**
     * Formats the sparse representation of a fitted model.
     *
     * @param model the fitted model
     * @return the formatted table, terminated by a newline
     */
    public static String format(FittedModel model) {
        return format(model.weights());
    }

    /**
     * Formats a list of labeled weights.
     *
     * @param weights rows to format
     * @return the formatted table, terminated by a newline
     */
    public static String format(List<LabeledWeight> weights) {
        if (weights.isEmpty()) {
            return "No relevance vectors\n";
        }
        List<String[]> rows = new ArrayList<>(weights.size());
        for (LabeledWeight w : weights) {
            rows.add(new String[]{
                w.label(),
                formatValue(w.weight()),
                formatValue(w.stdDev()),
                formatValue(w.alpha())
            });
        }

        int[] widths = new int[HEADERS.length];
        for (int c = 0; c < HEADERS.length; c++) {
            widths[c] = HEADERS[c].length();
            for (String[] row : rows) {
                widths[c] = Math.max(widths[c], row[c].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        appendRow(sb, HEADERS, widths);
        String[] separator = new String[HEADERS.length];
        for (int c = 0; c < HEADERS.length; c++) {
            separator[c] = "-".repeat(widths[c]);
        }
        appendRow(sb, separator, widths);
        for (String[] row : rows) {
            appendRow(sb, row, widths);
        }
        return sb.toString();
    }

    /**
     * Formats a value with four significant decimals, or a marker for non-finite values.
     */
    static String formatValue(double value) {
        if (Double.isNaN(value)) {
            return NA;
        }
        if (Double.isInfinite(value)) {
            return INFINITY;
        }
        double magnitude = Math.abs(value);
        if (magnitude != 0.0 && (magnitude >= 1e6 || magnitude < 1e-4)) {
            return String.format(Locale.ROOT, "%.4e", value);
        }
        return String.format(Locale.ROOT, "%.4f", value);
    }

    /**
     * Pads a string to the specified width.
     *
     * @param s the string to pad
     * @param width target width
     * @param rightAlign true for right alignment, false for left
     * @return padded string
     */
    static String pad(String s, int width, boolean rightAlign) {
        if (s.length() >= width) {
            return s;
        }
        String padding = " ".repeat(width - s.length());
        return rightAlign ? padding + s : s + padding;
    }

    private static void appendRow(StringBuilder sb, String[] cells, int[] widths) {
        for (int c = 0; c < cells.length; c++) {
            if (c > 0) {
                sb.append("  ");
            }
            // label column left aligned, numbers right aligned
            sb.append(pad(cells[c], widths[c], c > 0));
        }
        sb.append('\n');
    }
}
