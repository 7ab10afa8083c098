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

package io.nosqlbench.relevance.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/// The basis functions still retained by a fit.
///
/// ## Layout
///
/// ```text
///   position:   0      1      2     ...   size-1
///   column:    c0     c1     c2     ...   bias column (when biasUsed)
///   label:     l0     l1     l2     ...   (unlabeled, reported as "bias")
/// ```
///
/// Positions index the current (pruned) basis matrix; columns are the indices of the
/// same basis functions in the matrix originally passed to the fit. When the bias is
/// in use it is always the last position, and there is one label fewer than there are
/// positions.
///
/// Instances are immutable; [#retain(boolean\[\])] returns a new, smaller set.
public final class RelevanceSet {

    /// Label reported for the intercept column.
    public static final String BIAS_LABEL = "bias";

    private final int[] columns;
    private final List<String> labels;
    private final boolean biasUsed;

    private RelevanceSet(int[] columns, List<String> labels, boolean biasUsed) {
        this.columns = columns;
        this.labels = labels;
        this.biasUsed = biasUsed;
    }

    /// Creates the set that retains every basis function of a fresh fit.
    ///
    /// @param basisCount number of columns in the basis matrix, bias column included
    /// @param labels one label per non-bias column
    /// @param biasUsed whether the last column is the intercept
    /// @return the full relevance set
    public static RelevanceSet full(int basisCount, List<String> labels, boolean biasUsed) {
        int labelled = biasUsed ? basisCount - 1 : basisCount;
        if (labels.size() != labelled) {
            throw new IllegalArgumentException(
                "Expected " + labelled + " labels for " + basisCount + " columns, got " + labels.size());
        }
        int[] columns = new int[basisCount];
        for (int i = 0; i < basisCount; i++) {
            columns[i] = i;
        }
        return new RelevanceSet(columns, Collections.unmodifiableList(new ArrayList<>(labels)), biasUsed);
    }

    /// Returns a new set keeping only the positions whose mask entry is true.
    ///
    /// The bias flag is cleared when the bias position is masked out and never set again.
    ///
    /// @param keep one entry per current position
    /// @return the retained subset
    public RelevanceSet retain(boolean[] keep) {
        if (keep.length != columns.length) {
            throw new IllegalArgumentException(
                "Mask length " + keep.length + " does not match relevance set size " + columns.length);
        }
        int[] kept = new int[countKept(keep)];
        List<String> keptLabels = new ArrayList<>();
        int next = 0;
        for (int i = 0; i < columns.length; i++) {
            if (keep[i]) {
                kept[next++] = columns[i];
                if (!isBiasPosition(i)) {
                    keptLabels.add(labels.get(i));
                }
            }
        }
        boolean stillBiased = biasUsed && keep[columns.length - 1];
        return new RelevanceSet(kept, Collections.unmodifiableList(keptLabels), stillBiased);
    }

    /// Returns the labels of the positions a mask would remove.
    ///
    /// @param keep one entry per current position
    /// @return labels of the removed basis functions, bias included as [#BIAS_LABEL]
    public List<String> removedLabels(boolean[] keep) {
        List<String> removed = new ArrayList<>();
        for (int i = 0; i < keep.length; i++) {
            if (!keep[i]) {
                removed.add(labelAt(i));
            }
        }
        return removed;
    }

    /// Returns the label of a position, or [#BIAS_LABEL] for the bias position.
    public String labelAt(int position) {
        return isBiasPosition(position) ? BIAS_LABEL : labels.get(position);
    }

    /// Returns true if the position holds the intercept column.
    public boolean isBiasPosition(int position) {
        return biasUsed && position == columns.length - 1;
    }

    public int size() {
        return columns.length;
    }

    /// Original column indices of the retained basis functions, in order.
    public int[] columns() {
        return columns.clone();
    }

    /// Labels of the retained non-bias basis functions, in order.
    public List<String> labels() {
        return Collections.unmodifiableList(labels);
    }

    public boolean biasUsed() {
        return biasUsed;
    }

    /// Verifies a set that was not built through [#full] and [#retain], such as one read
    /// back from a model file.
    ///
    /// @param basisCount column count of the basis the set indexes into
    /// @throws IllegalStateException if the set is incomplete or inconsistent
    public void checkIntegrity(int basisCount) {
        if (columns == null || labels == null) {
            throw new IllegalStateException("relevance set is missing its columns or labels");
        }
        int labelled = biasUsed ? columns.length - 1 : columns.length;
        if (labelled < 0 || labels.size() != labelled) {
            throw new IllegalStateException("relevance set has " + labels.size() + " labels for "
                + columns.length + " columns" + (biasUsed ? " with a bias column" : ""));
        }
        if (labels.contains(null)) {
            throw new IllegalStateException("relevance set has a null label");
        }
        int previous = -1;
        for (int column : columns) {
            if (column <= previous || column >= basisCount) {
                throw new IllegalStateException("relevance set columns " + Arrays.toString(columns)
                    + " are not increasing indices below " + basisCount);
            }
            previous = column;
        }
        if (biasUsed && columns[columns.length - 1] != basisCount - 1) {
            throw new IllegalStateException("bias column must be the last of " + basisCount + " columns");
        }
    }

    private static int countKept(boolean[] keep) {
        int count = 0;
        for (boolean k : keep) {
            if (k) {
                count++;
            }
        }
        return count;
    }

    @Override
    public String toString() {
        return "RelevanceSet{columns=" + Arrays.toString(columns) + ", labels=" + labels + ", biasUsed=" + biasUsed + "}";
    }
}
