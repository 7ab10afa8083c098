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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CsvDesignMatrixTest {

    @TempDir
    Path tempDir;

    private Path write(String content) throws IOException {
        return Files.writeString(tempDir.resolve("data.csv"), content);
    }

    @Test
    void lastColumnIsTheDefaultTarget() throws IOException {
        Path file = write("a, b, y\n1,2,3\n4,5,6\n");

        CsvDesignMatrix design = CsvDesignMatrix.readTraining(file, null, false);

        assertThat(design.labels()).containsExactly("a", "b");
        assertThat(design.samples()).isEqualTo(2);
        assertThat(design.basis().getData()).isDeepEqualTo(new double[][]{{1, 2}, {4, 5}});
        assertThat(design.target().toArray()).containsExactly(3, 6);
        assertThat(design.hasTarget()).isTrue();
    }

    @Test
    void namedTargetAndBiasColumn() throws IOException {
        Path file = write("# measured\n\ny,a,b\n3,1,2\n\n6,4,5\n");

        CsvDesignMatrix design = CsvDesignMatrix.readTraining(file, "y", true);

        assertThat(design.labels()).containsExactly("a", "b");
        assertThat(design.basis().getData()).isDeepEqualTo(new double[][]{{1, 2, 1}, {4, 5, 1}});
        assertThat(design.target().toArray()).containsExactly(3, 6);
    }

    @Test
    void inputsWithoutTargetColumn() throws IOException {
        Path file = write("a,b\n1,2\n");

        CsvDesignMatrix design = CsvDesignMatrix.readInputs(file, "y", false);

        assertThat(design.hasTarget()).isFalse();
        assertThat(design.labels()).containsExactly("a", "b");
        assertThat(design.basis().getColumnDimension()).isEqualTo(2);
    }

    @Test
    void missingTargetColumnIsAFormatError() throws IOException {
        Path file = write("a,b\n1,2\n");

        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(file, "y", false))
            .isInstanceOf(CsvFormatException.class)
            .hasMessageContaining("target column 'y'");
    }

    @Test
    void raggedRowReportsItsLine() throws IOException {
        Path file = write("a,b,y\n1,2,3\n4,5\n");

        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(file, null, false))
            .isInstanceOfSatisfying(CsvFormatException.class, e -> assertThat(e.getLine()).isEqualTo(3))
            .hasMessageContaining("expected 3 values but found 2");
    }

    @Test
    void nonNumericValueNamesTheColumn() throws IOException {
        Path file = write("a,b,y\n1,two,3\n");

        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(file, null, false))
            .isInstanceOf(CsvFormatException.class)
            .hasMessageContaining("column 'b'");
    }

    @Test
    void emptyFilesAreRejected() throws IOException {
        Path headerOnly = write("a,y\n");
        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(headerOnly, null, false))
            .isInstanceOf(CsvFormatException.class)
            .hasMessageContaining("no data rows");

        Path blank = Files.writeString(tempDir.resolve("blank.csv"), "# nothing\n");
        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(blank, null, false))
            .isInstanceOf(CsvFormatException.class)
            .hasMessageContaining("no header");
    }

    @Test
    void targetOnlyFileNeedsABias() throws IOException {
        Path file = write("y\n1\n2\n");

        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(file, null, false))
            .isInstanceOf(CsvFormatException.class);
        assertThat(CsvDesignMatrix.readTraining(file, null, true).basis().getColumnDimension()).isEqualTo(1);
    }

    @Test
    void missingFileIsAnIoError() {
        assertThatThrownBy(() -> CsvDesignMatrix.readTraining(tempDir.resolve("absent.csv"), null, false))
            .isInstanceOf(NoSuchFileException.class);
    }
}
