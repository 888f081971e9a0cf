package io.percell.command.cellgroups;

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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class CMD_cellgroupsTest {

    @TempDir
    Path tempDir;

    private Path cells;
    private Path output;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        cells = tempDir.resolve("cells");
        output = tempDir.resolve("out");
        Path region = cells.resolve("Control").resolve("R1_ch00");
        for (int i = 1; i <= 6; i++) {
            writeRamp(region.resolve(String.format("CELL%03d.tif", i)), i <= 3 ? 1 : 20);
        }
        out = new StringWriter();
        err = new StringWriter();
    }

    private static void writeRamp(Path file, int factor) throws IOException {
        BufferedImage image = new BufferedImage(4, 4, BufferedImage.TYPE_USHORT_GRAY);
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                image.getRaster().setSample(x, y, 0, (y * 4 + x) * factor);
            }
        }
        Files.createDirectories(file.getParent());
        if (!ImageIO.write(image, "TIFF", file.toFile())) {
            throw new IOException("no TIFF writer");
        }
    }

    private int run(String... args) {
        CommandLine commandLine = CMD_cellgroups.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    @Test
    @DisplayName("group writes composites and provenance per directory")
    void groupWritesOutputs() {
        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(), "--bins", "2",
            "--method", "kmeans", "--seed", "3");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("Successfully processed 1 out of 1 cell directories");
        Path outDir = output.resolve("Control").resolve("R1_ch00");
        assertThat(outDir.resolve("R1_ch00_bin_1.tif")).exists();
        assertThat(outDir.resolve("R1_ch00_bin_2.tif")).exists();
        assertThat(outDir.resolve("R1_ch00_cell_groups.csv")).exists();
        assertThat(outDir.resolve("R1_ch00_grouping_info.txt")).exists();
    }

    @Test
    @DisplayName("config file is overridden by command line values")
    void configFileLayering() throws IOException {
        Path config = Files.writeString(tempDir.resolve("grouping.json"),
            "{\"bins\": 4, \"metric\": \"max\", \"method\": \"kmeans\"}");

        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(),
            "--config", config.toString(), "-b", "2");

        assertThat(exitCode).isEqualTo(0);
        Path outDir = output.resolve("Control").resolve("R1_ch00");
        assertThat(outDir.resolve("R1_ch00_bin_3.tif")).doesNotExist();
        assertThat(Files.readString(outDir.resolve("R1_ch00_grouping_info.txt")))
            .contains("Metric: max", "Number of groups: 2", "Clustering method: kmeans");
    }

    @Test
    @DisplayName("quiet suppresses the per-directory report")
    void quietRun() {
        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(), "-q", "-b", "2");

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @DisplayName("no cell directories exits with 1")
    void noDirectories() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        int exitCode = run("group", "-c", empty.toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No cell directories found");
    }

    @Test
    @DisplayName("channel filter that matches nothing exits with 1")
    void channelFilterMatchesNothing() {
        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(), "--channels", "ch09");

        assertThat(exitCode).isEqualTo(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"--bins=0", "--method=dbscan", "--metric=median", "--max-clusters=0"})
    @DisplayName("invalid settings exit with 2")
    void invalidSettings(String option) {
        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(), option);

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Error:");
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("missing cells root exits with 2")
    void missingCellsRoot() {
        int exitCode = run("group", "-c", tempDir.resolve("absent").toString(), "-o", output.toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    @DisplayName("malformed config file exits with 2")
    void malformedConfig() throws IOException {
        Path config = Files.writeString(tempDir.resolve("broken.json"), "{bins:");

        int exitCode = run("group", "-c", cells.toString(), "-o", output.toString(), "--config", config.toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    @DisplayName("conflicting verbosity exits with 2")
    void verboseAndQuiet() {
        assertThat(run("group", "-c", cells.toString(), "-o", output.toString(), "-v", "-q")).isEqualTo(2);
    }

    @Test
    @DisplayName("unparseable arguments are usage errors")
    void usageErrors() {
        assertThat(run("group", "-c", cells.toString())).isEqualTo(2);
        assertThat(run("group", "-c", cells.toString(), "-o", output.toString(), "--bins", "many")).isEqualTo(2);
    }

    @Test
    @DisplayName("features lists every cell and a BIC table")
    void featuresListing() {
        int exitCode = run("features", "-c", cells.toString(), "--max-clusters", "3");

        assertThat(exitCode).isEqualTo(0);
        String text = out.toString();
        assertThat(text).contains("# Control/R1_ch00 (6 cells, 0 unreadable)", "cell\tauc",
            "CELL001.tif\t120.0000", "CELL006.tif\t2400.0000", "components\tbic");
        assertThat(text.lines().filter(line -> line.matches("[123]\t-?[0-9.]+(\t\\*)?"))).hasSize(3);
        assertThat(text.lines().filter(line -> line.endsWith("\t*"))).hasSize(1);
        assertThat(output).doesNotExist();
    }

    @Test
    @DisplayName("features skips BIC for identical cells")
    void featuresOnIdenticalCells() throws IOException {
        Path flat = tempDir.resolve("flat");
        for (int i = 1; i <= 3; i++) {
            writeRamp(flat.resolve("Control").resolve("R9").resolve("CELL" + i + ".tif"), 0);
        }

        int exitCode = run("features", "-c", flat.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(out.toString()).contains("BIC: skipped");
    }

    @Test
    @DisplayName("no subcommand prints usage")
    void usage() {
        assertThat(run()).isEqualTo(0);
    }
}
