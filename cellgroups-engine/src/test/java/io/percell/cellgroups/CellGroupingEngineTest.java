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

package io.percell.cellgroups;

import io.percell.cellgroups.cluster.ClusterMethod;
import io.percell.cellgroups.config.GroupingConfig;
import io.percell.cellgroups.image.CellImage;
import io.percell.cellgroups.image.CellImageReader;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class CellGroupingEngineTest {

    @TempDir
    Path tempDir;

    private Path cells;
    private Path output;

    private GroupingConfig config(int bins) {
        return new GroupingConfig().setBins(bins).setMethod(ClusterMethod.KMEANS).setLogTransform(false);
    }

    /// Six 4x4 ramps scaled into three well separated intensity levels.
    private Path regionWithThreeLevels() throws IOException {
        Path region = tempDir.resolve("cells").resolve("Control").resolve("R1");
        int[] factors = {40, 1, 5, 1, 40, 5};
        for (int i = 0; i < factors.length; i++) {
            int[] samples = new int[16];
            for (int p = 0; p < samples.length; p++) {
                samples[p] = p * factors[i];
            }
            TestImages.write(region.resolve("CELL" + (i + 1) + ".tif"), 4, 4, samples);
        }
        return region;
    }

    private void setUpDirectories() {
        cells = tempDir.resolve("cells");
        output = tempDir.resolve("out");
    }

    @Test
    void writesCompositesAndProvenance() throws IOException {
        setUpDirectories();
        Path region = regionWithThreeLevels();

        DirectoryGroupingResult result = new CellGroupingEngine(config(3)).processDirectory(region, output);

        assertThat(result.success()).isTrue();
        assertThat(result.samplesRead()).isEqualTo(6);
        assertThat(result.actualBins()).isEqualTo(3);
        assertThat(result.compositesWritten()).isEqualTo(3);
        assertThat(result.failure()).isEmpty();

        Path outDir = output.resolve("Control").resolve("R1");
        assertThat(result.outputDirectory()).isEqualTo(outDir);
        for (int g = 1; g <= 3; g++) {
            CellImage composite = CellImageReader.read(outDir.resolve("R1_bin_" + g + ".tif"));
            assertThat(composite.width()).isEqualTo(4);
            assertThat(composite.height()).isEqualTo(4);
            assertThat(composite.max()).isGreaterThan(65000);
        }

        List<String> rows = Files.readAllLines(outDir.resolve("R1_cell_groups.csv"), StandardCharsets.UTF_8);
        assertThat(rows).hasSize(7);
        assertThat(rows.get(0)).isEqualTo("cell_filename,cell_id,group_id,group_name,group_mean_auc,cell_auc");
        assertThat(rows.get(1)).contains(",1,3,Group_3,4800.0,4800.0");
        assertThat(rows.get(2)).contains(",2,1,Group_1,120.0,120.0");
        assertThat(rows.get(3)).contains(",3,2,Group_2,600.0,600.0");

        String summary = Files.readString(outDir.resolve("R1_grouping_info.txt"), StandardCharsets.UTF_8);
        assertThat(summary).contains("Number of cells: 6", "Clustering method: kmeans", "Number of groups: 3",
            "Intensity range: 4680.00");
    }

    @Test
    void rerunWithFewerBinsRemovesStaleComposites() throws IOException {
        setUpDirectories();
        Path region = regionWithThreeLevels();
        Path outDir = output.resolve("Control").resolve("R1");
        Path unrelated = Files.writeString(Files.createDirectories(outDir).resolve("R1_notes.txt"), "keep");

        new CellGroupingEngine(config(3)).processDirectory(region, output);
        assertThat(outDir.resolve("R1_bin_3.tif")).exists();

        DirectoryGroupingResult rerun = new CellGroupingEngine(config(2)).processDirectory(region, output);

        assertThat(rerun.success()).isTrue();
        assertThat(outDir.resolve("R1_bin_1.tif")).exists();
        assertThat(outDir.resolve("R1_bin_2.tif")).exists();
        assertThat(outDir.resolve("R1_bin_3.tif")).doesNotExist();
        assertThat(unrelated).exists();
    }

    @Test
    void allZeroImagesStillProduceComposites() throws IOException {
        setUpDirectories();
        Path region = cells.resolve("Control").resolve("Blank");
        for (int i = 1; i <= 3; i++) {
            TestImages.writeConstant(region.resolve("CELL" + i + ".tif"), 5, 5, 0);
        }

        DirectoryGroupingResult result = new CellGroupingEngine(new GroupingConfig().setBins(5))
            .processDirectory(region, output);

        assertThat(result.success()).isTrue();
        assertThat(result.actualBins()).isEqualTo(3);
        assertThat(result.method()).isEqualTo(ClusterMethod.FORCED_QUANTILE);
        Path outDir = output.resolve("Control").resolve("Blank");
        for (int g = 1; g <= 3; g++) {
            assertThat(CellImageReader.read(outDir.resolve("Blank_bin_" + g + ".tif")).max()).isZero();
        }
        assertThat(Files.readString(outDir.resolve("Blank_grouping_info.txt")))
            .contains("Images with zero intensity: 3", "Images with non-zero intensity: 0");
    }

    @Test
    void unreadableFilesAreCountedAndSkipped() throws IOException {
        setUpDirectories();
        Path region = regionWithThreeLevels();
        Files.writeString(region.resolve("CELL99.tif"), "not an image");

        DirectoryGroupingResult result = new CellGroupingEngine(config(3)).processDirectory(region, output);

        assertThat(result.success()).isTrue();
        assertThat(result.samplesRead()).isEqualTo(6);
        assertThat(result.unreadable()).isEqualTo(1);
        assertThat(Files.readAllLines(output.resolve("Control/R1/R1_cell_groups.csv"))).hasSize(7);
    }

    @Test
    void autoBinsChoosesCountFromTheData() throws IOException {
        setUpDirectories();
        Path region = regionWithThreeLevels();

        DirectoryGroupingResult result = new CellGroupingEngine(config(8).setAutoBins(true).setMaxClusters(3))
            .processDirectory(region, output);

        assertThat(result.success()).isTrue();
        assertThat(result.actualBins()).isBetween(1, 3);
        assertThat(output.resolve("Control/R1/R1_bin_4.tif")).doesNotExist();
    }

    @Test
    void failedCompositeWriteDoesNotStopOtherGroups() throws IOException {
        setUpDirectories();
        Path region = regionWithThreeLevels();
        Path outDir = output.resolve("Control").resolve("R1");
        Path blocked = Files.createDirectories(outDir.resolve("R1_bin_1.tif"));
        Files.writeString(blocked.resolve("keep.txt"), "occupied");

        DirectoryGroupingResult result = new CellGroupingEngine(config(2)).processDirectory(region, output);

        assertThat(result.success()).isTrue();
        assertThat(result.compositesWritten()).isEqualTo(1);
        assertThat(outDir.resolve("R1_bin_2.tif")).isRegularFile();
        assertThat(blocked).isDirectory();
        assertThat(outDir.resolve("R1_cell_groups.csv")).exists();
        assertThat(outDir.resolve("R1_grouping_info.txt")).exists();
    }

    @Test
    void directoryWithoutCellsFails() throws IOException {
        setUpDirectories();
        Path empty = Files.createDirectories(cells.resolve("Control").resolve("Empty"));

        DirectoryGroupingResult result = new CellGroupingEngine(config(3)).processDirectory(empty, output);

        assertThat(result.success()).isFalse();
        assertThat(result.failure()).contains("no cell images");
        assertThat(output.resolve("Control").resolve("Empty")).doesNotExist();
    }

    @Test
    void directoryWithOnlyUnreadableCellsFails() throws IOException {
        setUpDirectories();
        Path region = Files.createDirectories(cells.resolve("Control").resolve("Broken"));
        Files.writeString(region.resolve("CELL1.tif"), "garbage");

        DirectoryGroupingResult result = new CellGroupingEngine(config(3)).processDirectory(region, output);

        assertThat(result.success()).isFalse();
        assertThat(result.unreadable()).isEqualTo(1);
    }

    @Test
    void mapsOutputDirectoryFromParentAndName() {
        Path out = Path.of("out");

        assertThat(CellGroupingEngine.outputDirectoryFor(Path.of("cells", "Treated", "R4"), out))
            .isEqualTo(out.resolve("Treated").resolve("R4"));
        assertThat(CellGroupingEngine.binFileName("R4", 2)).isEqualTo("R4_bin_2.tif");
    }

    @Test
    void invalidConfigIsRejectedUpFront() {
        assertThatThrownBy(() -> new CellGroupingEngine(new GroupingConfig().setBins(0)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
