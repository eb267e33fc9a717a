package com.conveyal.supplycurve.techmap;

import com.conveyal.supplycurve.SyntheticInputs;
import com.conveyal.supplycurve.generation.GenerationResults;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static com.conveyal.supplycurve.SyntheticInputs.BLOCK;
import static com.conveyal.supplycurve.SyntheticInputs.SIZE;

class NearestSiteTechMapBuilderTest {

    @TempDir
    Path tempDir;

    /**
     * Sites lie at the center of each 64 pixel block, so pixels well inside a block must map to that block's site.
     */
    @Test
    void pixelsMapToNearestSite () throws IOException {
        SyntheticInputs inputs = SyntheticInputs.create(tempDir);
        new NearestSiteTechMapBuilder().build(inputs.exclusionFile, inputs.generationFile, inputs.techMapFile);
        try (TechMap techMap = TechMap.open(inputs.techMapFile)) {
            Assertions.assertEquals(SIZE, techMap.nRows);
            Assertions.assertEquals(SIZE, techMap.nCols);
            for (int blockRow = 0; blockRow < SIZE; blockRow += BLOCK) {
                for (int blockCol = 0; blockCol < SIZE; blockCol += BLOCK) {
                    int expected = SyntheticInputs.blockGid(blockRow, blockCol);
                    Assertions.assertEquals(expected, techMap.resourceGid(blockRow + BLOCK / 2, blockCol + BLOCK / 2));
                    Assertions.assertEquals(expected, techMap.resourceGid(blockRow + 4, blockCol + 4));
                    Assertions.assertEquals(expected, techMap.resourceGid(blockRow + BLOCK - 5, blockCol + BLOCK - 5));
                }
            }
        }
        // Only the finished tech map is left behind.
        try (Stream<Path> files = Files.list(tempDir)) {
            Assertions.assertEquals(0, files.filter(p -> p.toString().endsWith(".partial")).count());
        }
    }

    @Test
    void noSitesMapsNoPixels () throws IOException {
        SyntheticInputs inputs = SyntheticInputs.create(tempDir);
        File emptyGeneration = tempDir.resolve("empty.csv").toFile();
        Files.write(emptyGeneration.toPath(), "gid,latitude,longitude\n".getBytes(StandardCharsets.UTF_8));
        try (GenerationResults generation = GenerationResults.open(emptyGeneration)) {
            int[] resourceGids = new NearestSiteTechMapBuilder().mapPixels(SyntheticInputs.extents(), generation);
            Assertions.assertEquals(SIZE * SIZE, resourceGids.length);
            for (int resourceGid : resourceGids) {
                Assertions.assertEquals(TechMap.NO_RESOURCE, resourceGid);
            }
        }
    }

}
