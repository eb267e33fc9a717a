package com.conveyal.supplycurve.grid;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

class ExclusionLayerTest {

    @TempDir
    Path tempDir;

    @Test
    void writtenValuesCanBeRead () throws IOException {
        RasterExtents extents = new RasterExtents(1000, 2000, 3, 2, 14);
        int[][] values = {{0, 1, 2}, {3, 0, 5}};
        File file = tempDir.resolve("exclusions.bin").toFile();
        ExclusionLayer.write(file, extents, values);

        Assertions.assertEquals(extents, ExclusionLayer.readExtents(file));
        try (ExclusionLayer layer = ExclusionLayer.open(file)) {
            Assertions.assertEquals(2, layer.nRows());
            Assertions.assertEquals(3, layer.nCols());
            Assertions.assertEquals(5, layer.value(1, 2));
            Assertions.assertFalse(layer.isIncluded(0, 0));
            Assertions.assertTrue(layer.isIncluded(0, 2));
            Assertions.assertThrows(IndexOutOfBoundsException.class, () -> layer.value(2, 0));
        }
    }

    @Test
    void closedLayerCannotBeRead () throws IOException {
        File file = tempDir.resolve("exclusions.bin").toFile();
        ExclusionLayer.write(file, new RasterExtents(0, 0, 1, 1, 12), new int[][] {{1}});
        ExclusionLayer layer = ExclusionLayer.open(file);
        layer.close();
        Assertions.assertTrue(layer.isClosed());
        Assertions.assertThrows(IllegalStateException.class, () -> layer.value(0, 0));
    }

    @Test
    void truncatedFileIsRejected () throws IOException {
        File file = tempDir.resolve("exclusions.bin").toFile();
        ExclusionLayer.write(file, new RasterExtents(0, 0, 4, 4, 12), new int[4][4]);
        byte[] bytes = Files.readAllBytes(file.toPath());
        Files.write(file.toPath(), Arrays.copyOf(bytes, bytes.length - 4));
        Assertions.assertThrows(IOException.class, () -> ExclusionLayer.open(file));
    }

    @Test
    void negativeValuesCannotBeWritten () {
        File file = tempDir.resolve("exclusions.bin").toFile();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ExclusionLayer.write(file, new RasterExtents(0, 0, 1, 1, 12), new int[][] {{-1}}));
    }

}
