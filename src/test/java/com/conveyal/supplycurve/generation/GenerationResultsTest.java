package com.conveyal.supplycurve.generation;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

class GenerationResultsTest {

    @TempDir
    Path tempDir;

    private File writeCsv (String... lines) throws IOException {
        File file = tempDir.resolve("generation.csv").toFile();
        Files.write(file.toPath(), String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void sitesAndNumericColumnsAreLoaded () throws IOException {
        File file = writeCsv(
                "gid,latitude,longitude,cf_mean,state,annual_energy",
                "7,39.5,-105.1,0.25,CO,100",
                "3,39.6,-105.2,0.30,CO,NaN",
                "7,39.5,-105.1,0.35,CO,120");
        try (GenerationResults generation = GenerationResults.open(file)) {
            Assertions.assertEquals(3, generation.size());
            Assertions.assertEquals(3, generation.resourceGid(1));
            Assertions.assertEquals(39.6, generation.latitude(1), 1e-12);
            Assertions.assertEquals(-105.2, generation.longitude(1), 1e-12);
            Assertions.assertTrue(generation.hasResource(7));
            Assertions.assertFalse(generation.hasResource(4));
            // Generation gids are row positions. Resource 7 was simulated twice.
            Assertions.assertArrayEquals(new int[] {0, 2}, generation.generationGids(7).toArray());
            Assertions.assertEquals(0, generation.generationGids(4).size());
            // Text and non-finite columns are not numeric results.
            Assertions.assertEquals(Set.of("cf_mean"), generation.numericColumnNames());
            Assertions.assertEquals(0.35, generation.value("cf_mean", 2), 1e-12);
            Assertions.assertThrows(IllegalArgumentException.class, () -> generation.value("state", 0));
        }
    }

    @Test
    void byteOrderMarkBeforeFirstHeaderIsIgnored () throws IOException {
        File file = writeCsv("\uFEFFgid,latitude,longitude,cf_mean", "12,39.5,-105.1,0.25", "13,39.6,-105.2,0.30");
        try (GenerationResults generation = GenerationResults.open(file)) {
            Assertions.assertEquals(2, generation.size());
            Assertions.assertEquals(12, generation.resourceGid(0));
            Assertions.assertEquals(13, generation.resourceGid(1));
            Assertions.assertEquals(Set.of("cf_mean"), generation.numericColumnNames());
        }
    }

    @Test
    void missingRequiredColumnIsRejected () throws IOException {
        File file = writeCsv("gid,latitude,cf_mean", "0,39.5,0.25");
        IOException e = Assertions.assertThrows(IOException.class, () -> GenerationResults.open(file));
        Assertions.assertTrue(e.getMessage().contains("longitude"));
    }

    @Test
    void invalidCoordinatesAreRejected () throws IOException {
        File file = writeCsv("gid,latitude,longitude", "0,39.5,-105.1", "1,north,-105.2");
        Assertions.assertThrows(IOException.class, () -> GenerationResults.open(file));
    }

    @Test
    void closedResultsCannotBeRead () throws IOException {
        File file = writeCsv("gid,latitude,longitude", "0,39.5,-105.1");
        GenerationResults generation = GenerationResults.open(file);
        generation.close();
        Assertions.assertThrows(IllegalStateException.class, generation::size);
    }

}
