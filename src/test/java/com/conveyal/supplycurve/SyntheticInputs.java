package com.conveyal.supplycurve;

import com.conveyal.supplycurve.grid.ExclusionLayer;
import com.conveyal.supplycurve.grid.RasterExtents;
import com.conveyal.supplycurve.techmap.TechMap;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes a small but realistic set of aggregation inputs into a test directory: a 640x640 pixel exclusion raster at
 * zoom 12, covered by a 10x10 grid of supply curve points at the default resolution of 64, and generation results with
 * one resource site at the center of each point. Resource gid, generation gid and supply curve gid therefore coincide.
 */
public class SyntheticInputs {

    public static final int ZOOM = 12;
    public static final int WEST = 200_000;
    public static final int NORTH = 390_000;
    public static final int SIZE = 640;
    public static final int BLOCK = 64;
    public static final int BLOCKS_PER_SIDE = SIZE / BLOCK;
    public static final int N_POINTS = BLOCKS_PER_SIDE * BLOCKS_PER_SIDE;

    public final File exclusionFile;
    public final File generationFile;
    public final File techMapFile;

    private SyntheticInputs (Path directory) {
        exclusionFile = directory.resolve("exclusions.bin").toFile();
        generationFile = directory.resolve("generation.csv").toFile();
        techMapFile = directory.resolve("techmap.bin").toFile();
    }

    public static RasterExtents extents () {
        return new RasterExtents(WEST, NORTH, SIZE, SIZE, ZOOM);
    }

    /**
     * Write the exclusion raster and generation results. The tech map file is not created.
     * @param maskedGids supply curve points whose pixels are all excluded.
     */
    public static SyntheticInputs create (Path directory, int... maskedGids) throws IOException {
        SyntheticInputs inputs = new SyntheticInputs(directory);
        int[][] values = new int[SIZE][SIZE];
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                values[row][col] = 1;
            }
        }
        for (int gid : maskedGids) {
            int rowStart = (gid / BLOCKS_PER_SIDE) * BLOCK;
            int colStart = (gid % BLOCKS_PER_SIDE) * BLOCK;
            for (int row = rowStart; row < rowStart + BLOCK; row++) {
                for (int col = colStart; col < colStart + BLOCK; col++) {
                    values[row][col] = 0;
                }
            }
        }
        ExclusionLayer.write(inputs.exclusionFile, extents(), values);

        try (PrintWriter writer = new PrintWriter(inputs.generationFile, StandardCharsets.UTF_8)) {
            writer.println("gid,latitude,longitude,cf_mean,state");
            for (int gid = 0; gid < N_POINTS; gid++) {
                writer.println(String.format(Locale.ROOT, "%d,%.8f,%.8f,%.3f,CO", gid, siteLat(gid), siteLon(gid),
                        cfMean(gid)));
            }
        }
        return inputs;
    }

    /** Write a tech map relating every pixel to the resource site of the supply curve point containing it. */
    public SyntheticInputs writeBlockTechMap () throws IOException {
        int[] resourceGids = new int[SIZE * SIZE];
        for (int row = 0; row < SIZE; row++) {
            for (int col = 0; col < SIZE; col++) {
                resourceGids[row * SIZE + col] = blockGid(row, col);
            }
        }
        TechMap.write(techMapFile, SIZE, SIZE, resourceGids);
        return this;
    }

    public static int blockGid (int row, int col) {
        return (row / BLOCK) * BLOCKS_PER_SIDE + col / BLOCK;
    }

    public static double siteLat (int gid) {
        return RasterExtents.pixelToLat(NORTH + (gid / BLOCKS_PER_SIDE) * BLOCK + BLOCK / 2, ZOOM);
    }

    public static double siteLon (int gid) {
        return RasterExtents.pixelToLon(WEST + (gid % BLOCKS_PER_SIDE) * BLOCK + BLOCK / 2, ZOOM);
    }

    public static double cfMean (int gid) {
        return 0.2 + gid * 0.001;
    }

}
