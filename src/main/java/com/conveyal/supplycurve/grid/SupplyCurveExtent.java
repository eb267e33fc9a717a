package com.conveyal.supplycurve.grid;

import java.io.File;
import java.io.IOException;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

/**
 * The grid of supply curve points laid over an exclusion raster. Each supply curve point (identified by its gid) covers
 * a square block of resolution x resolution exclusion pixels. Blocks in the last row and column are clipped to the
 * raster edge when the raster shape is not a multiple of the resolution.
 *
 * Gids are numbered in row-major order: gid = rowInd * nCols + colInd.
 */
public class SupplyCurveExtent {

    public static final int DEFAULT_RESOLUTION = 64;

    /** Side length of one supply curve point in exclusion pixels. */
    public final int resolution;

    /** Shape of the underlying exclusion raster. */
    public final int exclusionRows;
    public final int exclusionCols;

    /** Shape of the supply curve point grid. */
    public final int nRows;
    public final int nCols;

    public SupplyCurveExtent (int exclusionRows, int exclusionCols, int resolution) {
        checkArgument(resolution > 0, "Supply curve resolution must be positive, got %s.", resolution);
        checkArgument(exclusionRows > 0 && exclusionCols > 0, "Exclusion raster must not be empty.");
        this.resolution = resolution;
        this.exclusionRows = exclusionRows;
        this.exclusionCols = exclusionCols;
        this.nRows = ceilDiv(exclusionRows, resolution);
        this.nCols = ceilDiv(exclusionCols, resolution);
        checkArgument((long) nRows * nCols <= Integer.MAX_VALUE, "Too many supply curve points at this resolution.");
    }

    public static SupplyCurveExtent forExtents (RasterExtents extents, int resolution) {
        return new SupplyCurveExtent(extents.nRows(), extents.nCols(), resolution);
    }

    /** Reads only the header of the exclusion file to establish its shape. */
    public static SupplyCurveExtent forExclusionFile (File exclusionFile, int resolution) throws IOException {
        return forExtents(ExclusionLayer.readExtents(exclusionFile), resolution);
    }

    /** @return the total number of supply curve points, i.e. one more than the highest gid. */
    public int size () {
        return nRows * nCols;
    }

    /** @return all gids in this extent, in ascending order. */
    public int[] allGids () {
        int[] gids = new int[size()];
        for (int gid = 0; gid < gids.length; gid++) {
            gids[gid] = gid;
        }
        return gids;
    }

    public int rowInd (int gid) {
        checkElementIndex(gid, size(), "supply curve gid");
        return gid / nCols;
    }

    public int colInd (int gid) {
        checkElementIndex(gid, size(), "supply curve gid");
        return gid % nCols;
    }

    /** First exclusion row covered by the given point (inclusive). */
    public int rowStart (int gid) {
        return rowInd(gid) * resolution;
    }

    /** Last exclusion row covered by the given point (exclusive). */
    public int rowEnd (int gid) {
        return (int) Math.min((long) rowStart(gid) + resolution, exclusionRows);
    }

    public int colStart (int gid) {
        return colInd(gid) * resolution;
    }

    public int colEnd (int gid) {
        return (int) Math.min((long) colStart(gid) + resolution, exclusionCols);
    }

    /** Ceiling of a positive numerator over a positive denominator, without overflow for any int inputs. */
    private static int ceilDiv (int numerator, int denominator) {
        return (numerator - 1) / denominator + 1;
    }

    @Override
    public String toString () {
        return String.format("SupplyCurveExtent[%dx%d points at resolution %d over %dx%d pixels]",
                nRows, nCols, resolution, exclusionRows, exclusionCols);
    }

}
