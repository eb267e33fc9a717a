package com.conveyal.supplycurve.grid;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SupplyCurveExtentTest {

    @Test
    void evenlyDividedRaster () {
        SupplyCurveExtent extent = new SupplyCurveExtent(640, 640, 64);
        Assertions.assertEquals(10, extent.nRows);
        Assertions.assertEquals(10, extent.nCols);
        Assertions.assertEquals(100, extent.size());
        Assertions.assertEquals(100, extent.allGids().length);
        Assertions.assertEquals(99, extent.allGids()[99]);
        Assertions.assertEquals(1, extent.rowInd(13));
        Assertions.assertEquals(3, extent.colInd(13));
        Assertions.assertEquals(64, extent.rowStart(13));
        Assertions.assertEquals(128, extent.rowEnd(13));
        Assertions.assertEquals(192, extent.colStart(13));
        Assertions.assertEquals(256, extent.colEnd(13));
    }

    @Test
    void lastBlocksAreClippedToRaster () {
        SupplyCurveExtent extent = new SupplyCurveExtent(100, 130, 64);
        Assertions.assertEquals(2, extent.nRows);
        Assertions.assertEquals(3, extent.nCols);
        int lastGid = extent.size() - 1;
        Assertions.assertEquals(64, extent.rowStart(lastGid));
        Assertions.assertEquals(100, extent.rowEnd(lastGid));
        Assertions.assertEquals(128, extent.colStart(lastGid));
        Assertions.assertEquals(130, extent.colEnd(lastGid));
    }

    /** A resolution larger than the raster gives one point covering the whole raster, however large it is. */
    @Test
    void hugeResolutionGivesSinglePoint () {
        for (int resolution : new int[] {641, 1 << 20, Integer.MAX_VALUE - 1, Integer.MAX_VALUE}) {
            SupplyCurveExtent extent = new SupplyCurveExtent(640, 640, resolution);
            Assertions.assertEquals(1, extent.nRows);
            Assertions.assertEquals(1, extent.nCols);
            Assertions.assertArrayEquals(new int[] {0}, extent.allGids());
            Assertions.assertEquals(0, extent.rowStart(0));
            Assertions.assertEquals(640, extent.rowEnd(0));
            Assertions.assertEquals(640, extent.colEnd(0));
        }
    }

    @Test
    void gidsOutsideExtentAreRejected () {
        SupplyCurveExtent extent = new SupplyCurveExtent(640, 640, 64);
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> extent.rowInd(100));
        Assertions.assertThrows(IndexOutOfBoundsException.class, () -> extent.colStart(-1));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SupplyCurveExtent(640, 640, 0));
    }

}
