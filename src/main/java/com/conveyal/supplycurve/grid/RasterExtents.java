package com.conveyal.supplycurve.grid;

import org.apache.commons.math3.util.FastMath;

import java.io.Serializable;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static org.apache.commons.math3.util.FastMath.atan;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sinh;

/**
 * The position and size of an exclusion raster within the full-world web Mercator pixel grid at some zoom level.
 * Exclusion rasters are much finer than opportunity grids, so the allowed zoom range is higher. Rows of the raster
 * correspond to web Mercator y (increasing southward) and columns to web Mercator x (increasing eastward).
 *
 * Equals and hashcode are semantic, so two rasters can be checked for alignment before they are combined.
 */
public class RasterExtents implements Serializable {

    public static final int MIN_ZOOM = 9;
    public static final int MAX_ZOOM = 20;

    /** Exclusion rasters are read through memory mapped buffers, which are addressed with int byte offsets. */
    private static final long MAX_PIXELS = (Integer.MAX_VALUE - 64) / Integer.BYTES;

    /** The pixel number of the westernmost column (smallest x value). */
    public final int west;

    /** The pixel number of the northernmost row (smallest y value, since y increases from north to south). */
    public final int north;

    /** Width in web Mercator pixels, i.e. the number of columns. */
    public final int width;

    /** Height in web Mercator pixels, i.e. the number of rows. */
    public final int height;

    /** Web Mercator zoom level. */
    public final int zoom;

    public RasterExtents (int west, int north, int width, int height, int zoom) {
        this.west = west;
        this.north = north;
        this.width = width;
        this.height = height;
        this.zoom = zoom;
        checkRasterSize();
    }

    public int nRows () {
        return height;
    }

    public int nCols () {
        return width;
    }

    public long nPixels () {
        return (long) width * height;
    }

    /** @return the WGS84 latitude of the center of every pixel in the given raster row. */
    public double rowCenterLat (int row) {
        checkElementIndex(row, height, "row");
        return pixelToLat(north + row + 0.5, zoom);
    }

    /** @return the WGS84 longitude of the center of every pixel in the given raster column. */
    public double colCenterLon (int col) {
        checkElementIndex(col, width, "column");
        return pixelToLon(west + col + 0.5, zoom);
    }

    /**
     * Approximate ground area of one pixel in the given row, in square kilometers. Web Mercator pixels are square
     * on the ground, with a side length shrinking by the cosine of latitude.
     */
    public double pixelAreaSqKm (int row) {
        double lat = rowCenterLat(row);
        double equatorialSideKm = EARTH_CIRCUMFERENCE_KM / (Math.pow(2, zoom) * 256);
        double sideKm = equatorialSideKm * cos(FastMath.toRadians(lat));
        return sideKm * sideKm;
    }

    private void checkRasterSize () {
        checkArgument(zoom >= MIN_ZOOM && zoom <= MAX_ZOOM,
                "Raster zoom (%s) is outside valid range (%s - %s)", zoom, MIN_ZOOM, MAX_ZOOM);
        checkArgument(width >= 1 && height >= 1, "Raster must have at least one row and one column.");
        checkArgument(west >= 0 && north >= 0, "Raster origin must be within the world.");
        checkArgument(nPixels() <= MAX_PIXELS,
                "Raster size (%s pixels) exceeds limit (%s).", nPixels(), MAX_PIXELS);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RasterExtents extents = (RasterExtents) o;
        return west == extents.west && north == extents.north && width == extents.width &&
                height == extents.height && zoom == extents.zoom;
    }

    @Override
    public int hashCode () {
        return Arrays.hashCode(new int[] {west, north, width, height, zoom});
    }

    @Override
    public String toString () {
        return String.format("[zoom %d, west %d, north %d, %dx%d]", zoom, west, north, width, height);
    }

    /* Functions below from http://wiki.openstreetmap.org/wiki/Slippy_map_tilenames#Mathematics */

    /** Equatorial circumference used by the spherical Mercator pseudo-projection. */
    private static final double EARTH_CIRCUMFERENCE_KM = 40075.016686;

    /** Longitude of the west edge of an integer pixel, or a location within it for fractional pixel numbers. */
    public static double pixelToLon (double xPixel, int zoom) {
        return xPixel / (Math.pow(2, zoom) * 256) * 360 - 180;
    }

    /** Latitude of the north edge of an integer pixel, or a location within it for fractional pixel numbers. */
    public static double pixelToLat (double yPixel, int zoom) {
        return FastMath.toDegrees(atan(sinh(Math.PI - (yPixel / 256d) / Math.pow(2, zoom) * 2 * Math.PI)));
    }

}
