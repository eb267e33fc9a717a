package com.conveyal.supplycurve.grid;

import com.google.common.io.LittleEndianDataInputStream;
import com.google.common.io.LittleEndianDataOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * A read-only handle on an exclusion raster. Each pixel holds an inclusion value: zero means the land is excluded from
 * development, any positive value means it is available.
 *
 * The file format follows our binary grid format: a header of five little-endian 4-byte integers (zoom, west, north,
 * width, height) followed by one little-endian 4-byte integer per pixel in row-major order (x changes faster than y).
 * Unlike opportunity grids the pixel values are not delta coded, so the body can be memory mapped and any single
 * pixel read without scanning the file. Many handles on the same file can be open at once, one per worker.
 */
public class ExclusionLayer implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(ExclusionLayer.class);

    private static final int HEADER_BYTES = 5 * Integer.BYTES;

    public final File file;

    public final RasterExtents extents;

    private final FileChannel channel;

    private final ByteBuffer pixels;

    private volatile boolean closed = false;

    private ExclusionLayer (File file, RasterExtents extents, FileChannel channel, ByteBuffer pixels) {
        this.file = file;
        this.extents = extents;
        this.channel = channel;
        this.pixels = pixels;
    }

    /** Open a read-only handle on the exclusion raster stored in the given file. */
    public static ExclusionLayer open (File file) throws IOException {
        RasterExtents extents = readExtents(file);
        long expectedLength = HEADER_BYTES + extents.nPixels() * Integer.BYTES;
        RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r");
        FileChannel channel = randomAccessFile.getChannel();
        try {
            if (channel.size() != expectedLength) {
                throw new IOException(String.format("Exclusion file %s should contain %d bytes for extents %s, found %d.",
                        file, expectedLength, extents, channel.size()));
            }
            ByteBuffer pixels = channel.map(FileChannel.MapMode.READ_ONLY, HEADER_BYTES, expectedLength - HEADER_BYTES);
            pixels.order(ByteOrder.LITTLE_ENDIAN);
            LOG.debug("Opened exclusion layer {} with extents {}.", file, extents);
            return new ExclusionLayer(file, extents, channel, pixels);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    /** Read only the header of an exclusion raster file, without opening a handle on its pixels. */
    public static RasterExtents readExtents (File file) throws IOException {
        try (InputStream inputStream = new BufferedInputStream(new FileInputStream(file))) {
            return readExtents(inputStream);
        }
    }

    private static RasterExtents readExtents (InputStream inputStream) throws IOException {
        LittleEndianDataInputStream data = new LittleEndianDataInputStream(inputStream);
        int zoom = data.readInt();
        int west = data.readInt();
        int north = data.readInt();
        int width = data.readInt();
        int height = data.readInt();
        try {
            return new RasterExtents(west, north, width, height, zoom);
        } catch (IllegalArgumentException e) {
            throw new IOException("Exclusion raster header is not valid: " + e.getMessage(), e);
        }
    }

    public int nRows () {
        return extents.height;
    }

    public int nCols () {
        return extents.width;
    }

    /** @return the inclusion value of the pixel at the given raster row and column. */
    public int value (int row, int col) {
        checkState(!closed, "Exclusion layer %s has been closed.", file);
        checkElementIndex(row, extents.height, "row");
        checkElementIndex(col, extents.width, "column");
        return pixels.getInt((row * extents.width + col) * Integer.BYTES);
    }

    public boolean isIncluded (int row, int col) {
        return value(row, col) > 0;
    }

    @Override
    public void close () throws IOException {
        // The mapping itself is released when the buffer is garbage collected, but the descriptor goes away now.
        closed = true;
        channel.close();
    }

    public boolean isClosed () {
        return closed;
    }

    /**
     * Write an exclusion raster in the format read by this class.
     * @param values inclusion values indexed as [row][column], which must match the height and width of the extents.
     */
    public static void write (File file, RasterExtents extents, int[][] values) throws IOException {
        try (OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(file))) {
            write(outputStream, extents, values);
        }
    }

    public static void write (OutputStream outputStream, RasterExtents extents, int[][] values) throws IOException {
        checkArgument(values.length == extents.height, "Expected %s rows of values.", extents.height);
        LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(outputStream);
        out.writeInt(extents.zoom);
        out.writeInt(extents.west);
        out.writeInt(extents.north);
        out.writeInt(extents.width);
        out.writeInt(extents.height);
        for (int row = 0; row < extents.height; row++) {
            checkArgument(values[row].length == extents.width, "Expected %s values in row %s.", extents.width, row);
            for (int col = 0; col < extents.width; col++) {
                int value = values[row][col];
                checkArgument(value >= 0, "Inclusion values should never be negative.");
                out.writeInt(value);
            }
        }
        out.flush();
    }

}
