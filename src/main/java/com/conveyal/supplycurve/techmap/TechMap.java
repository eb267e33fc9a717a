package com.conveyal.supplycurve.techmap;

import com.google.common.io.LittleEndianDataOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * A read-only handle on a tech map: for each pixel of an exclusion raster, the gid of the nearest resource site, or
 * NO_RESOURCE. Like the exclusion layer, the pixel body is memory mapped so that several workers can each hold their
 * own handle on the same file without loading it all into memory.
 *
 * Format: little-endian 4-byte integers. A header (MAGIC, VERSION, height, width) followed by height * width resource
 * gids in row-major order.
 */
public class TechMap implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(TechMap.class);

    /** The bytes "TMAP" read as a little-endian integer. */
    public static final int MAGIC = 0x50414D54;

    public static final int VERSION = 1;

    /** Marks a pixel with no resource site. */
    public static final int NO_RESOURCE = -1;

    private static final int HEADER_BYTES = 4 * Integer.BYTES;

    public final File file;

    public final int nRows;

    public final int nCols;

    private final FileChannel channel;

    private final ByteBuffer pixels;

    private volatile boolean closed = false;

    private TechMap (File file, int nRows, int nCols, FileChannel channel, ByteBuffer pixels) {
        this.file = file;
        this.nRows = nRows;
        this.nCols = nCols;
        this.channel = channel;
        this.pixels = pixels;
    }

    public static TechMap open (File file) throws IOException {
        FileChannel channel = new RandomAccessFile(file, "r").getChannel();
        try {
            if (channel.size() < HEADER_BYTES) {
                throw new IOException("Tech map file is truncated: " + file);
            }
            ByteBuffer header = channel.map(FileChannel.MapMode.READ_ONLY, 0, HEADER_BYTES);
            header.order(ByteOrder.LITTLE_ENDIAN);
            if (header.getInt(0) != MAGIC) {
                throw new IOException("Not a tech map file: " + file);
            }
            int version = header.getInt(4);
            if (version != VERSION) {
                throw new IOException(String.format("Unsupported tech map version %d in %s.", version, file));
            }
            int nRows = header.getInt(8);
            int nCols = header.getInt(12);
            if (nRows < 1 || nCols < 1) {
                throw new IOException(String.format("Tech map %s has invalid shape %dx%d.", file, nRows, nCols));
            }
            long expectedLength = HEADER_BYTES + (long) nRows * nCols * Integer.BYTES;
            if (channel.size() != expectedLength) {
                throw new IOException(String.format("Tech map %s should contain %d bytes, found %d.",
                        file, expectedLength, channel.size()));
            }
            ByteBuffer pixels = channel.map(FileChannel.MapMode.READ_ONLY, HEADER_BYTES, expectedLength - HEADER_BYTES);
            pixels.order(ByteOrder.LITTLE_ENDIAN);
            LOG.debug("Opened tech map {} with shape {}x{}.", file, nRows, nCols);
            return new TechMap(file, nRows, nCols, channel, pixels);
        } catch (IOException | RuntimeException e) {
            channel.close();
            throw e;
        }
    }

    /** @return the resource gid mapped to the given exclusion pixel, or NO_RESOURCE. */
    public int resourceGid (int row, int col) {
        checkState(!closed, "Tech map %s has been closed.", file);
        checkElementIndex(row, nRows, "row");
        checkElementIndex(col, nCols, "column");
        return pixels.getInt((row * nCols + col) * Integer.BYTES);
    }

    @Override
    public void close () throws IOException {
        closed = true;
        channel.close();
    }

    public boolean isClosed () {
        return closed;
    }

    /**
     * Write a tech map in the format read by this class.
     * @param resourceGids resource gid of each pixel in row-major order, with length nRows * nCols.
     */
    public static void write (File file, int nRows, int nCols, int[] resourceGids) throws IOException {
        try (OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(file))) {
            write(outputStream, nRows, nCols, resourceGids);
        }
    }

    public static void write (OutputStream outputStream, int nRows, int nCols, int[] resourceGids) throws IOException {
        checkArgument(nRows > 0 && nCols > 0, "Tech map must have at least one row and one column.");
        checkArgument(resourceGids.length == (long) nRows * nCols, "Expected one resource gid per pixel.");
        LittleEndianDataOutputStream out = new LittleEndianDataOutputStream(outputStream);
        out.writeInt(MAGIC);
        out.writeInt(VERSION);
        out.writeInt(nRows);
        out.writeInt(nCols);
        for (int resourceGid : resourceGids) {
            checkArgument(resourceGid >= NO_RESOURCE, "Invalid resource gid %s.", resourceGid);
            out.writeInt(resourceGid);
        }
        out.flush();
    }

}
