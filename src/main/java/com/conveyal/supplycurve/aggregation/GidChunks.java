package com.conveyal.supplycurve.aggregation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Splits a sequence of supply curve gids into contiguous chunks that are processed as independent units of work.
 * The number of chunks is ceil(n / targetSize). Chunk sizes differ by at most one: the remainder is spread over the
 * first chunks, so the last chunk may be smaller than the others but is never larger. Every gid lands in exactly one
 * chunk, in its original order.
 */
public abstract class GidChunks {

    /** Bounds the work and the size of the result held by each task. */
    public static final int DEFAULT_CHUNK_SIZE = 1000;

    public static int chunkCount (int nGids, int targetSize) {
        checkArgument(targetSize > 0, "Chunk size must be positive, got %s.", targetSize);
        checkArgument(nGids >= 0);
        return (int) ((nGids + (long) targetSize - 1) / targetSize);
    }

    public static List<int[]> partition (int[] gids, int targetSize) {
        checkNotNull(gids);
        int nChunks = chunkCount(gids.length, targetSize);
        List<int[]> chunks = new ArrayList<>(nChunks);
        if (nChunks == 0) {
            return chunks;
        }
        int baseSize = gids.length / nChunks;
        int remainder = gids.length % nChunks;
        int start = 0;
        for (int i = 0; i < nChunks; i++) {
            int size = baseSize + (i < remainder ? 1 : 0);
            chunks.add(Arrays.copyOfRange(gids, start, start + size));
            start += size;
        }
        return chunks;
    }

}
