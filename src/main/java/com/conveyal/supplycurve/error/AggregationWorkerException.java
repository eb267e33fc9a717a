package com.conveyal.supplycurve.error;

import com.conveyal.supplycurve.util.ExceptionUtils;

/**
 * Thrown when processing one chunk of supply curve points fails for any reason other than an empty point. The whole
 * aggregation fails with it: no results from other chunks are returned.
 */
public class AggregationWorkerException extends RuntimeException {

    /** Chunk index of a failure not confined to one chunk: a serial run, or the thread collecting chunk results. */
    public static final int NO_CHUNK = -1;

    /** Index of the failed chunk in submission order, or NO_CHUNK. */
    public final int chunkIndex;

    public final int firstGid;

    public final int lastGid;

    public AggregationWorkerException (int chunkIndex, int firstGid, int lastGid, Throwable cause) {
        super(String.format("Aggregation failed%s (gids %d through %d): %s",
                chunkIndex == NO_CHUNK ? "" : " in chunk " + chunkIndex, firstGid, lastGid,
                ExceptionUtils.shortCauseString(cause)), cause);
        this.chunkIndex = chunkIndex;
        this.firstGid = firstGid;
        this.lastGid = lastGid;
    }

}
