package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.error.SupplyCurveInputException;
import com.conveyal.supplycurve.grid.SupplyCurveExtent;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Everything needed to run one aggregation: the three input files and the options controlling which points are
 * summarized, how the work is spread across threads and how results are returned. Built fluently, e.g.
 *
 * <pre>
 * AggregationRequest.forFiles(exclusions, generation, techMap).withResolution(128).withWorkerCount(4)
 * </pre>
 */
public class AggregationRequest {

    private final File exclusionFile;
    private final File generationFile;
    private final File techMapFile;

    private int resolution = SupplyCurveExtent.DEFAULT_RESOLUTION;

    /** Null means all points in the extent. */
    private int[] gids = null;

    /** Null means one worker per available processor. One means run serially on the calling thread. */
    private Integer workerCount = null;

    private OutputFormat outputFormat = OutputFormat.TABLE;

    /** Null means the summarizer's default attributes. */
    private List<String> attributes = null;

    private int chunkSize = GidChunks.DEFAULT_CHUNK_SIZE;

    private AggregationRequest (File exclusionFile, File generationFile, File techMapFile) {
        checkInput(exclusionFile != null, "Exclusion file must be specified.");
        checkInput(generationFile != null, "Generation file must be specified.");
        checkInput(techMapFile != null, "Tech map file must be specified.");
        this.exclusionFile = exclusionFile;
        this.generationFile = generationFile;
        this.techMapFile = techMapFile;
    }

    public static AggregationRequest forFiles (File exclusionFile, File generationFile, File techMapFile) {
        return new AggregationRequest(exclusionFile, generationFile, techMapFile);
    }

    public AggregationRequest withResolution (int resolution) {
        checkInput(resolution > 0, "Resolution must be positive, got " + resolution);
        this.resolution = resolution;
        return this;
    }

    public AggregationRequest withGids (int... gids) {
        if (gids != null) {
            for (int gid : gids) {
                checkInput(gid >= 0, "Supply curve gids must not be negative, got " + gid);
            }
        }
        this.gids = gids == null ? null : gids.clone();
        return this;
    }

    public AggregationRequest withWorkerCount (Integer workerCount) {
        checkInput(workerCount == null || workerCount > 0, "Worker count must be positive, got " + workerCount);
        this.workerCount = workerCount;
        return this;
    }

    public AggregationRequest withOutputFormat (OutputFormat outputFormat) {
        this.outputFormat = checkNotNull(outputFormat);
        return this;
    }

    public AggregationRequest withAttributes (List<String> attributes) {
        this.attributes = attributes == null ? null : Collections.unmodifiableList(new ArrayList<>(attributes));
        return this;
    }

    public AggregationRequest withChunkSize (int chunkSize) {
        checkInput(chunkSize > 0, "Chunk size must be positive, got " + chunkSize);
        this.chunkSize = chunkSize;
        return this;
    }

    public File exclusionFile () { return exclusionFile; }
    public File generationFile () { return generationFile; }
    public File techMapFile () { return techMapFile; }
    public int resolution () { return resolution; }
    public int[] gids () { return gids == null ? null : gids.clone(); }
    public Integer workerCount () { return workerCount; }
    public OutputFormat outputFormat () { return outputFormat; }
    public List<String> attributes () { return attributes; }
    public int chunkSize () { return chunkSize; }

    /** The worker count to actually use, substituting the number of available processors for null. */
    public int effectiveWorkerCount () {
        return workerCount == null ? Runtime.getRuntime().availableProcessors() : workerCount;
    }

    /** Invalid options are input errors, reported before any work is done. */
    private static void checkInput (boolean valid, String message) {
        if (!valid) {
            throw new SupplyCurveInputException(message);
        }
    }

    @Override
    public String toString () {
        return String.format("AggregationRequest[exclusions=%s, generation=%s, techMap=%s, resolution=%d, %s, " +
                        "workers=%s, format=%s, attributes=%s, chunkSize=%d]",
                exclusionFile, generationFile, techMapFile, resolution,
                gids == null ? "all gids" : gids.length + " gids",
                workerCount == null ? "auto" : workerCount, outputFormat,
                attributes == null ? "default" : attributes, chunkSize);
    }

}
