package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.error.AggregationWorkerException;
import com.conveyal.supplycurve.error.EmptySupplyCurvePointException;
import com.conveyal.supplycurve.error.SupplyCurveInputException;
import com.conveyal.supplycurve.generation.GenerationResults;
import com.conveyal.supplycurve.grid.ExclusionLayer;
import com.conveyal.supplycurve.grid.SupplyCurveExtent;
import com.conveyal.supplycurve.techmap.TechMap;
import com.conveyal.supplycurve.techmap.TechMapResolver;
import com.conveyal.supplycurve.util.ProgressCounter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Summarizes the exclusion pixels and generation results falling within each requested supply curve point.
 *
 * Points are either summarized one after another on the calling thread, or split into contiguous chunks that are
 * summarized concurrently by a fixed pool of threads. Chunk tasks share nothing mutable: each one opens its own
 * read-only handles on the three input files. Chunk results are collected in whatever order they complete and merged.
 * A point with no usable pixels is simply left out of the result. Any other failure in any chunk fails the whole
 * aggregation, and no partial result is returned.
 *
 * The tech map relating exclusion pixels to resource sites is built before any point is summarized if it does not
 * already exist.
 */
public class Aggregation {

    /** Options for a single aggregation run, e.g. as loaded from a properties file. */
    public interface Config {
        File exclusionFile ();
        File generationFile ();
        File techMapFile ();
        int resolution ();
        /** Null means all points in the extent. */
        int[] gids ();
        /** Null means one worker per available processor. */
        Integer workerCount ();
        OutputFormat outputFormat ();
        /** Null means the default summary attributes. */
        List<String> summaryAttributes ();
        int chunkSize ();
    }

    private final TechMapResolver techMapResolver;

    private final PointSummarizer summarizer;

    private final Logger log;

    public Aggregation () {
        this(new TechMapResolver(), new SupplyCurvePointSummary());
    }

    public Aggregation (TechMapResolver techMapResolver, PointSummarizer summarizer) {
        this(techMapResolver, summarizer, LoggerFactory.getLogger(Aggregation.class));
    }

    public Aggregation (TechMapResolver techMapResolver, PointSummarizer summarizer, Logger log) {
        this.techMapResolver = checkNotNull(techMapResolver);
        this.summarizer = checkNotNull(summarizer);
        this.log = checkNotNull(log);
    }

    public static AggregationRequest requestFromConfig (Config config) {
        return AggregationRequest.forFiles(config.exclusionFile(), config.generationFile(), config.techMapFile())
                .withResolution(config.resolution())
                .withGids(config.gids())
                .withWorkerCount(config.workerCount())
                .withOutputFormat(config.outputFormat())
                .withAttributes(config.summaryAttributes())
                .withChunkSize(config.chunkSize());
    }

    /**
     * Summarize every requested supply curve point.
     * @throws SupplyCurveInputException if an input file is missing or unreadable, before any work is done.
     * @throws com.conveyal.supplycurve.error.TechMapBuildException if the missing tech map could not be built.
     * @throws AggregationWorkerException if summarizing any point fails for a reason other than it being empty.
     */
    public AggregateResult aggregate (AggregationRequest request) {
        checkNotNull(request);
        checkReadable(request.exclusionFile(), "Exclusion");
        checkReadable(request.generationFile(), "Generation results");
        log.debug("Starting {}", request);

        techMapResolver.ensureTechMap(request.exclusionFile(), request.generationFile(), request.techMapFile());

        int[] gids = resolveGids(request);
        Map<Integer, PointSummary> summaries;
        if (gids.length == 0) {
            log.info("No supply curve points were requested, the result will be empty.");
            summaries = Collections.emptyMap();
        } else if (request.effectiveWorkerCount() == 1) {
            log.info("Running supply curve point aggregation for points {} through {} at a resolution of {} in serial.",
                    gids[0], gids[gids.length - 1], request.resolution());
            summaries = summarizeChunk(request, gids, AggregationWorkerException.NO_CHUNK);
        } else {
            summaries = summarizeInParallel(request, gids);
        }
        log.info("Supply curve point aggregation produced {} non-empty points out of {} requested.",
                summaries.size(), gids.length);
        return new AggregateResult(request.outputFormat(), summaries);
    }

    private static void checkReadable (File file, String description) {
        if (!file.isFile() || !file.canRead()) {
            throw new SupplyCurveInputException(description + " file does not exist or cannot be read: " + file);
        }
    }

    /** @return the requested gids without repeats, in their original order, or every gid if none were requested. */
    private int[] resolveGids (AggregationRequest request) {
        int[] gids = request.gids();
        if (gids == null) {
            try {
                return SupplyCurveExtent.forExclusionFile(request.exclusionFile(), request.resolution()).allGids();
            } catch (IOException e) {
                throw new SupplyCurveInputException("Could not read the extents of " + request.exclusionFile(), e);
            }
        }
        TIntSet seen = new TIntHashSet(gids.length);
        TIntList unique = new TIntArrayList(gids.length);
        for (int gid : gids) {
            if (seen.add(gid)) unique.add(gid);
        }
        if (unique.size() < gids.length) {
            log.warn("Ignoring {} repeated supply curve gids.", gids.length - unique.size());
        }
        return unique.toArray();
    }

    /**
     * Summarize the given points one by one using a private set of file handles, which are released on every exit
     * path. This is the serial aggregation and also the unit of work run by each thread of a parallel aggregation.
     * @param chunkIndex the position of this chunk among those submitted to the thread pool, or
     *                   {@link AggregationWorkerException#NO_CHUNK} for a serial run.
     */
    private Map<Integer, PointSummary> summarizeChunk (AggregationRequest request, int[] gids, int chunkIndex) {
        Map<Integer, PointSummary> summaries = new HashMap<>(gids.length);
        try (ExclusionLayer exclusions = ExclusionLayer.open(request.exclusionFile());
             GenerationResults generation = GenerationResults.open(request.generationFile());
             TechMap techMap = TechMap.open(request.techMapFile())) {
            checkState(techMap.nRows == exclusions.nRows() && techMap.nCols == exclusions.nCols(),
                    "Tech map %s has shape %sx%s but exclusions %s have shape %sx%s.", techMap.file,
                    techMap.nRows, techMap.nCols, exclusions.file, exclusions.nRows(), exclusions.nCols());
            SupplyCurveExtent extent = SupplyCurveExtent.forExtents(exclusions.extents, request.resolution());
            for (int gid : gids) {
                try {
                    PointSummary summary = summarizer.summarize(gid, exclusions, generation, techMap, extent,
                            request.attributes());
                    summary.put(PointSummary.SC_GID, gid)
                           .put(PointSummary.SC_ROW_IND, extent.rowInd(gid))
                           .put(PointSummary.SC_COL_IND, extent.colInd(gid));
                    summaries.put(gid, summary);
                } catch (EmptySupplyCurvePointException e) {
                    log.debug("SC gid {} is fully excluded or does not have any valid source data: {}",
                            gid, e.getMessage());
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new AggregationWorkerException(chunkIndex, gids[0], gids[gids.length - 1], e);
        }
        return summaries;
    }

    private Map<Integer, PointSummary> summarizeInParallel (AggregationRequest request, int[] gids) {
        List<int[]> chunks = GidChunks.partition(gids, request.chunkSize());
        int nThreads = Math.min(request.effectiveWorkerCount(), chunks.size());
        log.info("Running supply curve point aggregation for points {} through {} at a resolution of {} " +
                "on {} cores in {} chunks.", gids[0], gids[gids.length - 1], request.resolution(),
                nThreads, chunks.size());

        // The queue holds every chunk descriptor up front, so submission never blocks or is rejected.
        BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>(chunks.size());
        ThreadPoolExecutor executor = new ThreadPoolExecutor(nThreads, nThreads, 60, TimeUnit.SECONDS, taskQueue,
                new ThreadFactoryBuilder().setNameFormat("supply-curve-aggregation-%d").setDaemon(true).build());
        CompletionService<Map<Integer, PointSummary>> completionService = new ExecutorCompletionService<>(executor);
        List<Future<Map<Integer, PointSummary>>> futures = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            final int chunkIndex = i;
            final int[] chunk = chunks.get(i);
            futures.add(completionService.submit(() -> summarizeChunk(request, chunk, chunkIndex)));
        }

        Map<Integer, PointSummary> merged = new HashMap<>(gids.length);
        ProgressCounter progress = new ProgressCounter(log, chunks.size(), 1,
                "Parallel aggregation futures collected: {} out of {}");
        try {
            for (int i = 0; i < chunks.size(); i++) {
                mergeInto(merged, completionService.take().get());
                progress.increment();
            }
        } catch (ExecutionException e) {
            cancelQueued(futures);
            Throwable cause = e.getCause();
            if (cause instanceof AggregationWorkerException) {
                throw (AggregationWorkerException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AggregationWorkerException(AggregationWorkerException.NO_CHUNK,
                    gids[0], gids[gids.length - 1], cause);
        } catch (InterruptedException | RuntimeException e) {
            // The collecting thread was interrupted or could not merge a result, so no single chunk is to blame.
            cancelQueued(futures);
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new AggregationWorkerException(AggregationWorkerException.NO_CHUNK,
                    gids[0], gids[gids.length - 1], e);
        } finally {
            awaitShutdown(executor);
        }
        return merged;
    }

    /**
     * Add the summaries of one chunk to those merged so far.
     * @throws IllegalStateException if a gid was already merged from another chunk.
     */
    static void mergeInto (Map<Integer, PointSummary> merged, Map<Integer, PointSummary> chunkSummaries) {
        for (Map.Entry<Integer, PointSummary> entry : chunkSummaries.entrySet()) {
            PointSummary previous = merged.put(entry.getKey(), entry.getValue());
            checkState(previous == null, "Supply curve gid %s was summarized in more than one chunk.", entry.getKey());
        }
    }

    /** Cancel chunks that have not started. Chunks that are already running are allowed to finish. */
    private void cancelQueued (List<Future<Map<Integer, PointSummary>>> futures) {
        int nCancelled = 0;
        for (Future<Map<Integer, PointSummary>> future : futures) {
            if (future.cancel(false)) nCancelled += 1;
        }
        log.error("Supply curve aggregation failed, cancelled {} chunks that had not yet completed.", nCancelled);
    }

    private void awaitShutdown (ThreadPoolExecutor executor) {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for {} running aggregation chunks to finish.", executor.getActiveCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

}
