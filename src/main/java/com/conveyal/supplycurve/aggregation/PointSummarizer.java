package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.error.EmptySupplyCurvePointException;
import com.conveyal.supplycurve.generation.GenerationResults;
import com.conveyal.supplycurve.grid.ExclusionLayer;
import com.conveyal.supplycurve.grid.SupplyCurveExtent;
import com.conveyal.supplycurve.techmap.TechMap;

import java.util.List;

/**
 * Computes the summary of a single supply curve point from already-open input handles. The caller opens the handles
 * before and closes them after a run of calls, so implementations must not close them.
 *
 * Implementations are shared by all workers of one aggregation and must be threadsafe.
 */
public interface PointSummarizer {

    /**
     * @param attributes names of the attributes to include, or null for the defaults. Names the summarizer does not
     *                   recognize are left out of the summary with a warning.
     * @throws EmptySupplyCurvePointException if no generation site is reachable from the point once exclusions apply.
     */
    PointSummary summarize (int gid, ExclusionLayer exclusions, GenerationResults generation, TechMap techMap,
                            SupplyCurveExtent extent, List<String> attributes) throws EmptySupplyCurvePointException;

}
