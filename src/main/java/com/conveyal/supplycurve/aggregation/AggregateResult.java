package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.util.JsonUtilities;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkState;

/**
 * The outcome of a successful aggregation: the summaries of all non-empty points keyed by gid, and when a table was
 * requested, the same summaries assembled into a SupplyCurveTable.
 */
public class AggregateResult {

    public final OutputFormat format;

    private final SortedMap<Integer, PointSummary> summaries;

    private final SupplyCurveTable table;

    AggregateResult (OutputFormat format, Map<Integer, PointSummary> summaries) {
        this.format = format;
        this.summaries = Collections.unmodifiableSortedMap(new TreeMap<>(summaries));
        this.table = format == OutputFormat.TABLE ? SupplyCurveTable.fromSummaries(this.summaries) : null;
    }

    /** @return summaries keyed by gid, iterating in ascending gid order. */
    public SortedMap<Integer, PointSummary> mapping () {
        return summaries;
    }

    /** @throws IllegalStateException if the aggregation was not asked for a table. */
    public SupplyCurveTable table () {
        checkState(table != null, "Aggregation output format was %s, not %s.", format, OutputFormat.TABLE);
        return table;
    }

    public int size () {
        return summaries.size();
    }

    public boolean isEmpty () {
        return summaries.isEmpty();
    }

    /** Write the mapping as a JSON object keyed by gid. */
    public void writeMappingJson (OutputStream outputStream) throws IOException {
        Map<String, Map<String, Object>> json = new LinkedHashMap<>();
        summaries.forEach((gid, summary) -> json.put(Integer.toString(gid), summary.asMap()));
        JsonUtilities.writeJson(outputStream, json);
    }

}
