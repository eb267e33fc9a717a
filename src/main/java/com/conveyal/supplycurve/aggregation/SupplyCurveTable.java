package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.util.JsonUtilities;
import com.csvreader.CsvWriter;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Supply curve point summaries arranged as a table: one row per point, indexed by sc_gid in ascending order, with the
 * union of all summary attributes as columns. A point that lacks one of the columns has an empty cell there.
 *
 * Writing the table to disk is left to the caller, through writeCsv or writeJson.
 */
public class SupplyCurveTable {

    /** Columns other than the sc_gid index, in order of first appearance. */
    private final List<String> columns;

    /** Index of the table, strictly ascending. */
    private final int[] scGids;

    /** Rows aligned with scGids. */
    private final List<PointSummary> rows;

    private SupplyCurveTable (List<String> columns, int[] scGids, List<PointSummary> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.scGids = scGids;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Transpose summaries keyed by gid into a table indexed by each summary's sc_gid attribute.
     * @throws IllegalStateException if a summary has no sc_gid or two summaries share one.
     */
    public static SupplyCurveTable fromSummaries (Map<Integer, PointSummary> summaries) {
        TreeMap<Integer, PointSummary> sorted = new TreeMap<>();
        for (PointSummary summary : summaries.values()) {
            checkState(summary.has(PointSummary.SC_GID), "Summary has no %s column: %s", PointSummary.SC_GID, summary);
            PointSummary previous = sorted.put(summary.getInt(PointSummary.SC_GID), summary);
            checkState(previous == null, "Duplicate %s %s in supply curve table.",
                    PointSummary.SC_GID, summary.getInt(PointSummary.SC_GID));
        }
        Set<String> columns = new LinkedHashSet<>();
        int[] scGids = new int[sorted.size()];
        List<PointSummary> rows = new ArrayList<>(sorted.size());
        int i = 0;
        for (Map.Entry<Integer, PointSummary> entry : sorted.entrySet()) {
            scGids[i++] = entry.getKey();
            rows.add(entry.getValue());
            columns.addAll(entry.getValue().names());
        }
        columns.remove(PointSummary.SC_GID);
        return new SupplyCurveTable(new ArrayList<>(columns), scGids, rows);
    }

    public int rowCount () {
        return scGids.length;
    }

    public boolean isEmpty () {
        return scGids.length == 0;
    }

    public List<String> columns () {
        return columns;
    }

    public int[] scGids () {
        return scGids.clone();
    }

    public boolean contains (int scGid) {
        return Arrays.binarySearch(scGids, scGid) >= 0;
    }

    /** @return the summary in the row with the given sc_gid. */
    public PointSummary row (int scGid) {
        int index = Arrays.binarySearch(scGids, scGid);
        checkArgument(index >= 0, "No row with %s %s.", PointSummary.SC_GID, scGid);
        return rows.get(index);
    }

    /** @return the value in the given row and column, or null for an empty cell. */
    public Object get (int scGid, String column) {
        return row(scGid).get(column);
    }

    /** Write the table as CSV with sc_gid as the first column. Gid sets are written as "[a, b, c]". */
    public void writeCsv (File file) throws IOException {
        try (OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(file))) {
            writeCsv(outputStream);
        }
    }

    public void writeCsv (OutputStream outputStream) throws IOException {
        CsvWriter writer = new CsvWriter(outputStream, ',', StandardCharsets.UTF_8);
        String[] record = new String[columns.size() + 1];
        record[0] = PointSummary.SC_GID;
        for (int c = 0; c < columns.size(); c++) {
            record[c + 1] = columns.get(c);
        }
        writer.writeRecord(record);
        for (int r = 0; r < scGids.length; r++) {
            record[0] = Integer.toString(scGids[r]);
            PointSummary row = rows.get(r);
            for (int c = 0; c < columns.size(); c++) {
                record[c + 1] = PointSummary.formatValue(row.get(columns.get(c)));
            }
            writer.writeRecord(record);
        }
        // Flush rather than close, the caller owns the stream.
        writer.flush();
    }

    /** Write the table as a JSON array of row objects, each beginning with its sc_gid. */
    public void writeJson (OutputStream outputStream) throws IOException {
        List<Map<String, Object>> jsonRows = new ArrayList<>(scGids.length);
        for (int r = 0; r < scGids.length; r++) {
            Map<String, Object> jsonRow = new LinkedHashMap<>();
            jsonRow.put(PointSummary.SC_GID, scGids[r]);
            for (String column : columns) {
                jsonRow.put(column, rows.get(r).get(column));
            }
            jsonRows.add(jsonRow);
        }
        JsonUtilities.writeJson(outputStream, jsonRows);
    }

}
