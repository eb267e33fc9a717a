package com.conveyal.supplycurve.generation;

import com.csvreader.CsvReader;
import gnu.trove.list.TDoubleList;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TDoubleArrayList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntObjectMap;
import gnu.trove.map.hash.TIntObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkState;

/**
 * A read-only handle on the per-site results of a generation run. Each row is one generation site; its position in
 * the file is its generation gid. Every row also names the resource gid it was simulated from, which is what the tech
 * map refers to, and the coordinates of that resource site.
 *
 * Results are stored as CSV with the required columns gid (resource gid), latitude and longitude. Any other column
 * whose values all parse as finite numbers is exposed as a numeric result column, e.g. cf_mean. The whole table is
 * loaded when the handle is opened: results are one row per site rather than per pixel, so this remains small
 * compared to the exclusion raster.
 */
public class GenerationResults implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(GenerationResults.class);

    public static final String RESOURCE_GID_COLUMN = "gid";
    public static final String LAT_COLUMN = "latitude";
    public static final String LON_COLUMN = "longitude";

    public final File file;

    /** Resource gid of each generation site, indexed by generation gid. */
    private final int[] resourceGids;

    private final double[] latitudes;

    private final double[] longitudes;

    /** Columns of numeric results, in file order. */
    private final Map<String, double[]> numericColumns;

    /** Generation gids simulated from each resource gid. More than one when a site was run with several configs. */
    private final TIntObjectMap<TIntList> generationGidsByResource;

    private volatile boolean closed = false;

    private GenerationResults (File file, int[] resourceGids, double[] latitudes, double[] longitudes,
                               Map<String, double[]> numericColumns) {
        this.file = file;
        this.resourceGids = resourceGids;
        this.latitudes = latitudes;
        this.longitudes = longitudes;
        this.numericColumns = Collections.unmodifiableMap(numericColumns);
        this.generationGidsByResource = new TIntObjectHashMap<>();
        for (int genGid = 0; genGid < resourceGids.length; genGid++) {
            TIntList genGids = generationGidsByResource.get(resourceGids[genGid]);
            if (genGids == null) {
                genGids = new TIntArrayList();
                generationGidsByResource.put(resourceGids[genGid], genGids);
            }
            genGids.add(genGid);
        }
    }

    /** Open a read-only handle on the generation results stored in the given CSV file. */
    public static GenerationResults open (File file) throws IOException {
        try (InputStream inputStream = new BufferedInputStream(new FileInputStream(file))) {
            GenerationResults results = read(file, inputStream);
            LOG.debug("Opened generation results {} with {} sites and numeric columns {}.",
                    file, results.size(), results.numericColumns.keySet());
            return results;
        }
    }

    private static GenerationResults read (File file, InputStream inputStream) throws IOException {
        CsvReader reader = new CsvReader(inputStream, StandardCharsets.UTF_8);
        try {
            if (!reader.readHeaders()) {
                throw new IOException("Generation results file is empty: " + file);
            }
            String[] headerArray = reader.getHeaders();
            // Spreadsheet exports often start with a UTF-8 byte order mark, which would hide the first column.
            if (headerArray.length > 0 && headerArray[0].startsWith("\uFEFF")) {
                headerArray[0] = headerArray[0].substring(1);
                reader.setHeaders(headerArray);
            }
            List<String> headers = Arrays.asList(headerArray);
            Set<String> uniqueHeaders = new HashSet<>(headers);
            if (uniqueHeaders.size() != headers.size()) {
                throw new IOException("Generation results contain duplicate column headers: " + file);
            }
            for (String required : new String[] {RESOURCE_GID_COLUMN, LAT_COLUMN, LON_COLUMN}) {
                if (!uniqueHeaders.contains(required)) {
                    throw new IOException(String.format("Column '%s' not found in generation results %s.", required, file));
                }
            }
            // Track candidate numeric columns, dropping any column with a value that is not a finite number.
            Map<String, TDoubleList> candidates = new LinkedHashMap<>();
            for (String header : headers) {
                if (!header.equals(RESOURCE_GID_COLUMN) && !header.equals(LAT_COLUMN) && !header.equals(LON_COLUMN)) {
                    candidates.put(header, new TDoubleArrayList());
                }
            }
            TIntList resourceGids = new TIntArrayList();
            TDoubleList latitudes = new TDoubleArrayList();
            TDoubleList longitudes = new TDoubleArrayList();
            while (reader.readRecord()) {
                long line = reader.getCurrentRecord() + 2;
                try {
                    resourceGids.add(Integer.parseInt(reader.get(RESOURCE_GID_COLUMN).trim()));
                    latitudes.add(Double.parseDouble(reader.get(LAT_COLUMN)));
                    longitudes.add(Double.parseDouble(reader.get(LON_COLUMN)));
                } catch (NumberFormatException e) {
                    throw new IOException(String.format("Invalid site gid or coordinates on line %d of %s.", line, file), e);
                }
                for (Iterator<Map.Entry<String, TDoubleList>> it = candidates.entrySet().iterator(); it.hasNext(); ) {
                    Map.Entry<String, TDoubleList> entry = it.next();
                    try {
                        double value = Double.parseDouble(reader.get(entry.getKey()));
                        if (Double.isFinite(value)) {
                            entry.getValue().add(value);
                            continue;
                        }
                    } catch (NumberFormatException e) {
                        // Fall through, this is not a numeric column.
                    }
                    LOG.debug("Column '{}' of {} is not numeric and will not be available.", entry.getKey(), file);
                    it.remove();
                }
            }
            Map<String, double[]> numericColumns = new LinkedHashMap<>();
            candidates.forEach((name, values) -> numericColumns.put(name, values.toArray()));
            return new GenerationResults(file, resourceGids.toArray(), latitudes.toArray(), longitudes.toArray(),
                    numericColumns);
        } finally {
            reader.close();
        }
    }

    /** @return the number of generation sites, i.e. one more than the highest generation gid. */
    public int size () {
        checkOpen();
        return resourceGids.length;
    }

    public int resourceGid (int genGid) {
        checkOpen();
        checkElementIndex(genGid, resourceGids.length, "generation gid");
        return resourceGids[genGid];
    }

    public double latitude (int genGid) {
        checkOpen();
        checkElementIndex(genGid, latitudes.length, "generation gid");
        return latitudes[genGid];
    }

    public double longitude (int genGid) {
        checkOpen();
        checkElementIndex(genGid, longitudes.length, "generation gid");
        return longitudes[genGid];
    }

    public boolean hasResource (int resourceGid) {
        checkOpen();
        return generationGidsByResource.containsKey(resourceGid);
    }

    /** @return the generation gids simulated from the given resource gid, empty if there are none. */
    public TIntList generationGids (int resourceGid) {
        checkOpen();
        TIntList genGids = generationGidsByResource.get(resourceGid);
        return genGids == null ? new TIntArrayList(0) : new TIntArrayList(genGids);
    }

    public Set<String> numericColumnNames () {
        checkOpen();
        return numericColumns.keySet();
    }

    public boolean hasNumericColumn (String name) {
        checkOpen();
        return numericColumns.containsKey(name);
    }

    public double value (String column, int genGid) {
        checkOpen();
        double[] values = numericColumns.get(column);
        if (values == null) {
            throw new IllegalArgumentException("No numeric column named " + column + " in " + file);
        }
        checkElementIndex(genGid, values.length, "generation gid");
        return values[genGid];
    }

    private void checkOpen () {
        checkState(!closed, "Generation results %s have been closed.", file);
    }

    @Override
    public void close () {
        closed = true;
    }

}
