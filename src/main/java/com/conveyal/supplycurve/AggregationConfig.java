package com.conveyal.supplycurve;

import com.conveyal.supplycurve.aggregation.Aggregation;
import com.conveyal.supplycurve.aggregation.GidChunks;
import com.conveyal.supplycurve.aggregation.OutputFormat;
import com.conveyal.supplycurve.grid.SupplyCurveExtent;
import com.google.common.base.Splitter;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

import java.io.File;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/** Loads the options of a supply curve aggregation run and exposes them to the aggregation engine. */
public class AggregationConfig extends ConfigBase implements Aggregation.Config {

    /** Upper bound on the number of gids in one range of the gids option, which is expanded in memory. */
    static final int MAX_RANGE_SIZE = 10_000_000;

    private static final Splitter COMMA_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    // INSTANCE FIELDS

    private final File exclusionFile;
    private final File generationFile;
    private final File techMapFile;
    private final File outputFile;
    private final int resolution;
    private final int[] gids;
    private final Integer workerCount;
    private final OutputFormat outputFormat;
    private final List<String> summaryAttributes;
    private final int chunkSize;

    // CONSTRUCTORS

    public AggregationConfig (Properties properties) {
        this(properties, System.getenv(), System.getProperties());
    }

    AggregationConfig (Properties properties, Map<?, ?> environment, Map<?, ?> systemProperties) {
        super(properties, environment, systemProperties);
        exclusionFile = fileProp("exclusion-file");
        generationFile = fileProp("generation-file");
        techMapFile = fileProp("techmap-file");
        outputFile = fileProp("output-file");
        resolution = positiveIntProp("resolution", SupplyCurveExtent.DEFAULT_RESOLUTION);
        gids = parseGids(strProp("gids", "all"));
        workerCount = parseWorkerCount(strProp("worker-count", "auto"));
        outputFormat = parseOutputFormat(strProp("output-format", "table"));
        summaryAttributes = parseAttributes(strProp("summary-attributes", "default"));
        chunkSize = positiveIntProp("chunk-size", GidChunks.DEFAULT_CHUNK_SIZE);
        throwIfErrors();
    }

    public static AggregationConfig fromFile (String filename) {
        return new AggregationConfig(propsFromFile(filename));
    }

    // PARSING

    private File fileProp (String key) {
        String value = strProp(key);
        return value == null ? null : new File(value.trim());
    }

    private int positiveIntProp (String key, int defaultValue) {
        int value = intProp(key, defaultValue);
        if (value < 1) {
            invalidProp(key, Integer.toString(value), "must be positive");
            return defaultValue;
        }
        return value;
    }

    /** Accepts "all" or a comma separated list of gids and inclusive ranges such as "0, 5-9, 12". */
    private int[] parseGids (String value) {
        if ("all".equalsIgnoreCase(value)) {
            return null;
        }
        TIntList gids = new TIntArrayList();
        try {
            for (String item : COMMA_SPLITTER.split(value)) {
                int dash = item.indexOf('-', 1);
                if (dash < 0) {
                    gids.add(Integer.parseInt(item));
                } else {
                    int first = Integer.parseInt(item.substring(0, dash).trim());
                    int last = Integer.parseInt(item.substring(dash + 1).trim());
                    if (last < first) {
                        invalidProp("gids", value, "range " + item + " is descending");
                        return null;
                    }
                    if ((long) last - first + 1 > MAX_RANGE_SIZE) {
                        invalidProp("gids", value, "range " + item + " has more than " + MAX_RANGE_SIZE + " gids");
                        return null;
                    }
                    // A long counter, so a range ending at Integer.MAX_VALUE still terminates.
                    for (long gid = first; gid <= last; gid++) gids.add((int) gid);
                }
            }
        } catch (NumberFormatException e) {
            invalidProp("gids", value, "expected 'all' or integers and ranges");
            return null;
        }
        for (int i = 0; i < gids.size(); i++) {
            if (gids.get(i) < 0) {
                invalidProp("gids", value, "gids must not be negative");
                return null;
            }
        }
        return gids.toArray();
    }

    private Integer parseWorkerCount (String value) {
        if ("auto".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            int count = Integer.parseInt(value);
            if (count >= 1) return count;
        } catch (NumberFormatException e) {
            // Reported below.
        }
        invalidProp("worker-count", value, "expected 'auto' or a positive integer");
        return null;
    }

    private OutputFormat parseOutputFormat (String value) {
        try {
            return OutputFormat.parse(value);
        } catch (IllegalArgumentException e) {
            invalidProp("output-format", value, "expected 'table' or 'mapping'");
            return OutputFormat.TABLE;
        }
    }

    private static List<String> parseAttributes (String value) {
        if ("default".equalsIgnoreCase(value)) {
            return null;
        }
        return Collections.unmodifiableList(COMMA_SPLITTER.splitToList(value));
    }

    // INTERFACE IMPLEMENTATIONS

    @Override public File exclusionFile ()  { return exclusionFile; }
    @Override public File generationFile () { return generationFile; }
    @Override public File techMapFile ()    { return techMapFile; }
    @Override public int resolution ()      { return resolution; }
    @Override public int[] gids ()          { return gids == null ? null : gids.clone(); }
    @Override public Integer workerCount () { return workerCount; }
    @Override public OutputFormat outputFormat () { return outputFormat; }
    @Override public List<String> summaryAttributes () { return summaryAttributes; }
    @Override public int chunkSize ()       { return chunkSize; }

    public File outputFile () { return outputFile; }

}
