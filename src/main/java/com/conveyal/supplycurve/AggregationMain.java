package com.conveyal.supplycurve;

import com.conveyal.supplycurve.aggregation.AggregateResult;
import com.conveyal.supplycurve.aggregation.Aggregation;
import com.conveyal.supplycurve.aggregation.OutputFormat;
import com.conveyal.supplycurve.error.SupplyCurveInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.OutputStream;

/**
 * Main entry point for a supply curve aggregation run. Takes a single argument, the path to a properties file
 * describing the inputs, the output file and the aggregation options. Writes a CSV table, or a JSON object keyed by gid
 * when the mapping output format is requested.
 */
public class AggregationMain {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationMain.class);

    public static void main (String... args) throws Exception {
        if (args.length != 1) {
            System.err.println("Usage: AggregationMain <config.properties>");
            System.exit(1);
        }
        AggregationConfig config;
        try {
            config = AggregationConfig.fromFile(args[0]);
        } catch (SupplyCurveInputException e) {
            LOG.error(e.getMessage());
            System.exit(1);
            return;
        }
        long startTime = System.currentTimeMillis();
        AggregateResult result = new Aggregation().aggregate(Aggregation.requestFromConfig(config));
        try (OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(config.outputFile()))) {
            if (result.format == OutputFormat.TABLE) {
                result.table().writeCsv(outputStream);
            } else {
                result.writeMappingJson(outputStream);
            }
        }
        LOG.info("Supply curve points aggregated and written to {}. Time elapsed: {} minutes",
                config.outputFile(), String.format("%.2f", (System.currentTimeMillis() - startTime) / 60_000.0));
    }

}
