package com.conveyal.supplycurve.aggregation;

/** The shape in which aggregation results are returned. */
public enum OutputFormat {

    /** Summaries keyed by gid. */
    MAPPING,

    /** A table with one row per point, indexed and sorted by sc_gid. */
    TABLE;

    /** Lenient parsing of configuration values such as "table", "dataframe" or "dict". */
    public static OutputFormat parse (String value) {
        String lower = value.trim().toLowerCase();
        switch (lower) {
            case "table":
            case "dataframe":
                return TABLE;
            case "mapping":
            case "dict":
                return MAPPING;
            default:
                throw new IllegalArgumentException("Unknown output format: " + value);
        }
    }

}
