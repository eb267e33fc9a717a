package com.conveyal.supplycurve.aggregation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The attributes a supply curve point summary can contain, with the names under which they appear in output tables.
 */
public enum SummaryAttribute {

    /** Distinct resource gids mapped to included pixels of the point. */
    RESOURCE_GIDS("resource_gids"),

    /** Generation gids simulated from those resource gids. */
    GEN_GIDS("gen_gids"),

    /** Mean latitude of the included pixels. */
    LATITUDE("latitude"),

    /** Mean longitude of the included pixels. */
    LONGITUDE("longitude"),

    /** Ground area of the included pixels. */
    AREA_SQ_KM("area_sq_km"),

    /** Mean of the generation results' cf_mean column over the point's generation gids. */
    MEAN_CF("mean_cf");

    /** The generation results column averaged by MEAN_CF. */
    public static final String CF_MEAN_COLUMN = "cf_mean";

    /** Attributes summarized when the caller does not name any. */
    public static final List<SummaryAttribute> DEFAULTS =
            Collections.unmodifiableList(Arrays.asList(RESOURCE_GIDS, GEN_GIDS, LATITUDE, LONGITUDE));

    public final String columnName;

    SummaryAttribute (String columnName) {
        this.columnName = columnName;
    }

    /** @return the attribute with the given output column name, or null if there is none. */
    public static SummaryAttribute forColumnName (String columnName) {
        for (SummaryAttribute attribute : values()) {
            if (attribute.columnName.equals(columnName)) {
                return attribute;
            }
        }
        return null;
    }

}
