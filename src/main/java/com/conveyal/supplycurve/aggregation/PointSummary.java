package com.conveyal.supplycurve.aggregation;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The summary of one supply curve point: attribute values keyed by output column name, in insertion order.
 * Values are Integers, Doubles or int arrays (for sets of gids, kept sorted).
 */
public class PointSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Columns added by the aggregation itself rather than by a summarizer. */
    public static final String SC_GID = "sc_gid";
    public static final String SC_ROW_IND = "sc_row_ind";
    public static final String SC_COL_IND = "sc_col_ind";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public PointSummary put (String name, Object value) {
        checkNotNull(name);
        checkArgument(value instanceof Integer || value instanceof Double || value instanceof int[],
                "Unsupported value for summary attribute %s: %s", name, value);
        values.put(name, value);
        return this;
    }

    public boolean has (String name) {
        return values.containsKey(name);
    }

    public Object get (String name) {
        return values.get(name);
    }

    public int getInt (String name) {
        return (Integer) require(name);
    }

    public double getDouble (String name) {
        return (Double) require(name);
    }

    public int[] getIntArray (String name) {
        return ((int[]) require(name)).clone();
    }

    private Object require (String name) {
        Object value = values.get(name);
        checkArgument(value != null, "Summary has no attribute %s.", name);
        return value;
    }

    public Set<String> names () {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<String, Object> asMap () {
        return Collections.unmodifiableMap(values);
    }

    public int size () {
        return values.size();
    }

    /** Two summaries are equal when they hold the same attributes with equal values, regardless of order. */
    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PointSummary other = (PointSummary) o;
        if (!values.keySet().equals(other.values.keySet())) return false;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            if (!Objects.deepEquals(entry.getValue(), other.values.get(entry.getKey()))) return false;
        }
        return true;
    }

    @Override
    public int hashCode () {
        int hash = 0;
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Object value = entry.getValue();
            int valueHash = value instanceof int[] ? Arrays.hashCode((int[]) value) : value.hashCode();
            hash += entry.getKey().hashCode() ^ valueHash;
        }
        return hash;
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder("PointSummary{");
        String separator = "";
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            sb.append(separator).append(entry.getKey()).append('=').append(formatValue(entry.getValue()));
            separator = ", ";
        }
        return sb.append('}').toString();
    }

    /** Text form of a value as written to delimited output: gid sets as [a, b, c]. */
    public static String formatValue (Object value) {
        if (value == null) return "";
        if (value instanceof int[]) return Arrays.toString((int[]) value);
        return value.toString();
    }

}
