package com.conveyal.supplycurve.util;

import com.google.common.base.Throwables;

import java.util.ArrayList;
import java.util.List;

/** Convenience functions for summarizing exceptions in the messages of wrapping exceptions. */
public abstract class ExceptionUtils {

    /**
     * One-line summary of the chain of causes, reversed so the root cause comes first, e.g.
     * "NoSuchFileException: gen.csv, caused IOException: Could not open generation results".
     */
    public static String shortCauseString (Throwable throwable) {
        List<String> items = new ArrayList<>();
        for (Throwable link : Throwables.getCausalChain(throwable)) {
            String item = link.getClass().getSimpleName();
            if (link.getMessage() != null) {
                item += ": " + link.getMessage();
            }
            items.add(0, item);
        }
        return String.join(", caused ", items);
    }

}
