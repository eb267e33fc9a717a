package com.conveyal.supplycurve.error;

/**
 * Signals that a supply curve point has no generation sites left once exclusions are applied. This is an expected
 * outcome for points over water, protected land etc. and is handled by leaving the point out of the results.
 * It is checked so that every caller of a summarizer has to decide how to handle it.
 */
public class EmptySupplyCurvePointException extends Exception {

    public final int gid;

    public EmptySupplyCurvePointException (int gid, String reason) {
        super(String.format("Supply curve point %d is empty: %s", gid, reason));
        this.gid = gid;
    }

}
