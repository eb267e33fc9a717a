package com.conveyal.supplycurve.error;

/**
 * Thrown when an input to aggregation is missing, unreadable or inconsistent with the other inputs. This is detected
 * before any supply curve point is processed.
 */
public class SupplyCurveInputException extends RuntimeException {

    public SupplyCurveInputException (String message) {
        super(message);
    }

    public SupplyCurveInputException (String message, Throwable cause) {
        super(message, cause);
    }

}
