package com.conveyal.supplycurve.util;

import org.slf4j.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Counts completed units of work and logs a message every logFrequency units. Increments are threadsafe, so one
 * instance can be shared by a thread pool, a parallel stream or a loop collecting results from several workers.
 *
 * The message should contain two {} placeholders, the first for the count and the second for the total.
 */
public class ProgressCounter {

    private final Logger logger;

    private final String message;

    private final int total;

    private final int logFrequency;

    private int count = 0;

    public ProgressCounter (Logger logger, int total, int logFrequency, String message) {
        checkArgument(logFrequency > 0, "Log frequency must be positive.");
        this.logger = logger;
        this.total = total;
        this.logFrequency = logFrequency;
        this.message = message;
    }

    /** @return the count after incrementing it. */
    public synchronized int increment () {
        count += 1;
        if (count % logFrequency == 0 || count == total) {
            logger.info(message, count, total);
        }
        return count;
    }

    public synchronized int getCount () {
        return count;
    }

    public int getTotal () {
        return total;
    }

}
