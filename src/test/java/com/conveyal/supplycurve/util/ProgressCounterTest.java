package com.conveyal.supplycurve.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

class ProgressCounterTest {

    @Test
    void concurrentIncrementsAreCounted () {
        ProgressCounter counter = new ProgressCounter(LoggerFactory.getLogger(ProgressCounterTest.class), 1000, 100,
                "Counted {} of {}");
        IntStream.range(0, 1000).parallel().forEach(i -> counter.increment());
        Assertions.assertEquals(1000, counter.getCount());
        Assertions.assertEquals(1000, counter.getTotal());
    }

}
