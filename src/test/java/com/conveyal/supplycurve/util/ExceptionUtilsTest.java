package com.conveyal.supplycurve.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

class ExceptionUtilsTest {

    @Test
    void rootCauseComesFirst () {
        IOException wrapper = new IOException("Could not open generation results", new NoSuchFileException("gen.csv"));
        Assertions.assertEquals("NoSuchFileException: gen.csv, caused IOException: Could not open generation results",
                ExceptionUtils.shortCauseString(wrapper));
        Assertions.assertEquals("IllegalStateException", ExceptionUtils.shortCauseString(new IllegalStateException()));
    }

}
