package com.conveyal.supplycurve.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;

/**
 * A library of static methods for writing results as JSON.
 */
public abstract class JsonUtilities {

    public static final ObjectMapper objectMapper = createObjectMapper();

    private static ObjectMapper createObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        // Callers own the streams they pass in.
        objectMapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        objectMapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return objectMapper;
    }

    public static void writeJson (OutputStream outputStream, Object object) throws IOException {
        objectMapper.writeValue(outputStream, object);
        outputStream.flush();
    }

}
