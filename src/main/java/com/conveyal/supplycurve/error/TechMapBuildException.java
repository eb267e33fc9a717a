package com.conveyal.supplycurve.error;

import java.io.File;

/** Thrown when a missing tech map could not be built. Aggregation cannot proceed without it. */
public class TechMapBuildException extends RuntimeException {

    public final File techMapFile;

    public TechMapBuildException (File techMapFile, Throwable cause) {
        super("Failed to build tech map " + techMapFile, cause);
        this.techMapFile = techMapFile;
    }

}
