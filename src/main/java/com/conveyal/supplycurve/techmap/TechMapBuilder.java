package com.conveyal.supplycurve.techmap;

import java.io.File;

/**
 * Builds a tech map relating the pixels of an exclusion raster to the resource sites of a generation run.
 * Implementations must leave a complete, closed file at techMapFile when they return normally, and must not leave a
 * partial file there when they fail, since the presence of the file is what signals that no build is needed.
 */
public interface TechMapBuilder {

    void build (File exclusionFile, File generationFile, File techMapFile) throws Exception;

}
