package com.conveyal.supplycurve.techmap;

import com.conveyal.supplycurve.error.TechMapBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Makes sure a tech map exists before aggregation opens it. If the file is absent the tech map is built synchronously,
 * so that when ensureTechMap returns the artifact is complete and closed and can be opened by any number of workers.
 * This relies on program order rather than locking: callers must not start reading before ensureTechMap returns.
 *
 * A tech map that already exists is reused as-is. Its consistency with the exclusion raster is checked when it is
 * opened, not here.
 */
public class TechMapResolver {

    private final TechMapBuilder builder;

    private final Logger log;

    public TechMapResolver () {
        this(new NearestSiteTechMapBuilder());
    }

    public TechMapResolver (TechMapBuilder builder) {
        this(builder, LoggerFactory.getLogger(TechMapResolver.class));
    }

    public TechMapResolver (TechMapBuilder builder, Logger log) {
        this.builder = checkNotNull(builder);
        this.log = checkNotNull(log);
    }

    /**
     * Build the tech map at techMapFile from the given exclusions and generation results, unless it already exists.
     * @return true if a tech map was built, false if an existing one will be reused.
     * @throws TechMapBuildException if the builder fails or returns without producing the file.
     */
    public boolean ensureTechMap (File exclusionFile, File generationFile, File techMapFile) {
        if (techMapFile.exists()) {
            log.debug("Reusing existing tech map {}.", techMapFile);
            return false;
        }
        log.info("Supply curve point aggregation could not find the tech map file; " +
                "running the tech mapping with output: {}", techMapFile);
        long startTime = System.currentTimeMillis();
        try {
            builder.build(exclusionFile, generationFile, techMapFile);
        } catch (Exception e) {
            throw new TechMapBuildException(techMapFile, e);
        }
        if (!techMapFile.isFile()) {
            throw new TechMapBuildException(techMapFile,
                    new IllegalStateException("Tech map builder returned without writing " + techMapFile));
        }
        log.info("Built tech map {} in {} sec.", techMapFile, (System.currentTimeMillis() - startTime) / 1000);
        return true;
    }

}
