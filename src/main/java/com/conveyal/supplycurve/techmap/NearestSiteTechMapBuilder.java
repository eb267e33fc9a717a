package com.conveyal.supplycurve.techmap;

import com.conveyal.supplycurve.generation.GenerationResults;
import com.conveyal.supplycurve.grid.ExclusionLayer;
import com.conveyal.supplycurve.grid.RasterExtents;
import com.conveyal.supplycurve.util.ProgressCounter;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.GeometryItemDistance;
import org.locationtech.jts.index.strtree.STRtree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

/**
 * Maps every exclusion pixel to the resource site nearest to the pixel center. Sites are taken from the generation
 * results, one per distinct resource gid.
 *
 * Distances are computed in a local equirectangular system (longitude scaled by the cosine of the raster's central
 * latitude) so that the Euclidean distances used by the JTS STRtree nearest neighbor search are proportional to ground
 * distances. This is accurate enough over the extent of a study area to pick the nearest site.
 */
public class NearestSiteTechMapBuilder implements TechMapBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(NearestSiteTechMapBuilder.class);

    private static final GeometryFactory geometryFactory = new GeometryFactory();

    @Override
    public void build (File exclusionFile, File generationFile, File techMapFile) throws IOException {
        RasterExtents extents = ExclusionLayer.readExtents(exclusionFile);
        int[] resourceGids;
        try (GenerationResults generation = GenerationResults.open(generationFile)) {
            resourceGids = mapPixels(extents, generation);
        }
        // Write beside the final location and move into place, so the tech map never exists in a partial state.
        Path target = techMapFile.toPath().toAbsolutePath();
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".partial");
        try {
            TechMap.write(temp.toFile(), extents.nRows(), extents.nCols(), resourceGids);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOG.info("Wrote tech map for {} pixels to {}.", resourceGids.length, techMapFile);
    }

    /** @return the resource gid nearest to each pixel of the given extents, in row-major order. */
    public int[] mapPixels (RasterExtents extents, GenerationResults generation) {
        int[] resourceGids = new int[extents.nRows() * extents.nCols()];
        if (generation.size() == 0) {
            LOG.warn("Generation results {} contain no sites, no pixels will be mapped.", generation.file);
            Arrays.fill(resourceGids, TechMap.NO_RESOURCE);
            return resourceGids;
        }
        double centralLat = (extents.rowCenterLat(0) + extents.rowCenterLat(extents.nRows() - 1)) / 2;
        double lonScale = FastMath.cos(FastMath.toRadians(centralLat));

        STRtree siteIndex = new STRtree();
        TIntSet indexedResources = new TIntHashSet();
        for (int genGid = 0; genGid < generation.size(); genGid++) {
            int resourceGid = generation.resourceGid(genGid);
            // Several generation rows may share one resource site. Index each site once.
            if (indexedResources.add(resourceGid)) {
                Point site = project(generation.longitude(genGid), generation.latitude(genGid), lonScale);
                site.setUserData(resourceGid);
                siteIndex.insert(site.getEnvelopeInternal(), site);
            }
        }
        siteIndex.build();
        LOG.info("Mapping {} exclusion pixels to the nearest of {} resource sites.",
                resourceGids.length, indexedResources.size());

        GeometryItemDistance itemDistance = new GeometryItemDistance();
        ProgressCounter rowCounter = new ProgressCounter(LOG, extents.nRows(), 1000, "Tech map row {}/{}");
        for (int row = 0; row < extents.nRows(); row++) {
            double lat = extents.rowCenterLat(row);
            for (int col = 0; col < extents.nCols(); col++) {
                Point pixel = project(extents.colCenterLon(col), lat, lonScale);
                Point nearest = (Point) siteIndex.nearestNeighbour(pixel.getEnvelopeInternal(), pixel, itemDistance);
                resourceGids[row * extents.nCols() + col] = (Integer) nearest.getUserData();
            }
            rowCounter.increment();
        }
        return resourceGids;
    }

    private static Point project (double lon, double lat, double lonScale) {
        return geometryFactory.createPoint(new Coordinate(lon * lonScale, lat));
    }

}
