package com.conveyal.supplycurve.aggregation;

import com.conveyal.supplycurve.error.EmptySupplyCurvePointException;
import com.conveyal.supplycurve.generation.GenerationResults;
import com.conveyal.supplycurve.grid.ExclusionLayer;
import com.conveyal.supplycurve.grid.RasterExtents;
import com.conveyal.supplycurve.grid.SupplyCurveExtent;
import com.conveyal.supplycurve.techmap.TechMap;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.TIntSet;
import gnu.trove.set.hash.TIntHashSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The standard supply curve point summary. A pixel within the point contributes when it is not excluded and the tech
 * map relates it to a resource site that has generation results. The point's resource gids are those of the
 * contributing pixels, its generation gids all those simulated from these resource gids, and its location the mean
 * center of the contributing pixels.
 */
public class SupplyCurvePointSummary implements PointSummarizer {

    private static final Logger LOG = LoggerFactory.getLogger(SupplyCurvePointSummary.class);

    /** Warn about each unusable attribute name once, not once per point. */
    private final Set<String> warnedAttributes = ConcurrentHashMap.newKeySet();

    @Override
    public PointSummary summarize (int gid, ExclusionLayer exclusions, GenerationResults generation, TechMap techMap,
                                   SupplyCurveExtent extent, List<String> attributes)
            throws EmptySupplyCurvePointException {
        checkArgument(exclusions.nRows() == extent.exclusionRows && exclusions.nCols() == extent.exclusionCols,
                "Supply curve extent does not match the shape of exclusions %s.", exclusions.file);
        List<SummaryAttribute> requested = resolveAttributes(attributes, generation);
        RasterExtents raster = exclusions.extents;

        TIntSet resourceGids = new TIntHashSet();
        int nPixels = 0;
        double latSum = 0;
        double lonSum = 0;
        double areaSqKm = 0;
        for (int row = extent.rowStart(gid); row < extent.rowEnd(gid); row++) {
            double lat = raster.rowCenterLat(row);
            double pixelArea = raster.pixelAreaSqKm(row);
            for (int col = extent.colStart(gid); col < extent.colEnd(gid); col++) {
                if (!exclusions.isIncluded(row, col)) continue;
                int resourceGid = techMap.resourceGid(row, col);
                if (resourceGid == TechMap.NO_RESOURCE || !generation.hasResource(resourceGid)) continue;
                resourceGids.add(resourceGid);
                nPixels += 1;
                latSum += lat;
                lonSum += raster.colCenterLon(col);
                areaSqKm += pixelArea;
            }
        }
        if (nPixels == 0) {
            throw new EmptySupplyCurvePointException(gid, "no included pixels map to a site with generation results");
        }

        int[] sortedResourceGids = resourceGids.toArray();
        Arrays.sort(sortedResourceGids);
        TIntList genGids = new TIntArrayList();
        for (int resourceGid : sortedResourceGids) {
            genGids.addAll(generation.generationGids(resourceGid));
        }
        genGids.sort();

        PointSummary summary = new PointSummary();
        for (SummaryAttribute attribute : requested) {
            switch (attribute) {
                case RESOURCE_GIDS:
                    summary.put(attribute.columnName, sortedResourceGids);
                    break;
                case GEN_GIDS:
                    summary.put(attribute.columnName, genGids.toArray());
                    break;
                case LATITUDE:
                    summary.put(attribute.columnName, latSum / nPixels);
                    break;
                case LONGITUDE:
                    summary.put(attribute.columnName, lonSum / nPixels);
                    break;
                case AREA_SQ_KM:
                    summary.put(attribute.columnName, areaSqKm);
                    break;
                case MEAN_CF:
                    summary.put(attribute.columnName, meanOf(generation, SummaryAttribute.CF_MEAN_COLUMN, genGids));
                    break;
                default:
                    throw new UnsupportedOperationException("Unhandled summary attribute " + attribute);
            }
        }
        return summary;
    }

    /** Map requested names to attributes, dropping (with a warning) names that cannot be computed from these inputs. */
    List<SummaryAttribute> resolveAttributes (List<String> attributes, GenerationResults generation) {
        if (attributes == null) {
            return SummaryAttribute.DEFAULTS;
        }
        List<SummaryAttribute> resolved = new ArrayList<>(attributes.size());
        for (String name : attributes) {
            SummaryAttribute attribute = SummaryAttribute.forColumnName(name);
            if (attribute == null) {
                if (warnedAttributes.add(name)) {
                    LOG.warn("Cannot find \"{}\" as an available supply curve point summary output.", name);
                }
            } else if (attribute == SummaryAttribute.MEAN_CF && !generation.hasNumericColumn(SummaryAttribute.CF_MEAN_COLUMN)) {
                if (warnedAttributes.add(name)) {
                    LOG.warn("Generation results {} have no numeric \"{}\" column, \"{}\" will not be summarized.",
                            generation.file, SummaryAttribute.CF_MEAN_COLUMN, name);
                }
            } else if (!resolved.contains(attribute)) {
                resolved.add(attribute);
            }
        }
        return resolved;
    }

    private static double meanOf (GenerationResults generation, String column, TIntList genGids) {
        double sum = 0;
        for (int i = 0; i < genGids.size(); i++) {
            sum += generation.value(column, genGids.get(i));
        }
        return sum / genGids.size();
    }

}
