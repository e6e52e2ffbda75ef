package com.tazifor.bidengine.geo.spi;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.model.TileKey;

import java.util.Set;

/**
 * The {@code Tiler} interface defines a common contract for converting
 * latitude/longitude coordinates into discrete, indexable grid cells ("tiles").
 * <p>
 * The campaign index stores every campaign under the tiles its target zones cover, so that
 * at request time a single {@link #tileOf(LatLon)} call yields the geo candidates with an
 * O(1) lookup instead of a distance check against every campaign.
 * </p>
 *
 * <h3>Contract</h3>
 * A covering returned by {@link #tilesForCircle(LatLon, double)} must be <em>complete</em>:
 * for every point {@code p} within {@code radiusMeters} of {@code center},
 * {@code tileOf(p)} is a member of the covering. Extra tiles are allowed (the exact
 * distance check happens downstream); missing tiles are not.
 *
 * <h3>Example usage</h3>
 * <pre>{@code
 * Tiler tiler = new RectGridTiler(0.1, 0.1); // ~11km cells
 * TileKey tile = tiler.tileOf(LatLon.of(3.915, 11.548));
 * Set<TileKey> covering = tiler.tilesForCircle(LatLon.of(3.9, 11.5), 5_000);
 * }</pre>
 *
 * @author Amin Taz
 * @see RectGridTiler
 * @see H3Tiler
 */
public interface Tiler {

    /**
     * Computes the tile that contains the given geographic point.
     *
     * @param p the geographic point (latitude and longitude)
     * @return a {@link TileKey} uniquely identifying the tile that contains {@code p}
     */
    TileKey tileOf(LatLon p);

    /**
     * Enumerates all tiles whose area intersects a given bounding box.
     *
     * @param bbox the bounding box of interest
     * @return a set of {@link TileKey}s covering the supplied {@code bbox}
     */
    Set<TileKey> tilesCovering(BBox bbox);

    /**
     * Computes a complete covering of a circular target zone.
     *
     * @param center       zone center
     * @param radiusMeters zone radius in meters
     * @return every tile that may contain a point of the zone
     */
    Set<TileKey> tilesForCircle(LatLon center, double radiusMeters);

    /**
     * Estimates how many tiles {@link #tilesForCircle(LatLon, double)} would return,
     * without materialising them. Used to demote very large zones before allocating.
     */
    long estimateTileCount(LatLon center, double radiusMeters);

    /**
     * Returns a human-readable name describing the tiler configuration,
     * e.g. {@code "rect-0.1x0.1"} or {@code "h3-res5"}.
     */
    String name();
}
