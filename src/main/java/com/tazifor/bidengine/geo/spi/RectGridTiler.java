package com.tazifor.bidengine.geo.spi;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.model.TileKey;
import com.tazifor.bidengine.geo.util.Geo;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@code RectGridTiler} divides the Earth into a simple rectangular grid
 * based on constant latitude/longitude steps.
 *
 * <h3>The offset trick</h3>
 * To make the grid zero-based both ranges are shifted so that the smallest values start at 0:
 *
 * <pre>
 *   lat_shifted = lat + 90    → range [0, 180]
 *   lon_shifted = lon + 180   → range [0, 360]
 * </pre>
 *
 * Row and column are then {@code floor(shifted / step)} and the tile id is
 * {@code R{row}_C{col}}.
 *
 * <h3>Example</h3>
 * With {@code dLat = dLon = 0.1} a tile is about 11 km × 11 km at the equator, so a
 * 5 km target radius spans at most 2 × 2 tiles.
 *
 * @see Tiler
 */
public class RectGridTiler implements Tiler {

    /** Latitude step in degrees (vertical tile size). */
    private final double dLat;

    /** Longitude step in degrees (horizontal tile size). */
    private final double dLon;

    /**
     * Creates a rectangular tiler with the specified step sizes.
     *
     * @param dLat latitude step in degrees (tile height)
     * @param dLon longitude step in degrees (tile width)
     * @throws IllegalArgumentException if any step is ≤ 0
     */
    public RectGridTiler(double dLat, double dLon) {
        if (dLat <= 0 || dLon <= 0)
            throw new IllegalArgumentException("steps must be > 0");
        this.dLat = dLat;
        this.dLon = dLon;
    }

    private long row(double lat) {
        return (long) Math.floor((lat + 90.0) / dLat);
    }

    private long col(double lon) {
        return (long) Math.floor((lon + 180.0) / dLon);
    }

    private static TileKey key(long row, long col) {
        return new TileKey("R" + row + "_C" + col);
    }

    @Override
    public TileKey tileOf(LatLon p) {
        return key(row(p.lat()), col(p.lon()));
    }

    @Override
    public Set<TileKey> tilesCovering(BBox bbox) {
        long r0 = row(bbox.minLat());
        long c0 = col(bbox.minLon());
        long r1 = row(bbox.maxLat());
        long c1 = col(bbox.maxLon());

        Set<TileKey> out = new LinkedHashSet<>();
        for (long r = r0; r <= r1; r++) {
            for (long c = c0; c <= c1; c++) {
                out.add(key(r, c));
            }
        }
        return out;
    }

    /**
     * Covers the circle's bounding box. Any point of the circle lies inside the box,
     * and every tile intersecting the box is returned, so the covering is complete.
     */
    @Override
    public Set<TileKey> tilesForCircle(LatLon center, double radiusMeters) {
        return tilesCovering(Geo.boundingBox(center, radiusMeters));
    }

    @Override
    public long estimateTileCount(LatLon center, double radiusMeters) {
        BBox bb = Geo.boundingBox(center, radiusMeters);
        long rows = row(bb.maxLat()) - row(bb.minLat()) + 1;
        long cols = col(bb.maxLon()) - col(bb.minLon()) + 1;
        return rows * cols;
    }

    /** Returns a descriptive name, e.g. "rect-0.1x0.1". */
    @Override
    public String name() {
        return "rect-" + dLat + "x" + dLon;
    }
}
