package com.tazifor.bidengine.geo.spi;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.model.TileKey;
import com.uber.h3core.H3Core;
import com.uber.h3core.LengthUnit;
import com.uber.h3core.util.LatLng;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@code H3Tiler} quantizes the globe into Uber's H3 hexagonal cells.
 * <p>
 * Hexagons have a uniform neighbour distance, so a circular zone maps onto a
 * {@code gridDisk} of {@code k} rings around the center cell:
 * </p>
 *
 * <pre>
 *          ⬡ ⬡ ⬡
 *         ⬡ ⬢ ⬢ ⬡        ⬢ = ring 1
 *        ⬡ ⬢ ● ⬢ ⬡       ● = center cell
 *         ⬡ ⬢ ⬢ ⬡        ⬡ = ring 2
 *          ⬡ ⬡ ⬡
 * </pre>
 *
 * The ring count is derived from the average edge length at the configured
 * resolution, with one extra ring so that points on the zone boundary that fall into
 * a neighbouring cell are still covered.
 *
 * <h3>Resolution guide</h3>
 * <ul>
 *   <li>res 4: ~22 km edge</li>
 *   <li>res 5: ~8.5 km edge</li>
 *   <li>res 6: ~3.2 km edge</li>
 *   <li>res 7: ~1.2 km edge</li>
 * </ul>
 */
public class H3Tiler implements Tiler {

    private final H3Core h3;
    private final int resolution;
    private final double edgeMeters;

    public H3Tiler(int resolution) {
        if (resolution < 0 || resolution > 15) {
            throw new IllegalArgumentException("H3 resolution must be 0-15, got: " + resolution);
        }
        try {
            this.h3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize H3Core", e);
        }
        this.resolution = resolution;
        this.edgeMeters = h3.getHexagonEdgeLengthAvg(resolution, LengthUnit.m);
    }

    @Override
    public TileKey tileOf(LatLon p) {
        return key(h3.latLngToCell(p.lat(), p.lon(), resolution));
    }

    /**
     * Polyfills the box and adds the first ring around every filled cell. Polyfill only
     * returns cells whose centers fall inside the box, so the extra ring picks up the
     * partially overlapping cells along the edges.
     */
    @Override
    public Set<TileKey> tilesCovering(BBox bbox) {
        List<LatLng> boxPolygon = List.of(
            new LatLng(bbox.minLat(), bbox.minLon()),
            new LatLng(bbox.minLat(), bbox.maxLon()),
            new LatLng(bbox.maxLat(), bbox.maxLon()),
            new LatLng(bbox.maxLat(), bbox.minLon())
        );

        Set<TileKey> out = new LinkedHashSet<>();
        for (Long cell : h3.polygonToCells(boxPolygon, null, resolution)) {
            for (Long neighbour : h3.gridDisk(cell, 1)) {
                out.add(key(neighbour));
            }
        }
        // tiny boxes may contain no cell center at all
        LatLon mid = LatLon.of((bbox.minLat() + bbox.maxLat()) / 2, (bbox.minLon() + bbox.maxLon()) / 2);
        for (Long neighbour : h3.gridDisk(h3.latLngToCell(mid.lat(), mid.lon(), resolution), 1)) {
            out.add(key(neighbour));
        }
        return out;
    }

    @Override
    public Set<TileKey> tilesForCircle(LatLon center, double radiusMeters) {
        long origin = h3.latLngToCell(center.lat(), center.lon(), resolution);
        Set<TileKey> out = new LinkedHashSet<>();
        for (Long cell : h3.gridDisk(origin, rings(radiusMeters))) {
            out.add(key(cell));
        }
        return out;
    }

    @Override
    public long estimateTileCount(LatLon center, double radiusMeters) {
        long k = rings(radiusMeters);
        return 3 * k * (k + 1) + 1;
    }

    private int rings(double radiusMeters) {
        return (int) Math.ceil(radiusMeters / edgeMeters) + 1;
    }

    private static TileKey key(long cell) {
        return new TileKey(Long.toHexString(cell));
    }

    @Override
    public String name() {
        return "h3-res" + resolution;
    }
}
