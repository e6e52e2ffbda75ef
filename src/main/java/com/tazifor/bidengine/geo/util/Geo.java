package com.tazifor.bidengine.geo.util;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;

public final class Geo {

    /** Mean Earth radius in meters. */
    public static final double EARTH_RADIUS_METERS = 6_371_000.0;

    /** Meters spanned by one degree of latitude. */
    private static final double METERS_PER_DEGREE_LAT = Math.PI * EARTH_RADIUS_METERS / 180.0;

    private Geo() {}

    /**
     * Great-circle distance between two points using the <b>haversine</b> formula.
     * <p>
     * Accurate to well under one percent for the radii campaigns target
     * (hundreds of meters up to a few hundred kilometers).
     * </p>
     *
     * @return distance in meters
     */
    public static double distanceMeters(LatLon a, LatLon b) {
        double dLat = Math.toRadians(b.lat() - a.lat());
        double dLon = Math.toRadians(b.lon() - a.lon());
        double la1 = Math.toRadians(a.lat()), la2 = Math.toRadians(b.lat());
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
            Math.cos(la1) * Math.cos(la2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1.0, Math.sqrt(h)));
    }

    /**
     * Computes a bounding box that fully encloses a circle on the Earth's surface.
     * <p>
     * The latitude half-span is constant ({@code radius / meters-per-degree});
     * the longitude half-span widens with {@code 1 / cos(lat)} and is evaluated at the
     * circle's edge closest to the pole. Near the poles, or when the circle crosses the
     * antimeridian, the box is widened to the full longitude range.
     * </p>
     *
     * <pre>
     *        maxLat ┌───────────┐
     *               │   .---.   │
     *               │  /  •  \  │   • = center, r = radiusMeters
     *               │  \     /  │
     *               │   '---'   │
     *        minLat └───────────┘
     *            minLon       maxLon
     * </pre>
     */
    public static BBox boundingBox(LatLon center, double radiusMeters) {
        double dLat = radiusMeters / METERS_PER_DEGREE_LAT;
        double minLat = Math.max(-90.0, center.lat() - dLat);
        double maxLat = Math.min(90.0, center.lat() + dLat);

        double widestLat = Math.max(Math.abs(minLat), Math.abs(maxLat));
        double cos = Math.cos(Math.toRadians(widestLat));
        if (cos < 1e-6) {
            return new BBox(minLat, -180.0, maxLat, 180.0);
        }

        double dLon = dLat / cos;
        double minLon = center.lon() - dLon;
        double maxLon = center.lon() + dLon;
        if (minLon < -180.0 || maxLon > 180.0) {
            return new BBox(minLat, -180.0, maxLat, 180.0);
        }
        return new BBox(minLat, minLon, maxLat, maxLon);
    }
}
