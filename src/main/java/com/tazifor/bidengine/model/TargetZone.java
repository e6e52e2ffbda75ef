package com.tazifor.bidengine.model;

import com.tazifor.bidengine.geo.model.LatLon;

/**
 * Circular geo target: every point within {@code radiusMeters} of the center matches.
 */
public record TargetZone(double lat, double lng, double radiusMeters) {

    public LatLon center() {
        return LatLon.of(lat, lng);
    }
}
