package com.tazifor.bidengine.geo.model;

public record LatLon(double lat, double lon) {
    public static LatLon of(double lat, double lon) { return new LatLon(lat, lon); }

    public boolean isValid() {
        return lat >= -90.0 && lat <= 90.0 && lon >= -180.0 && lon <= 180.0;
    }
}
