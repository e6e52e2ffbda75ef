package com.tazifor.bidengine.geo.util;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

public class GeoTest {

    @Test
    public void distanceMetersShouldBeZeroForSamePoint() {
        // given
        LatLon point = LatLon.of(40.7580, -73.9855);

        // when and then
        assertThat(Geo.distanceMeters(point, point)).isEqualTo(0.0, offset(1e-9));
    }

    @Test
    public void distanceMetersShouldMatchKnownCityDistance() {
        // given
        LatLon newYork = LatLon.of(40.7128, -74.0060);
        LatLon london = LatLon.of(51.5074, -0.1278);

        // when
        double distance = Geo.distanceMeters(newYork, london);

        // then
        assertThat(distance).isCloseTo(5_570_000.0, offset(15_000.0));
    }

    @Test
    public void boundingBoxShouldContainEveryPointOfTheCircle() {
        // given
        LatLon center = LatLon.of(3.9, 11.5);
        double radius = 5_000;

        // when
        BBox box = Geo.boundingBox(center, radius);

        // then
        for (int bearing = 0; bearing < 360; bearing += 15) {
            LatLon edge = pointAt(center, radius * 0.999, Math.toRadians(bearing));
            assertThat(box.contains(edge)).as("bearing %d", bearing).isTrue();
        }
    }

    @Test
    public void boundingBoxShouldSpanAllLongitudesNearThePole() {
        // when
        BBox box = Geo.boundingBox(LatLon.of(89.99, 10.0), 5_000);

        // then
        assertThat(box.minLon()).isEqualTo(-180.0);
        assertThat(box.maxLon()).isEqualTo(180.0);
    }

    static LatLon pointAt(LatLon origin, double distanceMeters, double bearingRad) {
        double angular = distanceMeters / Geo.EARTH_RADIUS_METERS;
        double lat1 = Math.toRadians(origin.lat());
        double lon1 = Math.toRadians(origin.lon());
        double lat2 = Math.asin(Math.sin(lat1) * Math.cos(angular)
            + Math.cos(lat1) * Math.sin(angular) * Math.cos(bearingRad));
        double lon2 = lon1 + Math.atan2(Math.sin(bearingRad) * Math.sin(angular) * Math.cos(lat1),
            Math.cos(angular) - Math.sin(lat1) * Math.sin(lat2));
        return LatLon.of(Math.toDegrees(lat2), Math.toDegrees(lon2));
    }
}
