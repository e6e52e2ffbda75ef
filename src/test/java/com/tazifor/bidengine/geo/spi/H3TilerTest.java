package com.tazifor.bidengine.geo.spi;

import com.tazifor.bidengine.geo.model.BBox;
import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.geo.model.TileKey;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;

import static com.tazifor.bidengine.geo.spi.TilerAssertions.randomPointWithin;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class H3TilerTest {

    private final H3Tiler target = new H3Tiler(7);

    @Test
    public void creationShouldFailOnResolutionOutOfRange() {
        assertThatIllegalArgumentException().isThrownBy(() -> new H3Tiler(16));
        assertThatIllegalArgumentException().isThrownBy(() -> new H3Tiler(-1));
    }

    @Test
    public void tilesForCircleShouldContainTheTileOfEveryPointInTheCircle() {
        // given
        Random random = new Random(7);
        LatLon center = LatLon.of(37.7749, -122.4194);
        double radius = 3_000;

        // when
        Set<TileKey> covering = target.tilesForCircle(center, radius);

        // then
        for (int i = 0; i < 2_000; i++) {
            assertThat(covering).contains(target.tileOf(randomPointWithin(random, center, radius)));
        }
    }

    @Test
    public void estimateTileCountShouldMatchDiskSize() {
        // given
        LatLon center = LatLon.of(51.5074, -0.1278);

        // when and then
        assertThat(target.estimateTileCount(center, 2_500))
            .isEqualTo(target.tilesForCircle(center, 2_500).size());
    }

    @Test
    public void tilesCoveringShouldContainTheTileOfBoxCorners() {
        // given
        BBox box = new BBox(48.80, 2.25, 48.90, 2.40);

        // when
        Set<TileKey> covering = target.tilesCovering(box);

        // then
        assertThat(covering).contains(
            target.tileOf(LatLon.of(48.80, 2.25)),
            target.tileOf(LatLon.of(48.90, 2.40)),
            target.tileOf(LatLon.of(48.85, 2.32)));
    }

    @Test
    public void nameShouldDescribeResolution() {
        assertThat(target.name()).isEqualTo("h3-res7");
    }
}
