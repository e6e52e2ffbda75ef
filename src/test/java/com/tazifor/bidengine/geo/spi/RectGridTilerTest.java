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

public class RectGridTilerTest {

    private final RectGridTiler target = new RectGridTiler(0.1, 0.1);

    @Test
    public void creationShouldFailOnNonPositiveStep() {
        assertThatIllegalArgumentException().isThrownBy(() -> new RectGridTiler(0, 0.1));
        assertThatIllegalArgumentException().isThrownBy(() -> new RectGridTiler(0.1, -1));
    }

    @Test
    public void tileOfShouldUseShiftedRowAndColumn() {
        // when
        TileKey tile = target.tileOf(LatLon.of(3.915, 11.548));

        // then
        assertThat(tile.id()).isEqualTo("R939_C1915");
    }

    @Test
    public void tileOfShouldMapPointsOfTheSameCellToTheSameKey() {
        assertThat(target.tileOf(LatLon.of(40.71, -74.01)))
            .isEqualTo(target.tileOf(LatLon.of(40.79, -74.09)));
    }

    @Test
    public void tilesCoveringShouldReturnEveryCellOfTheBox() {
        // when
        Set<TileKey> tiles = target.tilesCovering(new BBox(0.05, 0.05, 0.25, 0.15));

        // then
        assertThat(tiles).hasSize(3 * 2);
    }

    @Test
    public void tilesForCircleShouldContainTheTileOfEveryPointInTheCircle() {
        // given
        Random random = new Random(42);
        LatLon center = LatLon.of(40.7580, -73.9855);
        double radius = 7_500;

        // when
        Set<TileKey> covering = target.tilesForCircle(center, radius);

        // then
        for (int i = 0; i < 2_000; i++) {
            LatLon point = randomPointWithin(random, center, radius);
            assertThat(covering).contains(target.tileOf(point));
        }
    }

    @Test
    public void estimateTileCountShouldMatchCoveringSize() {
        // given
        LatLon center = LatLon.of(-33.8688, 151.2093);

        // when and then
        assertThat(target.estimateTileCount(center, 20_000))
            .isEqualTo(target.tilesForCircle(center, 20_000).size());
    }

    @Test
    public void nameShouldDescribeCellSize() {
        assertThat(target.name()).isEqualTo("rect-0.1x0.1");
    }
}
