package com.tazifor.bidengine.service;

import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.DeviceType;
import com.tazifor.bidengine.model.TargetZone;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalStateException;
import static org.assertj.core.data.Offset.offset;

public class BidScorerTest {

    private static final LatLon CENTER = LatLon.of(40.7580, -73.9855);

    private final BidScorer target = new BidScorer(0.1, 0.3, 0.5, ValuePredictor.NEUTRAL);

    @Test
    public void scoreShouldEqualBaseBidWithoutOverlapOrProximity() {
        // given
        Campaign campaign = Campaign.builder().id("c1").bidPrice(new BigDecimal("2.00")).build();

        // when
        double score = target.score(opportunity(null, Set.of()), campaign);

        // then
        assertThat(score).isEqualTo(2.0, offset(1e-9));
    }

    @Test
    public void scoreShouldAddWeightPerSharedInterest() {
        // given
        Campaign campaign = campaignWith(Set.of("sports", "Fitness", "travel"), List.of());

        // when
        double score = target.score(opportunity(null, Set.of("sports", "fitness")), campaign);

        // then
        assertThat(score).isEqualTo(2.0 * 1.2, offset(1e-9));
    }

    @Test
    public void interestOverlapWeightShouldBeCapped() {
        // when
        double weight = target.interestOverlapWeight(Set.of("a", "b", "c", "d", "e"), Set.of("a", "b", "c", "d", "e"));

        // then
        assertThat(weight).isEqualTo(0.3, offset(1e-9));
    }

    @Test
    public void proximityBonusShouldBeMaximalAtZoneCenterAndDecayToZeroAtRadius() {
        // given
        Campaign campaign = campaignWith(Set.of(), List.of(new TargetZone(CENTER.lat(), CENTER.lon(), 10_000)));

        // when and then
        assertThat(target.proximityBonus(CENTER, campaign)).isEqualTo(0.5, offset(1e-9));
        assertThat(target.proximityBonus(LatLon.of(40.8030, -73.9855), campaign)).isBetween(0.0, 0.3);
        assertThat(target.proximityBonus(LatLon.of(41.5, -73.9855), campaign)).isZero();
    }

    @Test
    public void proximityBonusShouldUseNearestContainingZone() {
        // given
        LatLon point = LatLon.of(40.7600, -73.9855);
        Campaign campaign = campaignWith(Set.of(), List.of(
            new TargetZone(40.70, -73.9855, 20_000),
            new TargetZone(point.lat(), point.lon(), 1_000)));

        // when and then
        assertThat(target.proximityBonus(point, campaign)).isEqualTo(0.5, offset(1e-9));
    }

    @Test
    public void scoreShouldMultiplyByPredictedValue() {
        // given
        BidScorer scorer = new BidScorer(0.1, 1.0, 0.5, (opportunity, campaign) -> 1.5);
        Campaign campaign = Campaign.builder().id("c1").bidPrice(new BigDecimal("2.00")).build();

        // when and then
        assertThat(scorer.score(opportunity(null, Set.of()), campaign)).isEqualTo(3.0, offset(1e-9));
    }

    @Test
    public void scoreShouldUseGivenBasePriceForExternalBids() {
        // given
        Campaign campaign = Campaign.builder().id("c1").bidPrice(new BigDecimal("2.00")).build();

        // when and then
        assertThat(target.score(opportunity(null, Set.of()), campaign, new BigDecimal("5.00")))
            .isEqualTo(5.0, offset(1e-9));
    }

    @Test
    public void scoreShouldFailOnNegativePrediction() {
        // given
        BidScorer scorer = new BidScorer(0.1, 1.0, 0.5, (opportunity, campaign) -> -1.0);
        Campaign campaign = Campaign.builder().id("c1").bidPrice(BigDecimal.ONE).build();

        // then
        assertThatIllegalStateException().isThrownBy(() -> scorer.score(opportunity(null, Set.of()), campaign));
    }

    private static Campaign campaignWith(Set<String> interests, List<TargetZone> zones) {
        return Campaign.builder()
            .id("c1")
            .bidPrice(new BigDecimal("2.00"))
            .targeting(Campaign.TargetingRules.builder().interests(interests).zones(zones).build())
            .build();
    }

    private static AdOpportunity opportunity(LatLon location, Set<String> interests) {
        return AdOpportunity.builder()
            .requestId("req-1")
            .userId("u1")
            .impressionId("imp-1")
            .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
            .deviceType(DeviceType.MOBILE)
            .location(location)
            .interests(interests)
            .floorPrice(BigDecimal.ZERO)
            .build();
    }
}
