package com.tazifor.bidengine.service;

import com.tazifor.bidengine.exception.ValidationException;
import com.tazifor.bidengine.geo.model.LatLon;
import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.BidRequest;
import com.tazifor.bidengine.model.DeviceType;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a wire {@link BidRequest} onto an {@link AdOpportunity}.
 *
 * All problems found are reported together in one {@link ValidationException}.
 * Only the first impression is auctioned.
 */
public class RequestValidator {

    private final Clock clock;

    public RequestValidator(Clock clock) {
        this.clock = clock;
    }

    public AdOpportunity validate(BidRequest request) {
        if (request == null) {
            throw new ValidationException("request body is missing");
        }

        List<String> errors = new ArrayList<>();

        if (StringUtils.isBlank(request.getId())) {
            errors.add("request.id is required");
        }

        BidRequest.Impression impression = null;
        if (request.getImpressions() == null || request.getImpressions().isEmpty()) {
            errors.add("request.impressions must contain at least one impression");
        } else {
            impression = request.getImpressions().get(0);
            if (impression == null || StringUtils.isBlank(impression.getId())) {
                errors.add("request.impressions[0].id is required");
            } else if (impression.getBidFloor() != null && impression.getBidFloor().signum() < 0) {
                errors.add("request.impressions[0].bidfloor must be >= 0, got: " + impression.getBidFloor());
            }
        }

        BidRequest.User user = request.getUser();
        if (user == null || StringUtils.isBlank(user.getId())) {
            errors.add("request.user.id is required");
        }

        LatLon location = null;
        BidRequest.Geo geo = request.getGeo();
        if (geo != null && (geo.getLat() != null || geo.getLng() != null)) {
            if (geo.getLat() == null || geo.getLng() == null) {
                errors.add("request.geo must carry both lat and lng");
            } else {
                location = LatLon.of(geo.getLat(), geo.getLng());
                if (!location.isValid()) {
                    errors.add("request.geo is out of range: " + geo.getLat() + "," + geo.getLng());
                }
            }
        }

        if (request.getTmaxMs() != null && request.getTmaxMs() <= 0) {
            errors.add("request.tmax_ms must be > 0, got: " + request.getTmaxMs());
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        BidRequest.Banner banner = impression.getBanner();
        return AdOpportunity.builder()
            .requestId(request.getId())
            .userId(user.getId())
            .impressionId(impression.getId())
            .timestamp(request.getTimestamp() != null ? Instant.ofEpochMilli(request.getTimestamp()) : Instant.now(clock))
            .deviceType(DeviceType.fromCode(request.getDevice() != null ? request.getDevice().getType() : null))
            .location(location)
            .country(geo != null ? geo.getCountry() : null)
            .interests(normalizeInterests(user.getInterests()))
            .ageGroup(user.getAgeGroup())
            .floorPrice(impression.getBidFloor() != null ? impression.getBidFloor() : BigDecimal.ZERO)
            .width(banner != null ? banner.getW() : null)
            .height(banner != null ? banner.getH() : null)
            .tmax(request.getTmaxMs() != null ? Duration.ofMillis(request.getTmaxMs()) : null)
            .build();
    }

    private static Set<String> normalizeInterests(List<String> interests) {
        if (interests == null || interests.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> normalized = new LinkedHashSet<>();
        interests.stream()
            .filter(Objects::nonNull)
            .map(CampaignIndex::normalize)
            .filter(StringUtils::isNotEmpty)
            .forEach(normalized::add);
        return Collections.unmodifiableSet(normalized);
    }
}
