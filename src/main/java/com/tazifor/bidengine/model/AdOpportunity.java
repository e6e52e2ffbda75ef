package com.tazifor.bidengine.model;

import com.tazifor.bidengine.geo.model.LatLon;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, typed view of a {@link BidRequest}. Only {@code RequestValidator} creates these,
 * so a fully populated instance always describes a request the auction can run on.
 */
@Value
@Builder
public class AdOpportunity {

    @NonNull
    String requestId;

    @NonNull
    String userId;

    @NonNull
    String impressionId;

    @NonNull
    Instant timestamp;

    @NonNull
    DeviceType deviceType;

    /**
     * Request location, null when the request carried no coordinates
     */
    LatLon location;

    String country;

    @NonNull
    Set<String> interests;

    String ageGroup;

    @NonNull
    BigDecimal floorPrice;

    Integer width;
    Integer height;

    /**
     * Caller's time budget, null when the request did not state one
     */
    Duration tmax;

    public Optional<LatLon> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<Duration> getTmax() {
        return Optional.ofNullable(tmax);
    }
}
