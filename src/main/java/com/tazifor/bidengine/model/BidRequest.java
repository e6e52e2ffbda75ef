package com.tazifor.bidengine.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Ad opportunity as received on the wire (OpenRTB flavoured).
 *
 * Everything here is optional at the JSON level; {@code RequestValidator} turns it into a
 * typed {@link AdOpportunity} or rejects it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BidRequest {

    /**
     * Unique ID of the bid request
     */
    private String id;

    /**
     * Array of impression objects
     */
    @JsonAlias("imp")
    private List<Impression> impressions;

    /**
     * Site object (for display ads)
     */
    private Site site;

    /**
     * App object (for mobile ads)
     */
    private App app;

    private Device device;

    private User user;

    private Geo geo;

    /**
     * Maximum time in milliseconds to submit a bid
     */
    @JsonProperty("tmax_ms")
    @JsonAlias("tmax")
    private Integer tmaxMs;

    /**
     * Timestamp when request was sent (Unix epoch time in ms)
     */
    private Long timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Impression {
        private String id;
        private Banner banner;
        private Integer pos; // Ad position on screen

        @JsonProperty("bidfloor")
        private BigDecimal bidFloor; // Minimum bid price

        @JsonProperty("bidfloorcur")
        private String bidFloorCurrency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Banner {
        private Integer w; // Width
        private Integer h; // Height
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Site {
        private String id;
        private String domain;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class App {
        private String id;
        private String bundle;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Device {
        @JsonAlias("devicetype")
        private Integer type; // 1=mobile, 2=PC, 3=TV, etc.
        private String ua;
        private String os;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geo {
        private String country;
        private Double lat;
        @JsonAlias("lon")
        private Double lng;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {
        private String id;

        /**
         * Interest / audience segment tags
         */
        private List<String> interests;

        /**
         * Age bucket, e.g. "18-24"
         */
        @JsonProperty("age_group")
        private String ageGroup;
    }
}
