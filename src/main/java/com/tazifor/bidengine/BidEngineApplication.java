package com.tazifor.bidengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bid Engine - real-time bidding auction core
 *
 * <ul>
 *   <li>OpenRTB style bid endpoint behind a bounded worker pool</li>
 *   <li>Geo / interest campaign index</li>
 *   <li>Frequency capping and duplicate suppression per user</li>
 *   <li>Atomic budget ledger (in-memory or Aerospike)</li>
 *   <li>Second-price auction with commit cascades</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class BidEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BidEngineApplication.class, args);
    }
}
