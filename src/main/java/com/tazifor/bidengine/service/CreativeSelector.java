package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Creative;

import java.util.List;
import java.util.Optional;

/**
 * Picks the creative to serve for a winning campaign. Deterministic per request id, so a
 * retried request renders the same creative.
 */
public class CreativeSelector {

    public Optional<Creative> select(String requestId, List<Creative> creatives) {
        if (creatives == null || creatives.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(creatives.get(Math.floorMod(requestId.hashCode(), creatives.size())));
    }
}
