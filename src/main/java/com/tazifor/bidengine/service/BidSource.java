package com.tazifor.bidengine.service;

import com.tazifor.bidengine.exception.BidSourceException;
import com.tazifor.bidengine.model.AdOpportunity;
import com.tazifor.bidengine.model.ExternalBid;

import java.util.List;

/**
 * External bidder consulted during an auction. Calls run on the bid source executor and are
 * abandoned (interrupted) once the request deadline passes.
 */
public interface BidSource {

    String id();

    /**
     * @return bids for campaigns known to this engine, possibly empty
     * @throws BidSourceException if the source could not answer
     */
    List<ExternalBid> requestBids(AdOpportunity opportunity);
}
