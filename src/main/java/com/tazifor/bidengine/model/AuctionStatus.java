package com.tazifor.bidengine.model;

public enum AuctionStatus {
    WON,
    NO_BID,
    TIMEOUT
}
