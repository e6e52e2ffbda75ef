package com.tazifor.bidengine.model;

public enum BidType {
    CPM,
    CPC,
    CPA
}
