package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.WinNotification;

/**
 * Tells a campaign's owner it won. Best effort: must never block or fail the auction.
 */
public interface WinNotifier {

    WinNotifier NOOP = (campaign, notification) -> {
    };

    void notifyWin(Campaign campaign, WinNotification notification);
}
