package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Campaign;
import com.tazifor.bidengine.model.WinNotification;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * POSTs {@link WinNotification}s to the campaign's {@code notificationEndpoint}.
 *
 * Runs off the request thread. Failures are logged and dropped, never retried.
 */
@Slf4j
public class HttpWinNotifier implements WinNotifier {

    private final RestTemplate restTemplate;
    private final Executor executor;

    public HttpWinNotifier(RestTemplate restTemplate, Executor executor) {
        this.restTemplate = restTemplate;
        this.executor = executor;
    }

    @Override
    public void notifyWin(Campaign campaign, WinNotification notification) {
        String endpoint = campaign.getNotificationEndpoint();
        if (StringUtils.isBlank(endpoint)) {
            return;
        }

        try {
            executor.execute(() -> post(endpoint, campaign.getId(), notification));
        } catch (RejectedExecutionException e) {
            log.warn("[WIN] Notification for auction {} dropped, notifier saturated", notification.getAuctionId());
        }
    }

    private void post(String endpoint, String campaignId, WinNotification notification) {
        try {
            restTemplate.postForEntity(endpoint, notification, Void.class);
            log.debug("[WIN] Notified {} for auction {}", campaignId, notification.getAuctionId());
        } catch (RestClientException e) {
            log.warn("[WIN] Notification to {} for auction {} failed: {}",
                endpoint, notification.getAuctionId(), e.getMessage());
        }
    }
}
