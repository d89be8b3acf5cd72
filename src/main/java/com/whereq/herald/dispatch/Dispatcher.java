package com.whereq.herald.dispatch;

import com.whereq.herald.model.NotificationPayload;
import reactor.core.publisher.Mono;

/**
 * Delivery channel for notifications.
 * The scheduler only distinguishes success from failure; any error signal counts as a failed delivery.
 */
public interface Dispatcher {

    /**
     * Deliver a notification
     *
     * @param payload rendered notification, including its destination
     * @return Mono with the delivery identifier assigned by the channel (may complete empty)
     */
    Mono<String> deliver(NotificationPayload payload);
}
