package com.lingolink.gateway.notify;

import reactor.core.publisher.Mono;

/**
 * Fire-and-forget hand-off of notification records.
 */
public interface NotificationSink {

    Mono<Void> publish(NotificationRecord record);
}
