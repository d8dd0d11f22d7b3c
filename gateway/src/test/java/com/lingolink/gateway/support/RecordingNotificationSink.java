package com.lingolink.gateway.support;

import com.lingolink.gateway.notify.NotificationRecord;
import com.lingolink.gateway.notify.NotificationSink;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingNotificationSink implements NotificationSink {
    private final List<NotificationRecord> records = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> publish(NotificationRecord record) {
        return Mono.fromRunnable(() -> records.add(record));
    }

    public List<NotificationRecord> records() {
        return List.copyOf(records);
    }
}
