package com.lingolink.gateway.kafka;

import com.lingolink.core.msg.DeliveryCommand;
import com.lingolink.gateway.notify.NotificationSink;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Kafka producer/consumer lifecycle of a gateway node.
 */
public interface IKafkaService extends NotificationSink {

    /**
     * Starts consuming delivery commands.
     *
     * @param handler applies a command; returns whether it was accepted
     * @return Mono completing when the consumer is subscribed
     */
    Mono<Void> start(Function<DeliveryCommand, Boolean> handler);

    /**
     * Stops the consumer and closes the producer.
     *
     * @return Mono completing when stopped
     */
    Mono<Void> stop();
}
