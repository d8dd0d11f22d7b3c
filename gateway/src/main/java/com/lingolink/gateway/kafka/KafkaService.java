package com.lingolink.gateway.kafka;

import com.lingolink.core.msg.DeliveryCommand;
import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.config.GatewayConfig;
import com.lingolink.gateway.metrics.MetricsService;
import com.lingolink.gateway.notify.NotificationRecord;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.kafka.receiver.KafkaReceiver;
import reactor.kafka.receiver.ReceiverOptions;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;
import reactor.kafka.sender.SenderRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Kafka plumbing of a gateway node.
 * <p>
 * <ul>
 *   <li>Producer: notification records to the notification topic, keyed by user id so
 *   one user's records stay ordered</li>
 *   <li>Consumer: delivery commands from business services. Each node uses its own
 *   consumer group and reads the whole topic, because the target user may be connected
 *   to any node</li>
 * </ul>
 * </p>
 */
public class KafkaService implements IKafkaService {
    private static final Logger log = LoggerFactory.getLogger(KafkaService.class);

    private final GatewayConfig config;
    private final MetricsService metricsService;
    private final KafkaSender<String, String> sender;
    private Disposable deliverySubscription;

    public KafkaService(GatewayConfig config, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.ACKS_CONFIG, "all"); // Required for idempotent producer
        producerProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, "5");
        producerProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");

        this.sender = KafkaSender.create(SenderOptions.create(producerProps));
        log.info("Kafka producer initialized for {}", config.getKafkaBootstrap());
    }

    @Override
    public Mono<Void> start(Function<DeliveryCommand, Boolean> handler) {
        return Mono.fromRunnable(() -> {
            Map<String, Object> consumerProps = new HashMap<>();
            consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, config.getKafkaBootstrap());
            consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "gateway-delivery-" + config.getNodeId());
            consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
            // Commands for users that were connected before this node started are stale.
            consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");

            ReceiverOptions<String, String> receiverOptions = ReceiverOptions.<String, String>create(consumerProps)
                .subscription(Collections.singleton(config.getDeliveryTopic()));

            deliverySubscription = KafkaReceiver.create(receiverOptions).receive()
                .doOnNext(record -> {
                    boolean applied = applyCommand(record.value(), handler);
                    metricsService.recordDeliveryCommand(applied);
                    record.receiverOffset().acknowledge();
                })
                .doOnError(err -> log.error("Delivery command consumer failed", err))
                .subscribe();

            log.info("Node {} consuming delivery commands from {}", config.getNodeId(), config.getDeliveryTopic());
        });
    }

    private boolean applyCommand(String value, Function<DeliveryCommand, Boolean> handler) {
        try {
            DeliveryCommand command = JsonUtils.readValue(value, DeliveryCommand.class);
            return Boolean.TRUE.equals(handler.apply(command));
        } catch (RuntimeException e) {
            log.warn("Skipping unreadable delivery command: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Mono<Void> publish(NotificationRecord notificationRecord) {
        String key = notificationRecord.getUserId();
        ProducerRecord<String, String> producerRecord = new ProducerRecord<>(
            config.getNotificationTopic(), key, JsonUtils.writeValueAsString(notificationRecord)
        );
        return sender.send(Mono.just(SenderRecord.create(producerRecord, key)))
            .doOnNext(result -> {
                if (result.exception() != null) {
                    log.warn("Notification record for {} not published: {}", key, result.exception().getMessage());
                }
            })
            .then();
    }

    @Override
    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (deliverySubscription != null) {
                deliverySubscription.dispose();
            }
            sender.close();
            log.info("Kafka consumer and producer stopped");
        });
    }
}
