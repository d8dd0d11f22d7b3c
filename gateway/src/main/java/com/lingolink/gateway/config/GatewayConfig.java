package com.lingolink.gateway.config;

import com.lingolink.core.msg.Topics;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a gateway node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class GatewayConfig {

    String nodeId;
    int httpPort;
    /**
     * Deployment environment; {@code production} disables test credentials and shortens
     * the authentication deadline.
     */
    String environment;

    Duration authTimeoutProduction;
    Duration authTimeoutDevelopment;
    Duration authFailureCloseDelay;
    int maxConnectionsPerUser;
    Duration heartbeatInterval;
    Duration shutdownGrace;
    int perConnBufferSize;

    boolean testModeEnabled;
    String testAuthSecret;
    String tokenSigningKey;
    String firebaseProjectId;
    Duration verifyTimeout;
    Duration clockSkewTolerance;

    String backendBaseUrl;
    Duration backendTimeout;
    String kafkaBootstrap;
    String notificationTopic;
    String deliveryTopic;
    String redisUrl;
    int activityTtlSec;

    public static GatewayConfig fromEnv() {
        return GatewayConfig.builder()
                .nodeId(getEnv("NODE_ID", "gateway-node-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .environment(getEnv("APP_ENV", "development"))
                .authTimeoutProduction(Duration.ofMillis(Long.parseLong(getEnv("AUTH_TIMEOUT_PROD_MS", "30000"))))
                .authTimeoutDevelopment(Duration.ofMillis(Long.parseLong(getEnv("AUTH_TIMEOUT_DEV_MS", "60000"))))
                .authFailureCloseDelay(Duration.ofMillis(Long.parseLong(getEnv("AUTH_FAILURE_CLOSE_DELAY_MS", "1000"))))
                .maxConnectionsPerUser(Integer.parseInt(getEnv("MAX_CONNECTIONS_PER_USER", "5")))
                .heartbeatInterval(Duration.ofSeconds(Long.parseLong(getEnv("HEARTBEAT_INTERVAL_SEC", "30"))))
                .shutdownGrace(Duration.ofMillis(Long.parseLong(getEnv("SHUTDOWN_GRACE_MS", "1000"))))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .testModeEnabled(Boolean.parseBoolean(getEnv("TEST_MODE_ENABLED", "false")))
                .testAuthSecret(getEnv("TEST_AUTH_SECRET", ""))
                .tokenSigningKey(getEnv("TOKEN_SIGNING_KEY", ""))
                .firebaseProjectId(getEnv("FIREBASE_PROJECT_ID", ""))
                .verifyTimeout(Duration.ofMillis(Long.parseLong(getEnv("VERIFY_TIMEOUT_MS", "10000"))))
                .clockSkewTolerance(Duration.ofSeconds(Long.parseLong(getEnv("CLOCK_SKEW_SEC", "300"))))
                .backendBaseUrl(getEnv("BACKEND_BASE_URL", "http://localhost:3000"))
                .backendTimeout(Duration.ofMillis(Long.parseLong(getEnv("BACKEND_TIMEOUT_MS", "5000"))))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .notificationTopic(getEnv("NOTIFICATION_TOPIC", Topics.NOTIFICATIONS))
                .deliveryTopic(getEnv("DELIVERY_TOPIC", Topics.DELIVERIES))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .activityTtlSec(Integer.parseInt(getEnv("ACTIVITY_TTL_SEC", "86400")))
                .build();
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    /**
     * Hard deadline for a connection to complete authentication.
     */
    public Duration authTimeout() {
        return isProduction() ? authTimeoutProduction : authTimeoutDevelopment;
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
