package com.lingolink.gateway.presence;

import com.lingolink.core.model.Identity;
import com.lingolink.core.model.PresenceStatus;
import com.lingolink.core.msg.Events;
import com.lingolink.gateway.backend.SocialGraph;
import com.lingolink.gateway.redis.ActivityRecorder;
import com.lingolink.gateway.room.RoomRouter;
import com.lingolink.gateway.session.ConnectionListener;
import com.lingolink.gateway.session.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory user status and its fan-out to followers.
 * <p>
 * Status is advisory. Announcements are best effort: failures to resolve followers or
 * reach them are logged and never surface to the caller.
 * </p>
 * <p>
 * Registry callbacks for one user can arrive out of order from different threads, so
 * {@code offline} is only applied while the registry holds no live connection for the
 * user, and an announcement overtaken by a later status change is not sent.
 * </p>
 */
public class PresenceTracker implements ConnectionListener {
    private static final Logger log = LoggerFactory.getLogger(PresenceTracker.class);

    private final ConnectionRegistry registry;
    private final RoomRouter router;
    private final SocialGraph socialGraph;
    private final ActivityRecorder activityRecorder;
    private final Scheduler scheduler;
    private final Map<String, PresenceStatus> statuses = new ConcurrentHashMap<>();

    public PresenceTracker(ConnectionRegistry registry, RoomRouter router, SocialGraph socialGraph,
                           ActivityRecorder activityRecorder, Scheduler scheduler) {
        this.registry = registry;
        this.router = router;
        this.socialGraph = socialGraph;
        this.activityRecorder = activityRecorder;
        this.scheduler = scheduler;
    }

    /**
     * Sets a user's status and tells their followers.
     *
     * @return Mono completing once followers were notified (or notification failed)
     */
    public Mono<Void> setStatus(String userId, PresenceStatus status) {
        Instant now = now();
        statuses.put(userId, status);
        if (status != PresenceStatus.OFFLINE) {
            activityRecorder.touch(userId, now)
                .onErrorResume(err -> {
                    log.warn("Failed to record activity for user {}: {}", userId, err.getMessage());
                    return Mono.empty();
                })
                .subscribe();
        }
        log.debug("User {} is now {}", userId, status.wireValue());
        return announce(userId, status, now);
    }

    public PresenceStatus statusOf(String userId) {
        return statuses.getOrDefault(userId, PresenceStatus.OFFLINE);
    }

    @Override
    public void userOnline(Identity identity) {
        String userId = identity.getUserId();
        statuses.put(userId, PresenceStatus.ONLINE);
        announce(userId, PresenceStatus.ONLINE, now()).subscribe();
    }

    @Override
    public void userOffline(String userId) {
        AtomicBoolean wentOffline = new AtomicBoolean(false);
        statuses.compute(userId, (uid, current) -> {
            if (!registry.socketsFor(uid).isEmpty()) {
                return current;
            }
            wentOffline.set(true);
            return null;
        });
        if (!wentOffline.get()) {
            log.debug("User {} reconnected before going offline, keeping status", userId);
            return;
        }
        announce(userId, PresenceStatus.OFFLINE, now()).subscribe();
    }

    private Mono<Void> announce(String userId, PresenceStatus status, Instant at) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("status", status);
        payload.put("timestamp", at);

        return socialGraph.followersOf(userId)
            .takeWhile(followerId -> statusOf(userId) == status)
            .map(followerId -> router.sendToUser(followerId, Events.Server.FRIEND_STATUS_CHANGED, payload))
            .reduce(0, Integer::sum)
            .doOnNext(delivered -> log.debug("Status {} of user {} reached {} follower connections",
                status.wireValue(), userId, delivered))
            .then()
            .onErrorResume(err -> {
                log.warn("Failed to announce status {} of user {}: {}", status.wireValue(), userId, err.getMessage());
                return Mono.empty();
            });
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }
}
