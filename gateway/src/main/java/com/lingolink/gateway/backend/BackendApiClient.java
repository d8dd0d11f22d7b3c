package com.lingolink.gateway.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.lingolink.core.model.Identity;
import com.lingolink.core.util.JsonUtils;
import com.lingolink.gateway.config.GatewayConfig;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Reactive client for the business backend's internal API.
 * <p>
 * A 404 means "absent" and maps to an empty result; any other non-2xx status is a
 * {@link BackendException}.
 * </p>
 */
public class BackendApiClient implements IdentityLookup, SocialGraph, ConversationAccess, ConversationMessages {
    private static final Logger log = LoggerFactory.getLogger(BackendApiClient.class);

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };

    private final HttpClient client;

    public BackendApiClient(GatewayConfig config) {
        this(HttpClient.create()
            .baseUrl(config.getBackendBaseUrl())
            .responseTimeout(config.getBackendTimeout())
            .headers(headers -> headers.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON)));
        log.info("Backend API client targeting {}", config.getBackendBaseUrl());
    }

    BackendApiClient(HttpClient client) {
        this.client = client;
    }

    @Override
    public Mono<Identity> findByFirebaseUid(String firebaseUid) {
        return get("/internal/users/by-firebase-uid/" + segment(firebaseUid))
            .map(json -> JsonUtils.readValue(json, Identity.class));
    }

    @Override
    public Mono<Identity> findById(String userId) {
        return get("/internal/users/" + segment(userId))
            .map(json -> JsonUtils.readValue(json, Identity.class));
    }

    @Override
    public Flux<String> followersOf(String userId) {
        return get("/internal/users/" + segment(userId) + "/followers")
            .flatMapIterable(json -> JsonUtils.readValue(json, ID_LIST));
    }

    @Override
    public Mono<Boolean> userHasAccess(String userId, String conversationId) {
        return get("/internal/conversations/" + segment(conversationId) + "/participants/" + segment(userId))
            .map(json -> true)
            .defaultIfEmpty(false)
            .onErrorResume(
                err -> err instanceof BackendException backendError && backendError.getStatus() == 403,
                err -> Mono.just(false)
            );
    }

    @Override
    public Mono<JsonNode> createMessage(String userId, String conversationId, JsonNode message) {
        String body = JsonUtils.writeValueAsString(Map.of("senderId", userId, "message", message));
        String uri = "/internal/conversations/" + segment(conversationId) + "/messages";
        return client
            .headers(headers -> headers.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
            .post()
            .uri(uri)
            .send(ByteBufFlux.fromString(Mono.just(body)))
            .responseSingle((response, content) -> {
                int status = response.status().code();
                if (status >= 300) {
                    return Mono.<String>error(new BackendException("POST " + uri + " returned " + status, status));
                }
                return content.asString();
            })
            .switchIfEmpty(Mono.error(new BackendException("POST " + uri + " returned no body", 200)))
            .map(json -> JsonUtils.readValue(json, JsonNode.class));
    }

    /**
     * @return the response body; empty on 404 or an empty body
     */
    private Mono<String> get(String uri) {
        return client.get()
            .uri(uri)
            .responseSingle((response, content) -> {
                int status = response.status().code();
                if (status == 404) {
                    return Mono.<String>empty();
                }
                if (status >= 300) {
                    return Mono.<String>error(new BackendException("GET " + uri + " returned " + status, status));
                }
                return content.asString();
            });
    }

    private static String segment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
