/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.router.client;

import com.geastalt.kv.api.ApiResponse;
import com.geastalt.kv.api.KeyValue;
import com.geastalt.kv.api.KeyValueRequest;
import com.geastalt.kv.api.RaftStatusView;
import com.geastalt.kv.model.KvError;
import com.geastalt.kv.model.KvResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;
import java.util.function.Function;

/**
 * {@link NodeClient} over the nodes' JSON API.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpNodeClient implements NodeClient {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private static final ParameterizedTypeReference<ApiResponse<KeyValue>> KEY_VALUE_REPLY =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ApiResponse<Void>> EMPTY_REPLY =
            new ParameterizedTypeReference<>() {
            };
    private static final ParameterizedTypeReference<ApiResponse<RaftStatusView>> STATUS_REPLY =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;

    @Override
    public KvResult<KeyValue> put(String address, String key, String value, String requestId) {
        return call(address, "put", () -> restClient.post()
                        .uri(address + "/put")
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .header(REQUEST_ID_HEADER, requestId)
                        .body(new KeyValueRequest(key, value, requestId))
                        .exchange((request, reply) -> new Reply<>(
                                reply.getStatusCode().value(),
                                reply.getHeaders().getLocation(),
                                reply.bodyTo(KEY_VALUE_REPLY))),
                ApiResponse::data);
    }

    @Override
    public KvResult<KeyValue> get(String address, String key) {
        return call(address, "get", () -> restClient.get()
                        .uri(address + "/get?key={key}", key)
                        .accept(MediaType.APPLICATION_JSON)
                        .exchange((request, reply) -> new Reply<>(
                                reply.getStatusCode().value(),
                                reply.getHeaders().getLocation(),
                                reply.bodyTo(EMPTY_REPLY))),
                body -> new KeyValue(body.key() != null ? body.key() : key, body.value()));
    }

    @Override
    public KvResult<KeyValue> delete(String address, String key, String requestId) {
        return call(address, "delete", () -> restClient.delete()
                        .uri(address + "/delete?key={key}", key)
                        .accept(MediaType.APPLICATION_JSON)
                        .header(REQUEST_ID_HEADER, requestId)
                        .exchange((request, reply) -> new Reply<>(
                                reply.getStatusCode().value(),
                                reply.getHeaders().getLocation(),
                                reply.bodyTo(EMPTY_REPLY))),
                body -> new KeyValue(key, null));
    }

    @Override
    public KvResult<RaftStatusView> status(String address) {
        return call(address, "status", () -> restClient.get()
                        .uri(address + "/raft/status")
                        .accept(MediaType.APPLICATION_JSON)
                        .exchange((request, reply) -> new Reply<>(
                                reply.getStatusCode().value(),
                                reply.getHeaders().getLocation(),
                                reply.bodyTo(STATUS_REPLY))),
                ApiResponse::data);
    }

    private <B, T> KvResult<T> call(String address, String operation,
                                    ReplySupplier<B> exchange,
                                    Function<ApiResponse<B>, T> onSuccess) {
        Reply<B> reply;
        try {
            reply = exchange.get();
        } catch (RestClientException e) {
            log.debug("{} against {} failed: {}", operation, address, e.getMessage());
            return KvResult.failure(KvError.unreachable(address, e.getMessage()));
        }

        var body = reply.body();
        if (reply.status() == HttpStatus.TEMPORARY_REDIRECT.value()) {
            return KvResult.failure(redirectError(body, reply.location()));
        }
        if (body == null) {
            return KvResult.failure(KvError.error("Empty " + operation + " reply from " + address
                    + " (HTTP " + reply.status() + ")"));
        }
        if (!body.success()) {
            return KvResult.failure(body.toError());
        }
        return KvResult.success(onSuccess.apply(body));
    }

    /**
     * A 307 from a node always means NOT_LEADER. The Location header stands in
     * for a missing leader address.
     */
    private static KvError redirectError(ApiResponse<?> body, URI location) {
        String leaderId = body != null ? body.leaderId() : null;
        String leaderAddress = body != null ? body.leaderAddress() : null;
        if (leaderAddress == null && location != null) {
            leaderAddress = location.getScheme() + "://" + location.getAuthority();
        }
        return KvError.notLeader(leaderId, leaderAddress);
    }

    private record Reply<B>(int status, URI location, ApiResponse<B> body) {
    }

    @FunctionalInterface
    private interface ReplySupplier<B> {
        Reply<B> get();
    }
}
