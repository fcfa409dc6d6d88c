/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.kv.model;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a key-value or cluster operation: a value, or a {@link KvError}
 * whose {@link KvStatus} drives retries, redirects and HTTP codes.
 */
public sealed interface KvResult<T> {

    static <T> KvResult<T> success(T value) {
        return new Ok<>(value);
    }

    static <T> KvResult<T> failure(KvError error) {
        return new Failed<>(error);
    }

    static <T> KvResult<T> failure(KvStatus status, String message) {
        return new Failed<>(new KvError(status, message));
    }

    /**
     * {@link KvStatus#OK} for a value, otherwise the status of the error.
     */
    KvStatus status();

    /**
     * Gets the value, throwing if this is a failure.
     */
    T getValue();

    /**
     * Gets the error, throwing if this is a success.
     */
    KvError getError();

    default boolean isSuccess() {
        return this instanceof Ok;
    }

    default boolean is(KvStatus expected) {
        return status() == expected;
    }

    /**
     * True when another node may still succeed where this one failed.
     */
    default boolean isRetryable() {
        return status().isRetryable();
    }

    /**
     * Address of the leader carried by a NOT_LEADER failure, when known.
     */
    default Optional<String> leaderAddress() {
        return is(KvStatus.NOT_LEADER) ? getError().leaderAddress() : Optional.empty();
    }

    <U> KvResult<U> map(Function<T, U> mapper);

    /**
     * Replaces a failure of the given status with the result of the fallback.
     */
    default KvResult<T> recover(KvStatus status, Function<KvError, KvResult<T>> fallback) {
        return is(status) ? fallback.apply(getError()) : this;
    }

    record Ok<T>(T value) implements KvResult<T> {
        @Override
        public KvStatus status() {
            return KvStatus.OK;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public KvError getError() {
            throw new IllegalStateException("No error on a successful result");
        }

        @Override
        public <U> KvResult<U> map(Function<T, U> mapper) {
            return new Ok<>(mapper.apply(value));
        }

    }

    record Failed<T>(KvError error) implements KvResult<T> {
        @Override
        public KvStatus status() {
            return error.status();
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("No value on a failed result: " + error);
        }

        @Override
        public KvError getError() {
            return error;
        }

        @Override
        public <U> KvResult<U> map(Function<T, U> mapper) {
            return new Failed<>(error);
        }

    }
}
