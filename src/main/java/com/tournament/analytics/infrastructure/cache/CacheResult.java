package com.tournament.analytics.infrastructure.cache;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a single cache operation.
 *
 * Cache failures are reported as {@link Status#ERROR} instead of being thrown, so every
 * caller unwraps the result with an explicit fallback.
 */
public final class CacheResult<T> {

    public enum Status {
        HIT,
        MISS,
        COMPUTED,
        OK,
        ERROR
    }

    private final Status status;
    private final T value;
    private final Throwable error;

    private CacheResult(Status status, T value, Throwable error) {
        this.status = status;
        this.value = value;
        this.error = error;
    }

    public static <T> CacheResult<T> hit(T value) {
        return new CacheResult<>(Status.HIT, value, null);
    }

    public static <T> CacheResult<T> miss() {
        return new CacheResult<>(Status.MISS, null, null);
    }

    public static <T> CacheResult<T> computed(T value) {
        return new CacheResult<>(Status.COMPUTED, value, null);
    }

    public static <T> CacheResult<T> ok(T value) {
        return new CacheResult<>(Status.OK, value, null);
    }

    public static <T> CacheResult<T> error(Throwable error) {
        return new CacheResult<>(Status.ERROR, null, error);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isHit() {
        return status == Status.HIT;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public T orElseGet(Supplier<? extends T> fallback) {
        return value != null ? value : fallback.get();
    }

    @Override
    public String toString() {
        return "CacheResult{" + status + (error != null ? ", error=" + error.getMessage() : "") + "}";
    }
}
