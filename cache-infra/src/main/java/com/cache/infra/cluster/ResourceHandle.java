package com.cache.infra.cluster;

import java.util.Objects;
import java.util.function.Supplier;

import jakarta.annotation.Nullable;

/**
 * A child resource of the cluster that is either supplied by the caller or
 * created by the cluster itself.
 */
public record ResourceHandle<T>(T resource, Ownership ownership) {

    public enum Ownership {
        OWNED,
        BORROWED
    }

    public ResourceHandle {
        Objects.requireNonNull(resource, "resource");
        Objects.requireNonNull(ownership, "ownership");
    }

    public static <T> ResourceHandle<T> owned(T resource) {
        return new ResourceHandle<>(resource, Ownership.OWNED);
    }

    public static <T> ResourceHandle<T> borrowed(T resource) {
        return new ResourceHandle<>(resource, Ownership.BORROWED);
    }

    // Creation runs only when nothing was supplied
    public static <T> ResourceHandle<T> borrowOrCreate(@Nullable T supplied, Supplier<T> factory) {
        return supplied != null ? borrowed(supplied) : owned(factory.get());
    }

    public boolean isOwned() {
        return ownership == Ownership.OWNED;
    }
}
