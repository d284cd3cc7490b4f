package com.cache.infra.cluster;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class ResourceHandleTest {

    @Test
    void suppliedResourceIsBorrowedAndFactoryNotCalled() {
        var calls = new AtomicInteger();

        var handle = ResourceHandle.borrowOrCreate("supplied", () -> {
            calls.incrementAndGet();
            return "created";
        });

        assertThat(handle.resource()).isEqualTo("supplied");
        assertThat(handle.isOwned()).isFalse();
        assertThat(calls).hasValue(0);
    }

    @Test
    void missingResourceIsCreatedAndOwned() {
        var handle = ResourceHandle.borrowOrCreate(null, () -> "created");

        assertThat(handle.resource()).isEqualTo("created");
        assertThat(handle.ownership()).isEqualTo(ResourceHandle.Ownership.OWNED);
    }
}
