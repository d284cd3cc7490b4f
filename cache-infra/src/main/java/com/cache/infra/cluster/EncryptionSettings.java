package com.cache.infra.cluster;

import jakarta.annotation.Nullable;
import software.amazon.awscdk.services.kms.IKey;

public record EncryptionSettings(
    boolean atRest,
    boolean inTransit,
    // AWS owned key when null
    @Nullable IKey kmsKey
) {
    public EncryptionSettings(boolean atRest, boolean inTransit) {
        this(atRest, inTransit, null);
    }
}
