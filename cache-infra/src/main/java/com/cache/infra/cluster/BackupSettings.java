package com.cache.infra.cluster;

import java.util.Objects;

import jakarta.annotation.Nullable;
import software.amazon.awscdk.Duration;

public record BackupSettings(
    Duration retention,
    // UTC range such as "03:00-04:00", ElastiCache picks one when null
    @Nullable String preferredWindow
) {
    public BackupSettings {
        Objects.requireNonNull(retention, "retention");
    }

    public BackupSettings(Duration retention) {
        this(retention, null);
    }
}
