package com.purchasingpower.codegraph.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Bounds of the query result cache.
 *
 * <pre>
 * app:
 *   cache:
 *     max-entries: 1000
 *     ttl: 300000ms
 *     max-size-mb: 50
 *     stats-enabled: true
 *     max-sweep-interval: 60s
 * </pre>
 */
@Data
public class CacheProperties {

    @Min(1)
    private int maxEntries = 1000;

    @NotNull
    private Duration ttl = Duration.ofMinutes(5);

    @Min(1)
    private long maxSizeMb = 50;

    private boolean statsEnabled = true;

    /**
     * Upper bound of the expiry sweep period; the sweep runs at ttl / 4 when that is shorter.
     */
    @NotNull
    private Duration maxSweepInterval = Duration.ofSeconds(60);

    public long getMaxSizeBytes() {
        return maxSizeMb * 1024 * 1024;
    }
}
