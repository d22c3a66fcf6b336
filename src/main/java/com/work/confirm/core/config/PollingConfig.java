package com.work.confirm.core.config;

import java.time.Duration;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;
import static com.work.confirm.core.support.ValidationUtils.requirePositive;

/**
 * polling 兜底的界限：最多查询 maxAttempts 次，两次之间间隔 interval。
 */
public class PollingConfig {

    private final int maxAttempts;
    private final Duration interval;

    public PollingConfig(int maxAttempts, Duration interval) {
        this.maxAttempts = requirePositive(maxAttempts, "maxAttempts");
        this.interval = requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new IllegalArgumentException("interval 不能为负数");
        }
    }

    public static PollingConfig defaultConfig() {
        return new PollingConfig(30, Duration.ofSeconds(1));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getInterval() {
        return interval;
    }
}
