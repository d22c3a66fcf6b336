package com.work.confirm.core.config;

import com.work.confirm.core.model.Commitment;

import java.time.Duration;

import static com.work.confirm.core.support.ValidationUtils.requireNonNull;
import static com.work.confirm.core.support.ValidationUtils.requirePositive;

/**
 * 确认引擎配置。宿主应用（如 Spring Boot）只需在装配时将自身读取到的配置参数注入即可，
 * 确保 core 包保持与业务、框架解耦。
 */
public class ConfirmConfig {

    private final boolean pushEnabled;
    private final Commitment defaultCommitment;
    private final Duration defaultTimeout;
    private final int degradeFailThreshold;
    private final Duration degradeOpenDuration;
    private final int asyncWorkers;

    public ConfirmConfig(boolean pushEnabled,
                         Commitment defaultCommitment,
                         Duration defaultTimeout,
                         int degradeFailThreshold,
                         Duration degradeOpenDuration,
                         int asyncWorkers) {
        this.pushEnabled = pushEnabled;
        this.defaultCommitment = requireNonNull(defaultCommitment, "defaultCommitment");
        this.defaultTimeout = requirePositive(defaultTimeout, "defaultTimeout");
        this.degradeFailThreshold = requirePositive(degradeFailThreshold, "degradeFailThreshold");
        this.degradeOpenDuration = requirePositive(degradeOpenDuration, "degradeOpenDuration");
        this.asyncWorkers = requirePositive(asyncWorkers, "asyncWorkers");
    }

    public static ConfirmConfig defaultConfig() {
        return new ConfirmConfig(true, Commitment.CONFIRMED, Duration.ofSeconds(60), 3, Duration.ofSeconds(30), 8);
    }

    public boolean isPushEnabled() {
        return pushEnabled;
    }

    public Commitment getDefaultCommitment() {
        return defaultCommitment;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public int getDegradeFailThreshold() {
        return degradeFailThreshold;
    }

    public Duration getDegradeOpenDuration() {
        return degradeOpenDuration;
    }

    public int getAsyncWorkers() {
        return asyncWorkers;
    }
}
