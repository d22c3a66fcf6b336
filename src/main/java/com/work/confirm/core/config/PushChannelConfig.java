package com.work.confirm.core.config;

import java.time.Duration;

import static com.work.confirm.core.support.ValidationUtils.requirePositive;

/**
 * push 通道的各项时限。纯组件侧配置，不依赖任何框架。
 */
public class PushChannelConfig {

    private final Duration connectTimeout;
    private final Duration subscribeAckTimeout;
    private final Duration heartbeatInterval;
    private final Duration probeTimeout;
    private final Duration idleReadTimeout;
    private final Duration closeTimeout;

    public PushChannelConfig(Duration connectTimeout,
                             Duration subscribeAckTimeout,
                             Duration heartbeatInterval,
                             Duration probeTimeout,
                             Duration idleReadTimeout,
                             Duration closeTimeout) {
        this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
        this.subscribeAckTimeout = requirePositive(subscribeAckTimeout, "subscribeAckTimeout");
        this.heartbeatInterval = requirePositive(heartbeatInterval, "heartbeatInterval");
        this.probeTimeout = requirePositive(probeTimeout, "probeTimeout");
        this.idleReadTimeout = requirePositive(idleReadTimeout, "idleReadTimeout");
        this.closeTimeout = requirePositive(closeTimeout, "closeTimeout");
    }

    public static PushChannelConfig defaultConfig() {
        return new PushChannelConfig(Duration.ofSeconds(10), Duration.ofSeconds(10), Duration.ofSeconds(20),
                Duration.ofSeconds(10), Duration.ofSeconds(30), Duration.ofSeconds(5));
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getSubscribeAckTimeout() {
        return subscribeAckTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public Duration getIdleReadTimeout() {
        return idleReadTimeout;
    }

    public Duration getCloseTimeout() {
        return closeTimeout;
    }
}
