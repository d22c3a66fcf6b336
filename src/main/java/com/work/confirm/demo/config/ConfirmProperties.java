package com.work.confirm.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 仅存在于 demo/业务包，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link com.work.confirm.core.config.ConfirmConfig} 等不可变配置。
 */
@ConfigurationProperties(prefix = "confirm")
public class ConfirmProperties {

    /**
     * processed / confirmed / finalized
     */
    private String defaultCommitment = "confirmed";

    /**
     * 未显式给出时 push 等待的超时
     */
    private Duration defaultTimeout = Duration.ofSeconds(60);

    /**
     * confirmAsync 使用的线程数
     */
    private int asyncWorkers = 8;

    private final Push push = new Push();
    private final Polling polling = new Polling();
    private final Degrade degrade = new Degrade();
    private final Store store = new Store();

    public String getDefaultCommitment() {
        return defaultCommitment;
    }

    public void setDefaultCommitment(String defaultCommitment) {
        this.defaultCommitment = defaultCommitment;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public int getAsyncWorkers() {
        return asyncWorkers;
    }

    public void setAsyncWorkers(int asyncWorkers) {
        this.asyncWorkers = asyncWorkers;
    }

    public Push getPush() {
        return push;
    }

    public Polling getPolling() {
        return polling;
    }

    public Degrade getDegrade() {
        return degrade;
    }

    public Store getStore() {
        return store;
    }

    public static class Push {

        private boolean enabled = true;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration subscribeAckTimeout = Duration.ofSeconds(10);
        private Duration heartbeatInterval = Duration.ofSeconds(20);
        private Duration probeTimeout = Duration.ofSeconds(10);
        private Duration idleReadTimeout = Duration.ofSeconds(30);
        private Duration closeTimeout = Duration.ofSeconds(5);

        /**
         * 额外的节点服务商改写规则，优先于内置规则
         */
        private List<EndpointRule> endpointRules = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getSubscribeAckTimeout() {
            return subscribeAckTimeout;
        }

        public void setSubscribeAckTimeout(Duration subscribeAckTimeout) {
            this.subscribeAckTimeout = subscribeAckTimeout;
        }

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public Duration getProbeTimeout() {
            return probeTimeout;
        }

        public void setProbeTimeout(Duration probeTimeout) {
            this.probeTimeout = probeTimeout;
        }

        public Duration getIdleReadTimeout() {
            return idleReadTimeout;
        }

        public void setIdleReadTimeout(Duration idleReadTimeout) {
            this.idleReadTimeout = idleReadTimeout;
        }

        public Duration getCloseTimeout() {
            return closeTimeout;
        }

        public void setCloseTimeout(Duration closeTimeout) {
            this.closeTimeout = closeTimeout;
        }

        public List<EndpointRule> getEndpointRules() {
            return endpointRules;
        }

        public void setEndpointRules(List<EndpointRule> endpointRules) {
            this.endpointRules = endpointRules;
        }
    }

    public static class EndpointRule {

        private String name;
        private String hostPattern;

        /**
         * 为空时跟随原 scheme
         */
        private Boolean secure;
        private int portOffset;
        private String pathPattern;
        private String pathReplacement;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getHostPattern() {
            return hostPattern;
        }

        public void setHostPattern(String hostPattern) {
            this.hostPattern = hostPattern;
        }

        public Boolean getSecure() {
            return secure;
        }

        public void setSecure(Boolean secure) {
            this.secure = secure;
        }

        public int getPortOffset() {
            return portOffset;
        }

        public void setPortOffset(int portOffset) {
            this.portOffset = portOffset;
        }

        public String getPathPattern() {
            return pathPattern;
        }

        public void setPathPattern(String pathPattern) {
            this.pathPattern = pathPattern;
        }

        public String getPathReplacement() {
            return pathReplacement;
        }

        public void setPathReplacement(String pathReplacement) {
            this.pathReplacement = pathReplacement;
        }
    }

    public static class Polling {

        private int maxAttempts = 30;
        private Duration interval = Duration.ofSeconds(1);

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }
    }

    public static class Degrade {

        /**
         * 连续多少次 push 失败后降级为仅 polling
         */
        private int failThreshold = 3;
        private Duration openDuration = Duration.ofSeconds(30);

        public int getFailThreshold() {
            return failThreshold;
        }

        public void setFailThreshold(int failThreshold) {
            this.failThreshold = failThreshold;
        }

        public Duration getOpenDuration() {
            return openDuration;
        }

        public void setOpenDuration(Duration openDuration) {
            this.openDuration = openDuration;
        }
    }

    public static class Store {

        /**
         * memory 或 mybatis
         */
        private String type = "memory";
        private long memoryMaxSize = 10000;
        private Duration memoryRetention = Duration.ofHours(24);

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public long getMemoryMaxSize() {
            return memoryMaxSize;
        }

        public void setMemoryMaxSize(long memoryMaxSize) {
            this.memoryMaxSize = memoryMaxSize;
        }

        public Duration getMemoryRetention() {
            return memoryRetention;
        }

        public void setMemoryRetention(Duration memoryRetention) {
            this.memoryRetention = memoryRetention;
        }
    }
}
