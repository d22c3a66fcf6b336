package com.work.confirm.demo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.work.confirm.core.ConfirmationEngine;
import com.work.confirm.core.chain.SolanaRpcClient;
import com.work.confirm.core.channel.ChannelEndpointResolver;
import com.work.confirm.core.channel.EndpointRewriteRule;
import com.work.confirm.core.channel.web3j.Web3jWebSocketTransport;
import com.work.confirm.core.config.ConfirmConfig;
import com.work.confirm.core.config.PollingConfig;
import com.work.confirm.core.config.PushChannelConfig;
import com.work.confirm.core.model.Commitment;
import com.work.confirm.core.polling.PollingFallback;
import com.work.confirm.core.record.ConfirmationRecordRepository;
import com.work.confirm.core.record.InMemoryConfirmationRecordRepository;
import com.work.confirm.core.support.metrics.ConfirmMetrics;
import com.work.confirm.core.support.metrics.NoopConfirmMetrics;
import com.work.confirm.demo.chain.MockSolanaRpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 将核心组件装配为 Spring Bean，方便通过依赖注入复用。
 * 默认使用 mock 节点客户端 + 内存记录存储；chain.mode=web3j / confirm.store.type=mybatis 时切换为真实实现。
 * mock 模式下 push 通道关闭，确认只经 polling 查询 mock 节点。
 */
@Configuration
@EnableConfigurationProperties({ConfirmProperties.class, ChainProperties.class})
public class ConfirmComponentConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ConfirmComponentConfiguration.class);

    private static final String MODE_MOCK = "mock";

    @Bean
    public ConfirmConfig confirmConfig(ConfirmProperties properties, ChainProperties chainProperties) {
        return new ConfirmConfig(
                pushEnabled(properties, chainProperties),
                Commitment.parse(properties.getDefaultCommitment()),
                properties.getDefaultTimeout(),
                properties.getDegrade().getFailThreshold(),
                properties.getDegrade().getOpenDuration(),
                properties.getAsyncWorkers()
        );
    }

    /**
     * mock 节点的签名只存在于内存，真实节点永远不会推送通知，因此 mock 模式只走 polling。
     */
    static boolean pushEnabled(ConfirmProperties properties, ChainProperties chainProperties) {
        if (!properties.getPush().isEnabled()) {
            return false;
        }
        if (MODE_MOCK.equalsIgnoreCase(chainProperties.getMode())) {
            log.info("Push channel disabled in mock chain mode, confirmations use polling only");
            return false;
        }
        return true;
    }

    @Bean
    public PushChannelConfig pushChannelConfig(ConfirmProperties properties) {
        ConfirmProperties.Push p = properties.getPush();
        return new PushChannelConfig(
                p.getConnectTimeout(),
                p.getSubscribeAckTimeout(),
                p.getHeartbeatInterval(),
                p.getProbeTimeout(),
                p.getIdleReadTimeout(),
                p.getCloseTimeout()
        );
    }

    @Bean
    public PollingConfig pollingConfig(ConfirmProperties properties) {
        return new PollingConfig(properties.getPolling().getMaxAttempts(), properties.getPolling().getInterval());
    }

    @Bean
    public ChannelEndpointResolver channelEndpointResolver(ConfirmProperties properties) {
        List<EndpointRewriteRule> rules = new ArrayList<>();
        for (ConfirmProperties.EndpointRule r : properties.getPush().getEndpointRules()) {
            rules.add(new EndpointRewriteRule(r.getName(), r.getHostPattern(), r.getSecure(), r.getPortOffset(),
                    r.getPathPattern(), r.getPathReplacement()));
        }
        return new ChannelEndpointResolver(rules);
    }

    @Bean
    @ConditionalOnMissingBean(ConfirmMetrics.class)
    public ConfirmMetrics confirmMetrics() {
        return new NoopConfirmMetrics();
    }

    /**
     * 默认使用 mock；若设置 chain.mode=web3j，将由 Web3jConfiguration 提供实现
     */
    @Bean
    @ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "mock", matchIfMissing = true)
    public SolanaRpcClient mockSolanaRpcClient() {
        return new MockSolanaRpcClient();
    }

    /**
     * 默认内存存储；confirm.store.type=mybatis 时由 MybatisStoreConfiguration 提供
     */
    @Bean
    @ConditionalOnProperty(prefix = "confirm.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public ConfirmationRecordRepository inMemoryConfirmationRecordRepository(ConfirmProperties properties) {
        return new InMemoryConfirmationRecordRepository(properties.getStore().getMemoryMaxSize(),
                properties.getStore().getMemoryRetention());
    }

    @Bean
    public PollingFallback pollingFallback(SolanaRpcClient rpcClient, PollingConfig pollingConfig) {
        return new PollingFallback(rpcClient, pollingConfig);
    }

    @Bean(destroyMethod = "close")
    public ConfirmationEngine confirmationEngine(ConfirmConfig confirmConfig,
                                                 PushChannelConfig pushChannelConfig,
                                                 ChainProperties chainProperties,
                                                 ChannelEndpointResolver resolver,
                                                 ObjectMapper objectMapper,
                                                 PollingFallback pollingFallback,
                                                 ConfirmationRecordRepository records,
                                                 ConfirmMetrics metrics) {
        // 连接懒建立：第一次 confirm 时才会握手
        return ConfirmationEngine.create(confirmConfig, pushChannelConfig,
                chainProperties.getRpcUrl(), chainProperties.getWsUrl(),
                resolver, Web3jWebSocketTransport::new, objectMapper,
                pollingFallback, records, metrics);
    }
}
