package com.work.confirm.demo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 节点连接配置（demo/宿主侧）。
 *
 * mode=mock: 使用 MockSolanaRpcClient
 * mode=web3j: 使用 Web3jSolanaRpcClient（HTTP JSON-RPC）
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * 节点 HTTP RPC 地址，push 地址默认由它推导
     */
    private String rpcUrl = "https://api.mainnet-beta.solana.com";

    /**
     * 显式指定 push 地址（ws/wss），设置后不再按改写表推导
     */
    private String wsUrl;

    /**
     * HTTP RPC 读超时
     */
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getWsUrl() {
        return wsUrl;
    }

    public void setWsUrl(String wsUrl) {
        this.wsUrl = wsUrl;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}
