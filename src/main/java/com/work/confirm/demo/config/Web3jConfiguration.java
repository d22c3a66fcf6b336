package com.work.confirm.demo.config;

import com.work.confirm.core.chain.SolanaRpcClient;
import com.work.confirm.demo.chain.web3j.Web3jSolanaRpcClient;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.http.HttpService;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。只用到 web3j 的 HTTP JSON-RPC 传输，push 通道另见 Web3jWebSocketTransport。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean
    public Web3jService web3jService(ChainProperties properties) {
        OkHttpClient httpClient = HttpService.getOkHttpClientBuilder()
                .readTimeout(properties.getRequestTimeout())
                .callTimeout(properties.getRequestTimeout())
                .build();
        return new HttpService(properties.getRpcUrl(), httpClient);
    }

    @Bean
    public SolanaRpcClient web3jSolanaRpcClient(Web3jService web3jService) {
        return new Web3jSolanaRpcClient(web3jService);
    }
}
