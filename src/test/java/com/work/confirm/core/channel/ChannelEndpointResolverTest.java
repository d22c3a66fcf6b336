package com.work.confirm.core.channel;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ChannelEndpointResolverTest {

    private final ChannelEndpointResolver resolver = ChannelEndpointResolver.withBuiltinRules();

    private String resolve(String url) {
        return resolver.resolve(url).map(Object::toString).orElse(null);
    }

    @Test
    public void public_cluster_uses_secure_socket_on_same_host() {
        assertEquals("wss://api.mainnet-beta.solana.com", resolve("https://api.mainnet-beta.solana.com"));
        assertEquals("wss://api.devnet.solana.com/", resolve("https://api.devnet.solana.com/"));
    }

    @Test
    public void local_validator_uses_next_port() {
        assertEquals("ws://localhost:8900", resolve("http://localhost:8899"));
        assertEquals("ws://127.0.0.1:8900", resolve("http://127.0.0.1:8899"));
    }

    @Test
    public void provider_api_key_query_is_preserved() {
        assertEquals("wss://mainnet.helius-rpc.com/?api-key=abc123", resolve("https://mainnet.helius-rpc.com/?api-key=abc123"));
        assertEquals("wss://solemn-cool-dawn.solana-mainnet.quiknode.pro/token/",
                resolve("https://solemn-cool-dawn.solana-mainnet.quiknode.pro/token/"));
    }

    @Test
    public void ankr_gets_websocket_path() {
        assertEquals("wss://rpc.ankr.com/solana/ws/KEY", resolve("https://rpc.ankr.com/solana/KEY"));
        assertEquals("wss://rpc.ankr.com/solana/ws", resolve("https://rpc.ankr.com/solana"));
    }

    @Test
    public void websocket_url_is_returned_unchanged() {
        assertEquals("wss://ws.example.org/stream", resolve("wss://ws.example.org/stream"));
    }

    @Test
    public void unknown_host_falls_back_to_scheme_swap() {
        assertEquals("wss://rpc.example.org:8443/solana", resolve("https://rpc.example.org:8443/solana"));
        assertEquals("ws://rpc.internal/", resolve("http://rpc.internal/"));
    }

    @Test
    public void unsupported_or_broken_url_has_no_push_endpoint() {
        assertFalse(resolver.resolve("ftp://api.mainnet-beta.solana.com").isPresent());
        assertFalse(resolver.resolve("not a url").isPresent());
        assertFalse(resolver.resolve("").isPresent());
        assertFalse(resolver.resolve(null).isPresent());
    }

    @Test
    public void configured_rule_takes_precedence_over_builtin() {
        EndpointRewriteRule custom = new EndpointRewriteRule("internal-proxy", "api\\.mainnet-beta\\.solana\\.com",
                Boolean.FALSE, 0, "^$", "/pubsub");
        ChannelEndpointResolver r = new ChannelEndpointResolver(Collections.singletonList(custom));

        Optional<String> ws = r.resolve("https://api.mainnet-beta.solana.com").map(Object::toString);

        assertEquals("ws://api.mainnet-beta.solana.com/pubsub", ws.orElse(null));
        assertEquals("internal-proxy", r.getRules().get(0).getName());
    }
}
