package com.work.confirm.core.channel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 端点改写表：按顺序匹配 (hostname 模式 -> 改写规则)，未命中时退化为通用的 scheme 替换。
 *
 * 新增节点服务商只需要追加一条规则（配置项 confirm.push.endpoint-rules），无需改代码。
 * 配置规则优先于内置规则。
 */
public class ChannelEndpointResolver {

    private static final Logger log = LoggerFactory.getLogger(ChannelEndpointResolver.class);

    private final List<EndpointRewriteRule> rules;

    public ChannelEndpointResolver(List<EndpointRewriteRule> configuredRules) {
        List<EndpointRewriteRule> all = new ArrayList<>();
        if (configuredRules != null) {
            all.addAll(configuredRules);
        }
        all.addAll(builtinRules());
        this.rules = Collections.unmodifiableList(all);
    }

    public static ChannelEndpointResolver withBuiltinRules() {
        return new ChannelEndpointResolver(Collections.emptyList());
    }

    public static List<EndpointRewriteRule> builtinRules() {
        return Arrays.asList(
                // solana-test-validator: RPC 8899，pubsub 8900
                new EndpointRewriteRule("local-validator", "localhost|127\\.0\\.0\\.1", null, 1, null, null),
                EndpointRewriteRule.secureHost("solana-public", "api\\.(mainnet-beta|mainnet|devnet|testnet)\\.solana\\.com"),
                EndpointRewriteRule.secureHost("helius", "([a-z0-9-]+\\.)*helius-rpc\\.com"),
                EndpointRewriteRule.secureHost("quicknode", "([a-z0-9-]+\\.)+quiknode\\.pro"),
                EndpointRewriteRule.secureHost("alchemy", "([a-z0-9-]+\\.)+g\\.alchemy\\.com"),
                EndpointRewriteRule.secureHost("triton", "([a-z0-9-]+\\.)+rpcpool\\.com"),
                new EndpointRewriteRule("ankr", "rpc\\.ankr\\.com", Boolean.TRUE, 0, "^/solana(/.*)?$", "/solana/ws$1")
        );
    }

    /**
     * 推导 push 订阅端点。
     *
     * @param rpcUrl 节点的 HTTP(S) 查询端点；已经是 ws/wss 时原样返回
     * @return empty 表示该端点不支持 push（无法解析或非 http/ws 协议）
     */
    public Optional<URI> resolve(String rpcUrl) {
        if (rpcUrl == null || rpcUrl.trim().isEmpty()) {
            return Optional.empty();
        }
        URI uri;
        try {
            uri = new URI(rpcUrl.trim());
        } catch (URISyntaxException e) {
            log.warn("Unparseable rpc url, push channel disabled. url={} err={}", rpcUrl, e.getMessage());
            return Optional.empty();
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if ("ws".equals(scheme) || "wss".equals(scheme)) {
            return Optional.of(uri);
        }
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            log.warn("Unsupported rpc url scheme, push channel disabled. url={}", rpcUrl);
            return Optional.empty();
        }
        if (uri.getHost() == null) {
            log.warn("Rpc url has no host, push channel disabled. url={}", rpcUrl);
            return Optional.empty();
        }

        try {
            for (EndpointRewriteRule rule : rules) {
                if (rule.matches(uri)) {
                    URI ws = rule.rewrite(uri);
                    log.debug("Push endpoint resolved. rule={} ws={}", rule.getName(), ws.getHost());
                    return Optional.of(ws);
                }
            }
            log.warn("Unknown rpc provider, using generic scheme swap for push endpoint. host={}", uri.getHost());
            return Optional.of(genericSwap(uri));
        } catch (URISyntaxException e) {
            log.warn("Push endpoint rewrite failed. url={} err={}", rpcUrl, e.getMessage());
            return Optional.empty();
        }
    }

    List<EndpointRewriteRule> getRules() {
        return rules;
    }

    private static URI genericSwap(URI uri) throws URISyntaxException {
        return new EndpointRewriteRule("generic", ".*", null, 0, null, null).rewrite(uri);
    }
}
