package com.work.confirm.core.channel;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.regex.Pattern;

import static com.work.confirm.core.support.ValidationUtils.requireNonEmpty;

/**
 * 一条 (hostname 模式 -> 改写方式) 规则：把节点的 HTTP(S) 查询端点改写为对应的 WebSocket 订阅端点。
 *
 * <ul>
 *     <li>secure：true 强制 wss；false 强制 ws；null 跟随原 scheme（https->wss, http->ws）</li>
 *     <li>portOffset：原 URL 显式带端口时加上该偏移（本地验证节点 8899 -> 8900）</li>
 *     <li>pathPattern/pathReplacement：可选的 path 正则替换</li>
 * </ul>
 * query 参数（API key）原样保留。
 */
public class EndpointRewriteRule {

    private final String name;
    private final Pattern hostPattern;
    private final Boolean secure;
    private final int portOffset;
    private final Pattern pathPattern;
    private final String pathReplacement;

    public EndpointRewriteRule(String name, String hostRegex, Boolean secure, int portOffset,
                               String pathRegex, String pathReplacement) {
        this.name = requireNonEmpty(name, "name");
        this.hostPattern = Pattern.compile(requireNonEmpty(hostRegex, "hostRegex"), Pattern.CASE_INSENSITIVE);
        this.secure = secure;
        this.portOffset = portOffset;
        this.pathPattern = (pathRegex == null || pathRegex.isEmpty()) ? null : Pattern.compile(pathRegex);
        this.pathReplacement = pathReplacement == null ? "" : pathReplacement;
    }

    public static EndpointRewriteRule secureHost(String name, String hostRegex) {
        return new EndpointRewriteRule(name, hostRegex, Boolean.TRUE, 0, null, null);
    }

    public String getName() {
        return name;
    }

    public boolean matches(URI httpUri) {
        String host = httpUri.getHost();
        return host != null && hostPattern.matcher(host).matches();
    }

    public URI rewrite(URI httpUri) throws URISyntaxException {
        String scheme;
        if (secure == null) {
            scheme = "https".equalsIgnoreCase(httpUri.getScheme()) ? "wss" : "ws";
        } else {
            scheme = secure ? "wss" : "ws";
        }
        int port = httpUri.getPort();
        if (port > 0 && portOffset != 0) {
            port = port + portOffset;
        }
        String path = httpUri.getRawPath();
        if (pathPattern != null) {
            path = pathPattern.matcher(path == null ? "" : path).replaceFirst(pathReplacement);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(httpUri.getRawAuthority() == null ? "" : hostAndUserInfo(httpUri));
        if (port > 0) {
            sb.append(':').append(port);
        }
        if (path != null) {
            sb.append(path);
        }
        if (httpUri.getRawQuery() != null) {
            sb.append('?').append(httpUri.getRawQuery());
        }
        return new URI(sb.toString());
    }

    private static String hostAndUserInfo(URI uri) {
        String userInfo = uri.getRawUserInfo();
        return userInfo == null ? uri.getHost() : userInfo + "@" + uri.getHost();
    }

    @Override
    public String toString() {
        return "EndpointRewriteRule{" + name + " host=" + hostPattern.pattern() + "}";
    }
}
