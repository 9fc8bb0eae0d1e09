package com.warp.bridge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 代理选择：本机、回环地址、docker 宿主机以及 NO_PROXY 中的主机直连，其余走配置的代理
 * <p>
 * NO_PROXY 规则：完全匹配、子域名匹配（example.com 匹配 api.example.com）、
 * 以点开头的后缀匹配，以及通配 *
 */
public class LocalBypassProxySelector extends ProxySelector {

    private static final Logger log = LoggerFactory.getLogger(LocalBypassProxySelector.class);

    private static final List<String> LOCAL_HOSTS = List.of(
            "localhost", "0.0.0.0", "host.docker.internal", "::1");

    private final List<Proxy> proxied;
    private final List<String> noProxy = new ArrayList<>();

    public LocalBypassProxySelector(InetSocketAddress proxyAddress, String noProxyList) {
        this.proxied = List.of(new Proxy(Proxy.Type.HTTP, proxyAddress));
        if (noProxyList != null) {
            for (String entry : noProxyList.split(",")) {
                String pattern = entry.trim().toLowerCase(Locale.ROOT);
                if (!pattern.isEmpty()) {
                    noProxy.add(pattern);
                }
            }
        }
    }

    @Override
    public List<Proxy> select(URI uri) {
        if (uri == null) {
            throw new IllegalArgumentException("uri 不能为空");
        }
        return bypass(uri.getHost()) ? List.of(Proxy.NO_PROXY) : proxied;
    }

    @Override
    public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
        log.warn("代理连接失败: uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
    }

    boolean bypass(String rawHost) {
        if (rawHost == null || rawHost.isEmpty()) {
            return false;
        }
        String host = rawHost.toLowerCase(Locale.ROOT);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (LOCAL_HOSTS.contains(host) || host.startsWith("127.")) {
            return true;
        }
        for (String pattern : noProxy) {
            if (pattern.equals("*") || host.equals(pattern)) {
                return true;
            }
            if (pattern.startsWith(".") ? host.endsWith(pattern) : host.endsWith("." + pattern)) {
                return true;
            }
        }
        return false;
    }
}
