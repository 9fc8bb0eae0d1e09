package com.warp.bridge.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalBypassProxySelectorTest {

    private static final InetSocketAddress PROXY = InetSocketAddress.createUnresolved("proxy.internal", 3128);

    private final LocalBypassProxySelector selector =
            new LocalBypassProxySelector(PROXY, " corp.example , .lan,10.0.0.5");

    @Test
    void loopbackAndLocalHosts_connectDirectly() {
        assertDirect("http://127.0.0.1:28888/api/warp/send_stream_sse");
        assertDirect("http://127.0.0.2:8080/");
        assertDirect("http://localhost:28888/");
        assertDirect("http://LOCALHOST/");
        assertDirect("http://[::1]:28888/");
        assertDirect("http://host.docker.internal:28888/");
        assertDirect("http://0.0.0.0:28888/");
    }

    @Test
    void remoteHosts_useConfiguredProxy() {
        List<Proxy> proxies = selector.select(URI.create("https://app.warp.dev/graphql/v2"));

        assertEquals(1, proxies.size());
        assertEquals(Proxy.Type.HTTP, proxies.get(0).type());
        assertEquals(PROXY, proxies.get(0).address());
    }

    @Test
    void noProxyList_matchesExactSubdomainAndDotSuffix() {
        assertDirect("https://corp.example/");
        assertDirect("https://api.corp.example/");
        assertDirect("http://printer.lan/");
        assertDirect("http://10.0.0.5:9000/");

        assertProxied("https://notcorp.example/");
        assertProxied("http://10.0.0.50/");
    }

    @Test
    void wildcard_bypassesEverything() {
        LocalBypassProxySelector all = new LocalBypassProxySelector(PROXY, "*");

        assertEquals(List.of(Proxy.NO_PROXY), all.select(URI.create("https://app.warp.dev/")));
    }

    @Test
    void emptyNoProxy_onlyLocalHostsBypass() {
        LocalBypassProxySelector plain = new LocalBypassProxySelector(PROXY, "");

        assertEquals(List.of(Proxy.NO_PROXY), plain.select(URI.create("http://127.0.0.1:1/")));
        assertNotEquals(List.of(Proxy.NO_PROXY), plain.select(URI.create("https://corp.example/")));
    }

    private void assertDirect(String url) {
        assertEquals(List.of(Proxy.NO_PROXY), selector.select(URI.create(url)), url);
    }

    private void assertProxied(String url) {
        assertEquals(PROXY, selector.select(URI.create(url)).get(0).address(), url);
    }
}
