package fun.fengwk.bmh.core.configuration;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.util.List;
import java.util.Locale;

/**
 * Proxy configuration for the api HttpClient.
 *
 * @author fengwk
 */
@Slf4j
@Data
@Component
@ConfigurationProperties(prefix = "bmh.http.proxy")
public class HttpClientProxyProperties {

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpProxy;

    /**
     * HTTPS proxy in URL form, e.g. http://host:port or host:port.
     */
    private String httpsProxy;

    @PostConstruct
    public void init() {
        logProxy("http", httpProxy);
        logProxy("https", httpsProxy);
    }

    /**
     * Selector routing http and https requests through the configured proxies, each scheme falling back to the
     * other scheme's proxy and then to a direct connection.
     */
    public ProxySelector proxySelector() {
        Proxy http = parseProxy(httpProxy);
        Proxy https = parseProxy(httpsProxy);
        return new SchemeProxySelector(http != null ? http : https, https != null ? https : http);
    }

    private void logProxy(String scheme, String proxyStr) {
        Proxy proxy = parseProxy(proxyStr);
        if (proxy != null) {
            log.info("{} proxy configured: {}", scheme, proxyStr);
        }
    }

    /**
     * @return parsed proxy or {@code null} when blank
     * @throws IllegalArgumentException when the value is not a host:port or http url
     */
    static Proxy parseProxy(String proxyStr) {
        if (!StringUtils.hasText(proxyStr)) {
            return null;
        }
        String value = proxyStr.trim();
        try {
            URI uri = new URI(value.contains("://") ? value : "http://" + value);
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            // java.net.http only tunnels through HTTP proxies.
            if (!"http".equals(scheme) && !"https".equals(scheme)) {
                throw new IllegalArgumentException("unsupported proxy scheme: " + scheme);
            }
            String host = uri.getHost();
            if (host == null) {
                throw new IllegalArgumentException("proxy host missing");
            }
            int port = uri.getPort() == -1 ? 80 : uri.getPort();
            return new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(host, port));
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

    static class SchemeProxySelector extends ProxySelector {

        private final Proxy httpProxy;
        private final Proxy httpsProxy;

        SchemeProxySelector(Proxy httpProxy, Proxy httpsProxy) {
            this.httpProxy = httpProxy;
            this.httpsProxy = httpsProxy;
        }

        @Override
        public List<Proxy> select(URI uri) {
            Proxy proxy = "https".equalsIgnoreCase(uri.getScheme()) ? httpsProxy : httpProxy;
            return List.of(proxy == null ? Proxy.NO_PROXY : proxy);
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("proxy connect failed, uri={}, proxy={}, error={}", uri, sa, ioe.getMessage());
        }

    }

}
