package xzy.fz.agent;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.backend.DirectConnector;
import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.broker.TunnelRequest;
import xzy.fz.agent.broker.TunnelResult;
import xzy.fz.agent.broker.UnsupportedProxyProtocolException;
import xzy.fz.agent.cache.BoundedCache;
import xzy.fz.agent.cache.RemovalCause;
import xzy.fz.agent.config.AgentConfig;
import xzy.fz.agent.proxy.EnvironmentProxyResolver;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyResolver;
import xzy.fz.agent.proxy.ProxyScheme;
import xzy.fz.agent.tunnel.HeaderProvider;
import xzy.fz.agent.tunnel.TunnelProvider;

import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point: asks a {@link ProxyResolver} which proxy serves a destination and delegates to the
 * matching tunnel.
 * <p>
 * Per request:
 * <ol>
 *   <li>Build the destination URL {@code protocol://host[:port]path}, with {@code ws}/{@code wss}
 *   for WebSocket upgrades</li>
 *   <li>Resolve the proxy URL, consulting the resolution cache first (empty answers are not cached)</li>
 *   <li>No proxy: delegate to the plain or secure {@link DirectConnector}</li>
 *   <li>Otherwise: look up or create the tunnel for {@code protocol+proxyUrl} and delegate to it</li>
 * </ol>
 * Tunnels are kept in a least-recently-used cache; evicted tunnels are destroyed. Tunnel classes are
 * found through {@link TunnelProvider} service registrations.
 */
public class ProxyDispatcher extends ConnectionBroker {
    private static final Logger log = LoggerFactory.getLogger(ProxyDispatcher.class);

    private final ProxyResolver resolver;
    private final HeaderProvider headers;
    private final Iterable<TunnelProvider> providerSource;
    private final BoundedCache<String, String> proxyResolutions;
    private final BoundedCache<String, ConnectionBroker> tunnels;
    private final Map<String, TunnelProvider> providers = new ConcurrentHashMap<>();
    private final DirectConnector plainConnector;
    private final DirectConnector secureConnector;

    private ProxyDispatcher(Builder builder, TunnelContext context) {
        super(context);
        this.resolver = builder.resolver != null ? builder.resolver : new EnvironmentProxyResolver();
        this.headers = builder.headers != null ? builder.headers : HeaderProvider.NONE;
        this.providerSource = builder.providers != null
                ? builder.providers
                : ServiceLoader.load(TunnelProvider.class, ProxyDispatcher.class.getClassLoader());
        AgentConfig config = context.config();
        this.proxyResolutions = BoundedCache.<String, String>builder(config.proxyCacheMaxSize())
                .ttl(config.proxyCacheTtl())
                .build();
        this.tunnels = BoundedCache.<String, ConnectionBroker>builder(config.agentCacheMaxSize())
                .accessOrder(true)
                .removalListener(ProxyDispatcher::onTunnelRemoved)
                .build();
        this.plainConnector = new DirectConnector(context, "direct");
        this.secureConnector = new DirectConnector(context, "direct-tls");
        this.secureConnector.setDefaultSecure(true);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    protected void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise) {
        boolean webSocket = isWebSocketUpgrade(request.httpRequest());
        String protocol = webSocket ? (secure ? "wss" : "ws") : (secure ? "https" : "http");
        String url = destinationUrl(protocol, request);

        String cached = proxyResolutions.get(url);
        if (cached != null) {
            route(request, secure, webSocket, protocol, cached, promise);
            return;
        }
        resolver.resolve(url, request, context.executor().newPromise()).addListener((Future<String> f) -> {
            if (!f.isSuccess()) {
                promise.tryFailure(f.cause());
                return;
            }
            String proxyUrl = f.getNow();
            if (proxyUrl != null && !proxyUrl.isBlank()) {
                proxyResolutions.put(url, proxyUrl);
            }
            route(request, secure, webSocket, protocol, proxyUrl, promise);
        });
    }

    private void route(TunnelRequest request, boolean secure, boolean webSocket, String protocol, String proxyUrl,
                       Promise<TunnelResult> promise) {
        if (proxyUrl == null || proxyUrl.isBlank()) {
            log.debug("No proxy for {}:{}, connecting directly", request.host(), request.port());
            TunnelRequest direct = request.toBuilder().secureEndpoint(secure).build();
            promise.trySuccess(TunnelResult.delegated(secure ? secureConnector : plainConnector, direct));
            return;
        }
        ConnectionBroker tunnel;
        try {
            tunnel = tunnels.computeIfAbsent(protocol + "+" + proxyUrl.trim(),
                    key -> newTunnel(proxyUrl.trim(), secure || webSocket));
        } catch (RuntimeException e) {
            promise.tryFailure(e);
            return;
        }
        TunnelRequest forwarded = request.toBuilder().secureEndpoint(secure).build();
        promise.trySuccess(TunnelResult.delegated(tunnel, forwarded));
    }

    private ConnectionBroker newTunnel(String proxyUrl, boolean secureOrWebSocket) {
        ProxyDescriptor proxy = ProxyDescriptor.parse(proxyUrl);
        TunnelProvider provider = providers.computeIfAbsent(
                proxy.scheme().scheme() + ":" + (secureOrWebSocket ? 1 : 0),
                key -> findProvider(proxy.scheme()));
        ConnectionBroker tunnel = provider.create(proxy, secureOrWebSocket, context, headers);
        log.debug("Created {} for {}", tunnel.getClass().getSimpleName(), proxy);
        return tunnel;
    }

    private TunnelProvider findProvider(ProxyScheme scheme) {
        for (TunnelProvider provider : providerSource) {
            if (provider.supports(scheme)) {
                return provider;
            }
        }
        throw new UnsupportedProxyProtocolException(scheme.scheme());
    }

    private static void onTunnelRemoved(String key, ConnectionBroker tunnel, RemovalCause cause) {
        log.debug("Tunnel {} left the cache ({})", key, cause);
        tunnel.destroy();
    }

    /** {@code protocol://host[:port]path}; the port is left out when it is the protocol's default. */
    static String destinationUrl(String protocol, TunnelRequest request) {
        HttpRequest http = request.httpRequest();
        String path = http == null ? "/" : http.uri();
        if (!path.startsWith("/") && path.contains("://")) {
            return path;
        }
        if (path.isEmpty() || path.charAt(0) != '/') {
            path = "/" + path;
        }
        String authority = http == null ? null : http.headers().get(HttpHeaderNames.HOST);
        if (authority == null || authority.isBlank()) {
            boolean defaultPort = request.port() == ("https".equals(protocol) || "wss".equals(protocol) ? 443 : 80);
            authority = ProxyDescriptor.bracketed(request.host()) + (defaultPort ? "" : ":" + request.port());
        }
        return protocol + "://" + authority + path;
    }

    static boolean isWebSocketUpgrade(HttpRequest http) {
        return http != null && http.headers().containsValue(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true);
    }

    /** The cached tunnel for {@code protocol} and {@code proxyUrl}, or {@code null}. */
    public ConnectionBroker cachedTunnel(String protocol, String proxyUrl) {
        return tunnels.get(protocol + "+" + proxyUrl);
    }

    public int cachedTunnelCount() {
        return tunnels.size();
    }

    public int cachedResolutionCount() {
        return proxyResolutions.size();
    }

    @Override
    protected void onDestroy() {
        tunnels.clear();
        proxyResolutions.clear();
        providers.clear();
        plainConnector.destroy();
        secureConnector.destroy();
        context.close();
    }

    public static final class Builder {
        private AgentConfig config;
        private TunnelContext context;
        private ProxyResolver resolver;
        private HeaderProvider headers;
        private Iterable<TunnelProvider> providers;

        private Builder() {
        }

        /** Settings for a context the dispatcher creates and closes itself. */
        public Builder config(AgentConfig config) {
            this.config = config;
            return this;
        }

        /** Shared context; the dispatcher closes it on {@link #destroy()}. */
        public Builder context(TunnelContext context) {
            this.context = context;
            return this;
        }

        public Builder resolver(ProxyResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder headers(HeaderProvider headers) {
            this.headers = headers;
            return this;
        }

        /** Tunnel providers to use instead of the {@code ServiceLoader} registrations. */
        public Builder providers(Iterable<TunnelProvider> providers) {
            this.providers = providers;
            return this;
        }

        public ProxyDispatcher build() {
            if (context != null) {
                return new ProxyDispatcher(this, context);
            }
            return new ProxyDispatcher(this, TunnelContext.create(config != null ? config : AgentConfig.defaults()));
        }
    }
}
