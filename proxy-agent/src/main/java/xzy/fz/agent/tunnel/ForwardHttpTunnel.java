package xzy.fz.agent.tunnel;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.CompositeByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpRequestEncoder;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.backend.DirectConnector;
import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.InvalidRequestException;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.broker.TunnelRequest;
import xzy.fz.agent.broker.TunnelResult;
import xzy.fz.agent.cache.BoundedCache;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyScheme;

import java.util.Map;

/**
 * Sends plain HTTP requests to a forward proxy: the request line gets an absolute URI, proxy headers
 * are merged in, and the connection itself is the proxy connection.
 * <p>
 * The request head is rewritten in place. If the caller already serialized it into
 * {@link TunnelRequest#pendingOutput()}, the head is re-encoded and the body bytes that followed the
 * old head are kept. The attempt is then delegated to this tunnel's {@link DirectConnector}, aimed at
 * the proxy.
 */
public class ForwardHttpTunnel extends ConnectionBroker {
    private static final Logger log = LoggerFactory.getLogger(ForwardHttpTunnel.class);

    private final ProxyDescriptor proxy;
    private final HeaderProvider headerProvider;
    private final DirectConnector proxyConnector;
    private final BoundedCache<String, String> absoluteUris;

    public ForwardHttpTunnel(ProxyDescriptor proxy, TunnelContext context, HeaderProvider headerProvider) {
        super(context);
        this.proxy = proxy;
        this.headerProvider = headerProvider == null ? HeaderProvider.NONE : headerProvider;
        this.proxyConnector = new DirectConnector(context, "forward");
        this.absoluteUris = BoundedCache.<String, String>builder(context.config().urlCacheMaxSize())
                .accessOrder(true)
                .build();
    }

    public ProxyDescriptor proxy() {
        return proxy;
    }

    @Override
    protected void validate(TunnelRequest request) {
        super.validate(request);
        if (request.httpRequest() == null) {
            throw new InvalidRequestException("Forward proxying needs the outbound request head");
        }
    }

    @Override
    protected void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise) {
        HttpRequest http = request.httpRequest();
        String uri = http.uri();
        if (!isAbsolute(uri)) {
            String protocol = secure ? "https" : "http";
            String hostHeader = http.headers().get(HttpHeaderNames.HOST);
            String host = hostHeader != null ? stripPort(hostHeader) : ProxyDescriptor.bracketed(request.host());
            http.setUri(absoluteUri(protocol, host, uri, request.port()));
        }
        mergeProxyHeaders(http.headers());

        ByteBuf pending = request.pendingOutput();
        if (pending != null && pending.isReadable()) {
            request.replacePendingOutput(reencode(http, pending));
        }
        log.debug("Forwarding {} {} through {}", http.method(), http.uri(), proxy);

        TunnelRequest toProxy = TunnelRequest.builder(proxy.host(), proxy.port())
                .secureEndpoint(proxy.scheme() == ProxyScheme.HTTPS)
                .httpRequest(http)
                .pendingOutput(request.pendingOutput())
                .build();
        promise.trySuccess(TunnelResult.delegated(proxyConnector, toProxy));
    }

    /**
     * {@code protocol://host[:port]path}, the port omitted when it is the protocol's default.
     * Memoized per protocol, host, path and port.
     */
    String absoluteUri(String protocol, String host, String path, int port) {
        String key = protocol + "|" + host + "|" + path + "|" + port;
        return absoluteUris.computeIfAbsent(key, k -> {
            int defaultPort = "https".equals(protocol) ? 443 : 80;
            String normalizedPath = path.isEmpty() || path.charAt(0) != '/' ? "/" + path : path;
            return protocol + "://" + host + (port == defaultPort ? "" : ":" + port) + normalizedPath;
        });
    }

    /** Adds the proxy's default headers without replacing anything the caller set. */
    void mergeProxyHeaders(HttpHeaders headers) {
        if (proxy.hasCredentials() && !headers.contains(HttpHeaderNames.PROXY_AUTHORIZATION)) {
            headers.set(HttpHeaderNames.PROXY_AUTHORIZATION, proxy.basicAuthorization());
        }
        if (!headers.contains(ConnectTunnel.PROXY_CONNECTION)) {
            headers.set(ConnectTunnel.PROXY_CONNECTION, context.config().proxyConnectionHeader());
        }
        for (Map.Entry<String, String> extra : headerProvider.headers()) {
            if (!headers.contains(extra.getKey())) {
                headers.set(extra.getKey(), extra.getValue());
            }
        }
    }

    /**
     * Encodes the rewritten head with {@link HttpRequestEncoder} and appends whatever followed the old
     * head in {@code pending}. Takes ownership of {@code pending}.
     */
    static ByteBuf reencode(HttpRequest http, ByteBuf pending) {
        int headEnd = headEnd(pending);
        ByteBuf body = headEnd < 0
                ? Unpooled.EMPTY_BUFFER
                : pending.retainedSlice(pending.readerIndex() + headEnd, pending.readableBytes() - headEnd);
        pending.release();

        EmbeddedChannel encoder = new EmbeddedChannel(new HttpRequestEncoder());
        CompositeByteBuf out = Unpooled.compositeBuffer();
        try {
            encoder.writeOutbound(new DefaultHttpRequest(http.protocolVersion(), http.method(), http.uri(),
                    http.headers()));
            ByteBuf part;
            while ((part = encoder.readOutbound()) != null) {
                out.addComponent(true, part);
            }
        } finally {
            encoder.finishAndReleaseAll();
        }
        out.addComponent(true, body);
        return out;
    }

    private static int headEnd(ByteBuf buf) {
        int start = buf.readerIndex();
        for (int i = start; i <= buf.writerIndex() - 4; i++) {
            if (buf.getByte(i) == '\r' && buf.getByte(i + 1) == '\n'
                    && buf.getByte(i + 2) == '\r' && buf.getByte(i + 3) == '\n') {
                return i - start + 4;
            }
        }
        return -1;
    }

    private static boolean isAbsolute(String uri) {
        int scheme = uri.indexOf("://");
        return scheme > 0 && uri.indexOf('/') > scheme;
    }

    private static String stripPort(String hostHeader) {
        if (hostHeader.startsWith("[")) {
            int close = hostHeader.indexOf(']');
            return close > 0 ? hostHeader.substring(0, close + 1) : hostHeader;
        }
        int colon = hostHeader.indexOf(':');
        return colon >= 0 ? hostHeader.substring(0, colon) : hostHeader;
    }

    @Override
    protected void onDestroy() {
        proxyConnector.destroy();
        absoluteUris.clear();
    }

    @Override
    public String toString() {
        return "ForwardHttpTunnel{" + proxy + "}";
    }
}
