package xzy.fz.agent.tunnel;

import io.netty.channel.*;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.ImmediateEventExecutor;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.broker.ConnectFailedException;
import xzy.fz.agent.broker.ConnectFailedException.Reason;
import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.broker.TunnelRequest;
import xzy.fz.agent.broker.TunnelResult;
import xzy.fz.agent.cache.BoundedCache;
import xzy.fz.agent.handler.BufferedReplayHandler;
import xzy.fz.agent.handler.upstream.ConnectHandshakeHandler;
import xzy.fz.agent.handler.upstream.ConnectReply;
import xzy.fz.agent.handler.upstream.ProxyResponse;
import xzy.fz.agent.proxy.ProxyDescriptor;
import xzy.fz.agent.proxy.ProxyScheme;

/**
 * Tunnels through an HTTP(S) proxy with {@code CONNECT host:port}.
 * <p>
 * Per attempt:
 * <ol>
 *   <li>Connect to the proxy, negotiating TLS first for {@code https://} proxies (ALPN {@code http/1.1})</li>
 *   <li>Send the CONNECT head via {@link ConnectHandshakeHandler} and wait, at most
 *   {@code connect.timeoutMillis}, for the response head</li>
 *   <li>On {@code 200}: keep any bytes that followed the head for the caller's first read, then
 *   negotiate TLS with the destination when it is secure</li>
 *   <li>Otherwise: close the proxy channel and hand back a read-only replay of everything the proxy
 *   sent, so the caller can read e.g. a {@code 407} without anything reaching the destination</li>
 * </ol>
 */
public class ConnectTunnel extends ConnectionBroker {
    private static final Logger log = LoggerFactory.getLogger(ConnectTunnel.class);

    static final String PROXY_TLS = "proxy-tls";

    static final String PROXY_CONNECTION = "Proxy-Connection";

    private final ProxyDescriptor proxy;
    private final HeaderProvider headerProvider;
    private final BoundedCache<String, HttpHeaders> headerCache;
    private final String proxyKey;

    public ConnectTunnel(ProxyDescriptor proxy, TunnelContext context, HeaderProvider headerProvider) {
        super(context);
        this.proxy = proxy;
        this.headerProvider = headerProvider == null ? HeaderProvider.NONE : headerProvider;
        this.headerCache = BoundedCache.<String, HttpHeaders>builder(context.config().headerCacheMaxSize())
                .accessOrder(true)
                .build();
        this.proxyKey = proxy.scheme().scheme() + "://" + proxy.hostAndPort();
    }

    public ProxyDescriptor proxy() {
        return proxy;
    }

    @Override
    protected void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise) {
        String authority = ProxyDescriptor.bracketed(request.host()) + ":" + request.port();
        HttpHeaders headers = connectHeaders(request.host(), request.port());
        Promise<ConnectReply> reply = ImmediateEventExecutor.INSTANCE.newPromise();
        int maxHeadBytes = context.config().maxResponseHeadBytes();
        long responseTimeoutMillis = context.config().connectTimeout().toMillis();

        ChannelFuture connectFuture = context.newBootstrap()
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ChannelPipeline pipeline = ch.pipeline();
                        if (proxy.scheme() == ProxyScheme.HTTPS) {
                            pipeline.addLast(PROXY_TLS, context.tls().newProxyHandler(ch, proxy.host(), proxy.port()));
                        }
                        pipeline.addLast(ConnectHandshakeHandler.NAME,
                                new ConnectHandshakeHandler(authority, headers, maxHeadBytes,
                                        responseTimeoutMillis, reply));
                    }
                })
                .connect(proxy.host(), proxy.port());
        Channel channel = connectFuture.channel();
        track(channel);

        promise.addListener(f -> {
            if (!f.isSuccess()) {
                reply.tryFailure(f.cause());
                channel.close();
            }
        });
        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reply.tryFailure(new ConnectFailedException(Reason.CONNECT,
                        "Unable to connect to proxy " + proxy, future.cause()));
            }
        });

        reply.addListener((Future<ConnectReply> f) -> {
            if (!f.isSuccess()) {
                channel.close();
                promise.tryFailure(f.cause());
                return;
            }
            ConnectReply connectReply = f.getNow();
            if (promise.isDone()) {
                connectReply.release();
                return;
            }
            if (connectReply.response().isTunnelEstablished()) {
                onEstablished(channel, connectReply, request, secure, authority, promise);
            } else {
                onRejected(channel, connectReply, authority, promise);
            }
        });
    }

    private void onEstablished(Channel channel, ConnectReply reply, TunnelRequest request, boolean secure,
                               String authority, Promise<TunnelResult> promise) {
        ProxyResponse response = reply.response();
        ChannelPipeline pipeline = channel.pipeline();
        try {
            if (reply.hasTrailer()) {
                pipeline.replace(ConnectHandshakeHandler.NAME, BufferedReplayHandler.NAME,
                        new BufferedReplayHandler(reply.retainedTrailer(), false));
            } else {
                pipeline.remove(ConnectHandshakeHandler.NAME);
            }
        } finally {
            reply.release();
        }
        context.addWireLogging(pipeline);
        log.info("CONNECT tunnel to {} established through {}", authority, proxy);

        if (!secure) {
            complete(promise, TunnelResult.established(channel, response));
            return;
        }
        context.tls().upgrade(channel, request.host(), request.port(), request.serverName())
                .addListener((Future<Channel> hs) -> {
                    if (hs.isSuccess()) {
                        complete(promise, TunnelResult.established(channel, response));
                    } else {
                        channel.close();
                        promise.tryFailure(new ConnectFailedException(Reason.TLS,
                                "TLS handshake with " + authority + " through " + proxy + " failed", hs.cause()));
                    }
                });
    }

    private void onRejected(Channel channel, ConnectReply reply, String authority, Promise<TunnelResult> promise) {
        ProxyResponse response = reply.response();
        log.warn("Proxy {} refused CONNECT {}: {} {}", proxy, authority, response.statusCode(),
                response.reasonPhrase());
        // the proxy socket is gone before the result completes
        channel.close().addListener(f -> {
            Channel replay;
            try {
                replay = BufferedReplayHandler.replayChannel(reply.buffered());
            } catch (IllegalStateException e) {
                promise.tryFailure(e);
                return;
            }
            complete(promise, TunnelResult.rejected(replay, response));
        });
    }

    /**
     * Request headers for {@code CONNECT host:port}. Fixed header sets are memoized per proxy and
     * destination.
     */
    HttpHeaders connectHeaders(String host, int port) {
        if (!headerProvider.isStatic()) {
            return buildHeaders(host, port, headerProvider.headers());
        }
        return headerCache.computeIfAbsent(proxyKey + ":" + host + ":" + port,
                key -> buildHeaders(host, port, headerProvider.headers()));
    }

    private HttpHeaders buildHeaders(String host, int port, HttpHeaders provided) {
        HttpHeaders headers = new DefaultHttpHeaders();
        headers.add(provided);
        if (proxy.hasCredentials()) {
            headers.set(HttpHeaderNames.PROXY_AUTHORIZATION, proxy.basicAuthorization());
        }
        headers.set(HttpHeaderNames.HOST, ProxyDescriptor.bracketed(host) + ":" + port);
        if (!headers.contains(PROXY_CONNECTION)) {
            headers.set(PROXY_CONNECTION, context.config().proxyConnectionHeader());
        }
        return headers;
    }

    int cachedHeaderSets() {
        return headerCache.size();
    }

    @Override
    protected void onDestroy() {
        headerCache.clear();
    }

    @Override
    public String toString() {
        return "ConnectTunnel{" + proxy + "}";
    }
}
