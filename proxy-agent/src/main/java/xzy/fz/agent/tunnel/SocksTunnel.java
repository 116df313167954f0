package xzy.fz.agent.tunnel;

import io.netty.channel.*;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.proxy.ProxyConnectException;
import io.netty.handler.proxy.ProxyHandler;
import io.netty.handler.proxy.Socks4ProxyHandler;
import io.netty.handler.proxy.Socks5ProxyHandler;
import io.netty.resolver.NoopAddressResolverGroup;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.backend.IdleChannelPool;
import xzy.fz.agent.broker.ConnectFailedException;
import xzy.fz.agent.broker.ConnectFailedException.Reason;
import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.broker.TunnelRequest;
import xzy.fz.agent.broker.TunnelResult;
import xzy.fz.agent.proxy.ProxyDescriptor;

import java.net.InetAddress;
import java.net.InetSocketAddress;

/**
 * Tunnels through a SOCKS4, SOCKS4a, SOCKS5 or SOCKS5h proxy.
 * <p>
 * {@code socks4://} and {@code socks5://} look the destination up locally (through the DNS cache)
 * and send an address; {@code socks://}, {@code socks4a://} and {@code socks5h://} send the hostname
 * and let the proxy resolve it. The byte-level handshake is Netty's {@link Socks4ProxyHandler} /
 * {@link Socks5ProxyHandler}.
 * <p>
 * With {@code socks.socketCache} on, established tunnels are pooled per proxy and destination and
 * handed out again after {@link TunnelResult#release()}.
 */
public class SocksTunnel extends ConnectionBroker {
    private static final Logger log = LoggerFactory.getLogger(SocksTunnel.class);

    static final String SOCKS_HANDLER = "socks";

    private final ProxyDescriptor proxy;
    private final boolean socketCache;

    public SocksTunnel(ProxyDescriptor proxy, TunnelContext context) {
        super(context);
        if (!proxy.scheme().isSocks()) {
            throw new IllegalArgumentException("Not a SOCKS proxy: " + proxy);
        }
        this.proxy = proxy;
        this.socketCache = context.config().socksSocketCache();
    }

    public ProxyDescriptor proxy() {
        return proxy;
    }

    @Override
    protected void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise) {
        String key = poolKey(request);
        if (socketCache) {
            IdleChannelPool.Lease reused = context.idleChannels().acquire(key, secure);
            if (reused != null) {
                complete(promise, TunnelResult.pooled(reused));
                return;
            }
        }

        destination(request).addListener((Future<InetSocketAddress> dest) -> {
            if (!dest.isSuccess()) {
                promise.tryFailure(new ConnectFailedException(Reason.DNS,
                        "Unable to resolve " + request.host(), dest.cause()));
                return;
            }
            context.dnsCache().resolve(proxy.host(), context.nameResolver(), context.executor())
                    .addListener((Future<InetAddress> proxyAddress) -> {
                        if (!proxyAddress.isSuccess()) {
                            promise.tryFailure(new ConnectFailedException(Reason.DNS,
                                    "Unable to resolve proxy " + proxy, proxyAddress.cause()));
                            return;
                        }
                        if (promise.isDone()) {
                            return;
                        }
                        open(new InetSocketAddress(proxyAddress.getNow(), proxy.port()), dest.getNow(),
                                request, secure, key, promise);
                    });
        });
    }

    /**
     * Destination handed to the proxy: unresolved when the proxy resolves names, otherwise looked up
     * here.
     */
    private Future<InetSocketAddress> destination(TunnelRequest request) {
        Promise<InetSocketAddress> destination = context.executor().newPromise();
        if (!proxy.scheme().clientResolves()) {
            return destination.setSuccess(InetSocketAddress.createUnresolved(request.host(), request.port()));
        }
        context.dnsCache().resolve(request.host(), context.nameResolver(), context.executor())
                .addListener((Future<InetAddress> f) -> {
                    if (f.isSuccess()) {
                        destination.trySuccess(new InetSocketAddress(f.getNow(), request.port()));
                    } else {
                        destination.tryFailure(f.cause());
                    }
                });
        return destination;
    }

    private void open(InetSocketAddress proxyAddress, InetSocketAddress destination, TunnelRequest request,
                      boolean secure, String key, Promise<TunnelResult> promise) {
        ProxyHandler socksHandler = newSocksHandler(proxyAddress);
        socksHandler.setConnectTimeoutMillis(context.config().connectTimeout().toMillis());

        ChannelFuture connectFuture = context.newBootstrap()
                .resolver(NoopAddressResolverGroup.INSTANCE)
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        ch.pipeline().addLast(SOCKS_HANDLER, socksHandler);
                    }
                })
                .connect(destination);
        Channel channel = connectFuture.channel();
        track(channel);
        promise.addListener(f -> {
            if (!f.isSuccess()) {
                channel.close();
            }
        });

        connectFuture.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                promise.tryFailure(new ConnectFailedException(Reason.CONNECT,
                        "Unable to connect to proxy " + proxy, future.cause()));
            }
        });
        socksHandler.connectFuture().addListener((Future<Channel> handshake) -> {
            if (!handshake.isSuccess()) {
                channel.close();
                promise.tryFailure(handshakeFailure(handshake.cause(), request));
                return;
            }
            context.addWireLogging(channel.pipeline());
            log.info("SOCKS{} tunnel to {}:{} established through {}", proxy.scheme().socksVersion(),
                    request.host(), request.port(), proxy);
            IdleChannelPool.Lease lease = socketCache ? context.idleChannels().track(key, channel, secure) : null;
            if (!secure) {
                complete(promise, lease != null ? TunnelResult.pooled(lease) : TunnelResult.established(channel));
                return;
            }
            context.tls().upgrade(channel, request.host(), request.port(), request.serverName())
                    .addListener((Future<Channel> hs) -> {
                        if (hs.isSuccess()) {
                            if (lease != null) {
                                lease.markBaseline();
                            }
                            complete(promise, lease != null ? TunnelResult.pooled(lease) : TunnelResult.established(channel));
                        } else {
                            if (lease != null) {
                                lease.discard();
                            }
                            channel.close();
                            promise.tryFailure(new ConnectFailedException(Reason.TLS,
                                    "TLS handshake with " + request.host() + ":" + request.port() + " failed",
                                    hs.cause()));
                        }
                    });
        });
    }

    private ProxyHandler newSocksHandler(InetSocketAddress proxyAddress) {
        if (proxy.scheme().socksVersion() == 4) {
            return new Socks4ProxyHandler(proxyAddress, proxy.username());
        }
        return new Socks5ProxyHandler(proxyAddress, proxy.username(), proxy.password());
    }

    /** Maps Netty's handshake failures onto connect failure reasons. */
    private ConnectFailedException handshakeFailure(Throwable cause, TunnelRequest request) {
        String target = request.host() + ":" + request.port();
        if (cause instanceof ProxyConnectException) {
            String message = String.valueOf(cause.getMessage());
            if (message.contains("timeout")) {
                return new ConnectFailedException(Reason.CONNECT,
                        "SOCKS handshake with " + proxy + " timed out", cause);
            }
            if (message.contains("status:") || message.contains("authStatus:")) {
                return new ConnectFailedException(Reason.PROXY_REJECTED,
                        "SOCKS proxy " + proxy + " refused " + target, cause);
            }
            if (message.contains("disconnected")) {
                return new ConnectFailedException(Reason.CONNECT,
                        "SOCKS proxy " + proxy + " closed the connection", cause);
            }
            return new ConnectFailedException(Reason.PROXY_PROTOCOL,
                    "Bad SOCKS handshake with " + proxy, cause);
        }
        if (cause instanceof DecoderException) {
            return new ConnectFailedException(Reason.PROXY_PROTOCOL, "Bad SOCKS reply from " + proxy, cause);
        }
        return new ConnectFailedException(Reason.CONNECT, "SOCKS connect to " + target + " failed", cause);
    }

    String poolKey(TunnelRequest request) {
        return proxy.host() + ":" + proxy.port() + ":" + request.host() + ":" + request.port();
    }

    @Override
    public String toString() {
        return "SocksTunnel{" + proxy + "}";
    }
}
