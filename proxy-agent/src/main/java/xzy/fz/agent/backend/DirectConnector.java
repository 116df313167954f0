package xzy.fz.agent.backend;

import io.netty.channel.*;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.broker.ConnectFailedException;
import xzy.fz.agent.broker.ConnectFailedException.Reason;
import xzy.fz.agent.broker.ConnectionBroker;
import xzy.fz.agent.broker.TunnelContext;
import xzy.fz.agent.broker.TunnelRequest;
import xzy.fz.agent.broker.TunnelResult;

/**
 * Opens plain or TLS connections straight to the requested host, reusing idle channels released by
 * earlier users. This is the connection used when no proxy applies, and the one a forward-proxy
 * tunnel hands its rewritten request to.
 */
public final class DirectConnector extends ConnectionBroker {
    private static final Logger log = LoggerFactory.getLogger(DirectConnector.class);

    private final String poolPrefix;

    public DirectConnector(TunnelContext context) {
        this(context, "direct");
    }

    /**
     * @param poolPrefix Prefix of idle-pool keys, so connectors owned by different tunnels never share
     *                   channels
     */
    public DirectConnector(TunnelContext context, String poolPrefix) {
        super(context);
        this.poolPrefix = poolPrefix;
    }

    @Override
    protected void establish(TunnelRequest request, boolean secure, Promise<TunnelResult> promise) {
        String host = request.host();
        int port = request.port();
        String key = poolKey(request);
        IdleChannelPool pool = context.idleChannels();

        IdleChannelPool.Lease reused = pool.acquire(key, secure);
        if (reused != null) {
            complete(promise, TunnelResult.pooled(reused));
            return;
        }

        ChannelFuture connectFuture = context.newBootstrap()
                .handler(new ChannelInitializer<>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        context.addWireLogging(ch.pipeline());
                    }
                })
                .connect(host, port);
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
                        "Unable to connect to " + host + ":" + port, future.cause()));
                return;
            }
            IdleChannelPool.Lease lease = pool.track(key, channel, secure);
            if (!secure) {
                log.debug("Connected to {}:{}", host, port);
                complete(promise, lease != null ? TunnelResult.pooled(lease) : TunnelResult.established(channel));
                return;
            }
            context.tls().upgrade(channel, host, port, request.serverName()).addListener((Future<Channel> hs) -> {
                if (hs.isSuccess()) {
                    log.debug("Connected to {}:{} over TLS", host, port);
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
                            "TLS handshake with " + host + ":" + port + " failed", hs.cause()));
                }
            });
        });
    }

    String poolKey(TunnelRequest request) {
        String key = poolPrefix + ":" + request.host() + ":" + request.port();
        return request.serverName() == null ? key : key + ":" + request.serverName();
    }
}
