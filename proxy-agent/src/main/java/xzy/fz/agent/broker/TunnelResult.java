package xzy.fz.agent.broker;

import io.netty.channel.Channel;
import xzy.fz.agent.backend.IdleChannelPool;
import xzy.fz.agent.handler.upstream.ProxyResponse;

/**
 * Outcome of a connection attempt.
 *
 * <p>Channels are handed out with auto-read disabled; the caller installs its codec and then calls
 * {@code read()} or enables auto-read.
 */
public final class TunnelResult {

    public enum Kind {
        /** The channel speaks to the destination (TLS already negotiated when secure). */
        ESTABLISHED,
        /** The proxy refused the tunnel; the channel is a read-only replay of its answer. */
        REJECTED,
        /** Another broker continues the attempt. Never seen by callers of {@code connect}. */
        DELEGATED
    }

    private final Kind kind;
    private final Channel channel;
    private final ProxyResponse proxyResponse;
    private final IdleChannelPool.Lease lease;
    private final ConnectionBroker delegate;
    private final TunnelRequest delegatedRequest;

    private TunnelResult(Kind kind, Channel channel, ProxyResponse proxyResponse, IdleChannelPool.Lease lease,
                         ConnectionBroker delegate, TunnelRequest delegatedRequest) {
        this.kind = kind;
        this.channel = channel;
        this.proxyResponse = proxyResponse;
        this.lease = lease;
        this.delegate = delegate;
        this.delegatedRequest = delegatedRequest;
    }

    public static TunnelResult established(Channel channel) {
        return new TunnelResult(Kind.ESTABLISHED, channel, null, null, null, null);
    }

    public static TunnelResult established(Channel channel, ProxyResponse proxyResponse) {
        return new TunnelResult(Kind.ESTABLISHED, channel, proxyResponse, null, null, null);
    }

    public static TunnelResult pooled(IdleChannelPool.Lease lease) {
        return new TunnelResult(Kind.ESTABLISHED, lease.channel(), null, lease, null, null);
    }

    public static TunnelResult rejected(Channel replayChannel, ProxyResponse proxyResponse) {
        return new TunnelResult(Kind.REJECTED, replayChannel, proxyResponse, null, null, null);
    }

    public static TunnelResult delegated(ConnectionBroker delegate, TunnelRequest request) {
        return new TunnelResult(Kind.DELEGATED, null, null, null, delegate, request);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isEstablished() {
        return kind == Kind.ESTABLISHED;
    }

    public boolean isRejected() {
        return kind == Kind.REJECTED;
    }

    public Channel channel() {
        return channel;
    }

    /** The proxy's CONNECT answer, or {@code null} when the tunnel involved no CONNECT exchange. */
    public ProxyResponse proxyResponse() {
        return proxyResponse;
    }

    public boolean isPooled() {
        return lease != null;
    }

    ConnectionBroker delegate() {
        return delegate;
    }

    TunnelRequest delegatedRequest() {
        return delegatedRequest;
    }

    /**
     * Returns a pooled channel to the idle pool once the caller is done with it. Unpooled channels
     * are left untouched; the caller closes them.
     *
     * @return {@code true} if the channel went back to the pool
     */
    public boolean release() {
        if (lease == null) {
            return false;
        }
        return lease.release();
    }

    /** Closes the channel and drops any pool entry. */
    public void discard() {
        if (lease != null) {
            lease.discard();
        }
        if (channel != null) {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "TunnelResult{" + kind + (channel != null ? ", " + channel : "")
                + (proxyResponse != null ? ", " + proxyResponse.statusCode() : "") + "}";
    }
}
