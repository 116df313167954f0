package xzy.fz.agent.broker;

/**
 * A tunnel could not be established. Delivered as the failure of the future returned by
 * {@link ConnectionBroker#connect(TunnelRequest)}.
 */
public class ConnectFailedException extends RuntimeException {

    public enum Reason {
        /** TCP connect failed, timed out, or the proxy closed before answering. */
        CONNECT,
        /** TLS handshake with the proxy or the destination failed. */
        TLS,
        /** The proxy sent something that is not a valid handshake reply. */
        PROXY_PROTOCOL,
        /** A SOCKS proxy refused the connect command. */
        PROXY_REJECTED,
        /** Client-side hostname lookup failed. */
        DNS,
        /** The caller cancelled the attempt. */
        CANCELLED,
        /** The broker was destroyed. */
        CLOSED
    }

    private final Reason reason;

    public ConnectFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConnectFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
