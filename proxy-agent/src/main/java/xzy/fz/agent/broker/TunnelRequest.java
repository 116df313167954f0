package xzy.fz.agent.broker;

import io.netty.buffer.ByteBuf;
import io.netty.handler.codec.http.HttpRequest;

/**
 * One outbound connection request handed to {@link ConnectionBroker#connect(TunnelRequest)}.
 *
 * <p>Owned by the caller. The forward-proxy tunnel rewrites the {@link HttpRequest} in place and may
 * replace {@link #pendingOutput()} with a re-encoded copy.
 */
public final class TunnelRequest {

    private final String host;
    private final int port;
    private final Boolean secureEndpoint;
    private final String protocol;
    private final String serverName;
    private final HttpRequest httpRequest;
    private ByteBuf pendingOutput;

    private TunnelRequest(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.secureEndpoint = builder.secureEndpoint;
        this.protocol = builder.protocol;
        this.serverName = builder.serverName;
        this.httpRequest = builder.httpRequest;
        this.pendingOutput = builder.pendingOutput;
    }

    public static Builder builder(String host, int port) {
        return new Builder(host, port);
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    /** Explicit secure flag, or {@code null} when the broker should decide. */
    public Boolean secureEndpoint() {
        return secureEndpoint;
    }

    /** {@code http}, {@code https}, {@code ws} or {@code wss}; {@code null} when unknown. */
    public String protocol() {
        return protocol;
    }

    /** TLS server name override, or {@code null}. */
    public String serverName() {
        return serverName;
    }

    public HttpRequest httpRequest() {
        return httpRequest;
    }

    /** Request bytes the caller already serialized, or {@code null}. */
    public ByteBuf pendingOutput() {
        return pendingOutput;
    }

    public void replacePendingOutput(ByteBuf pendingOutput) {
        this.pendingOutput = pendingOutput;
    }

    public Builder toBuilder() {
        return new Builder(host, port)
                .secureEndpoint(secureEndpoint)
                .protocol(protocol)
                .serverName(serverName)
                .httpRequest(httpRequest)
                .pendingOutput(pendingOutput);
    }

    @Override
    public String toString() {
        return "TunnelRequest{" + (protocol == null ? "" : protocol + "://") + host + ":" + port + "}";
    }

    public static final class Builder {
        private final String host;
        private final int port;
        private Boolean secureEndpoint;
        private String protocol;
        private String serverName;
        private HttpRequest httpRequest;
        private ByteBuf pendingOutput;

        private Builder(String host, int port) {
            this.host = host;
            this.port = port;
        }

        public Builder secureEndpoint(Boolean secureEndpoint) {
            this.secureEndpoint = secureEndpoint;
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = protocol;
            return this;
        }

        public Builder serverName(String serverName) {
            this.serverName = serverName;
            return this;
        }

        public Builder httpRequest(HttpRequest httpRequest) {
            this.httpRequest = httpRequest;
            return this;
        }

        public Builder pendingOutput(ByteBuf pendingOutput) {
            this.pendingOutput = pendingOutput;
            return this;
        }

        public TunnelRequest build() {
            return new TunnelRequest(this);
        }
    }
}
