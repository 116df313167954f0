package xzy.fz.agent.tls;

import io.netty.channel.Channel;
import io.netty.handler.ssl.ApplicationProtocolConfig;
import io.netty.handler.ssl.ApplicationProtocolNames;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.cache.DnsCache;
import xzy.fz.agent.config.AgentConfig;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import java.util.List;

/**
 * Builds client {@link SslHandler}s for proxies and destinations and records negotiated sessions in
 * the {@link TlsSessionCache}.
 */
public final class TlsUpgrader {

    private static final Logger log = LoggerFactory.getLogger(TlsUpgrader.class);

    public static final String HANDLER_NAME = "tls";

    private final SslContext destinationContext;
    private final SslContext proxyContext;
    private final TlsSessionCache sessions;
    private final boolean insecure;
    private final long handshakeTimeoutMillis;

    public TlsUpgrader(SslContext destinationContext, SslContext proxyContext, TlsSessionCache sessions,
                       AgentConfig config) {
        this.destinationContext = destinationContext;
        this.proxyContext = proxyContext;
        this.sessions = sessions;
        this.insecure = config.tlsInsecure();
        this.handshakeTimeoutMillis = config.connectTimeout().toMillis();
    }

    public static TlsUpgrader create(AgentConfig config, TlsSessionCache sessions) {
        return new TlsUpgrader(buildSslContext(config, false), buildSslContext(config, true), sessions, config);
    }

    /**
     * Client context honouring {@code tls.insecure} and the session cache bounds. Proxy contexts
     * advertise ALPN {@code http/1.1}.
     */
    public static SslContext buildSslContext(AgentConfig config, boolean forProxy) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient()
                    .sessionCacheSize(config.tlsSessionMaxSize())
                    .sessionTimeout(Math.max(1L, config.tlsSessionTtl().toSeconds()));
            if (config.tlsInsecure()) {
                builder.trustManager(InsecureTrustManagerFactory.INSTANCE);
            }
            if (forProxy) {
                builder.applicationProtocolConfig(new ApplicationProtocolConfig(
                        ApplicationProtocolConfig.Protocol.ALPN,
                        ApplicationProtocolConfig.SelectorFailureBehavior.NO_ADVERTISE,
                        ApplicationProtocolConfig.SelectedListenerFailureBehavior.ACCEPT,
                        ApplicationProtocolNames.HTTP_1_1));
            }
            return builder.build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to create TLS context", e);
        }
    }

    /**
     * Handler for the TLS connection to an {@code https://} proxy. Session key
     * {@code https://host:port}.
     */
    public SslHandler newProxyHandler(Channel channel, String host, int port) {
        return newHandler(proxyContext, channel, host, port, null, "https://" + host + ":" + port);
    }

    /**
     * Appends a destination {@link SslHandler} to {@code channel} and requests the first read.
     * The returned future completes once the handshake finishes.
     *
     * @param serverName SNI override; by default the destination host is sent unless it is an IP literal
     */
    public Future<Channel> upgrade(Channel channel, String host, int port, String serverName) {
        SslHandler handler = newHandler(destinationContext, channel, host, port, serverName,
                "target:" + host + ":" + port);
        channel.pipeline().addLast(HANDLER_NAME, handler);
        channel.read();
        return handler.handshakeFuture();
    }

    private SslHandler newHandler(SslContext context, Channel channel, String host, int port, String serverName,
                                  String sessionKey) {
        SslHandler handler = context.newHandler(channel.alloc(), host, port);
        handler.setHandshakeTimeoutMillis(handshakeTimeoutMillis);
        SSLEngine engine = handler.engine();
        SSLParameters params = engine.getSSLParameters();
        if (serverName != null && !serverName.isEmpty() && !DnsCache.isIpLiteral(serverName)) {
            params.setServerNames(List.of(new SNIHostName(serverName)));
        }
        if (!insecure) {
            params.setEndpointIdentificationAlgorithm("HTTPS");
        }
        engine.setSSLParameters(params);

        boolean known = sessions.get(sessionKey) != null;
        handler.handshakeFuture().addListener(f -> {
            if (f.isSuccess()) {
                sessions.put(sessionKey, engine.getSession());
                log.debug("TLS handshake with {}:{} done ({}, cached session {})", host, port,
                        engine.getSession().getProtocol(), known);
            } else {
                log.debug("TLS handshake with {}:{} failed: {}", host, port, f.cause().toString());
            }
        });
        return handler;
    }
}
