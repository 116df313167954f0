package xzy.fz.agent.broker;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioChannelOption;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.resolver.DefaultNameResolver;
import io.netty.resolver.NameResolver;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import jdk.net.ExtendedSocketOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.backend.IdleChannelPool;
import xzy.fz.agent.cache.DnsCache;
import xzy.fz.agent.config.AgentConfig;
import xzy.fz.agent.tls.TlsSessionCache;
import xzy.fz.agent.tls.TlsUpgrader;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Services shared by every broker a dispatcher creates: the event loop group, admission control,
 * TLS and DNS caches, the idle channel pool and the outbound bootstrap template.
 *
 * <p>Closing the context clears the caches, closes pooled channels and shuts down the event loop
 * group when the context created it.
 */
public final class TunnelContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TunnelContext.class);

    public static final String WIRE_LOGGER = "wire-log";

    private final AgentConfig config;
    private final EventLoopGroup group;
    private final boolean ownsGroup;
    private final AdmissionControl admissionControl = new AdmissionControl();
    private final TlsSessionCache tlsSessions;
    private final TlsUpgrader tlsUpgrader;
    private final DnsCache dnsCache;
    private final NameResolver<InetAddress> nameResolver;
    private final boolean ownsResolver;
    private final IdleChannelPool idleChannels;
    private final ScheduledFuture<?> sweepTask;
    private final AtomicBoolean closed = new AtomicBoolean();

    private TunnelContext(Builder builder) {
        this.config = builder.config;
        this.ownsGroup = builder.group == null;
        this.group = ownsGroup ? new NioEventLoopGroup() : builder.group;
        this.tlsSessions = new TlsSessionCache(config.tlsSessionTtl(), config.tlsSessionMaxSize());
        this.tlsUpgrader = builder.tlsUpgrader != null
                ? builder.tlsUpgrader.apply(tlsSessions)
                : TlsUpgrader.create(config, tlsSessions);
        this.dnsCache = new DnsCache(config.dnsCacheEnabled(), config.dnsCacheTtl(), config.dnsCacheMaxSize());
        this.ownsResolver = builder.nameResolver == null;
        this.nameResolver = ownsResolver ? new DefaultNameResolver(group.next()) : builder.nameResolver;
        this.idleChannels = new IdleChannelPool(config.maxSocketsPerKey(), config.socketIdleTimeout());

        long sweepMillis = config.socketSweepInterval().toMillis();
        this.sweepTask = group.next().scheduleAtFixedRate(this::sweep, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
    }

    public static Builder builder(AgentConfig config) {
        return new Builder(config);
    }

    public static TunnelContext create(AgentConfig config) {
        return builder(config).build();
    }

    public AgentConfig config() {
        return config;
    }

    public EventLoopGroup eventLoopGroup() {
        return group;
    }

    public EventExecutor executor() {
        return group.next();
    }

    public AdmissionControl admissionControl() {
        return admissionControl;
    }

    public TlsUpgrader tls() {
        return tlsUpgrader;
    }

    public TlsSessionCache tlsSessions() {
        return tlsSessions;
    }

    public DnsCache dnsCache() {
        return dnsCache;
    }

    public NameResolver<InetAddress> nameResolver() {
        return nameResolver;
    }

    public IdleChannelPool idleChannels() {
        return idleChannels;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Outbound bootstrap with auto-read off, the configured connect timeout, keep-alive and local
     * bind address. Callers add the handler.
     */
    public Bootstrap newBootstrap() {
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.AUTO_READ, false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.connectTimeout().toMillis())
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, config.keepAlive());
        if (config.keepAlive()) {
            int idleSeconds = (int) Math.max(1L, (config.keepAliveInterval().toMillis() + 999) / 1000);
            bootstrap.option(NioChannelOption.of(ExtendedSocketOptions.TCP_KEEPIDLE), idleSeconds);
        }
        if (config.localAddress() != null) {
            bootstrap.localAddress(new InetSocketAddress(config.localAddress(), 0));
        }
        return bootstrap;
    }

    /** Adds a Netty {@link LoggingHandler} when {@code wire.logging} is on. */
    public void addWireLogging(ChannelPipeline pipeline) {
        if (config.wireLogging()) {
            pipeline.addLast(WIRE_LOGGER, new LoggingHandler(LogLevel.DEBUG));
        }
    }

    private void sweep() {
        idleChannels.sweep();
        tlsSessions.purgeExpired();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        sweepTask.cancel(false);
        idleChannels.close();
        dnsCache.clear();
        tlsSessions.clear();
        if (ownsResolver) {
            nameResolver.close();
        }
        if (ownsGroup) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        }
        log.debug("Tunnel context closed");
    }

    public static final class Builder {
        private final AgentConfig config;
        private EventLoopGroup group;
        private NameResolver<InetAddress> nameResolver;
        private Function<TlsSessionCache, TlsUpgrader> tlsUpgrader;

        private Builder(AgentConfig config) {
            this.config = config;
        }

        /** Borrowed event loop group; the context will not shut it down. */
        public Builder eventLoopGroup(EventLoopGroup group) {
            this.group = group;
            return this;
        }

        /** Resolver for client-side SOCKS lookups; defaults to the JDK resolver. */
        public Builder nameResolver(NameResolver<InetAddress> nameResolver) {
            this.nameResolver = nameResolver;
            return this;
        }

        /** Custom TLS setup, given the context's session cache. */
        public Builder tlsUpgrader(Function<TlsSessionCache, TlsUpgrader> tlsUpgrader) {
            this.tlsUpgrader = tlsUpgrader;
            return this;
        }

        public TunnelContext build() {
            return new TunnelContext(this);
        }
    }
}
