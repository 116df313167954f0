package xzy.fz.agent.config;

import java.time.Duration;
import java.util.Properties;

/**
 * Settings shared by every broker created from one {@code TunnelContext}.
 *
 * @param keepAlive              Enable TCP keep-alive on outbound sockets and ask proxies to keep connections open
 * @param keepAliveInterval      Idle time before the first keep-alive probe
 * @param connectTimeout         TCP connect timeout, also used as the SOCKS handshake and CONNECT response timeout
 * @param maxResponseHeadBytes   Largest CONNECT response head accepted from a proxy
 * @param localAddress           Local address outbound sockets bind to, or {@code null}
 * @param maxSocketsPerKey       Idle-pool bound per pool key
 * @param socketIdleTimeout      Idle time after which a pooled socket is closed
 * @param socketSweepInterval    Interval of the idle-pool sweep
 * @param socksSocketCache       Reuse SOCKS tunnels through the idle pool
 * @param dnsCacheEnabled        Cache client-side DNS answers for SOCKS4/SOCKS5
 * @param dnsCacheTtl            DNS cache entry lifetime
 * @param dnsCacheMaxSize        DNS cache bound
 * @param tlsSessionTtl          TLS session cache entry lifetime
 * @param tlsSessionMaxSize      TLS session cache bound
 * @param tlsInsecure            Trust any certificate and skip hostname verification
 * @param proxyCacheMaxSize      Proxy-resolution cache bound
 * @param proxyCacheTtl          Proxy-resolution entry lifetime, zero for none
 * @param agentCacheMaxSize      Tunnel instance cache bound in the dispatcher
 * @param urlCacheMaxSize        Forward-proxy absolute URI cache bound
 * @param headerCacheMaxSize     CONNECT header cache bound
 * @param wireLogging            Add a Netty {@code LoggingHandler} to tunnel pipelines
 */
public record AgentConfig(
        boolean keepAlive,
        Duration keepAliveInterval,
        Duration connectTimeout,
        int maxResponseHeadBytes,
        String localAddress,
        int maxSocketsPerKey,
        Duration socketIdleTimeout,
        Duration socketSweepInterval,
        boolean socksSocketCache,
        boolean dnsCacheEnabled,
        Duration dnsCacheTtl,
        int dnsCacheMaxSize,
        Duration tlsSessionTtl,
        int tlsSessionMaxSize,
        boolean tlsInsecure,
        int proxyCacheMaxSize,
        Duration proxyCacheTtl,
        int agentCacheMaxSize,
        int urlCacheMaxSize,
        int headerCacheMaxSize,
        boolean wireLogging
) {

    public AgentConfig {
        if (maxResponseHeadBytes <= 0) {
            throw new IllegalStateException("connect.maxResponseHeadBytes must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalStateException("connect.timeoutMillis must be positive");
        }
        if (localAddress != null && localAddress.isBlank()) {
            localAddress = null;
        }
    }

    /** Built-in defaults, ignoring any properties file on the classpath. */
    public static AgentConfig defaults() {
        return ConfigLoader.fromProperties(new Properties());
    }

    public String proxyConnectionHeader() {
        return keepAlive ? "Keep-Alive" : "close";
    }
}
