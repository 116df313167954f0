package xzy.fz.agent.cache;

import io.netty.resolver.NameResolver;
import io.netty.util.NetUtil;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.time.Duration;
import java.util.Locale;
import java.util.function.LongSupplier;

/**
 * Hostname to address cache consulted before a {@link NameResolver} lookup.
 *
 * <p>IP literals are converted directly and never reach the resolver or the cache.
 */
public final class DnsCache {

    private static final Logger log = LoggerFactory.getLogger(DnsCache.class);

    private final boolean enabled;
    private final BoundedCache<String, InetAddress> addresses;

    public DnsCache(boolean enabled, Duration ttl, int maxSize) {
        this(enabled, ttl, maxSize, System::nanoTime);
    }

    DnsCache(boolean enabled, Duration ttl, int maxSize, LongSupplier clock) {
        this.enabled = enabled;
        this.addresses = BoundedCache.<String, InetAddress>builder(maxSize)
                .ttl(ttl)
                .clock(clock)
                .build();
    }

    /**
     * Resolves {@code host}, answering from the cache when a live entry exists and storing the
     * resolver's answer otherwise.
     */
    public Future<InetAddress> resolve(String host, NameResolver<InetAddress> resolver, EventExecutor executor) {
        Promise<InetAddress> promise = executor.newPromise();
        InetAddress literal = literalAddress(host);
        if (literal != null) {
            return promise.setSuccess(literal);
        }
        String key = host.toLowerCase(Locale.ROOT);
        if (enabled) {
            InetAddress cached = addresses.get(key);
            if (cached != null) {
                log.debug("DNS cache hit for {}", host);
                return promise.setSuccess(cached);
            }
        }
        resolver.resolve(host).addListener((Future<InetAddress> f) -> {
            if (!f.isSuccess()) {
                promise.tryFailure(f.cause());
                return;
            }
            InetAddress address = f.getNow();
            if (enabled) {
                addresses.put(key, address);
            }
            log.debug("Resolved {} to {}", host, address.getHostAddress());
            promise.trySuccess(address);
        });
        return promise;
    }

    public int size() {
        return addresses.size();
    }

    public void clear() {
        addresses.clear();
    }

    /** Returns the address for an IPv4/IPv6 literal (IPv6 may be bracketed), or {@code null}. */
    public static InetAddress literalAddress(String host) {
        String candidate = host;
        if (candidate.startsWith("[") && candidate.endsWith("]")) {
            candidate = candidate.substring(1, candidate.length() - 1);
        }
        return NetUtil.createInetAddressFromIpAddressString(candidate);
    }

    public static boolean isIpLiteral(String host) {
        return literalAddress(host) != null;
    }
}
