package xzy.fz.agent.tls;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xzy.fz.agent.cache.BoundedCache;
import xzy.fz.agent.cache.RemovalCause;

import javax.net.ssl.SSLSession;
import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Remembers the last TLS session negotiated per key ({@code https://proxyHost:port} for proxies,
 * {@code target:host:port} for destinations).
 *
 * <p>The JDK engine resumes sessions by peer host and port on its own. Sessions leaving this cache
 * through expiry, eviction or {@link #clear()} are invalidated so the engine no longer offers them;
 * the cache bounds therefore decide which sessions can be resumed.
 */
public final class TlsSessionCache {

    private static final Logger log = LoggerFactory.getLogger(TlsSessionCache.class);

    private final BoundedCache<String, SSLSession> sessions;

    public TlsSessionCache(Duration ttl, int maxSize) {
        this(ttl, maxSize, System::nanoTime);
    }

    TlsSessionCache(Duration ttl, int maxSize, LongSupplier clock) {
        this.sessions = BoundedCache.<String, SSLSession>builder(maxSize)
                .ttl(ttl)
                .clock(clock)
                .removalListener(TlsSessionCache::onRemoval)
                .build();
    }

    /** Live session for {@code key}, or {@code null}. */
    public SSLSession get(String key) {
        return sessions.get(key);
    }

    public void put(String key, SSLSession session) {
        if (session != null && session.isValid()) {
            sessions.put(key, session);
        }
    }

    public int size() {
        return sessions.size();
    }

    public int purgeExpired() {
        return sessions.purgeExpired();
    }

    public void clear() {
        sessions.clear();
    }

    private static void onRemoval(String key, SSLSession session, RemovalCause cause) {
        if (cause == RemovalCause.REPLACED) {
            return;
        }
        log.debug("Dropping TLS session for {} ({})", key, cause);
        session.invalidate();
    }
}
