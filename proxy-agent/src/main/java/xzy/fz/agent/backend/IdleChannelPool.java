package xzy.fz.agent.backend;

import io.netty.channel.Channel;
import io.netty.channel.ChannelPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Keyed pool of established channels that can be handed out again once their user releases them.
 *
 * <p>Each key holds at most {@code maxPerKey} entries. An entry is in use from the moment it is
 * tracked or acquired until its {@link Lease} is released. Idle entries older than the idle timeout
 * are closed by {@link #sweep()}; closed channels leave the pool on their own.
 */
public final class IdleChannelPool {

    private static final Logger log = LoggerFactory.getLogger(IdleChannelPool.class);

    private final int maxPerKey;
    private final long idleTimeoutNanos;
    private final LongSupplier clock;
    private final Map<String, Deque<Lease>> entries = new HashMap<>();
    private boolean closed;

    public IdleChannelPool(int maxPerKey, Duration idleTimeout) {
        this(maxPerKey, idleTimeout, System::nanoTime);
    }

    IdleChannelPool(int maxPerKey, Duration idleTimeout, LongSupplier clock) {
        if (maxPerKey <= 0) {
            throw new IllegalArgumentException("maxPerKey must be positive: " + maxPerKey);
        }
        this.maxPerKey = maxPerKey;
        this.idleTimeoutNanos = idleTimeout.toNanos();
        this.clock = clock;
    }

    /**
     * Hands out an idle, still-active channel for {@code key} whose TLS state matches {@code secure},
     * or returns {@code null}.
     */
    public synchronized Lease acquire(String key, boolean secure) {
        Deque<Lease> leases = entries.get(key);
        if (leases == null) {
            return null;
        }
        // newest idle entry first
        Iterator<Lease> it = leases.descendingIterator();
        while (it.hasNext()) {
            Lease lease = it.next();
            if (!lease.inUse && lease.secure == secure && lease.channel.isActive()) {
                lease.inUse = true;
                lease.lastUsed = clock.getAsLong();
                log.debug("Reusing pooled channel {} for {}", lease.channel, key);
                return lease;
            }
        }
        return null;
    }

    /**
     * Adds a freshly opened channel as an in-use entry. When the key is full the oldest idle entry
     * is closed to make room; if every entry is in use the channel is not pooled and {@code null} is
     * returned.
     */
    public Lease track(String key, Channel channel, boolean secure) {
        Lease evicted = null;
        Lease lease;
        synchronized (this) {
            if (closed) {
                return null;
            }
            Deque<Lease> leases = entries.computeIfAbsent(key, k -> new ArrayDeque<>());
            if (leases.size() >= maxPerKey) {
                for (Iterator<Lease> it = leases.iterator(); it.hasNext(); ) {
                    Lease candidate = it.next();
                    if (!candidate.inUse) {
                        it.remove();
                        evicted = candidate;
                        break;
                    }
                }
                if (evicted == null) {
                    return null;
                }
            }
            lease = new Lease(key, channel, secure);
            lease.lastUsed = clock.getAsLong();
            leases.addLast(lease);
        }
        if (evicted != null) {
            log.debug("Pool for {} full, closing idle channel {}", key, evicted.channel);
            evicted.channel.close();
        }
        channel.closeFuture().addListener(f -> remove(lease));
        return lease;
    }

    /** Closes idle entries that exceeded the idle timeout and returns how many were closed. */
    public int sweep() {
        List<Lease> expired = new ArrayList<>();
        synchronized (this) {
            long now = clock.getAsLong();
            for (Iterator<Deque<Lease>> perKey = entries.values().iterator(); perKey.hasNext(); ) {
                Deque<Lease> leases = perKey.next();
                for (Iterator<Lease> it = leases.iterator(); it.hasNext(); ) {
                    Lease lease = it.next();
                    if (!lease.inUse && now - lease.lastUsed >= idleTimeoutNanos) {
                        it.remove();
                        expired.add(lease);
                    }
                }
                if (leases.isEmpty()) {
                    perKey.remove();
                }
            }
        }
        for (Lease lease : expired) {
            lease.channel.close();
        }
        if (!expired.isEmpty()) {
            log.debug("Closed {} idle pooled channels", expired.size());
        }
        return expired.size();
    }

    public synchronized int size(String key) {
        Deque<Lease> leases = entries.get(key);
        return leases == null ? 0 : leases.size();
    }

    public synchronized int idleCount(String key) {
        Deque<Lease> leases = entries.get(key);
        if (leases == null) {
            return 0;
        }
        int idle = 0;
        for (Lease lease : leases) {
            if (!lease.inUse) {
                idle++;
            }
        }
        return idle;
    }

    /** Closes every pooled channel, in use or not, and refuses new entries. */
    public void close() {
        List<Lease> all = new ArrayList<>();
        synchronized (this) {
            closed = true;
            for (Deque<Lease> leases : entries.values()) {
                all.addAll(leases);
            }
            entries.clear();
        }
        for (Lease lease : all) {
            lease.channel.close();
        }
    }

    private synchronized boolean remove(Lease lease) {
        Deque<Lease> leases = entries.get(lease.key);
        if (leases == null || !leases.remove(lease)) {
            return false;
        }
        if (leases.isEmpty()) {
            entries.remove(lease.key);
        }
        return true;
    }

    private synchronized boolean markIdle(Lease lease) {
        Deque<Lease> leases = entries.get(lease.key);
        if (leases == null || !leases.contains(lease) || !lease.channel.isActive()) {
            return false;
        }
        lease.inUse = false;
        lease.lastUsed = clock.getAsLong();
        return true;
    }

    /**
     * One pooled channel. Handlers added after {@link #markBaseline()} are stripped on release so the
     * next user starts from the same pipeline.
     */
    public final class Lease {
        private final String key;
        private final Channel channel;
        private final boolean secure;
        private List<String> baseline;
        private boolean inUse = true;
        private long lastUsed;

        private Lease(String key, Channel channel, boolean secure) {
            this.key = key;
            this.channel = channel;
            this.secure = secure;
            this.baseline = channel.pipeline().names();
        }

        public Channel channel() {
            return channel;
        }

        public String key() {
            return key;
        }

        public boolean isSecure() {
            return secure;
        }

        /** Records the current pipeline as the state the channel returns to on release. */
        public void markBaseline() {
            this.baseline = channel.pipeline().names();
        }

        /**
         * Marks the entry idle again.
         *
         * @return {@code false} if the channel is no longer pooled (closed or evicted)
         */
        public boolean release() {
            ChannelPipeline pipeline = channel.pipeline();
            for (String name : pipeline.names()) {
                if (!baseline.contains(name) && pipeline.context(name) != null) {
                    pipeline.remove(name);
                }
            }
            channel.config().setAutoRead(false);
            return markIdle(this);
        }

        /** Removes the entry and closes its channel. */
        public void discard() {
            remove(this);
            channel.close();
        }
    }
}
