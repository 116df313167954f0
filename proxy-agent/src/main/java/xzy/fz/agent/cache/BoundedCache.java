package xzy.fz.agent.cache;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * Map with a hard size bound and an optional time-to-live.
 *
 * <p>Entries are kept in either insertion order or recency order. When a new key is stored while the
 * cache is full, exactly one entry (the oldest in iteration order) is evicted. Entries older than the
 * time-to-live count as misses and are dropped on the lookup that finds them.
 *
 * <p>All operations hold the cache's own lock. The removal listener runs after the lock is released,
 * so it may do slow work such as closing channels.
 */
public final class BoundedCache<K, V> {

    private final int maxSize;
    private final long ttlNanos;
    private final boolean accessOrder;
    private final LinkedHashMap<K, CacheEntry<V>> entries;
    private final RemovalListener<K, V> removalListener;
    private final LongSupplier clock;

    private BoundedCache(Builder<K, V> builder) {
        this.maxSize = builder.maxSize;
        this.ttlNanos = builder.ttl.toNanos();
        this.accessOrder = builder.accessOrder;
        this.entries = new LinkedHashMap<>(16, 0.75f, builder.accessOrder);
        this.removalListener = builder.removalListener;
        this.clock = builder.clock;
    }

    public static <K, V> Builder<K, V> builder(int maxSize) {
        return new Builder<>(maxSize);
    }

    /**
     * Returns the live value for {@code key}, or {@code null} on a miss. A hit in a recency-ordered
     * cache moves the entry to the freshest position.
     */
    public V get(K key) {
        CacheEntry<V> expired;
        synchronized (this) {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isExpired(clock.getAsLong(), ttlNanos)) {
                return entry.value();
            }
            entries.remove(key);
            expired = entry;
        }
        notifyRemoval(key, expired.value(), RemovalCause.EXPIRED);
        return null;
    }

    /**
     * Stores {@code value} with a fresh timestamp. Storing a new key into a full cache evicts the
     * oldest entry first.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(value, "value");
        List<Removal<K, V>> removals = new ArrayList<>(1);
        synchronized (this) {
            store(key, value, removals);
        }
        notifyRemovals(removals);
    }

    /**
     * Returns the live value for {@code key}, computing and storing it under the cache lock when
     * absent. At most one caller computes a value for a given key at a time.
     */
    public V computeIfAbsent(K key, Function<? super K, ? extends V> loader) {
        List<Removal<K, V>> removals = new ArrayList<>(2);
        V value;
        synchronized (this) {
            CacheEntry<V> entry = entries.get(key);
            if (entry != null && !entry.isExpired(clock.getAsLong(), ttlNanos)) {
                return entry.value();
            }
            if (entry != null) {
                entries.remove(key);
                removals.add(new Removal<>(key, entry.value(), RemovalCause.EXPIRED));
            }
            value = loader.apply(key);
            if (value != null) {
                store(key, value, removals);
            }
        }
        notifyRemovals(removals);
        return value;
    }

    public V remove(K key) {
        CacheEntry<V> removed;
        synchronized (this) {
            removed = entries.remove(key);
        }
        if (removed == null) {
            return null;
        }
        notifyRemoval(key, removed.value(), RemovalCause.EXPLICIT);
        return removed.value();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean containsKey(K key) {
        CacheEntry<V> entry = entries.get(key);
        return entry != null && !entry.isExpired(clock.getAsLong(), ttlNanos);
    }

    /** Snapshot of the stored values, oldest first, expired entries included until purged. */
    public synchronized List<V> values() {
        List<V> values = new ArrayList<>(entries.size());
        for (CacheEntry<V> entry : entries.values()) {
            values.add(entry.value());
        }
        return values;
    }

    /** Drops every expired entry and returns how many were dropped. */
    public int purgeExpired() {
        if (ttlNanos <= 0) {
            return 0;
        }
        List<Removal<K, V>> removals = new ArrayList<>();
        synchronized (this) {
            long now = clock.getAsLong();
            Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<K, CacheEntry<V>> e = it.next();
                if (e.getValue().isExpired(now, ttlNanos)) {
                    it.remove();
                    removals.add(new Removal<>(e.getKey(), e.getValue().value(), RemovalCause.EXPIRED));
                }
            }
        }
        notifyRemovals(removals);
        return removals.size();
    }

    public void clear() {
        List<Removal<K, V>> removals = new ArrayList<>();
        synchronized (this) {
            for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
                removals.add(new Removal<>(e.getKey(), e.getValue().value(), RemovalCause.EXPLICIT));
            }
            entries.clear();
        }
        notifyRemovals(removals);
    }

    public int maxSize() {
        return maxSize;
    }

    public boolean isAccessOrder() {
        return accessOrder;
    }

    // caller holds the lock
    private void store(K key, V value, List<Removal<K, V>> removals) {
        CacheEntry<V> previous = entries.put(key, new CacheEntry<>(value, clock.getAsLong()));
        if (previous != null) {
            if (previous.value() != value) {
                removals.add(new Removal<>(key, previous.value(), RemovalCause.REPLACED));
            }
            return;
        }
        if (entries.size() > maxSize) {
            Iterator<Map.Entry<K, CacheEntry<V>>> it = entries.entrySet().iterator();
            Map.Entry<K, CacheEntry<V>> eldest = it.next();
            it.remove();
            removals.add(new Removal<>(eldest.getKey(), eldest.getValue().value(), RemovalCause.SIZE));
        }
    }

    private void notifyRemovals(List<Removal<K, V>> removals) {
        for (Removal<K, V> removal : removals) {
            notifyRemoval(removal.key(), removal.value(), removal.cause());
        }
    }

    private void notifyRemoval(K key, V value, RemovalCause cause) {
        if (removalListener != null) {
            removalListener.onRemoval(key, value, cause);
        }
    }

    private record Removal<K, V>(K key, V value, RemovalCause cause) {
    }

    public static final class Builder<K, V> {
        private final int maxSize;
        private Duration ttl = Duration.ZERO;
        private boolean accessOrder;
        private RemovalListener<K, V> removalListener;
        private LongSupplier clock = System::nanoTime;

        private Builder(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
            }
            this.maxSize = maxSize;
        }

        /** Entry lifetime; {@link Duration#ZERO} disables expiry. */
        public Builder<K, V> ttl(Duration ttl) {
            if (ttl.isNegative()) {
                throw new IllegalArgumentException("ttl must not be negative: " + ttl);
            }
            this.ttl = ttl;
            return this;
        }

        /** Recency order when {@code true}, insertion order otherwise. */
        public Builder<K, V> accessOrder(boolean accessOrder) {
            this.accessOrder = accessOrder;
            return this;
        }

        public Builder<K, V> removalListener(RemovalListener<K, V> removalListener) {
            this.removalListener = removalListener;
            return this;
        }

        public Builder<K, V> clock(LongSupplier clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public BoundedCache<K, V> build() {
            return new BoundedCache<>(this);
        }
    }
}
