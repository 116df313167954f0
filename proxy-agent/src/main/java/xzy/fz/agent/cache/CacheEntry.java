package xzy.fz.agent.cache;

/**
 * A cached value together with the time it was stored.
 *
 * @param value     Cached value
 * @param timestamp Store time in nanoseconds, taken from the owning cache's clock
 */
public record CacheEntry<V>(V value, long timestamp) {

    boolean isExpired(long now, long ttlNanos) {
        return ttlNanos > 0 && now - timestamp >= ttlNanos;
    }
}
