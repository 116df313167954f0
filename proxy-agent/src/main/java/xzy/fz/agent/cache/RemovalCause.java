package xzy.fz.agent.cache;

/**
 * Why an entry left a {@link BoundedCache}.
 */
public enum RemovalCause {
    /** Removed by {@code remove()} or {@code clear()}. */
    EXPLICIT,
    /** Overwritten by a {@code put()} for the same key. */
    REPLACED,
    /** Evicted because the cache was full. */
    SIZE,
    /** Found older than the cache's time-to-live. */
    EXPIRED
}
