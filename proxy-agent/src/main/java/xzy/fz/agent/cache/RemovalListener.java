package xzy.fz.agent.cache;

/**
 * Callback for entries leaving a {@link BoundedCache}. Invoked outside the cache lock.
 */
@FunctionalInterface
public interface RemovalListener<K, V> {

    void onRemoval(K key, V value, RemovalCause cause);
}
