package xzy.fz.agent.broker;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts connection attempts in flight, per pool name and in total, so the host client's pool
 * accounting stays correct while a tunnel is being negotiated.
 */
public final class AdmissionControl {

    private final ConcurrentMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger total = new AtomicInteger();

    public AdmissionToken reserve(String name) {
        inFlight.compute(name, (key, count) -> {
            AtomicInteger c = count == null ? new AtomicInteger() : count;
            c.incrementAndGet();
            return c;
        });
        total.incrementAndGet();
        return new AdmissionToken(this, name);
    }

    void release(String name) {
        inFlight.computeIfPresent(name, (key, count) -> count.decrementAndGet() == 0 ? null : count);
        total.decrementAndGet();
    }

    public int inFlight(String name) {
        AtomicInteger count = inFlight.get(name);
        return count == null ? 0 : count.get();
    }

    public int totalInFlight() {
        return total.get();
    }
}
