package xzy.fz.agent.broker;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Placeholder slot held in the host pool while one connection attempt is in flight.
 */
public final class AdmissionToken {

    private final AdmissionControl owner;
    private final String name;
    private final AtomicBoolean released = new AtomicBoolean();

    AdmissionToken(AdmissionControl owner, String name) {
        this.owner = owner;
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Returns the slot to the pool.
     *
     * @throws IllegalStateException if the token was already released
     */
    public void release() {
        if (!released.compareAndSet(false, true)) {
            throw new IllegalStateException("Admission token for " + name + " already released");
        }
        owner.release(name);
    }

    public boolean isReleased() {
        return released.get();
    }
}
