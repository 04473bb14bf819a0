package decentralabs.sso.util;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Keyed mutual exclusion: at most one holder per key, waiting callers served in arrival order.
 *
 * <pre>
 * try (Linearizer.Lane lane = linearizer.queue("saml")) {
 *     // check-then-create
 * }
 * </pre>
 */
@Slf4j
public class Linearizer {

    private final String name;
    private final Map<String, ReentrantLock> lanes = new ConcurrentHashMap<>();

    public Linearizer(String name) {
        this.name = name;
    }

    /**
     * Blocks until the lane for {@code key} is free, then takes it.
     *
     * @return handle that releases the lane when closed
     */
    public Lane queue(String key) {
        ReentrantLock lock = lanes.computeIfAbsent(key, k -> new ReentrantLock(true));
        if (lock.isLocked() && !lock.isHeldByCurrentThread()) {
            log.debug("Waiting for linearizer {} lane {} ({} queued)", name, key, lock.getQueueLength());
        }
        lock.lock();
        return new Lane(lock);
    }

    /**
     * @return number of threads waiting on the lane for {@code key}
     */
    public int queueLength(String key) {
        ReentrantLock lock = lanes.get(key);
        return lock == null ? 0 : lock.getQueueLength();
    }

    public String getName() {
        return name;
    }

    /**
     * Exclusive possession of one lane.
     */
    public static final class Lane implements AutoCloseable {

        private final ReentrantLock lock;
        private boolean released;

        private Lane(ReentrantLock lock) {
            this.lock = lock;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
