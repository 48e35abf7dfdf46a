package world.willfrog.review.workflow;

import java.util.concurrent.locks.ReentrantLock;

/**
 * fan-out 的共享计数器，所有计数在同一把锁下更新。
 */
public class FanOutCounter {

    private final ReentrantLock lock = new ReentrantLock();
    private final int total;
    private int succeeded;
    private int failed;
    private int skipped;

    public FanOutCounter(int total) {
        this.total = total;
    }

    public Snapshot recordSuccess() {
        lock.lock();
        try {
            succeeded++;
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public Snapshot recordFailure() {
        lock.lock();
        try {
            failed++;
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public Snapshot recordSkip() {
        lock.lock();
        try {
            skipped++;
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    public Snapshot snapshot() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    private Snapshot snapshotLocked() {
        return new Snapshot(total, succeeded, failed, skipped);
    }

    public record Snapshot(int total, int succeeded, int failed, int skipped) {

        public int completed() {
            return succeeded + failed + skipped;
        }
    }
}
