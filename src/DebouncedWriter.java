import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-slot quiet-period timer: every {@link #schedule()} cancels the pending
 * run and starts the wait again, so only the last request fires.
 */
final class DebouncedWriter {
    private static final Logger log = LoggerFactory.getLogger(DebouncedWriter.class);

    private final ScheduledExecutorService scheduler;
    private final long quietMillis;
    private final Runnable action;

    private ScheduledFuture<?> pending;
    private long generation;

    DebouncedWriter(ScheduledExecutorService scheduler, long quietMillis, Runnable action) {
        this.scheduler = scheduler;
        this.quietMillis = quietMillis;
        this.action = action;
    }

    synchronized void schedule() {
        if (pending != null) pending.cancel(false);
        final long gen = ++generation;
        try {
            pending = scheduler.schedule(new Runnable() {
                @Override public void run() {
                    fire(gen);
                }
            }, quietMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending = null;
            log.warn("Scheduler closed, writing without quiet period");
            action.run();
        }
    }

    synchronized boolean isPending() {
        return pending != null;
    }

    /** Runs the pending action now, on the caller's thread. No-op when nothing is pending. */
    void flush() {
        ScheduledFuture<?> p;
        synchronized (this) {
            p = pending;
            pending = null;
            generation++;
        }
        if (p != null) {
            p.cancel(false);
            action.run();
        }
    }

    synchronized void cancel() {
        if (pending != null) pending.cancel(false);
        pending = null;
        generation++;
    }

    private void fire(long gen) {
        synchronized (this) {
            if (gen != generation) return;
            pending = null;
        }
        action.run();
    }
}
