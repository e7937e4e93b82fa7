package com.ryuqq.swarm.testkit.support;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * ExecutorService that queues submitted work until the test runs it explicitly.
 *
 * <p>Lets a test observe state between dispatch and execution.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class ManualExecutorService extends AbstractExecutorService {

    private final Deque<Runnable> pending = new ArrayDeque<>();
    private boolean shutdown;
    private boolean rejecting;

    @Override
    public synchronized void execute(Runnable command) {
        if (shutdown || rejecting) {
            throw new RejectedExecutionException("ManualExecutorService does not accept work");
        }
        pending.add(command);
    }

    /**
     * Runs the oldest queued command on the calling thread.
     *
     * @return false if nothing was queued
     */
    public boolean runNext() {
        Runnable next;
        synchronized (this) {
            next = pending.poll();
        }
        if (next == null) {
            return false;
        }
        next.run();
        return true;
    }

    /**
     * Runs queued commands, including ones queued while running, until none remain.
     *
     * @return number of commands run
     */
    public int runAll() {
        int count = 0;
        while (runNext()) {
            count++;
        }
        return count;
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * Makes subsequent {@link #execute(Runnable)} calls throw {@link RejectedExecutionException}.
     */
    public synchronized void rejectNewWork() {
        this.rejecting = true;
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
    }

    @Override
    public synchronized List<Runnable> shutdownNow() {
        shutdown = true;
        List<Runnable> drained = new ArrayList<>(pending);
        pending.clear();
        return drained;
    }

    @Override
    public synchronized boolean isShutdown() {
        return shutdown;
    }

    @Override
    public synchronized boolean isTerminated() {
        return shutdown && pending.isEmpty();
    }

    @Override
    public synchronized boolean awaitTermination(long timeout, TimeUnit unit) {
        return isTerminated();
    }
}
