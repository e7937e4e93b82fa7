package com.ryuqq.swarm.adapter.launcher;

import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 프로세스 없이 종료 동작을 흉내 내는 핸들.
 */
final class FakeAgentHandle implements AgentHandle {

    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final AtomicInteger stopRequests = new AtomicInteger();
    private final AtomicInteger forceStops = new AtomicInteger();
    private volatile boolean ignoresStopRequest;

    FakeAgentHandle ignoringStopRequests() {
        this.ignoresStopRequest = true;
        return this;
    }

    void exit() {
        alive.set(false);
    }

    @Override
    public boolean isAlive() {
        return alive.get();
    }

    @Override
    public OptionalLong pid() {
        return OptionalLong.of(4242);
    }

    @Override
    public AgentMetrics sampleMetrics() {
        return new AgentMetrics(12.5, 64.0, 10);
    }

    @Override
    public void requestStop() {
        stopRequests.incrementAndGet();
        if (!ignoresStopRequest) {
            alive.set(false);
        }
    }

    @Override
    public boolean awaitExit(long timeoutMs) {
        return !alive.get();
    }

    @Override
    public void forceStop() {
        forceStops.incrementAndGet();
        alive.set(false);
    }

    int stopRequests() {
        return stopRequests.get();
    }

    int forceStops() {
        return forceStops.get();
    }
}
