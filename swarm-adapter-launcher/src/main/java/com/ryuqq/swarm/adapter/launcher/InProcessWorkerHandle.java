package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.worker.AgentWorker;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;

/**
 * 전용 스레드에서 실행되는 {@link AgentWorker} 핸들.
 *
 * <p>정상 종료는 워커의 종료 플래그, 강제 종료는 스레드 인터럽트입니다.
 * CPU 사용률은 워커 루프 스레드의 CPU 시간 기준입니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
final class InProcessWorkerHandle implements AgentHandle {

    private final AgentWorker worker;
    private final Thread thread;
    private final Clock clock;
    private final Instant startedAt;

    private long lastCpuNanos;
    private Instant lastSampleAt;

    InProcessWorkerHandle(AgentWorker worker, Thread thread, Clock clock) {
        this.worker = worker;
        this.thread = thread;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastSampleAt = startedAt;
    }

    @Override
    public boolean isAlive() {
        return thread.isAlive();
    }

    @Override
    public OptionalLong pid() {
        return OptionalLong.empty();
    }

    @Override
    public synchronized AgentMetrics sampleMetrics() {
        Instant now = clock.instant();
        long uptimeSeconds = Duration.between(startedAt, now).toSeconds();
        ThreadMXBean threads = ManagementFactory.getThreadMXBean();
        if (!thread.isAlive() || !threads.isThreadCpuTimeSupported()) {
            return new AgentMetrics(0.0, 0.0, uptimeSeconds);
        }

        long cpuNanos = threads.getThreadCpuTime(thread.getId());
        if (cpuNanos < 0) {
            return new AgentMetrics(0.0, 0.0, uptimeSeconds);
        }
        long wallNanos = Duration.between(lastSampleAt, now).toNanos();
        double cpuPercent = wallNanos > 0 ? (cpuNanos - lastCpuNanos) * 100.0 / wallNanos : 0.0;
        lastCpuNanos = cpuNanos;
        lastSampleAt = now;
        return new AgentMetrics(Math.max(cpuPercent, 0.0), 0.0, uptimeSeconds);
    }

    @Override
    public void requestStop() {
        worker.requestShutdown();
    }

    @Override
    public boolean awaitExit(long timeoutMs) throws InterruptedException {
        thread.join(Math.max(timeoutMs, 1));
        return !thread.isAlive();
    }

    @Override
    public void forceStop() {
        worker.requestShutdown();
        thread.interrupt();
    }
}
