package com.ryuqq.swarm.adapter.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * OS 프로세스 핸들.
 *
 * <p>종료 신호는 자식 프로세스에 먼저 보낸 뒤 Agent 프로세스에 보냅니다.
 * CPU 시간은 {@link ProcessHandle.Info}에서, 상주 메모리는 {@code /proc/{pid}/status}의
 * VmRSS에서 읽습니다 (없으면 0).</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
final class OsProcessHandle implements AgentHandle {

    private static final Logger log = LoggerFactory.getLogger(OsProcessHandle.class);

    private final Process process;
    private final Clock clock;
    private final Instant startedAt;

    private Duration lastCpu = Duration.ZERO;
    private Instant lastSampleAt;

    OsProcessHandle(Process process, Clock clock) {
        this.process = process;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastSampleAt = startedAt;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public OptionalLong pid() {
        try {
            return OptionalLong.of(process.pid());
        } catch (UnsupportedOperationException e) {
            return OptionalLong.empty();
        }
    }

    @Override
    public synchronized AgentMetrics sampleMetrics() {
        Instant now = clock.instant();
        long uptimeSeconds = Duration.between(startedAt, now).toSeconds();
        if (!process.isAlive()) {
            return new AgentMetrics(0.0, 0.0, uptimeSeconds);
        }

        Duration cpu = process.info().totalCpuDuration().orElse(lastCpu);
        long wallMs = Duration.between(lastSampleAt, now).toMillis();
        double cpuPercent = wallMs > 0 ? cpu.minus(lastCpu).toMillis() * 100.0 / wallMs : 0.0;
        lastCpu = cpu;
        lastSampleAt = now;

        double memoryMb = pid().isPresent() ? residentMemoryMb(pid().getAsLong()) : 0.0;
        return new AgentMetrics(Math.max(cpuPercent, 0.0), memoryMb, uptimeSeconds);
    }

    @Override
    public void requestStop() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    @Override
    public boolean awaitExit(long timeoutMs) throws InterruptedException {
        return process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
    }

    @Override
    public void forceStop() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static double residentMemoryMb(long pid) {
        Path status = Path.of("/proc", String.valueOf(pid), "status");
        if (!Files.isReadable(status)) {
            return 0.0;
        }
        try {
            for (String line : Files.readAllLines(status)) {
                if (line.startsWith("VmRSS:")) {
                    return JvmSystemResources.parseKilobytes(line) / 1024.0;
                }
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Could not read {}: {}", status, e.getMessage());
        }
        return 0.0;
    }
}
