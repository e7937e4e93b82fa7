package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.worker.AgentWorker;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.model.SessionId;

import java.time.Clock;

/**
 * 같은 JVM의 전용 스레드에서 {@link AgentWorker}를 실행 (가벼운 Agent, 모니터링용).
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class InProcessLaunchStrategy implements LaunchStrategy {

    private final MemoryCoordinator memory;
    private final TaskHandlerRegistry handlers;
    private final Clock clock;
    private final String storeUrl;

    public InProcessLaunchStrategy(MemoryCoordinator memory, TaskHandlerRegistry handlers, Clock clock, String storeUrl) {
        this.memory = memory;
        this.handlers = handlers;
        this.clock = clock;
        this.storeUrl = storeUrl;
    }

    @Override
    public AgentHandle launch(SessionId sessionId, AgentConfig config) {
        AgentWorker worker = new AgentWorker(LaunchStrategy.workerConfig(sessionId, config, storeUrl), memory, handlers, clock);
        Thread thread = new Thread(worker, "swarm-agent-" + config.id());
        thread.setDaemon(true);
        thread.start();
        return new InProcessWorkerHandle(worker, thread, clock);
    }
}
