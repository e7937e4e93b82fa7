package com.ryuqq.swarm.adapter.launcher.worker;

import com.ryuqq.swarm.adapter.redis.store.RedisBackingStore;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.handler.TaskHandlerProvider;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ServiceLoader;

/**
 * 프로세스 모드 Agent 진입점.
 *
 * <p>환경 변수({@link AgentEnvironment})로 설정을 읽고, {@code SWARM_STORE_URL}의 Redis에 접속하며,
 * {@link ServiceLoader}로 {@link TaskHandlerProvider}를 찾아 핸들러를 등록합니다.
 * SIGTERM 시 shutdown hook이 정상 종료 절차를 실행합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class AgentWorkerMain {

    private static final Logger log = LoggerFactory.getLogger(AgentWorkerMain.class);
    private static final long SHUTDOWN_HOOK_MARGIN_MS = 5000;

    private AgentWorkerMain() {
    }

    public static void main(String[] args) {
        AgentWorkerConfig config;
        try {
            config = AgentWorkerConfig.fromEnvironment(System.getenv());
        } catch (ValidationException e) {
            log.error("Invalid agent environment: {}", e.getMessage());
            System.exit(1);
            return;
        }

        TaskHandlerRegistry handlers = loadHandlers();
        RedisBackingStore store = new RedisBackingStore(config.storeUrl());
        AgentWorker worker = new AgentWorker(config, new MemoryCoordinator(store), handlers, Clock.systemUTC());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            worker.requestShutdown();
            try {
                if (!worker.awaitStopped(config.shutdownGraceMs() + SHUTDOWN_HOOK_MARGIN_MS)) {
                    log.warn("Agent worker {} did not stop in time", config.agentId());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                store.close();
            }
        }, "swarm-agent-shutdown"));

        worker.run();
    }

    static TaskHandlerRegistry loadHandlers() {
        TaskHandlerRegistry handlers = new TaskHandlerRegistry();
        for (TaskHandlerProvider provider : ServiceLoader.load(TaskHandlerProvider.class)) {
            provider.registerHandlers(handlers);
            log.info("Loaded task handlers from {}", provider.getClass().getName());
        }
        log.info("Registered task types: {}", handlers.registeredTypes());
        return handlers;
    }
}
