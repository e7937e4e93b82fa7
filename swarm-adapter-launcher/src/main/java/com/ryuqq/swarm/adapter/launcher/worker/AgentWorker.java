package com.ryuqq.swarm.adapter.launcher.worker;

import com.ryuqq.swarm.application.memory.AgentRegistration;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.handler.TaskHandler;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 실행된 Agent 안에서 도는 작업 루프.
 *
 * <p><strong>동작 흐름:</strong></p>
 * <pre>
 * 1. Memory Coordinator에 자신을 등록
 * 2. heartbeat 루프 시작 (상태, 실행 중 Task, 카운터, uptime)
 * 3. 반복 (pollIntervalMs 주기):
 *    - 실행 중 Task 수가 maxTasks 미만이면 공유 컨텍스트 pending_tasks 조회
 *    - 핸들러가 있고 capability가 겹치고 미지정인 Task를 claimTask로 선점
 *    - 선점한 Task를 Task 풀에서 동시 실행
 *    - 결과를 세션 결과 hash에 Task별로 기록 (다른 Agent의 결과와 독립)
 * 4. 종료 신호: 실행 중 Task를 shutdownGraceMs까지 기다린 뒤 강제 종료, OFFLINE 보고
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>Backing Store 오류: 경고 로그 후 다음 주기에 재시도</li>
 *   <li>핸들러 예외: failed 결과로 기록, 루프는 계속</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class AgentWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(AgentWorker.class);

    public static final String PENDING_TASKS_KEY = "pending_tasks";

    private final AgentWorkerConfig config;
    private final MemoryCoordinator memory;
    private final TaskHandlerRegistry handlers;
    private final Clock clock;
    private final ExecutorService taskPool;
    private final ScheduledExecutorService heartbeatScheduler;
    private final TaskHandler healthCheckHandler;
    private final SharedContext context = new SharedContext();

    private final Map<String, FutureTask<Void>> currentTasks = new ConcurrentHashMap<>();
    private final AtomicInteger tasksCompleted = new AtomicInteger();
    private final AtomicInteger tasksFailed = new AtomicInteger();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean running;
    private volatile Instant startedAt;

    /**
     * 생성자.
     *
     * @param config 워커 설정
     * @param memory Memory Coordinator
     * @param handlers 핸들러 레지스트리
     * @param clock 시계
     */
    public AgentWorker(AgentWorkerConfig config, MemoryCoordinator memory, TaskHandlerRegistry handlers, Clock clock) {
        this(
            config, memory, handlers, clock,
            Executors.newFixedThreadPool(config.maxTasks(), namedThreads("swarm-task-" + config.agentId() + "-")),
            Executors.newSingleThreadScheduledExecutor(namedThreads("swarm-heartbeat-" + config.agentId() + "-"))
        );
    }

    AgentWorker(
        AgentWorkerConfig config,
        MemoryCoordinator memory,
        TaskHandlerRegistry handlers,
        Clock clock,
        ExecutorService taskPool,
        ScheduledExecutorService heartbeatScheduler
    ) {
        if (config == null || memory == null || handlers == null || clock == null) {
            throw new IllegalArgumentException("config, memory, handlers and clock cannot be null");
        }
        if (taskPool == null || heartbeatScheduler == null) {
            throw new IllegalArgumentException("taskPool and heartbeatScheduler cannot be null");
        }
        this.config = config;
        this.memory = memory;
        this.handlers = handlers;
        this.clock = clock;
        this.taskPool = taskPool;
        this.heartbeatScheduler = heartbeatScheduler;
        this.healthCheckHandler = new HealthCheckHandler(this::statusSnapshot);
    }

    @Override
    public void run() {
        start();
        try {
            while (running) {
                try {
                    pollOnce();
                } catch (RuntimeException e) {
                    log.error("Worker loop error (agent: {})", config.agentId(), e);
                }
                if (stopSignal.await(config.pollIntervalMs(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Agent worker {} interrupted", config.agentId());
        } finally {
            shutdownGracefully();
            stopped.countDown();
        }
    }

    /**
     * 등록 후 heartbeat 루프 시작.
     */
    void start() {
        startedAt = clock.instant();
        running = true;
        register();
        heartbeatScheduler.scheduleWithFixedDelay(
            this::safeHeartbeat, 0, config.heartbeatIntervalMs(), TimeUnit.MILLISECONDS
        );
        log.info("Agent worker started: {} ({}, capabilities: {}, max tasks: {})",
            config.agentId(), config.name(), config.capabilities(), config.maxTasks());
    }

    /**
     * 종료 요청. 실행 루프는 다음 주기 전에 빠져나와 정상 종료 절차를 밟습니다.
     */
    public void requestShutdown() {
        running = false;
        stopSignal.countDown();
    }

    /**
     * {@link #run()}이 종료 절차를 마칠 때까지 대기.
     *
     * @return 시간 안에 종료되었으면 true
     */
    public boolean awaitStopped(long timeoutMs) throws InterruptedException {
        return stopped.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /**
     * pending Task를 한 번 조회하여 처리 가능한 Task를 선점하고 실행.
     *
     * @return 선점한 Task 수
     */
    int pollOnce() {
        if (!running) {
            return 0;
        }
        int capacity = config.maxTasks() - currentTasks.size();
        if (capacity <= 0) {
            return 0;
        }

        List<PendingTask> pending;
        try {
            pending = memory.getContextList(config.sessionId(), PENDING_TASKS_KEY, PendingTask.class);
        } catch (StoreException e) {
            log.warn("Could not read pending tasks (agent: {}): {}", config.agentId(), e.getMessage());
            return 0;
        }

        int accepted = 0;
        for (PendingTask task : pending) {
            if (accepted >= capacity) {
                break;
            }
            Optional<TaskHandler> handler = canHandle(task) ? resolveHandler(task.type()) : Optional.empty();
            if (handler.isEmpty() || !claim(task)) {
                continue;
            }
            if (accept(task, handler.get())) {
                accepted++;
            }
        }
        return accepted;
    }

    private boolean canHandle(PendingTask task) {
        if (task.id() == null || task.id().isBlank() || task.type() == null) {
            return false;
        }
        if (currentTasks.containsKey(task.id())) {
            return false;
        }
        if (task.isAssigned() && !task.assignedAgent().equals(config.agentId().getValue())) {
            return false;
        }
        return task.requiredCapabilities().isEmpty()
            || !Collections.disjoint(task.requiredCapabilities(), config.capabilities());
    }

    private Optional<TaskHandler> resolveHandler(String taskType) {
        Optional<TaskHandler> registered = handlers.find(taskType);
        if (registered.isPresent()) {
            return registered;
        }
        if (HealthCheckHandler.TASK_TYPE.equals(taskType)
            && (config.capabilities().contains("monitoring") || config.capabilities().contains("health_check"))) {
            return Optional.of(healthCheckHandler);
        }
        return Optional.empty();
    }

    private boolean claim(PendingTask task) {
        try {
            return memory.claimTask(config.sessionId(), task.id(), config.agentId());
        } catch (StoreException e) {
            log.warn("Could not claim task {} (agent: {}): {}", task.id(), config.agentId(), e.getMessage());
            return false;
        }
    }

    private boolean accept(PendingTask task, TaskHandler handler) {
        FutureTask<Void> execution = new FutureTask<>(() -> executeSafely(task, handler), null);
        currentTasks.put(task.id(), execution);
        try {
            taskPool.execute(execution);
            return true;
        } catch (RejectedExecutionException e) {
            currentTasks.remove(task.id());
            log.warn("Task pool rejected task {} (agent: {})", task.id(), config.agentId());
            return false;
        }
    }

    private void executeSafely(PendingTask task, TaskHandler handler) {
        try {
            execute(task, handler);
        } catch (RuntimeException e) {
            log.error("Unexpected error running task {} (agent: {})", task.id(), config.agentId(), e);
        }
    }

    private void execute(PendingTask task, TaskHandler handler) {
        Instant taskStartedAt = clock.instant();
        log.info("Agent {} executing task {} ({})", config.agentId(), task.id(), task.type());
        TaskResultRecord record;
        try {
            Map<String, Object> result = handler.execute(task.parameters(), context);
            tasksCompleted.incrementAndGet();
            record = TaskResultRecord.completed(config.agentId().getValue(), result, taskStartedAt, clock.instant());
            log.info("Task {} completed on agent {}", task.id(), config.agentId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            tasksFailed.incrementAndGet();
            record = TaskResultRecord.failed(config.agentId().getValue(), "Task interrupted", taskStartedAt, clock.instant());
            log.warn("Task {} interrupted on agent {}", task.id(), config.agentId());
        } catch (Exception e) {
            tasksFailed.incrementAndGet();
            record = TaskResultRecord.failed(config.agentId().getValue(), describe(e), taskStartedAt, clock.instant());
            log.warn("Task {} failed on agent {}: {}", task.id(), config.agentId(), describe(e));
        }
        try {
            writeResult(task.id(), record);
        } finally {
            currentTasks.remove(task.id());
        }
    }

    private void writeResult(String taskId, TaskResultRecord record) {
        try {
            memory.putTaskResult(config.sessionId(), taskId, record);
        } catch (StoreException e) {
            log.warn("Could not store result of task {} (agent: {}): {}", taskId, config.agentId(), e.getMessage());
        }
    }

    private void register() {
        AgentRegistration registration = AgentRegistration.of(
            config.agentId().getValue(),
            config.sessionId().getValue(),
            config.name(),
            config.capabilities(),
            config.maxTasks(),
            config.resourceLimits(),
            config.launchMode()
        );
        try {
            memory.registerAgent(config.sessionId(), registration);
        } catch (StoreException e) {
            log.warn("Could not register agent {}: {}", config.agentId(), e.getMessage());
        }
    }

    /**
     * heartbeat 전송. 등록 정보가 만료되었으면 다시 등록합니다.
     *
     * @return 등록된 Agent의 heartbeat를 갱신했으면 true
     */
    boolean sendHeartbeat() {
        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(AgentRegistration.STATUS, currentTasks.isEmpty() ? AgentStatus.IDLE : AgentStatus.BUSY);
        patch.put(AgentRegistration.CURRENT_TASKS, List.copyOf(currentTasks.keySet()));
        patch.put(AgentRegistration.TASKS_COMPLETED, tasksCompleted.get());
        patch.put(AgentRegistration.TASKS_FAILED, tasksFailed.get());
        patch.put(AgentRegistration.METRICS, Map.of("uptime_seconds", uptimeSeconds()));
        boolean updated = memory.updateAgentHeartbeat(config.sessionId(), config.agentId(), patch);
        if (!updated && running) {
            register();
        }
        return updated;
    }

    private void safeHeartbeat() {
        try {
            sendHeartbeat();
        } catch (StoreException e) {
            log.warn("Heartbeat failed (agent: {}): {}", config.agentId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected heartbeat error (agent: {})", config.agentId(), e);
        }
    }

    /**
     * 실행 중 Task를 grace 기간까지 기다린 뒤 강제 종료하고 OFFLINE 보고.
     */
    void shutdownGracefully() {
        running = false;
        taskPool.shutdown();
        try {
            if (!taskPool.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Agent {} force stopping {} task(s) after {}ms grace period",
                    config.agentId(), currentTasks.size(), config.shutdownGraceMs());
                taskPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            taskPool.shutdownNow();
        }
        heartbeatScheduler.shutdownNow();
        try {
            heartbeatScheduler.awaitTermination(config.heartbeatIntervalMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        Map<String, Object> patch = new LinkedHashMap<>();
        patch.put(AgentRegistration.STATUS, AgentStatus.OFFLINE);
        patch.put(AgentRegistration.CURRENT_TASKS, List.of());
        patch.put(AgentRegistration.TASKS_COMPLETED, tasksCompleted.get());
        patch.put(AgentRegistration.TASKS_FAILED, tasksFailed.get());
        try {
            memory.updateAgentHeartbeat(config.sessionId(), config.agentId(), patch);
        } catch (StoreException e) {
            log.warn("Could not report offline status (agent: {}): {}", config.agentId(), e.getMessage());
        }
        log.info("Agent worker stopped: {} (completed: {}, failed: {})",
            config.agentId(), tasksCompleted.get(), tasksFailed.get());
    }

    private Map<String, Object> statusSnapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("agent_id", config.agentId().getValue());
        snapshot.put("current_tasks", currentTasks.size());
        snapshot.put("tasks_completed", tasksCompleted.get());
        snapshot.put("tasks_failed", tasksFailed.get());
        snapshot.put("uptime_seconds", uptimeSeconds());
        snapshot.put("checked_at", clock.instant().toString());
        return snapshot;
    }

    private long uptimeSeconds() {
        Instant started = startedAt;
        return started == null ? 0 : Duration.between(started, clock.instant()).toSeconds();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    public boolean isRunning() {
        return running;
    }

    public List<String> currentTaskIds() {
        return List.copyOf(currentTasks.keySet());
    }

    public int tasksCompleted() {
        return tasksCompleted.get();
    }

    public int tasksFailed() {
        return tasksFailed.get();
    }

    public AgentWorkerConfig getConfig() {
        return config;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
