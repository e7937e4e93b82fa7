package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.application.memory.AgentRecord;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.application.memory.MemoryEventType;
import com.ryuqq.swarm.application.memory.SessionRecord;
import com.ryuqq.swarm.application.orchestrator.AgentDefinition;
import com.ryuqq.swarm.application.orchestrator.Orchestrator;
import com.ryuqq.swarm.application.orchestrator.SessionStatusView;
import com.ryuqq.swarm.application.orchestrator.TaskDefinition;
import com.ryuqq.swarm.application.orchestrator.TaskSnapshot;
import com.ryuqq.swarm.application.runtime.Runtime;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.handler.TaskHandler;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.model.Agent;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.RetryPolicy;
import com.ryuqq.swarm.core.model.Session;
import com.ryuqq.swarm.core.model.SessionConfig;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.model.Task;
import com.ryuqq.swarm.core.model.TaskId;
import com.ryuqq.swarm.core.outcome.Fail;
import com.ryuqq.swarm.core.outcome.Ok;
import com.ryuqq.swarm.core.outcome.Outcome;
import com.ryuqq.swarm.core.outcome.Retry;
import com.ryuqq.swarm.core.statemachine.SessionStatus;
import com.ryuqq.swarm.core.statemachine.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntToLongFunction;

/**
 * Orchestrator 구현체 (조정 루프 + 제한된 워커 풀).
 *
 * <p>세션을 Task로 분해하고 준비된 Task를 capability가 맞는 IDLE Agent에 할당하여
 * 워커 풀에서 실행합니다. 모든 세션을 하나의 조정 루프가 고정 주기로 구동합니다.</p>
 *
 * <p><strong>조정 tick (세션별, 세션 잠금 안):</strong></p>
 * <pre>
 * 1. ACTIVE가 아니면 건너뜀
 * 2. Agent liveness 갱신
 * 3. taskTimeout을 넘긴 IN_PROGRESS Task 실패 처리 (재시도 경로)
 * 4. ready set 계산 → priority 내림차순, 생성 순서 → first-match Agent 할당
 * 5. 진행률 재계산
 * 6. 모든 Task가 종료 상태면 COMPLETED
 * 잠금 밖: 할당된 Task를 워커 풀에 제출, Memory Coordinator로 미러링 (세션, 진행률, Agent)
 * </pre>
 *
 * <p><strong>실행 (워커 풀):</strong></p>
 * <pre>
 * ASSIGNED + attempt 일치 확인 → IN_PROGRESS
 *   ↓ (잠금 밖)
 * handler.execute(parameters, sharedContext)
 *   ↓ (잠금 안)
 * attempt가 바뀌었으면 결과 폐기
 * 세션이 ACTIVE가 아니면 CANCELLED
 * 성공 → COMPLETED (Ok)
 * 실패 → retryCount++ → QUEUED (Retry) 또는 FAILED (Fail)
 * Agent는 항상 IDLE로 복귀
 * </pre>
 *
 * <p><strong>오류 처리:</strong></p>
 * <ul>
 *   <li>핸들러 오류: Outcome으로 기록, 조정 루프로 전파되지 않음</li>
 *   <li>Backing Store 오류: 경고 로그, 메모리 상태로 계속 진행</li>
 *   <li>세션 처리 중 예기치 않은 예외: 해당 세션만 FAILED, 루프는 계속</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class CoordinatorRunner implements Orchestrator, Runtime {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorRunner.class);

    /**
     * 상태 변화가 없는 Agent의 heartbeat 기록 주기 (기본 freshness 60초의 절반).
     */
    private static final long AGENT_HEARTBEAT_MIRROR_MS = 30000;

    private final TaskHandlerRegistry handlers;
    private final MemoryCoordinator memory;
    private final CoordinatorConfig config;
    private final ReaperConfig reaperConfig;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ExecutorService workerPool;
    private final ScheduledExecutorService scheduler;
    private final SessionRegistry registry = new SessionRegistry();
    private final SessionReaper reaper;

    private final Object loopMonitor = new Object();
    private ScheduledFuture<?> loop;
    private volatile boolean shutdown;
    private volatile Instant nextReapAt;

    /**
     * 기본 설정으로 생성.
     *
     * @param handlers 핸들러 레지스트리
     * @param memory Memory Coordinator
     */
    public CoordinatorRunner(TaskHandlerRegistry handlers, MemoryCoordinator memory) {
        this(handlers, memory, new CoordinatorConfig(), new ReaperConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param handlers 핸들러 레지스트리
     * @param memory Memory Coordinator
     * @param config 설정
     * @param reaperConfig 세션 정리 설정
     * @param clock 시계
     */
    public CoordinatorRunner(
        TaskHandlerRegistry handlers,
        MemoryCoordinator memory,
        CoordinatorConfig config,
        ReaperConfig reaperConfig,
        Clock clock
    ) {
        this(handlers, memory, config, reaperConfig, new BackoffCalculator(), clock,
            Executors.newFixedThreadPool(config.workerPoolSize(), namedThreads("swarm-worker-")),
            Executors.newSingleThreadScheduledExecutor(namedThreads("swarm-coordinator")));
    }

    /**
     * 생성자 (실행기 주입).
     *
     * @param workerPool Task 실행 풀 (shutdown 시 함께 종료)
     * @param scheduler 조정 루프 스케줄러 (shutdown 시 함께 종료)
     */
    CoordinatorRunner(
        TaskHandlerRegistry handlers,
        MemoryCoordinator memory,
        CoordinatorConfig config,
        ReaperConfig reaperConfig,
        BackoffCalculator backoffCalculator,
        Clock clock,
        ExecutorService workerPool,
        ScheduledExecutorService scheduler
    ) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (memory == null) {
            throw new IllegalArgumentException("memory cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (reaperConfig == null) {
            throw new IllegalArgumentException("reaperConfig cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (workerPool == null) {
            throw new IllegalArgumentException("workerPool cannot be null");
        }
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.handlers = handlers;
        this.memory = memory;
        this.config = config;
        this.reaperConfig = reaperConfig;
        this.backoffCalculator = backoffCalculator;
        this.clock = clock;
        this.workerPool = workerPool;
        this.scheduler = scheduler;
        this.reaper = new SessionReaper(registry, memory, config.sessionRetentionMs(), clock);
        this.nextReapAt = clock.instant().plusMillis(reaperConfig.scanIntervalMs());
    }

    // ============================================================
    // Orchestrator
    // ============================================================

    @Override
    public SessionId createSession(
        String name,
        List<TaskDefinition> tasks,
        List<AgentDefinition> agents,
        SessionConfig sessionConfig
    ) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Session name cannot be null or blank");
        }
        if (tasks == null) {
            throw new ValidationException("Task definitions cannot be null");
        }
        SessionConfig effectiveConfig = sessionConfig != null ? sessionConfig : config.defaultSessionConfig();
        SessionId sessionId = SessionId.generate();
        Instant now = clock.instant();

        List<Task> builtTasks = buildTasks(sessionId, tasks, now);
        List<Agent> builtAgents = agents == null || agents.isEmpty()
            ? synthesizeAgents(sessionId, builtTasks, effectiveConfig, now)
            : buildAgents(agents, builtTasks, effectiveConfig, now);

        SharedContext sharedContext = new SharedContext();
        sharedContext.onChange((key, value) -> mirrorContext(sessionId, key, value));
        Session session = new Session(sessionId, name, effectiveConfig, builtTasks, builtAgents, sharedContext, now);
        SessionContext context = new SessionContext(session);
        registry.register(context);

        SessionRecord record = SessionRecord.from(session);
        try {
            memory.createSession(record);
        } catch (StoreException e) {
            log.warn("Failed to mirror new session {}: {}", sessionId, e.getMessage());
        }
        synchronized (context.mirrorMonitor()) {
            mirrorAgents(context, record);
        }
        log.info("Session created: {} ({}, tasks: {}, agents: {})",
            sessionId, name, builtTasks.size(), builtAgents.size());
        return sessionId;
    }

    @Override
    public boolean startSession(SessionId sessionId) {
        Optional<SessionContext> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        SessionContext context = found.get();
        context.lock().lock();
        try {
            if (context.session().getStatus() != SessionStatus.INITIALIZING) {
                log.warn("Session {} cannot be started from {}", sessionId, context.session().getStatus());
                return false;
            }
            context.session().start(clock.instant());
        } finally {
            context.lock().unlock();
        }
        mirror(context);
        ensureLoopRunning();
        log.info("Session started: {}", sessionId);
        return true;
    }

    @Override
    public boolean stopSession(SessionId sessionId) {
        Optional<SessionContext> found = registry.find(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        SessionContext context = found.get();
        context.lock().lock();
        try {
            if (context.session().getStatus().isTerminal()) {
                return false;
            }
            context.session().cancel(clock.instant());
        } finally {
            context.lock().unlock();
        }
        mirror(context);
        log.info("Session cancelled: {}", sessionId);
        return true;
    }

    @Override
    public Optional<SessionStatusView> getSessionStatus(SessionId sessionId) {
        return registry.find(sessionId).map(context -> {
            context.lock().lock();
            try {
                return SessionStatusView.from(context.session());
            } finally {
                context.lock().unlock();
            }
        });
    }

    @Override
    public List<TaskSnapshot> listTasks(SessionId sessionId) {
        return registry.find(sessionId).map(context -> {
            context.lock().lock();
            try {
                return context.session().getTasks().stream().map(TaskSnapshot::from).toList();
            } finally {
                context.lock().unlock();
            }
        }).orElseGet(List::of);
    }

    /**
     * 조정 루프 중단 후 실행 중 Task를 shutdownTimeoutMs 동안 대기.
     *
     * <p>시간 안에 끝나지 않으면 워커 풀을 강제 종료합니다 (인터럽트).</p>
     *
     * @throws InterruptedException 대기 중 인터럽트 발생 시
     */
    @Override
    public void shutdown() throws InterruptedException {
        shutdown = true;
        synchronized (loopMonitor) {
            if (loop != null) {
                loop.cancel(false);
                loop = null;
            }
        }
        scheduler.shutdown();
        workerPool.shutdown();
        if (!workerPool.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker pool did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerPool.shutdownNow();
        }
        if (!scheduler.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Coordinator runner shut down ({} session(s) in memory)", registry.size());
    }

    // ============================================================
    // Runtime
    // ============================================================

    @Override
    public void pump() {
        for (SessionContext context : registry.all()) {
            try {
                tick(context);
            } catch (RuntimeException e) {
                log.error("Unexpected failure while coordinating session {}", context.session().getId(), e);
                failSession(context, e);
            }
        }
        reapIfDue();
    }

    private void ensureLoopRunning() {
        if (!config.selfScheduling() || shutdown) {
            return;
        }
        synchronized (loopMonitor) {
            if (loop == null) {
                loop = scheduler.scheduleWithFixedDelay(
                    this::safePump, 0, config.tickIntervalMs(), TimeUnit.MILLISECONDS
                );
                log.info("Coordination loop started (tick: {}ms)", config.tickIntervalMs());
            }
        }
    }

    private void safePump() {
        try {
            pump();
        } catch (RuntimeException e) {
            log.error("Coordination tick failed", e);
        }
    }

    private void reapIfDue() {
        Instant now = clock.instant();
        if (now.isBefore(nextReapAt)) {
            return;
        }
        nextReapAt = now.plusMillis(reaperConfig.scanIntervalMs());
        try {
            reaper.scan();
        } catch (RuntimeException e) {
            log.error("Session reaper scan failed", e);
        }
    }

    /**
     * 세션 하나에 대한 조정 tick.
     */
    private void tick(SessionContext context) {
        Session session = context.session();
        List<Dispatch> dispatches = new ArrayList<>();
        List<TimedOut> timedOut = new ArrayList<>();
        boolean completed = false;

        context.lock().lock();
        try {
            if (session.getStatus() != SessionStatus.ACTIVE) {
                return;
            }
            Instant now = clock.instant();
            session.refreshAgentLiveness(now);
            failTimedOutTasks(context, now, timedOut);

            for (Task task : session.readyTasks(now)) {
                Optional<Agent> agent = session.findIdleAgent(task.getRequiredCapabilities());
                if (agent.isEmpty()) {
                    continue;
                }
                int attempt = session.assign(task, agent.get(), now);
                dispatches.add(new Dispatch(task.getId(), task.getType(), agent.get().getId(), attempt));
                log.debug("Task {} assigned to {} (attempt {})", task.getId(), agent.get().getId(), attempt);
            }

            session.recomputeProgress();
            if (session.allTasksTerminal()) {
                session.complete(now);
                completed = true;
            }
        } finally {
            context.lock().unlock();
        }

        for (TimedOut expired : timedOut) {
            if (expired.future() != null) {
                expired.future().cancel(true);
            }
            handleOutcome(context, expired.outcome(), expired.agentId());
        }
        for (Dispatch dispatch : dispatches) {
            emit(context, MemoryEventType.TASK_ASSIGNED, taskEventData(dispatch.taskId(), dispatch.agentId()), dispatch.agentId());
            submit(context, dispatch);
        }
        if (completed) {
            log.info("Session completed: {} ({})", session.getId(), session.getProgress());
        }
        mirror(context);
    }

    private void failTimedOutTasks(SessionContext context, Instant now, List<TimedOut> timedOut) {
        Session session = context.session();
        long timeoutMs = session.getConfig().taskTimeoutMs();
        for (Task task : session.getTasks()) {
            if (task.getStatus() != TaskStatus.IN_PROGRESS || task.getStartedAt() == null) {
                continue;
            }
            if (!task.getStartedAt().plusMillis(timeoutMs).isBefore(now)) {
                continue;
            }
            AgentId agentId = task.getAssignedAgent();
            Outcome outcome = task.fail(
                "Task timed out after " + timeoutMs + "ms", now, retryDelay(session.getConfig().retryPolicy())
            );
            session.findAgent(agentId).ifPresent(agent -> {
                agent.recordFailure();
                agent.release();
            });
            session.markChanged();
            timedOut.add(new TimedOut(outcome, agentId, context.runningExecutions().remove(task.getId())));
        }
    }

    private void submit(SessionContext context, Dispatch dispatch) {
        FutureTask<Void> execution = new FutureTask<>(() -> runExecution(context, dispatch), null);
        context.runningExecutions().put(dispatch.taskId(), execution);
        try {
            workerPool.execute(execution);
        } catch (RejectedExecutionException e) {
            context.runningExecutions().remove(dispatch.taskId(), execution);
            log.warn("Worker pool rejected task {}, returning it to the queue", dispatch.taskId());
            revertAssignment(context, dispatch);
        }
    }

    private void revertAssignment(SessionContext context, Dispatch dispatch) {
        Session session = context.session();
        context.lock().lock();
        try {
            Optional<Task> task = session.findTask(dispatch.taskId());
            if (task.isPresent() && task.get().getStatus() == TaskStatus.ASSIGNED
                && task.get().getAttempt() == dispatch.attempt()) {
                task.get().unassign(clock.instant());
                session.findAgent(dispatch.agentId()).ifPresent(Agent::release);
                session.markChanged();
            }
        } finally {
            context.lock().unlock();
        }
    }

    // ============================================================
    // 실행
    // ============================================================

    private void runExecution(SessionContext context, Dispatch dispatch) {
        try {
            execute(context, dispatch);
        } catch (RuntimeException e) {
            log.error("Execution of task {} failed unexpectedly", dispatch.taskId(), e);
        }
    }

    private void execute(SessionContext context, Dispatch dispatch) {
        Session session = context.session();
        TaskHandler handler;
        Map<String, Object> parameters;

        context.lock().lock();
        try {
            Optional<Task> task = session.findTask(dispatch.taskId());
            if (task.isEmpty() || task.get().getStatus() != TaskStatus.ASSIGNED
                || task.get().getAttempt() != dispatch.attempt()) {
                log.debug("Skipping stale execution of {} (attempt {})", dispatch.taskId(), dispatch.attempt());
                return;
            }
            handler = handlers.require(task.get().getType());
            parameters = task.get().getParameters();
            task.get().start(clock.instant());
            session.markChanged();
        } finally {
            context.lock().unlock();
        }
        mirror(context);

        Map<String, Object> result = null;
        Exception error = null;
        try {
            result = handler.execute(parameters, session.getSharedContext());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = e;
        } catch (Exception e) {
            error = e;
        }

        Outcome outcome = recordResult(context, dispatch, result, error);
        if (outcome != null) {
            handleOutcome(context, outcome, dispatch.agentId());
            mirror(context);
        }
    }

    /**
     * 실행 결과 반영. 결과가 폐기되면 null.
     */
    private Outcome recordResult(SessionContext context, Dispatch dispatch, Map<String, Object> result, Exception error) {
        Session session = context.session();
        context.lock().lock();
        try {
            Optional<Task> found = session.findTask(dispatch.taskId());
            if (found.isEmpty() || found.get().getStatus() != TaskStatus.IN_PROGRESS
                || found.get().getAttempt() != dispatch.attempt()) {
                log.debug("Discarding late result of {} (attempt {})", dispatch.taskId(), dispatch.attempt());
                return null;
            }
            Task task = found.get();
            Optional<Agent> agent = session.findAgent(dispatch.agentId());
            Instant now = clock.instant();
            context.runningExecutions().remove(task.getId());

            if (session.getStatus() != SessionStatus.ACTIVE) {
                task.cancel(now);
                agent.ifPresent(Agent::release);
                session.recomputeProgress();
                session.markChanged();
                log.debug("Result of {} discarded, session {} is {}", task.getId(), session.getId(), session.getStatus());
                return null;
            }

            Outcome outcome;
            if (error == null) {
                outcome = task.complete(result, now);
                agent.ifPresent(Agent::recordCompletion);
            } else {
                outcome = task.fail(describe(error), now, retryDelay(session.getConfig().retryPolicy()));
                agent.ifPresent(Agent::recordFailure);
            }
            agent.ifPresent(Agent::release);
            session.recomputeProgress();
            session.markChanged();
            return outcome;
        } finally {
            context.lock().unlock();
        }
    }

    private void handleOutcome(SessionContext context, Outcome outcome, AgentId agentId) {
        if (outcome instanceof Ok) {
            log.debug("Task {} completed", outcome.taskId());
            emit(context, MemoryEventType.TASK_COMPLETED, taskEventData(outcome.taskId(), agentId), agentId);
        } else if (outcome instanceof Retry retry) {
            log.warn("Task {} failed (retry {}), requeued after {}ms: {}",
                retry.taskId(), retry.retryCount(), retry.nextRetryAfterMillis(), retry.reason());
            Map<String, Object> data = taskEventData(retry.taskId(), agentId);
            data.put("error", retry.reason());
            data.put("retry_count", retry.retryCount());
            data.put("terminal", false);
            emit(context, MemoryEventType.TASK_FAILED, data, agentId);
        } else if (outcome instanceof Fail fail) {
            log.warn("Task {} failed permanently: {} - {}", fail.taskId(), fail.errorCode(), fail.message());
            Map<String, Object> data = taskEventData(fail.taskId(), agentId);
            data.put("error", fail.message());
            data.put("error_code", fail.errorCode());
            data.put("terminal", true);
            emit(context, MemoryEventType.TASK_FAILED, data, agentId);
        }
    }

    private IntToLongFunction retryDelay(RetryPolicy policy) {
        return retryCount -> switch (policy) {
            case IMMEDIATE -> 0L;
            case FIXED -> backoffCalculator.getBaseDelayMs();
            case EXPONENTIAL -> backoffCalculator.calculate(retryCount);
        };
    }

    private void failSession(SessionContext context, RuntimeException cause) {
        Session session = context.session();
        context.lock().lock();
        try {
            if (session.getStatus().isTerminal()) {
                return;
            }
            session.fail(clock.instant(), describe(cause));
        } catch (RuntimeException e) {
            log.error("Could not mark session {} as failed", session.getId(), e);
            return;
        } finally {
            context.lock().unlock();
        }
        try {
            mirror(context);
        } catch (RuntimeException e) {
            log.error("Could not mirror failed session {}", session.getId(), e);
        }
    }

    // ============================================================
    // 미러링
    // ============================================================

    /**
     * 세션 스냅샷을 Memory Coordinator에 기록. 더 최신 버전이 이미 기록되었으면 건너뜁니다.
     *
     * <p>Agent 등록 정보는 세션 버전과 별도로 동기화합니다. heartbeat는 세션 버전을 올리지 않기
     * 때문입니다.</p>
     */
    private void mirror(SessionContext context) {
        SessionRecord snapshot;
        context.lock().lock();
        try {
            snapshot = SessionRecord.from(context.session());
        } finally {
            context.lock().unlock();
        }
        synchronized (context.mirrorMonitor()) {
            if (snapshot.version() < context.lastMirroredVersion()) {
                return;
            }
            if (snapshot.version() > context.lastMirroredVersion()) {
                try {
                    memory.updateSession(snapshot);
                    memory.updateProgress(context.session().getId(), snapshot.progress());
                    context.lastMirroredVersion(snapshot.version());
                } catch (StoreException e) {
                    log.warn("Failed to mirror session {} (version {}): {}",
                        snapshot.id(), snapshot.version(), e.getMessage());
                }
            }
            mirrorAgents(context, snapshot);
        }
    }

    /**
     * 상태가 바뀌었거나 heartbeat가 오래된 Agent만 기록. 등록 정보가 없으면 다시 등록합니다.
     * mirrorMonitor를 보유한 상태에서 호출합니다.
     */
    private void mirrorAgents(SessionContext context, SessionRecord snapshot) {
        SessionId sessionId = context.session().getId();
        for (AgentRecord agent : snapshot.agents()) {
            AgentRecord last = context.mirroredAgents().get(agent.id());
            if (agent.sameState(last) && !heartbeatDue(last, agent)) {
                continue;
            }
            try {
                AgentId agentId = AgentId.of(agent.id());
                if (!memory.updateAgent(sessionId, agentId, agent.statePatch())) {
                    memory.registerAgent(sessionId, agent.toRegistration(sessionId.getValue()));
                    memory.updateAgent(sessionId, agentId, agent.statePatch());
                }
                context.mirroredAgents().put(agent.id(), agent);
            } catch (StoreException e) {
                log.warn("Failed to mirror agent {} (session {}): {}", agent.id(), sessionId, e.getMessage());
            }
        }
    }

    private static boolean heartbeatDue(AgentRecord last, AgentRecord current) {
        if (last.lastHeartbeat() == null || current.lastHeartbeat() == null) {
            return current.lastHeartbeat() != null;
        }
        return !current.lastHeartbeat().isBefore(last.lastHeartbeat().plusMillis(AGENT_HEARTBEAT_MIRROR_MS));
    }

    private void mirrorContext(SessionId sessionId, String key, Object value) {
        try {
            memory.setContext(sessionId, key, value);
        } catch (StoreException e) {
            log.warn("Failed to mirror shared context key {} (session {}): {}", key, sessionId, e.getMessage());
        }
    }

    private void emit(SessionContext context, MemoryEventType type, Map<String, Object> data, AgentId agentId) {
        try {
            memory.emitEvent(type, context.session().getId(), data, agentId == null ? null : agentId.getValue());
        } catch (StoreException e) {
            log.warn("Failed to emit {} for session {}: {}", type, context.session().getId(), e.getMessage());
        }
    }

    private static Map<String, Object> taskEventData(TaskId taskId, AgentId agentId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", taskId.getValue());
        data.put("agent_id", agentId == null ? null : agentId.getValue());
        return data;
    }

    // ============================================================
    // 세션 구성
    // ============================================================

    private List<Task> buildTasks(SessionId sessionId, List<TaskDefinition> definitions, Instant now) {
        Map<String, TaskDefinition> byKey = new LinkedHashMap<>();
        for (int i = 0; i < definitions.size(); i++) {
            TaskDefinition definition = definitions.get(i);
            if (definition == null) {
                throw new ValidationException("Task definition at index " + i + " is null");
            }
            String key = definition.key() != null ? definition.key() : "task" + i;
            if (byKey.putIfAbsent(key, definition) != null) {
                throw new ValidationException("Duplicate task key: " + key);
            }
        }

        Map<String, Set<String>> capabilities = new HashMap<>();
        for (Map.Entry<String, TaskDefinition> entry : byKey.entrySet()) {
            TaskDefinition definition = entry.getValue();
            handlers.require(definition.type());
            Set<String> required = definition.requiredCapabilities().isEmpty()
                ? handlers.capabilitiesFor(definition.type())
                : definition.requiredCapabilities();
            if (required.isEmpty()) {
                throw new ValidationException("Task " + entry.getKey() + " has no required capabilities");
            }
            capabilities.put(entry.getKey(), required);
            for (String dependency : definition.dependencies()) {
                if (!byKey.containsKey(dependency)) {
                    throw new ValidationException(
                        "Task " + entry.getKey() + " depends on unknown task: " + dependency
                    );
                }
            }
        }
        rejectCycles(byKey);

        List<Task> tasks = new ArrayList<>();
        int sequence = 0;
        for (Map.Entry<String, TaskDefinition> entry : byKey.entrySet()) {
            TaskDefinition definition = entry.getValue();
            Set<TaskId> dependencies = new LinkedHashSet<>();
            for (String dependency : definition.dependencies()) {
                dependencies.add(taskId(sessionId, dependency));
            }
            tasks.add(new Task(
                taskId(sessionId, entry.getKey()),
                entry.getKey(),
                sequence++,
                definition.type(),
                definition.parameters(),
                definition.priority(),
                capabilities.get(entry.getKey()),
                dependencies,
                definition.maxRetries(),
                now
            ));
        }
        return tasks;
    }

    /**
     * 의존성 순환 검사 (Kahn 알고리즘).
     */
    private static void rejectCycles(Map<String, TaskDefinition> byKey) {
        Map<String, Integer> pending = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Map.Entry<String, TaskDefinition> entry : byKey.entrySet()) {
            Set<String> distinct = new HashSet<>(entry.getValue().dependencies());
            pending.put(entry.getKey(), distinct.size());
            for (String dependency : distinct) {
                dependents.computeIfAbsent(dependency, ignored -> new ArrayList<>()).add(entry.getKey());
            }
        }
        Deque<String> ready = new ArrayDeque<>();
        pending.forEach((key, count) -> {
            if (count == 0) {
                ready.add(key);
            }
        });
        int resolved = 0;
        while (!ready.isEmpty()) {
            String key = ready.poll();
            resolved++;
            for (String dependent : dependents.getOrDefault(key, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (resolved != byKey.size()) {
            List<String> cyclic = new ArrayList<>();
            pending.forEach((key, count) -> {
                if (count > 0) {
                    cyclic.add(key);
                }
            });
            throw new ValidationException("Dependency cycle among tasks: " + cyclic);
        }
    }

    private List<Agent> buildAgents(
        List<AgentDefinition> definitions,
        List<Task> tasks,
        SessionConfig sessionConfig,
        Instant now
    ) {
        if (definitions.size() > sessionConfig.maxAgents()) {
            throw new ValidationException(
                "Too many agents: " + definitions.size() + " (maxAgents: " + sessionConfig.maxAgents() + ")"
            );
        }
        Map<AgentId, Agent> agents = new LinkedHashMap<>();
        for (AgentDefinition definition : definitions) {
            if (definition == null) {
                throw new ValidationException("Agent definition cannot be null");
            }
            if (definition.capabilities().isEmpty()) {
                throw new ValidationException("Agent " + definition.id() + " has no capabilities");
            }
            AgentId agentId = agentId(definition.id());
            String agentName = definition.name() == null || definition.name().isBlank()
                ? definition.id()
                : definition.name();
            Agent agent = new Agent(agentId, agentName, definition.capabilities(), definition.resourceLimits(), now);
            if (agents.putIfAbsent(agentId, agent) != null) {
                throw new ValidationException("Duplicate agent id: " + definition.id());
            }
        }
        for (Task task : tasks) {
            boolean covered = agents.values().stream().anyMatch(agent -> agent.canHandle(task.getRequiredCapabilities()));
            if (!covered) {
                throw new ValidationException(
                    "No agent covers capabilities " + task.getRequiredCapabilities() + " of task " + task.getKey()
                );
            }
        }
        return new ArrayList<>(agents.values());
    }

    /**
     * Task가 요구하는 capability마다 Agent 하나씩 합성.
     */
    private List<Agent> synthesizeAgents(SessionId sessionId, List<Task> tasks, SessionConfig sessionConfig, Instant now) {
        Set<String> capabilities = new LinkedHashSet<>();
        for (Task task : tasks) {
            capabilities.addAll(task.getRequiredCapabilities());
        }
        if (capabilities.size() > sessionConfig.maxAgents()) {
            throw new ValidationException(
                "Tasks require " + capabilities.size() + " distinct capabilities, more than maxAgents "
                    + sessionConfig.maxAgents()
            );
        }
        List<Agent> agents = new ArrayList<>();
        int index = 0;
        for (String capability : capabilities) {
            agents.add(new Agent(
                AgentId.of(sessionId.getValue() + "_agent_" + index++),
                "Agent-" + capability,
                Set.of(capability),
                null,
                now
            ));
        }
        return agents;
    }

    private static TaskId taskId(SessionId sessionId, String key) {
        try {
            return TaskId.of(sessionId, key);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid task key: " + key, e);
        }
    }

    private static AgentId agentId(String id) {
        try {
            return AgentId.of(id);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid agent id: " + id, e);
        }
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            String name = prefix.endsWith("-") ? prefix + counter.incrementAndGet() : prefix;
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Dispatch(TaskId taskId, String type, AgentId agentId, int attempt) {
    }

    private record TimedOut(Outcome outcome, AgentId agentId, Future<?> future) {
    }
}
