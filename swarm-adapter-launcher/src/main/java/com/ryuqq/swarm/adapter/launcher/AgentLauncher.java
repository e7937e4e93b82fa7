package com.ryuqq.swarm.adapter.launcher;

import com.ryuqq.swarm.adapter.launcher.SwarmConfig.AgentSpec;
import com.ryuqq.swarm.application.memory.AgentRegistration;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.error.AgentLaunchException;
import com.ryuqq.swarm.core.error.ResourceExhaustedException;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.error.UnsupportedLaunchModeException;
import com.ryuqq.swarm.core.error.ValidationException;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Agent 실행과 수명 관리.
 *
 * <p><strong>Launch 절차:</strong></p>
 * <pre>
 * 1. 설정 검증 (id/name/capabilities, 메모리 (0, 8192]MB, CPU (0, 100]%)  → ValidationException
 * 2. 같은 ID의 Agent가 STARTING/RUNNING이면 거부                          → ValidationException
 * 3. 리소스 검사 (가용 메모리 × headroom, 활성 Agent 수 &lt; maxAgents)     → ResourceExhaustedException
 * 4. 실행 모드별 시작 (PROCESS, IN_PROCESS / CONTAINER, REMOTE는 미지원)
 * 5. Memory Coordinator에 등록, 로컬 핸들 기록 (STARTING)
 * </pre>
 *
 * <p><strong>헬스 체크 (healthCheckIntervalMs 주기):</strong></p>
 * <ul>
 *   <li>핸들에서 CPU/메모리 측정</li>
 *   <li>시작 이후 heartbeat가 관측되면 STARTING → RUNNING</li>
 *   <li>프로세스가 종료되었거나 heartbeat가 heartbeatTimeoutMs 동안 없으면 FAILED (Memory Coordinator에는 ERROR)</li>
 *   <li>실패해도 자동 재시작하지 않음 ({@link #restartAgent(SessionId, String)} 사용)</li>
 * </ul>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class AgentLauncher {

    private static final Logger log = LoggerFactory.getLogger(AgentLauncher.class);

    private final MemoryCoordinator memory;
    private final LauncherConfig config;
    private final AgentTemplates templates;
    private final SystemResources systemResources;
    private final Clock clock;
    private final Map<LaunchMode, LaunchStrategy> strategies;
    private final ScheduledExecutorService scheduler;

    private final Map<String, ManagedAgent> agents = new ConcurrentHashMap<>();
    private final Object launchMonitor = new Object();
    private ScheduledFuture<?> healthLoop;
    private volatile boolean shutdown;

    /**
     * 기본 설정으로 생성.
     *
     * @param memory Memory Coordinator
     * @param handlers 스레드 모드 Agent가 사용할 핸들러 레지스트리
     */
    public AgentLauncher(MemoryCoordinator memory, TaskHandlerRegistry handlers) {
        this(memory, handlers, new LauncherConfig(), AgentTemplates.defaults(), new JvmSystemResources(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param memory Memory Coordinator
     * @param handlers 스레드 모드 Agent가 사용할 핸들러 레지스트리
     * @param config 설정
     * @param templates Agent 템플릿
     * @param systemResources 리소스 검사용 시스템 정보
     * @param clock 시계
     */
    public AgentLauncher(
        MemoryCoordinator memory,
        TaskHandlerRegistry handlers,
        LauncherConfig config,
        AgentTemplates templates,
        SystemResources systemResources,
        Clock clock
    ) {
        this(
            memory, config, templates, systemResources, clock,
            defaultStrategies(memory, handlers, config, clock),
            Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "swarm-launcher-health");
                thread.setDaemon(true);
                return thread;
            })
        );
    }

    AgentLauncher(
        MemoryCoordinator memory,
        LauncherConfig config,
        AgentTemplates templates,
        SystemResources systemResources,
        Clock clock,
        Map<LaunchMode, LaunchStrategy> strategies,
        ScheduledExecutorService scheduler
    ) {
        if (memory == null || config == null || templates == null || systemResources == null || clock == null) {
            throw new IllegalArgumentException("memory, config, templates, systemResources and clock cannot be null");
        }
        if (strategies == null || scheduler == null) {
            throw new IllegalArgumentException("strategies and scheduler cannot be null");
        }
        this.memory = memory;
        this.config = config;
        this.templates = templates;
        this.systemResources = systemResources;
        this.clock = clock;
        this.strategies = new EnumMap<>(LaunchMode.class);
        this.strategies.putAll(strategies);
        this.scheduler = scheduler;
    }

    private static Map<LaunchMode, LaunchStrategy> defaultStrategies(
        MemoryCoordinator memory,
        TaskHandlerRegistry handlers,
        LauncherConfig config,
        Clock clock
    ) {
        Map<LaunchMode, LaunchStrategy> strategies = new EnumMap<>(LaunchMode.class);
        strategies.put(LaunchMode.PROCESS, new ProcessLaunchStrategy(config, clock));
        strategies.put(LaunchMode.IN_PROCESS, new InProcessLaunchStrategy(memory, handlers, clock, config.storeUrl()));
        strategies.put(LaunchMode.CONTAINER, new UnsupportedLaunchStrategy(LaunchMode.CONTAINER));
        strategies.put(LaunchMode.REMOTE, new UnsupportedLaunchStrategy(LaunchMode.REMOTE));
        return strategies;
    }

    // ============================================================
    // Launch
    // ============================================================

    /**
     * 템플릿으로 Agent 설정 생성.
     *
     * @see AgentTemplates#create(String, Map)
     */
    public AgentConfig createAgentFromTemplate(String templateName, Map<String, Object> overrides) {
        return templates.create(templateName, overrides);
    }

    /**
     * Agent 실행.
     *
     * @param sessionId 세션 ID
     * @param agentConfig Agent 설정
     * @return 시작되었으면 true, 프로세스/스레드 시작에 실패했으면 false
     * @throws ValidationException 설정이 잘못되었거나 같은 ID의 Agent가 실행 중인 경우
     * @throws ResourceExhaustedException 메모리 또는 Agent 수 제한에 걸린 경우
     * @throws UnsupportedLaunchModeException CONTAINER, REMOTE 모드인 경우
     */
    public boolean launchAgent(SessionId sessionId, AgentConfig agentConfig) {
        return launch(sessionId, agentConfig, 0);
    }

    private boolean launch(SessionId sessionId, AgentConfig agentConfig, int restartCount) {
        if (sessionId == null) {
            throw new IllegalArgumentException("sessionId cannot be null");
        }
        if (agentConfig == null) {
            throw new ValidationException("Agent config cannot be null");
        }
        agentConfig.validate();

        synchronized (launchMonitor) {
            if (shutdown) {
                throw new IllegalStateException("AgentLauncher is shut down");
            }
            ManagedAgent existing = agents.get(agentConfig.id());
            if (existing != null && existing.status().isActive()) {
                throw new ValidationException("Agent already running: " + agentConfig.id());
            }
            checkResources(agentConfig);

            LaunchStrategy strategy = strategies.get(agentConfig.launchMode());
            if (strategy == null) {
                throw new UnsupportedLaunchModeException(agentConfig.launchMode().wireName());
            }
            AgentHandle handle;
            try {
                handle = strategy.launch(sessionId, agentConfig);
            } catch (AgentLaunchException e) {
                log.error("Failed to launch agent {}: {}", agentConfig.id(), e.getMessage(), e);
                return false;
            }

            register(sessionId, agentConfig);
            agents.put(agentConfig.id(), new ManagedAgent(sessionId, agentConfig, handle, clock.instant(), restartCount));
        }
        log.info("Agent launched: {} ({}, mode: {}, session: {}, restarts: {})",
            agentConfig.id(), agentConfig.name(), agentConfig.launchMode().wireName(), sessionId, restartCount);
        return true;
    }

    private void checkResources(AgentConfig agentConfig) {
        long availableMb = systemResources.availableMemoryMb();
        long requestedMb = agentConfig.resourceLimits().memoryMb();
        if (requestedMb > availableMb * config.memoryHeadroomRatio()) {
            throw new ResourceExhaustedException(
                "Insufficient memory for agent " + agentConfig.id() + ": requested " + requestedMb
                    + "MB, available " + availableMb + "MB (headroom: " + config.memoryHeadroomRatio() + ")"
            );
        }
        long active = agents.values().stream().filter(agent -> agent.status().isActive()).count();
        if (active >= config.maxAgents()) {
            throw new ResourceExhaustedException(
                "Agent limit reached: " + active + "/" + config.maxAgents() + " (agent: " + agentConfig.id() + ")"
            );
        }
    }

    private void register(SessionId sessionId, AgentConfig agentConfig) {
        AgentRegistration registration = AgentRegistration.of(
            agentConfig.id(),
            sessionId.getValue(),
            agentConfig.name(),
            agentConfig.capabilities(),
            agentConfig.maxTasks(),
            agentConfig.resourceLimits(),
            agentConfig.launchMode().wireName()
        );
        try {
            memory.registerAgent(sessionId, registration);
        } catch (StoreException e) {
            log.warn("Could not register agent {} (session: {}): {}", agentConfig.id(), sessionId, e.getMessage());
        }
    }

    /**
     * 여러 Agent 실행.
     *
     * <p>실패한 항목은 경고 로그를 남기고 건너뜁니다. autoScale이면 requiredCapabilities 중
     * 등록된 Agent가 없는 capability마다 capability → 템플릿 매핑으로 Agent를 하나씩 추가합니다.</p>
     *
     * @param sessionId 세션 ID
     * @param swarmConfig Swarm 설정
     * @return 시작된 Agent ID
     */
    public List<String> launchAgentSwarm(SessionId sessionId, SwarmConfig swarmConfig) {
        List<String> launched = new ArrayList<>();
        for (AgentSpec spec : swarmConfig.agents()) {
            launchSpec(sessionId, spec.config(), spec.template(), spec.overrides()).ifPresent(launched::add);
        }

        if (swarmConfig.autoScale()) {
            Set<String> covered = coveredCapabilities(sessionId);
            for (String capability : swarmConfig.requiredCapabilities()) {
                if (covered.contains(capability)) {
                    continue;
                }
                Optional<String> template = templates.templateForCapability(capability);
                if (template.isEmpty()) {
                    log.warn("No template provides capability {} (session: {})", capability, sessionId);
                    continue;
                }
                log.info("Auto-scaling: launching {} for missing capability {}", template.get(), capability);
                launchSpec(sessionId, null, template.get(), null).ifPresent(launched::add);
            }
        }

        log.info("Launched {}/{} agent(s) for session {}", launched.size(),
            swarmConfig.agents().size() + (swarmConfig.autoScale() ? swarmConfig.requiredCapabilities().size() : 0),
            sessionId);
        return launched;
    }

    private Optional<String> launchSpec(SessionId sessionId, AgentConfig explicit, String template, Map<String, Object> overrides) {
        try {
            AgentConfig agentConfig = explicit != null ? explicit : templates.create(template, overrides);
            return launchAgent(sessionId, agentConfig) ? Optional.of(agentConfig.id()) : Optional.empty();
        } catch (ValidationException | ResourceExhaustedException | UnsupportedLaunchModeException e) {
            log.warn("Skipping agent {} (session: {}): {}",
                explicit != null ? explicit.id() : template, sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private Set<String> coveredCapabilities(SessionId sessionId) {
        Set<String> covered = new LinkedHashSet<>();
        for (ManagedAgent agent : agents.values()) {
            if (agent.sessionId().equals(sessionId) && agent.status().isActive()) {
                covered.addAll(agent.config().capabilities());
            }
        }
        try {
            for (AgentRegistration registration : memory.listAgents(sessionId)) {
                if (registration.status() != AgentStatus.OFFLINE && registration.status() != AgentStatus.ERROR) {
                    covered.addAll(registration.capabilities());
                }
            }
        } catch (StoreException e) {
            log.warn("Could not list registered agents (session: {}): {}", sessionId, e.getMessage());
        }
        return covered;
    }

    // ============================================================
    // 헬스 체크
    // ============================================================

    /**
     * 주기적 헬스 체크 시작 (이미 시작되었으면 무시).
     */
    public void startHealthMonitoring() {
        synchronized (launchMonitor) {
            if (shutdown || healthLoop != null) {
                return;
            }
            healthLoop = scheduler.scheduleWithFixedDelay(
                this::safeCheckHealth, config.healthCheckIntervalMs(), config.healthCheckIntervalMs(), TimeUnit.MILLISECONDS
            );
        }
        log.info("Agent health monitoring started (interval: {}ms)", config.healthCheckIntervalMs());
    }

    private void safeCheckHealth() {
        try {
            checkHealth();
        } catch (RuntimeException e) {
            log.error("Agent health check failed", e);
        }
    }

    /**
     * 관리 중인 모든 Agent를 한 번 점검.
     *
     * @return 이번 점검에서 FAILED가 된 Agent 수
     */
    public int checkHealth() {
        Instant now = clock.instant();
        int failed = 0;
        for (ManagedAgent agent : agents.values()) {
            try {
                if (checkAgent(agent, now)) {
                    failed++;
                }
            } catch (RuntimeException e) {
                log.error("Health check failed for agent {}", agent.config().id(), e);
            }
        }
        return failed;
    }

    private boolean checkAgent(ManagedAgent agent, Instant now) {
        if (!agent.status().isActive()) {
            return false;
        }
        agent.updateMetrics(agent.handle().sampleMetrics());
        observeHeartbeat(agent);

        if (!agent.handle().isAlive()) {
            fail(agent, "Agent process exited unexpectedly");
            return true;
        }
        long silentMs = Duration.between(agent.lastActivity(), now).toMillis();
        if (silentMs > config.heartbeatTimeoutMs()) {
            fail(agent, "No heartbeat for " + silentMs + "ms (timeout: " + config.heartbeatTimeoutMs() + "ms)");
            return true;
        }
        return false;
    }

    private void observeHeartbeat(ManagedAgent agent) {
        try {
            memory.getAgent(agent.sessionId(), AgentId.of(agent.config().id()))
                .map(AgentRegistration::lastHeartbeat)
                .ifPresent(heartbeat -> {
                    if (agent.observeHeartbeat(heartbeat)) {
                        log.info("Agent running: {} (first heartbeat at {})", agent.config().id(), heartbeat);
                    }
                });
        } catch (StoreException e) {
            log.warn("Could not read heartbeat of agent {}: {}", agent.config().id(), e.getMessage());
        }
    }

    private void fail(ManagedAgent agent, String reason) {
        agent.markFailed(reason);
        log.warn("Agent {} failed: {}", agent.config().id(), reason);
        mirrorStatus(agent, AgentStatus.ERROR);
    }

    private void mirrorStatus(ManagedAgent agent, AgentStatus status) {
        try {
            memory.updateAgentStatus(agent.sessionId(), AgentId.of(agent.config().id()), status);
        } catch (StoreException e) {
            log.warn("Could not update status of agent {} to {}: {}", agent.config().id(), status, e.getMessage());
        }
    }

    // ============================================================
    // 종료, 재시작
    // ============================================================

    /**
     * Agent 종료 (종료 신호 → stopTimeoutMs 대기 → 강제 종료).
     *
     * @param agentId Agent ID
     * @return 관리 중인 Agent였으면 true
     */
    public boolean stopAgent(String agentId) {
        ManagedAgent agent = agents.get(agentId);
        if (agent == null) {
            log.warn("Cannot stop unknown agent: {}", agentId);
            return false;
        }
        if (agent.status() == ManagedAgentStatus.STOPPED) {
            return true;
        }
        terminate(agent);
        agent.markStopped();
        mirrorStatus(agent, AgentStatus.OFFLINE);
        log.info("Agent stopped: {}", agentId);
        return true;
    }

    private void terminate(ManagedAgent agent) {
        AgentHandle handle = agent.handle();
        try {
            handle.requestStop();
            if (!handle.awaitExit(config.stopTimeoutMs())) {
                log.warn("Agent {} did not stop within {}ms, forcing termination", agent.config().id(), config.stopTimeoutMs());
                handle.forceStop();
                handle.awaitExit(config.stopTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.forceStop();
        }
    }

    /**
     * 관리 중인 모든 Agent 종료.
     *
     * @return 종료한 Agent 수
     */
    public int stopAllAgents() {
        int stopped = 0;
        for (String agentId : List.copyOf(agents.keySet())) {
            ManagedAgent agent = agents.get(agentId);
            if (agent != null && agent.status() != ManagedAgentStatus.STOPPED && stopAgent(agentId)) {
                stopped++;
            }
        }
        return stopped;
    }

    /**
     * Agent 재시작 (종료 → restartDelayMs 대기 → 같은 설정으로 재실행).
     *
     * @param sessionId 재실행할 세션
     * @param agentId Agent ID
     * @return 재실행되었으면 true, 재시작 한도 초과나 실행 실패 시 false
     */
    public boolean restartAgent(SessionId sessionId, String agentId) {
        ManagedAgent agent = agents.get(agentId);
        if (agent == null) {
            log.warn("Cannot restart unknown agent: {}", agentId);
            return false;
        }
        if (agent.restartCount() >= config.maxRestarts()) {
            log.error("Agent {} exceeded max restarts ({})", agentId, config.maxRestarts());
            return false;
        }

        stopAgent(agentId);
        try {
            TimeUnit.MILLISECONDS.sleep(config.restartDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Restart of agent {} interrupted", agentId);
            return false;
        }

        try {
            return launch(sessionId, agent.config(), agent.restartCount() + 1);
        } catch (RuntimeException e) {
            log.error("Failed to restart agent {}: {}", agentId, e.getMessage(), e);
            return false;
        }
    }

    // ============================================================
    // 조회
    // ============================================================

    public Optional<AgentStatusView> getAgentStatus(String agentId) {
        return Optional.ofNullable(agents.get(agentId)).map(ManagedAgent::toView);
    }

    /**
     * 관리 중인 모든 Agent (ID 순).
     */
    public List<AgentStatusView> listAgents() {
        List<AgentStatusView> views = new ArrayList<>();
        for (ManagedAgent agent : agents.values()) {
            views.add(agent.toView());
        }
        views.sort(Comparator.comparing(AgentStatusView::agentId));
        return views;
    }

    /**
     * 헬스 체크를 멈추고 모든 Agent 종료.
     */
    public void shutdown() throws InterruptedException {
        synchronized (launchMonitor) {
            shutdown = true;
            if (healthLoop != null) {
                healthLoop.cancel(false);
                healthLoop = null;
            }
        }
        scheduler.shutdown();
        int stopped = stopAllAgents();
        if (!scheduler.awaitTermination(config.stopTimeoutMs(), TimeUnit.MILLISECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Agent launcher shut down ({} agent(s) stopped)", stopped);
    }
}
