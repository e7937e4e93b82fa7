package com.ryuqq.swarm.adapter.launcher.worker;

import com.ryuqq.swarm.adapter.inmemory.store.InMemoryBackingStore;
import com.ryuqq.swarm.application.memory.AgentRegistration;
import com.ryuqq.swarm.application.memory.MemoryConfig;
import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.model.AgentId;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.statemachine.AgentStatus;
import com.ryuqq.swarm.testkit.support.DirectExecutorService;
import com.ryuqq.swarm.testkit.support.FailingTaskHandler;
import com.ryuqq.swarm.testkit.support.ManualExecutorService;
import com.ryuqq.swarm.testkit.support.MutableClock;
import com.ryuqq.swarm.testkit.support.RecordingTaskHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

/**
 * AgentWorker 테스트.
 *
 * <p>Task 풀은 테스트용 Executor로, heartbeat 스케줄러는 mock으로 대체하고
 * {@code pollOnce}, {@code sendHeartbeat}를 직접 호출합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AgentWorkerTest {

    @Mock
    private ScheduledExecutorService heartbeatScheduler;

    private MutableClock clock;
    private MemoryCoordinator memory;
    private TaskHandlerRegistry handlers;
    private RecordingTaskHandler processHandler;
    private SessionId sessionId;
    private AgentWorkerConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpochOfTests();
        memory = new MemoryCoordinator(new InMemoryBackingStore(clock), new MemoryConfig(), clock);
        processHandler = RecordingTaskHandler.returning(Map.of("rows", 42));
        handlers = new TaskHandlerRegistry()
            .register("process_csv", processHandler)
            .register("explode", new FailingTaskHandler("disk full"));
        sessionId = SessionId.generate();
        config = AgentWorkerConfig.of(AgentId.of("worker-1"), sessionId, "Worker One", List.of("data_processing"));
    }

    private AgentWorker worker(AgentWorkerConfig workerConfig, ExecutorService taskPool) {
        return new AgentWorker(workerConfig, memory, handlers, clock, taskPool, heartbeatScheduler);
    }

    private void publish(PendingTask... tasks) {
        memory.setContext(sessionId, AgentWorker.PENDING_TASKS_KEY, List.of(tasks));
    }

    private Map<String, TaskResultRecord> results() {
        return memory.getTaskResults(sessionId, TaskResultRecord.class);
    }

    private AgentRegistration registration() {
        return memory.getAgent(sessionId, AgentId.of("worker-1")).orElseThrow();
    }

    // ============================================================
    // 등록과 heartbeat
    // ============================================================

    @Test
    void 시작하면_등록하고_heartbeat를_예약() {
        // given
        AgentWorker worker = worker(config.withHeartbeatIntervalMs(5000), new DirectExecutorService());

        // when
        worker.start();

        // then
        AgentRegistration registration = registration();
        assertThat(registration.name()).isEqualTo("Worker One");
        assertThat(registration.capabilities()).containsExactly("data_processing");
        assertThat(registration.launchMode()).isEqualTo("process");
        assertThat(worker.isRunning()).isTrue();
        verify(heartbeatScheduler).scheduleWithFixedDelay(any(), eq(0L), eq(5000L), eq(TimeUnit.MILLISECONDS));
    }

    @Test
    void heartbeat는_실행_중_Task와_uptime을_보고() {
        // given
        ManualExecutorService taskPool = new ManualExecutorService();
        AgentWorker worker = worker(config.withMaxTasks(2), taskPool);
        worker.start();
        publish(PendingTask.of("t1", "process_csv", Map.of(), List.of()));
        worker.pollOnce();
        clock.advanceMillis(5000);

        // when
        boolean updated = worker.sendHeartbeat();

        // then
        assertThat(updated).isTrue();
        AgentRegistration registration = registration();
        assertThat(registration.status()).isEqualTo(AgentStatus.BUSY);
        assertThat(registration.currentTasks()).containsExactly("t1");
        assertThat(registration.metrics()).containsEntry("uptime_seconds", 5);
        assertThat(registration.lastHeartbeat()).isEqualTo(clock.instant());
    }

    @Test
    void 등록_정보가_없어지면_heartbeat에서_다시_등록() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        memory.unregisterAgent(sessionId, AgentId.of("worker-1"));

        // when
        boolean updated = worker.sendHeartbeat();

        // then
        assertThat(updated).isFalse();
        assertThat(memory.getAgent(sessionId, AgentId.of("worker-1"))).isPresent();
    }

    // ============================================================
    // Task 처리
    // ============================================================

    @Test
    void 처리_가능한_Task를_선점하고_결과를_기록() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        clock.advanceMillis(1000);
        publish(PendingTask.of("t1", "process_csv", Map.of("file", "products.csv"), List.of("data_processing")));

        // when
        int accepted = worker.pollOnce();

        // then
        assertThat(accepted).isEqualTo(1);
        assertThat(processHandler.invocations()).hasSize(1);
        assertThat(processHandler.invocations().get(0)).containsEntry("file", "products.csv");
        TaskResultRecord result = results().get("t1");
        assertThat(result.status()).isEqualTo(TaskResultRecord.COMPLETED);
        assertThat(result.agentId()).isEqualTo("worker-1");
        assertThat(result.result()).containsEntry("rows", 42);
        assertThat(worker.tasksCompleted()).isEqualTo(1);
        assertThat(worker.currentTaskIds()).isEmpty();

        // 이미 선점한 Task는 다시 실행하지 않음
        assertThat(worker.pollOnce()).isZero();
        assertThat(processHandler.invocationCount()).isEqualTo(1);
    }

    @Test
    void 처리할_수_없는_Task는_건너뜀() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        memory.claimTask(sessionId, "claimed", AgentId.of("worker-2"));
        publish(
            PendingTask.of("no-handler", "render_pdf", Map.of(), List.of()),
            PendingTask.of("wrong-capability", "process_csv", Map.of(), List.of("upload")),
            new PendingTask("assigned-elsewhere", "process_csv", Map.of(), List.of(), "worker-2"),
            PendingTask.of("claimed", "process_csv", Map.of(), List.of())
        );

        // when
        int accepted = worker.pollOnce();

        // then
        assertThat(accepted).isZero();
        assertThat(processHandler.invocationCount()).isZero();
        assertThat(results()).isEmpty();
    }

    @Test
    void 자신에게_지정된_Task는_처리() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        publish(new PendingTask("mine", "process_csv", Map.of(), List.of(), "worker-1"));

        // when & then
        assertThat(worker.pollOnce()).isEqualTo(1);
        assertThat(results()).containsKey("mine");
    }

    @Test
    void 핸들러_예외는_failed_결과로_기록() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        publish(PendingTask.of("t1", "explode", Map.of(), List.of()));

        // when
        worker.pollOnce();

        // then
        TaskResultRecord result = results().get("t1");
        assertThat(result.status()).isEqualTo(TaskResultRecord.FAILED);
        assertThat(result.error()).isEqualTo("disk full");
        assertThat(worker.tasksFailed()).isEqualTo(1);
        assertThat(worker.tasksCompleted()).isZero();
    }

    @Test
    void 동시_실행은_maxTasks로_제한() {
        // given
        ManualExecutorService taskPool = new ManualExecutorService();
        AgentWorker worker = worker(config.withMaxTasks(2), taskPool);
        worker.start();
        publish(
            PendingTask.of("t1", "process_csv", Map.of(), List.of()),
            PendingTask.of("t2", "process_csv", Map.of(), List.of()),
            PendingTask.of("t3", "process_csv", Map.of(), List.of())
        );

        // when
        int firstPoll = worker.pollOnce();
        int whileFull = worker.pollOnce();

        // then
        assertThat(firstPoll).isEqualTo(2);
        assertThat(whileFull).isZero();
        assertThat(taskPool.pendingCount()).isEqualTo(2);
        assertThat(worker.currentTaskIds()).containsExactlyInAnyOrder("t1", "t2");

        // when: 실행이 끝나면 남은 Task를 선점
        taskPool.runAll();
        int afterCompletion = worker.pollOnce();
        taskPool.runAll();

        // then
        assertThat(afterCompletion).isEqualTo(1);
        assertThat(results()).containsOnlyKeys("t1", "t2", "t3");
        assertThat(worker.tasksCompleted()).isEqualTo(3);
    }

    // ============================================================
    // 여러 Agent의 결과 기록
    // ============================================================

    @Test
    void 두_Agent가_같은_세션에서_완료한_결과가_모두_남음() {
        // given
        ManualExecutorService poolA = new ManualExecutorService();
        ManualExecutorService poolB = new ManualExecutorService();
        AgentWorker workerA = worker(config, poolA);
        AgentWorker workerB = worker(
            AgentWorkerConfig.of(AgentId.of("worker-2"), sessionId, "Worker Two", List.of("data_processing")), poolB
        );
        workerA.start();
        workerB.start();
        publish(
            PendingTask.of("t1", "process_csv", Map.of(), List.of()),
            PendingTask.of("t2", "process_csv", Map.of(), List.of())
        );
        workerA.pollOnce();
        workerB.pollOnce();

        // when
        poolB.runAll();
        poolA.runAll();

        // then
        Map<String, TaskResultRecord> results = results();
        assertThat(results).containsOnlyKeys("t1", "t2");
        assertThat(results.get("t1").agentId()).isEqualTo("worker-1");
        assertThat(results.get("t2").agentId()).isEqualTo("worker-2");
        assertThat(memory.getContext(sessionId)).doesNotContainKey(MemoryCoordinator.TASK_RESULTS);
    }

    @Test
    void 두_Agent가_동시에_결과를_기록해도_유실되지_않음() throws Exception {
        // given
        CyclicBarrier finishTogether = new CyclicBarrier(2);
        TaskHandlerRegistry racingHandlers = new TaskHandlerRegistry().register("process_csv", (parameters, context) -> {
            finishTogether.await(5, TimeUnit.SECONDS);
            return Map.of("done", true);
        });
        ExecutorService poolA = Executors.newSingleThreadExecutor();
        ExecutorService poolB = Executors.newSingleThreadExecutor();
        AgentWorker workerA = new AgentWorker(config, memory, racingHandlers, clock, poolA, heartbeatScheduler);
        AgentWorker workerB = new AgentWorker(
            AgentWorkerConfig.of(AgentId.of("worker-2"), sessionId, "Worker Two", List.of("data_processing")),
            memory, racingHandlers, clock, poolB, heartbeatScheduler
        );
        workerA.start();
        workerB.start();
        publish(
            PendingTask.of("t1", "process_csv", Map.of(), List.of()),
            PendingTask.of("t2", "process_csv", Map.of(), List.of())
        );

        // when
        workerA.pollOnce();
        workerB.pollOnce();
        poolA.shutdown();
        poolB.shutdown();

        // then
        assertThat(poolA.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(poolB.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        assertThat(results()).containsOnlyKeys("t1", "t2");
        assertThat(results().values()).extracting(TaskResultRecord::status)
            .containsOnly(TaskResultRecord.COMPLETED);
    }

    @Test
    void Task_풀이_거부하면_실행_중_목록에서_제거() {
        // given
        ManualExecutorService taskPool = new ManualExecutorService();
        taskPool.rejectNewWork();
        AgentWorker worker = worker(config, taskPool);
        worker.start();
        publish(PendingTask.of("t1", "process_csv", Map.of(), List.of()));

        // when & then
        assertThat(worker.pollOnce()).isZero();
        assertThat(worker.currentTaskIds()).isEmpty();
    }

    @Test
    void 모니터링_Agent는_내장_health_check를_처리() {
        // given
        AgentWorkerConfig monitorConfig = AgentWorkerConfig.of(
            AgentId.of("worker-1"), sessionId, "Monitor", List.of("monitoring", "health_check")
        );
        AgentWorker worker = worker(monitorConfig, new DirectExecutorService());
        worker.start();
        publish(PendingTask.of("hc-1", HealthCheckHandler.TASK_TYPE, Map.of(), List.of("health_check")));

        // when
        worker.pollOnce();

        // then
        TaskResultRecord result = results().get("hc-1");
        assertThat(result.status()).isEqualTo(TaskResultRecord.COMPLETED);
        assertThat(result.result())
            .containsEntry("status", "healthy")
            .containsEntry("agent_id", "worker-1");
    }

    @Test
    void 모니터링_capability가_없으면_health_check를_건너뜀() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        publish(PendingTask.of("hc-1", HealthCheckHandler.TASK_TYPE, Map.of(), List.of()));

        // when & then
        assertThat(worker.pollOnce()).isZero();
    }

    // ============================================================
    // 종료
    // ============================================================

    @Test
    void 정상_종료하면_OFFLINE을_보고() {
        // given
        AgentWorker worker = worker(config, new DirectExecutorService());
        worker.start();
        publish(PendingTask.of("t1", "process_csv", Map.of(), List.of()));
        worker.pollOnce();

        // when
        worker.shutdownGracefully();

        // then
        AgentRegistration registration = registration();
        assertThat(registration.status()).isEqualTo(AgentStatus.OFFLINE);
        assertThat(registration.currentTasks()).isEmpty();
        assertThat(registration.tasksCompleted()).isEqualTo(1);
        assertThat(worker.isRunning()).isFalse();
        verify(heartbeatScheduler).shutdownNow();
    }

    @Test
    void 종료_요청으로_실행_루프가_멈춤() throws InterruptedException {
        // given
        AgentWorker worker = worker(config.withPollIntervalMs(10), new DirectExecutorService());
        publish(PendingTask.of("t1", "process_csv", Map.of(), List.of()));
        Thread thread = new Thread(worker, "agent-worker-test");
        thread.start();

        // when
        worker.requestShutdown();
        boolean stopped = worker.awaitStopped(5000);
        thread.join(5000);

        // then
        assertThat(stopped).isTrue();
        assertThat(thread.isAlive()).isFalse();
        assertThat(registration().status()).isEqualTo(AgentStatus.OFFLINE);
    }
}
