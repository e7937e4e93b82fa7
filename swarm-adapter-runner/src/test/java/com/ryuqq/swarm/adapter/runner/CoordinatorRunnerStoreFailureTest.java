package com.ryuqq.swarm.adapter.runner;

import com.ryuqq.swarm.application.memory.MemoryCoordinator;
import com.ryuqq.swarm.application.memory.MemoryEventType;
import com.ryuqq.swarm.application.orchestrator.SessionStatusView;
import com.ryuqq.swarm.application.orchestrator.TaskDefinition;
import com.ryuqq.swarm.core.error.StoreException;
import com.ryuqq.swarm.core.handler.TaskHandlerRegistry;
import com.ryuqq.swarm.core.model.SessionId;
import com.ryuqq.swarm.core.statemachine.SessionStatus;
import com.ryuqq.swarm.core.statemachine.TaskStatus;
import com.ryuqq.swarm.testkit.support.DirectExecutorService;
import com.ryuqq.swarm.testkit.support.MutableClock;
import com.ryuqq.swarm.testkit.support.RecordingTaskHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

/**
 * Backing Store 장애 시 CoordinatorRunner 동작 테스트.
 *
 * <p>저장소 오류는 경고 로그만 남기고 메모리 상태로 계속 진행해야 하며,
 * 한 세션의 예기치 않은 오류는 해당 세션만 FAILED로 만들어야 합니다.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CoordinatorRunnerStoreFailureTest {

    @Mock
    private MemoryCoordinator memory;

    private MutableClock clock;
    private TaskHandlerRegistry handlers;
    private ScheduledExecutorService scheduler;
    private CoordinatorRunner runner;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpochOfTests();
        handlers = new TaskHandlerRegistry().register("process", new RecordingTaskHandler());
        scheduler = Executors.newSingleThreadScheduledExecutor();
        runner = new CoordinatorRunner(
            handlers, memory,
            new CoordinatorConfig().withSelfScheduling(false),
            new ReaperConfig(),
            new BackoffCalculator(),
            clock,
            new DirectExecutorService(),
            scheduler
        );
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        runner.shutdown();
    }

    @Test
    void 저장소가_모두_실패해도_세션은_끝까지_진행됨() {
        // given
        StoreException down = new StoreException("Redis command failed: connection refused");
        doThrow(down).when(memory).createSession(any());
        lenient().doThrow(down).when(memory).updateSession(any());
        lenient().doThrow(down).when(memory).updateProgress(any(), any());
        lenient().doThrow(down).when(memory).emitEvent(any(), any(), any(), any());
        lenient().doThrow(down).when(memory).registerAgent(any(), any());
        lenient().doThrow(down).when(memory).updateAgent(any(), any(), any());
        lenient().doThrow(down).when(memory).setContext(any(), anyString(), any());

        // when
        SessionId sessionId = runner.createSession("offline", List.of(TaskDefinition.of("process")));
        runner.startSession(sessionId);
        runner.pump();
        runner.pump();

        // then
        SessionStatusView view = runner.getSessionStatus(sessionId).orElseThrow();
        assertThat(view.status()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(runner.listTasks(sessionId)).singleElement()
            .satisfies(task -> assertThat(task.status()).isEqualTo(TaskStatus.COMPLETED));
        verify(memory, atLeastOnce()).updateSession(any());
    }

    @Test
    void 한_세션의_예기치_않은_오류는_그_세션만_FAILED로_만듦() {
        // given
        SessionId broken = runner.createSession("broken", List.of(TaskDefinition.of("process")));
        SessionId healthy = runner.createSession("healthy", List.of(TaskDefinition.of("process")));
        lenient().doThrow(new IllegalStateException("event payload rejected"))
            .when(memory).emitEvent(eq(MemoryEventType.TASK_ASSIGNED), eq(broken), any(), anyString());
        runner.startSession(broken);
        runner.startSession(healthy);

        // when
        runner.pump();
        runner.pump();

        // then
        SessionStatusView brokenView = runner.getSessionStatus(broken).orElseThrow();
        assertThat(brokenView.status()).isEqualTo(SessionStatus.FAILED);
        assertThat(brokenView.failureReason()).isEqualTo("event payload rejected");
        assertThat(runner.listTasks(broken)).singleElement()
            .satisfies(task -> assertThat(task.status()).isEqualTo(TaskStatus.CANCELLED));

        assertThat(runner.getSessionStatus(healthy).orElseThrow().status()).isEqualTo(SessionStatus.COMPLETED);
    }
}
