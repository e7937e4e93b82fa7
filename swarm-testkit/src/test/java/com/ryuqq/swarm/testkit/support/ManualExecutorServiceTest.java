package com.ryuqq.swarm.testkit.support;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ManualExecutorServiceTest {

    @Test
    void 제출한_작업은_runAll_전까지_실행되지_않음() throws Exception {
        // given
        ManualExecutorService executor = new ManualExecutorService();
        List<String> ran = new ArrayList<>();

        // when
        Future<String> future = executor.submit(() -> {
            ran.add("first");
            return "done";
        });
        executor.execute(() -> ran.add("second"));

        // then
        assertThat(ran).isEmpty();
        assertThat(executor.pendingCount()).isEqualTo(2);
        assertThat(executor.runAll()).isEqualTo(2);
        assertThat(ran).containsExactly("first", "second");
        assertThat(future.get()).isEqualTo("done");
    }

    @Test
    void 거부_모드와_shutdown_이후에는_RejectedExecutionException() {
        // given
        ManualExecutorService rejecting = new ManualExecutorService();
        rejecting.rejectNewWork();
        ManualExecutorService stopped = new ManualExecutorService();
        stopped.execute(() -> { });
        stopped.shutdown();

        // when / then
        assertThatThrownBy(() -> rejecting.execute(() -> { }))
            .isInstanceOf(RejectedExecutionException.class);
        assertThatThrownBy(() -> stopped.execute(() -> { }))
            .isInstanceOf(RejectedExecutionException.class);
        assertThat(stopped.isTerminated()).isFalse();
        assertThat(stopped.shutdownNow()).hasSize(1);
        assertThat(stopped.isTerminated()).isTrue();
    }

    @Test
    void DirectExecutorService는_제출_즉시_호출_스레드에서_실행함() {
        // given
        DirectExecutorService executor = new DirectExecutorService();
        Thread caller = Thread.currentThread();
        List<Thread> threads = new ArrayList<>();

        // when
        executor.execute(() -> threads.add(Thread.currentThread()));
        executor.shutdown();

        // then
        assertThat(threads).containsExactly(caller);
        assertThat(executor.isTerminated()).isTrue();
        assertThatThrownBy(() -> executor.execute(() -> { }))
            .isInstanceOf(RejectedExecutionException.class);
    }
}
