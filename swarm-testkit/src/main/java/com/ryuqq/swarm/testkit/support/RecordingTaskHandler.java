package com.ryuqq.swarm.testkit.support;

import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.handler.TaskHandler;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Handler that records every invocation and returns a fixed result.
 *
 * <p>Optionally blocks each invocation on a gate latch until the test releases it.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class RecordingTaskHandler implements TaskHandler {

    private final List<Map<String, Object>> invocations = new CopyOnWriteArrayList<>();
    private final Map<String, Object> result;
    private final CountDownLatch gate;

    public RecordingTaskHandler() {
        this(Map.of("status", "ok"), null);
    }

    private RecordingTaskHandler(Map<String, Object> result, CountDownLatch gate) {
        this.result = result;
        this.gate = gate;
    }

    /**
     * Handler that waits on {@code gate} (up to 10 seconds) before returning.
     *
     * @param gate latch released by the test
     * @return gated handler
     */
    public static RecordingTaskHandler gatedBy(CountDownLatch gate) {
        return new RecordingTaskHandler(Map.of("status", "ok"), gate);
    }

    public static RecordingTaskHandler returning(Map<String, Object> result) {
        return new RecordingTaskHandler(result, null);
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> parameters, SharedContext context) throws Exception {
        invocations.add(parameters);
        if (gate != null && !gate.await(10, TimeUnit.SECONDS)) {
            throw new IllegalStateException("gate was never released");
        }
        return result;
    }

    public List<Map<String, Object>> invocations() {
        return List.copyOf(invocations);
    }

    public int invocationCount() {
        return invocations.size();
    }
}
