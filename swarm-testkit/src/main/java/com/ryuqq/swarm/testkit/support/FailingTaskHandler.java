package com.ryuqq.swarm.testkit.support;

import com.ryuqq.swarm.core.handler.SharedContext;
import com.ryuqq.swarm.core.handler.TaskHandler;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handler that fails every invocation.
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public final class FailingTaskHandler implements TaskHandler {

    private final AtomicInteger invocations = new AtomicInteger();
    private final String message;

    public FailingTaskHandler() {
        this("handler failure");
    }

    public FailingTaskHandler(String message) {
        this.message = message;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> parameters, SharedContext context) {
        invocations.incrementAndGet();
        throw new IllegalStateException(message);
    }

    public int invocationCount() {
        return invocations.get();
    }
}
