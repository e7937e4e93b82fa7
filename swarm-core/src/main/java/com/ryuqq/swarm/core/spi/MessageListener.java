package com.ryuqq.swarm.core.spi;

/**
 * Pub/Sub message callback.
 *
 * <p>Invoked on a store-owned thread. Implementations must not block for long and must not
 * throw; exceptions are logged by the store and otherwise ignored.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageListener {

    /**
     * Handles one message.
     *
     * @param channel channel the message was published on
     * @param message message payload
     */
    void onMessage(String channel, String message);
}
