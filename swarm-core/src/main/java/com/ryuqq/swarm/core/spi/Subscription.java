package com.ryuqq.swarm.core.spi;

/**
 * Active channel subscription.
 *
 * <p>Closing is idempotent.</p>
 *
 * @author Swarm Team
 * @since 1.0.0
 */
public interface Subscription extends AutoCloseable {

    /**
     * Channel name.
     *
     * @return channel
     */
    String channel();

    /**
     * Cancels the subscription.
     */
    @Override
    void close();
}
