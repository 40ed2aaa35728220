package org.abstractica.vaultbridge;

/**
 * Handle returned when registering a listener. Closing it unregisters the listener.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable
{
    /**
     * Unregisters the listener. Calling this more than once has no effect.
     */
    @Override
    void close();
}
