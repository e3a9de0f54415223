package homelab.orchestrator.core;

/**
 * Handle returned by a subscription. Closing it more than once is a no-op.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
