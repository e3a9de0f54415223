package homelab.orchestrator.wake;

/**
 * Sends a wake-on-LAN signal and waits for the target to come up.
 * Blocks up to {@link WakeRequest#waitTimeout()}; reports failures in the response.
 */
@FunctionalInterface
public interface WakePrimitive {

    WakeResponse wake(WakeRequest request);
}
