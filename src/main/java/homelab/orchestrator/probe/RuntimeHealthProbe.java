package homelab.orchestrator.probe;

import java.util.List;

/**
 * Health check of the local AI runtimes. Never throws: an unreachable runtime
 * is reported as offline.
 */
public interface RuntimeHealthProbe {

    List<RuntimeHealth> checkAll();
}
