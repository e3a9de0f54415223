package homelab.orchestrator.core;

import homelab.orchestrator.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Per-job update listeners, owned by one orchestrator instance.
 * Listeners run on the publishing thread and must not block.
 */
public final class JobEventBus {

    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);

    private final Map<String, CopyOnWriteArrayList<Consumer<Job>>> listeners = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Consumer<Job>> global = new CopyOnWriteArrayList<>();

    /**
     * Adding and removing run inside the map's per-key compute, so a list emptied by a closing
     * subscription is never handed to a concurrent registration.
     */
    public Subscription onJobUpdate(String jobId, Consumer<Job> listener) {
        listeners.compute(jobId, (id, list) -> {
            CopyOnWriteArrayList<Consumer<Job>> target = list != null ? list : new CopyOnWriteArrayList<>();
            target.add(listener);
            return target;
        });
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                listeners.computeIfPresent(jobId, (id, list) -> {
                    list.remove(listener);
                    return list.isEmpty() ? null : list;
                });
            }
        };
    }

    /** Listen to updates of every job */
    public Subscription onAnyJobUpdate(Consumer<Job> listener) {
        global.add(listener);
        AtomicBoolean closed = new AtomicBoolean();
        return () -> {
            if (closed.compareAndSet(false, true)) {
                global.remove(listener);
            }
        };
    }

    public void publish(Job job) {
        List<Consumer<Job>> list = listeners.get(job.id());
        if (list != null) {
            for (Consumer<Job> l : list) {
                deliver(l, job);
            }
        }
        for (Consumer<Job> l : global) {
            deliver(l, job);
        }
    }

    /** Drop every listener of a job that has been garbage-collected */
    public void forget(String jobId) {
        listeners.remove(jobId);
    }

    public int listenerCount(String jobId) {
        List<Consumer<Job>> list = listeners.get(jobId);
        return list == null ? 0 : list.size();
    }

    private static void deliver(Consumer<Job> listener, Job job) {
        try {
            listener.accept(job);
        } catch (RuntimeException e) {
            log.warn("Job listener failed for {}: {}", job.id(), e.getMessage(), e);
        }
    }
}
