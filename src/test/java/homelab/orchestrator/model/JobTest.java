package homelab.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Job model and its enums.
 */
class JobTest {

    private static Job.Builder queued() {
        return Job.builder()
                .id("job-1")
                .type(JobType.CODE_FIX)
                .priority(JobPriority.HIGH)
                .status(JobStatus.QUEUED)
                .createdAt(Instant.now())
                .maxRetries(3);
    }

    @Test
    void testCanRetry() {
        Job job = queued().retries(0).build();
        assertTrue(job.canRetry());

        job = queued().retries(1).build();
        assertTrue(job.canRetry());

        job = queued().retries(2).build();
        assertFalse(job.canRetry()); // third failure exhausts maxRetries
    }

    @Test
    void testIsRetry() {
        assertFalse(queued().build().isRetry());
        assertTrue(queued().retries(1).build().isRetry());
        assertFalse(queued().retries(1).status(JobStatus.RUNNING).build().isRetry());
    }

    @Test
    void testProgressIsClamped() {
        assertEquals(100, queued().progress(250).build().progress());
        assertEquals(0, queued().progress(-1).build().progress());
    }

    @Test
    void testParamsAreCopied() {
        Map<String, Object> params = new HashMap<>();
        params.put("file", "a.ts");
        Job job = queued().params(params).build();

        params.put("file", "b.ts");

        assertEquals("a.ts", job.params().get("file"));
        assertThrows(UnsupportedOperationException.class, () -> job.params().put("x", 1));
    }

    @Test
    void testToBuilderKeepsFields() {
        Job job = queued().subagentId("agent-1").notifyOnComplete(true).sequence(7).build();
        Job copy = job.toBuilder().status(JobStatus.RUNNING).build();

        assertEquals(job.id(), copy.id());
        assertEquals("agent-1", copy.subagentId());
        assertTrue(copy.notifyOnComplete());
        assertEquals(7, copy.sequence());
        assertEquals(JobStatus.RUNNING, copy.status());
    }

    @Test
    void testStatusTransitions() {
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.RUNNING));
        assertTrue(JobStatus.QUEUED.canTransitionTo(JobStatus.CANCELLED));
        assertFalse(JobStatus.QUEUED.canTransitionTo(JobStatus.COMPLETED));
        assertTrue(JobStatus.RUNNING.canTransitionTo(JobStatus.QUEUED));
        assertFalse(JobStatus.COMPLETED.canTransitionTo(JobStatus.RUNNING));
        assertFalse(JobStatus.CANCELLED.canTransitionTo(JobStatus.QUEUED));
        assertTrue(JobStatus.FAILED.isTerminal());
        assertFalse(JobStatus.RUNNING.isTerminal());
    }

    @Test
    void testPriorityParsing() {
        assertEquals(JobPriority.NORMAL, JobPriority.parse(null));
        assertEquals(JobPriority.CRITICAL, JobPriority.parse("critical"));
        assertThrows(IllegalArgumentException.class, () -> JobPriority.parse("urgent"));
        assertTrue(JobPriority.CRITICAL.weight() > JobPriority.HIGH.weight());
        assertTrue(JobPriority.NORMAL.weight() > JobPriority.LOW.weight());
    }

    @Test
    void testTypeParsing() {
        assertEquals(JobType.OPENCODE_TASK, JobType.parse("opencode-task"));
        assertEquals(JobType.CODE_ANALYSIS, JobType.parse("code_analysis"));
        assertThrows(IllegalArgumentException.class, () -> JobType.parse(""));
        assertThrows(IllegalArgumentException.class, () -> JobType.parse("compile"));
    }
}
