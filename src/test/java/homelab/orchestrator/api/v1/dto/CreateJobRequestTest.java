package homelab.orchestrator.api.v1.dto;

import homelab.orchestrator.model.JobOptions;
import homelab.orchestrator.model.JobPriority;
import homelab.orchestrator.model.JobType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    @Test
    void mapsAllOptions() {
        CreateJobRequest request = new CreateJobRequest("code-fix", "critical", Map.of("file", "a.ts"),
                5, 30_000L, true, "sub-1");

        request.validate();
        JobOptions options = request.toOptions();

        assertEquals(JobType.CODE_FIX, request.jobType());
        assertEquals(JobPriority.CRITICAL, options.priority());
        assertEquals(5, options.maxRetries());
        assertEquals(Duration.ofSeconds(30), options.timeout());
        assertTrue(options.notifyOnComplete());
        assertEquals("sub-1", options.subagentId());
    }

    @Test
    void leavesDefaultsUnset() {
        JobOptions options = new CreateJobRequest("code_analysis", null, null, null, null, null, " ").toOptions();

        assertEquals(JobPriority.NORMAL, options.priority());
        assertNull(options.maxRetries());
        assertNull(options.timeout());
        assertNull(options.subagentId());
    }

    @Test
    void rejectsInvalidRequests() {
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, null, null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("teleport", null, null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("code_fix", "urgent", null, null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("code_fix", null, null, 0, null, null, null).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("code_fix", null, null, null, -1L, null, null).validate());
    }
}
