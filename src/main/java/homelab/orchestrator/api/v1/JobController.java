package homelab.orchestrator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import homelab.orchestrator.api.Controller;
import homelab.orchestrator.api.v1.dto.CreateJobRequest;
import homelab.orchestrator.api.v1.dto.JobResponse;
import homelab.orchestrator.model.Job;
import homelab.orchestrator.model.JobStatus;
import homelab.orchestrator.server.RouterHandler;
import homelab.orchestrator.service.Orchestrator;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for jobs.
 *
 * GET /api/v1/jobs[?status=queued] - List jobs, newest first
 * POST /api/v1/jobs - Queue a job
 * GET /api/v1/jobs/{jobId} - Job details
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a queued job
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");

    private final Orchestrator orchestrator;

    public JobController(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOBS_PATTERN.matcher(path).matches() || JOB_BY_ID_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean post = req.method().equals(HttpMethod.POST);
            if (JOBS_PATTERN.matcher(path).matches()) {
                return post ? handleCreateJob(req) : handleListJobs(req);
            }

            Matcher cancelMatcher = JOB_CANCEL_PATTERN.matcher(path);
            if (post && cancelMatcher.matches()) {
                return handleCancel(cancelMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (!post && jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        if (body.isBlank()) {
            throw new IllegalArgumentException("request body is required");
        }
        CreateJobRequest request;
        try {
            request = RouterHandler.mapper().readValue(body, CreateJobRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("invalid JSON body: " + e.getOriginalMessage());
        }
        request.validate();

        Job job = orchestrator.createJob(request.jobType(), request.params(), request.toOptions());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(JobResponse.from(job)));
    }

    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        List<String> statusParam = new QueryStringDecoder(req.uri()).parameters().get("status");
        List<Job> jobs;
        if (statusParam != null && !statusParam.isEmpty()) {
            jobs = orchestrator.getJobsByStatus(parseStatus(statusParam.get(0)));
        } else {
            jobs = orchestrator.getAllJobs();
        }

        List<JobResponse> items = jobs.stream()
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .map(job -> JobResponse.from(job).compact())
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("total", items.size(), "jobs", items)));
    }

    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> job = orchestrator.getJob(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
    }

    private ControllerResponse handleCancel(String jobId) throws Exception {
        Optional<Job> job = orchestrator.getJob(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        if (!orchestrator.cancelJob(jobId)) {
            return ControllerResponse.conflict("only queued jobs can be cancelled");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "jobId", jobId)));
    }

    private static JobStatus parseStatus(String value) {
        try {
            return JobStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown job status: " + value);
        }
    }
}
