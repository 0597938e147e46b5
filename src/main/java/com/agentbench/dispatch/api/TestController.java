package com.agentbench.dispatch.api;

import com.agentbench.core.model.Job;
import com.agentbench.core.model.JobStatus;
import com.agentbench.core.service.SubmissionResult;
import com.agentbench.core.service.TestExecutionService;
import com.agentbench.core.service.UserTestsPage;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for test jobs. The caller is identified by the {@code X-User-Id} header, set by
 * the authenticating gateway in front of this service.
 */
@RestController
@RequestMapping("/api/v1/tests")
public class TestController {

    private static final Logger log = LoggerFactory.getLogger(TestController.class);

    static final String USER_HEADER = "X-User-Id";

    private final TestExecutionService testService;

    public TestController(TestExecutionService testService) {
        this.testService = testService;
    }

    /**
     * POST /api/v1/tests: Submit a test. Returns 202 with the queue position.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestHeader(USER_HEADER) String userId,
                                                      @Valid @RequestBody SubmitTestRequest request) {
        SubmissionResult result = testService.submitTest(userId, request.agentId(), request.query(),
                request.timeoutMs(), request.priority());
        log.info("Accepted test {} for agent {}", result.jobId(), request.agentId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submissionBody(result));
    }

    @GetMapping("/{jobId}")
    public JobResponse get(@PathVariable String jobId) {
        return JobResponse.from(testService.getTestById(jobId));
    }

    @GetMapping
    public Map<String, Object> list(@RequestHeader(USER_HEADER) String userId,
                                    @RequestParam(required = false) Integer limit,
                                    @RequestParam(required = false) String status) {
        JobStatus filter = status != null ? JobStatus.valueOf(status.toUpperCase()) : null;
        UserTestsPage page = testService.getUserTests(userId, limit, filter);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tests", page.tests().stream().map(JobResponse::summary).toList());
        body.put("has_more", page.hasMore());
        return body;
    }

    @GetMapping("/{jobId}/logs")
    public Map<String, Object> logs(@PathVariable String jobId) {
        Job job = testService.getTestById(jobId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", job.id());
        body.put("status", job.status().name());
        body.put("logs", job.logs());
        body.put("last_log_fetched_at", job.lastLogFetchedAt());
        return body;
    }

    @PostMapping("/{jobId}/cancel")
    public JobResponse cancel(@RequestHeader(USER_HEADER) String userId, @PathVariable String jobId) {
        return JobResponse.from(testService.cancelTest(jobId, userId));
    }

    @PostMapping("/{jobId}/retry")
    public ResponseEntity<Map<String, Object>> retry(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable String jobId,
                                                     @RequestBody(required = false) RetryTestRequest request) {
        SubmissionResult result = testService.retryTest(jobId, userId, request != null ? request.newQuery() : null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(submissionBody(result));
    }

    @PostMapping("/{jobId}/archive")
    public JobResponse archive(@PathVariable String jobId) {
        return JobResponse.from(testService.archiveTest(jobId));
    }

    private static Map<String, Object> submissionBody(SubmissionResult result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("test_id", result.jobId());
        body.put("status", result.status().name());
        body.put("queue_position", result.queuePosition());
        body.put("estimated_wait_seconds", result.estimatedWaitSeconds());
        return body;
    }
}
