package com.agentbench.dispatch.api;

import com.agentbench.core.model.JobStatus;
import com.agentbench.core.service.TestExecutionService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Internal endpoints for collaborators that report on jobs directly, such as a container that
 * posts its own status or log lines.
 */
@RestController
@RequestMapping("/api/internal/tests")
public class InternalApiController {

    private static final Logger log = LoggerFactory.getLogger(InternalApiController.class);

    private final TestExecutionService testService;

    public InternalApiController(TestExecutionService testService) {
        this.testService = testService;
    }

    @PostMapping("/{jobId}/status")
    public JobResponse updateStatus(@PathVariable String jobId, @Valid @RequestBody StatusUpdateRequest request) {
        JobStatus status = JobStatus.valueOf(request.status().toUpperCase());
        log.info("External status update for job {}: {}", jobId, status);
        return JobResponse.summary(testService.updateStatus(jobId, status, request.error(), request.errorStage()));
    }

    @PostMapping("/{jobId}/logs")
    public JobResponse appendLogs(@PathVariable String jobId, @RequestBody List<String> lines) {
        log.debug("Received {} log line(s) for job {}", lines.size(), jobId);
        return JobResponse.summary(testService.appendLogs(jobId, lines));
    }
}
