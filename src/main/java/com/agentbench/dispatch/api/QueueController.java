package com.agentbench.dispatch.api;

import com.agentbench.core.scheduler.QueueScheduler;
import com.agentbench.core.service.QueueStatus;
import com.agentbench.core.service.TestExecutionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private final TestExecutionService testService;
    private final QueueScheduler scheduler;

    public QueueController(TestExecutionService testService, QueueScheduler scheduler) {
        this.testService = testService;
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        QueueStatus status = testService.getQueueStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pending_count", status.pendingCount());
        body.put("running_count", status.runningCount());
        body.put("capacity", status.capacity());
        body.put("avg_wait_ms", status.avgWaitMs());
        body.put("oldest_pending_age_ms", status.oldestPendingAgeMs());
        return body;
    }

    /**
     * POST /api/v1/queue/process: Runs one claim tick now.
     */
    @PostMapping("/process")
    public Map<String, Object> process() {
        return Map.of("claimed", scheduler.processQueue());
    }
}
