package com.pokerpulse.enrichment.controller;

import com.pokerpulse.enrichment.batch.BackgroundTaskRunner;
import com.pokerpulse.enrichment.batch.TaskModels;
import com.pokerpulse.enrichment.dto.TaskSubmissionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/tasks")
@CrossOrigin(origins = "*")
public class TaskController {
    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final BackgroundTaskRunner runner;

    public TaskController(BackgroundTaskRunner runner) {
        this.runner = runner;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Map<String, String> submit(@RequestHeader("X-Entity-Id") Long entityId, @RequestBody TaskSubmissionRequest request) {
        String taskId = runner.submit(entityId, request);
        log.info("[TaskController][SUBMITTED] entityId={} type={} taskId={}", entityId, request.getTaskType(), taskId);
        return Map.of("taskId", taskId);
    }

    @GetMapping("/{taskId}")
    public TaskModels.TaskStatusResponse status(@RequestHeader("X-Entity-Id") Long entityId, @PathVariable String taskId) {
        return TaskModels.TaskStatusResponse.of(runner.get(entityId, taskId));
    }

    @PostMapping("/{taskId}/cancel")
    public TaskModels.TaskStatusResponse cancel(@RequestHeader("X-Entity-Id") Long entityId, @PathVariable String taskId) {
        return TaskModels.TaskStatusResponse.of(runner.cancel(entityId, taskId));
    }
}
