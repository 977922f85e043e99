package com.practicum.homeworkbot.controller;

import com.practicum.homeworkbot.model.MonitorState;
import com.practicum.homeworkbot.service.HomeworkStatusPoller;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/monitor")
@Tag(name = "Monitor", description = "Inspect the homework status poller and trigger a check")
public class MonitorController {

    private final HomeworkStatusPoller poller;

    public MonitorController(HomeworkStatusPoller poller) {
        this.poller = poller;
    }

    @GetMapping
    @Operation(summary = "Get poller state",
               description = "Returns the cursor, the last reported verdict and the last alerted failure")
    public ResponseEntity<MonitorState> getState() {
        return ResponseEntity.ok(poller.getState());
    }

    @PostMapping("/check")
    @Operation(summary = "Run a poll cycle now",
               description = "Runs one fetch/validate/detect/notify cycle immediately. Waits for a scheduled cycle in progress.")
    public ResponseEntity<MonitorState> triggerCheck() {
        poller.runCycle();
        return ResponseEntity.ok(poller.getState());
    }
}
