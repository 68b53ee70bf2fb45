package com.delta.adfeed.monitor.api;

import com.delta.adfeed.monitor.model.MonitorStatusResponse;
import com.delta.adfeed.monitor.service.AdMonitorScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/monitor")
public class MonitorController {
    private final AdMonitorScheduler scheduler;

    public MonitorController(AdMonitorScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public MonitorStatusResponse status() {
        return scheduler.getStatus();
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run() {
        long cycleNumber = scheduler.triggerNow();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(Map.of("cycleNumber", cycleNumber, "status", "started"));
    }
}
