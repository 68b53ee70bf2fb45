package com.delta.adfeed.monitor.api;

import com.delta.adfeed.monitor.model.HealthResponse;
import com.delta.adfeed.monitor.service.AdFeedService;
import com.delta.adfeed.monitor.service.HealthService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class FeedController {
    static final MediaType RSS = MediaType.parseMediaType("application/rss+xml;charset=UTF-8");

    private final AdFeedService feedService;
    private final HealthService healthService;

    public FeedController(AdFeedService feedService, HealthService healthService) {
        this.feedService = feedService;
        this.healthService = healthService;
    }

    @GetMapping("/rss")
    public ResponseEntity<String> rss() {
        return ResponseEntity.ok()
            .contentType(RSS)
            .body(feedService.render());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return healthService.check();
    }
}
