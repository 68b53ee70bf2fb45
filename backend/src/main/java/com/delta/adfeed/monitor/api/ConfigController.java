package com.delta.adfeed.monitor.api;

import com.delta.adfeed.monitor.model.ConfigDocument;
import com.delta.adfeed.monitor.model.ConfigUpdateResult;
import com.delta.adfeed.monitor.model.ConfigUpdateStatus;
import com.delta.adfeed.monitor.service.MonitorConfigService;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/config")
public class ConfigController {
    private final MonitorConfigService configService;

    public ConfigController(MonitorConfigService configService) {
        this.configService = configService;
    }

    @GetMapping
    public ConfigDocument current() {
        return configService.getDocument();
    }

    /**
     * 200 when applied, 400 when rejected by validation, 500 when the update failed after validation
     * (the body says whether the previous configuration was restored).
     */
    @PostMapping
    public ResponseEntity<ConfigUpdateResult> update(@RequestBody JsonNode candidate) {
        ConfigUpdateResult result = configService.applyUpdate(candidate);
        return ResponseEntity.status(statusFor(result.status())).body(result);
    }

    static HttpStatus statusFor(ConfigUpdateStatus status) {
        return switch (status) {
            case APPLIED -> HttpStatus.OK;
            case REJECTED -> HttpStatus.BAD_REQUEST;
            case ROLLED_BACK, ROLLBACK_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
