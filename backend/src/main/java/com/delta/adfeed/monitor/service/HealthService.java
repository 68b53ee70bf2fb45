package com.delta.adfeed.monitor.service;

import com.delta.adfeed.monitor.model.HealthResponse;
import com.delta.adfeed.monitor.persistence.AdJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Service
public class HealthService {
    private static final Logger log = LoggerFactory.getLogger(HealthService.class);

    private final AdJdbcRepository repository;
    private final MonitorConfigService configService;
    private final Clock clock;
    private final Instant startedAt;

    public HealthService(AdJdbcRepository repository, MonitorConfigService configService, Clock clock) {
        this.repository = repository;
        this.configService = configService;
        this.clock = clock;
        this.startedAt = Instant.now(clock);
    }

    public HealthResponse check() {
        Instant now = Instant.now(clock);
        boolean reachable = false;
        long storedAds = 0;
        try {
            reachable = repository.isDbReachable();
            storedAds = repository.countAds();
        } catch (DataAccessException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
        }
        return new HealthResponse(
            "up",
            now,
            configService.getSnapshot().databaseName(),
            Math.max(0, Duration.between(startedAt, now).toSeconds()),
            reachable,
            storedAds
        );
    }
}
