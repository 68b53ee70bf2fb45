package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.extract.AdExtractor;
import com.delta.adfeed.monitor.fetch.PageFetchException;
import com.delta.adfeed.monitor.fetch.PageFetcher;
import com.delta.adfeed.monitor.filter.FilterEngine;
import com.delta.adfeed.monitor.model.AdRecord;
import com.delta.adfeed.monitor.model.CandidateRecord;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.CycleSummary;
import com.delta.adfeed.monitor.model.NewAdEvent;
import com.delta.adfeed.monitor.model.Target;
import com.delta.adfeed.monitor.model.TargetCycleSummary;
import com.delta.adfeed.monitor.model.UpsertOutcome;
import com.delta.adfeed.monitor.persistence.AdJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One poll cycle: fetch, extract, filter and store every target in turn, then prune. A failing
 * target is recorded in the summary and skipped; only an interrupt ends the cycle early.
 */
@Service
public class AdMonitorService {
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String STATUS_ABORTED = "ABORTED";
    public static final String STATUS_FAILED = "FAILED";

    private static final Logger log = LoggerFactory.getLogger(AdMonitorService.class);

    private final PageFetcher pageFetcher;
    private final AdExtractor adExtractor;
    private final FilterEngine filterEngine;
    private final AdJdbcRepository repository;
    private final ApplicationEventPublisher eventPublisher;
    private final MonitorProperties properties;
    private final Clock clock;

    public AdMonitorService(
        PageFetcher pageFetcher,
        AdExtractor adExtractor,
        FilterEngine filterEngine,
        AdJdbcRepository repository,
        ApplicationEventPublisher eventPublisher,
        MonitorProperties properties,
        Clock clock
    ) {
        this.pageFetcher = pageFetcher;
        this.adExtractor = adExtractor;
        this.filterEngine = filterEngine;
        this.repository = repository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public CycleSummary runCycle(long cycleNumber, ConfigSnapshot config) {
        Instant startedAt = Instant.now(clock);
        String status = STATUS_FAILED;
        List<TargetCycleSummary> summaries = new ArrayList<>();
        int pruned = 0;
        log.info("Cycle {} started for {} targets", cycleNumber, config.targets().size());

        try {
            List<Target> targets = config.targets();
            for (int i = 0; i < targets.size(); i++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("cycle interrupted before " + targets.get(i).url());
                }
                summaries.add(processTarget(targets.get(i), config.currency()));
                if (i < targets.size() - 1) {
                    pauseBetweenTargets();
                }
            }
            pruned = pruneQuietly();
            boolean hadErrors = summaries.stream().anyMatch(summary -> !summary.succeeded());
            status = hadErrors ? STATUS_COMPLETED_WITH_ERRORS : STATUS_COMPLETED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Cycle {} aborted: {}", cycleNumber, e.getMessage());
            status = STATUS_ABORTED;
        } catch (RuntimeException e) {
            log.warn("Cycle {} failed", cycleNumber, e);
            status = STATUS_FAILED;
        }

        CycleSummary summary = new CycleSummary(
            cycleNumber,
            startedAt,
            Instant.now(clock),
            status,
            List.copyOf(summaries),
            pruned
        );
        log.info(
            "Cycle {} finished: status={} targets={} new_ads={} pruned={}",
            cycleNumber,
            status,
            summaries.size(),
            summary.insertedCount(),
            pruned
        );
        return summary;
    }

    TargetCycleSummary processTarget(Target target, String currency) {
        String url = target.url();
        String html;
        try {
            html = pageFetcher.fetch(url);
        } catch (PageFetchException e) {
            log.warn("Skipping target {}: fetch failed ({})", url, e.getMessage());
            return TargetCycleSummary.failed(url, e.getErrorCode() == null ? "fetch_failed" : e.getErrorCode());
        }

        List<CandidateRecord> candidates;
        try {
            candidates = adExtractor.extract(html, target, currency);
        } catch (RuntimeException e) {
            log.warn("Skipping target {}: extraction failed", url, e);
            return TargetCycleSummary.failed(url, "extraction_failed");
        }
        if (candidates.isEmpty()) {
            log.info("No ads extracted from {}", url);
        }

        int accepted = 0;
        int inserted = 0;
        int updated = 0;
        int storageErrors = 0;
        for (CandidateRecord candidate : candidates) {
            if (!filterEngine.accepts(target.filterSpec(), candidate.title())) {
                continue;
            }
            accepted++;
            AdRecord ad = AdRecord.fromCandidate(candidate, Instant.now(clock));
            UpsertOutcome outcome;
            try {
                outcome = repository.upsert(ad);
            } catch (DataAccessException e) {
                storageErrors++;
                log.warn("Failed to store ad {} from {}", ad.url(), url, e);
                continue;
            }
            if (outcome == UpsertOutcome.INSERTED) {
                inserted++;
                log.info("New ad: {} - {} ({})", ad.title(), ad.price(), ad.url());
                eventPublisher.publishEvent(new NewAdEvent(ad, url));
            } else {
                updated++;
            }
        }
        log.info(
            "Target {}: candidates={} accepted={} new={} seen_again={}",
            url,
            candidates.size(),
            accepted,
            inserted,
            updated
        );
        return new TargetCycleSummary(url, candidates.size(), accepted, inserted, updated, storageErrors, null);
    }

    private int pruneQuietly() {
        Duration retention = Duration.ofDays(properties.getRetentionDays());
        try {
            int removed = repository.prune(retention);
            if (removed > 0) {
                log.info("Pruned {} ads not seen for {} days", removed, retention.toDays());
            }
            return removed;
        } catch (DataAccessException e) {
            log.warn("Prune of ads older than {} days failed", retention.toDays(), e);
            return 0;
        }
    }

    private void pauseBetweenTargets() throws InterruptedException {
        int minMs = properties.getScheduler().getInterTargetDelayMinMs();
        int maxMs = properties.getScheduler().getInterTargetDelayMaxMs();
        if (maxMs <= 0) {
            return;
        }
        long delay = minMs >= maxMs ? minMs : ThreadLocalRandom.current().nextLong(minMs, maxMs + 1L);
        if (delay > 0) {
            Thread.sleep(delay);
        }
    }
}
