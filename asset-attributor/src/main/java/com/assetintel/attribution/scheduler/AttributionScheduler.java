package com.assetintel.attribution.scheduler;

import com.assetintel.attribution.config.AttributorProperties;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.service.AttributionService;
import com.assetintel.attribution.store.AssetStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Manages scheduled and on-startup attribution runs.
 *
 * Default schedule: every night at 03:00 UTC, after the field edits of the
 * day have been posted. Override with ATTRIBUTOR_CRON or
 * attributor.scheduling.cron.
 *
 * With attributor.scheduling.exit-after-startup-run (the oneshot profile) the
 * startup run's status becomes the process exit code.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AttributionScheduler implements ExitCodeGenerator {

    private final AttributionService attributionService;
    private final AssetStore assetStore;
    private final AttributorProperties properties;

    private int exitCode = 0;

    /**
     * On application startup:
     *  1. Always ensure the database schema exists
     *  2. Optionally run once if RUN_ON_STARTUP=true or in oneshot mode
     */
    @PostConstruct
    public void onStartup() {
        try {
            assetStore.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise asset store schema: {}", e.getMessage());
        }

        AttributorProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.isRunOnStartup() || scheduling.isExitAfterStartupRun()) {
            log.info("Running attribution at startup");
            Optional<AttributionRun> run = attributionService.runOnce();
            exitCode = run.map(AttributionService::exitCodeOf).orElse(1);
        } else {
            log.info("Attributor ready. Next scheduled run: {}", scheduling.getCron());
        }
    }

    @Scheduled(cron = "${attributor.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRun() {
        log.info("Scheduled attribution triggered");
        try {
            attributionService.runOnce();
        } catch (Exception e) {
            log.error("Scheduled attribution failed: {}", e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
