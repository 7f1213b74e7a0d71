package com.assetintel.attribution.service;

import com.assetintel.attribution.exception.StoreUnavailableException;
import com.assetintel.attribution.model.AttributionRun;
import com.assetintel.attribution.output.IssueReportRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the attribution run lifecycle: one call, one {@link AttributionRun}.
 *
 * The engine assumes it is the only writer, so overlapping runs inside this
 * process are refused rather than queued.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AttributionService {

    private final AttributionEngine engine;
    private final IssueReportRouter reportRouter;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile AttributionRun currentRun;
    private volatile AttributionRun lastRun;

    /**
     * Run the engine once over every configured category.
     *
     * @return the finished run, or empty if another run was already in progress
     */
    public Optional<AttributionRun> runOnce() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Attribution run {} still in progress; request ignored",
                    currentRun != null ? currentRun.getRunId() : "?");
            return Optional.empty();
        }

        AttributionRun run = AttributionRun.builder()
                .runId(UUID.randomUUID().toString())
                .startedAt(LocalDateTime.now())
                .status(AttributionRun.RunStatus.RUNNING)
                .build();
        currentRun = run;
        log.info("Attribution run {} started", run.getRunId());

        try {
            engine.run(run);
        } catch (StoreUnavailableException e) {
            log.error("Attribution run {} aborted, store unavailable: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(AttributionRun.RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());
        } catch (Exception e) {
            log.error("Attribution run {} failed: {}", run.getRunId(), e.getMessage(), e);
            run.setStatus(AttributionRun.RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            reportRouter.write(run);
            lastRun = run;
            currentRun = null;
            running.set(false);
        }

        log.info("Attribution run {} finished: status={} attributed={} issues={} failedBatches={}",
                run.getRunId(), run.getStatus(), run.totalAttributed(), run.getIssues().size(), run.getFailedBatches());
        return Optional.of(run);
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<AttributionRun> currentRun() {
        return Optional.ofNullable(currentRun);
    }

    public Optional<AttributionRun> lastRun() {
        return Optional.ofNullable(lastRun);
    }

    /**
     * Process exit status for a finished run: 0 only when everything that was
     * eligible was either attributed or deliberately left pending or skipped.
     */
    public static int exitCodeOf(AttributionRun run) {
        return run != null && run.getStatus() == AttributionRun.RunStatus.SUCCESS ? 0 : 1;
    }
}
