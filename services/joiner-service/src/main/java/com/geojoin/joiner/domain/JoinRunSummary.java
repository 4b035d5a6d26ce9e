package com.geojoin.joiner.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Counters for one coordinator run. Only the coordinator thread mutates an instance.
 */
public class JoinRunSummary {

    private UUID runId;
    private Instant startedAt;
    private Instant completedAt;
    private RunStatus status;
    private int pagesFetched;
    private int pagesFailed;
    private int dispatchedCount;
    private int resolvedCount;
    private int emptyMatchCount;
    private int pointFailedCount;
    private int pipFailedCount;
    private long lastSequenceNumber = -1;
    private String errorSummary;

    public static JoinRunSummary startNew() {
        JoinRunSummary run = new JoinRunSummary();
        run.runId = UUID.randomUUID();
        run.startedAt = Instant.now();
        run.status = RunStatus.RUNNING;
        return run;
    }

    public void incrementPagesFetched() {
        this.pagesFetched++;
    }

    public void incrementPagesFailed() {
        this.pagesFailed++;
    }

    public void record(ResolutionOutcome outcome) {
        this.dispatchedCount++;
        this.lastSequenceNumber = Math.max(lastSequenceNumber, outcome.sequenceNumber());
        switch (outcome.status()) {
            case RESOLVED -> {
                this.resolvedCount++;
                if (outcome.isEmptyMatch()) {
                    this.emptyMatchCount++;
                }
            }
            case POINT_LOOKUP_FAILED -> this.pointFailedCount++;
            case POLYGON_MATCH_FAILED -> this.pipFailedCount++;
        }
    }

    public void complete() {
        this.completedAt = Instant.now();
        this.status = hasFailures() ? RunStatus.PARTIAL_SUCCESS : RunStatus.SUCCEEDED;
    }

    public void fail(String errorSummary) {
        this.completedAt = Instant.now();
        this.status = RunStatus.FAILED;
        this.errorSummary = errorSummary;
    }

    public boolean hasFailures() {
        return pagesFailed > 0 || pointFailedCount > 0 || pipFailedCount > 0;
    }

    public UUID getRunId() {
        return runId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public RunStatus getStatus() {
        return status;
    }

    public int getPagesFetched() {
        return pagesFetched;
    }

    public int getPagesFailed() {
        return pagesFailed;
    }

    public int getDispatchedCount() {
        return dispatchedCount;
    }

    public int getResolvedCount() {
        return resolvedCount;
    }

    public int getEmptyMatchCount() {
        return emptyMatchCount;
    }

    public int getPointFailedCount() {
        return pointFailedCount;
    }

    public int getPipFailedCount() {
        return pipFailedCount;
    }

    /**
     * Highest sequence number written in this run, or -1 when nothing was dispatched.
     */
    public long getLastSequenceNumber() {
        return lastSequenceNumber;
    }

    public String getErrorSummary() {
        return errorSummary;
    }
}
