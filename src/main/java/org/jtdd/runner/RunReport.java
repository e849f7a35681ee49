package org.jtdd.runner;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate output of one runner invocation.
 */
public final class RunReport {
    private final String runId;
    private final Instant generatedAt;
    private final List<UnitResult> results;
    private final int passedCount;
    private final int failedCount;
    private final int missedFailureCount;
    private final boolean aborted;

    RunReport(
        String runId,
        Instant generatedAt,
        List<UnitResult> results,
        int passedCount,
        int failedCount,
        int missedFailureCount,
        boolean aborted
    ) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
        this.results = List.copyOf(new ArrayList<>(Objects.requireNonNull(results, "results")));
        this.passedCount = passedCount;
        this.failedCount = failedCount;
        this.missedFailureCount = missedFailureCount;
        this.aborted = aborted;
    }

    public String runId() {
        return runId;
    }

    public Instant generatedAt() {
        return generatedAt;
    }

    public List<UnitResult> results() {
        return results;
    }

    /**
     * Passed units, including expected failures and passing suite setups and teardowns.
     */
    public int passedCount() {
        return passedCount;
    }

    public int failedCount() {
        return failedCount;
    }

    public int missedFailureCount() {
        return missedFailureCount;
    }

    /**
     * Whether the run stopped early because a suite was not registered.
     */
    public boolean aborted() {
        return aborted;
    }

    public boolean overallPassed() {
        return failedCount == 0 && missedFailureCount == 0 && !aborted;
    }

    public int countOf(Verdict verdict) {
        int count = 0;
        for (UnitResult result : results) {
            if (result.verdict() == verdict) {
                count++;
            }
        }
        return count;
    }
}
