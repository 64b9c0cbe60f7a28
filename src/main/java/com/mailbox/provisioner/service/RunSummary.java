package com.mailbox.provisioner.service;

import com.mailbox.provisioner.entity.JobOutcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class RunSummary {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_FLAGGED = 3;

    private final Map<JobOutcome, Integer> counts = new EnumMap<>(JobOutcome.class);
    private final List<String> succeeded = new ArrayList<>();
    private final List<String> flagged = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private int abandoned;
    private String runError;

    public synchronized void record(JobOutcome outcome, String email) {
        counts.merge(outcome, 1, Integer::sum);
        String label = email == null ? "<unassigned>" : email;
        switch (outcome) {
            case SUCCEEDED -> succeeded.add(label);
            case FLAGGED -> flagged.add(label);
            case FAILED, INTERRUPTED -> failed.add(label);
        }
    }

    /**
     * Jobs still queued when the run was stopped.
     */
    public synchronized void recordAbandoned(int count) {
        abandoned += count;
    }

    public synchronized void recordRunError(String message) {
        if (runError == null) {
            runError = message;
        }
    }

    public synchronized int count(JobOutcome outcome) {
        return counts.getOrDefault(outcome, 0);
    }

    public synchronized int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    public synchronized List<String> succeededEmails() {
        return List.copyOf(succeeded);
    }

    public synchronized List<String> flaggedEmails() {
        return List.copyOf(flagged);
    }

    public synchronized List<String> failedEmails() {
        return List.copyOf(failed);
    }

    public synchronized int abandoned() {
        return abandoned;
    }

    public synchronized String runError() {
        return runError;
    }

    /**
     * 0 when every job succeeded, 3 when some were only flagged, 1 on any
     * failure, interruption or run-level error.
     */
    public synchronized int exitCode() {
        if (runError != null || abandoned > 0 || count(JobOutcome.FAILED) > 0 || count(JobOutcome.INTERRUPTED) > 0) {
            return EXIT_FAILED;
        }
        if (count(JobOutcome.FLAGGED) > 0) {
            return EXIT_FLAGGED;
        }
        return EXIT_OK;
    }

    @Override
    public synchronized String toString() {
        return String.format("succeeded=%d flagged=%d failed=%d interrupted=%d abandoned=%d%s",
                count(JobOutcome.SUCCEEDED), count(JobOutcome.FLAGGED), count(JobOutcome.FAILED),
                count(JobOutcome.INTERRUPTED), abandoned, runError == null ? "" : " error=" + runError);
    }
}
