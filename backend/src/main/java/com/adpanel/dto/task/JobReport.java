package com.adpanel.dto.task;

/** Counts a job run reports to the task run log. */
public record JobReport(int processed, int succeeded, int failed, String message) {

    public static JobReport of(int processed, int succeeded, int failed, String message) {
        return new JobReport(processed, succeeded, failed, message);
    }

    public static JobReport skipped(String message) {
        return new JobReport(0, 0, 0, message);
    }

    public boolean hasFailures() {
        return failed > 0;
    }
}
