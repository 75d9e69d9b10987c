package io.fullerstack.uptime.core.run;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate result of a run.
 * <p>
 * {@code success} is false only when the run could not start (configuration
 * problem). Per-target failures leave it true and show up on the records.
 *
 * @param statusCode 200 for a completed run, 500 for a run that never started
 * @param success    whether the run got as far as evaluating targets
 * @param message    summary line
 * @param records    per-target records in configuration order
 */
public record RunReport(
    int statusCode,
    boolean success,
    String message,
    List<EvaluationRecord> records
) {
    public static final int OK = 200;
    public static final int FAILED = 500;
    public static final String COMPLETED_MESSAGE = "URL ping completed";

    public RunReport {
        Objects.requireNonNull(message, "message cannot be null");
        records = List.copyOf(records);
    }

    public static RunReport completed(List<EvaluationRecord> records) {
        return new RunReport(OK, true, COMPLETED_MESSAGE, records);
    }

    public static RunReport failed(String reason) {
        return new RunReport(FAILED, false, "Error: " + reason, List.of());
    }

    public long errorCount() {
        return records.stream().filter(EvaluationRecord::hasError).count();
    }
}
