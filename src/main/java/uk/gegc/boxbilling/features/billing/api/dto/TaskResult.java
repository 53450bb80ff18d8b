package uk.gegc.boxbilling.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TaskResult")
public record TaskResult(
        String task,
        Status status,
        String message
) {
    public enum Status {
        COMPLETED,
        SKIPPED,
        FAILED
    }

    public static TaskResult completed(String task, String message) {
        return new TaskResult(task, Status.COMPLETED, message);
    }

    public static TaskResult skipped(String task, String message) {
        return new TaskResult(task, Status.SKIPPED, message);
    }

    public static TaskResult failed(String task, String message) {
        return new TaskResult(task, Status.FAILED, message);
    }
}
