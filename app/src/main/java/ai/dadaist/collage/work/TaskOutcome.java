package ai.dadaist.collage.work;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of a single pooled task. Failed tasks keep the failure message instead of propagating.
 */
public record TaskOutcome<T>(String taskName, Status status, Optional<T> value, Optional<String> failure) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public TaskOutcome {
        Objects.requireNonNull(taskName, "taskName");
        Objects.requireNonNull(status, "status");
        value = value == null ? Optional.empty() : value;
        failure = failure == null ? Optional.empty() : failure;
    }

    public static <T> TaskOutcome<T> succeeded(String taskName, T value) {
        return new TaskOutcome<>(taskName, Status.SUCCEEDED, Optional.ofNullable(value), Optional.empty());
    }

    public static <T> TaskOutcome<T> failed(String taskName, String failure) {
        return new TaskOutcome<>(taskName, Status.FAILED, Optional.empty(), Optional.ofNullable(failure));
    }

    public static <T> TaskOutcome<T> skipped(String taskName) {
        return new TaskOutcome<>(taskName, Status.SKIPPED, Optional.empty(), Optional.empty());
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
