package ai.dadaist.collage.grid;

import java.util.Objects;

/**
 * Memory ceiling for canvas allocation and the policy applied when an estimate exceeds it.
 */
public record CanvasBudget(long ceilingBytes, OverridePrompt overridePrompt) {

    public static final long DEFAULT_CEILING_BYTES = 32L * 1024 * 1024 * 1024;

    public CanvasBudget {
        if (ceilingBytes <= 0) {
            throw new IllegalArgumentException("ceilingBytes must be positive");
        }
        overridePrompt = Objects.requireNonNull(overridePrompt, "overridePrompt");
    }

    public static CanvasBudget strict() {
        return new CanvasBudget(DEFAULT_CEILING_BYTES, OverridePrompt.DENY);
    }

    public static CanvasBudget ofGigabytes(double gigabytes, OverridePrompt prompt) {
        return new CanvasBudget((long) (gigabytes * 1024 * 1024 * 1024), prompt);
    }
}
