package ai.dadaist.collage.assemble;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate of one assembler invocation. {@code failedRuns} lists the remix runs that produced
 * no canvas; exact restores never populate it.
 */
public record AssemblyResult(List<CanvasOutput> outputs,
                             List<String> failedVariations,
                             List<Integer> failedRuns,
                             int blankPositions) {

    public AssemblyResult {
        outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
        failedVariations = List.copyOf(Objects.requireNonNull(failedVariations, "failedVariations"));
        failedRuns = List.copyOf(Objects.requireNonNull(failedRuns, "failedRuns"));
        if (blankPositions < 0) {
            throw new IllegalArgumentException("blankPositions must not be negative");
        }
    }

    public boolean hasFailures() {
        return !failedVariations.isEmpty() || !failedRuns.isEmpty();
    }
}
