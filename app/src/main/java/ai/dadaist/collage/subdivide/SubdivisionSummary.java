package ai.dadaist.collage.subdivide;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-scale success and failure counts of a subdivision batch.
 */
public record SubdivisionSummary(Map<SubdivisionScale, ScaleCounts> counts, int skippedTiles) {

    public SubdivisionSummary {
        counts = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(counts, "counts")));
        if (skippedTiles < 0) {
            throw new IllegalArgumentException("skippedTiles must not be negative");
        }
    }

    public ScaleCounts countsFor(SubdivisionScale scale) {
        return counts.getOrDefault(scale, ScaleCounts.ZERO);
    }

    public int totalSucceeded() {
        return counts.values().stream().mapToInt(ScaleCounts::succeeded).sum();
    }

    public int totalFailed() {
        return counts.values().stream().mapToInt(ScaleCounts::failed).sum();
    }

    public boolean hasFailures() {
        return totalFailed() > 0;
    }

    public record ScaleCounts(int succeeded, int failed) {

        public static final ScaleCounts ZERO = new ScaleCounts(0, 0);

        public ScaleCounts plus(boolean success) {
            return success ? new ScaleCounts(succeeded + 1, failed) : new ScaleCounts(succeeded, failed + 1);
        }
    }
}
