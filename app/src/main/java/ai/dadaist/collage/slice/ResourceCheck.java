package ai.dadaist.collage.slice;

/**
 * Advisory comparison of estimated and available memory, both in GiB.
 */
public record ResourceCheck(boolean canProcess, double availableGb, double requiredGb) {
}
