package ai.dadaist.collage.select;

import java.util.Locale;

/**
 * Tile selection strategies available to the assembler.
 */
public enum PlacementStrategy {
    EXACT("exact"),
    RANDOM("random"),
    MULTI_SCALE("multi-scale");

    private final String label;

    PlacementStrategy(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static PlacementStrategy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return EXACT;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (normalized) {
            case "exact", "restore" -> EXACT;
            case "random", "randomize" -> RANDOM;
            case "multi-scale", "multiscale" -> MULTI_SCALE;
            default -> throw new IllegalArgumentException("Unsupported strategy: " + raw);
        };
    }
}
