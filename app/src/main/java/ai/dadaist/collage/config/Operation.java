package ai.dadaist.collage.config;

/**
 * Pipeline stage run by the CLI.
 */
public enum Operation {
    SLICE,
    SUBDIVIDE,
    ASSEMBLE;

    public static Operation from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ASSEMBLE;
        }
        for (Operation operation : values()) {
            if (operation.name().equalsIgnoreCase(raw.trim())) {
                return operation;
            }
        }
        throw new IllegalArgumentException("Unsupported operation: " + raw);
    }
}
