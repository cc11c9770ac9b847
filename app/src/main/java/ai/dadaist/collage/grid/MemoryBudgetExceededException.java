package ai.dadaist.collage.grid;

/**
 * Estimated memory for a canvas or processing step is above what the caller allows.
 */
public class MemoryBudgetExceededException extends RuntimeException {

    private final long requiredBytes;
    private final long limitBytes;

    public MemoryBudgetExceededException(long requiredBytes, long limitBytes, String message) {
        super(message);
        this.requiredBytes = requiredBytes;
        this.limitBytes = limitBytes;
    }

    public long requiredBytes() {
        return requiredBytes;
    }

    public long limitBytes() {
        return limitBytes;
    }
}
