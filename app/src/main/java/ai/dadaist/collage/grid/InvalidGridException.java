package ai.dadaist.collage.grid;

/**
 * Detected grid dimensions fall outside the supported range.
 */
public class InvalidGridException extends RuntimeException {

    private final int rows;
    private final int cols;

    public InvalidGridException(int rows, int cols, String message) {
        super(message);
        this.rows = rows;
        this.cols = cols;
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }
}
