package ai.dadaist.collage.grid;

/**
 * Grid topology and per-piece pixel size of one tile directory.
 */
public record GridSpec(int rows, int cols, int pieceHeight, int pieceWidth) {

    public static final int MIN_DIMENSION = 1;
    public static final int MAX_DIMENSION = 100;

    public GridSpec {
        if (rows < MIN_DIMENSION || cols < MIN_DIMENSION) {
            throw new GridTooSmallException(rows, cols);
        }
        if (rows > MAX_DIMENSION || cols > MAX_DIMENSION) {
            throw new GridTooLargeException(rows, cols);
        }
        if (pieceHeight <= 0 || pieceWidth <= 0) {
            throw new IllegalArgumentException("piece size must be positive: " + pieceWidth + "x" + pieceHeight);
        }
    }

    public int canvasHeight() {
        return rows * pieceHeight;
    }

    public int canvasWidth() {
        return cols * pieceWidth;
    }

    public long canvasBytes() {
        return GridManager.estimateCanvasMemory(rows, cols, pieceHeight, pieceWidth);
    }
}
