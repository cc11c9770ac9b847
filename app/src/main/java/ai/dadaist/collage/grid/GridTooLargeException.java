package ai.dadaist.collage.grid;

public class GridTooLargeException extends InvalidGridException {

    public GridTooLargeException(int rows, int cols) {
        super(rows, cols, "Grid dimensions (" + rows + "x" + cols + ") exceed maximum allowed size "
                + GridSpec.MAX_DIMENSION + "x" + GridSpec.MAX_DIMENSION);
    }
}
