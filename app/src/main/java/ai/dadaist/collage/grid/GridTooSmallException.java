package ai.dadaist.collage.grid;

public class GridTooSmallException extends InvalidGridException {

    public GridTooSmallException(int rows, int cols) {
        super(rows, cols, "Grid dimensions too small: " + rows + "x" + cols);
    }
}
