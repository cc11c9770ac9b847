package ai.dadaist.collage.grid;

/**
 * Row and column count inferred from tile names.
 */
public record GridSize(int rows, int cols) {
}
