package ai.dadaist.collage.select;

/**
 * Which source image(s) fill one parent cell of the canvas.
 */
public interface PlacementRecord {

    String ORIGINAL_SCHEME = "original";

    /**
     * {@code original} for a whole tile, {@code NxN} for a subdivision grid.
     */
    String scheme();
}
