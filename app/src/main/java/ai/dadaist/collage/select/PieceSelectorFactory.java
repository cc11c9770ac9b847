package ai.dadaist.collage.select;

import ai.dadaist.collage.subdivide.SubdivisionScale;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Provides the selector registered for each {@link PlacementStrategy}.
 */
public class PieceSelectorFactory {

    private final PieceSelector exactSelector;
    private final PieceSelector randomSelector;
    private final PieceSelector multiScaleSelector;

    public PieceSelectorFactory(PieceSelector exactSelector,
                                PieceSelector randomSelector,
                                PieceSelector multiScaleSelector) {
        this.exactSelector = Objects.requireNonNull(exactSelector, "exactSelector");
        this.randomSelector = Objects.requireNonNull(randomSelector, "randomSelector");
        this.multiScaleSelector = Objects.requireNonNull(multiScaleSelector, "multiScaleSelector");
    }

    public static PieceSelectorFactory create(Random random, List<SubdivisionScale> scales) {
        return new PieceSelectorFactory(new ExactPieceSelector(),
                new RandomPieceSelector(random),
                new MultiScalePieceSelector(random, scales));
    }

    public PieceSelector select(PlacementStrategy strategy) {
        return switch (strategy) {
            case EXACT -> exactSelector;
            case RANDOM -> randomSelector;
            case MULTI_SCALE -> multiScaleSelector;
        };
    }
}
