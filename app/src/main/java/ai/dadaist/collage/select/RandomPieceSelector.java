package ai.dadaist.collage.select;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Draws the variation uniformly on every call, so one canvas can mix all variations.
 */
public class RandomPieceSelector implements PieceSelector {

    private final Random random;

    public RandomPieceSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public PlacementRecord select(String pieceName, Path currentVariationPath, List<String> allVariationNames, Path projectRoot) {
        if (allVariationNames == null || allVariationNames.isEmpty()) {
            throw new IllegalArgumentException("allVariationNames must not be empty");
        }
        String variation = allVariationNames.get(random.nextInt(allVariationNames.size()));
        Path variationsRoot = currentVariationPath.toAbsolutePath().getParent();
        return new OriginalPlacement(variation, pieceName, variationsRoot.resolve(variation).resolve(pieceName));
    }
}
