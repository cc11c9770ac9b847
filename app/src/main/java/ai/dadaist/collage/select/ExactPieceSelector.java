package ai.dadaist.collage.select;

import java.nio.file.Path;
import java.util.List;

/**
 * Always returns the tile at the same position of the current variation.
 */
public class ExactPieceSelector implements PieceSelector {

    @Override
    public PlacementRecord select(String pieceName, Path currentVariationPath, List<String> allVariationNames, Path projectRoot) {
        String variation = currentVariationPath.getFileName().toString();
        return new OriginalPlacement(variation, pieceName, currentVariationPath.resolve(pieceName));
    }
}
