package ai.dadaist.collage.select;

import java.nio.file.Path;
import java.util.List;

/**
 * Chooses the source image(s) for one parent position.
 */
public interface PieceSelector {

    /**
     * @param pieceName            parent tile filename in the base variation, e.g. {@code v-0_1.png}
     * @param currentVariationPath directory of the base variation
     * @param allVariationNames    names of every valid sibling variation
     * @param projectRoot          project root, used to locate subdivided tiles
     */
    PlacementRecord select(String pieceName, Path currentVariationPath, List<String> allVariationNames, Path projectRoot);
}
