package ai.dadaist.collage.assemble;

import java.nio.file.Path;

/**
 * No subdirectory of the rendered-tiles root is a usable tile set.
 */
public class NoValidVariationsException extends RuntimeException {

    public NoValidVariationsException(Path renderedTilesRoot) {
        super("No valid tile directories found in " + renderedTilesRoot);
    }
}
