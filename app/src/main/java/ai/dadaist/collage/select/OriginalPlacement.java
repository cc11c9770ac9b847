package ai.dadaist.collage.select;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A whole parent tile taken from one variation.
 */
public record OriginalPlacement(String sourceVariation, String sourceFilename, Path sourcePath)
        implements PlacementRecord {

    public OriginalPlacement {
        Objects.requireNonNull(sourceVariation, "sourceVariation");
        Objects.requireNonNull(sourceFilename, "sourceFilename");
        Objects.requireNonNull(sourcePath, "sourcePath");
    }

    @Override
    public String scheme() {
        return ORIGINAL_SCHEME;
    }
}
