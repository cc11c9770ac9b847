package ai.dadaist.collage.select;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Source of one sub-cell inside a subdivided parent cell.
 */
public record SubcellSource(int childRow, int childCol, String sourceVariation, Path sourcePath) {

    public SubcellSource {
        if (childRow < 0 || childCol < 0) {
            throw new IllegalArgumentException("sub-cell coordinates must not be negative");
        }
        Objects.requireNonNull(sourceVariation, "sourceVariation");
        Objects.requireNonNull(sourcePath, "sourcePath");
    }

    public String key() {
        return childRow + "_" + childCol;
    }
}
