package ai.dadaist.collage.select;

import ai.dadaist.collage.subdivide.SubdivisionScale;
import java.util.List;
import java.util.Objects;

/**
 * A parent cell rebuilt from an N x N grid of sub-tiles. Sub-cells absent from {@code subcells}
 * stay blank on the canvas.
 */
public record SubdividedPlacement(SubdivisionScale scale, List<SubcellSource> subcells) implements PlacementRecord {

    public SubdividedPlacement {
        Objects.requireNonNull(scale, "scale");
        subcells = List.copyOf(Objects.requireNonNull(subcells, "subcells"));
    }

    @Override
    public String scheme() {
        return scale.directoryName();
    }

    public SubdividedPlacement withSubcells(List<SubcellSource> placed) {
        return new SubdividedPlacement(scale, placed);
    }
}
