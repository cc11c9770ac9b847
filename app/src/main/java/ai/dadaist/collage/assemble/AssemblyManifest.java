package ai.dadaist.collage.assemble;

import ai.dadaist.collage.grid.GridSpec;
import ai.dadaist.collage.select.PlacementRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Provenance record of one canvas: which source filled each parent position, keyed {@code row_col}.
 */
public record AssemblyManifest(Metadata metadata, GridSpec gridSpec, Map<String, PlacementRecord> positions) {

    public AssemblyManifest {
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(gridSpec, "gridSpec");
        positions = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(positions, "positions")));
    }

    public Optional<PlacementRecord> placementAt(int row, int col) {
        return Optional.ofNullable(positions.get(row + "_" + col));
    }

    /**
     * @param runNumber      1-based run index; empty for exact restores
     * @param baseDirectory  project-relative directory that supplied the grid topology
     */
    public record Metadata(String project, String strategy, Optional<Integer> runNumber, String baseDirectory) {

        public Metadata {
            Objects.requireNonNull(project, "project");
            Objects.requireNonNull(strategy, "strategy");
            runNumber = runNumber == null ? Optional.empty() : runNumber;
            Objects.requireNonNull(baseDirectory, "baseDirectory");
        }
    }
}
