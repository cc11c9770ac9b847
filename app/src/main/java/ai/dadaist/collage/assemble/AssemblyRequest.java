package ai.dadaist.collage.assemble;

import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.select.PlacementStrategy;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Inputs of one composition run.
 */
public record AssemblyRequest(String projectName,
                              Path projectRoot,
                              Path renderedTilesRoot,
                              Path outputRoot,
                              PlacementStrategy strategy,
                              int runCount) {

    public AssemblyRequest {
        projectName = requireNonBlank(projectName, "projectName");
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        renderedTilesRoot = Objects.requireNonNull(renderedTilesRoot, "renderedTilesRoot").toAbsolutePath().normalize();
        outputRoot = Objects.requireNonNull(outputRoot, "outputRoot").toAbsolutePath().normalize();
        Objects.requireNonNull(strategy, "strategy");
        if (runCount < 1) {
            throw new IllegalArgumentException("runCount must be at least 1");
        }
    }

    /**
     * Request using the standard {@code rendered_tiles} and {@code collage_out} directories of a project.
     */
    public static AssemblyRequest forProject(String projectName, ProjectLayout layout, PlacementStrategy strategy, int runCount) {
        return new AssemblyRequest(projectName, layout.root(), layout.renderedTilesDir(), layout.collageOutDir(), strategy, runCount);
    }

    /**
     * Exact restores always produce a single canvas per variation.
     */
    public int effectiveRunCount() {
        return strategy == PlacementStrategy.EXACT ? 1 : runCount;
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
