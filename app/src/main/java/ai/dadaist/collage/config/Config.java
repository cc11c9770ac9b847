package ai.dadaist.collage.config;

import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.select.PlacementStrategy;
import ai.dadaist.collage.subdivide.SubdivisionScale;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Operation operation,
        Path projectRoot,
        String projectName,
        PlacementStrategy strategy,
        int runs,
        int gridSize,
        List<SubdivisionScale> scales,
        double memoryCeilingGb,
        boolean allowLargeCanvas,
        OptionalInt chunkSize,
        int workerThreads,
        int renderedTileSize,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(operation, "operation");
        projectRoot = Objects.requireNonNull(projectRoot, "projectRoot").toAbsolutePath().normalize();
        if (projectName == null || projectName.isBlank()) {
            throw new IllegalArgumentException("projectName must not be blank");
        }
        Objects.requireNonNull(strategy, "strategy");
        if (runs < 1) {
            throw new IllegalArgumentException("runs must be at least 1");
        }
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be at least 1");
        }
        scales = List.copyOf(Objects.requireNonNull(scales, "scales"));
        if (scales.isEmpty()) {
            throw new IllegalArgumentException("at least one subdivision scale must be configured");
        }
        if (memoryCeilingGb <= 0) {
            throw new IllegalArgumentException("memoryCeilingGb must be positive");
        }
        chunkSize = chunkSize == null ? OptionalInt.empty() : chunkSize;
        if (chunkSize.isPresent() && chunkSize.getAsInt() < 1) {
            throw new IllegalArgumentException("chunkSize must be at least 1");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        if (renderedTileSize < 0) {
            throw new IllegalArgumentException("renderedTileSize must not be negative");
        }
        Objects.requireNonNull(logFormat, "logFormat");
    }

    public ProjectLayout layout() {
        return new ProjectLayout(projectRoot);
    }
}
