package ai.dadaist.collage.subdivide;

import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.naming.InvalidNameException;
import ai.dadaist.collage.naming.TileCoordinate;
import ai.dadaist.collage.naming.TileNaming;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.work.CancellationToken;
import ai.dadaist.collage.work.TaskOutcome;
import ai.dadaist.collage.work.WorkerPool;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts every parent tile of a variation into N x N sub-tiles for each requested scale.
 *
 * <p>Sub-tile size is {@code tileWidth / N} by {@code tileHeight / N}; remainder pixels on the
 * right and bottom edges are dropped. Output lands in {@code <outputVariationDir>/<N>x<N>/}
 * under {@link TileNaming#encodeChild} names. Tiles are processed on a {@link WorkerPool};
 * each tile is an isolated task.
 */
public class TileSubdivider {

    private static final Logger LOGGER = LoggerFactory.getLogger(TileSubdivider.class);

    private final WorkerPool workerPool;

    public TileSubdivider() {
        this(new WorkerPool());
    }

    public TileSubdivider(WorkerPool workerPool) {
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
    }

    public boolean subdivideTile(Path tilePath, SubdivisionScale scale, Path outputVariationDir) {
        return subdivideTile(tilePath, List.of(scale), outputVariationDir).get(scale);
    }

    public SubdivisionSummary subdivideAll(Path variationDir, Path outputVariationDir, List<SubdivisionScale> scales) {
        return subdivideAll(variationDir, outputVariationDir, scales, CancellationToken.none());
    }

    public SubdivisionSummary subdivideAll(Path variationDir,
                                           Path outputVariationDir,
                                           List<SubdivisionScale> scales,
                                           CancellationToken cancellation) {
        Objects.requireNonNull(scales, "scales");
        if (scales.isEmpty()) {
            throw new IllegalArgumentException("at least one subdivision scale is required");
        }
        LOGGER.info("Starting subdivision of {} at scales {}", variationDir, scales);
        for (SubdivisionScale scale : scales) {
            createDirectory(outputVariationDir.resolve(scale.directoryName()));
        }

        List<Path> tiles = listPngFiles(variationDir);
        List<WorkerPool.NamedTask<Map<SubdivisionScale, Boolean>>> tasks = new ArrayList<>(tiles.size());
        for (Path tile : tiles) {
            tasks.add(new WorkerPool.NamedTask<>(tile.getFileName().toString(),
                    () -> subdivideTile(tile, scales, outputVariationDir)));
        }

        Map<SubdivisionScale, SubdivisionSummary.ScaleCounts> counts = new LinkedHashMap<>();
        scales.forEach(scale -> counts.put(scale, SubdivisionSummary.ScaleCounts.ZERO));
        int skipped = 0;
        for (TaskOutcome<Map<SubdivisionScale, Boolean>> outcome : workerPool.runAll(tasks, cancellation)) {
            switch (outcome.status()) {
                case SUCCEEDED -> outcome.value().orElse(Map.of())
                        .forEach((scale, success) -> counts.computeIfPresent(scale, (key, current) -> current.plus(success)));
                case FAILED -> scales.forEach(scale -> counts.computeIfPresent(scale, (key, current) -> current.plus(false)));
                case SKIPPED -> skipped++;
            }
        }
        if (cancellation != null && cancellation.isCancelled()) {
            LOGGER.warn("Subdivision of {} cancelled; {} tile(s) not processed", variationDir, skipped);
        }
        SubdivisionSummary summary = new SubdivisionSummary(counts, skipped);
        counts.forEach((scale, count) -> LOGGER.info("Subdivision {} of {}: {} succeeded, {} failed",
                scale, variationDir.getFileName(), count.succeeded(), count.failed()));
        return summary;
    }

    /**
     * Subdivides every rendered variation of a project into {@code subdivided_tiles/<variation>/}.
     */
    public Map<String, SubdivisionSummary> subdivideProject(ProjectLayout layout,
                                                            List<SubdivisionScale> scales,
                                                            CancellationToken cancellation) {
        Map<String, SubdivisionSummary> summaries = new LinkedHashMap<>();
        for (Path variationDir : listDirectories(layout.renderedTilesDir())) {
            if (cancellation != null && cancellation.isCancelled()) {
                break;
            }
            String variation = variationDir.getFileName().toString();
            summaries.put(variation, subdivideAll(variationDir, layout.subdividedVariationDir(variation), scales, cancellation));
        }
        return summaries;
    }

    private Map<SubdivisionScale, Boolean> subdivideTile(Path tilePath, List<SubdivisionScale> scales, Path outputVariationDir) {
        Map<SubdivisionScale, Boolean> results = new LinkedHashMap<>();
        scales.forEach(scale -> results.put(scale, false));
        String tileName = tilePath.getFileName().toString();

        TileCoordinate coordinate;
        try {
            coordinate = TileNaming.parseParent(tileName);
        } catch (InvalidNameException ex) {
            LOGGER.warn("Skipping invalid tile name {}: {}", tileName, ex.getMessage());
            return results;
        }

        BufferedImage tile;
        try {
            tile = TileImages.read(tilePath);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Error subdividing {}: {}", tileName, ex.getMessage());
            return results;
        }

        for (SubdivisionScale scale : scales) {
            try {
                writeSubTiles(tile, coordinate, scale, outputVariationDir.resolve(scale.directoryName()));
                results.put(scale, true);
            } catch (RuntimeException ex) {
                LOGGER.warn("Error subdividing {} at {}: {}", tileName, scale, ex.getMessage());
            }
        }
        return results;
    }

    private void writeSubTiles(BufferedImage tile, TileCoordinate coordinate, SubdivisionScale scale, Path scaleDir) {
        int n = scale.size();
        int subWidth = tile.getWidth() / n;
        int subHeight = tile.getHeight() / n;
        if (subWidth == 0 || subHeight == 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                    "tile of %dx%d is too small for %s", tile.getWidth(), tile.getHeight(), scale));
        }
        createDirectory(scaleDir);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                BufferedImage subTile = TileImages.crop(tile, j * subWidth, i * subHeight, subWidth, subHeight);
                String name = TileNaming.encodeChild(coordinate.parentRow(), coordinate.parentCol(), i, j);
                TileImages.writePng(subTile, scaleDir.resolve(name));
            }
        }
    }

    private static List<Path> listPngFiles(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".png"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list tiles in " + directory, ex);
        }
    }

    private static List<Path> listDirectories(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list variations in " + directory, ex);
        }
    }

    private static void createDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create directory " + directory, ex);
        }
    }
}
