package ai.dadaist.collage.assemble;

import ai.dadaist.collage.grid.CanvasBudget;
import ai.dadaist.collage.grid.GridManager;
import ai.dadaist.collage.grid.GridSpec;
import ai.dadaist.collage.grid.InvalidGridException;
import ai.dadaist.collage.grid.MemoryBudgetExceededException;
import ai.dadaist.collage.grid.UnreadableTileException;
import ai.dadaist.collage.grid.Variation;
import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.naming.TileCoordinate;
import ai.dadaist.collage.naming.TileNaming;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.select.OriginalPlacement;
import ai.dadaist.collage.select.PieceSelector;
import ai.dadaist.collage.select.PieceSelectorFactory;
import ai.dadaist.collage.select.PlacementRecord;
import ai.dadaist.collage.select.PlacementStrategy;
import ai.dadaist.collage.select.SubcellSource;
import ai.dadaist.collage.select.SubdividedPlacement;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Composes canvases from rendered tile variations.
 *
 * <p>Exact restores rebuild every variation on its own. Random and multi-scale remixes take the
 * geometry of the first valid variation (by name) and fill each position through the
 * configured {@link PieceSelector}, once per requested run.
 */
public class Assembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Assembler.class);

    private final GridManager gridManager;
    private final PieceSelectorFactory selectorFactory;
    private final OutputManager outputManager;
    private final CanvasBudget canvasBudget;

    public Assembler(GridManager gridManager,
                     PieceSelectorFactory selectorFactory,
                     OutputManager outputManager,
                     CanvasBudget canvasBudget) {
        this.gridManager = Objects.requireNonNull(gridManager, "gridManager");
        this.selectorFactory = Objects.requireNonNull(selectorFactory, "selectorFactory");
        this.outputManager = Objects.requireNonNull(outputManager, "outputManager");
        this.canvasBudget = Objects.requireNonNull(canvasBudget, "canvasBudget");
    }

    public AssemblyResult assemble(AssemblyRequest request) {
        Objects.requireNonNull(request, "request");
        List<Path> variationDirs = findValidVariations(request.renderedTilesRoot());
        if (variationDirs.isEmpty()) {
            throw new NoValidVariationsException(request.renderedTilesRoot());
        }
        ProjectLayout layout = new ProjectLayout(request.projectRoot());
        List<String> variationNames = variationDirs.stream()
                .map(dir -> dir.getFileName().toString())
                .toList();
        LOGGER.info("Assembling project {} with strategy {} over {} variation(s)",
                request.projectName(), request.strategy().label(), variationNames.size());

        MDC.put("project", request.projectName());
        try {
            return request.strategy() == PlacementStrategy.EXACT
                    ? restoreAll(request, layout, variationDirs, variationNames)
                    : remix(request, layout, variationDirs.get(0), variationNames);
        } finally {
            MDC.remove("project");
        }
    }

    private AssemblyResult restoreAll(AssemblyRequest request,
                                      ProjectLayout layout,
                                      List<Path> variationDirs,
                                      List<String> variationNames) {
        PieceSelector selector = selectorFactory.select(PlacementStrategy.EXACT);
        List<CanvasOutput> outputs = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        int blank = 0;
        for (Path variationDir : variationDirs) {
            String name = variationDir.getFileName().toString();
            MDC.put("variation", name);
            try {
                Variation variation = gridManager.inspect(variationDir);
                Path outputDir = request.outputRoot().resolve(ProjectLayout.RESTORED).resolve(name);
                Composition composition = compose(request, layout, variation, selector, variationNames, Optional.empty());
                blank += composition.blankPositions();
                outputs.add(save(composition, layout, outputDir, Optional.empty()));
            } catch (InvalidGridException | UnreadableTileException | MemoryBudgetExceededException | UncheckedIOException ex) {
                LOGGER.error("Skipping variation {}: {}", name, ex.getMessage());
                failed.add(name);
            } finally {
                MDC.remove("variation");
            }
        }
        return summarize(outputs, failed, List.of(), blank);
    }

    private AssemblyResult remix(AssemblyRequest request,
                                 ProjectLayout layout,
                                 Path baseDir,
                                 List<String> variationNames) {
        PieceSelector selector = selectorFactory.select(request.strategy());
        String baseName = baseDir.getFileName().toString();
        Path outputDir = request.outputRoot().resolve(ProjectLayout.RANDOMIZED);
        MDC.put("variation", baseName);
        try {
            Variation base;
            try {
                base = gridManager.inspect(baseDir);
            } catch (InvalidGridException | UnreadableTileException | UncheckedIOException ex) {
                LOGGER.error("Cannot remix from base variation {}: {}", baseName, ex.getMessage());
                return summarize(List.of(), List.of(baseName), List.of(), 0);
            }
            LOGGER.info("Using {} as base for {} run(s)", baseName, request.effectiveRunCount());
            List<CanvasOutput> outputs = new ArrayList<>();
            List<Integer> failedRuns = new ArrayList<>();
            int blank = 0;
            for (int run = 1; run <= request.effectiveRunCount(); run++) {
                MDC.put("run", Integer.toString(run));
                try {
                    Composition composition = compose(request, layout, base, selector, variationNames, Optional.of(run));
                    blank += composition.blankPositions();
                    String label = request.strategy().label() + "-" + run;
                    outputs.add(save(composition, layout, outputDir, Optional.of(label)));
                } catch (MemoryBudgetExceededException | UncheckedIOException ex) {
                    LOGGER.error("Run {} failed: {}", run, ex.getMessage());
                    failedRuns.add(run);
                } finally {
                    MDC.remove("run");
                }
            }
            return summarize(outputs, List.of(), failedRuns, blank);
        } finally {
            MDC.remove("variation");
        }
    }

    private Composition compose(AssemblyRequest request,
                                ProjectLayout layout,
                                Variation variation,
                                PieceSelector selector,
                                List<String> variationNames,
                                Optional<Integer> runNumber) {
        GridSpec spec = variation.gridSpec();
        BufferedImage canvas = gridManager.createCanvas(spec, canvasBudget);
        Map<String, PlacementRecord> positions = new LinkedHashMap<>();
        int blank = 0;
        for (String tileName : variation.tileNames()) {
            TileCoordinate coordinate = TileNaming.parseParent(tileName);
            PlacementRecord selected = fitToCell(
                    selector.select(tileName, variation.directory(), variationNames, request.projectRoot()),
                    spec, variation, tileName);
            Optional<PlacementRecord> placed = place(canvas, spec, coordinate, selected);
            if (placed.isPresent()) {
                positions.put(coordinate.positionKey(), placed.get());
            } else {
                blank++;
            }
        }
        AssemblyManifest.Metadata metadata = new AssemblyManifest.Metadata(
                request.projectName(), request.strategy().label(), runNumber, layout.relativize(variation.directory()));
        return new Composition(canvas, new AssemblyManifest(metadata, spec, positions), blank);
    }

    /**
     * Replaces a subdivided record whose sub-cells would be narrower than one pixel with the
     * base variation's whole tile.
     */
    private static PlacementRecord fitToCell(PlacementRecord record, GridSpec spec, Variation variation, String tileName) {
        if (record instanceof SubdividedPlacement subdivided) {
            int size = subdivided.scale().size();
            if (spec.pieceWidth() < size || spec.pieceHeight() < size) {
                LOGGER.warn("{}x{} pieces are too small for {} subtiles at {}; using whole tile",
                        spec.pieceWidth(), spec.pieceHeight(), subdivided.scale(), tileName);
                return new OriginalPlacement(variation.name(), tileName, variation.directory().resolve(tileName));
            }
        }
        return record;
    }

    /**
     * Draws {@code record} into its cell and returns what was actually placed, or empty when
     * nothing could be drawn.
     */
    Optional<PlacementRecord> place(BufferedImage canvas, GridSpec spec, TileCoordinate coordinate, PlacementRecord record) {
        int x = coordinate.parentCol() * spec.pieceWidth();
        int y = coordinate.parentRow() * spec.pieceHeight();
        if (record instanceof OriginalPlacement original) {
            return loadFitted(original.sourcePath(), spec.pieceWidth(), spec.pieceHeight())
                    .map(tile -> {
                        TileImages.blit(canvas, tile, x, y);
                        return (PlacementRecord) original;
                    });
        }
        if (record instanceof SubdividedPlacement subdivided) {
            int subWidth = spec.pieceWidth() / subdivided.scale().size();
            int subHeight = spec.pieceHeight() / subdivided.scale().size();
            List<SubcellSource> placed = new ArrayList<>();
            for (SubcellSource subcell : subdivided.subcells()) {
                loadFitted(subcell.sourcePath(), subWidth, subHeight).ifPresent(tile -> {
                    TileImages.blit(canvas, tile, x + subcell.childCol() * subWidth, y + subcell.childRow() * subHeight);
                    placed.add(subcell);
                });
            }
            if (placed.isEmpty()) {
                LOGGER.warn("No subtiles could be placed at {}", coordinate.positionKey());
                return Optional.empty();
            }
            return Optional.of(subdivided.withSubcells(placed));
        }
        throw new IllegalArgumentException("Unsupported placement record: " + record.getClass().getName());
    }

    private Optional<BufferedImage> loadFitted(Path source, int width, int height) {
        if (!Files.isRegularFile(source)) {
            LOGGER.warn("Source tile not found: {}", source);
            return Optional.empty();
        }
        Optional<BufferedImage> image = TileImages.tryRead(source);
        if (image.isEmpty()) {
            LOGGER.warn("Could not decode source tile {}", source);
            return Optional.empty();
        }
        BufferedImage tile = image.get();
        if (tile.getWidth() != width || tile.getHeight() != height) {
            LOGGER.debug("Resizing {} from {}x{} to {}x{}", source.getFileName(), tile.getWidth(), tile.getHeight(), width, height);
            tile = TileImages.resizeTo(tile, width, height);
        }
        return Optional.of(tile);
    }

    private CanvasOutput save(Composition composition, ProjectLayout layout, Path outputDir, Optional<String> label) {
        layout.ensureDirectories(List.of(outputDir));
        return outputManager.save(composition.canvas(), composition.manifest(), layout, outputDir, label);
    }

    private List<Path> findValidVariations(Path renderedTilesRoot) {
        if (!Files.isDirectory(renderedTilesRoot)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(renderedTilesRoot)) {
            return children
                    .filter(Files::isDirectory)
                    .sorted()
                    .filter(dir -> {
                        boolean valid = gridManager.isValidTileDirectory(dir);
                        if (!valid) {
                            LOGGER.warn("Skipping invalid tile directory {}", dir.getFileName());
                        }
                        return valid;
                    })
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + renderedTilesRoot, ex);
        }
    }

    private AssemblyResult summarize(List<CanvasOutput> outputs, List<String> failed, List<Integer> failedRuns, int blank) {
        LOGGER.info("Assembly finished: {} canvas(es) written, {} variation(s) failed, {} run(s) failed, {} blank position(s)",
                outputs.size(), failed.size(), failedRuns.size(), blank);
        return new AssemblyResult(outputs, failed, failedRuns, blank);
    }

    private record Composition(BufferedImage canvas, AssemblyManifest manifest, int blankPositions) {
    }
}
