package ai.dadaist.collage.grid;

import ai.dadaist.collage.image.ImageDimensions;
import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.naming.InvalidNameException;
import ai.dadaist.collage.naming.TileCoordinate;
import ai.dadaist.collage.naming.TileNaming;
import ai.dadaist.collage.work.MemoryProbe;
import ai.dadaist.collage.work.SystemMemoryProbe;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates tile directories, infers their {@link GridSpec} from filenames and guards the
 * memory needed for the reassembled canvas. Every call re-scans the filesystem; nothing is cached.
 */
public class GridManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridManager.class);
    private static final long MAX_RASTER_BYTES = Integer.MAX_VALUE - 8L;

    private final MemoryProbe memoryProbe;

    public GridManager() {
        this(new SystemMemoryProbe());
    }

    public GridManager(MemoryProbe memoryProbe) {
        this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
    }

    public boolean isValidTileDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            return false;
        }
        List<String> names;
        try {
            names = listTileNames(directory);
        } catch (UncheckedIOException ex) {
            LOGGER.warn("Error checking directory {}: {}", directory, ex.getMessage());
            return false;
        }
        if (names.isEmpty()) {
            return false;
        }
        Path sample = directory.resolve(names.get(0));
        if (TileImages.tryRead(sample).isEmpty()) {
            LOGGER.warn("Sample tile {} is not readable", sample);
            return false;
        }
        return true;
    }

    public GridSize detectGridSize(Path directory) {
        return detectGridSize(listTileNames(directory));
    }

    public ImageDimensions getPieceDimensions(Path directory) {
        return getPieceDimensions(directory, listTileNames(directory));
    }

    /**
     * Scans a tile directory into an immutable {@link Variation}.
     *
     * @throws GridTooSmallException when no filename parses as a tile
     * @throws GridTooLargeException when a dimension exceeds {@link GridSpec#MAX_DIMENSION}
     * @throws UnreadableTileException when no tile decodes
     */
    public Variation inspect(Path directory) {
        List<String> names = listTileNames(directory);
        GridSize size = detectGridSize(names);
        ImageDimensions piece = getPieceDimensions(directory, names);
        GridSpec spec = new GridSpec(size.rows(), size.cols(), piece.height(), piece.width());
        LOGGER.debug("Inspected {}: {}x{} grid of {} pieces", directory, spec.rows(), spec.cols(), piece);
        return new Variation(directory.getFileName().toString(), directory, spec, names);
    }

    public static long estimateCanvasMemory(int rows, int cols, int height, int width) {
        if (rows < 0 || cols < 0 || height < 0 || width < 0) {
            throw new IllegalArgumentException("canvas dimensions must not be negative");
        }
        return (long) rows * cols * height * width * TileImages.CHANNELS;
    }

    /**
     * Allocates a zero-filled canvas for {@code spec}. Above the budget ceiling the budget's
     * {@link OverridePrompt} decides; sizes the JVM cannot allocate always fail.
     */
    public BufferedImage createCanvas(GridSpec spec, CanvasBudget budget) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(budget, "budget");
        long required = spec.canvasBytes();
        if (required > budget.ceilingBytes()) {
            if (!budget.overridePrompt().confirm(required, budget.ceilingBytes(), spec)) {
                throw new MemoryBudgetExceededException(required, budget.ceilingBytes(), String.format(Locale.ROOT,
                        "Canvas would require %.1f GB (ceiling %.1f GB). Grid size: %dx%d, Piece size: %dx%d",
                        toGigabytes(required), toGigabytes(budget.ceilingBytes()),
                        spec.rows(), spec.cols(), spec.pieceHeight(), spec.pieceWidth()));
            }
            LOGGER.warn("Canvas of {} bytes exceeds ceiling of {} bytes; proceeding on explicit override",
                    required, budget.ceilingBytes());
        }
        if (required > MAX_RASTER_BYTES) {
            throw new MemoryBudgetExceededException(required, MAX_RASTER_BYTES,
                    "Canvas of " + required + " bytes exceeds the largest addressable raster");
        }
        long availableHeap = memoryProbe.availableHeapBytes();
        if (required > availableHeap) {
            throw new MemoryBudgetExceededException(required, availableHeap,
                    "Canvas of " + required + " bytes exceeds available heap of " + availableHeap + " bytes");
        }
        return TileImages.blank(spec.canvasWidth(), spec.canvasHeight());
    }

    /**
     * Sorted filenames in {@code directory} that parse as parent tiles. Other PNG files are
     * skipped with a warning.
     */
    public List<String> listTileNames(Path directory) {
        List<String> names = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            entries.filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .forEach(name -> {
                        if (TileNaming.isParentName(name)) {
                            names.add(name);
                        } else if (name.toLowerCase(Locale.ROOT).endsWith(".png")) {
                            LOGGER.warn("Skipping malformed piece '{}' in {}", name, directory);
                        }
                    });
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list tiles in " + directory, ex);
        }
        return List.copyOf(names);
    }

    private GridSize detectGridSize(List<String> names) {
        int maxRow = -1;
        int maxCol = -1;
        for (String name : names) {
            try {
                TileCoordinate coordinate = TileNaming.parseParent(name);
                maxRow = Math.max(maxRow, coordinate.parentRow());
                maxCol = Math.max(maxCol, coordinate.parentCol());
            } catch (InvalidNameException ex) {
                LOGGER.warn("Skipping malformed piece '{}': {}", name, ex.getMessage());
            }
        }
        int rows = maxRow + 1;
        int cols = maxCol + 1;
        if (rows > GridSpec.MAX_DIMENSION || cols > GridSpec.MAX_DIMENSION) {
            throw new GridTooLargeException(rows, cols);
        }
        if (rows < GridSpec.MIN_DIMENSION || cols < GridSpec.MIN_DIMENSION) {
            throw new GridTooSmallException(rows, cols);
        }
        return new GridSize(rows, cols);
    }

    private ImageDimensions getPieceDimensions(Path directory, List<String> names) {
        for (String name : names) {
            Optional<BufferedImage> sample = TileImages.tryRead(directory.resolve(name));
            if (sample.isPresent()) {
                return new ImageDimensions(sample.get().getWidth(), sample.get().getHeight());
            }
            LOGGER.warn("Cannot read sample piece {}", directory.resolve(name));
        }
        throw new UnreadableTileException(directory, "Cannot read any sample piece from " + directory);
    }

    private static double toGigabytes(long bytes) {
        return bytes / (1024.0 * 1024.0 * 1024.0);
    }
}
