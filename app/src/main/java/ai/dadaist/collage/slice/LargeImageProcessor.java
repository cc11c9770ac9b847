package ai.dadaist.collage.slice;

import ai.dadaist.collage.image.ImageDimensions;
import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.work.MemoryProbe;
import ai.dadaist.collage.work.SystemMemoryProbe;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slices images too large to decode at once by reading horizontal bands through an
 * {@code ImageReader} source region. Produces the same tiles as {@link GridSlicer} without
 * upscaling.
 */
public class LargeImageProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LargeImageProcessor.class);
    private static final double BYTES_PER_GB = 1024d * 1024 * 1024;
    private static final long CHUNK_BUDGET_BYTES = 500L * 1024 * 1024;
    private static final int RGBA_BYTES = 4;
    private static final double SAFETY_MARGIN = 1.5;

    private final MemoryProbe memoryProbe;

    public LargeImageProcessor() {
        this(new SystemMemoryProbe());
    }

    public LargeImageProcessor(MemoryProbe memoryProbe) {
        this.memoryProbe = Objects.requireNonNull(memoryProbe, "memoryProbe");
    }

    /**
     * Full RGBA buffer, every piece buffer and twice the piece buffers as working space, in GiB.
     */
    public static double estimateMemoryGb(int width, int height, int gridSize) {
        if (width <= 0 || height <= 0 || gridSize <= 0) {
            throw new IllegalArgumentException("width, height and gridSize must be positive");
        }
        long pieceWidth = ceilDiv(width, gridSize);
        long pieceHeight = ceilDiv(height, gridSize);
        double original = (double) width * height * RGBA_BYTES;
        double pieces = (double) pieceWidth * pieceHeight * RGBA_BYTES * gridSize * gridSize;
        double processing = pieces * 2;
        return (original + pieces + processing) / BYTES_PER_GB;
    }

    public ResourceCheck checkResources(double requiredGb) {
        double available = memoryProbe.availableSystemBytes() / BYTES_PER_GB;
        return new ResourceCheck(available > requiredGb * SAFETY_MARGIN, available, requiredGb);
    }

    public static int defaultChunkSize(int width, int height) {
        long rows = CHUNK_BUDGET_BYTES / ((long) width * RGBA_BYTES);
        return (int) Math.max(1, Math.min(rows, height));
    }

    public ChunkingReport processInChunks(Path input, Path outputDir, int gridSize) {
        return processInChunks(input, outputDir, gridSize, OptionalInt.empty());
    }

    public ChunkingReport processInChunks(Path input, Path outputDir, int gridSize, OptionalInt chunkSize) {
        ImageDimensions dimensions;
        try {
            dimensions = TileImages.readDimensions(input);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read image header of " + input, ex);
        }
        int width = dimensions.width();
        int height = dimensions.height();
        LOGGER.info("Starting chunked processing of {} ({}x{})", input.getFileName(), width, height);

        double required = estimateMemoryGb(width, height, gridSize);
        ResourceCheck resources = checkResources(required);
        if (!resources.canProcess()) {
            LOGGER.warn(String.format(Locale.ROOT,
                    "This operation requires approximately %.1fGB of memory. Available memory: %.1fGB. "
                            + "Processing in chunks to manage memory usage.", required, resources.availableGb()));
        }

        int chunkHeight = chunkSize.orElseGet(() -> defaultChunkSize(width, height));
        if (chunkHeight < 1) {
            throw new IllegalArgumentException("chunk size must be at least 1");
        }
        SliceGeometry geometry = SliceGeometry.of(width, height, gridSize);
        int piece = geometry.pieceSize();
        String stem = SliceGeometry.stemOf(input);
        List<Path> tiles = new ArrayList<>(gridSize * gridSize);
        int bands = 0;
        int nextRow = 0;
        while (nextRow < gridSize) {
            int bandStart = nextRow * piece;
            int bandEnd = Math.min(bandStart + chunkHeight, geometry.usedSize());
            int rowsCovered = (bandEnd - bandStart) / piece;
            if (rowsCovered == 0) {
                // the band must hold at least one complete tile row
                rowsCovered = 1;
                bandEnd = bandStart + piece;
            }
            LOGGER.debug("Processing chunk rows {}-{}", bandStart, bandEnd);
            BufferedImage band = readBand(input, bandStart, bandEnd);
            bands++;
            for (int row = nextRow; row < nextRow + rowsCovered; row++) {
                int offsetY = row * piece - bandStart;
                for (int col = 0; col < gridSize; col++) {
                    Path target = outputDir.resolve(SliceGeometry.tileName(stem, row, col));
                    TileImages.writePng(TileImages.crop(band, col * piece, offsetY, piece, piece), target);
                    tiles.add(target);
                }
            }
            nextRow += rowsCovered;
        }
        LOGGER.info("Chunked processing of {} completed: {} tiles from {} band(s)", input.getFileName(), tiles.size(), bands);
        SliceResult result = new SliceResult(input, geometry, tiles, true, 0);
        return new ChunkingReport(result, resources, chunkHeight, bands);
    }

    private static BufferedImage readBand(Path input, int startY, int endY) {
        try {
            return TileImages.readBand(input, startY, endY);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to decode rows " + startY + "-" + endY + " of " + input, ex);
        }
    }

    private static long ceilDiv(long value, long divisor) {
        return (value + divisor - 1) / divisor;
    }
}
