package ai.dadaist.collage.slice;

import ai.dadaist.collage.collaborator.Preprocessor;
import ai.dadaist.collage.image.ImageDimensions;
import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.work.CancellationToken;
import ai.dadaist.collage.work.TaskOutcome;
import ai.dadaist.collage.work.WorkerPool;
import ai.dadaist.collage.work.WorkerPool.NamedTask;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Slices every image of a project's {@code base_image/} directory into {@code base_tiles/}
 * and writes overlay masks for the resulting geometry.
 */
public class SliceService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SliceService.class);

    public static final long DEFAULT_LARGE_IMAGE_THRESHOLD_BYTES = 500L * 1024 * 1024;

    private final Preprocessor preprocessor;
    private final GridSlicer gridSlicer;
    private final LargeImageProcessor largeImageProcessor;
    private final MaskGenerator maskGenerator;
    private final WorkerPool workerPool;
    private final long largeImageThresholdBytes;
    private final OptionalInt chunkSize;

    public SliceService(Preprocessor preprocessor,
                        GridSlicer gridSlicer,
                        LargeImageProcessor largeImageProcessor,
                        MaskGenerator maskGenerator,
                        WorkerPool workerPool,
                        long largeImageThresholdBytes,
                        OptionalInt chunkSize) {
        this.preprocessor = Objects.requireNonNull(preprocessor, "preprocessor");
        this.gridSlicer = Objects.requireNonNull(gridSlicer, "gridSlicer");
        this.largeImageProcessor = Objects.requireNonNull(largeImageProcessor, "largeImageProcessor");
        this.maskGenerator = Objects.requireNonNull(maskGenerator, "maskGenerator");
        this.workerPool = Objects.requireNonNull(workerPool, "workerPool");
        if (largeImageThresholdBytes <= 0) {
            throw new IllegalArgumentException("largeImageThresholdBytes must be positive");
        }
        this.largeImageThresholdBytes = largeImageThresholdBytes;
        this.chunkSize = Objects.requireNonNull(chunkSize, "chunkSize");
    }

    public SliceOutcome sliceProject(ProjectLayout layout, int gridSize) {
        return sliceProject(layout, gridSize, CancellationToken.none());
    }

    public SliceOutcome sliceProject(ProjectLayout layout, int gridSize, CancellationToken cancellation) {
        layout.ensureDirectories(List.of(layout.baseTilesDir(), layout.maskDir(), layout.preprocessedDir()));
        List<Path> images = listImages(layout.baseImageDir());
        if (images.isEmpty()) {
            LOGGER.warn("No valid images found in {}", layout.baseImageDir());
            return new SliceOutcome(List.of(), List.of(), List.of());
        }
        LOGGER.info("Found {} images to slice with grid size {}x{}", images.size(), gridSize, gridSize);

        List<NamedTask<SliceResult>> tasks = new ArrayList<>(images.size());
        for (Path image : images) {
            tasks.add(new NamedTask<>(image.getFileName().toString(),
                    () -> sliceImage(image, layout, gridSize)));
        }
        List<TaskOutcome<SliceResult>> outcomes = workerPool.runAll(tasks, cancellation);

        List<SliceResult> sliced = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (TaskOutcome<SliceResult> outcome : outcomes) {
            if (outcome.isSuccess()) {
                outcome.value().ifPresent(sliced::add);
            } else {
                failed.add(outcome.taskName());
            }
        }

        List<Path> masks = List.of();
        if (!sliced.isEmpty()) {
            SliceGeometry last = sliced.get(sliced.size() - 1).geometry();
            masks = maskGenerator.createMasks(layout.maskDir(), last.usedSize(), last.usedSize(), last.pieceSize());
        }
        LOGGER.info("Slicing finished: {} image(s) sliced, {} failed or skipped", sliced.size(), failed.size());
        return new SliceOutcome(sliced, failed, masks);
    }

    private SliceResult sliceImage(Path image, ProjectLayout layout, int gridSize) throws IOException {
        Path preprocessed = preprocessor.preprocess(image, layout.preprocessedDir());
        ImageDimensions dimensions = TileImages.readDimensions(preprocessed);
        long decodedBytes = dimensions.pixelCount() * TileImages.CHANNELS;
        if (decodedBytes > largeImageThresholdBytes) {
            LOGGER.info("Large image detected ({} bytes). Using chunked processing.", decodedBytes);
            return largeImageProcessor.processInChunks(preprocessed, layout.baseTilesDir(), gridSize, chunkSize).result();
        }
        return gridSlicer.slice(preprocessed, layout.baseTilesDir(), gridSize);
    }

    private static List<Path> listImages(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(TileImages::isImageFile)
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + directory, ex);
        }
    }
}
