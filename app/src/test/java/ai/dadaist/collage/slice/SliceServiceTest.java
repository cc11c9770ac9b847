package ai.dadaist.collage.slice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.dadaist.collage.collaborator.PngPreprocessor;
import ai.dadaist.collage.collaborator.PreprocessingException;
import ai.dadaist.collage.collaborator.ResamplingUpscaler;
import ai.dadaist.collage.grid.GridManager;
import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.support.TestImages;
import ai.dadaist.collage.work.WorkerPool;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SliceServiceTest {

    @TempDir
    Path projectRoot;

    @Test
    void slicesEveryBaseImageAndWritesMasks() throws Exception {
        ProjectLayout layout = new ProjectLayout(projectRoot);
        TestImages.write(TestImages.gradient(60, 60), layout.baseImageDir().resolve("alpha.png"));
        TestImages.write(TestImages.gradient(90, 80), layout.baseImageDir().resolve("beta.png"));

        SliceOutcome outcome = service(SliceService.DEFAULT_LARGE_IMAGE_THRESHOLD_BYTES).sliceProject(layout, 3);

        assertThat(outcome.hasFailures()).isFalse();
        assertThat(outcome.tileCount()).isEqualTo(18);
        assertThat(Files.isRegularFile(layout.baseTilesDir().resolve("alpha-2_2.png"))).isTrue();
        assertThat(Files.isRegularFile(layout.baseTilesDir().resolve("beta-0_1.png"))).isTrue();
        assertThat(Files.isRegularFile(layout.preprocessedDir().resolve("alpha.png"))).isTrue();
        assertThat(outcome.masks()).hasSize(5);
        assertThat(TestImages.read(layout.maskDir().resolve("Mask_70.png")).getWidth()).isEqualTo(78);
    }

    @Test
    void largeImagesGoThroughChunkedProcessing() throws Exception {
        ProjectLayout layout = new ProjectLayout(projectRoot);
        TestImages.write(TestImages.gradient(50, 50), layout.baseImageDir().resolve("huge.png"));

        SliceOutcome outcome = service(1).sliceProject(layout, 5);

        assertThat(outcome.sliced()).singleElement().satisfies(result -> assertThat(result.chunked()).isTrue());
        assertThat(new GridManager().isValidTileDirectory(layout.baseTilesDir())).isTrue();
    }

    @Test
    void preprocessingFailuresAreCollected() throws Exception {
        ProjectLayout layout = new ProjectLayout(projectRoot);
        Files.createDirectories(layout.baseImageDir());
        Files.writeString(layout.baseImageDir().resolve("broken.jpg"), "not an image", StandardCharsets.UTF_8);
        TestImages.write(TestImages.gradient(30, 30), layout.baseImageDir().resolve("fine.png"));

        SliceOutcome outcome = service(SliceService.DEFAULT_LARGE_IMAGE_THRESHOLD_BYTES).sliceProject(layout, 3);

        assertThat(outcome.failedImages()).containsExactly("broken.jpg");
        assertThat(outcome.sliced()).hasSize(1);
    }

    @Test
    void preprocessorReportsUndecodableInput() throws Exception {
        Path broken = Files.writeString(projectRoot.resolve("x.bmp"), "??", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new PngPreprocessor().preprocess(broken, projectRoot))
                .isInstanceOf(PreprocessingException.class);
    }

    @Test
    void emptyBaseImageDirectoryProducesNothing() {
        SliceOutcome outcome = service(SliceService.DEFAULT_LARGE_IMAGE_THRESHOLD_BYTES)
                .sliceProject(new ProjectLayout(projectRoot), 3);

        assertThat(outcome.sliced()).isEmpty();
        assertThat(outcome.masks()).isEmpty();
    }

    private static SliceService service(long largeImageThreshold) {
        return new SliceService(new PngPreprocessor(),
                new GridSlicer(new ResamplingUpscaler(), 0),
                new LargeImageProcessor(),
                new MaskGenerator(),
                new WorkerPool(2),
                largeImageThreshold,
                OptionalInt.of(7));
    }
}
