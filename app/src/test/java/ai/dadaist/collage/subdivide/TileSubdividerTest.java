package ai.dadaist.collage.subdivide;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dadaist.collage.project.ProjectLayout;
import ai.dadaist.collage.support.TestImages;
import ai.dadaist.collage.work.CancellationToken;
import ai.dadaist.collage.work.WorkerPool;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TileSubdividerTest {

    @TempDir
    Path tempDir;

    private final TileSubdivider subdivider = new TileSubdivider(new WorkerPool(2));

    @Test
    void cutsTileIntoNamedSubtiles() throws Exception {
        Path tile = TestImages.write(TestImages.gradient(100, 100), tempDir.resolve("v1/tile-0_0.png"));
        Path output = tempDir.resolve("out");

        boolean success = subdivider.subdivideTile(tile, new SubdivisionScale(5), output);

        assertThat(success).isTrue();
        List<String> expected = new ArrayList<>();
        for (int row = 0; row < 5; row++) {
            for (int col = 0; col < 5; col++) {
                expected.add("0-0_" + row + "-" + col + ".png");
            }
        }
        assertThat(listNames(output.resolve("5x5"))).containsExactlyInAnyOrderElementsOf(expected);

        BufferedImage source = TestImages.read(tile);
        BufferedImage subTile = TestImages.read(output.resolve("5x5/0-0_2-3.png"));
        assertThat(subTile.getWidth()).isEqualTo(20);
        assertThat(subTile.getHeight()).isEqualTo(20);
        assertThat(subTile.getRGB(0, 0)).isEqualTo(source.getRGB(60, 40));
        assertThat(subTile.getRGB(19, 19)).isEqualTo(source.getRGB(79, 59));
    }

    @Test
    void dropsRemainderPixels() throws Exception {
        Path tile = TestImages.write(TestImages.gradient(103, 104), tempDir.resolve("v1/tile-2_1.png"));

        assertThat(subdivider.subdivideTile(tile, new SubdivisionScale(10), tempDir.resolve("out"))).isTrue();

        BufferedImage last = TestImages.read(tempDir.resolve("out/10x10/2-1_9-9.png"));
        assertThat(last.getWidth()).isEqualTo(10);
        assertThat(last.getHeight()).isEqualTo(10);
    }

    @Test
    void reportsFailureForTinyCorruptOrMisnamedTiles() throws Exception {
        Path tiny = TestImages.writeSolid(tempDir.resolve("v1/tile-0_0.png"), 3, Color.RED);
        Path corrupt = tempDir.resolve("v1/tile-0_1.png");
        Files.writeString(corrupt, "nope", StandardCharsets.UTF_8);
        Path misnamed = TestImages.writeSolid(tempDir.resolve("v1/background.png"), 50, Color.RED);
        Path output = tempDir.resolve("out");

        assertThat(subdivider.subdivideTile(tiny, new SubdivisionScale(5), output)).isFalse();
        assertThat(subdivider.subdivideTile(corrupt, new SubdivisionScale(5), output)).isFalse();
        assertThat(subdivider.subdivideTile(misnamed, new SubdivisionScale(5), output)).isFalse();
    }

    @Test
    void subdividesWholeVariationAtEveryScale() throws Exception {
        Path variation = TestImages.writeGrid(tempDir.resolve("v1"), "tile", 2, 2, 40, 1);
        Files.writeString(variation.resolve("tile-9_9.png"), "broken", StandardCharsets.UTF_8);
        List<SubdivisionScale> scales = List.of(new SubdivisionScale(5), new SubdivisionScale(10));

        SubdivisionSummary summary = subdivider.subdivideAll(variation, tempDir.resolve("sub/v1"), scales);

        assertThat(summary.countsFor(new SubdivisionScale(5))).isEqualTo(new SubdivisionSummary.ScaleCounts(4, 1));
        assertThat(summary.countsFor(new SubdivisionScale(10))).isEqualTo(new SubdivisionSummary.ScaleCounts(4, 1));
        assertThat(summary.hasFailures()).isTrue();
        assertThat(listNames(tempDir.resolve("sub/v1/5x5"))).hasSize(4 * 25);
        assertThat(listNames(tempDir.resolve("sub/v1/10x10"))).hasSize(4 * 100);
    }

    @Test
    void cancelledRunSkipsEveryTile() throws Exception {
        Path variation = TestImages.writeGrid(tempDir.resolve("v1"), "tile", 2, 2, 20, 1);
        CancellationToken token = CancellationToken.none();
        token.cancel();

        SubdivisionSummary summary = subdivider.subdivideAll(variation, tempDir.resolve("sub/v1"),
                List.of(new SubdivisionScale(5)), token);

        assertThat(summary.skippedTiles()).isEqualTo(4);
        assertThat(summary.totalSucceeded()).isZero();
        assertThat(listNames(tempDir.resolve("sub/v1/5x5"))).isEmpty();
    }

    @Test
    void subdividesEveryRenderedVariationOfProject() throws Exception {
        ProjectLayout layout = new ProjectLayout(tempDir);
        TestImages.writeGrid(layout.renderedVariationDir("a"), "tile", 1, 2, 10, 1);
        TestImages.writeGrid(layout.renderedVariationDir("b"), "tile", 1, 2, 10, 2);

        Map<String, SubdivisionSummary> summaries =
                subdivider.subdivideProject(layout, List.of(new SubdivisionScale(5)), CancellationToken.none());

        assertThat(summaries).containsOnlyKeys("a", "b");
        assertThat(Files.isRegularFile(layout.subdivisionScaleDir("b", 5).resolve("0-1_4-4.png"))).isTrue();
    }

    @Test
    void parsesScaleLists() {
        assertThat(SubdivisionScale.parseList("5, 10x10,5"))
                .containsExactly(new SubdivisionScale(5), new SubdivisionScale(10));
        assertThat(new SubdivisionScale(15).directoryName()).isEqualTo("15x15");
    }

    private static List<String> listNames(Path directory) throws Exception {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.map(path -> path.getFileName().toString()).toList();
        }
    }
}
