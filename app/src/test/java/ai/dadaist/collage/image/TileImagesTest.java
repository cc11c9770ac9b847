package ai.dadaist.collage.image;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.dadaist.collage.support.TestImages;
import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TileImagesTest {

    @TempDir
    Path tempDir;

    @Test
    void readsOnlyTheRequestedBand() throws Exception {
        BufferedImage source = TestImages.gradient(30, 40);
        Path image = TestImages.write(source, tempDir.resolve("band.png"));

        BufferedImage band = TileImages.readBand(image, 10, 25);

        assertThat(band.getWidth()).isEqualTo(30);
        assertThat(band.getHeight()).isEqualTo(15);
        assertThat(band.getRGB(4, 0)).isEqualTo(source.getRGB(4, 10));
        assertThat(TileImages.readDimensions(image)).isEqualTo(new ImageDimensions(30, 40));
        assertThatThrownBy(() -> TileImages.readBand(image, 30, 41)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cropAndBlitCopyPixelsWithoutAliasing() {
        BufferedImage source = TestImages.gradient(20, 20);
        BufferedImage region = TileImages.crop(source, 5, 6, 4, 3);
        source.setRGB(5, 6, Color.WHITE.getRGB());

        BufferedImage canvas = TileImages.blank(10, 10);
        TileImages.blit(canvas, region, 2, 2);

        assertThat(region.getRGB(0, 0)).isNotEqualTo(Color.WHITE.getRGB());
        assertThat(canvas.getRGB(2, 2)).isEqualTo(region.getRGB(0, 0));
        assertThat(canvas.getRGB(1, 1) & 0xFFFFFF).isZero();
    }

    @Test
    void atomicWriteLeavesNoTemporaryFiles() throws Exception {
        Path target = tempDir.resolve("nested/out.png");

        TileImages.writePng(TestImages.solid(5, 5, Color.CYAN), target);
        assertThatThrownBy(() -> TileImages.writeAtomically(tempDir.resolve("nested/fail.bin"), temp -> {
            throw new IOException("disk full");
        })).isInstanceOf(UncheckedIOException.class).hasMessageContaining("fail.bin");

        try (Stream<Path> files = Files.list(tempDir.resolve("nested"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("out.png");
        }
        assertThat(TileImages.tryRead(target)).isPresent();
        assertThat(TileImages.tryRead(tempDir.resolve("missing.png"))).isEmpty();
    }
}
