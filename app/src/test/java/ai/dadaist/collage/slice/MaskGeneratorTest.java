package ai.dadaist.collage.slice;

import static org.assertj.core.api.Assertions.assertThat;

import ai.dadaist.collage.support.TestImages;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MaskGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void writesOneMaskPerPercentage() {
        List<Path> masks = new MaskGenerator().createMasks(tempDir, 40, 60, 20);

        assertThat(masks).extracting(path -> path.getFileName().toString())
                .containsExactly("Mask_50.png", "Mask_60.png", "Mask_70.png", "Mask_80.png", "Mask_90.png");
    }

    @Test
    void framesEveryPieceWithWhiteBorder() throws Exception {
        Path mask = new MaskGenerator().createMasks(tempDir, 40, 40, 20, List.of(50)).get(0);
        BufferedImage image = TestImages.read(mask);

        assertThat(MaskGenerator.borderWidth(20, 50)).isEqualTo(5);
        assertThat(image.getWidth()).isEqualTo(40);
        assertThat(image.getRGB(2, 2) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(image.getRGB(10, 10) & 0xFFFFFF).isZero();
        assertThat(image.getRGB(24, 30) & 0xFFFFFF).isEqualTo(0xFFFFFF);
        assertThat(image.getRGB(30, 30) & 0xFFFFFF).isZero();
    }
}
