package ai.dadaist.collage.collaborator;

import ai.dadaist.collage.image.TileImages;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-encodes any decodable image as an 8-bit, three-channel PNG.
 */
public class PngPreprocessor implements Preprocessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PngPreprocessor.class);

    @Override
    public Path preprocess(Path input, Path outputDir) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        Path target = outputDir.resolve(stem + ".png");
        try {
            BufferedImage image = TileImages.read(input);
            TileImages.writePng(image, target);
        } catch (IOException | RuntimeException ex) {
            throw new PreprocessingException("Failed to preprocess " + input, ex);
        }
        LOGGER.info("Preprocessed {} -> {}", input, target);
        return target;
    }
}
