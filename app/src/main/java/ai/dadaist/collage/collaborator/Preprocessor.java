package ai.dadaist.collage.collaborator;

import java.nio.file.Path;

/**
 * Normalises a source image (format, colour space) into a PNG that the slicers can read.
 */
public interface Preprocessor {

    /**
     * @return path of the normalised image inside {@code outputDir}
     * @throws PreprocessingException when the image cannot be normalised
     */
    Path preprocess(Path input, Path outputDir);
}
