package ai.dadaist.collage.collaborator;

import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Enlarges a tile to a square of exactly {@code targetSize} pixels. Empty means the upscale failed.
 */
public interface Upscaler {

    Optional<BufferedImage> upscale(BufferedImage image, int targetSize);
}
