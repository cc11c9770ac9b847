package ai.dadaist.collage.collaborator;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Optional;

/**
 * Bicubic resampling, used when no model-backed upscaler is configured.
 */
public class ResamplingUpscaler implements Upscaler {

    @Override
    public Optional<BufferedImage> upscale(BufferedImage image, int targetSize) {
        if (image == null || targetSize <= 0) {
            return Optional.empty();
        }
        BufferedImage result = new BufferedImage(targetSize, targetSize, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = result.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            graphics.drawImage(image, 0, 0, targetSize, targetSize, null);
        } finally {
            graphics.dispose();
        }
        return Optional.of(result);
    }
}
