package ai.dadaist.collage.slice;

import ai.dadaist.collage.image.TileImages;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes {@code Mask_<percent>.png} overlays: every piece gets a white frame around a black
 * interior covering {@code percent} of the piece edge.
 */
public class MaskGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(MaskGenerator.class);

    public static final List<Integer> DEFAULT_PERCENTAGES = List.of(50, 60, 70, 80, 90);

    public List<Path> createMasks(Path maskDir, int height, int width, int pieceSize) {
        return createMasks(maskDir, height, width, pieceSize, DEFAULT_PERCENTAGES);
    }

    public List<Path> createMasks(Path maskDir, int height, int width, int pieceSize, List<Integer> percentages) {
        if (height <= 0 || width <= 0 || pieceSize <= 0) {
            throw new IllegalArgumentException("mask dimensions and piece size must be positive");
        }
        List<Path> written = new ArrayList<>(percentages.size());
        for (int percent : percentages) {
            if (percent < 0 || percent > 100) {
                throw new IllegalArgumentException("mask percentage out of range: " + percent);
            }
            Path target = maskDir.resolve("Mask_" + percent + ".png");
            TileImages.writePng(render(height, width, pieceSize, percent), target);
            written.add(target);
        }
        LOGGER.info("Created {} masks in {}", written.size(), maskDir);
        return written;
    }

    static int borderWidth(int pieceSize, int percent) {
        int inner = pieceSize * percent / 100;
        return (pieceSize - inner) / 2;
    }

    private BufferedImage render(int height, int width, int pieceSize, int percent) {
        BufferedImage mask = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        int border = borderWidth(pieceSize, percent);
        Graphics2D graphics = mask.createGraphics();
        try {
            for (int y = 0; y + pieceSize <= height; y += pieceSize) {
                for (int x = 0; x + pieceSize <= width; x += pieceSize) {
                    graphics.setColor(Color.WHITE);
                    graphics.fillRect(x, y, pieceSize, pieceSize);
                    graphics.setColor(Color.BLACK);
                    graphics.fillRect(x + border, y + border, pieceSize - 2 * border, pieceSize - 2 * border);
                }
            }
        } finally {
            graphics.dispose();
        }
        return mask;
    }
}
