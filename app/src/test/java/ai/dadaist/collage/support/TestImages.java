package ai.dadaist.collage.support;

import ai.dadaist.collage.naming.TileNaming;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Synthetic PNG fixtures.
 */
public final class TestImages {

    private TestImages() {
    }

    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setColor(color);
            graphics.fillRect(0, 0, width, height);
        } finally {
            graphics.dispose();
        }
        return image;
    }

    /**
     * Every pixel differs from its neighbours, so any misplaced crop shows up in comparisons.
     */
    public static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, new Color((x * 7) % 256, (y * 13) % 256, (x + y) % 256).getRGB());
            }
        }
        return image;
    }

    public static Path write(BufferedImage image, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        ImageIO.write(image, "png", target.toFile());
        return target;
    }

    public static Path writeSolid(Path target, int size, Color color) throws IOException {
        return write(solid(size, size, color), target);
    }

    /**
     * Writes a {@code rows x cols} grid of square tiles named {@code <prefix>-<row>_<col>.png},
     * each filled with {@link #colorFor(int, int, int)}.
     */
    public static Path writeGrid(Path directory, String prefix, int rows, int cols, int size, int seed) throws IOException {
        Files.createDirectories(directory);
        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                writeSolid(directory.resolve(TileNaming.encodeParent(prefix, row, col)), size, colorFor(seed, row, col));
            }
        }
        return directory;
    }

    public static Color colorFor(int seed, int row, int col) {
        return new Color((seed * 60 + 20) % 256, (row * 40 + 10) % 256, (col * 40 + 30) % 256);
    }

    public static BufferedImage read(Path path) throws IOException {
        return ImageIO.read(path.toFile());
    }

    public static int rgbAt(Path path, int x, int y) throws IOException {
        return read(path).getRGB(x, y) & 0xFFFFFF;
    }

    public static boolean samePixels(BufferedImage left, BufferedImage right) {
        if (left.getWidth() != right.getWidth() || left.getHeight() != right.getHeight()) {
            return false;
        }
        for (int y = 0; y < left.getHeight(); y++) {
            for (int x = 0; x < left.getWidth(); x++) {
                if (left.getRGB(x, y) != right.getRGB(x, y)) {
                    return false;
                }
            }
        }
        return true;
    }
}
