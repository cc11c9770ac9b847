package ai.dadaist.collage.image;

import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image decoding, encoding and pixel copying shared by slicing, subdivision and assembly.
 *
 * <p>All in-memory pixels are normalised to {@link BufferedImage#TYPE_3BYTE_BGR}: three 8-bit
 * channels, zero-filled on allocation. Encoded files are written to a temporary sibling first
 * and moved into place, so a reader never observes a half-written tile.
 */
public final class TileImages {

    public static final int CHANNELS = 3;

    private static final Logger LOGGER = LoggerFactory.getLogger(TileImages.class);

    static {
        ImageIO.setUseCache(false);
    }

    private TileImages() {
    }

    public static BufferedImage blank(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("image size must be positive: " + width + "x" + height);
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
    }

    /**
     * Decodes an image, returning empty when the file is missing or no decoder accepts it.
     */
    public static Optional<BufferedImage> tryRead(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            BufferedImage image = ImageIO.read(path.toFile());
            return Optional.ofNullable(image).map(TileImages::toBgr);
        } catch (IOException | RuntimeException ex) {
            LOGGER.debug("Cannot decode {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    public static BufferedImage read(Path path) throws IOException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("No image decoder accepts " + path);
        }
        return toBgr(image);
    }

    /**
     * Reads the pixel size from the image header without decoding pixel data.
     */
    public static ImageDimensions readDimensions(Path path) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            ImageReader reader = firstReader(input, path);
            try {
                reader.setInput(input, true, true);
                return new ImageDimensions(reader.getWidth(0), reader.getHeight(0));
            } finally {
                reader.dispose();
            }
        }
    }

    /**
     * Decodes only the rows {@code [startY, endY)} of an image.
     */
    public static BufferedImage readBand(Path path, int startY, int endY) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            ImageReader reader = firstReader(input, path);
            try {
                reader.setInput(input, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (startY < 0 || endY > height || startY >= endY) {
                    throw new IllegalArgumentException("band [" + startY + "," + endY + ") outside image height " + height);
                }
                ImageReadParam param = reader.getDefaultReadParam();
                param.setSourceRegion(new Rectangle(0, startY, width, endY - startY));
                return toBgr(reader.read(0, param));
            } finally {
                reader.dispose();
            }
        }
    }

    public static BufferedImage toBgr(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        if (image.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            return image;
        }
        BufferedImage converted = blank(image.getWidth(), image.getHeight());
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(image, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }

    /**
     * Returns {@code image} unchanged when it already has the requested size, otherwise a bilinear resample.
     */
    public static BufferedImage resizeTo(BufferedImage image, int width, int height) {
        if (image.getWidth() == width && image.getHeight() == height) {
            return image;
        }
        BufferedImage resized = blank(width, height);
        Graphics2D graphics = resized.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(image, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return resized;
    }

    /**
     * Copies an independent region so later writes to either image do not alias.
     */
    public static BufferedImage crop(BufferedImage source, int x, int y, int width, int height) {
        BufferedImage region = blank(width, height);
        region.getRaster().setRect(-x, -y, toBgr(source).getRaster());
        return region;
    }

    /**
     * Copies every pixel of {@code tile} into {@code canvas} with its top-left corner at {@code (x, y)}.
     * Pixels falling outside the canvas are clipped.
     */
    public static void blit(BufferedImage canvas, BufferedImage tile, int x, int y) {
        canvas.getRaster().setRect(x, y, toBgr(tile).getRaster());
    }

    public static void writePng(BufferedImage image, Path target) {
        writeAtomically(target, temp -> {
            if (!ImageIO.write(image, "png", temp.toFile())) {
                throw new IOException("No PNG encoder available");
            }
        });
    }

    public static void writeJpeg(BufferedImage image, Path target, float quality) {
        writeAtomically(target, temp -> {
            Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
            if (!writers.hasNext()) {
                throw new IOException("No JPEG encoder available");
            }
            ImageWriter writer = writers.next();
            ImageWriteParam param = writer.getDefaultWriteParam();
            param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
            param.setCompressionQuality(quality);
            try (ImageOutputStream output = ImageIO.createImageOutputStream(temp.toFile())) {
                writer.setOutput(output);
                writer.write(null, new IIOImage(toBgr(image), null, null), param);
            } finally {
                writer.dispose();
            }
        });
    }

    public static void writeAtomically(Path target, FileWrite write) {
        Objects.requireNonNull(target, "target");
        Path directory = target.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, "." + target.getFileName(), ".part");
            write.writeTo(temp);
            moveIntoPlace(temp, target);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write " + target, ex);
        } finally {
            deleteTemporary(temp);
        }
    }

    public static boolean isImageFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".png") || name.endsWith(".jpg") || name.endsWith(".jpeg")
                || name.endsWith(".bmp") || name.endsWith(".gif");
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteTemporary(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to remove temporary file " + temp, ex);
        }
    }

    private static ImageReader firstReader(ImageInputStream input, Path path) throws IOException {
        if (input == null) {
            throw new IOException("Cannot open image stream for " + path);
        }
        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext()) {
            throw new IOException("No image decoder accepts " + path);
        }
        return readers.next();
    }

    /**
     * Encodes content into the given temporary file.
     */
    @FunctionalInterface
    public interface FileWrite {
        void writeTo(Path temp) throws IOException;
    }
}
