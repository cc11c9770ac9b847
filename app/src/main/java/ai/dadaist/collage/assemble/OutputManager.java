package ai.dadaist.collage.assemble;

import ai.dadaist.collage.image.TileImages;
import ai.dadaist.collage.project.ProjectLayout;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a canvas as lossless PNG, a packed JPEG and the JSON manifest, all sharing one base name
 * {@code [<label>-]<md5-of-pixels>-<yyyy-MM-dd>}.
 */
public class OutputManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputManager.class);
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final float JPEG_QUALITY = 0.9f;

    private final Clock clock;
    private final ManifestWriter manifestWriter;

    public OutputManager() {
        this(Clock.systemDefaultZone(), new ManifestWriter());
    }

    public OutputManager(Clock clock, ManifestWriter manifestWriter) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.manifestWriter = Objects.requireNonNull(manifestWriter, "manifestWriter");
    }

    public CanvasOutput save(BufferedImage canvas,
                             AssemblyManifest manifest,
                             ProjectLayout layout,
                             Path outputDir,
                             Optional<String> label) {
        String digest = pixelDigest(canvas);
        String date = LocalDate.now(clock).format(DATE_FORMAT);
        String baseName = label.map(value -> value + "-").orElse("") + digest + "-" + date;

        Path png = outputDir.resolve(baseName + ".png");
        Path jpeg = outputDir.resolve(baseName + "-packed.jpg");
        Path json = outputDir.resolve(baseName + ".json");

        LOGGER.info("Saving {} to {}", baseName, outputDir);
        TileImages.writePng(canvas, png);
        TileImages.writeJpeg(canvas, jpeg, JPEG_QUALITY);
        manifestWriter.write(manifest, layout, json);
        return new CanvasOutput(png, jpeg, json, digest, manifest);
    }

    /**
     * MD5 over the raw BGR pixel bytes, stable across encoders.
     */
    public static String pixelDigest(BufferedImage canvas) {
        BufferedImage bgr = TileImages.toBgr(canvas);
        byte[] pixels = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        try {
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(pixels));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 digest is not available", ex);
        }
    }
}
