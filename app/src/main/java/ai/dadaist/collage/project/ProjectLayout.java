package ai.dadaist.collage.project;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Resolves the fixed directory layout of a collage project.
 */
public record ProjectLayout(Path root) {

    public static final String BASE_IMAGE = "base_image";
    public static final String PREPROCESSED = "preprocessed";
    public static final String BASE_TILES = "base_tiles";
    public static final String RENDERED_TILES = "rendered_tiles";
    public static final String SUBDIVIDED_TILES = "subdivided_tiles";
    public static final String MASK_DIRECTORY = "mask_directory";
    public static final String COLLAGE_OUT = "collage_out";
    public static final String RESTORED = "restored";
    public static final String RANDOMIZED = "randomized";

    public ProjectLayout {
        root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path baseImageDir() {
        return root.resolve(BASE_IMAGE);
    }

    public Path preprocessedDir() {
        return baseImageDir().resolve(PREPROCESSED);
    }

    public Path baseTilesDir() {
        return root.resolve(BASE_TILES);
    }

    public Path renderedTilesDir() {
        return root.resolve(RENDERED_TILES);
    }

    public Path renderedVariationDir(String variation) {
        return renderedTilesDir().resolve(variation);
    }

    public Path subdividedTilesDir() {
        return root.resolve(SUBDIVIDED_TILES);
    }

    public Path subdividedVariationDir(String variation) {
        return subdividedTilesDir().resolve(variation);
    }

    public Path subdivisionScaleDir(String variation, int scale) {
        return subdividedVariationDir(variation).resolve(scale + "x" + scale);
    }

    public Path maskDir() {
        return root.resolve(MASK_DIRECTORY);
    }

    public Path collageOutDir() {
        return root.resolve(COLLAGE_OUT);
    }

    public Path restoredDir(String variation) {
        return collageOutDir().resolve(RESTORED).resolve(variation);
    }

    public Path randomizedDir() {
        return collageOutDir().resolve(RANDOMIZED);
    }

    /**
     * Path of {@code path} relative to the project root, always with {@code /} separators.
     * Paths outside the root climb out with {@code ..} segments.
     */
    public String relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        return root.relativize(absolute).toString().replace('\\', '/');
    }

    public void ensureDirectories(List<Path> directories) {
        for (Path directory : directories) {
            try {
                Files.createDirectories(directory);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to create directory " + directory, ex);
            }
        }
    }
}
