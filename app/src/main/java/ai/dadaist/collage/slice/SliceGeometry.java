package ai.dadaist.collage.slice;

import ai.dadaist.collage.naming.TileNaming;
import java.nio.file.Path;

/**
 * Square tiling of an image: {@code gridSize x gridSize} pieces of {@code pieceSize} pixels,
 * anchored top-left. Pixels beyond {@code gridSize * pieceSize} are dropped.
 */
public record SliceGeometry(int imageWidth, int imageHeight, int gridSize, int pieceSize) {

    public SliceGeometry {
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be at least 1");
        }
        if (pieceSize < 1) {
            throw new IllegalArgumentException(String.format(
                    "Image %dx%d is too small for a %dx%d grid", imageWidth, imageHeight, gridSize, gridSize));
        }
    }

    public static SliceGeometry of(int imageWidth, int imageHeight, int gridSize) {
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be at least 1");
        }
        return new SliceGeometry(imageWidth, imageHeight, gridSize, Math.min(imageWidth / gridSize, imageHeight / gridSize));
    }

    public int usedSize() {
        return gridSize * pieceSize;
    }

    public static String tileName(String stem, int row, int col) {
        return TileNaming.encodeParent(stem, row, col);
    }

    /**
     * File name without extension, usable as a tile prefix: trailing {@code -} are stripped and
     * an empty result becomes {@link TileNaming#DEFAULT_PREFIX}.
     */
    static String stemOf(Path imagePath) {
        String fileName = imagePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        int end = stem.length();
        while (end > 0 && stem.charAt(end - 1) == '-') {
            end--;
        }
        return end == 0 ? TileNaming.DEFAULT_PREFIX : stem.substring(0, end);
    }
}
