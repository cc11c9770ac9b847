package ai.dadaist.collage.slice;

import ai.dadaist.collage.collaborator.Upscaler;
import ai.dadaist.collage.image.TileImages;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts a fully decoded image into square tiles. Pieces smaller than the rendered tile size are
 * enlarged through the {@link Upscaler}; a failed upscale keeps the original piece.
 */
public class GridSlicer {

    private static final Logger LOGGER = LoggerFactory.getLogger(GridSlicer.class);

    private final Upscaler upscaler;
    private final int renderedTileSize;

    public GridSlicer(Upscaler upscaler, int renderedTileSize) {
        this.upscaler = Objects.requireNonNull(upscaler, "upscaler");
        if (renderedTileSize < 0) {
            throw new IllegalArgumentException("renderedTileSize must not be negative");
        }
        this.renderedTileSize = renderedTileSize;
    }

    public SliceResult slice(Path imagePath, Path outputDir, int gridSize) {
        BufferedImage image;
        try {
            image = TileImages.read(imagePath);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to load " + imagePath, ex);
        }
        SliceGeometry geometry = SliceGeometry.of(image.getWidth(), image.getHeight(), gridSize);
        LOGGER.info("Slicing {} ({}x{}) into {}x{} pieces of {}px",
                imagePath.getFileName(), image.getWidth(), image.getHeight(), gridSize, gridSize, geometry.pieceSize());
        String stem = SliceGeometry.stemOf(imagePath);
        int piece = geometry.pieceSize();
        List<Path> tiles = new ArrayList<>(gridSize * gridSize);
        int upscaleFailures = 0;
        for (int row = 0; row < gridSize; row++) {
            for (int col = 0; col < gridSize; col++) {
                BufferedImage tile = TileImages.crop(image, col * piece, row * piece, piece, piece);
                Path target = outputDir.resolve(SliceGeometry.tileName(stem, row, col));
                if (piece < renderedTileSize) {
                    Optional<BufferedImage> upscaled = upscaler.upscale(tile, renderedTileSize);
                    if (upscaled.isPresent()) {
                        tile = upscaled.get();
                    } else {
                        LOGGER.warn("Upscaling failed, saving original piece {}", target.getFileName());
                        upscaleFailures++;
                    }
                }
                TileImages.writePng(tile, target);
                tiles.add(target);
            }
        }
        LOGGER.info("Created {} tiles for {}", tiles.size(), imagePath.getFileName());
        return new SliceResult(imagePath, geometry, tiles, false, upscaleFailures);
    }
}
