package ai.dadaist.collage.slice;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Tiles written for one source image.
 *
 * @param chunked          whether the image went through row-band processing
 * @param upscaleFailures  pieces kept at their original size because the upscaler gave up
 */
public record SliceResult(Path source, SliceGeometry geometry, List<Path> tiles, boolean chunked, int upscaleFailures) {

    public SliceResult {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(geometry, "geometry");
        tiles = List.copyOf(Objects.requireNonNull(tiles, "tiles"));
    }
}
