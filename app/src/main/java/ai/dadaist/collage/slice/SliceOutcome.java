package ai.dadaist.collage.slice;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of slicing every image under {@code base_image/}.
 */
public record SliceOutcome(List<SliceResult> sliced, List<String> failedImages, List<Path> masks) {

    public SliceOutcome {
        sliced = List.copyOf(Objects.requireNonNull(sliced, "sliced"));
        failedImages = List.copyOf(Objects.requireNonNull(failedImages, "failedImages"));
        masks = List.copyOf(Objects.requireNonNull(masks, "masks"));
    }

    public int tileCount() {
        return sliced.stream().mapToInt(result -> result.tiles().size()).sum();
    }

    public boolean hasFailures() {
        return !failedImages.isEmpty();
    }
}
