package ai.dadaist.collage.slice;

import java.util.Objects;

/**
 * Summary of a chunked slicing pass.
 *
 * @param chunkHeight  requested band height in rows
 * @param bands        number of bands decoded
 */
public record ChunkingReport(SliceResult result, ResourceCheck resources, int chunkHeight, int bands) {

    public ChunkingReport {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(resources, "resources");
    }
}
