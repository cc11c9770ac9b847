package ai.dadaist.collage.assemble;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Files written for one assembled canvas.
 */
public record CanvasOutput(Path png, Path jpeg, Path manifestFile, String pixelDigest, AssemblyManifest manifest) {

    public CanvasOutput {
        Objects.requireNonNull(png, "png");
        Objects.requireNonNull(jpeg, "jpeg");
        Objects.requireNonNull(manifestFile, "manifestFile");
        Objects.requireNonNull(pixelDigest, "pixelDigest");
        Objects.requireNonNull(manifest, "manifest");
    }
}
