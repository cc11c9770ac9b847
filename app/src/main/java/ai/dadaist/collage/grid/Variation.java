package ai.dadaist.collage.grid;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A named directory of tiles sharing one {@link GridSpec}. {@code tileNames} holds every
 * filename that parses as a parent tile, sorted.
 */
public record Variation(String name, Path directory, GridSpec gridSpec, List<String> tileNames) {

    public Variation {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(gridSpec, "gridSpec");
        tileNames = List.copyOf(Objects.requireNonNull(tileNames, "tileNames"));
    }
}
