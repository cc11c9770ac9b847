package ai.dadaist.collage.grid;

import java.nio.file.Path;

/**
 * A tile image could not be decoded.
 */
public class UnreadableTileException extends RuntimeException {

    private final Path path;

    public UnreadableTileException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public UnreadableTileException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
