package ai.dadaist.collage.naming;

/**
 * Raised when a filename does not follow the grid-coordinate naming contract.
 */
public class InvalidNameException extends RuntimeException {

    private final String name;

    public InvalidNameException(String name, String message) {
        super(message);
        this.name = name;
    }

    public InvalidNameException(String name, String message, Throwable cause) {
        super(message, cause);
        this.name = name;
    }

    public String name() {
        return name;
    }
}
