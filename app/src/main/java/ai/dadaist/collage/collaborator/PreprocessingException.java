package ai.dadaist.collage.collaborator;

/**
 * Runtime exception used to propagate preprocessing failures.
 */
public class PreprocessingException extends RuntimeException {

    public PreprocessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
