package graphslick.exceptions;

/**
 * Base class of the recoverable failures reported by the group model,
 * the sanitizer, the graph synthesizer and the combiner.
 * The caller decides whether the failure is shown to the user or ignored.
 */
public class GraphSlickException extends Exception {

    public GraphSlickException(String message) {
        super(message);
    }

    public GraphSlickException(String message, Throwable cause) {
        super(message, cause);
    }
}
