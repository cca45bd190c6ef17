package graphslick.exceptions;

/**
 * An internal sequencing contract was violated, e.g. the lookup indices were
 * queried before the group manager was sanitized. Not recoverable by the user.
 */
public class PreconditionException extends IllegalStateException {

    public PreconditionException(String message) {
        super(message);
    }
}
