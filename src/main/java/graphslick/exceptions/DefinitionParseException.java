package graphslick.exceptions;

/**
 * The group definition could not be read or is malformed. No partial model is kept.
 */
public class DefinitionParseException extends GraphSlickException {

    public DefinitionParseException(String message) {
        super(message);
    }

    public DefinitionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
