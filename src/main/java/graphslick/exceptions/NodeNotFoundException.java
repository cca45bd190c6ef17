package graphslick.exceptions;

/**
 * A node id, node group or super group id does not resolve in the current model.
 */
public class NodeNotFoundException extends GraphSlickException {

    public NodeNotFoundException(String message) {
        super(message);
    }
}
