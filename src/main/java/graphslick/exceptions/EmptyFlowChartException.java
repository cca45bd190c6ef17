package graphslick.exceptions;

/**
 * The function has no basic blocks, so nothing can be sanitized or drawn.
 */
public class EmptyFlowChartException extends GraphSlickException {

    public EmptyFlowChartException(String functionName) {
        super("Flowchart of function '" + functionName + "' has no basic blocks");
    }
}
