package graphslick.exceptions;

import graphslick.base.graph.ViewMode;

public class InvalidViewModeException extends GraphSlickException {

    public InvalidViewModeException(String operation, ViewMode required, ViewMode current) {
        super(String.format("%s is only available in %s mode (current: %s)", operation, required, current));
    }
}
