package graphslick.exceptions;

public class InsufficientSelectionException extends GraphSlickException {

    private final int selectedCount;

    public InsufficientSelectionException(int selectedCount) {
        super("Not enough selected nodes: " + selectedCount + " selected, at least 2 required");
        this.selectedCount = selectedCount;
    }

    public int getSelectedCount() {
        return selectedCount;
    }
}
