package graphslick.base.graph;

/**
 * Text shown for one node of a {@link RenderableGraph}.
 */
public class RenderNode {
    private final int id;
    private final String text;
    private final String hint;

    public RenderNode(int id, String text, String hint) {
        this.id = id;
        this.text = text;
        this.hint = hint;
    }

    public int getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    /**
     * @return the hint, or the text if the node has no hint
     */
    public String getHint() {
        return hint == null || hint.isEmpty() ? text : hint;
    }

    @Override
    public String toString() {
        return "RenderNode{" + id + ": " + text.replace('\n', ' ') + "}";
    }
}
