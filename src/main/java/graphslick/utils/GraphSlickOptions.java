package graphslick.utils;

import graphslick.base.graph.ViewMode;

/**
 * User options shared by the graph synthesizer and the graph view.
 */
public class GraphSlickOptions {
    /** Append the node id to the node text */
    public boolean appendNodeId = false;

    /** Highlight synthetic super groups along with the loaded ones */
    public boolean highlightSyntheticNodes = false;

    /** Pad one-line group names so combined nodes look bigger */
    public boolean enlargeGroupName = true;

    /** View mode used when a graph is first shown */
    public ViewMode startViewMode = ViewMode.COMBINED;

    /** Log each lazy highlight and unresolved node group */
    public boolean debug = false;

    @Override
    public String toString() {
        return "GraphSlickOptions{" +
                "appendNodeId=" + appendNodeId +
                ", highlightSyntheticNodes=" + highlightSyntheticNodes +
                ", enlargeGroupName=" + enlargeGroupName +
                ", startViewMode=" + startViewMode +
                ", debug=" + debug +
                '}';
    }
}
