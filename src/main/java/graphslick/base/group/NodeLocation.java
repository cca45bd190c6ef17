package graphslick.base.group;

/**
 * Where a node definition lives in the group hierarchy.
 */
public class NodeLocation {
    public final SuperGroup superGroup;
    public final NodeGroup nodeGroup;
    public final NodeDef nodeDef;

    public NodeLocation(SuperGroup superGroup, NodeGroup nodeGroup, NodeDef nodeDef) {
        this.superGroup = superGroup;
        this.nodeGroup = nodeGroup;
        this.nodeDef = nodeDef;
    }

    @Override
    public String toString() {
        return "NodeLocation{" + superGroup.getId() + ", " + nodeDef + "}";
    }
}
