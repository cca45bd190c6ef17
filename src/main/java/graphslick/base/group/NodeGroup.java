package graphslick.base.group;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered list of node definitions drawn as one node in combined mode.
 * Groups are compared by identity: two groups holding the same blocks are still
 * two different groups.
 */
public class NodeGroup implements Iterable<NodeDef> {
    private final List<NodeDef> nodeDefs = new ArrayList<>();

    public NodeGroup() {
    }

    public NodeGroup(Collection<NodeDef> nodeDefs) {
        this.nodeDefs.addAll(nodeDefs);
    }

    public void add(NodeDef nd) {
        nodeDefs.add(nd);
    }

    public List<NodeDef> getNodeDefs() {
        return Collections.unmodifiableList(nodeDefs);
    }

    /**
     * @return the first node definition, or null if the group is empty
     */
    public NodeDef getFirstNodeDef() {
        return nodeDefs.isEmpty() ? null : nodeDefs.get(0);
    }

    public int size() {
        return nodeDefs.size();
    }

    public boolean isEmpty() {
        return nodeDefs.isEmpty();
    }

    @Override
    public Iterator<NodeDef> iterator() {
        return getNodeDefs().iterator();
    }

    /**
     * Describe the group as {@code C(n):(nid:start:end, ...)}.
     */
    public String describe() {
        return String.format("C(%d):(%s)", nodeDefs.size(),
                nodeDefs.stream().map(NodeDef::toString).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return "NodeGroup" + describe();
    }
}
