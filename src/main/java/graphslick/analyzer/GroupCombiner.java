package graphslick.analyzer;

import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeDef;
import graphslick.base.group.NodeGroup;
import graphslick.exceptions.InsufficientSelectionException;
import graphslick.exceptions.NodeNotFoundException;
import graphslick.exceptions.PreconditionException;
import graphslick.utils.Logging;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges node groups picked by the user into a single node group.
 * <p>
 * The merged group replaces the first of the picked groups (lowest address)
 * inside its super group; the others are removed from their super groups.
 * Super groups left without node groups are kept.
 */
public class GroupCombiner {
    private final GroupManager gm;

    public GroupCombiner(GroupManager gm) {
        this.gm = gm;
    }

    /**
     * Combine the given node groups.
     * Nothing is changed unless every check passes.
     * @param selected the node groups to merge; duplicates are ignored
     * @return the merged node group
     * @throws InsufficientSelectionException if fewer than two distinct groups are given
     * @throws NodeNotFoundException if a group does not belong to the manager
     * @throws PreconditionException if the manager's lookups are not initialized
     */
    public NodeGroup combine(Collection<NodeGroup> selected)
            throws InsufficientSelectionException, NodeNotFoundException {
        if (!gm.isLookupsInitialized()) {
            Logging.error("GroupCombiner", "combine() called before lookups were initialized");
            throw new PreconditionException("Cannot combine node groups before lookups are initialized");
        }

        Map<NodeGroup, Boolean> distinct = new IdentityHashMap<>();
        List<NodeGroup> groups = new ArrayList<>();
        for (var ng : selected) {
            if (ng != null && distinct.put(ng, Boolean.TRUE) == null) {
                groups.add(ng);
            }
        }
        if (groups.size() < 2) {
            Logging.warn("GroupCombiner", "Not enough selected node groups: " + groups.size());
            throw new InsufficientSelectionException(groups.size());
        }

        Map<NodeGroup, Integer> modelOrder = new HashMap<>();
        int index = 0;
        for (var sg : gm.getSuperGroups()) {
            for (var ng : sg.getGroups()) {
                modelOrder.put(ng, index++);
            }
        }
        for (var ng : groups) {
            if (!modelOrder.containsKey(ng) || ng.isEmpty()) {
                throw new NodeNotFoundException("Node group is not part of " + gm.getSourceFile() + ": " + ng);
            }
        }

        groups.sort(Comparator
                .comparing((NodeGroup ng) -> ng.getFirstNodeDef().getStart(), Long::compareUnsigned)
                .thenComparingInt(this::discoveryOrder)
                .thenComparingInt(modelOrder::get));

        NodeGroup merged = new NodeGroup();
        for (var ng : groups) {
            for (NodeDef nd : ng) {
                merged.add(nd);
            }
        }

        var target = gm.replaceNodeGroups(groups, merged);
        Logging.info("GroupCombiner", String.format("Combined %d node groups into %s of super group %s",
                groups.size(), merged.describe(), target.getId()));
        return merged;
    }

    /**
     * Groups that already have a combined-graph id sort by it; the others after them.
     */
    private int discoveryOrder(NodeGroup ng) {
        int id = gm.getNodeGroupId(ng);
        return id == GroupManager.NO_NODE_ID ? Integer.MAX_VALUE : id;
    }
}
