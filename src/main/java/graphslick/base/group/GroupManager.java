package graphslick.base.group;

import graphslick.exceptions.PreconditionException;
import graphslick.utils.Logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the super groups loaded from one definition file, and the lookup indices
 * built once the groups have been sanitized against a flowchart.
 */
public class GroupManager {
    public static final int NO_NODE_ID = -1;

    private final String sourceFile;
    private final List<SuperGroup> superGroups = new ArrayList<>();

    private boolean sanitized = false;
    private boolean lookupsInitialized = false;

    /** Map from node definition id to its location in the hierarchy */
    private final Map<Integer, NodeLocation> nidToLocation = new HashMap<>();

    /** Map from node group to its combined-graph node id */
    private final Map<NodeGroup, Integer> groupToId = new HashMap<>();

    /** Map from combined-graph node id to its node group */
    private final Map<Integer, NodeGroup> idToGroup = new HashMap<>();

    private int nextGroupId = 0;

    public GroupManager(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    public String getSourceFile() {
        return sourceFile;
    }

    public List<SuperGroup> getSuperGroups() {
        return Collections.unmodifiableList(superGroups);
    }

    /**
     * Append a super group while the raw hierarchy is being built.
     * @throws IllegalArgumentException if a super group with the same id exists
     */
    public void addSuperGroup(SuperGroup sg) {
        if (findSuperGroup(sg.getId()).isPresent()) {
            throw new IllegalArgumentException("Duplicate super group id: " + sg.getId());
        }
        superGroups.add(sg);
    }

    public Optional<SuperGroup> findSuperGroup(String id) {
        for (var sg : superGroups) {
            if (sg.getId().equals(id)) {
                return Optional.of(sg);
            }
        }
        return Optional.empty();
    }

    /**
     * The first node definition in model order. Used to find out which function
     * the definition file describes.
     */
    public Optional<NodeDef> firstNodeDef() {
        for (var sg : superGroups) {
            for (var ng : sg.getGroups()) {
                if (!ng.isEmpty()) {
                    return Optional.of(ng.getFirstNodeDef());
                }
            }
        }
        return Optional.empty();
    }

    /**
     * @return every node definition of the model, ordered by nid
     */
    public List<NodeDef> getNodeDefs() {
        List<NodeDef> result = new ArrayList<>();
        for (var sg : superGroups) {
            for (var ng : sg.getGroups()) {
                result.addAll(ng.getNodeDefs());
            }
        }
        result.sort(Comparator.comparingInt(NodeDef::getNid));
        return result;
    }

    public int getNodeGroupCount() {
        int count = 0;
        for (var sg : superGroups) {
            count += sg.gcount();
        }
        return count;
    }

    public boolean isSanitized() {
        return sanitized;
    }

    public boolean isLookupsInitialized() {
        return lookupsInitialized;
    }

    /**
     * Replace the whole hierarchy with a sanitized one in a single step.
     * Any previously built lookup is dropped.
     * @param sanitizedGroups the reconciled super groups
     */
    public void applySanitized(List<SuperGroup> sanitizedGroups) {
        superGroups.clear();
        superGroups.addAll(sanitizedGroups);
        sanitized = true;
        lookupsInitialized = false;
        nidToLocation.clear();
        groupToId.clear();
        idToGroup.clear();
        nextGroupId = 0;
    }

    /**
     * Build the nid lookup and reset the node group id index.
     * @throws PreconditionException if the manager was not sanitized or nids collide
     */
    public void initializeLookups() {
        if (!sanitized) {
            Logging.error("GroupManager", "initializeLookups() called before sanitization of " + sourceFile);
            throw new PreconditionException("Group manager must be sanitized before its lookups are built");
        }

        Map<Integer, NodeLocation> locations = new HashMap<>();
        for (var sg : superGroups) {
            for (var ng : sg.getGroups()) {
                for (var nd : ng) {
                    if (locations.put(nd.getNid(), new NodeLocation(sg, ng, nd)) != null) {
                        Logging.error("GroupManager", "Duplicate node id " + nd.getNid());
                        throw new PreconditionException("Duplicate node id " + nd.getNid() + " in sanitized model");
                    }
                }
            }
        }

        nidToLocation.clear();
        nidToLocation.putAll(locations);
        groupToId.clear();
        idToGroup.clear();
        nextGroupId = 0;
        lookupsInitialized = true;
        Logging.debug("GroupManager", String.format("Initialized lookups: %d node definitions", nidToLocation.size()));
    }

    public Optional<NodeLocation> findNodeLocation(int nid) {
        checkLookups();
        return Optional.ofNullable(nidToLocation.get(nid));
    }

    /**
     * Find the super group holding a node group, through the location of its first node definition.
     */
    public Optional<SuperGroup> getSuperGroupOf(NodeGroup ng) {
        checkLookups();
        var nd = ng.getFirstNodeDef();
        if (nd == null) {
            return Optional.empty();
        }
        var loc = nidToLocation.get(nd.getNid());
        if (loc == null || loc.nodeGroup != ng) {
            return Optional.empty();
        }
        return Optional.of(loc.superGroup);
    }

    public boolean containsNodeGroup(NodeGroup ng) {
        return getSuperGroupOf(ng).isPresent();
    }

    /**
     * @return the combined-graph node id of the group, or {@link #NO_NODE_ID}
     */
    public int getNodeGroupId(NodeGroup ng) {
        Integer id = groupToId.get(ng);
        return id == null ? NO_NODE_ID : id;
    }

    /**
     * Get the combined-graph node id of the group, assigning the next free one if needed.
     */
    public int getOrAssignNodeGroupId(NodeGroup ng) {
        checkLookups();
        Integer id = groupToId.get(ng);
        if (id != null) {
            return id;
        }
        int newId = nextGroupId++;
        groupToId.put(ng, newId);
        idToGroup.put(newId, ng);
        return newId;
    }

    public Optional<NodeGroup> getNodeGroupById(int id) {
        return Optional.ofNullable(idToGroup.get(id));
    }

    /**
     * Swap a list of node groups for their merged group, keeping every index current.
     * The merged group takes the place of the first group inside its super group, and
     * inherits its combined-graph node id if it had one.
     * @param ordered the groups being merged; all must belong to this manager
     * @param merged the new group holding their node definitions
     * @return the super group receiving the merged group
     */
    public SuperGroup replaceNodeGroups(List<NodeGroup> ordered, NodeGroup merged) {
        checkLookups();
        List<SuperGroup> owners = new ArrayList<>();
        for (var ng : ordered) {
            var owner = getSuperGroupOf(ng);
            if (owner.isEmpty()) {
                throw new PreconditionException("Node group is not part of this manager: " + ng);
            }
            owners.add(owner.get());
        }

        SuperGroup target = owners.get(0);
        NodeGroup first = ordered.get(0);
        int inheritedId = getNodeGroupId(first);

        target.insertGroup(target.indexOf(first), merged);
        for (int i = 0; i < ordered.size(); i++) {
            NodeGroup ng = ordered.get(i);
            owners.get(i).removeGroup(ng);
            Integer oldId = groupToId.remove(ng);
            if (oldId != null) {
                idToGroup.remove(oldId);
            }
        }

        for (var nd : merged) {
            nidToLocation.put(nd.getNid(), new NodeLocation(target, merged, nd));
        }

        if (inheritedId != NO_NODE_ID) {
            groupToId.put(merged, inheritedId);
            idToGroup.put(inheritedId, merged);
        }
        return target;
    }

    private void checkLookups() {
        if (!lookupsInitialized) {
            Logging.error("GroupManager", "Lookup used before initializeLookups() on " + sourceFile);
            throw new PreconditionException("Lookups of " + sourceFile + " are not initialized");
        }
    }

    @Override
    public String toString() {
        return String.format("GroupManager{%s, %d super groups}", sourceFile, superGroups.size());
    }
}
