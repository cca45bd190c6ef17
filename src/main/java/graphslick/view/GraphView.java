package graphslick.view;

import graphslick.analyzer.GroupCombiner;
import graphslick.base.flowchart.FlowChart;
import graphslick.base.graph.GraphSynthesizer;
import graphslick.base.graph.RenderableGraph;
import graphslick.base.graph.ViewMode;
import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeDef;
import graphslick.base.group.NodeGroup;
import graphslick.base.group.SuperGroup;
import graphslick.exceptions.EmptyFlowChartException;
import graphslick.exceptions.InsufficientSelectionException;
import graphslick.exceptions.InvalidViewModeException;
import graphslick.exceptions.NodeNotFoundException;
import graphslick.exceptions.PreconditionException;
import graphslick.utils.GraphSlickOptions;
import graphslick.utils.Logging;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * One displayed graph of a function and the user state attached to it.
 * <p>
 * Node ids mean different things in flat and combined mode, so every mode switch
 * drops the selection, the highlighting and the current node before the new
 * graph becomes visible. Selection colors win over highlight colors.
 */
public class GraphView implements AutoCloseable {
    private final FlowChart fc;
    private final GroupManager gm;
    private final GraphSlickOptions options;
    private final GraphSynthesizer synthesizer;
    private final GroupCombiner combiner;
    private final ColorAssigner colors = new ColorAssigner();

    private ViewMode mode;
    private RenderableGraph graph;
    private int currentNode = -1;
    private boolean selectionMode = false;
    private boolean closed = false;

    private final Map<Integer, Color> selectedNodes = new LinkedHashMap<>();
    private final Map<Integer, Color> highlightedNodes = new LinkedHashMap<>();

    private GraphView(FlowChart fc, GroupManager gm, GraphSlickOptions options) {
        this.fc = fc;
        this.gm = gm;
        this.options = options;
        this.synthesizer = new GraphSynthesizer(options);
        this.combiner = new GroupCombiner(gm);
    }

    /**
     * Build the graph of a sanitized group manager in the start-up view mode.
     */
    public static GraphView open(FlowChart fc, GroupManager gm, GraphSlickOptions options)
            throws EmptyFlowChartException {
        GraphView view = new GraphView(fc, gm, options);
        view.switchMode(options.startViewMode);
        return view;
    }

    public ViewMode getMode() {
        return mode;
    }

    public RenderableGraph getGraph() {
        checkOpen();
        return graph;
    }

    public GroupManager getGroupManager() {
        return gm;
    }

    /**
     * Rebuild the graph in the given mode. Selection and highlighting are cleared first.
     */
    public void switchMode(ViewMode newMode) throws EmptyFlowChartException {
        checkOpen();
        resetStates();
        Logging.info("GraphView", "Switching to " + newMode.name().toLowerCase() + " mode view...");
        RenderableGraph newGraph = synthesizer.build(newMode, fc, gm);
        graph = newGraph;
        mode = newMode;
    }

    /**
     * Rebuild the graph in the current mode, e.g. after the model changed.
     */
    public void refresh() throws EmptyFlowChartException {
        switchMode(mode);
    }

    private void resetStates() {
        highlightedNodes.clear();
        selectedNodes.clear();
        colors.reset();
        currentNode = -1;
    }

    public int getCurrentNode() {
        return currentNode;
    }

    public void setCurrentNode(int nodeId) {
        checkOpen();
        currentNode = graph.containsNode(nodeId) ? nodeId : -1;
    }

    public boolean isSelectionMode() {
        return selectionMode;
    }

    public void setSelectionMode(boolean selectionMode) {
        this.selectionMode = selectionMode;
        Logging.debug("GraphView", selectionMode ? "Start selection mode" : "End selection mode");
    }

    /**
     * A node was clicked: it becomes the current node, and is toggled in selection mode.
     */
    public void onNodeClicked(int nodeId) throws NodeNotFoundException {
        setCurrentNode(nodeId);
        if (selectionMode) {
            toggleSelect(nodeId);
        }
    }

    /**
     * Select the node if it is not selected, unselect it otherwise.
     * @return true if the node is now selected
     */
    public boolean toggleSelect(int nodeId) throws NodeNotFoundException {
        checkOpen();
        if (!graph.containsNode(nodeId)) {
            throw new NodeNotFoundException("No node " + nodeId + " in the " + mode + " graph");
        }
        if (selectedNodes.remove(nodeId) != null) {
            return false;
        }
        selectedNodes.put(nodeId, ColorAssigner.SELECTION_COLOR);
        if (options.debug) {
            Logging.debug("GraphView", "Selected " + nodeId);
        }
        return true;
    }

    public Set<Integer> getSelectedNodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(selectedNodes.keySet()));
    }

    public Set<Integer> getHighlightedNodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(highlightedNodes.keySet()));
    }

    public void clearSelection() {
        selectedNodes.clear();
    }

    public void clearHighlighting() {
        highlightedNodes.clear();
        colors.reset();
    }

    /**
     * Background color of a node: its selection color, else its highlight color.
     */
    public Optional<Color> colorOf(int nodeId) {
        Color color = selectedNodes.get(nodeId);
        if (color == null) {
            color = highlightedNodes.get(nodeId);
        }
        return Optional.ofNullable(color);
    }

    /**
     * The graph node showing the given node group in the current mode: the group's
     * id in combined mode, the nid of its first node definition in flat mode.
     * @return the node id, or -1 if the group is not shown
     */
    public int nodeIdOf(NodeGroup ng) {
        if (ng != null) {
            if (mode == ViewMode.COMBINED) {
                return gm.getNodeGroupId(ng);
            } else if (mode == ViewMode.FLAT) {
                NodeDef nd = ng.getFirstNodeDef();
                return nd == null ? -1 : nd.getNid();
            }
        }
        if (options.debug) {
            Logging.debug("GraphView", "Could not find graph node for " + ng);
        }
        return -1;
    }

    /**
     * The super group drawn by a node of the current graph.
     */
    public Optional<SuperGroup> superGroupOfNode(int nodeId) {
        if (mode == ViewMode.COMBINED) {
            return gm.getNodeGroupById(nodeId).flatMap(gm::getSuperGroupOf);
        }
        return gm.findNodeLocation(nodeId).map(loc -> loc.superGroup);
    }

    /**
     * Highlight a node group with one color.
     * @return false if the group is not shown in the current graph
     */
    public boolean highlight(NodeGroup ng, Color color) {
        checkOpen();
        List<Integer> colored = new ArrayList<>();
        if (mode == ViewMode.COMBINED) {
            int id = nodeIdOf(ng);
            if (id == -1 || !graph.containsNode(id)) {
                return false;
            }
            colored.add(id);
        } else {
            for (var nd : ng) {
                if (graph.containsNode(nd.getNid())) {
                    colored.add(nd.getNid());
                }
            }
            if (colored.isEmpty()) {
                return false;
            }
        }

        for (int id : colored) {
            highlightedNodes.put(id, color);
        }
        if (options.debug) {
            Logging.debug("GraphView", "Lazy highlight( " + colored + " )");
        }
        return true;
    }

    /**
     * Highlight node groups as one family: one batch, one variant per group.
     * An empty list takes no batch.
     */
    public void highlight(List<NodeGroup> groups) {
        if (groups.isEmpty()) {
            return;
        }
        ColorAssigner.BatchHandle batch = colors.newBatch();
        for (var ng : groups) {
            highlight(ng, colors.nextVariant(batch));
        }
    }

    /**
     * Highlight super groups, one color family each. Synthetic super groups are
     * skipped unless the options ask for them.
     */
    public void highlightSuperGroups(List<SuperGroup> superGroups) {
        for (var sg : superGroups) {
            if (sg.isSynthetic() && !options.highlightSyntheticNodes) {
                continue;
            }
            highlight(sg.getGroups());
        }
    }

    /**
     * Highlight the super groups whose name or id contains the pattern, ignoring case.
     * Previous highlighting is cleared.
     * @return the node to jump to: the first group of the last match
     */
    public OptionalInt findAndHighlight(String pattern) {
        checkOpen();
        clearHighlighting();
        if (pattern == null || pattern.isBlank()) {
            return OptionalInt.empty();
        }

        String needle = pattern.toLowerCase();
        SuperGroup lastMatch = null;
        for (var sg : gm.getSuperGroups()) {
            if (sg.getName().toLowerCase().contains(needle) || sg.getId().toLowerCase().contains(needle)) {
                highlight(sg.getGroups());
                lastMatch = sg;
            }
        }

        if (lastMatch == null || lastMatch.getFirstGroup() == null) {
            Logging.info("GraphView", "No group matches '" + pattern + "'");
            return OptionalInt.empty();
        }
        int nodeId = nodeIdOf(lastMatch.getFirstGroup());
        return nodeId == -1 ? OptionalInt.empty() : OptionalInt.of(nodeId);
    }

    /**
     * Combine the selected nodes of the combined graph into one node group and redraw.
     */
    public NodeGroup combineSelected()
            throws InvalidViewModeException, InsufficientSelectionException, NodeNotFoundException,
            EmptyFlowChartException {
        return combine(selectedNodes.keySet());
    }

    /**
     * Combine the given nodes of the combined graph into one node group and redraw.
     * @param nodeIds combined-graph node ids
     */
    public NodeGroup combine(Collection<Integer> nodeIds)
            throws InvalidViewModeException, InsufficientSelectionException, NodeNotFoundException,
            EmptyFlowChartException {
        checkOpen();
        if (mode != ViewMode.COMBINED) {
            throw new InvalidViewModeException("Grouping", ViewMode.COMBINED, mode);
        }
        if (nodeIds.size() <= 1) {
            throw new InsufficientSelectionException(nodeIds.size());
        }

        List<NodeGroup> groups = new ArrayList<>();
        for (int id : nodeIds) {
            var ng = gm.getNodeGroupById(id);
            if (ng.isEmpty()) {
                throw new NodeNotFoundException("No node group with id " + id);
            }
            groups.add(ng.get());
        }

        NodeGroup merged = combiner.combine(groups);
        refresh();
        return merged;
    }

    /**
     * Change the description of a super group and update the hints of its nodes.
     */
    public void editDescription(String superGroupId, String description) throws NodeNotFoundException {
        checkOpen();
        SuperGroup sg = gm.findSuperGroup(superGroupId)
                .orElseThrow(() -> new NodeNotFoundException("No super group with id " + superGroupId));
        sg.setDescription(description);

        if (mode == ViewMode.COMBINED) {
            for (var ng : sg.getGroups()) {
                int id = gm.getNodeGroupId(ng);
                if (id != GroupManager.NO_NODE_ID && graph.containsNode(id)) {
                    graph.putNode(synthesizer.combinedNode(id, ng, sg));
                }
            }
        }
        Logging.info("GraphView", "Updated description of super group " + superGroupId);
    }

    /**
     * Change the description of the super group shown by the current node.
     */
    public void editCurrentDescription(String description)
            throws InvalidViewModeException, NodeNotFoundException {
        if (mode != ViewMode.COMBINED || currentNode == -1) {
            throw new InvalidViewModeException("Editing a group description", ViewMode.COMBINED, mode);
        }
        SuperGroup sg = superGroupOfNode(currentNode)
                .orElseThrow(() -> new NodeNotFoundException("No super group for node " + currentNode));
        editDescription(sg.getId(), description);
    }

    public String toGraphviz() {
        checkOpen();
        return graph.toGraphviz(id -> colorOf(id).orElse(null));
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        resetStates();
        graph = null;
        closed = true;
        Logging.debug("GraphView", "Closed graph view of " + fc.getFunctionName());
    }

    private void checkOpen() {
        if (closed) {
            throw new PreconditionException("Graph view of " + fc.getFunctionName() + " is closed");
        }
    }
}
