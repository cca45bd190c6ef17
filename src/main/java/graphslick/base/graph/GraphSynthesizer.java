package graphslick.base.graph;

import graphslick.base.Range;
import graphslick.base.flowchart.BasicBlock;
import graphslick.base.flowchart.FlowChart;
import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeGroup;
import graphslick.base.group.NodeLocation;
import graphslick.base.group.SuperGroup;
import graphslick.exceptions.EmptyFlowChartException;
import graphslick.exceptions.PreconditionException;
import graphslick.utils.GraphSlickOptions;
import graphslick.utils.Logging;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the flat or combined graph of a function from its flowchart and a
 * sanitized group manager.
 * <p>
 * In flat mode every basic block is a node whose id is the nid of its node
 * definition, and edges are the flowchart's own. In combined mode every node
 * group is a node whose id comes from the group manager, and an edge joins two
 * groups when a block of the first has a successor in the second.
 */
public class GraphSynthesizer {
    private final GraphSlickOptions options;

    public GraphSynthesizer(GraphSlickOptions options) {
        this.options = options;
    }

    public RenderableGraph build(ViewMode mode, FlowChart fc, GroupManager gm) throws EmptyFlowChartException {
        if (fc.isEmpty()) {
            Logging.error("GraphSynthesizer", "Cannot build a graph for empty flowchart " + fc.getFunctionName());
            throw new EmptyFlowChartException(fc.getFunctionName());
        }
        if (!gm.isLookupsInitialized()) {
            Logging.error("GraphSynthesizer", "build() called before lookups of " + gm.getSourceFile() + " were initialized");
            throw new PreconditionException("Group manager lookups must be initialized before building a graph");
        }

        RenderableGraph graph;
        if (mode == ViewMode.FLAT) {
            graph = buildFlat(fc, gm);
        } else {
            graph = buildCombined(fc, gm);
        }
        Logging.debug("GraphSynthesizer", "Built " + graph);
        return graph;
    }

    private RenderableGraph buildFlat(FlowChart fc, GroupManager gm) {
        RenderableGraph graph = new RenderableGraph(ViewMode.FLAT, fc.getFunctionName());
        Map<Integer, Integer> blockToNid = new HashMap<>();
        Map<Range, NodeLocation> locations = indexByRange(gm);

        for (var block : fc.getBlocks()) {
            Optional<NodeLocation> loc = Optional.ofNullable(locations.get(block.getRange()));
            if (loc.isEmpty()) {
                Logging.warn("GraphSynthesizer", "Block " + block.getRange() + " has no node definition");
                continue;
            }
            int nid = loc.get().nodeDef.getNid();
            blockToNid.put(block.getId(), nid);
            if (!graph.containsNode(nid)) {
                graph.putNode(flatNode(nid, block, loc.get().superGroup));
            }
        }

        for (var block : fc.getBlocks()) {
            Integer from = blockToNid.get(block.getId());
            if (from == null) {
                continue;
            }
            for (var succ : fc.getSuccessors(block)) {
                Integer to = blockToNid.get(succ.getId());
                if (to != null) {
                    graph.addEdge(from, to);
                }
            }
        }
        return graph;
    }

    private RenderableGraph buildCombined(FlowChart fc, GroupManager gm) {
        RenderableGraph graph = new RenderableGraph(ViewMode.COMBINED, fc.getFunctionName());
        Map<Integer, Integer> blockToGroupId = new HashMap<>();
        Map<Range, NodeLocation> locations = indexByRange(gm);

        // Ids are handed out in block order the first time a group is met
        for (var block : fc.getBlocks()) {
            Optional<NodeLocation> loc = Optional.ofNullable(locations.get(block.getRange()));
            if (loc.isEmpty()) {
                Logging.warn("GraphSynthesizer", "Block " + block.getRange() + " has no node group");
                continue;
            }
            NodeGroup ng = loc.get().nodeGroup;
            int ngId = gm.getOrAssignNodeGroupId(ng);
            blockToGroupId.put(block.getId(), ngId);
            if (!graph.containsNode(ngId)) {
                graph.putNode(combinedNode(ngId, ng, loc.get().superGroup));
            }
        }

        for (var block : fc.getBlocks()) {
            Integer from = blockToGroupId.get(block.getId());
            if (from == null) {
                continue;
            }
            for (var succ : fc.getSuccessors(block)) {
                Integer to = blockToGroupId.get(succ.getId());
                if (to != null && !to.equals(from)) {
                    graph.addEdge(from, to);
                }
            }
        }
        return graph;
    }

    /**
     * Map each node definition's range to its location. After sanitization every
     * live block has exactly one entry.
     */
    private Map<Range, NodeLocation> indexByRange(GroupManager gm) {
        Map<Range, NodeLocation> result = new HashMap<>();
        for (var nd : gm.getNodeDefs()) {
            gm.findNodeLocation(nd.getNid()).ifPresent(loc -> result.put(nd.getRange(), loc));
        }
        return result;
    }

    private RenderNode flatNode(int nid, BasicBlock block, SuperGroup sg) {
        String text = String.format("0x%x - 0x%x", block.getStart(), block.getEnd());
        if (options.appendNodeId) {
            text += String.format("\n(%d)", nid);
        }
        String hint = String.format("%s (%s)", sg.getDisplayName(), sg.getId());
        return new RenderNode(nid, text, hint);
    }

    /**
     * Build the combined node of a group: super group name, then id and size.
     */
    public RenderNode combinedNode(int ngId, NodeGroup ng, SuperGroup sg) {
        StringBuilder text = new StringBuilder(sg.getDisplayName());
        if (options.enlargeGroupName && !sg.getDisplayName().contains("\n")) {
            text.append("\n");
        }
        text.append(String.format("\n(%s) C(%d)", sg.getId(), ng.size()));
        if (options.appendNodeId) {
            text.append(String.format("\n[%d]", ngId));
        }

        List<String> hintLines = new ArrayList<>();
        if (!sg.getDescription().isEmpty()) {
            hintLines.add(sg.getDescription());
        }
        hintLines.add(ng.describe());
        return new RenderNode(ngId, text.toString(), String.join("\n", hintLines));
    }
}
