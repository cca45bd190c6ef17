package graphslick.base.graph;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.awt.Color;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * A directed graph ready to be handed to a renderer.
 * Nodes and edges keep their insertion order so layouts are reproducible.
 */
public class RenderableGraph {

    public static class RenderEdge extends DefaultEdge {
        public int getFrom() {
            return (Integer) getSource();
        }

        public int getTo() {
            return (Integer) getTarget();
        }

        @Override
        public String toString() {
            return String.format("%s ---> %s", getSource(), getTarget());
        }
    }

    private final ViewMode mode;
    private final String title;
    private final Graph<Integer, RenderEdge> graph;
    private final Map<Integer, RenderNode> nodes = new LinkedHashMap<>();

    public RenderableGraph(ViewMode mode, String title) {
        this.mode = mode;
        this.title = title;
        this.graph = new DefaultDirectedGraph<>(RenderEdge.class);
    }

    public ViewMode getMode() {
        return mode;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Add a node, or replace the text of an existing node with the same id.
     */
    public void putNode(RenderNode node) {
        graph.addVertex(node.getId());
        nodes.put(node.getId(), node);
    }

    public boolean containsNode(int id) {
        return nodes.containsKey(id);
    }

    /**
     * @return the node, or null if the graph has no node with this id
     */
    public RenderNode getNode(int id) {
        return nodes.get(id);
    }

    public List<RenderNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    /**
     * Add an edge between two existing nodes. Parallel edges are collapsed.
     * @return true if the edge is new
     */
    public boolean addEdge(int from, int to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            throw new IllegalArgumentException(String.format("Edge %d -> %d references a missing node", from, to));
        }
        if (graph.containsEdge(from, to)) {
            return false;
        }
        return graph.addEdge(from, to) != null;
    }

    public boolean hasEdge(int from, int to) {
        return graph.containsEdge(from, to);
    }

    public List<RenderEdge> getEdges() {
        return new ArrayList<>(graph.edgeSet());
    }

    public List<Integer> getSuccessors(int id) {
        return Graphs.successorListOf(graph, id);
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return graph.edgeSet().size();
    }

    public Graph<Integer, RenderEdge> getGraph() {
        return graph;
    }

    public String toGraphviz() {
        return toGraphviz(id -> null);
    }

    /**
     * Write the graph in DOT format.
     * @param colors background color of each node, null for none
     */
    public String toGraphviz(IntFunction<Color> colors) {
        StringBuilder builder = new StringBuilder();
        builder.append("digraph \"").append(escape(title)).append("\" {\n");
        builder.append("  node [shape=box];\n");
        for (var node : nodes.values()) {
            builder.append("  ").append(node.getId())
                    .append(" [label=\"").append(escape(node.getText()))
                    .append("\", tooltip=\"").append(escape(node.getHint())).append("\"");
            Color color = colors.apply(node.getId());
            if (color != null) {
                builder.append(String.format(", style=filled, fillcolor=\"#%06x\"", color.getRGB() & 0xFFFFFF));
            }
            builder.append("];\n");
        }
        for (var edge : graph.edgeSet()) {
            builder.append("  ").append(edge.getFrom()).append(" -> ").append(edge.getTo()).append(";\n");
        }
        builder.append("}\n");
        return builder.toString();
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public String toString() {
        return String.format("RenderableGraph{%s, %s, %d nodes, %d edges}", title, mode, getNodeCount(), getEdgeCount());
    }
}
