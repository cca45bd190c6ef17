package graphslick.view;

import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeDef;
import graphslick.base.group.NodeGroup;
import graphslick.base.group.SuperGroup;
import org.apache.commons.io.FilenameUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A three-level listing of a group manager: the definition file, its super
 * groups, and their node groups. Each line can drive the graph view.
 */
public class GroupOutline {
    private static final String TAB = "    ";

    public enum LineType {
        FILE, SUPER_GROUP, NODE_GROUP
    }

    public static class Line {
        public final LineType type;
        public final SuperGroup superGroup;
        public final NodeGroup nodeGroup;

        Line(LineType type, SuperGroup superGroup, NodeGroup nodeGroup) {
            this.type = type;
            this.superGroup = superGroup;
            this.nodeGroup = nodeGroup;
        }
    }

    private final GroupManager gm;
    private final List<Line> lines = new ArrayList<>();

    public GroupOutline(GroupManager gm) {
        this.gm = gm;
        populate();
    }

    /**
     * Rebuild the lines from the current state of the group manager.
     */
    public void populate() {
        lines.clear();
        lines.add(new Line(LineType.FILE, null, null));
        for (var sg : gm.getSuperGroups()) {
            lines.add(new Line(LineType.SUPER_GROUP, sg, null));
            for (var ng : sg.getGroups()) {
                lines.add(new Line(LineType.NODE_GROUP, sg, ng));
            }
        }
    }

    public List<Line> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }

    /**
     * Text of the first column.
     */
    public String describe(Line line) {
        switch (line.type) {
            case FILE:
                return FilenameUtils.getName(gm.getSourceFile());
            case SUPER_GROUP:
                return String.format("%s%s (%s) C(%d)", TAB,
                        line.superGroup.getDisplayName(), line.superGroup.getId(), line.superGroup.gcount());
            case NODE_GROUP:
                StringBuilder sb = new StringBuilder(TAB + TAB);
                sb.append(String.format("C(%d):(", line.nodeGroup.size()));
                List<String> parts = new ArrayList<>();
                for (NodeDef nd : line.nodeGroup) {
                    parts.add(String.format("%d:0x%x:0x%x", nd.getNid(), nd.getStart(), nd.getEnd()));
                }
                sb.append(String.join(", ", parts)).append(")");
                return sb.toString();
            default:
                return "";
        }
    }

    /**
     * Text of the second column: the address of the first node of a node group.
     */
    public String address(Line line) {
        if (line.type != LineType.NODE_GROUP) {
            return "";
        }
        NodeDef nd = line.nodeGroup.getFirstNodeDef();
        return nd == null ? "" : String.format("0x%x", nd.getStart());
    }

    /**
     * Highlight what a line stands for: every super group for the file line,
     * one color family for a super group, a single color for a node group.
     */
    public void highlight(Line line, GraphView view) {
        view.clearHighlighting();
        switch (line.type) {
            case FILE:
                view.highlightSuperGroups(gm.getSuperGroups());
                break;
            case SUPER_GROUP:
                view.highlight(line.superGroup.getGroups());
                break;
            case NODE_GROUP:
                view.highlight(List.of(line.nodeGroup));
                break;
            default:
                break;
        }
    }

    /**
     * The graph node a line points to, in the view's current mode.
     * @return the node id, or -1 for the file line or an unresolved group
     */
    public int nodeIdOf(Line line, GraphView view) {
        NodeGroup ng;
        if (line.type == LineType.NODE_GROUP) {
            ng = line.nodeGroup;
        } else if (line.type == LineType.SUPER_GROUP) {
            ng = line.superGroup.getFirstGroup();
        } else {
            return -1;
        }
        return ng == null ? -1 : view.nodeIdOf(ng);
    }
}
