package graphslick.view;

import graphslick.TestData;
import graphslick.analyzer.Sanitizer;
import graphslick.base.flowchart.FlowChart;
import graphslick.base.graph.ViewMode;
import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeGroup;
import graphslick.exceptions.InsufficientSelectionException;
import graphslick.exceptions.InvalidViewModeException;
import graphslick.exceptions.NodeNotFoundException;
import graphslick.exceptions.PreconditionException;
import graphslick.utils.GraphSlickOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GraphViewTest {
    private FlowChart fc;
    private GroupManager gm;
    private GraphSlickOptions options;
    private GraphView view;

    @BeforeEach
    public void setUp() throws Exception {
        fc = TestData.diamondWithTail();
        gm = TestData.diamondSingletons();
        new Sanitizer(fc).run(gm);
        gm.initializeLookups();
        options = new GraphSlickOptions();
        view = GraphView.open(fc, gm, options);
    }

    @AfterEach
    public void tearDown() {
        view.close();
    }

    @Test
    public void testOpensInStartMode() throws Exception {
        assertEquals(ViewMode.COMBINED, view.getMode());
        assertEquals(5, view.getGraph().getNodeCount());

        options.startViewMode = ViewMode.FLAT;
        try (GraphView flat = GraphView.open(fc, gm, options)) {
            assertEquals(ViewMode.FLAT, flat.getMode());
            assertEquals(5, flat.getGraph().getEdgeCount());
        }
    }

    @Test
    public void testModeSwitchClearsState() throws Exception {
        view.toggleSelect(0);
        view.toggleSelect(1);
        view.highlight(List.of(gm.findSuperGroup("sgC").orElseThrow().getFirstGroup()));
        view.setCurrentNode(2);

        view.switchMode(ViewMode.FLAT);

        assertEquals(ViewMode.FLAT, view.getMode());
        assertTrue(view.getSelectedNodes().isEmpty());
        assertTrue(view.getHighlightedNodes().isEmpty());
        assertEquals(-1, view.getCurrentNode());
        assertEquals(5, view.getGraph().getNodeCount());
    }

    @Test
    public void testSelectionWinsOverHighlight() throws Exception {
        NodeGroup ngA = gm.findSuperGroup("sgA").orElseThrow().getFirstGroup();
        Color highlight = new Color(0x10, 0x20, 0x30);
        assertTrue(view.highlight(ngA, highlight));
        int id = view.nodeIdOf(ngA);
        assertEquals(highlight, view.colorOf(id).orElseThrow());

        assertTrue(view.toggleSelect(id));
        assertEquals(ColorAssigner.SELECTION_COLOR, view.colorOf(id).orElseThrow());

        assertFalse(view.toggleSelect(id));
        assertEquals(highlight, view.colorOf(id).orElseThrow());

        view.clearHighlighting();
        assertTrue(view.colorOf(id).isEmpty());
    }

    @Test
    public void testSelectionMode() throws Exception {
        view.onNodeClicked(1);
        assertEquals(1, view.getCurrentNode());
        assertTrue(view.getSelectedNodes().isEmpty());

        view.setSelectionMode(true);
        view.onNodeClicked(1);
        view.onNodeClicked(2);
        assertEquals(Set.of(1, 2), view.getSelectedNodes());

        assertThrows(NodeNotFoundException.class, () -> view.toggleSelect(42));
    }

    @Test
    public void testCombineRequiresCombinedMode() throws Exception {
        view.switchMode(ViewMode.FLAT);
        view.toggleSelect(0);
        view.toggleSelect(1);

        assertThrows(InvalidViewModeException.class, () -> view.combineSelected());
        assertEquals(5, gm.getNodeGroupCount());
    }

    @Test
    public void testCombineRequiresTwoNodes() throws Exception {
        view.toggleSelect(0);

        var e = assertThrows(InsufficientSelectionException.class, () -> view.combineSelected());
        assertEquals(1, e.getSelectedCount());
        assertEquals(5, gm.getNodeGroupCount());
        assertEquals(Set.of(0), view.getSelectedNodes());
    }

    @Test
    public void testCombineSelected() throws Exception {
        view.setSelectionMode(true);
        view.onNodeClicked(1);
        view.onNodeClicked(3);

        NodeGroup merged = view.combineSelected();

        assertEquals(2, merged.size());
        assertEquals(4, view.getGraph().getNodeCount());
        assertTrue(view.getSelectedNodes().isEmpty());
        assertTrue(gm.findSuperGroup("sgD").orElseThrow().isEmpty());
        assertEquals("sgB", view.superGroupOfNode(view.nodeIdOf(merged)).orElseThrow().getId());
    }

    @Test
    public void testFindAndHighlight() throws Exception {
        OptionalInt jump = view.findAndHighlight("SGc");

        assertTrue(jump.isPresent());
        assertEquals(view.nodeIdOf(gm.findSuperGroup("sgC").orElseThrow().getFirstGroup()), jump.getAsInt());
        assertEquals(Set.of(jump.getAsInt()), view.getHighlightedNodes());

        assertTrue(view.findAndHighlight("nothing like it").isEmpty());
        assertTrue(view.getHighlightedNodes().isEmpty());
        assertTrue(view.findAndHighlight("  ").isEmpty());
    }

    @Test
    public void testFindMatchesSeveralGroups() {
        OptionalInt jump = view.findAndHighlight("sg");

        // Synthetic group for the tail block does not match "sg"
        assertEquals(4, view.getHighlightedNodes().size());
        assertEquals(view.nodeIdOf(gm.findSuperGroup("sgD").orElseThrow().getFirstGroup()), jump.getAsInt());
    }

    @Test
    public void testHighlightSuperGroupsSkipsSynthetic() throws Exception {
        view.highlightSuperGroups(gm.getSuperGroups());
        assertEquals(4, view.getHighlightedNodes().size());

        options.highlightSyntheticNodes = true;
        view.clearHighlighting();
        view.highlightSuperGroups(gm.getSuperGroups());
        assertEquals(5, view.getHighlightedNodes().size());
    }

    @Test
    public void testEmptySuperGroupTakesNoBatch() throws Exception {
        view.combine(List.of(0, 1));
        assertEquals(1, gm.getSuperGroups().stream().filter(sg -> sg.isEmpty()).count());

        view.clearHighlighting();
        view.highlightSuperGroups(gm.getSuperGroups());

        int sgC = view.nodeIdOf(gm.findSuperGroup("sgC").orElseThrow().getFirstGroup());
        int sgD = view.nodeIdOf(gm.findSuperGroup("sgD").orElseThrow().getFirstGroup());
        assertEquals(ColorAssigner.colorOf(1, 0), view.colorOf(sgC).orElseThrow());
        assertEquals(ColorAssigner.colorOf(2, 0), view.colorOf(sgD).orElseThrow());
    }

    @Test
    public void testFlatHighlightColorsEveryBlock() throws Exception {
        view.switchMode(ViewMode.FLAT);
        NodeGroup ng = gm.findSuperGroup("sgB").orElseThrow().getFirstGroup();

        assertTrue(view.highlight(ng, Color.ORANGE));

        assertEquals(Set.of(1), view.getHighlightedNodes());
        assertEquals(1, view.nodeIdOf(ng));
        assertEquals("sgB", view.superGroupOfNode(1).orElseThrow().getId());
    }

    @Test
    public void testEditDescription() throws Exception {
        NodeGroup ngC = gm.findSuperGroup("sgC").orElseThrow().getFirstGroup();
        int id = view.nodeIdOf(ngC);

        view.editDescription("sgC", "error path");

        assertEquals("error path", gm.findSuperGroup("sgC").orElseThrow().getDescription());
        assertTrue(view.getGraph().getNode(id).getHint().startsWith("error path\n"));
        assertThrows(NodeNotFoundException.class, () -> view.editDescription("missing", "x"));

        view.setCurrentNode(id);
        view.editCurrentDescription("renamed path");
        assertEquals("renamed path", gm.findSuperGroup("sgC").orElseThrow().getDescription());
    }

    @Test
    public void testEditCurrentDescriptionNeedsCombinedNode() throws Exception {
        assertThrows(InvalidViewModeException.class, () -> view.editCurrentDescription("x"));
        view.switchMode(ViewMode.FLAT);
        view.setCurrentNode(0);
        assertThrows(InvalidViewModeException.class, () -> view.editCurrentDescription("x"));
    }

    @Test
    public void testGraphvizCarriesColors() throws Exception {
        view.toggleSelect(0);

        String dot = view.toGraphviz();

        assertTrue(dot.contains("fillcolor=\"#ad757c\""));
    }

    @Test
    public void testClosedViewRejectsCalls() {
        view.close();

        assertTrue(view.isClosed());
        assertThrows(PreconditionException.class, () -> view.getGraph());
        assertThrows(PreconditionException.class, () -> view.switchMode(ViewMode.FLAT));
        // Closing twice is harmless
        view.close();
    }
}
