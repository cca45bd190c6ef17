package graphslick;

import graphslick.base.flowchart.FlowChart;
import graphslick.base.flowchart.FlowChartProvider;
import graphslick.base.graph.ViewMode;
import graphslick.base.group.GroupDefinitionReader;
import graphslick.base.group.GroupManager;
import graphslick.utils.Logging;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class GraphSlickTest {

    @Mock
    private FlowChartProvider provider;

    @TempDir
    File tempDir;

    @BeforeAll
    public static void initLogging() {
        Logging.init();
    }

    private File copyFixture(String name) throws Exception {
        File target = new File(tempDir, name);
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            FileUtils.copyInputStreamToFile(in, target);
        }
        return target;
    }

    @Test
    public void testParseArgs() {
        GraphSlick app = new GraphSlick();
        assertTrue(app.parseArgs(new String[]{
                "definition=a.json", "flowchart=b.json", "output=out", "mode=flat", "append_node_id=true"}));
        assertEquals(ViewMode.FLAT, app.getOptions().startViewMode);
        assertTrue(app.getOptions().appendNodeId);
        assertFalse(app.getOptions().highlightSyntheticNodes);

        assertFalse(new GraphSlick().parseArgs(new String[]{"definition=a.json", "flowchart=b.json"}));
        assertFalse(new GraphSlick().parseArgs(new String[]{"definition"}));
        assertFalse(new GraphSlick().parseArgs(new String[]{
                "definition=a.json", "flowchart=b.json", "output=out", "mode=tree"}));
        assertFalse(new GraphSlick().parseArgs(new String[]{
                "definition=a.json", "flowchart=b.json", "output=out", "color=red"}));
    }

    @Test
    public void testResolveFlowChart() throws Exception {
        FlowChart fc = TestData.diamond();
        when(provider.getFlowChart(TestData.A)).thenReturn(Optional.of(fc));

        Optional<FlowChart> resolved = GraphSlick.resolveFlowChart(TestData.diamondGroups(), provider);

        assertSame(fc, resolved.orElseThrow());
        verify(provider).getFlowChart(TestData.A);
    }

    @Test
    public void testResolveUnknownFunction() {
        when(provider.getFlowChart(anyLong())).thenReturn(Optional.empty());

        assertTrue(GraphSlick.resolveFlowChart(TestData.diamondGroups(), provider).isEmpty());
    }

    @Test
    public void testResolveEmptyDefinition() {
        assertTrue(GraphSlick.resolveFlowChart(new GroupManager("empty"), provider).isEmpty());
        verify(provider, never()).getFlowChart(anyLong());
    }

    @Test
    public void testRun() throws Exception {
        File definition = copyFixture("stale.bbgroup.json");
        File flowChart = copyFixture("diamond.cfg.json");
        File output = new File(tempDir, "out");

        GraphSlick app = new GraphSlick();
        assertTrue(app.parseArgs(new String[]{
                "definition=" + definition.getPath(),
                "flowchart=" + flowChart.getPath(),
                "output=" + output.getPath()}));
        assertTrue(app.run());

        String flat = FileUtils.readFileToString(new File(output, "flat.dot"), StandardCharsets.UTF_8);
        String combined = FileUtils.readFileToString(new File(output, "combined.dot"), StandardCharsets.UTF_8);
        assertTrue(flat.contains("0x1040 - 0x1048"));
        assertTrue(combined.contains("Inlined memcpy"));

        File sanitized = new File(output, "stale.bbgroup.sanitized.json");
        GroupManager gm = new GroupDefinitionReader().read(sanitized);
        assertEquals(4, gm.getSuperGroups().size());
        assertTrue(gm.findSuperGroup("synth_1040").orElseThrow().isSynthetic());
        assertEquals(5, gm.getNodeDefs().size());
    }

    @Test
    public void testRunFailsOnMalformedDefinition() throws Exception {
        File definition = copyFixture("malformed.bbgroup.json");
        File flowChart = copyFixture("diamond.cfg.json");

        GraphSlick app = new GraphSlick();
        assertTrue(app.parseArgs(new String[]{
                "definition=" + definition.getPath(),
                "flowchart=" + flowChart.getPath(),
                "output=" + new File(tempDir, "out").getPath()}));
        assertFalse(app.run());
    }
}
