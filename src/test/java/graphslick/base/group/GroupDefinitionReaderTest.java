package graphslick.base.group;

import graphslick.exceptions.DefinitionParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class GroupDefinitionReaderTest {
    private final GroupDefinitionReader reader = new GroupDefinitionReader();

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    private static InputStream fixture(String name) {
        return GroupDefinitionReaderTest.class.getResourceAsStream("/fixtures/" + name);
    }

    @Test
    public void testReadFixture() throws Exception {
        GroupManager gm = reader.read(fixture("diamond.bbgroup.json"), "diamond.bbgroup.json");

        assertEquals("diamond.bbgroup.json", gm.getSourceFile());
        assertEquals(1, gm.getSuperGroups().size());
        SuperGroup sg = gm.getSuperGroups().get(0);
        assertEquals("path1", sg.getId());
        assertEquals("Path 1", sg.getName());
        assertEquals("left and right halves of the diamond", sg.getDescription());
        assertFalse(sg.isSynthetic());
        assertEquals(2, sg.gcount());
        assertEquals(0x1030, sg.getGroups().get(1).getNodeDefs().get(1).getStart());
        assertEquals(0x1040, sg.getGroups().get(1).getNodeDefs().get(1).getEnd());
        assertFalse(gm.isSanitized());
    }

    @Test
    public void testMissingNidsAreNumberedInOrder() throws Exception {
        GroupManager gm = reader.read(fixture("diamond.bbgroup.json"), "diamond");

        var nodeDefs = gm.getNodeDefs();
        for (int i = 0; i < nodeDefs.size(); i++) {
            assertEquals(i, nodeDefs.get(i).getNid());
        }
    }

    @Test
    public void testAddressForms() throws Exception {
        GroupManager gm = reader.read(json("{\"supergroups\": [{\"id\": \"a\", \"groups\": ["
                + "{\"nodes\": [{\"start\": 4096, \"end\": \"4112\"}, {\"start\": \"0X1010\", \"end\": \"0x1020\"}]}]}]}"),
                "forms");

        NodeGroup ng = gm.getSuperGroups().get(0).getFirstGroup();
        assertEquals(0x1000, ng.getNodeDefs().get(0).getStart());
        assertEquals(0x1010, ng.getNodeDefs().get(0).getEnd());
        assertEquals(0x1010, ng.getNodeDefs().get(1).getStart());
        // Missing name falls back to the id
        assertEquals("a", gm.getSuperGroups().get(0).getDisplayName());
    }

    @Test
    public void testMalformedJson() {
        assertThrows(DefinitionParseException.class,
                () -> reader.read(fixture("malformed.bbgroup.json"), "malformed.bbgroup.json"));
    }

    @Test
    public void testStructuralErrors() {
        assertThrows(DefinitionParseException.class, () -> reader.read(json("[]"), "array"));
        assertThrows(DefinitionParseException.class, () -> reader.read(json("{\"groups\": []}"), "no supergroups"));
        assertThrows(DefinitionParseException.class,
                () -> reader.read(json("{\"supergroups\": [{\"name\": \"x\"}]}"), "no id"));
        assertThrows(DefinitionParseException.class,
                () -> reader.read(json("{\"supergroups\": [{\"id\": \"a\"}, {\"id\": \"a\"}]}"), "duplicate id"));
    }

    @Test
    public void testBadNodes() {
        assertThrows(DefinitionParseException.class, () -> reader.read(json(
                "{\"supergroups\": [{\"id\": \"a\", \"groups\": [{\"nodes\": [{\"start\": \"0xZZ\", \"end\": \"0x10\"}]}]}]}"),
                "bad address"));
        assertThrows(DefinitionParseException.class, () -> reader.read(json(
                "{\"supergroups\": [{\"id\": \"a\", \"groups\": [{\"nodes\": [{\"start\": \"0x10\"}]}]}]}"),
                "missing end"));
        var e = assertThrows(DefinitionParseException.class, () -> reader.read(json(
                "{\"supergroups\": [{\"id\": \"a\", \"groups\": [{\"nodes\": [{\"start\": \"0x20\", \"end\": \"0x10\"}]}]}]}"),
                "reversed"));
        assertTrue(e.getMessage().contains("'a'"));
    }

    @Test
    public void testNonNumericNid() {
        var e = assertThrows(DefinitionParseException.class, () -> reader.read(json(
                "{\"supergroups\": [{\"id\": \"a\", \"groups\": [{\"nodes\": "
                        + "[{\"nid\": \"seven\", \"start\": \"0x10\", \"end\": \"0x20\"}]}]}]}"),
                "text nid"));
        assertTrue(e.getMessage().contains("seven"));
        assertThrows(DefinitionParseException.class, () -> reader.read(json(
                "{\"supergroups\": [{\"id\": \"a\", \"groups\": [{\"nodes\": "
                        + "[{\"nid\": 1.5, \"start\": \"0x10\", \"end\": \"0x20\"}]}]}]}"),
                "fractional nid"));
    }

    @Test
    public void testHighHalfAddresses() throws Exception {
        GroupManager gm = reader.read(json("{\"supergroups\": [{\"id\": \"k\", \"groups\": [{\"nodes\": "
                + "[{\"start\": \"0x7fffffffffffff00\", \"end\": \"0x8000000000000010\"}]}]}]}"),
                "kernel");

        NodeDef nd = gm.getSuperGroups().get(0).getFirstGroup().getNodeDefs().get(0);
        assertEquals(0x7fffffffffffff00L, nd.getStart());
        assertEquals(0x8000000000000010L, nd.getEnd());
        assertEquals(0x110, nd.getRange().getSize());
    }

    @Test
    public void testWriterKeepsMetadata() throws Exception {
        GroupManager gm = new GroupManager("saved");
        SuperGroup sg = new SuperGroup("synth_1040", "Synthetic 0x1040", "tail \"block\"", true);
        NodeGroup ng = new NodeGroup();
        ng.add(new NodeDef(4, 0x1040, 0x1048));
        sg.addGroup(ng);
        gm.addSuperGroup(sg);
        gm.addSuperGroup(new SuperGroup("empty", "", "", false));

        String text = new GroupDefinitionWriter().writeAsString(gm);
        GroupManager reloaded = reader.read(json(text), "saved");

        SuperGroup copy = reloaded.findSuperGroup("synth_1040").orElseThrow();
        assertTrue(copy.isSynthetic());
        assertEquals("Synthetic 0x1040", copy.getName());
        assertEquals("tail \"block\"", copy.getDescription());
        assertEquals(new NodeDef(4, 0x1040, 0x1048), copy.getFirstGroup().getFirstNodeDef());
        assertTrue(reloaded.findSuperGroup("empty").orElseThrow().isEmpty());
        assertTrue(text.contains("\"0x1040\""));
    }
}
