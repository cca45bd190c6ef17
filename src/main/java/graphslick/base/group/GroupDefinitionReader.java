package graphslick.base.group;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphslick.exceptions.DefinitionParseException;
import graphslick.utils.JsonHelper;
import graphslick.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Builds the raw group hierarchy from a bbgroup JSON definition:
 * <pre>
 * {"supergroups": [
 *   {"id": "path1", "name": "...", "description": "...", "synthetic": false,
 *    "groups": [{"nodes": [{"nid": 0, "start": "0x401000", "end": "0x401010"}]}]}
 * ]}
 * </pre>
 * The flowchart is not consulted and no lookup is built.
 */
public class GroupDefinitionReader {
    private final ObjectMapper mapper = new ObjectMapper();

    public GroupManager read(File file) throws DefinitionParseException {
        JsonNode root;
        try {
            root = mapper.readTree(file);
        } catch (JsonProcessingException e) {
            throw new DefinitionParseException("Malformed group file '" + file + "': " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DefinitionParseException("Cannot read group file '" + file + "'", e);
        }
        return parse(root, file.getPath());
    }

    public GroupManager read(InputStream in, String sourceName) throws DefinitionParseException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new DefinitionParseException("Malformed group file '" + sourceName + "': " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DefinitionParseException("Cannot read group file '" + sourceName + "'", e);
        }
        return parse(root, sourceName);
    }

    /**
     * Build a group manager from an already parsed JSON tree.
     */
    public GroupManager parse(JsonNode root, String sourceName) throws DefinitionParseException {
        if (root == null || !root.isObject()) {
            throw new DefinitionParseException("Group file '" + sourceName + "' is empty or not a JSON object");
        }
        JsonNode sgArray = root.get("supergroups");
        if (sgArray == null || !sgArray.isArray()) {
            throw new DefinitionParseException("Group file '" + sourceName + "' has no 'supergroups' array");
        }

        GroupManager gm = new GroupManager(sourceName);
        int nextNid = 0;
        int sgIndex = 0;
        for (JsonNode sgNode : sgArray) {
            String id = JsonHelper.readText(sgNode, "id", "");
            if (id.isEmpty()) {
                throw new DefinitionParseException(String.format("Super group #%d in '%s' has no id", sgIndex, sourceName));
            }
            SuperGroup sg = new SuperGroup(
                    id,
                    JsonHelper.readText(sgNode, "name", ""),
                    JsonHelper.readText(sgNode, "description", ""),
                    sgNode.path("synthetic").asBoolean(false));

            for (JsonNode ngNode : sgNode.path("groups")) {
                NodeGroup ng = new NodeGroup();
                for (JsonNode ndNode : ngNode.path("nodes")) {
                    long start;
                    long end;
                    try {
                        start = JsonHelper.readAddress(ndNode, "start");
                        end = JsonHelper.readAddress(ndNode, "end");
                    } catch (IllegalArgumentException e) {
                        throw new DefinitionParseException("Super group '" + id + "': " + e.getMessage(), e);
                    }
                    if (Long.compareUnsigned(end, start) < 0) {
                        throw new DefinitionParseException(String.format(
                                "Super group '%s': node end 0x%x is before start 0x%x", id, end, start));
                    }
                    int nid = nextNid;
                    JsonNode nidNode = ndNode.get("nid");
                    if (nidNode != null && !nidNode.isNull()) {
                        if (!nidNode.isIntegralNumber() || !nidNode.canConvertToInt()) {
                            throw new DefinitionParseException(String.format(
                                    "Super group '%s': invalid nid %s", id, nidNode));
                        }
                        nid = nidNode.intValue();
                    }
                    nextNid = Math.max(nextNid, nid) + 1;
                    ng.add(new NodeDef(nid, start, end));
                }
                sg.addGroup(ng);
            }

            try {
                gm.addSuperGroup(sg);
            } catch (IllegalArgumentException e) {
                throw new DefinitionParseException("Group file '" + sourceName + "': " + e.getMessage(), e);
            }
            sgIndex++;
        }

        Logging.info("GroupDefinitionReader", String.format("Parsed %d super groups from %s",
                gm.getSuperGroups().size(), sourceName));
        return gm;
    }
}
