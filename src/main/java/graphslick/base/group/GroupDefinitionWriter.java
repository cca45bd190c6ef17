package graphslick.base.group;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import graphslick.utils.JsonHelper;
import graphslick.utils.Logging;

import java.io.File;
import java.io.IOException;

/**
 * Saves a group manager in the format read by {@link GroupDefinitionReader}.
 * Synthetic super groups keep their tag so a later load recognizes them.
 */
public class GroupDefinitionWriter {
    private final ObjectMapper mapper;

    public GroupDefinitionWriter() {
        mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public ObjectNode toJson(GroupManager gm) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode sgArray = root.putArray("supergroups");
        for (var sg : gm.getSuperGroups()) {
            ObjectNode sgNode = sgArray.addObject();
            sgNode.put("id", sg.getId());
            sgNode.put("name", sg.getName());
            sgNode.put("description", sg.getDescription());
            sgNode.put("synthetic", sg.isSynthetic());
            ArrayNode groups = sgNode.putArray("groups");
            for (var ng : sg.getGroups()) {
                ArrayNode nodes = groups.addObject().putArray("nodes");
                for (var nd : ng) {
                    ObjectNode ndNode = nodes.addObject();
                    ndNode.put("nid", nd.getNid());
                    ndNode.put("start", JsonHelper.formatAddress(nd.getStart()));
                    ndNode.put("end", JsonHelper.formatAddress(nd.getEnd()));
                }
            }
        }
        return root;
    }

    public String writeAsString(GroupManager gm) throws IOException {
        return mapper.writeValueAsString(toJson(gm));
    }

    public void write(GroupManager gm, File file) throws IOException {
        mapper.writeValue(file, toJson(gm));
        Logging.info("GroupDefinitionWriter", "Saved group definition to " + file);
    }
}
