package graphslick.base.flowchart;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import graphslick.utils.JsonHelper;
import graphslick.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Flowchart provider backed by a JSON export of one or more functions:
 * <pre>
 * {"functions": [{"name": "f", "entry": "0x1000",
 *                 "blocks": [{"id": 0, "start": "0x1000", "end": "0x1008", "succs": [1]}]}]}
 * </pre>
 */
public class JsonFlowChartProvider implements FlowChartProvider {
    private final List<FlowChart> functions;

    public JsonFlowChartProvider(List<FlowChart> functions) {
        this.functions = Collections.unmodifiableList(new ArrayList<>(functions));
    }

    public static JsonFlowChartProvider fromFile(File file) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return fromTree(mapper.readTree(file), file.getName());
    }

    public static JsonFlowChartProvider fromStream(InputStream in, String sourceName) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        return fromTree(mapper.readTree(in), sourceName);
    }

    private static JsonFlowChartProvider fromTree(JsonNode root, String sourceName) throws IOException {
        if (root == null || !root.path("functions").isArray()) {
            throw new IOException("Flowchart file " + sourceName + " has no 'functions' array");
        }

        List<FlowChart> functions = new ArrayList<>();
        try {
            for (JsonNode funcNode : root.get("functions")) {
                String name = JsonHelper.readText(funcNode, "name", "sub_unknown");
                List<BasicBlock> blocks = new ArrayList<>();
                int index = 0;
                for (JsonNode blockNode : funcNode.path("blocks")) {
                    int id = blockNode.has("id") ? blockNode.get("id").asInt() : index;
                    long start = JsonHelper.readAddress(blockNode, "start");
                    long end = JsonHelper.readAddress(blockNode, "end");
                    List<Integer> succs = new ArrayList<>();
                    for (JsonNode succ : blockNode.path("succs")) {
                        succs.add(succ.asInt());
                    }
                    blocks.add(new BasicBlock(id, start, end, succs));
                    index++;
                }
                long entry = funcNode.has("entry")
                        ? JsonHelper.readAddress(funcNode, "entry")
                        : (blocks.isEmpty() ? 0 : blocks.get(0).getStart());
                functions.add(new FlowChart(name, entry, blocks));
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed flowchart file " + sourceName + ": " + e.getMessage(), e);
        }

        Logging.debug("JsonFlowChartProvider", String.format("Loaded %d functions from %s", functions.size(), sourceName));
        return new JsonFlowChartProvider(functions);
    }

    public List<FlowChart> getFunctions() {
        return functions;
    }

    @Override
    public Optional<FlowChart> getFlowChart(long address) {
        for (var func : functions) {
            if (func.getEntryAddress() == address || func.findBlockContaining(address).isPresent()) {
                return Optional.of(func);
            }
        }
        Logging.warn("JsonFlowChartProvider", "No function contains address " + JsonHelper.formatAddress(address));
        return Optional.empty();
    }
}
