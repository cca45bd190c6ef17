package graphslick;

import graphslick.analyzer.SanitizeResult;
import graphslick.analyzer.Sanitizer;
import graphslick.base.flowchart.FlowChart;
import graphslick.base.flowchart.FlowChartProvider;
import graphslick.base.flowchart.JsonFlowChartProvider;
import graphslick.base.graph.ViewMode;
import graphslick.base.group.GroupDefinitionReader;
import graphslick.base.group.GroupDefinitionWriter;
import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeDef;
import graphslick.exceptions.GraphSlickException;
import graphslick.utils.GraphSlickOptions;
import graphslick.utils.JsonHelper;
import graphslick.utils.Logging;
import graphslick.view.GraphView;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Command-line driver: loads a group definition and a flowchart export,
 * sanitizes the groups, and writes both graph projections as DOT files along
 * with the sanitized definition.
 * <pre>
 * graphslick.GraphSlick definition=f1.bbgroup.json flowchart=f1.cfg.json output=out [mode=flat|combined]
 *                       [append_node_id=true] [highlight_synthetic=true]
 * </pre>
 */
public class GraphSlick {
    private String definitionPath;
    private String flowChartPath;
    private String outputDirectory;
    private final GraphSlickOptions options = new GraphSlickOptions();

    public static void main(String[] args) {
        System.out.println("====================== GraphSlick ======================");
        if (!Logging.init()) {
            System.exit(1);
        }
        GraphSlick app = new GraphSlick();
        if (!app.parseArgs(args)) {
            System.exit(1);
        }
        System.exit(app.run() ? 0 : 1);
    }

    /**
     * Parse {@code key=value} arguments.
     * @return false if an argument is invalid or a mandatory one is missing
     */
    public boolean parseArgs(String[] args) {
        for (String arg : args) {
            Logging.info("GraphSlick", "Arg: " + arg);
            String[] argParts = arg.split("=", 2);
            if (argParts.length != 2) {
                Logging.error("GraphSlick", "Invalid argument: " + arg);
                return false;
            }

            String key = argParts[0];
            String value = argParts[1];
            switch (key) {
                case "definition":
                    definitionPath = value;
                    break;
                case "flowchart":
                    flowChartPath = value;
                    break;
                case "output":
                    outputDirectory = value;
                    break;
                case "mode":
                    try {
                        options.startViewMode = ViewMode.fromName(value);
                    } catch (IllegalArgumentException e) {
                        Logging.error("GraphSlick", e.getMessage());
                        return false;
                    }
                    break;
                case "append_node_id":
                    options.appendNodeId = Boolean.parseBoolean(value);
                    break;
                case "highlight_synthetic":
                    options.highlightSyntheticNodes = Boolean.parseBoolean(value);
                    break;
                case "debug":
                    options.debug = Boolean.parseBoolean(value);
                    break;
                default:
                    Logging.error("GraphSlick", "Invalid argument: " + arg);
                    return false;
            }
        }

        if (definitionPath == null || flowChartPath == null || outputDirectory == null) {
            Logging.error("GraphSlick", "Arguments 'definition', 'flowchart' and 'output' are required");
            return false;
        }
        return true;
    }

    public GraphSlickOptions getOptions() {
        return options;
    }

    /**
     * Run the whole pipeline.
     * @return true on success
     */
    public boolean run() {
        long beginTime = System.currentTimeMillis();
        Logging.debug("GraphSlick", "Options: " + options);

        File outputDir = new File(outputDirectory);
        try {
            prepareOutputDirectory(outputDir);
        } catch (IOException e) {
            Logging.error("GraphSlick", "Failed to prepare output directory: " + e.getMessage());
            return false;
        }

        FlowChartProvider provider;
        try {
            provider = JsonFlowChartProvider.fromFile(new File(flowChartPath));
        } catch (IOException e) {
            Logging.error("GraphSlick", "Cannot load flowchart file '" + flowChartPath + "': " + e.getMessage());
            return false;
        }

        try {
            GroupManager gm = new GroupDefinitionReader().read(new File(definitionPath));
            Optional<FlowChart> fc = resolveFlowChart(gm, provider);
            if (fc.isEmpty()) {
                return false;
            }

            SanitizeResult result = new Sanitizer(fc.get()).run(gm);
            for (var action : result.getActions()) {
                Logging.info("GraphSlick", action.toString());
            }
            gm.initializeLookups();

            String baseName = FilenameUtils.getBaseName(definitionPath);
            try (GraphView view = GraphView.open(fc.get(), gm, options)) {
                ViewMode startMode = view.getMode();
                writeGraph(view, new File(outputDir, startMode.name().toLowerCase() + ".dot"));

                ViewMode otherMode = startMode == ViewMode.FLAT ? ViewMode.COMBINED : ViewMode.FLAT;
                view.switchMode(otherMode);
                writeGraph(view, new File(outputDir, otherMode.name().toLowerCase() + ".dot"));
            }

            new GroupDefinitionWriter().write(gm, new File(outputDir, baseName + ".sanitized.json"));
        } catch (GraphSlickException e) {
            Logging.error("GraphSlick", e.getMessage());
            return false;
        } catch (IOException e) {
            Logging.error("GraphSlick", "Failed to write output: " + e.getMessage());
            return false;
        }

        Logging.info("GraphSlick", "Total time: " + (System.currentTimeMillis() - beginTime) / 1000.00 + "s");
        return true;
    }

    /**
     * Find the function the definition describes, through the address of its first node.
     */
    static Optional<FlowChart> resolveFlowChart(GroupManager gm, FlowChartProvider provider) {
        Optional<NodeDef> nd = gm.firstNodeDef();
        if (nd.isEmpty()) {
            Logging.error("GraphSlick", "Invalid input file! No addresses defined");
            return Optional.empty();
        }

        Optional<FlowChart> fc = provider.getFlowChart(nd.get().getStart());
        if (fc.isEmpty()) {
            Logging.error("GraphSlick", "Input file does not relate to a defined function: "
                    + JsonHelper.formatAddress(nd.get().getStart()));
            return Optional.empty();
        }
        Logging.info("GraphSlick", "Function: " + fc.get());
        return fc;
    }

    private void writeGraph(GraphView view, File file) throws IOException {
        FileUtils.writeStringToFile(file, view.toGraphviz(), StandardCharsets.UTF_8);
        Logging.info("GraphSlick", "Wrote " + view.getGraph() + " to " + file);
    }

    protected void prepareOutputDirectory(File outputDir) throws IOException {
        // If the output directory does not exist, create it; otherwise empty it
        if (!outputDir.exists()) {
            FileUtils.forceMkdir(outputDir);
        } else {
            FileUtils.cleanDirectory(outputDir);
        }
    }
}
