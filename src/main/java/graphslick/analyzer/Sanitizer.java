package graphslick.analyzer;

import graphslick.base.Range;
import graphslick.base.flowchart.BasicBlock;
import graphslick.base.flowchart.FlowChart;
import graphslick.base.group.GroupManager;
import graphslick.base.group.NodeDef;
import graphslick.base.group.NodeGroup;
import graphslick.base.group.SuperGroup;
import graphslick.exceptions.EmptyFlowChartException;
import graphslick.utils.Logging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles a loaded group definition with the live flowchart of its function.
 * <p>
 * The definition may have been written against an older analysis of the
 * function: blocks may have moved, been split or merged, or be missing from the
 * definition altogether. After {@link #run} every live block is referenced by
 * exactly one node definition, and node ids are numbered by ascending address.
 * Running it again on the same flowchart changes nothing.
 */
public class Sanitizer {
    public static final String SYNTHETIC_ID_PREFIX = "synth_";

    private final FlowChart flowChart;

    /** Live blocks ordered by address */
    private final List<BasicBlock> liveBlocks;
    private final Map<Range, BasicBlock> rangeToBlock = new HashMap<>();

    /** Live blocks sharing the range of an earlier block; they never get a node of their own */
    private final Set<BasicBlock> aliases = new HashSet<>();

    /** Live blocks already referenced by a node definition */
    private final Set<BasicBlock> claimed = new HashSet<>();

    /** Node definitions that own the block matching their range exactly */
    private final Set<NodeDef> exactClaims = Collections.newSetFromMap(new IdentityHashMap<>());

    private final List<SanitizeAction> actions = new ArrayList<>();

    /** A super group being rebuilt: its header and the block ranges of each node group */
    private static class PendingSuperGroup {
        final SuperGroup header;
        final List<List<Range>> groups = new ArrayList<>();

        PendingSuperGroup(SuperGroup header) {
            this.header = header;
        }
    }

    public Sanitizer(FlowChart flowChart) {
        this.flowChart = flowChart;
        this.liveBlocks = new ArrayList<>(flowChart.getBlocks());
        this.liveBlocks.sort(Comparator.comparing(BasicBlock::getRange));
        for (var block : liveBlocks) {
            if (rangeToBlock.putIfAbsent(block.getRange(), block) != null) {
                Logging.warn("Sanitizer", "Flowchart has two blocks at " + block.getRange());
                aliases.add(block);
            }
        }
    }

    /**
     * Sanitize the group manager against the flowchart.
     * The manager is only modified once every repair has been worked out.
     * @param gm the group manager, freshly parsed or already sanitized
     * @return the repairs made, empty if the manager already matched
     * @throws EmptyFlowChartException if the flowchart has no blocks
     */
    public SanitizeResult run(GroupManager gm) throws EmptyFlowChartException {
        if (flowChart.isEmpty()) {
            Logging.error("Sanitizer", "Cannot sanitize against an empty flowchart: " + flowChart.getFunctionName());
            throw new EmptyFlowChartException(flowChart.getFunctionName());
        }
        claimed.clear();
        claimed.addAll(aliases);
        exactClaims.clear();
        actions.clear();

        claimExactMatches(gm);

        List<PendingSuperGroup> pending = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (var sg : gm.getSuperGroups()) {
            pending.add(resolveSuperGroup(sg));
            usedIds.add(sg.getId());
        }

        synthesizeUncovered(pending, usedIds);

        List<SuperGroup> sanitized = renumber(pending);
        gm.applySanitized(sanitized);

        Logging.info("Sanitizer", String.format("Sanitized %s against %s: %d actions",
                gm.getSourceFile(), flowChart.getFunctionName(), actions.size()));
        return new SanitizeResult(new ArrayList<>(actions));
    }

    private PendingSuperGroup resolveSuperGroup(SuperGroup sg) {
        PendingSuperGroup result = new PendingSuperGroup(sg.copyHeader());
        for (var ng : sg.getGroups()) {
            List<Range> ranges = new ArrayList<>();
            for (var nd : ng) {
                ranges.addAll(resolveNodeDef(sg.getId(), nd));
            }

            if (ranges.isEmpty()) {
                if (ng.isEmpty()) {
                    actions.add(new SanitizeAction(SanitizeAction.Kind.DROPPED, sg.getId(), null,
                            List.of(), "empty node group"));
                }
                Logging.debug("Sanitizer", "Dropping empty node group in super group " + sg.getId());
                continue;
            }
            result.groups.add(ranges);
        }
        return result;
    }

    /**
     * Give every live block to the first node definition, in model order, whose
     * range matches it exactly. Overlaps are only resolved against what is left.
     */
    private void claimExactMatches(GroupManager gm) {
        for (var sg : gm.getSuperGroups()) {
            for (var ng : sg.getGroups()) {
                for (var nd : ng) {
                    BasicBlock exact = rangeToBlock.get(nd.getRange());
                    if (exact != null && claimed.add(exact)) {
                        exactClaims.add(nd);
                    }
                }
            }
        }
    }

    /**
     * Map one node definition to the live block ranges it now stands for.
     */
    private List<Range> resolveNodeDef(String sgId, NodeDef nd) {
        Range range = nd.getRange();

        if (exactClaims.contains(nd)) {
            return List.of(range);
        }
        if (rangeToBlock.containsKey(range)) {
            actions.add(new SanitizeAction(SanitizeAction.Kind.DROPPED, sgId, range, List.of(),
                    "duplicate of an already grouped block"));
            Logging.warn("Sanitizer", String.format("Duplicate node %s in super group %s", range, sgId));
            return List.of();
        }

        List<Range> overlapping = new ArrayList<>();
        for (var block : liveBlocks) {
            if (block.getRange().overlaps(range) && !claimed.contains(block)) {
                overlapping.add(block.getRange());
                claimed.add(block);
            }
        }

        if (overlapping.isEmpty()) {
            actions.add(new SanitizeAction(SanitizeAction.Kind.DROPPED, sgId, range, List.of(),
                    "no live block overlaps this range"));
            Logging.warn("Sanitizer", String.format("Stale node %s in super group %s", range, sgId));
        } else if (overlapping.size() == 1) {
            actions.add(new SanitizeAction(SanitizeAction.Kind.ADJUSTED, sgId, range, overlapping, ""));
            Logging.debug("Sanitizer", String.format("Adjusted node %s to %s", range, overlapping.get(0)));
        } else {
            actions.add(new SanitizeAction(SanitizeAction.Kind.SPLIT, sgId, range, overlapping, ""));
            Logging.debug("Sanitizer", String.format("Split node %s into %d blocks", range, overlapping.size()));
        }
        return overlapping;
    }

    private void synthesizeUncovered(List<PendingSuperGroup> pending, Set<String> usedIds) {
        for (var block : liveBlocks) {
            if (claimed.contains(block)) {
                continue;
            }
            claimed.add(block);

            String baseId = String.format("%s%x", SYNTHETIC_ID_PREFIX, block.getStart());
            String id = baseId;
            for (int suffix = 1; usedIds.contains(id); suffix++) {
                id = baseId + "_" + suffix;
            }
            usedIds.add(id);

            SuperGroup header = new SuperGroup(id, String.format("Synthetic 0x%x", block.getStart()),
                    "", true);
            PendingSuperGroup synth = new PendingSuperGroup(header);
            synth.groups.add(List.of(block.getRange()));
            pending.add(synth);

            actions.add(new SanitizeAction(SanitizeAction.Kind.SYNTHESIZED, id, null,
                    List.of(block.getRange()), "block missing from the definition"));
            Logging.debug("Sanitizer", "Synthesized super group " + id + " for block " + block.getRange());
        }
    }

    /**
     * Number all node definitions by ascending address and build the final hierarchy.
     */
    private List<SuperGroup> renumber(List<PendingSuperGroup> pending) {
        List<Range> allRanges = new ArrayList<>();
        for (var p : pending) {
            for (var ranges : p.groups) {
                allRanges.addAll(ranges);
            }
        }
        allRanges.sort(Comparator.naturalOrder());

        Map<Range, Integer> rangeToNid = new HashMap<>();
        for (int i = 0; i < allRanges.size(); i++) {
            rangeToNid.put(allRanges.get(i), i);
        }

        List<SuperGroup> result = new ArrayList<>();
        for (var p : pending) {
            for (var ranges : p.groups) {
                NodeGroup ng = new NodeGroup();
                for (var range : ranges) {
                    ng.add(new NodeDef(rangeToNid.get(range), range));
                }
                p.header.addGroup(ng);
            }
            result.add(p.header);
        }
        return result;
    }
}
