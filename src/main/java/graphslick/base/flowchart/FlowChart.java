package graphslick.base.flowchart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered basic blocks of a single function.
 */
public class FlowChart {
    private final String functionName;
    private final long entryAddress;
    private final List<BasicBlock> blocks;
    private final Map<Integer, BasicBlock> idToBlock = new HashMap<>();
    private final Map<Long, BasicBlock> startToBlock = new HashMap<>();

    public FlowChart(String functionName, long entryAddress, List<BasicBlock> blocks) {
        this.functionName = functionName;
        this.entryAddress = entryAddress;
        this.blocks = Collections.unmodifiableList(new ArrayList<>(blocks));
        for (var block : this.blocks) {
            if (idToBlock.put(block.getId(), block) != null) {
                throw new IllegalArgumentException("Duplicate block id " + block.getId() + " in " + functionName);
            }
            startToBlock.put(block.getStart(), block);
        }
    }

    public String getFunctionName() {
        return functionName;
    }

    public long getEntryAddress() {
        return entryAddress;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public int size() {
        return blocks.size();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public BasicBlock getBlock(int id) {
        return idToBlock.get(id);
    }

    public BasicBlock getBlockAt(long start) {
        return startToBlock.get(start);
    }

    /**
     * Resolve the successors of a block. Successor ids that do not name a block
     * of this flowchart are skipped.
     */
    public List<BasicBlock> getSuccessors(BasicBlock block) {
        List<BasicBlock> result = new ArrayList<>();
        for (int succId : block.getSuccs()) {
            var succ = idToBlock.get(succId);
            if (succ != null) {
                result.add(succ);
            }
        }
        return result;
    }

    public Optional<BasicBlock> findBlockContaining(long address) {
        for (var block : blocks) {
            if (block.getRange().contains(address)) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return String.format("FlowChart{%s@0x%x, %d blocks}", functionName, entryAddress, blocks.size());
    }
}
