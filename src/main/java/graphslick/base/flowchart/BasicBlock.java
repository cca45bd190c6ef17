package graphslick.base.flowchart;

import graphslick.base.Range;

import java.util.Collections;
import java.util.List;

/**
 * One basic block of a function flowchart, as handed over by the host.
 */
public class BasicBlock {
    private final int id;
    private final Range range;
    private final List<Integer> succs;

    public BasicBlock(int id, long start, long end, List<Integer> succs) {
        this.id = id;
        this.range = new Range(start, end);
        this.succs = Collections.unmodifiableList(succs);
    }

    /** Index of the block inside its flowchart */
    public int getId() {
        return id;
    }

    public Range getRange() {
        return range;
    }

    public long getStart() {
        return range.getStart();
    }

    public long getEnd() {
        return range.getEnd();
    }

    /** Ids of the successor blocks, in the order the host reports them */
    public List<Integer> getSuccs() {
        return succs;
    }

    @Override
    public String toString() {
        return "BasicBlock{" + id + ":" + range + " -> " + succs + "}";
    }
}
