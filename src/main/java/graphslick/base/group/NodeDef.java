package graphslick.base.group;

import graphslick.base.Range;

import java.util.Objects;

/**
 * Leaf of the group model: a reference to one basic block by address range.
 * Before sanitization the range may no longer match a live block.
 */
public class NodeDef {
    private final int nid;
    private final Range range;

    public NodeDef(int nid, long start, long end) {
        this(nid, new Range(start, end));
    }

    public NodeDef(int nid, Range range) {
        this.nid = nid;
        this.range = range;
    }

    public int getNid() {
        return nid;
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

    @Override
    public int hashCode() {
        return Objects.hash(nid, range);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NodeDef other = (NodeDef) o;
        return nid == other.nid && range.equals(other.range);
    }

    @Override
    public String toString() {
        return String.format("%d:0x%x:0x%x", nid, getStart(), getEnd());
    }
}
