package graphslick.base;

import java.util.Objects;

/**
 * A half-open address range {@code [start, end)}. Addresses are unsigned 64-bit values.
 */
public class Range implements Comparable<Range> {
    private final long start;
    private final long end;

    public Range(long start, long end) {
        if (Long.compareUnsigned(end, start) < 0) {
            throw new IllegalArgumentException(String.format("Invalid range [0x%x, 0x%x)", start, end));
        }
        this.start = start;
        this.end = end;
    }

    public long getStart() {
        return start;
    }

    public long getEnd() {
        return end;
    }

    public long getSize() {
        return end - start;
    }

    public boolean contains(long address) {
        return Long.compareUnsigned(address, start) >= 0 && Long.compareUnsigned(address, end) < 0;
    }

    /**
     * Two ranges overlap if they share at least one address.
     * An empty range overlaps a range that contains its start.
     */
    public boolean overlaps(Range other) {
        if (getSize() == 0) {
            return other.contains(start);
        }
        if (other.getSize() == 0) {
            return contains(other.start);
        }
        return Long.compareUnsigned(start, other.end) < 0 && Long.compareUnsigned(other.start, end) < 0;
    }

    @Override
    public int compareTo(Range o) {
        int cmp = Long.compareUnsigned(start, o.start);
        return cmp != 0 ? cmp : Long.compareUnsigned(end, o.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Range range = (Range) o;
        return start == range.start && end == range.end;
    }

    @Override
    public String toString() {
        return String.format("[0x%x, 0x%x)", start, end);
    }
}
