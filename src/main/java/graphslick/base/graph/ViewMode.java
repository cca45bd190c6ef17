package graphslick.base.graph;

/**
 * The two projections of a function graph.
 */
public enum ViewMode {
    /** One node per basic block */
    FLAT,
    /** One node per node group */
    COMBINED;

    public static ViewMode fromName(String name) {
        switch (name.trim().toLowerCase()) {
            case "flat":
            case "single":
            case "ungrouped":
                return FLAT;
            case "combined":
            case "grouped":
                return COMBINED;
            default:
                throw new IllegalArgumentException("Unknown view mode: " + name);
        }
    }
}
