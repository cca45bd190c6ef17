package graphslick.base.group;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named collection of node groups, typically one path through the function.
 */
public class SuperGroup {
    public static final String DUMMY_NAME = "No name";

    private final String id;
    private String name;
    private String description;
    private final boolean synthetic;
    private final List<NodeGroup> groups = new ArrayList<>();

    public SuperGroup(String id, String name, String description, boolean synthetic) {
        this.id = id;
        this.name = name == null ? "" : name;
        this.description = description == null ? "" : description;
        this.synthetic = synthetic;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name == null ? "" : name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    /** True if the group was made up by the sanitizer to cover a block the definition missed */
    public boolean isSynthetic() {
        return synthetic;
    }

    /**
     * The name to show for this group: its name, else its id, else {@link #DUMMY_NAME}.
     */
    public String getDisplayName() {
        if (!name.isEmpty()) {
            return name;
        }
        if (id != null && !id.isEmpty()) {
            return id;
        }
        return DUMMY_NAME;
    }

    public List<NodeGroup> getGroups() {
        return Collections.unmodifiableList(groups);
    }

    /** Number of node groups */
    public int gcount() {
        return groups.size();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    public NodeGroup getFirstGroup() {
        return groups.isEmpty() ? null : groups.get(0);
    }

    public void addGroup(NodeGroup ng) {
        groups.add(ng);
    }

    void insertGroup(int index, NodeGroup ng) {
        groups.add(index, ng);
    }

    boolean removeGroup(NodeGroup ng) {
        return groups.removeIf(g -> g == ng);
    }

    public int indexOf(NodeGroup ng) {
        for (int i = 0; i < groups.size(); i++) {
            if (groups.get(i) == ng) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Copy the metadata of this group without its node groups.
     */
    public SuperGroup copyHeader() {
        return new SuperGroup(id, name, description, synthetic);
    }

    @Override
    public String toString() {
        return String.format("SuperGroup{%s (%s) C(%d)%s}", getDisplayName(), id, groups.size(),
                synthetic ? " synthetic" : "");
    }
}
