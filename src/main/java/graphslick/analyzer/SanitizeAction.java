package graphslick.analyzer;

import graphslick.base.Range;

import java.util.Collections;
import java.util.List;

/**
 * One repair the sanitizer made to a group definition.
 */
public class SanitizeAction {
    public enum Kind {
        /** A node definition overlapped several live blocks and was split into one per block */
        SPLIT,
        /** A node definition overlapped exactly one live block and was resized to it */
        ADJUSTED,
        /** A node definition or node group no longer matched anything and was removed */
        DROPPED,
        /** A live block missing from the definition was wrapped in a synthetic super group */
        SYNTHESIZED
    }

    private final Kind kind;
    private final String superGroupId;
    private final Range original;
    private final List<Range> result;
    private final String reason;

    public SanitizeAction(Kind kind, String superGroupId, Range original, List<Range> result, String reason) {
        this.kind = kind;
        this.superGroupId = superGroupId;
        this.original = original;
        this.result = Collections.unmodifiableList(result);
        this.reason = reason;
    }

    public Kind getKind() {
        return kind;
    }

    public String getSuperGroupId() {
        return superGroupId;
    }

    /** The range found in the definition, null for synthesized groups */
    public Range getOriginal() {
        return original;
    }

    /** The live block ranges that replaced the original */
    public List<Range> getResult() {
        return result;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format("%s [%s] %s -> %s%s", kind, superGroupId,
                original == null ? "-" : original, result,
                reason == null || reason.isEmpty() ? "" : " (" + reason + ")");
    }
}
