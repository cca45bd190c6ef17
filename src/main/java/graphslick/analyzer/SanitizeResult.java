package graphslick.analyzer;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * What the sanitizer changed while reconciling a definition with a flowchart.
 */
public class SanitizeResult {
    private final List<SanitizeAction> actions;

    public SanitizeResult(List<SanitizeAction> actions) {
        this.actions = Collections.unmodifiableList(actions);
    }

    public List<SanitizeAction> getActions() {
        return actions;
    }

    public List<SanitizeAction> getActions(SanitizeAction.Kind kind) {
        return actions.stream().filter(a -> a.getKind() == kind).collect(Collectors.toList());
    }

    /** True if the definition already matched the flowchart */
    public boolean isClean() {
        return actions.isEmpty();
    }
}
