package im.arun.taxonomy.model;

import lombok.Value;

import java.util.List;

/**
 * A row with its resolved parent.
 *
 * <p>{@code ancestors} is the chain of frames that were open when the row was attached,
 * bottom to top; the last frame is the parent. {@code levelLabels} holds the label of the
 * i-th ancestor for each configured hierarchy level, null past the chain.</p>
 */
@Value
public class HierarchyEntry {
    TaxonomyRow row;
    String parentConcept;
    List<AncestorFrame> ancestors;
    List<String> levelLabels;

    public int getDepth() {
        return row.getIndent();
    }

    public boolean isRoot() {
        return ancestors.isEmpty();
    }

    /**
     * Depth of the parent frame, or -1 for roots.
     */
    public int getParentDepth() {
        return isRoot() ? -1 : ancestors.get(ancestors.size() - 1).getDepth();
    }
}
