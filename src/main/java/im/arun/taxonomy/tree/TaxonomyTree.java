package im.arun.taxonomy.tree;

import com.fasterxml.jackson.annotation.JsonValue;
import im.arun.taxonomy.util.TreeUtils;

import java.util.Collections;
import java.util.List;

/**
 * The materialized forest. Serializes as the JSON array of its roots.
 */
public class TaxonomyTree {
    private final List<TaxonomyNode> roots;

    TaxonomyTree(List<TaxonomyNode> roots) {
        this.roots = Collections.unmodifiableList(roots);
    }

    @JsonValue
    public List<TaxonomyNode> getRoots() {
        return roots;
    }

    public int size() {
        return TreeUtils.countNodes(roots);
    }
}
