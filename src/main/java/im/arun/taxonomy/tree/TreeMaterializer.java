package im.arun.taxonomy.tree;

import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.util.TreeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the owned taxonomy tree from hierarchy entries and computes each node's full path.
 *
 * <p>Uses the same depth stack as the hierarchy pass. The path of a node starts from its group
 * (name, else code): when the parent's path already starts with that group text the node's path
 * is {@code group > label}, otherwise it extends the parent path. Rows of one group thus carry the
 * group name once, not once per level. The match is a plain string prefix, so a group named
 * {@code Assets} also restarts under a parent in {@code Assets Non-current}.</p>
 */
public class TreeMaterializer {
    private static final Logger logger = LoggerFactory.getLogger(TreeMaterializer.class);

    private static final class Frame {
        final int depth;
        final TaxonomyNode node;

        Frame(int depth, TaxonomyNode node) {
            this.depth = depth;
            this.node = node;
        }
    }

    public TaxonomyTree materialize(List<HierarchyEntry> entries) {
        List<TaxonomyNode> roots = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();

        for (HierarchyEntry entry : entries) {
            TaxonomyRow row = entry.getRow();
            int depth = row.getIndent();
            while (!stack.isEmpty() && stack.peek().depth >= depth) {
                stack.pop();
            }
            String parentPath = stack.isEmpty() ? "" : stack.peek().node.getFullPath();

            TaxonomyNode node = new TaxonomyNode(row, fullPath(parentPath, row));
            if (stack.isEmpty()) {
                roots.add(node);
            } else {
                stack.peek().node.addChild(node);
            }
            stack.push(new Frame(depth, node));
        }

        TaxonomyTree tree = new TaxonomyTree(roots);
        logger.debug("Materialized {} nodes under {} roots", tree.size(), roots.size());
        return tree;
    }

    static String fullPath(String parentPath, TaxonomyRow row) {
        String base = baseSegment(row);
        if (parentPath.isEmpty() || parentPath.startsWith(base)) {
            return TreeUtils.joinPath(base, row.getLabel());
        }
        return TreeUtils.joinPath(parentPath, row.getLabel());
    }

    private static String baseSegment(TaxonomyRow row) {
        if (row.getGroupName() != null && !row.getGroupName().isBlank()) {
            return row.getGroupName();
        }
        if (row.getGroupCode() != null && !row.getGroupCode().isBlank()) {
            return row.getGroupCode();
        }
        return "";
    }
}
