package im.arun.taxonomy.util;

import im.arun.taxonomy.tree.TaxonomyNode;

import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Utility methods for materialized paths and tree walks.
 */
public final class TreeUtils {

    public static final String PATH_SEPARATOR = " > ";

    private TreeUtils() {
    }

    /**
     * Join two path segments, leaving out empty ones.
     * e.g., ("G1", "Alpha") -> "G1 > Alpha", ("G1", "") -> "G1", ("", "Alpha") -> "Alpha"
     */
    public static String joinPath(String head, String tail) {
        boolean noHead = head == null || head.isEmpty();
        boolean noTail = tail == null || tail.isEmpty();
        if (noTail) {
            return noHead ? "" : head;
        }
        return noHead ? tail : head + PATH_SEPARATOR + tail;
    }

    /**
     * Visit every node in pre-order: node first, then its children in insertion order.
     */
    public static void forEachPreOrder(List<TaxonomyNode> nodes, Consumer<TaxonomyNode> visitor) {
        for (TaxonomyNode node : nodes) {
            visitor.accept(node);
            forEachPreOrder(node.getChildren(), visitor);
        }
    }

    public static int countNodes(List<TaxonomyNode> nodes) {
        int count = 0;
        for (TaxonomyNode node : nodes) {
            count += 1 + countNodes(node.getChildren());
        }
        return count;
    }

    /**
     * Header-style column name to a JSON key, e.g. "Reference Links" -> "reference_links".
     */
    public static String toSnakeCase(String column) {
        return column.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }
}
