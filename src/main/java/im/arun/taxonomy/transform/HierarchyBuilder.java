package im.arun.taxonomy.transform;

import im.arun.taxonomy.model.AncestorFrame;
import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.TaxonomyRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Resolves each row's parent from its indent depth.
 *
 * <p>Single pass over the rows in sheet order with a stack of open ancestors. A row at depth d
 * closes every open frame at depth >= d and attaches to the nearest remaining frame, so its
 * parent is the closest earlier row with a strictly smaller depth. Depth jumps are accepted as is.</p>
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    private final int maxLevels;

    /**
     * @param maxLevels configured number of Level_N ancestor columns; wins over the data
     */
    public HierarchyBuilder(int maxLevels) {
        if (maxLevels < 1) {
            throw new IllegalArgumentException("maxLevels must be positive: " + maxLevels);
        }
        this.maxLevels = maxLevels;
    }

    public HierarchyResult build(List<TaxonomyRow> rows) {
        int maxDepthFromData = rows.stream().mapToInt(TaxonomyRow::getIndent).max().orElse(-1) + 1;
        List<String> warnings = new ArrayList<>();
        if (maxDepthFromData > maxLevels) {
            String warning = String.format(
                "Data contains hierarchy depth (%d) greater than configured max (%d). Using config value.",
                maxDepthFromData, maxLevels);
            logger.warn(warning);
            warnings.add(warning);
        }

        // bottom of the stack is the last element
        Deque<AncestorFrame> stack = new ArrayDeque<>();
        List<HierarchyEntry> entries = new ArrayList<>(rows.size());

        for (TaxonomyRow row : rows) {
            int depth = row.getIndent();
            while (!stack.isEmpty() && stack.peek().getDepth() >= depth) {
                stack.pop();
            }
            String parentConcept = stack.isEmpty() ? null : stack.peek().getConceptName();

            List<AncestorFrame> ancestors = snapshot(stack);
            entries.add(new HierarchyEntry(row, parentConcept, ancestors, levelLabels(ancestors)));

            stack.push(new AncestorFrame(depth, row.getConceptName(), row.getLabel()));
        }

        return new HierarchyResult(
            Collections.unmodifiableList(entries), maxDepthFromData, maxLevels,
            Collections.unmodifiableList(warnings));
    }

    /** Open frames ordered bottom to top. */
    private static List<AncestorFrame> snapshot(Deque<AncestorFrame> stack) {
        List<AncestorFrame> frames = new ArrayList<>(stack.size());
        Iterator<AncestorFrame> it = stack.descendingIterator();
        while (it.hasNext()) {
            frames.add(it.next());
        }
        return Collections.unmodifiableList(frames);
    }

    private List<String> levelLabels(List<AncestorFrame> ancestors) {
        String[] levels = new String[maxLevels];
        for (int i = 0; i < maxLevels && i < ancestors.size(); i++) {
            levels[i] = ancestors.get(i).getLabel();
        }
        return Collections.unmodifiableList(Arrays.asList(levels));
    }
}
