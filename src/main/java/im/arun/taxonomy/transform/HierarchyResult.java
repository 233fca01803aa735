package im.arun.taxonomy.transform;

import im.arun.taxonomy.model.HierarchyEntry;
import lombok.Value;

import java.util.List;

/**
 * Output of {@link HierarchyBuilder}: entries in input order plus any depth warnings.
 */
@Value
public class HierarchyResult {
    List<HierarchyEntry> entries;
    /** Deepest level seen in the data, counted from 1. */
    int maxDepthFromData;
    int maxLevels;
    List<String> warnings;

    public boolean exceedsConfiguredDepth() {
        return maxDepthFromData > maxLevels;
    }
}
