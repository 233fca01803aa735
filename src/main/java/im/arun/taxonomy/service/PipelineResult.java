package im.arun.taxonomy.service;

import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.MaterializedPathRow;
import im.arun.taxonomy.transform.HierarchyResult;
import im.arun.taxonomy.tree.TaxonomyTree;
import im.arun.taxonomy.verification.QaReport;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Everything the in-memory transformation produces for one run.
 */
@Value
public class PipelineResult {
    HierarchyResult hierarchy;
    TaxonomyTree tree;
    List<MaterializedPathRow> materializedPath;
    QaReport qaReport;
    /** Row count after each stage, in stage order. */
    Map<String, Integer> rowCounts;
    List<String> anomalies;

    public List<HierarchyEntry> getHierarchyEntries() {
        return hierarchy.getEntries();
    }
}
