package im.arun.taxonomy.service;

import im.arun.taxonomy.model.MaterializedPathRow;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.transform.GroupTagger;
import im.arun.taxonomy.transform.HierarchyBuilder;
import im.arun.taxonomy.transform.HierarchyResult;
import im.arun.taxonomy.transform.RowNormalizer;
import im.arun.taxonomy.tree.TaxonomyTree;
import im.arun.taxonomy.tree.TreeFlattener;
import im.arun.taxonomy.tree.TreeMaterializer;
import im.arun.taxonomy.verification.QaCheck;
import im.arun.taxonomy.verification.QaReport;
import im.arun.taxonomy.verification.QaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The in-memory transformation: group tagging, cleaning, hierarchy, tree, flat table, QA.
 * Works on rows and configuration values only; reading and writing files is done elsewhere.
 */
public class TaxonomyPipeline {
    private static final Logger logger = LoggerFactory.getLogger(TaxonomyPipeline.class);

    public static final String RAW_EXTRACT = "raw_extract";
    public static final String AFTER_GROUP_HEADERS = "after_group_headers";
    public static final String AFTER_CLEANING = "after_cleaning";
    public static final String AFTER_HIERARCHY = "after_hierarchy";
    public static final String MATERIALIZED_PATH = "materialized_path";

    private final GroupTagger groupTagger;
    private final RowNormalizer rowNormalizer;
    private final HierarchyBuilder hierarchyBuilder;
    private final TreeMaterializer treeMaterializer;
    private final TreeFlattener treeFlattener;
    private final QaValidator qaValidator;

    /**
     * @param maxHierarchyLevels configured hierarchy depth
     * @param criticalChecks     names of checks that block output when failing
     */
    public TaxonomyPipeline(int maxHierarchyLevels, List<String> criticalChecks) {
        this.groupTagger = new GroupTagger();
        this.rowNormalizer = new RowNormalizer();
        this.hierarchyBuilder = new HierarchyBuilder(maxHierarchyLevels);
        this.treeMaterializer = new TreeMaterializer();
        this.treeFlattener = new TreeFlattener();
        this.qaValidator = new QaValidator(resolveChecks(criticalChecks));
    }

    public PipelineResult process(List<TaxonomyRow> rawRows) {
        Map<String, Integer> rowCounts = new LinkedHashMap<>();
        List<String> anomalies = new ArrayList<>();
        rowCounts.put(RAW_EXTRACT, rawRows.size());

        // Headers are tagged before cleaning so a header row without a type still opens its group.
        long start = System.nanoTime();
        List<TaxonomyRow> grouped = groupTagger.tag(rawRows);
        rowCounts.put(AFTER_GROUP_HEADERS, grouped.size());
        List<TaxonomyRow> cleaned = rowNormalizer.normalize(grouped);
        rowCounts.put(AFTER_CLEANING, cleaned.size());
        logger.info("Data grouped and cleaned: {} rows in {} seconds.", cleaned.size(), elapsedSeconds(start));

        start = System.nanoTime();
        HierarchyResult hierarchy = hierarchyBuilder.build(cleaned);
        anomalies.addAll(hierarchy.getWarnings());
        rowCounts.put(AFTER_HIERARCHY, hierarchy.getEntries().size());
        logger.info("Hierarchy built: {} rows in {} seconds.", hierarchy.getEntries().size(), elapsedSeconds(start));

        start = System.nanoTime();
        TaxonomyTree tree = treeMaterializer.materialize(hierarchy.getEntries());
        List<MaterializedPathRow> flatRows = treeFlattener.flatten(tree);
        rowCounts.put(MATERIALIZED_PATH, flatRows.size());
        logger.info("Materialized path built: {} rows in {} seconds.", flatRows.size(), elapsedSeconds(start));

        start = System.nanoTime();
        QaReport report = qaValidator.validate(hierarchy.getEntries(), flatRows);
        report.getDuplicatePaths().forEach(path -> anomalies.add("Duplicate full path: " + path));
        logger.info("QA checks completed in {} seconds.", elapsedSeconds(start));

        return new PipelineResult(hierarchy, tree, Collections.unmodifiableList(flatRows), report,
            Collections.unmodifiableMap(rowCounts), Collections.unmodifiableList(anomalies));
    }

    private static List<QaCheck> resolveChecks(List<String> names) {
        return names.stream()
            .map(name -> QaCheck.fromName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown QA check: " + name)))
            .collect(Collectors.toList());
    }

    static String elapsedSeconds(long startNanos) {
        return String.format("%.2f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
