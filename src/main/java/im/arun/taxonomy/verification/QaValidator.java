package im.arun.taxonomy.verification;

import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.MaterializedPathRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs every {@link QaCheck} and classifies failures against the configured critical set.
 * Only reports; blocking output on critical failures is up to the caller.
 */
public class QaValidator {
    private static final Logger logger = LoggerFactory.getLogger(QaValidator.class);

    private final List<QaCheck> criticalChecks;

    public QaValidator(List<QaCheck> criticalChecks) {
        this.criticalChecks = List.copyOf(criticalChecks);
    }

    public QaReport validate(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows) {
        Map<String, Boolean> results = new LinkedHashMap<>();
        for (QaCheck check : QaCheck.values()) {
            boolean passed = check.test(hierarchy, flatRows);
            results.put(check.getCheckName(), passed);
            if (!passed) {
                logger.warn("QA check {} failed", check.getCheckName());
            }
        }

        List<String> failedCritical = new ArrayList<>();
        for (QaCheck check : criticalChecks) {
            if (!results.get(check.getCheckName())) {
                failedCritical.add(check.getCheckName());
            }
        }

        return new QaReport(
            Collections.unmodifiableMap(results),
            Collections.unmodifiableList(failedCritical),
            duplicatePaths(flatRows));
    }

    /**
     * Full paths that occur more than once, in first-seen order.
     */
    public static List<String> duplicatePaths(List<MaterializedPathRow> flatRows) {
        Set<String> seen = new LinkedHashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (MaterializedPathRow row : flatRows) {
            if (!seen.add(row.getFullPath())) {
                duplicates.add(row.getFullPath());
            }
        }
        return List.copyOf(duplicates);
    }
}
