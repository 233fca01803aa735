package im.arun.taxonomy.verification;

import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.MaterializedPathRow;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.transform.RowNormalizer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks over the hierarchy table and the flat materialized-path table.
 * Each check is independent of the others.
 */
public enum QaCheck {

    /** Every row has both a group code and a group name. */
    ALL_HAVE_GROUP_INFO("all_have_group_info") {
        @Override
        public boolean test(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows) {
            return hierarchy.stream().allMatch(e -> e.getRow().hasGroupInfo());
        }
    },

    /** Every indent is a whole, non-negative depth. */
    INDENT_MATCHES_INT("indent_matches_int") {
        @Override
        public boolean test(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows) {
            return hierarchy.stream().allMatch(e -> e.getDepth() >= 0);
        }
    },

    /** Rows that are not abstract carry a non-empty label. */
    NO_EMPTY_LABELS_UNLESS_ABSTRACT("no_empty_labels_unless_abstract") {
        @Override
        public boolean test(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows) {
            return hierarchy.stream()
                .map(HierarchyEntry::getRow)
                .filter(row -> !RowNormalizer.ABSTRACT_TYPE.equals(row.getType()))
                .map(TaxonomyRow::getLabel)
                .allMatch(label -> label != null && !label.isEmpty());
        }
    },

    /** Full paths are distinct across the flat table; downstream uses them as keys. */
    UNIQUE_FULL_PATH("unique_full_path") {
        @Override
        public boolean test(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows) {
            Set<String> seen = new HashSet<>();
            for (MaterializedPathRow row : flatRows) {
                if (!seen.add(row.getFullPath())) {
                    return false;
                }
            }
            return true;
        }
    };

    private final String checkName;

    QaCheck(String checkName) {
        this.checkName = checkName;
    }

    public String getCheckName() {
        return checkName;
    }

    public abstract boolean test(List<HierarchyEntry> hierarchy, List<MaterializedPathRow> flatRows);

    public static Optional<QaCheck> fromName(String name) {
        return Arrays.stream(values()).filter(c -> c.checkName.equals(name)).findFirst();
    }
}
