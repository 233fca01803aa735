package im.arun.taxonomy.model;

import java.util.List;
import java.util.Set;

/**
 * Column names of the hierarchy table and their values for a {@link HierarchyEntry}.
 * Names follow the source sheet headers so existing column-order configs keep working.
 */
public final class HierarchyColumns {
    public static final String EXCEL_ROW = "excel_row";
    public static final String CONCEPT_NAME = "Concept name";
    public static final String PREFERRED_LABEL = "Preferred label";
    public static final String LABEL_CLEAN = "label_clean";
    public static final String INDENT = "indent";
    public static final String TYPE = "Type";
    public static final String GROUP_CODE = "group_code";
    public static final String GROUP_NAME = "group_name";
    public static final String PARENT_CONCEPT = "parent_concept";
    public static final String LEVEL_PREFIX = "Level_";

    private static final Set<String> FIXED = Set.of(
        EXCEL_ROW, CONCEPT_NAME, PREFERRED_LABEL, LABEL_CLEAN, INDENT, TYPE,
        GROUP_CODE, GROUP_NAME, PARENT_CONCEPT);

    private HierarchyColumns() {
    }

    public static String levelColumn(int level) {
        return LEVEL_PREFIX + level;
    }

    public static boolean isKnown(String column, List<String> optionalCols, int maxLevels) {
        return FIXED.contains(column)
            || optionalCols.contains(column)
            || levelIndex(column, maxLevels) >= 0;
    }

    /**
     * Value of {@code column} for the entry, as it should appear in a table cell.
     */
    public static Object valueOf(HierarchyEntry entry, String column) {
        TaxonomyRow row = entry.getRow();
        switch (column) {
            case EXCEL_ROW:
                return row.getExcelRow();
            case CONCEPT_NAME:
                return row.getConceptName();
            case PREFERRED_LABEL:
                return row.getPreferredLabel();
            case LABEL_CLEAN:
                return row.getLabel();
            case INDENT:
                return row.getIndent();
            case TYPE:
                return row.getType();
            case GROUP_CODE:
                return row.getGroupCode();
            case GROUP_NAME:
                return row.getGroupName();
            case PARENT_CONCEPT:
                return entry.getParentConcept();
            default:
                int level = levelIndex(column, entry.getLevelLabels().size());
                if (level >= 0) {
                    return entry.getLevelLabels().get(level);
                }
                if (row.getAttributes().containsKey(column)) {
                    return row.attribute(column);
                }
                throw new IllegalArgumentException("Unknown hierarchy column: " + column);
        }
    }

    /** Zero-based level for "Level_N" with 1 <= N <= maxLevels, else -1. */
    private static int levelIndex(String column, int maxLevels) {
        if (!column.startsWith(LEVEL_PREFIX)) {
            return -1;
        }
        try {
            int level = Integer.parseInt(column.substring(LEVEL_PREFIX.length()));
            return level >= 1 && level <= maxLevels ? level - 1 : -1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
