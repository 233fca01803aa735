package im.arun.taxonomy.transform;

import im.arun.taxonomy.model.TaxonomyRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans labels and resolves the concept type.
 * Rows without a type (after the abstract rule) are dropped; order is preserved.
 */
public class RowNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(RowNormalizer.class);

    public static final String ABSTRACT_TYPE = "abstract";
    public static final String ABSTRACT_MARKER = "[abstract]";

    /** Leading or trailing Unicode whitespace, including the no-break spaces spreadsheets carry. */
    private static final Pattern LABEL_PADDING =
        Pattern.compile("^[\\s\\x1C-\\x1F]+|[\\s\\x1C-\\x1F]+$", Pattern.UNICODE_CHARACTER_CLASS);

    public List<TaxonomyRow> normalize(List<TaxonomyRow> rows) {
        List<TaxonomyRow> result = new ArrayList<>(rows.size());
        for (TaxonomyRow row : rows) {
            String label = row.getPreferredLabel() == null ? "" : clean(row.getPreferredLabel());
            String type = isBlank(row.getType()) ? null : row.getType();

            if (type == null && label.contains(ABSTRACT_MARKER)) {
                type = ABSTRACT_TYPE;
            }
            if (type == null) {
                logger.debug("Dropping row {} without type", row.getExcelRow());
                continue;
            }
            result.add(row.toBuilder().label(label).type(type).build());
        }
        return result;
    }

    static String clean(String label) {
        return LABEL_PADDING.matcher(label).replaceAll("");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
