package im.arun.taxonomy.transform;

import im.arun.taxonomy.model.TaxonomyRow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forward-fills group headers of the form {@code [110000] Name} onto the rows that follow them.
 */
public class GroupTagger {

    public static final Pattern HEADER_PATTERN = Pattern.compile("^\\[(\\d{6})\\]\\s*(.*)");

    public List<TaxonomyRow> tag(List<TaxonomyRow> rows) {
        List<TaxonomyRow> result = new ArrayList<>(rows.size());
        String groupCode = null;
        String groupName = null;

        for (TaxonomyRow row : rows) {
            if (row.getConceptName() != null) {
                Matcher matcher = HEADER_PATTERN.matcher(row.getConceptName());
                if (matcher.find()) {
                    groupCode = matcher.group(1);
                    groupName = matcher.group(2);
                }
            }
            result.add(row.toBuilder().groupCode(groupCode).groupName(groupName).build());
        }
        return result;
    }
}
