package im.arun.taxonomy.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * A single concept row of the taxonomy sheet.
 * Stages never mutate a row; they derive a new one with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class TaxonomyRow {
    /** 1-based sheet row number, stable and unique. */
    int excelRow;
    String conceptName;
    /** Label exactly as read from the sheet. */
    String preferredLabel;
    /** Trimmed label, set by the normalizer. */
    String label;
    int indent;
    String type;
    String groupCode;
    String groupName;
    /** Optional descriptive columns in configured order, carried through unchanged. */
    @Builder.Default
    Map<String, String> attributes = Collections.emptyMap();

    public String attribute(String column) {
        return attributes.get(column);
    }

    public boolean hasGroupInfo() {
        return groupCode != null && groupName != null;
    }
}
