package im.arun.taxonomy.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * One row of the flat materialized-path table, in tree pre-order.
 */
@Value
@Builder
public class MaterializedPathRow {
    String fullPath;
    int excelRow;
    String conceptName;
    String preferredLabel;
    String label;
    String groupCode;
    String groupName;
    String type;
    Map<String, String> attributes;
}
