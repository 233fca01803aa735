package im.arun.taxonomy.tree;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.util.TreeUtils;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of the taxonomy tree. Owns its children; the parent is known only through tree position.
 * The full path is fixed at construction.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"excel_row", "concept_name", "preferred_label", "label", "group_code",
    "group_name", "type", "full_path"})
public class TaxonomyNode {

    @JsonProperty("excel_row")
    private final int excelRow;

    @JsonProperty("concept_name")
    private final String conceptName;

    @JsonProperty("preferred_label")
    private final String preferredLabel;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("group_code")
    private final String groupCode;

    @JsonProperty("group_name")
    private final String groupName;

    @JsonProperty("type")
    private final String type;

    @JsonProperty("full_path")
    private final String fullPath;

    /** Optional descriptive columns keyed by their sheet header. */
    @JsonIgnore
    private final Map<String, String> attributes;

    @Getter(AccessLevel.NONE)
    private final List<TaxonomyNode> children = new ArrayList<>();

    TaxonomyNode(TaxonomyRow row, String fullPath) {
        this.excelRow = row.getExcelRow();
        this.conceptName = row.getConceptName();
        this.preferredLabel = row.getPreferredLabel();
        this.label = row.getLabel();
        this.groupCode = row.getGroupCode();
        this.groupName = row.getGroupName();
        this.type = row.getType();
        this.fullPath = fullPath;
        this.attributes = row.getAttributes();
    }

    void addChild(TaxonomyNode child) {
        children.add(child);
    }

    @JsonProperty("children")
    public List<TaxonomyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @JsonAnyGetter
    public Map<String, String> attributesForJson() {
        Map<String, String> json = new LinkedHashMap<>();
        attributes.forEach((column, value) -> json.put(TreeUtils.toSnakeCase(column), value));
        return json;
    }
}
