package im.arun.taxonomy.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline configuration as read from the YAML config file.
 * Values only; resolving paths and reading files is left to the caller.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaxonomyEtlConfig {

    @JsonProperty("etl_version")
    private String etlVersion = "unknown";

    @JsonProperty("operator")
    private String operator = "Automated ETL Pipeline";

    /** Directory keys (input_dir, output_dir, logs_dir) relative to the project root. */
    @JsonProperty("paths")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private Map<String, String> paths = new LinkedHashMap<>();

    @JsonProperty("source_file")
    private SourceFile sourceFile = new SourceFile();

    @JsonProperty("max_hierarchy_levels")
    private int maxHierarchyLevels = 5;

    @JsonProperty("optional_cols")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> optionalCols = new ArrayList<>();

    @JsonProperty("critical_checks")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> criticalChecks = new ArrayList<>();

    @JsonProperty("df_hierarchy_cols_order")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<String> hierarchyColumnOrder = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceFile {
        @JsonProperty("filename")
        private String filename;

        @JsonProperty("sheet_name")
        private String sheetName;
    }
}
