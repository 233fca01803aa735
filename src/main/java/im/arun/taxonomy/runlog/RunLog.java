package im.arun.taxonomy.runlog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit record of one pipeline run. Written for every run, including blocked ones.
 */
@Data
@NoArgsConstructor
@JsonPropertyOrder({"run_metadata", "row_counts", "qa_results", "failed_critical_checks", "anomalies", "sign_off"})
public class RunLog {

    @JsonProperty("run_metadata")
    private RunMetadata runMetadata;

    @JsonProperty("row_counts")
    private Map<String, Integer> rowCounts = new LinkedHashMap<>();

    @JsonProperty("qa_results")
    private Map<String, Boolean> qaResults = new LinkedHashMap<>();

    @JsonProperty("failed_critical_checks")
    private List<String> failedCriticalChecks = new ArrayList<>();

    @JsonProperty("anomalies")
    private List<String> anomalies = new ArrayList<>();

    @JsonProperty("sign_off")
    private SignOff signOff = new SignOff();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"run_id", "run_datetime", "operator", "source_file", "sheet_name",
        "etl_version", "environment", "force_override"})
    public static class RunMetadata {
        @JsonProperty("run_id")
        private String runId;

        @JsonProperty("run_datetime")
        private String runDatetime;

        @JsonProperty("operator")
        private String operator;

        @JsonProperty("source_file")
        private String sourceFile;

        @JsonProperty("sheet_name")
        private String sheetName;

        @JsonProperty("etl_version")
        private String etlVersion;

        @JsonProperty("environment")
        private String environment;

        @JsonProperty("force_override")
        private boolean forceOverride;
    }

    @Data
    @NoArgsConstructor
    public static class SignOff {
        @JsonProperty("etl_operator")
        private String etlOperator;

        @JsonProperty("reviewer")
        private String reviewer;
    }
}
