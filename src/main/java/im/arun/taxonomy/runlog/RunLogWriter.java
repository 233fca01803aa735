package im.arun.taxonomy.runlog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.taxonomy.exception.OutputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes the run log next to the application logs as {@code run_log_<runId>.json} and {@code .md}.
 */
public class RunLogWriter {
    private static final Logger logger = LoggerFactory.getLogger(RunLogWriter.class);

    private final Path logsDir;
    private final ObjectMapper objectMapper;

    public RunLogWriter(Path logsDir) {
        this.logsDir = logsDir;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write both renderings.
     *
     * @return the JSON and Markdown paths, in that order
     */
    public List<Path> write(RunLog runLog) {
        String runId = runLog.getRunMetadata().getRunId();
        Path jsonPath = logsDir.resolve("run_log_" + runId + ".json");
        Path mdPath = logsDir.resolve("run_log_" + runId + ".md");
        try {
            Files.createDirectories(logsDir);
            objectMapper.writeValue(jsonPath.toFile(), runLog);
            Files.writeString(mdPath, toMarkdown(runLog), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new OutputException("Failed to write run log", Map.of("logs_dir", logsDir.toString()), e);
        }
        logger.info("Run logs saved as:\n- {}\n- {}", jsonPath, mdPath);
        return List.of(jsonPath, mdPath);
    }

    public String toMarkdown(RunLog runLog) {
        StringBuilder md = new StringBuilder();
        RunLog.RunMetadata meta = runLog.getRunMetadata();

        md.append("# Taxonomy ETL Run Log\n\n");
        md.append("**Run ID:** ").append(meta.getRunId()).append('\n');
        md.append("**Run Date/Time:** ").append(meta.getRunDatetime()).append('\n');
        md.append("**Operator:** ").append(meta.getOperator()).append('\n');
        md.append("**Source File:** ").append(meta.getSourceFile()).append('\n');
        md.append("**Sheet Name:** ").append(meta.getSheetName()).append('\n');
        md.append("**ETL Version:** ").append(meta.getEtlVersion()).append('\n');
        md.append("**Environment:** ").append(meta.getEnvironment()).append('\n');
        md.append("**Force Override:** ").append(meta.isForceOverride()).append("\n\n");

        md.append("## Row Counts\n");
        runLog.getRowCounts().forEach((stage, count) ->
            md.append("- **").append(titleCase(stage)).append(":** ").append(count).append('\n'));
        md.append('\n');

        md.append("## QA Results\n");
        runLog.getQaResults().forEach((check, passed) ->
            md.append("- ").append(titleCase(check)).append(": ").append(passed ? "Pass" : "Fail").append('\n'));
        md.append('\n');

        md.append("## Anomalies & Exceptions\n");
        if (runLog.getAnomalies().isEmpty()) {
            md.append("- None recorded\n");
        } else {
            runLog.getAnomalies().forEach(anomaly -> md.append("- ").append(anomaly).append('\n'));
        }
        md.append('\n');

        md.append("## Sign-Off\n");
        md.append("| Role | Name | Date | Signature |\n");
        md.append("|------|------|------|-----------|\n");
        md.append("| ETL Operator |  |  |  |\n");
        md.append("| Reviewer / QA |  |  |  |\n");
        return md.toString();
    }

    /** "after_group_headers" -> "After Group Headers" */
    static String titleCase(String key) {
        StringBuilder out = new StringBuilder();
        for (String word : key.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return out.toString();
    }
}
