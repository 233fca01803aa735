package im.arun.taxonomy.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.taxonomy.TaxonomyFixtures;
import im.arun.taxonomy.config.ConfigLoader;
import im.arun.taxonomy.config.EtlPaths;
import im.arun.taxonomy.config.TaxonomyEtlConfig;
import im.arun.taxonomy.exception.InputDataException;
import im.arun.taxonomy.exception.QaFailureException;
import im.arun.taxonomy.extract.WorkbookExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class TaxonomyEtlServiceTest {

    static final String CONFIG = String.join("\n",
        "etl_version: \"1.0.0\"",
        "operator: \"Test Operator\"",
        "paths:",
        "  input_dir: data/raw",
        "  output_dir: data/processed",
        "  logs_dir: logs",
        "source_file:",
        "  filename: taxonomy.xlsx",
        "  sheet_name: Taxonomy ITI",
        "");

    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path projectRoot;

    private TaxonomyEtlService service;
    private TaxonomyEtlConfig config;
    private EtlPaths paths;

    @BeforeEach
    void setUp() throws IOException {
        service = new TaxonomyEtlService(new WorkbookExtractor(), CLOCK);
        Path configFile = Files.writeString(projectRoot.resolve("config.yaml"), CONFIG);
        ConfigLoader loader = new ConfigLoader();
        config = loader.load(configFile, null);
        paths = loader.resolvePaths(config, projectRoot);
    }

    private JsonNode readRunLog() throws IOException {
        return new ObjectMapper().readTree(paths.getLogsDir().resolve("run_log_20260301-1015.json").toFile());
    }

    @Test
    @DisplayName("A clean run writes the run log and all three outputs")
    void testHappyPath() throws IOException {
        TaxonomyFixtures.writeWorkbook(paths.getInputFile(), TaxonomyFixtures.sampleSheet());

        EtlRunResult result = service.run(config, paths, false);

        assertThat(result.getRunLog().getRunMetadata().getRunId()).isEqualTo("20260301-1015");
        assertThat(result.getRunLog().getRunMetadata().getRunDatetime()).isEqualTo("2026-03-01 10:15");
        assertThat(result.getRunLog().getRunMetadata().getSourceFile()).isEqualTo("taxonomy.xlsx");
        assertThat(result.getRunLogFiles()).allSatisfy(file -> assertThat(file).isRegularFile());
        assertThat(result.getOutputFiles()).hasSize(3).allSatisfy(file -> assertThat(file).isRegularFile());
        assertThat(paths.getOutputDir().resolve("df_hierarchy_20260301-1015.csv")).isRegularFile();

        JsonNode runLog = readRunLog();
        assertThat(runLog.at("/run_metadata/operator").asText()).isEqualTo("Test Operator");
        assertThat(runLog.at("/row_counts/after_cleaning").asInt()).isEqualTo(7);
        assertThat(runLog.at("/failed_critical_checks")).isEmpty();
    }

    @Test
    @DisplayName("A failed critical check blocks outputs but still writes the run log")
    void testFailFast() throws IOException {
        TaxonomyFixtures.writeWorkbook(paths.getInputFile(), TaxonomyFixtures.sheetWithDuplicatePath());

        QaFailureException e = catchThrowableOfType(() -> service.run(config, paths, false), QaFailureException.class);

        assertThat(e.getFailedChecks()).containsExactly("unique_full_path");
        assertThat(e.getContext()).containsEntry("run_id", "20260301-1015");
        assertThat(paths.getOutputDir()).doesNotExist();

        JsonNode runLog = readRunLog();
        assertThat(runLog.at("/run_metadata/force_override").asBoolean()).isFalse();
        assertThat(runLog.at("/qa_results/unique_full_path").asBoolean()).isFalse();
        assertThat(runLog.at("/failed_critical_checks/0").asText()).isEqualTo("unique_full_path");
        assertThat(runLog.at("/anomalies/0").asText()).startsWith("Duplicate full path: ");
        assertThat(paths.getLogsDir().resolve("run_log_20260301-1015.md")).isRegularFile();
    }

    @Test
    @DisplayName("Force override writes outputs despite failed critical checks")
    void testForce() throws IOException {
        TaxonomyFixtures.writeWorkbook(paths.getInputFile(), TaxonomyFixtures.sheetWithDuplicatePath());

        EtlRunResult result = service.run(config, paths, true);

        assertThat(result.getPipelineResult().getQaReport().getFailedCritical()).containsExactly("unique_full_path");
        assertThat(result.getOutputFiles()).allSatisfy(file -> assertThat(file).isRegularFile());
        assertThat(readRunLog().at("/run_metadata/force_override").asBoolean()).isTrue();
    }

    @Test
    @DisplayName("A non-critical failure does not block outputs")
    void testNonCriticalFailure() throws IOException {
        config.setCriticalChecks(List.of("all_have_group_info"));
        TaxonomyFixtures.writeWorkbook(paths.getInputFile(), TaxonomyFixtures.sheetWithDuplicatePath());

        EtlRunResult result = service.run(config, paths, false);

        assertThat(result.getPipelineResult().getQaReport().getResults()).containsEntry("unique_full_path", false);
        assertThat(result.getOutputFiles()).hasSize(3);
    }

    @Test
    @DisplayName("A missing input file fails before anything is written")
    void testMissingInput() {
        assertThatThrownBy(() -> service.run(config, paths, false)).isInstanceOf(InputDataException.class);
        assertThat(paths.getLogsDir()).doesNotExist();
    }
}
