package im.arun.taxonomy.service;

import im.arun.taxonomy.config.EtlPaths;
import im.arun.taxonomy.config.TaxonomyEtlConfig;
import im.arun.taxonomy.exception.QaFailureException;
import im.arun.taxonomy.extract.WorkbookExtractor;
import im.arun.taxonomy.model.TaxonomyRow;
import im.arun.taxonomy.output.OutputWriter;
import im.arun.taxonomy.runlog.RunLog;
import im.arun.taxonomy.runlog.RunLogWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main service orchestrator: extract, transform, validate, log the run, then write outputs.
 *
 * <p>The run log is always written. Outputs are written together, and only when every critical
 * check passed or the caller forces the run.</p>
 */
public class TaxonomyEtlService {
    private static final Logger logger = LoggerFactory.getLogger(TaxonomyEtlService.class);

    private static final DateTimeFormatter RUN_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");
    private static final DateTimeFormatter RUN_DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final WorkbookExtractor workbookExtractor;
    private final Clock clock;

    public TaxonomyEtlService() {
        this(new WorkbookExtractor(), Clock.systemDefaultZone());
    }

    public TaxonomyEtlService(WorkbookExtractor workbookExtractor, Clock clock) {
        this.workbookExtractor = workbookExtractor;
        this.clock = clock;
    }

    /**
     * Run the full pipeline.
     *
     * @param config validated configuration
     * @param paths  resolved directories and input file
     * @param force  write outputs even when critical QA checks fail
     * @throws QaFailureException when critical checks fail and {@code force} is false
     */
    public EtlRunResult run(TaxonomyEtlConfig config, EtlPaths paths, boolean force) {
        logger.info("ETL process started.");
        long start = System.nanoTime();
        LocalDateTime now = LocalDateTime.now(clock);
        String runId = now.format(RUN_ID_FORMAT);

        long extractStart = System.nanoTime();
        List<TaxonomyRow> rawRows = workbookExtractor.extractRows(
            paths.getInputFile(), config.getSourceFile().getSheetName(), config.getOptionalCols());
        logger.info("Data extracted: {} rows in {} seconds.", rawRows.size(),
            TaxonomyPipeline.elapsedSeconds(extractStart));

        TaxonomyPipeline pipeline = new TaxonomyPipeline(config.getMaxHierarchyLevels(), config.getCriticalChecks());
        PipelineResult result = pipeline.process(rawRows);

        RunLog runLog = buildRunLog(config, paths, force, runId, now, result);
        List<Path> runLogFiles = new RunLogWriter(paths.getLogsDir()).write(runLog);

        List<String> failedCritical = result.getQaReport().getFailedCritical();
        if (!failedCritical.isEmpty() && !force) {
            failedCritical.forEach(check -> logger.error("Critical QA check failed: {}", check));
            logger.error("ETL aborted before producing downstream outputs.");
            throw new QaFailureException(failedCritical,
                Map.of("run_id", runId, "run_log", runLogFiles.get(0).toString()));
        }
        if (!failedCritical.isEmpty()) {
            failedCritical.forEach(check ->
                logger.warn("Force override enabled, continuing despite failed QA check: {}", check));
        } else {
            logger.info("All critical QA checks passed, proceeding with downstream outputs.");
        }

        long outputStart = System.nanoTime();
        List<Path> outputFiles = new OutputWriter(paths.getOutputDir()).writeAll(
            runId,
            result.getHierarchyEntries(),
            config.getHierarchyColumnOrder(),
            result.getMaterializedPath(),
            config.getOptionalCols(),
            result.getTree());
        logger.info("Outputs saved in {} seconds.", TaxonomyPipeline.elapsedSeconds(outputStart));

        logger.info("ETL process completed in {} seconds.", TaxonomyPipeline.elapsedSeconds(start));
        return new EtlRunResult(runLog, result, runLogFiles, outputFiles);
    }

    private RunLog buildRunLog(TaxonomyEtlConfig config, EtlPaths paths, boolean force,
                               String runId, LocalDateTime now, PipelineResult result) {
        RunLog runLog = new RunLog();
        runLog.setRunMetadata(new RunLog.RunMetadata(
            runId,
            now.format(RUN_DATETIME_FORMAT),
            config.getOperator(),
            paths.getInputFile().getFileName().toString(),
            config.getSourceFile().getSheetName(),
            config.getEtlVersion(),
            hostName(),
            force));
        runLog.getRowCounts().putAll(result.getRowCounts());
        runLog.getQaResults().putAll(result.getQaReport().getResults());
        runLog.setFailedCriticalChecks(new ArrayList<>(result.getQaReport().getFailedCritical()));
        runLog.getAnomalies().addAll(result.getAnomalies());
        return runLog;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not resolve host name for run log: {}", e.getMessage());
            return "unknown";
        }
    }
}
