package im.arun.taxonomy.cli;

import im.arun.taxonomy.config.ConfigLoader;
import im.arun.taxonomy.config.EtlPaths;
import im.arun.taxonomy.config.TaxonomyEtlConfig;
import im.arun.taxonomy.exception.QaFailureException;
import im.arun.taxonomy.exception.TaxonomyEtlException;
import im.arun.taxonomy.logging.LoggingService;
import im.arun.taxonomy.service.EtlRunResult;
import im.arun.taxonomy.service.TaxonomyEtlService;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for the taxonomy ETL using Picocli.
 */
@Command(
    name = "taxonomy-etl",
    description = "Rebuild the taxonomy hierarchy and materialized-path tree from the indented taxonomy sheet",
    mixinStandardHelpOptions = true,
    version = "Taxonomy ETL 1.0"
)
public class TaxonomyEtlCLI implements Callable<Integer> {

    static final String DEFAULT_CONFIG = "config/etl_taxonomy_pipeline_config.yaml";

    @Option(names = {"--project-root"}, description = "Directory the configured paths are relative to", defaultValue = ".")
    private String projectRoot;

    @Option(names = {"--config"}, description = "Pipeline YAML config (default: <project-root>/" + DEFAULT_CONFIG + ")")
    private String configPath;

    @Option(names = {"--force"}, description = "Override fail-fast QA checks")
    private boolean force;

    @Option(names = {"--operator"}, description = "Operator recorded in the run log")
    private String operator;

    @Option(names = {"--max-levels"}, description = "Maximum hierarchy depth (overrides config)")
    private Integer maxLevels;

    private final TaxonomyEtlService service;

    public TaxonomyEtlCLI() {
        this(new TaxonomyEtlService());
    }

    TaxonomyEtlCLI(TaxonomyEtlService service) {
        this.service = service;
    }

    @Override
    public Integer call() {
        Path root = Paths.get(projectRoot).toAbsolutePath().normalize();
        Path effectiveConfig = configPath != null ? Paths.get(configPath) : root.resolve(DEFAULT_CONFIG);

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("operator", operator);
        overrides.put("max_hierarchy_levels", maxLevels);

        try {
            ConfigLoader loader = new ConfigLoader();
            TaxonomyEtlConfig config = loader.load(effectiveConfig, overrides);
            EtlPaths paths = loader.resolvePaths(config, root);
            LoggingService.attachFileAppender(paths.getLogsDir());

            EtlRunResult result = service.run(config, paths, force);

            if (!result.getPipelineResult().getQaReport().passed()) {
                System.out.println("\nForce override enabled, continuing despite failed QA checks:");
                result.getPipelineResult().getQaReport().getFailedCritical()
                    .forEach(check -> System.out.println("- " + check + " failed"));
            } else {
                System.out.println("\nAll critical QA checks passed.");
            }
            System.out.println("\nOutputs saved:");
            result.getOutputFiles().forEach(path -> System.out.println("- " + path));
            return 0;
        } catch (QaFailureException e) {
            System.err.println("\nCRITICAL QA CHECKS FAILED");
            e.getFailedChecks().forEach(check -> System.err.println("- " + check + " failed"));
            System.err.println("\nETL aborted before producing downstream outputs.");
            return 1;
        } catch (TaxonomyEtlException e) {
            System.err.println("Error: " + e.getMessage() + (e.getContext().isEmpty() ? "" : " " + e.getContext()));
            return 1;
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TaxonomyEtlCLI()).execute(args);
        System.exit(exitCode);
    }
}
