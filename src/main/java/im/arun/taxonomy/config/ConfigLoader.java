package im.arun.taxonomy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import im.arun.taxonomy.exception.ConfigurationException;
import im.arun.taxonomy.model.HierarchyColumns;
import im.arun.taxonomy.verification.QaCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the pipeline YAML configuration on top of the bundled defaults,
 * merges caller overrides and validates the result before any data is read.
 */
public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "taxonomy-etl-defaults.yaml";
    public static final List<String> REQUIRED_PATH_KEYS = List.of("input_dir", "output_dir", "logs_dir");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final TaxonomyEtlConfig defaultConfig;

    public ConfigLoader() {
        this.defaultConfig = loadDefaultConfig();
    }

    private TaxonomyEtlConfig loadDefaultConfig() {
        try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (resourceStream != null) {
                return yamlMapper.readValue(resourceStream, TaxonomyEtlConfig.class);
            }
            logger.warn("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            return new TaxonomyEtlConfig();
        } catch (IOException e) {
            throw new ConfigurationException("Bundled defaults are not valid YAML",
                Map.of("resource", DEFAULTS_RESOURCE), e);
        }
    }

    /**
     * Read the config file, apply overrides and validate.
     *
     * @param configPath YAML file, must exist
     * @param userOptions overrides keyed by snake_case or camelCase name, may be null
     */
    public TaxonomyEtlConfig load(Path configPath, Map<String, Object> userOptions) {
        if (configPath == null || !Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Configuration file not found",
                Map.of("config_path", String.valueOf(configPath)));
        }

        TaxonomyEtlConfig config = copyConfig(defaultConfig);
        try {
            yamlMapper.readerForUpdating(config).readValue(configPath.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file",
                Map.of("config_path", configPath.toString()), e);
        }
        logger.info("Config loaded from {}", configPath);

        applyOverrides(config, userOptions);
        validate(config);
        return config;
    }

    /**
     * Merge user options into an already loaded config.
     */
    public TaxonomyEtlConfig applyOverrides(TaxonomyEtlConfig config, Map<String, Object> userOptions) {
        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            if (value == null) {
                return;
            }
            switch (key) {
                case "operator":
                    config.setOperator(requireString(key, value));
                    break;
                case "etl_version":
                case "etlVersion":
                    config.setEtlVersion(requireString(key, value));
                    break;
                case "max_hierarchy_levels":
                case "maxHierarchyLevels":
                    if (!(value instanceof Integer)) {
                        throw new ConfigurationException("Override must be an integer",
                            Map.of("key", key, "value", value));
                    }
                    config.setMaxHierarchyLevels((Integer) value);
                    break;
                case "sheet_name":
                case "sheetName":
                    config.getSourceFile().setSheetName(requireString(key, value));
                    break;
                case "filename":
                    config.getSourceFile().setFilename(requireString(key, value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    /**
     * Checks every key the pipeline needs, so a bad config aborts before extraction.
     */
    public void validate(TaxonomyEtlConfig config) {
        for (String key : REQUIRED_PATH_KEYS) {
            String value = config.getPaths() == null ? null : config.getPaths().get(key);
            if (value == null || value.isBlank()) {
                throw new ConfigurationException("Key '" + key + "' not found in configuration.",
                    Map.of("section", "paths", "key", key));
            }
        }
        TaxonomyEtlConfig.SourceFile sourceFile = config.getSourceFile();
        if (sourceFile == null || isBlank(sourceFile.getFilename())) {
            throw new ConfigurationException("Missing 'filename' in configuration.",
                Map.of("section", "source_file", "key", "filename"));
        }
        if (isBlank(sourceFile.getSheetName())) {
            throw new ConfigurationException("Missing 'sheet_name' in configuration.",
                Map.of("section", "source_file", "key", "sheet_name"));
        }
        if (config.getMaxHierarchyLevels() < 1) {
            throw new ConfigurationException("max_hierarchy_levels must be positive",
                Map.of("key", "max_hierarchy_levels", "value", config.getMaxHierarchyLevels()));
        }
        for (String check : config.getCriticalChecks()) {
            if (QaCheck.fromName(check).isEmpty()) {
                throw new ConfigurationException("Unknown critical check: " + check,
                    Map.of("key", "critical_checks", "value", check));
            }
        }
        if (config.getHierarchyColumnOrder().isEmpty()) {
            throw new ConfigurationException("Missing 'df_hierarchy_cols_order' in configuration.",
                Map.of("key", "df_hierarchy_cols_order"));
        }
        for (String column : config.getHierarchyColumnOrder()) {
            if (!HierarchyColumns.isKnown(column, config.getOptionalCols(), config.getMaxHierarchyLevels())) {
                throw new ConfigurationException("Unknown hierarchy column: " + column,
                    Map.of("key", "df_hierarchy_cols_order", "value", column));
            }
        }
    }

    /**
     * Resolve the configured directories and input file against the project root.
     */
    public EtlPaths resolvePaths(TaxonomyEtlConfig config, Path projectRoot) {
        Map<String, Path> resolved = new LinkedHashMap<>();
        config.getPaths().forEach((key, value) -> {
            if (value == null) {
                throw new ConfigurationException("Key '" + key + "' not found in configuration.",
                    Map.of("section", "paths", "key", key));
            }
            resolved.put(key, projectRoot.resolve(value).normalize());
        });
        Path inputDir = resolved.get("input_dir");
        return new EtlPaths(
            inputDir,
            resolved.get("output_dir"),
            resolved.get("logs_dir"),
            inputDir.resolve(config.getSourceFile().getFilename()));
    }

    private String requireString(String key, Object value) {
        if (!(value instanceof String)) {
            throw new ConfigurationException("Override must be a string", Map.of("key", key, "value", value));
        }
        return (String) value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private TaxonomyEtlConfig copyConfig(TaxonomyEtlConfig source) {
        TaxonomyEtlConfig copy = new TaxonomyEtlConfig();
        copy.setEtlVersion(source.getEtlVersion());
        copy.setOperator(source.getOperator());
        copy.setPaths(new LinkedHashMap<>(source.getPaths()));
        TaxonomyEtlConfig.SourceFile sourceFile = new TaxonomyEtlConfig.SourceFile();
        sourceFile.setFilename(source.getSourceFile().getFilename());
        sourceFile.setSheetName(source.getSourceFile().getSheetName());
        copy.setSourceFile(sourceFile);
        copy.setMaxHierarchyLevels(source.getMaxHierarchyLevels());
        copy.setOptionalCols(new ArrayList<>(source.getOptionalCols()));
        copy.setCriticalChecks(new ArrayList<>(source.getCriticalChecks()));
        copy.setHierarchyColumnOrder(new ArrayList<>(source.getHierarchyColumnOrder()));
        return copy;
    }
}
