package im.arun.taxonomy.config;

import lombok.Value;

import java.nio.file.Path;

/**
 * Absolute locations derived from the {@code paths} and {@code source_file} config sections.
 */
@Value
public class EtlPaths {
    Path inputDir;
    Path outputDir;
    Path logsDir;
    Path inputFile;
}
