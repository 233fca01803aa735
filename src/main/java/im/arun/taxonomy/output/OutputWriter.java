package im.arun.taxonomy.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.taxonomy.exception.OutputException;
import im.arun.taxonomy.model.HierarchyColumns;
import im.arun.taxonomy.model.HierarchyEntry;
import im.arun.taxonomy.model.MaterializedPathRow;
import im.arun.taxonomy.tree.TaxonomyTree;
import im.arun.taxonomy.util.TreeUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Persists the hierarchy table, the materialized-path table and the tree.
 * Called only once the QA gate has let the run through.
 */
public class OutputWriter {
    private static final Logger logger = LoggerFactory.getLogger(OutputWriter.class);

    static final List<String> MATERIALIZED_PATH_COLUMNS = List.of(
        "full_path", "excel_row", "concept_name", "preferred_label", "label",
        "group_code", "group_name", "type");

    private final Path outputDir;
    private final ObjectMapper objectMapper;

    public OutputWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Write all three outputs for a run.
     *
     * @return written files: hierarchy CSV, materialized path CSV, tree JSON
     * @throws OutputException when any output fails; outputs already written by this call are removed
     */
    public List<Path> writeAll(String runId,
                               List<HierarchyEntry> hierarchy,
                               List<String> hierarchyColumns,
                               List<MaterializedPathRow> flatRows,
                               List<String> optionalCols,
                               TaxonomyTree tree) {
        createOutputDir();
        Path hierarchyPath = outputDir.resolve("df_hierarchy_" + runId + ".csv");
        Path materializedPath = outputDir.resolve("df_materialized_path_" + runId + ".csv");
        Path treePath = outputDir.resolve("taxonomy_tree_" + runId + ".json");

        List<Path> written = new ArrayList<>(3);
        try {
            writeHierarchyCsv(hierarchy, hierarchyColumns, hierarchyPath);
            written.add(hierarchyPath);
            writeMaterializedPathCsv(flatRows, optionalCols, materializedPath);
            written.add(materializedPath);
            writeTreeJson(tree, treePath);
            written.add(treePath);
        } catch (OutputException e) {
            // the three outputs are published together or not at all
            List<Path> targets = List.of(hierarchyPath, materializedPath, treePath);
            Path failed = targets.get(written.size());
            if (Files.isRegularFile(failed)) {
                written.add(failed);
            }
            written.forEach(path -> deletePartial(path, e));
            throw e;
        }
        return List.copyOf(written);
    }

    public void writeHierarchyCsv(List<HierarchyEntry> hierarchy, List<String> columns, Path path) {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(columns.toArray(new String[0]))
            .build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (HierarchyEntry entry : hierarchy) {
                List<Object> record = new ArrayList<>(columns.size());
                for (String column : columns) {
                    record.add(HierarchyColumns.valueOf(entry, column));
                }
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new OutputException("Failed to write hierarchy table", Map.of("path", path.toString()), e);
        }
        logger.info("Hierarchy table saved: {} rows to {}", hierarchy.size(), path);
    }

    public void writeMaterializedPathCsv(List<MaterializedPathRow> rows, List<String> optionalCols, Path path) {
        List<String> header = new ArrayList<>(MATERIALIZED_PATH_COLUMNS);
        optionalCols.forEach(col -> header.add(TreeUtils.toSnakeCase(col)));

        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(header.toArray(new String[0]))
            .build();
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (MaterializedPathRow row : rows) {
                List<Object> record = new ArrayList<>(header.size());
                record.add(row.getFullPath());
                record.add(row.getExcelRow());
                record.add(row.getConceptName());
                record.add(row.getPreferredLabel());
                record.add(row.getLabel());
                record.add(row.getGroupCode());
                record.add(row.getGroupName());
                record.add(row.getType());
                for (String col : optionalCols) {
                    record.add(row.getAttributes().get(col));
                }
                printer.printRecord(record);
            }
        } catch (IOException e) {
            throw new OutputException("Failed to write materialized path table", Map.of("path", path.toString()), e);
        }
        logger.info("Materialized path table saved: {} rows to {}", rows.size(), path);
    }

    public void writeTreeJson(TaxonomyTree tree, Path path) {
        try {
            objectMapper.writeValue(path.toFile(), tree);
        } catch (IOException e) {
            throw new OutputException("Failed to write taxonomy tree", Map.of("path", path.toString()), e);
        }
        logger.info("Taxonomy tree saved: {} nodes to {}", tree.size(), path);
    }

    private static void deletePartial(Path path, OutputException failure) {
        try {
            Files.deleteIfExists(path);
            logger.warn("Removed {} after a failed output write", path);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private void createOutputDir() {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new OutputException("Failed to create output directory", Map.of("output_dir", outputDir.toString()), e);
        }
    }
}
