package com.auditsentinel.worker.pipeline;

import com.auditsentinel.core.model.AuditRecord;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Reads the files an extractor wrote for one extraction.
 *
 * <h3>Lookup</h3>
 * <p>
 * For each configured base directory in order, {@code <base>/<extractionId>}
 * is scanned for {@code .json} and {@code .csv} files, read in name order.
 * A JSON array contributes each element, a JSON object contributes itself;
 * CSV files contribute one record per row keyed by the header. The first
 * directory from which at least one file could be read wins. A directory
 * that cannot be listed, or a file that cannot be read, is logged and skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class ExtractionOutputDataSource implements AuditDataSource {

    private static final Logger LOG = LoggerFactory.getLogger(ExtractionOutputDataSource.class);

    public static final List<Path> DEFAULT_BASE_DIRECTORIES = List.of(
            Path.of("/output"),
            Path.of("/extractor_output"),
            Path.of("/app/output"),
            Path.of("/shared/output"));

    static final String NO_DATA_MESSAGE = "No extraction data found. Please ensure the extraction "
            + "completed successfully and data is available.";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final List<Path> baseDirectories;
    private final ObjectMapper mapper;

    public ExtractionOutputDataSource(List<Path> baseDirectories, ObjectMapper mapper) {
        this.baseDirectories = List.copyOf(Objects.requireNonNull(baseDirectories, "baseDirectories must not be null"));
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<AuditRecord> load(String extractionId) throws AuditDataException {
        Objects.requireNonNull(extractionId, "extractionId must not be null");
        for (Path base : baseDirectories) {
            Path dir = base.resolve(extractionId);
            if (!Files.isDirectory(dir)) {
                LOG.debug("Path does not exist: {}", dir);
                continue;
            }
            List<Path> files;
            try {
                files = dataFiles(dir);
            } catch (IOException e) {
                LOG.error("Failed to list {}: {}", dir, e.getMessage());
                continue;
            }
            LOG.info("Found {} data file(s) in {}", files.size(), dir);

            List<AuditRecord> records = new ArrayList<>();
            boolean found = false;
            for (Path file : files) {
                try {
                    List<AuditRecord> loaded = isJson(file) ? readJson(file) : readCsv(file);
                    records.addAll(loaded);
                    found = true;
                    LOG.info("Loaded {} record(s) from {}", loaded.size(), file.getFileName());
                } catch (IOException | IllegalArgumentException e) {
                    LOG.error("Error reading file {}: {}", file, e.getMessage());
                }
            }
            if (found) {
                return records;
            }
        }
        throw new AuditDataException(NO_DATA_MESSAGE);
    }

    public List<Path> getBaseDirectories() {
        return baseDirectories;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    List<Path> dataFiles(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> isJson(p) || isCsv(p))
                    .sorted()
                    .toList();
        }
    }

    private List<AuditRecord> readJson(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        List<AuditRecord> records = new ArrayList<>();
        if (root == null || root.isMissingNode()) {
            return records;
        }
        if (root.isArray()) {
            for (JsonNode element : root) {
                records.add(toRecord(element));
            }
        } else {
            records.add(toRecord(root));
        }
        return records;
    }

    private AuditRecord toRecord(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Expected a JSON object, got " + node.getNodeType());
        }
        return mapper.convertValue(node, AuditRecord.class);
    }

    private static List<AuditRecord> readCsv(Path file) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<AuditRecord> records = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER.readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            while (rows.hasNextValue()) {
                records.add(new AuditRecord(rows.nextValue()));
            }
        }
        return records;
    }

    private static boolean isJson(Path file) {
        return file.getFileName().toString().endsWith(".json");
    }

    private static boolean isCsv(Path file) {
        return file.getFileName().toString().endsWith(".csv");
    }
}
