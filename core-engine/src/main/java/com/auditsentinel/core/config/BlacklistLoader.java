package com.auditsentinel.core.config;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the denylist CSV files named by {@link AnalysisConfig.BlacklistSources}.
 *
 * <h3>File format</h3>
 * <p>
 * Header row required. The value column is {@value #APPLICATION_COLUMN},
 * {@value #COUNTRY_COLUMN} or {@value #USER_AGENT_COLUMN}; an optional
 * {@value #REASON_COLUMN} column explains the listing. Rows with a blank
 * value are skipped.
 * </p>
 *
 * <h3>Missing files</h3>
 * <p>
 * A list whose location is blank, or names neither a file nor a classpath
 * resource, is logged and treated as empty. A file that exists but cannot
 * be parsed fails the load.
 * </p>
 *
 * @since 1.0.0
 */
public final class BlacklistLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BlacklistLoader.class);

    public static final String APPLICATION_COLUMN = "AppDisplayName";
    public static final String COUNTRY_COLUMN = "Country";
    public static final String USER_AGENT_COLUMN = "UserAgent";
    public static final String REASON_COLUMN = "Reason";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private BlacklistLoader() {
        // utility class
    }

    /**
     * Load all three denylists.
     *
     * @param sources file locations; must not be {@code null}
     * @return immutable blacklists
     * @throws IllegalStateException if an existing file cannot be read
     */
    public static Blacklists load(AnalysisConfig.BlacklistSources sources) {
        Objects.requireNonNull(sources, "Blacklist sources must not be null");
        Blacklists blacklists = new Blacklists(
                loadList("application", sources.getApplications(), APPLICATION_COLUMN),
                loadList("country", sources.getCountries(), COUNTRY_COLUMN),
                loadList("user agent", sources.getUserAgents(), USER_AGENT_COLUMN));
        LOG.info("Loaded {}", blacklists);
        return blacklists;
    }

    /**
     * Parse one denylist from a stream.
     *
     * @param is          CSV content with a header row
     * @param valueColumn name of the column holding the listed value
     * @return entries in file order
     * @throws IOException if the content is not valid CSV
     */
    public static List<BlacklistEntry> parse(InputStream is, String valueColumn) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<BlacklistEntry> entries = new ArrayList<>();
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER.readerForMapOf(String.class)
                .with(schema)
                .readValues(is)) {
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                String value = row.get(valueColumn);
                if (value == null || value.isBlank()) {
                    continue;
                }
                String reason = row.get(REASON_COLUMN);
                entries.add(new BlacklistEntry(value.trim(),
                        reason == null || reason.isBlank() ? null : reason.trim()));
            }
        }
        return entries;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static List<BlacklistEntry> loadList(String name, String location, String valueColumn) {
        if (location == null || location.isBlank()) {
            LOG.warn("No {} blacklist configured; treating as empty", name);
            return List.of();
        }
        try (InputStream is = open(location)) {
            if (is == null) {
                LOG.warn("{} blacklist not found at '{}'; treating as empty", name, location);
                return List.of();
            }
            List<BlacklistEntry> entries = parse(is, valueColumn);
            LOG.info("Loaded {} blacklist: {} entries", name, entries.size());
            return entries;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + name + " blacklist: " + location, e);
        }
    }

    private static InputStream open(String location) throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return Files.newInputStream(path);
        }
        return BlacklistLoader.class.getClassLoader().getResourceAsStream(location);
    }
}
