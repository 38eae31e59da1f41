package org.carball.cinebot.catalog;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvException;
import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.model.catalog.CatalogRecord;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads the IMDb Top 1000 dataset, either from the SQLite database built by the import command or
 * straight from the Kaggle CSV file.
 */
@Slf4j
public class CatalogLoader {

    private static final String SELECT_MOVIES = """
        SELECT
            Series_Title,
            Released_Year,
            COALESCE(Genre, '') AS Genre,
            IMDB_Rating,
            COALESCE(Overview, '') AS Overview,
            COALESCE(Director, '') AS Director,
            COALESCE(Star1, '') AS Star1,
            COALESCE(Star2, '') AS Star2,
            COALESCE(Star3, '') AS Star3,
            COALESCE(Star4, '') AS Star4
        FROM movies
        ORDER BY rowid
    """;

    /**
     * Opens the catalog at the given path. A missing file yields an empty catalog so that the
     * assistant still runs, with every catalog tool answering "not found".
     */
    public CatalogStore load(Path path) {
        if (!Files.exists(path)) {
            log.warn("Catalog file not found: {}. Catalog tools will have no data, run the import command first", path);
            return InMemoryCatalogStore.empty();
        }

        List<CatalogRecord> records = isCsv(path) ? readCsv(path) : readSqlite(path);
        log.info("Loaded {} movies from {}", records.size(), path);
        return new InMemoryCatalogStore(records);
    }

    public List<CatalogRecord> readSqlite(Path databaseFile) {
        List<CatalogRecord> records = new ArrayList<>();

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath());
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(SELECT_MOVIES)) {

            while (rs.next()) {
                Map<String, String> row = new HashMap<>();
                for (String column : ImdbColumns.ALL) {
                    row.put(column, rs.getString(column));
                }
                toRecord(row).ifPresent(records::add);
            }
        } catch (SQLException e) {
            throw new CatalogLoadException("Failed to read catalog database " + databaseFile + ": " + e.getMessage(), e);
        }

        return records;
    }

    public List<CatalogRecord> readCsv(Path csvFile) {
        List<String[]> lines;
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReader(reader)) {
            lines = csvReader.readAll();
        } catch (IOException | CsvException e) {
            throw new CatalogLoadException("Failed to read catalog CSV " + csvFile + ": " + e.getMessage(), e);
        }

        if (lines.isEmpty()) {
            return List.of();
        }

        String[] header = lines.get(0);
        Map<String, Integer> columnIndex = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            columnIndex.put(header[i].trim(), i);
        }
        if (!columnIndex.containsKey(ImdbColumns.TITLE)) {
            throw new CatalogLoadException("CSV file " + csvFile + " has no " + ImdbColumns.TITLE + " column", null);
        }

        List<CatalogRecord> records = new ArrayList<>();
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String[] line = lines.get(lineNo);
            Map<String, String> row = new HashMap<>();
            for (String column : ImdbColumns.ALL) {
                Integer index = columnIndex.get(column);
                row.put(column, index != null && index < line.length ? line[index] : null);
            }
            toRecord(row).ifPresent(records::add);
        }
        return records;
    }

    private Optional<CatalogRecord> toRecord(Map<String, String> row) {
        String title = trimToEmpty(row.get(ImdbColumns.TITLE));
        if (title.isEmpty()) {
            log.debug("Skipping catalog row without a title");
            return Optional.empty();
        }

        CatalogRecord.CatalogRecordBuilder builder = CatalogRecord.builder()
                .title(title)
                .year(parseYear(row.get(ImdbColumns.YEAR), title))
                .rating(parseRating(row.get(ImdbColumns.RATING), title))
                .director(trimToEmpty(row.get(ImdbColumns.DIRECTOR)))
                .overview(trimToEmpty(row.get(ImdbColumns.OVERVIEW)));

        for (String genre : trimToEmpty(row.get(ImdbColumns.GENRE)).split(",")) {
            if (!genre.isBlank()) {
                builder.genre(genre.trim());
            }
        }
        for (String star : ImdbColumns.STARS) {
            String member = trimToEmpty(row.get(star));
            if (!member.isEmpty()) {
                builder.castMember(member);
            }
        }
        return Optional.of(builder.build());
    }

    private static int parseYear(String value, String title) {
        try {
            return Integer.parseInt(trimToEmpty(value));
        } catch (NumberFormatException e) {
            // The Kaggle file has a few rows with a certificate in the year column
            log.debug("Invalid year '{}' for {}, using 0", value, title);
            return 0;
        }
    }

    private static double parseRating(String value, String title) {
        try {
            return Double.parseDouble(trimToEmpty(value));
        } catch (NumberFormatException e) {
            log.debug("Invalid rating '{}' for {}, using 0", value, title);
            return 0.0;
        }
    }

    private static String trimToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isCsv(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv");
    }
}
