package org.carball.cinebot.catalog;

import lombok.extern.slf4j.Slf4j;
import org.carball.cinebot.model.catalog.CatalogRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * One-shot import of the Kaggle IMDb Top 1000 CSV into the SQLite catalog. The table is replaced.
 */
@Slf4j
public class CatalogImporter {

    private static final String CREATE_TABLE = """
        CREATE TABLE movies (
            Series_Title TEXT,
            Released_Year TEXT,
            Genre TEXT,
            IMDB_Rating REAL,
            Overview TEXT,
            Director TEXT,
            Star1 TEXT,
            Star2 TEXT,
            Star3 TEXT,
            Star4 TEXT
        )
    """;

    private static final String INSERT_MOVIE = """
        INSERT INTO movies
            (Series_Title, Released_Year, Genre, IMDB_Rating, Overview, Director, Star1, Star2, Star3, Star4)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
    """;

    private final CatalogLoader loader;

    public CatalogImporter(CatalogLoader loader) {
        this.loader = loader;
    }

    /**
     * @return number of imported movies
     */
    public int importCsv(Path csvFile, Path databaseFile) throws IOException {
        if (!Files.exists(csvFile)) {
            throw new IOException("CSV file not found: " + csvFile);
        }
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        List<CatalogRecord> records = loader.readCsv(csvFile);
        log.info("Read {} movies from {}", records.size(), csvFile);

        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + databaseFile.toAbsolutePath())) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate("DROP TABLE IF EXISTS " + ImdbColumns.TABLE);
                statement.executeUpdate(CREATE_TABLE);
            }

            try (PreparedStatement insert = connection.prepareStatement(INSERT_MOVIE)) {
                for (CatalogRecord record : records) {
                    insert.setString(1, record.getTitle());
                    insert.setString(2, String.valueOf(record.getYear()));
                    insert.setString(3, record.getGenreText());
                    insert.setDouble(4, record.getRating());
                    insert.setString(5, record.getOverview());
                    insert.setString(6, record.getDirector());
                    for (int star = 0; star < ImdbColumns.STARS.size(); star++) {
                        insert.setString(7 + star, star < record.getCast().size() ? record.getCast().get(star) : null);
                    }
                    insert.addBatch();
                }
                insert.executeBatch();
            }
            connection.commit();
        } catch (SQLException e) {
            throw new IOException("Failed to write catalog database " + databaseFile + ": " + e.getMessage(), e);
        }

        log.info("Table '{}' written to {}", ImdbColumns.TABLE, databaseFile);
        return records.size();
    }
}
