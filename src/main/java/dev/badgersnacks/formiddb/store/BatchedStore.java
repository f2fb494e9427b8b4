package dev.badgersnacks.formiddb.store;

import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.RecordRow;
import dev.badgersnacks.formiddb.model.RunHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

/**
 * SQLite persistence for FormID rows: one table per {@link GameRelease}, written in batches.
 *
 * <p>Every SQL identifier comes from {@link GameRelease#tableName()}; plugin names and labels are
 * always bound as parameters.
 */
public class BatchedStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchedStore.class);
    private static final int CACHE_SIZE_KIB = -64000;
    private static final int PAGE_SIZE = 4096;
    private static final int BUSY_TIMEOUT_MS = 30_000;

    /**
     * Opens a writer connection tuned for bulk loads. WAL journaling keeps readers of the same file
     * unblocked while a run is writing.
     */
    public Connection open(Path databasePath) throws SQLException {
        Objects.requireNonNull(databasePath, "databasePath");
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setCacheSize(CACHE_SIZE_KIB);
        config.setPageSize(PAGE_SIZE);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.enforceForeignKeys(false);
        return DriverManager.getConnection(jdbcUrl(databasePath), config.toProperties());
    }

    public void initializeSchema(Path databasePath, GameRelease release) throws SQLException, IOException {
        Objects.requireNonNull(release, "release");
        Path parent = databasePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String table = release.tableName();
        try (Connection connection = open(databasePath);
             Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "plugin TEXT NOT NULL, "
                    + "formid TEXT NOT NULL, "
                    + "entry TEXT NOT NULL)");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_" + table + "_plugin ON " + table + "(plugin)");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_" + table + "_formid ON " + table + "(formid)");
        }
        LOGGER.debug("Schema ready for {} in {}", table, databasePath);
    }

    public void insertBatch(Connection connection, GameRelease release, List<RecordRow> rows) throws SQLException {
        insertBatch(connection, release, rows, null);
    }

    /**
     * Writes {@code rows} with one prepared statement executed as a JDBC batch. In auto-commit mode
     * the batch gets its own transaction; inside a caller's transaction it is fenced by a savepoint.
     * Either way a failed or cancelled batch leaves none of its rows behind.
     */
    public void insertBatch(Connection connection, GameRelease release, List<RecordRow> rows, RunHandle handle)
            throws SQLException {
        if (rows.isEmpty()) {
            return;
        }
        boolean ownsTransaction = connection.getAutoCommit();
        Savepoint savepoint = null;
        if (ownsTransaction) {
            connection.setAutoCommit(false);
        } else {
            savepoint = connection.setSavepoint();
        }
        try (PreparedStatement statement = connection.prepareStatement(insertSql(release))) {
            for (RecordRow row : rows) {
                if (handle != null) {
                    handle.throwIfCancelled();
                }
                statement.setString(1, row.plugin());
                statement.setString(2, row.formId());
                statement.setString(3, row.entry());
                statement.addBatch();
            }
            statement.executeBatch();
            if (ownsTransaction) {
                connection.commit();
            } else {
                connection.releaseSavepoint(savepoint);
            }
        } catch (SQLException | RuntimeException e) {
            rollback(connection, savepoint, e);
            throw e;
        } finally {
            if (ownsTransaction) {
                connection.setAutoCommit(true);
            }
        }
    }

    public void insertRecord(Connection connection, GameRelease release, String plugin, String formId, String entry)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(insertSql(release))) {
            statement.setString(1, plugin);
            statement.setString(2, formId);
            statement.setString(3, entry);
            statement.executeUpdate();
        }
    }

    /**
     * Deletes every row of {@code pluginName}, matching the name without regard to case. Clearing a
     * plugin without rows is a no-op.
     *
     * @return number of rows removed
     */
    public int clearPluginEntries(Connection connection, GameRelease release, String pluginName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "DELETE FROM " + release.tableName() + " WHERE plugin = ? COLLATE NOCASE")) {
            statement.setString(1, pluginName);
            int removed = statement.executeUpdate();
            LOGGER.debug("Cleared {} rows for {} from {}", removed, pluginName, release.tableName());
            return removed;
        }
    }

    /**
     * Rebuilds the file to reclaim space. Must run outside a transaction.
     */
    public void optimize(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("VACUUM");
        }
    }

    public long countRows(Connection connection, GameRelease release) throws SQLException {
        try (Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM " + release.tableName())) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    public long countRows(Connection connection, GameRelease release, String pluginName) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COUNT(*) FROM " + release.tableName() + " WHERE plugin = ?")) {
            statement.setString(1, pluginName);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    static String jdbcUrl(Path databasePath) {
        return "jdbc:sqlite:" + databasePath.toAbsolutePath();
    }

    private static String insertSql(GameRelease release) {
        return "INSERT INTO " + release.tableName() + " (plugin, formid, entry) VALUES (?, ?, ?)";
    }

    private static void rollback(Connection connection, Savepoint savepoint, Exception cause) {
        try {
            if (savepoint == null) {
                connection.rollback();
            } else {
                connection.rollback(savepoint);
            }
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }
}
