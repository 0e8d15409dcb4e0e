package bsp.indexer.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SQLite index file: schema, FTS5 search table and its sync triggers, metadata.
 * <p>
 * {@link #create(Path)} always starts from an empty snapshot: any previous database at the
 * same location (including WAL side files) is removed first.
 */
public final class IndexStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IndexStore.class);

    public static final String INDEXER_VERSION = "2.0-server";

    private static final List<String> PRAGMAS = List.of(
            "PRAGMA journal_mode = WAL",
            "PRAGMA synchronous = NORMAL",
            "PRAGMA cache_size = -64000",
            "PRAGMA foreign_keys = ON"
    );

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS files (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                path TEXT NOT NULL UNIQUE,
                name TEXT NOT NULL,
                type TEXT NOT NULL,
                size INTEGER,
                mtime INTEGER
            )""",
            "CREATE INDEX IF NOT EXISTS idx_files_path ON files(path)",
            "CREATE INDEX IF NOT EXISTS idx_files_type ON files(type)",
            """
            CREATE TABLE IF NOT EXISTS symbols (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL,
                value TEXT,
                type TEXT NOT NULL,
                file_id INTEGER REFERENCES files(id) ON DELETE CASCADE,
                line INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_symbols_name ON symbols(name)",
            "CREATE INDEX IF NOT EXISTS idx_symbols_file ON symbols(file_id)",
            """
            CREATE TABLE IF NOT EXISTS includes (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                from_file_id INTEGER REFERENCES files(id) ON DELETE CASCADE,
                to_path TEXT NOT NULL,
                type TEXT NOT NULL,
                line INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_includes_from ON includes(from_file_id)",
            "CREATE INDEX IF NOT EXISTS idx_includes_to ON includes(to_path)",
            """
            CREATE TABLE IF NOT EXISTS dt_nodes (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                file_id INTEGER REFERENCES files(id) ON DELETE CASCADE,
                path TEXT NOT NULL,
                name TEXT NOT NULL,
                label TEXT,
                address TEXT,
                parent_id INTEGER,
                start_line INTEGER NOT NULL,
                end_line INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_dt_nodes_path ON dt_nodes(path)",
            "CREATE INDEX IF NOT EXISTS idx_dt_nodes_label ON dt_nodes(label)",
            "CREATE INDEX IF NOT EXISTS idx_dt_nodes_file ON dt_nodes(file_id)",
            """
            CREATE TABLE IF NOT EXISTS dt_properties (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                node_id INTEGER REFERENCES dt_nodes(id) ON DELETE CASCADE,
                name TEXT NOT NULL,
                value TEXT,
                line INTEGER NOT NULL
            )""",
            "CREATE INDEX IF NOT EXISTS idx_dt_props_node ON dt_properties(node_id)",
            "CREATE INDEX IF NOT EXISTS idx_dt_props_name ON dt_properties(name)",
            """
            CREATE TABLE IF NOT EXISTS metadata (
                key TEXT PRIMARY KEY,
                value TEXT
            )""",
            """
            CREATE VIRTUAL TABLE IF NOT EXISTS symbols_fts USING fts5(
                name, value, content='symbols', content_rowid='id'
            )""",
            """
            CREATE TRIGGER IF NOT EXISTS symbols_ai AFTER INSERT ON symbols BEGIN
                INSERT INTO symbols_fts(rowid, name, value) VALUES (new.id, new.name, new.value);
            END""",
            """
            CREATE TRIGGER IF NOT EXISTS symbols_ad AFTER DELETE ON symbols BEGIN
                INSERT INTO symbols_fts(symbols_fts, rowid, name, value) VALUES ('delete', old.id, old.name, old.value);
            END"""
    );

    private final Path location;
    private final Connection connection;

    private IndexStore(Path location, Connection connection) {
        this.location = location;
        this.connection = connection;
    }

    /**
     * Deletes any snapshot at {@code location} and creates an empty one.
     *
     * @throws IOException if the old file cannot be removed or the database cannot be created
     */
    public static IndexStore create(Path location) throws IOException {
        Objects.requireNonNull(location, "location");
        final Path db = location.toAbsolutePath().normalize();

        for (String suffix : List.of("", "-wal", "-shm", "-journal")) {
            Files.deleteIfExists(db.resolveSibling(db.getFileName() + suffix));
        }

        Connection conn = null;
        try {
            conn = connect(db);
            try (Statement st = conn.createStatement()) {
                for (String pragma : PRAGMAS) {
                    st.execute(pragma);
                }
                for (String ddl : SCHEMA) {
                    st.executeUpdate(ddl);
                }
            }
            log.debug("Created index store at {}", db);
            return new IndexStore(db, conn);
        } catch (SQLException ex) {
            closeAfterFailure(conn, ex);
            throw new IOException("Cannot create index store at " + db + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Opens an existing snapshot, e.g. for {@link IndexReader}.
     */
    public static IndexStore open(Path location) throws IOException {
        Objects.requireNonNull(location, "location");
        final Path db = location.toAbsolutePath().normalize();
        if (!Files.isRegularFile(db)) {
            throw new IOException("Index store not found: " + db);
        }
        Connection conn = null;
        try {
            conn = connect(db);
            try (Statement st = conn.createStatement()) {
                st.execute("PRAGMA foreign_keys = ON");
            }
            return new IndexStore(db, conn);
        } catch (SQLException ex) {
            closeAfterFailure(conn, ex);
            throw new IOException("Cannot open index store at " + db + ": " + ex.getMessage(), ex);
        }
    }

    public Path location() {
        return location;
    }

    public Connection connection() {
        return connection;
    }

    /**
     * Inserts or replaces metadata entries in one transaction.
     */
    public void writeMetadata(Map<String, String> entries) throws SQLException {
        Objects.requireNonNull(entries, "entries");
        final boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR REPLACE INTO metadata (key, value) VALUES (?, ?)")) {
            for (var e : entries.entrySet()) {
                ps.setString(1, e.getKey());
                ps.setString(2, e.getValue());
                ps.addBatch();
            }
            ps.executeBatch();
            connection.commit();
        } catch (SQLException | RuntimeException ex) {
            rollback(connection, ex);
            throw ex;
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private static Connection connect(Path db) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + db);
    }

    private static void closeAfterFailure(Connection conn, SQLException cause) {
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }
}
