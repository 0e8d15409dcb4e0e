package bsp.indexer.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import bsp.indexer.model.FileFacts;
import bsp.indexer.model.IncludeFact;
import bsp.indexer.model.IndexCounters;
import bsp.indexer.model.SymbolFact;
import bsp.indexer.model.TreeNodeFact;
import bsp.indexer.model.TreePropertyFact;

/**
 * Persists parsed files, one transaction per batch.
 * <p>
 * Device-tree node ids are resolved through a path map scoped to a single file: paths are
 * only unique inside one file's tree. When a path repeats (override blocks), the most
 * recently inserted node wins, both for property attribution and for {@code parent_id}.
 */
public final class StoreWriter {

    private static final String INSERT_FILE =
            "INSERT OR REPLACE INTO files (path, name, type, size, mtime) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_SYMBOL =
            "INSERT INTO symbols (name, value, type, file_id, line) VALUES (?, ?, ?, ?, ?)";
    private static final String INSERT_INCLUDE =
            "INSERT INTO includes (from_file_id, to_path, type, line) VALUES (?, ?, ?, ?)";
    private static final String INSERT_NODE =
            "INSERT INTO dt_nodes (file_id, path, name, label, address, parent_id, start_line, end_line)"
                    + " VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String INSERT_PROPERTY =
            "INSERT INTO dt_properties (node_id, name, value, line) VALUES (?, ?, ?, ?)";

    private final Connection conn;

    public StoreWriter(IndexStore store) {
        this.conn = Objects.requireNonNull(store, "store").connection();
    }

    /**
     * Writes all files of a batch and commits once.
     *
     * @return counts of the rows committed by this call
     * @throws SQLException if any insert or the commit fails; the batch is rolled back.
     *                      Runtime failures roll back the batch too before propagating
     */
    public IndexCounters writeBatch(List<FileFacts> batch) throws SQLException {
        Objects.requireNonNull(batch, "batch");
        if (batch.isEmpty()) {
            return IndexCounters.ZERO;
        }

        final boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (PreparedStatement insFile = conn.prepareStatement(INSERT_FILE);
             PreparedStatement insSymbol = conn.prepareStatement(INSERT_SYMBOL);
             PreparedStatement insInclude = conn.prepareStatement(INSERT_INCLUDE);
             PreparedStatement insNode = conn.prepareStatement(INSERT_NODE);
             PreparedStatement insProperty = conn.prepareStatement(INSERT_PROPERTY);
             PreparedStatement lastId = conn.prepareStatement("SELECT last_insert_rowid()")) {

            long files = 0;
            long symbols = 0;
            long includes = 0;
            long nodes = 0;
            long properties = 0;

            for (FileFacts ff : batch) {
                final var file = ff.file();
                insFile.setString(1, file.path());
                insFile.setString(2, file.name());
                insFile.setString(3, file.format().id());
                insFile.setLong(4, file.size());
                insFile.setLong(5, file.mtime());
                insFile.executeUpdate();
                final long fileId = lastInsertId(lastId);
                files++;

                for (SymbolFact s : ff.symbols()) {
                    insSymbol.setString(1, s.name());
                    insSymbol.setString(2, s.value());
                    insSymbol.setString(3, s.kind().id());
                    insSymbol.setLong(4, fileId);
                    insSymbol.setInt(5, s.line());
                    insSymbol.addBatch();
                }
                if (!ff.symbols().isEmpty()) {
                    insSymbol.executeBatch();
                    symbols += ff.symbols().size();
                }

                for (IncludeFact inc : ff.includes()) {
                    insInclude.setLong(1, fileId);
                    insInclude.setString(2, inc.toPath());
                    insInclude.setString(3, inc.kind().id());
                    insInclude.setInt(4, inc.line());
                    insInclude.addBatch();
                }
                if (!ff.includes().isEmpty()) {
                    insInclude.executeBatch();
                    includes += ff.includes().size();
                }

                final Map<String, Long> nodeIds = new HashMap<>();
                for (TreeNodeFact n : ff.treeNodes()) {
                    final Long parentId = n.parentPath() != null ? nodeIds.get(n.parentPath()) : null;
                    insNode.setLong(1, fileId);
                    insNode.setString(2, n.path());
                    insNode.setString(3, n.name());
                    insNode.setString(4, n.label());
                    insNode.setString(5, n.address());
                    if (parentId != null) {
                        insNode.setLong(6, parentId);
                    } else {
                        insNode.setNull(6, Types.INTEGER);
                    }
                    insNode.setInt(7, n.startLine());
                    insNode.setInt(8, n.endLine());
                    insNode.executeUpdate();
                    nodeIds.put(n.path(), lastInsertId(lastId));
                    nodes++;
                }

                int pending = 0;
                for (TreePropertyFact p : ff.treeProperties()) {
                    final Long nodeId = nodeIds.get(p.nodePath());
                    if (nodeId == null) {
                        continue;
                    }
                    insProperty.setLong(1, nodeId);
                    insProperty.setString(2, p.name());
                    insProperty.setString(3, p.value());
                    insProperty.setInt(4, p.line());
                    insProperty.addBatch();
                    pending++;
                }
                if (pending > 0) {
                    insProperty.executeBatch();
                    properties += pending;
                }
            }

            conn.commit();
            return new IndexCounters(files, symbols, includes, nodes, properties, 0);

        } catch (SQLException | RuntimeException ex) {
            // restoring auto-commit below would otherwise commit the partial batch
            IndexStore.rollback(conn, ex);
            throw ex;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private static long lastInsertId(PreparedStatement lastId) throws SQLException {
        try (ResultSet rs = lastId.executeQuery()) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }
}
