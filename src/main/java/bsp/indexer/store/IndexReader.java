package bsp.indexer.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import bsp.indexer.model.FileFormat;
import bsp.indexer.model.FileRecord;
import bsp.indexer.model.IndexCounters;
import bsp.indexer.model.SymbolKind;

/**
 * Read-only queries over a finished snapshot.
 * <p>
 * Symbol search goes through the FTS5 table (prefix match) unless the query contains path
 * or identifier punctuation ({@code / - . @}), which the FTS tokenizer splits on; those
 * queries fall back to LIKE over name, value and file path.
 */
public final class IndexReader {

    private static final Pattern SPECIAL_CHARS = Pattern.compile("[/\\-.@]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w]");

    private static final String SYMBOL_COLUMNS =
            "SELECT s.id, s.name, s.value, s.type, f.path, s.line FROM symbols s JOIN files f ON s.file_id = f.id ";

    private static final String NODE_COLUMNS =
            "SELECT n.id, f.path, n.path, n.name, n.label, n.address, n.parent_id, n.start_line, n.end_line"
                    + " FROM dt_nodes n JOIN files f ON n.file_id = f.id ";

    private final Connection conn;

    public IndexReader(IndexStore store) {
        this.conn = Objects.requireNonNull(store, "store").connection();
    }

    public List<SymbolHit> searchSymbols(String query, int limit) throws SQLException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final String q = query.trim();
        final String ftsTerm = NON_WORD.matcher(q).replaceAll("");

        if (SPECIAL_CHARS.matcher(q).find() || ftsTerm.isEmpty()) {
            final String like = "%" + escapeLike(q) + "%";
            return querySymbols(SYMBOL_COLUMNS
                            + "WHERE s.name LIKE ? ESCAPE '\\' OR s.value LIKE ? ESCAPE '\\' OR f.path LIKE ? ESCAPE '\\' "
                            + "ORDER BY CASE WHEN s.name = ? THEN 0 WHEN s.name LIKE ? ESCAPE '\\' THEN 1"
                            + " WHEN f.path LIKE ? ESCAPE '\\' THEN 2 ELSE 3 END, length(s.name) LIMIT ?",
                    like, like, like, q, escapeLike(q) + "%", like, limit);
        }

        return querySymbols(SYMBOL_COLUMNS
                        + "WHERE s.id IN (SELECT rowid FROM symbols_fts WHERE symbols_fts MATCH ?) "
                        + "ORDER BY CASE WHEN s.name = ? THEN 0 ELSE 1 END, length(s.name) LIMIT ?",
                ftsTerm + "*", q, limit);
    }

    public Optional<SymbolHit> findSymbol(String name) throws SQLException {
        final List<SymbolHit> hits = querySymbols(SYMBOL_COLUMNS + "WHERE s.name = ? ORDER BY s.id LIMIT 1", name);
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }

    public List<FileRecord> searchFiles(String query, int limit) throws SQLException {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        final String q = query.trim();
        final String like = "%" + escapeLike(q) + "%";
        return queryFiles("SELECT path, name, type, size, mtime FROM files "
                        + "WHERE path LIKE ? ESCAPE '\\' OR name LIKE ? ESCAPE '\\' "
                        + "ORDER BY CASE WHEN path = ? THEN 0 WHEN name = ? THEN 1"
                        + " WHEN name LIKE ? ESCAPE '\\' THEN 2 ELSE 3 END,"
                        + " length(path) LIMIT ?",
                like, like, q, q, escapeLike(q) + "%", limit);
    }

    /**
     * Every symbol row for {@code name}: the definition itself (label, define, variable) and
     * each {@code &name} reference. Definitions come first, then file path and line order.
     * A leading {@code &} in {@code name} is ignored.
     */
    public List<SymbolHit> findAllReferences(String name, int limit) throws SQLException {
        if (name == null || name.isBlank()) {
            return List.of();
        }
        final String bare = name.trim().startsWith("&") ? name.trim().substring(1) : name.trim();
        return querySymbols(SYMBOL_COLUMNS
                        + "WHERE s.name = ? OR (s.type = ? AND s.value = ?) "
                        + "ORDER BY CASE WHEN s.type = ? THEN 1 ELSE 0 END, f.path, s.line LIMIT ?",
                bare, SymbolKind.LABEL_REFERENCE.id(), bare, SymbolKind.LABEL_REFERENCE.id(), limit);
    }

    public Optional<FileRecord> findFile(String path) throws SQLException {
        final List<FileRecord> files = queryFiles(
                "SELECT path, name, type, size, mtime FROM files WHERE path = ? LIMIT 1", path);
        return files.isEmpty() ? Optional.empty() : Optional.of(files.get(0));
    }

    /**
     * Files whose include edges point at {@code filePath}, matched either exactly or by
     * trailing file name, since edges are stored unresolved.
     */
    public List<String> filesIncluding(String filePath) throws SQLException {
        final int slash = filePath.lastIndexOf('/');
        final String fileName = slash >= 0 ? filePath.substring(slash + 1) : filePath;
        final List<String> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT DISTINCT f.path FROM includes i JOIN files f ON i.from_file_id = f.id "
                        + "WHERE i.to_path = ? OR i.to_path = ? OR i.to_path LIKE ? ESCAPE '\\' ORDER BY f.path")) {
            bind(ps, filePath, fileName, "%/" + escapeLike(fileName));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    public List<IncludeRecord> includesOf(String filePath) throws SQLException {
        final List<IncludeRecord> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT f.path, i.to_path, i.type, i.line FROM includes i JOIN files f ON i.from_file_id = f.id "
                        + "WHERE f.path = ? ORDER BY i.line, i.id")) {
            bind(ps, filePath);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new IncludeRecord(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4)));
                }
            }
        }
        return out;
    }

    public Optional<TreeNodeRecord> findTreeNodeByLabel(String label) throws SQLException {
        final List<TreeNodeRecord> nodes = queryNodes(NODE_COLUMNS + "WHERE n.label = ? ORDER BY n.id LIMIT 1", label);
        return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
    }

    public List<TreeNodeRecord> findTreeNodesByPath(String nodePath) throws SQLException {
        return queryNodes(NODE_COLUMNS + "WHERE n.path = ? ORDER BY f.path, n.start_line", nodePath);
    }

    /**
     * Labelled nodes whose label or node name starts with {@code prefix}; label matches first.
     */
    public List<TreeNodeRecord> searchDtNodes(String prefix, int limit) throws SQLException {
        if (prefix == null || prefix.isBlank()) {
            return List.of();
        }
        final String like = escapeLike(prefix.trim()) + "%";
        return queryNodes(NODE_COLUMNS
                        + "WHERE n.label IS NOT NULL AND (n.label LIKE ? ESCAPE '\\' OR n.name LIKE ? ESCAPE '\\') "
                        + "ORDER BY CASE WHEN n.label LIKE ? ESCAPE '\\' THEN 0 ELSE 1 END, length(n.label), n.id LIMIT ?",
                like, like, like, limit);
    }

    public List<TreeNodeRecord> childrenOf(long nodeId) throws SQLException {
        return queryNodes(NODE_COLUMNS + "WHERE n.parent_id = ? ORDER BY n.start_line", nodeId);
    }

    public List<TreePropertyRecord> propertiesOf(long nodeId) throws SQLException {
        final List<TreePropertyRecord> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT node_id, name, value, line FROM dt_properties WHERE node_id = ? ORDER BY line, id")) {
            bind(ps, nodeId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TreePropertyRecord(rs.getLong(1), rs.getString(2), rs.getString(3), rs.getInt(4)));
                }
            }
        }
        return out;
    }

    /**
     * Nodes that define {@code label} first, then nodes owning a property that references
     * {@code &label} exactly (through the stored label-reference symbols). One entry per
     * file and start line.
     */
    public List<TreeNodeRecord> findLabelReferences(String label, int limit) throws SQLException {
        final Map<String, TreeNodeRecord> merged = new LinkedHashMap<>();
        for (TreeNodeRecord n : queryNodes(NODE_COLUMNS + "WHERE n.label = ? ORDER BY f.path, n.start_line", label)) {
            merged.putIfAbsent(n.filePath() + ":" + n.startLine(), n);
        }
        final List<TreeNodeRecord> refs = queryNodes(
                "SELECT DISTINCT n.id, f.path, n.path, n.name, n.label, n.address, n.parent_id, n.start_line, n.end_line"
                        + " FROM symbols s"
                        + " JOIN dt_nodes n ON n.file_id = s.file_id"
                        + " JOIN dt_properties p ON p.node_id = n.id AND p.line = s.line"
                        + " JOIN files f ON n.file_id = f.id"
                        + " WHERE s.type = ? AND s.value = ? ORDER BY f.path, n.start_line LIMIT ?",
                SymbolKind.LABEL_REFERENCE.id(), label, limit);
        for (TreeNodeRecord n : refs) {
            if (merged.size() >= limit) {
                break;
            }
            merged.putIfAbsent(n.filePath() + ":" + n.startLine(), n);
        }
        return new ArrayList<>(merged.values());
    }

    public Optional<String> metadata(String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT value FROM metadata WHERE key = ?")) {
            bind(ps, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        }
    }

    /**
     * Row counts of the snapshot; {@code skipped} is always 0 since skips are not stored.
     */
    public IndexCounters counts() throws SQLException {
        try (Statement st = conn.createStatement()) {
            return new IndexCounters(
                    count(st, "files"),
                    count(st, "symbols"),
                    count(st, "includes"),
                    count(st, "dt_nodes"),
                    count(st, "dt_properties"),
                    0);
        }
    }

    private static long count(Statement st, String table) throws SQLException {
        try (ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private List<SymbolHit> querySymbols(String sql, Object... args) throws SQLException {
        final List<SymbolHit> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SymbolHit(
                            rs.getLong(1), rs.getString(2), rs.getString(3),
                            rs.getString(4), rs.getString(5), rs.getInt(6)));
                }
            }
        }
        return out;
    }

    private List<FileRecord> queryFiles(String sql, Object... args) throws SQLException {
        final List<FileRecord> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FileRecord(
                            rs.getString(1), rs.getString(2), FileFormat.fromId(rs.getString(3)),
                            rs.getLong(4), rs.getLong(5)));
                }
            }
        }
        return out;
    }

    private List<TreeNodeRecord> queryNodes(String sql, Object... args) throws SQLException {
        final List<TreeNodeRecord> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    final long parent = rs.getLong(7);
                    final Long parentId = rs.wasNull() ? null : parent;
                    out.add(new TreeNodeRecord(
                            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4),
                            rs.getString(5), rs.getString(6), parentId, rs.getInt(8), rs.getInt(9)));
                }
            }
        }
        return out;
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            ps.setObject(i + 1, args[i]);
        }
    }
}
