package bsp.indexer.index;

import java.sql.SQLException;
import java.util.List;

import bsp.indexer.model.FileFacts;
import bsp.indexer.model.IndexCounters;

/**
 * Persists one batch of parsed files; {@code StoreWriter::writeBatch} in production.
 */
@FunctionalInterface
public interface BatchSink {

    IndexCounters write(List<FileFacts> batch) throws SQLException;
}
