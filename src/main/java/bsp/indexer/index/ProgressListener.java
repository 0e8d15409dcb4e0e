package bsp.indexer.index;

/**
 * Receives the number of files processed so far after each batch is committed.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (processed, total) -> { };

    void onProgress(int processed, int total);
}
