package bsp.indexer.index;

/**
 * Fatal indexing failure: a batch could not be committed, or the run was interrupted.
 * Batches committed before the failure stay in the store; the snapshot is incomplete.
 */
public final class IndexingException extends Exception {

    private final int batchNumber;

    public IndexingException(String message, int batchNumber, Throwable cause) {
        super(message, cause);
        this.batchNumber = batchNumber;
    }

    /** 1-based number of the batch that failed. */
    public int batchNumber() {
        return batchNumber;
    }
}
