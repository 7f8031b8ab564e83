package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Progress callback exposed to callers.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(long loaded, long total, double percent);

    /**
     * Full snapshot, for listeners that want speed, ETA and chunk counts.
     */
    default void onSnapshot(TransferProgress progress) {
    }
}
