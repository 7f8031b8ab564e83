package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Receives health transitions of a transfer across the minimum score.
 */
public interface HealthListener {

    void onHealthDegraded(HealthSnapshot snapshot);

    void onHealthRecovered(HealthSnapshot snapshot);

    /**
     * Called on every evaluation tick.
     */
    default void onHealthCheck(HealthSnapshot snapshot) {
    }
}
