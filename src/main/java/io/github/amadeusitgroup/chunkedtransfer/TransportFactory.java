package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;

/**
 * Creates the transport behind a pool entry.
 */
@FunctionalInterface
public interface TransportFactory {

    /**
     * @param endpointKey normalized endpoint, e.g. {@code https://files.example.com}
     */
    Transport create(String endpointKey) throws IOException;
}
