package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;

/**
 * Random access view over an upload payload.
 */
public interface ChunkSource {

    long size() throws IOException;

    /**
     * Read exactly {@code length} bytes starting at {@code offset}.
     */
    byte[] read(long offset, int length) throws IOException;
}
