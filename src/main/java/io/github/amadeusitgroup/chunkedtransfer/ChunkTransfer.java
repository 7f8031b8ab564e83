package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;

/**
 * Moves the bytes of one chunk over a transport. Called once per attempt.
 */
@FunctionalInterface
public interface ChunkTransfer {
    ChunkPayload transfer(ChunkDescriptor chunk, CancellationToken token) throws IOException;
}
