package io.github.amadeusitgroup.chunkedtransfer;

import java.io.IOException;
import java.util.Arrays;

/**
 * Chunk source over an in-memory payload.
 */
public class ByteArrayChunkSource implements ChunkSource {

    private final byte[] data;

    public ByteArrayChunkSource(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("data must not be null");
        }
        this.data = data;
    }

    @Override
    public long size() {
        return data.length;
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        if (offset < 0 || length < 0 || offset + length > data.length) {
            throw new IOException("Range [" + offset + ", " + (offset + length) + ") outside payload of "
                + data.length + " bytes");
        }
        return Arrays.copyOfRange(data, (int) offset, (int) offset + length);
    }
}
