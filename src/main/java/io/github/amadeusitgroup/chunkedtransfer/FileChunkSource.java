package io.github.amadeusitgroup.chunkedtransfer;

import java.io.EOFException;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * Chunk source reading slices of a local file. Each read opens the file independently,
 * so concurrent workers never share a file pointer.
 */
public class FileChunkSource implements ChunkSource {

    private final File file;

    public FileChunkSource(File file) throws FileNotFoundException {
        if (!file.isFile()) {
            throw new FileNotFoundException("Upload source not found: " + file.getAbsolutePath());
        }
        this.file = file;
    }

    public File getFile() {
        return file;
    }

    @Override
    public long size() {
        return file.length();
    }

    @Override
    public byte[] read(long offset, int length) throws IOException {
        byte[] buffer = new byte[length];
        try (RandomAccessFile raf = new RandomAccessFile(file, "r")) {
            raf.seek(offset);
            int read = 0;
            while (read < length) {
                int n = raf.read(buffer, read, length - read);
                if (n < 0) {
                    throw new EOFException("Unexpected end of " + file.getName() + " at offset " + (offset + read));
                }
                read += n;
            }
        }
        return buffer;
    }
}
