package io.github.amadeusitgroup.chunkedtransfer;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP compression of wire payloads for the compressed-text format.
 */
public class CompressionHandler {

    static final int DEFAULT_MAX_INFLATED_BYTES = 256 * 1024 * 1024;

    /**
     * Compression levels.
     */
    public enum Level {
        FAST(Deflater.BEST_SPEED),
        NORMAL(Deflater.DEFAULT_COMPRESSION),
        BEST(Deflater.BEST_COMPRESSION);

        private final int level;

        Level(int level) {
            this.level = level;
        }

        public int getLevel() {
            return level;
        }
    }

    private final Level level;
    private final int maxInflatedBytes;

    private final AtomicInteger compressionCount = new AtomicInteger(0);
    private final AtomicInteger decompressionCount = new AtomicInteger(0);
    private final AtomicLong totalBytesCompressed = new AtomicLong(0);
    private final AtomicLong totalCompressedOutput = new AtomicLong(0);

    public CompressionHandler() {
        this(Level.NORMAL, DEFAULT_MAX_INFLATED_BYTES);
    }

    public CompressionHandler(Level level, int maxInflatedBytes) {
        this.level = level;
        this.maxInflatedBytes = maxInflatedBytes;
    }

    public byte[] compress(byte[] data) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.max(64, data.length / 2));
        try (GZIPOutputStream gzip = new LeveledGzipOutputStream(bytes, level.getLevel())) {
            gzip.write(data);
        }
        byte[] compressed = bytes.toByteArray();
        compressionCount.incrementAndGet();
        totalBytesCompressed.addAndGet(data.length);
        totalCompressedOutput.addAndGet(compressed.length);
        return compressed;
    }

    /**
     * Inflate a GZIP payload, refusing output larger than the configured limit.
     */
    public byte[] decompress(byte[] compressed) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(Math.max(64, compressed.length * 2));
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] buffer = new byte[8192];
            int read;
            long total = 0;
            while ((read = gzip.read(buffer)) != -1) {
                total += read;
                if (total > maxInflatedBytes) {
                    throw new CodecException("Compressed payload inflates beyond " + maxInflatedBytes + " bytes");
                }
                bytes.write(buffer, 0, read);
            }
        }
        decompressionCount.incrementAndGet();
        return bytes.toByteArray();
    }

    public int getCompressionCount() {
        return compressionCount.get();
    }

    public int getDecompressionCount() {
        return decompressionCount.get();
    }

    /**
     * Compressed size over original size across every compression so far.
     */
    public double getAverageCompressionRatio() {
        long original = totalBytesCompressed.get();
        return original > 0 ? (double) totalCompressedOutput.get() / original : 0.0;
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        LeveledGzipOutputStream(ByteArrayOutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
