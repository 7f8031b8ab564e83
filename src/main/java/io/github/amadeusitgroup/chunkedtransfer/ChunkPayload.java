package io.github.amadeusitgroup.chunkedtransfer;

/**
 * What a single chunk attempt produced: the bytes received (downloads) or the count of bytes
 * accepted by the remote side (uploads), plus the checksum the remote side reported, if any.
 */
public class ChunkPayload {

    private final byte[] data;
    private final long bytesTransferred;
    private final String reportedChecksum;

    private ChunkPayload(byte[] data, long bytesTransferred, String reportedChecksum) {
        this.data = data;
        this.bytesTransferred = bytesTransferred;
        this.reportedChecksum = reportedChecksum;
    }

    public static ChunkPayload received(byte[] data, String reportedChecksum) {
        return new ChunkPayload(data, data != null ? data.length : 0, reportedChecksum);
    }

    public static ChunkPayload sent(long bytesTransferred, String reportedChecksum) {
        return new ChunkPayload(null, bytesTransferred, reportedChecksum);
    }

    public byte[] getData() { return data; }
    public long getBytesTransferred() { return bytesTransferred; }
    public String getReportedChecksum() { return reportedChecksum; }
}
