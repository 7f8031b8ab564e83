package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * Asks the remote side to commit an upload session once every chunk was accepted.
 */
public class UploadFinalizeMessage extends TransferMessage {

    private String sessionId;
    private String fileName;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long totalBytes;

    private int totalChunks;
    private String fileChecksum;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long timestamp;

    public UploadFinalizeMessage() {
    }

    public UploadFinalizeMessage(String sessionId, String fileName, long totalBytes, int totalChunks,
                                 String fileChecksum, long timestamp) {
        this.sessionId = sessionId;
        this.fileName = fileName;
        this.totalBytes = totalBytes;
        this.totalChunks = totalChunks;
        this.fileChecksum = fileChecksum;
        this.timestamp = timestamp;
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.UPLOAD_FINALIZE;
    }

    @Override
    public void validate() throws CodecException {
        require(!isBlank(sessionId), "Finalize message without session id");
        require(!isBlank(fileName), "Finalize message without file name");
        require(totalBytes >= 0, "Negative total bytes: " + totalBytes);
        require(totalChunks >= 1, "Invalid chunk total: " + totalChunks);
        require(fileChecksum == null || ChecksumHandler.isHexDigest(fileChecksum),
            "Malformed file checksum: " + fileChecksum);
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getFileName() { return fileName; }
    public void setFileName(String fileName) { this.fileName = fileName; }
    public long getTotalBytes() { return totalBytes; }
    public void setTotalBytes(long totalBytes) { this.totalBytes = totalBytes; }
    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }
    public String getFileChecksum() { return fileChecksum; }
    public void setFileChecksum(String fileChecksum) { this.fileChecksum = fileChecksum; }
    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadFinalizeMessage)) return false;
        UploadFinalizeMessage that = (UploadFinalizeMessage) o;
        return totalBytes == that.totalBytes && totalChunks == that.totalChunks && timestamp == that.timestamp
            && Objects.equals(sessionId, that.sessionId) && Objects.equals(fileName, that.fileName)
            && Objects.equals(fileChecksum, that.fileChecksum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, fileName, totalBytes, totalChunks, fileChecksum, timestamp);
    }

    @Override
    public String toString() {
        return String.format("UploadFinalizeMessage{session=%s, file=%s, bytes=%d, chunks=%d}",
            sessionId, fileName, totalBytes, totalChunks);
    }
}
