package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Objects;

/**
 * Remote confirmation returned by the finalize call.
 */
public class UploadReceipt extends TransferMessage {

    private String sessionId;
    private String status;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long bytesReceived;

    private int chunksReceived;
    private String location;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long timestamp;

    public UploadReceipt() {
    }

    public UploadReceipt(String sessionId, String status, long bytesReceived, int chunksReceived, String location,
                         long timestamp) {
        this.sessionId = sessionId;
        this.status = status;
        this.bytesReceived = bytesReceived;
        this.chunksReceived = chunksReceived;
        this.location = location;
        this.timestamp = timestamp;
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.UPLOAD_RECEIPT;
    }

    @Override
    public void validate() throws CodecException {
        require(!isBlank(sessionId), "Receipt without session id");
        require(!isBlank(status), "Receipt without status");
        require(bytesReceived >= 0, "Negative bytes received: " + bytesReceived);
        require(chunksReceived >= 0, "Negative chunks received: " + chunksReceived);
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public long getBytesReceived() { return bytesReceived; }
    public void setBytesReceived(long bytesReceived) { this.bytesReceived = bytesReceived; }
    public int getChunksReceived() { return chunksReceived; }
    public void setChunksReceived(int chunksReceived) { this.chunksReceived = chunksReceived; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UploadReceipt)) return false;
        UploadReceipt that = (UploadReceipt) o;
        return bytesReceived == that.bytesReceived && chunksReceived == that.chunksReceived
            && timestamp == that.timestamp && Objects.equals(sessionId, that.sessionId)
            && Objects.equals(status, that.status) && Objects.equals(location, that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, status, bytesReceived, chunksReceived, location, timestamp);
    }

    @Override
    public String toString() {
        return String.format("UploadReceipt{session=%s, status=%s, bytes=%d, chunks=%d, location=%s}",
            sessionId, status, bytesReceived, chunksReceived, location);
    }
}
