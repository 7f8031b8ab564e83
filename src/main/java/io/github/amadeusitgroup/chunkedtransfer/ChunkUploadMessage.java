package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Arrays;
import java.util.Objects;

/**
 * One chunk of an upload together with its descriptor.
 */
public class ChunkUploadMessage extends TransferMessage {

    private String sessionId;
    private int chunkIndex;
    private int totalChunks;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long offset;

    @JsonSerialize(using = SafeLongSerializer.class)
    @JsonDeserialize(using = SafeLongDeserializer.class)
    private long size;

    private String checksum;
    private byte[] data;

    public ChunkUploadMessage() {
    }

    public ChunkUploadMessage(String sessionId, int chunkIndex, int totalChunks, long offset, long size,
                              String checksum, byte[] data) {
        this.sessionId = sessionId;
        this.chunkIndex = chunkIndex;
        this.totalChunks = totalChunks;
        this.offset = offset;
        this.size = size;
        this.checksum = checksum;
        this.data = data;
    }

    @Override
    public MessageKind getKind() {
        return MessageKind.CHUNK_UPLOAD;
    }

    @Override
    public void validate() throws CodecException {
        require(!isBlank(sessionId), "Chunk message without session id");
        require(chunkIndex >= 0, "Negative chunk index: " + chunkIndex);
        require(totalChunks >= 1, "Invalid chunk total: " + totalChunks);
        require(chunkIndex < totalChunks, "Chunk index " + chunkIndex + " outside total " + totalChunks);
        require(offset >= 0, "Negative chunk offset: " + offset);
        require(size >= 0, "Negative chunk size: " + size);
        require(checksum == null || ChecksumHandler.isHexDigest(checksum), "Malformed chunk checksum: " + checksum);
        require(data == null || data.length == size, "Chunk data length does not match size " + size);
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }
    public int getChunkIndex() { return chunkIndex; }
    public void setChunkIndex(int chunkIndex) { this.chunkIndex = chunkIndex; }
    public int getTotalChunks() { return totalChunks; }
    public void setTotalChunks(int totalChunks) { this.totalChunks = totalChunks; }
    public long getOffset() { return offset; }
    public void setOffset(long offset) { this.offset = offset; }
    public long getSize() { return size; }
    public void setSize(long size) { this.size = size; }
    public String getChecksum() { return checksum; }
    public void setChecksum(String checksum) { this.checksum = checksum; }
    public byte[] getData() { return data; }
    public void setData(byte[] data) { this.data = data; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChunkUploadMessage)) return false;
        ChunkUploadMessage that = (ChunkUploadMessage) o;
        return chunkIndex == that.chunkIndex && totalChunks == that.totalChunks && offset == that.offset
            && size == that.size && Objects.equals(sessionId, that.sessionId)
            && Objects.equals(checksum, that.checksum) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sessionId, chunkIndex, totalChunks, offset, size, checksum);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("ChunkUploadMessage{session=%s, index=%d/%d, offset=%d, size=%d}",
            sessionId, chunkIndex, totalChunks, offset, size);
    }
}
