package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persists the confirmed chunks of an upload so that uploading the same payload again skips them.
 * One JSON file per checkpoint key; the file is removed once the upload is finalized.
 */
public class SessionCheckpoint {

    private static final Logger logger = LoggerFactory.getLogger(SessionCheckpoint.class);

    private final File directory;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SessionCheckpoint(File directory) {
        this.directory = directory;
    }

    /**
     * Key identifying the same payload sent to the same endpoint.
     */
    public static String checkpointKey(String endpointKey, String fileName, String fileChecksum, long totalBytes) {
        String raw = endpointKey + "|" + fileName + "|" + fileChecksum + "|" + totalBytes;
        return new ChecksumHandler().md5Hex(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return the saved state, or null when there is none or it cannot be read
     */
    public synchronized State load(String key) {
        File file = fileFor(key);
        if (!file.isFile()) {
            return null;
        }
        try {
            return objectMapper.readValue(file, State.class);
        } catch (IOException e) {
            logger.warn("Ignoring unreadable checkpoint {}: {}", file, e.getMessage());
            return null;
        }
    }

    /**
     * Record one more confirmed chunk.
     */
    public synchronized void recordCompleted(String key, String sessionId, long totalBytes, int chunkSize,
                                             int chunkIndex, String checksum) throws IOException {
        State state = load(key);
        if (state == null || state.getChunkSize() != chunkSize || state.getTotalBytes() != totalBytes) {
            state = new State();
            state.setSessionId(sessionId);
            state.setTotalBytes(totalBytes);
            state.setChunkSize(chunkSize);
        }
        state.getCompletedChunks().put(chunkIndex, checksum);
        state.setUpdatedAt(System.currentTimeMillis());

        FileUtils.forceMkdir(directory);
        objectMapper.writeValue(fileFor(key), state);
    }

    public synchronized void clear(String key) {
        File file = fileFor(key);
        if (file.exists() && !file.delete()) {
            logger.warn("Could not delete checkpoint {}", file);
        }
    }

    public File getDirectory() {
        return directory;
    }

    private File fileFor(String key) {
        return new File(directory, "upload-" + key + ".json");
    }

    /**
     * Serialized checkpoint content.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class State {
        private String sessionId;
        private long totalBytes;
        private int chunkSize;
        private long updatedAt;
        private Map<Integer, String> completedChunks = new TreeMap<>();

        public String getSessionId() { return sessionId; }
        public void setSessionId(String sessionId) { this.sessionId = sessionId; }
        public long getTotalBytes() { return totalBytes; }
        public void setTotalBytes(long totalBytes) { this.totalBytes = totalBytes; }
        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
        public long getUpdatedAt() { return updatedAt; }
        public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }

        public Map<Integer, String> getCompletedChunks() { return completedChunks; }

        public void setCompletedChunks(Map<Integer, String> completedChunks) {
            this.completedChunks = completedChunks != null ? new TreeMap<>(completedChunks) : new TreeMap<>();
        }
    }
}
