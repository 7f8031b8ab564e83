package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Upload of a payload under a remote file name.
 */
public class UploadRequest extends TransferRequest {

    private final String fileName;
    private final ChunkSource source;
    private final SessionCheckpoint checkpoint;

    private UploadRequest(Builder builder) {
        super(builder);
        if (builder.fileName == null || builder.fileName.trim().isEmpty()) {
            throw new IllegalArgumentException("fileName is required");
        }
        if (builder.source == null) {
            throw new IllegalArgumentException("source is required");
        }
        this.fileName = builder.fileName;
        this.source = builder.source;
        this.checkpoint = builder.checkpoint;
    }

    public static Builder builder(String endpoint, String fileName, ChunkSource source) {
        return new Builder().endpoint(endpoint).fileName(fileName).source(source);
    }

    public String getFileName() { return fileName; }
    public ChunkSource getSource() { return source; }

    /**
     * Checkpoint store used to skip chunks already confirmed by an earlier attempt, may be null.
     */
    public SessionCheckpoint getCheckpoint() { return checkpoint; }

    public static class Builder extends TransferRequest.Builder<Builder> {
        private String fileName;
        private ChunkSource source;
        private SessionCheckpoint checkpoint;

        @Override
        protected Builder self() { return this; }

        public Builder fileName(String fileName) { this.fileName = fileName; return this; }
        public Builder source(ChunkSource source) { this.source = source; return this; }
        public Builder checkpoint(SessionCheckpoint checkpoint) { this.checkpoint = checkpoint; return this; }

        public UploadRequest build() {
            return new UploadRequest(this);
        }
    }
}
