package io.github.amadeusitgroup.chunkedtransfer;

import java.io.File;

/**
 * Download of one remote resource, optionally written to a local file.
 */
public class DownloadRequest extends TransferRequest {

    private final String path;
    private final File targetFile;

    private DownloadRequest(Builder builder) {
        super(builder);
        if (builder.path == null || builder.path.isEmpty()) {
            throw new IllegalArgumentException("path is required");
        }
        this.path = builder.path.startsWith("/") ? builder.path : "/" + builder.path;
        this.targetFile = builder.targetFile;
    }

    public static Builder builder(String endpoint, String path) {
        return new Builder().endpoint(endpoint).path(path);
    }

    public String getPath() { return path; }
    public File getTargetFile() { return targetFile; }

    public static class Builder extends TransferRequest.Builder<Builder> {
        private String path;
        private File targetFile;

        @Override
        protected Builder self() { return this; }

        public Builder path(String path) { this.path = path; return this; }
        public Builder targetFile(File targetFile) { this.targetFile = targetFile; return this; }

        public DownloadRequest build() {
            return new DownloadRequest(this);
        }
    }
}
