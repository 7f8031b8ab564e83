package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Settings shared by upload and download requests.
 */
public abstract class TransferRequest {

    private final String endpoint;
    private final TransferOptions options;
    private final ProgressListener progressListener;
    private final HealthListener healthListener;
    private final CancellationToken cancellationToken;

    protected TransferRequest(Builder<?> builder) {
        if (builder.endpoint == null || builder.endpoint.trim().isEmpty()) {
            throw new IllegalArgumentException("endpoint is required");
        }
        this.endpoint = builder.endpoint;
        this.options = builder.options != null ? builder.options : TransferOptions.defaults();
        this.progressListener = builder.progressListener;
        this.healthListener = builder.healthListener;
        this.cancellationToken = builder.cancellationToken != null ? builder.cancellationToken : new CancellationToken();
    }

    /**
     * Base URL of the remote endpoint, such as {@code http://files.example.com:8080}.
     */
    public String getEndpoint() { return endpoint; }
    public TransferOptions getOptions() { return options; }
    public ProgressListener getProgressListener() { return progressListener; }
    public HealthListener getHealthListener() { return healthListener; }
    public CancellationToken getCancellationToken() { return cancellationToken; }

    protected abstract static class Builder<B extends Builder<B>> {
        private String endpoint;
        private TransferOptions options;
        private ProgressListener progressListener;
        private HealthListener healthListener;
        private CancellationToken cancellationToken;

        protected abstract B self();

        public B endpoint(String endpoint) { this.endpoint = endpoint; return self(); }
        public B options(TransferOptions options) { this.options = options; return self(); }
        public B progressListener(ProgressListener listener) { this.progressListener = listener; return self(); }
        public B healthListener(HealthListener listener) { this.healthListener = listener; return self(); }
        public B cancellationToken(CancellationToken token) { this.cancellationToken = token; return self(); }
    }
}
