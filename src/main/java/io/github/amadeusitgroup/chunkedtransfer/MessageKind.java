package io.github.amadeusitgroup.chunkedtransfer;

/**
 * Discriminator of the closed set of wire messages.
 */
public enum MessageKind {
    CHUNK_UPLOAD(1),
    UPLOAD_FINALIZE(2),
    UPLOAD_RECEIPT(3);

    private final int wireTag;

    MessageKind(int wireTag) {
        this.wireTag = wireTag;
    }

    public int getWireTag() {
        return wireTag;
    }

    public static MessageKind fromWireTag(int wireTag) throws CodecException {
        for (MessageKind kind : values()) {
            if (kind.wireTag == wireTag) {
                return kind;
            }
        }
        throw new CodecException("Unknown message kind: " + wireTag);
    }
}
