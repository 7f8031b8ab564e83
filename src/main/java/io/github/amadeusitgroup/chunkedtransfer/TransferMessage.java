package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of the closed set of messages exchanged with a chunk-ingest endpoint.
 * The text form carries the subtype in a {@code kind} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ChunkUploadMessage.class, name = "chunk-upload"),
    @JsonSubTypes.Type(value = UploadFinalizeMessage.class, name = "upload-finalize"),
    @JsonSubTypes.Type(value = UploadReceipt.class, name = "upload-receipt")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class TransferMessage {

    @JsonIgnore
    public abstract MessageKind getKind();

    /**
     * Check required fields and value ranges.
     *
     * @throws CodecException describing the first violation
     */
    public abstract void validate() throws CodecException;

    static void require(boolean condition, String message) throws CodecException {
        if (!condition) {
            throw new CodecException(message);
        }
    }

    static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
