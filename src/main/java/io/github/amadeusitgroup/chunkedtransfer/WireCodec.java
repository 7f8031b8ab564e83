package io.github.amadeusitgroup.chunkedtransfer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.InvalidProtocolBufferException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Encodes and decodes {@link TransferMessage}s in the negotiated wire format.
 * <p>
 * BINARY uses the protobuf wire encoding with fixed field numbers per message kind; field 1 is
 * always the kind. TEXT is JSON with a {@code kind} discriminator and numeric-safe longs.
 * COMPRESSED_TEXT is GZIP over TEXT. Every decoded message is validated before it is returned.
 */
public class WireCodec {

    private static final int FIELD_KIND = 1;

    // chunk upload
    private static final int CHUNK_SESSION_ID = 2;
    private static final int CHUNK_INDEX = 3;
    private static final int CHUNK_TOTAL = 4;
    private static final int CHUNK_OFFSET = 5;
    private static final int CHUNK_SIZE = 6;
    private static final int CHUNK_CHECKSUM = 7;
    private static final int CHUNK_DATA = 8;

    // finalize
    private static final int FINALIZE_SESSION_ID = 2;
    private static final int FINALIZE_FILE_NAME = 3;
    private static final int FINALIZE_TOTAL_BYTES = 4;
    private static final int FINALIZE_TOTAL_CHUNKS = 5;
    private static final int FINALIZE_CHECKSUM = 6;
    private static final int FINALIZE_TIMESTAMP = 7;

    // receipt
    private static final int RECEIPT_SESSION_ID = 2;
    private static final int RECEIPT_STATUS = 3;
    private static final int RECEIPT_BYTES = 4;
    private static final int RECEIPT_CHUNKS = 5;
    private static final int RECEIPT_LOCATION = 6;
    private static final int RECEIPT_TIMESTAMP = 7;

    private final ObjectMapper objectMapper;
    private final CompressionHandler compressionHandler;

    public WireCodec() {
        this(new CompressionHandler());
    }

    public WireCodec(CompressionHandler compressionHandler) {
        this.objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.compressionHandler = compressionHandler;
    }

    public byte[] encode(TransferMessage message, WireFormat format) throws IOException {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        message.validate();
        switch (format) {
            case BINARY:
                return encodeBinary(message);
            case COMPRESSED_TEXT:
                return compressionHandler.compress(encodeText(message));
            case TEXT:
            default:
                return encodeText(message);
        }
    }

    public TransferMessage decode(byte[] bytes, WireFormat format) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new CodecException("Empty " + format.getToken() + " payload");
        }
        TransferMessage message;
        switch (format) {
            case BINARY:
                message = decodeBinary(bytes);
                break;
            case COMPRESSED_TEXT:
                message = decodeText(compressionHandler.decompress(bytes));
                break;
            case TEXT:
            default:
                message = decodeText(bytes);
                break;
        }
        message.validate();
        return message;
    }

    /**
     * Decode and check the message kind.
     */
    public <T extends TransferMessage> T decode(byte[] bytes, WireFormat format, Class<T> expectedType)
            throws IOException {
        TransferMessage message = decode(bytes, format);
        if (!expectedType.isInstance(message)) {
            throw new CodecException("Expected " + expectedType.getSimpleName() + " but got " + message.getKind());
        }
        return expectedType.cast(message);
    }

    private byte[] encodeText(TransferMessage message) throws IOException {
        return objectMapper.writerFor(TransferMessage.class).writeValueAsBytes(message);
    }

    private TransferMessage decodeText(byte[] bytes) throws CodecException {
        try {
            return objectMapper.readValue(bytes, TransferMessage.class);
        } catch (JsonProcessingException e) {
            throw new CodecException("Malformed JSON message: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new CodecException("Unreadable JSON message: " + e.getMessage(), e);
        }
    }

    private byte[] encodeBinary(TransferMessage message) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeEnum(FIELD_KIND, message.getKind().getWireTag());

        switch (message.getKind()) {
            case CHUNK_UPLOAD: {
                ChunkUploadMessage chunk = (ChunkUploadMessage) message;
                writeString(out, CHUNK_SESSION_ID, chunk.getSessionId());
                out.writeUInt32(CHUNK_INDEX, chunk.getChunkIndex());
                out.writeUInt32(CHUNK_TOTAL, chunk.getTotalChunks());
                out.writeInt64(CHUNK_OFFSET, chunk.getOffset());
                out.writeInt64(CHUNK_SIZE, chunk.getSize());
                writeString(out, CHUNK_CHECKSUM, chunk.getChecksum());
                if (chunk.getData() != null) {
                    out.writeByteArray(CHUNK_DATA, chunk.getData());
                }
                break;
            }
            case UPLOAD_FINALIZE: {
                UploadFinalizeMessage finalize = (UploadFinalizeMessage) message;
                writeString(out, FINALIZE_SESSION_ID, finalize.getSessionId());
                writeString(out, FINALIZE_FILE_NAME, finalize.getFileName());
                out.writeInt64(FINALIZE_TOTAL_BYTES, finalize.getTotalBytes());
                out.writeUInt32(FINALIZE_TOTAL_CHUNKS, finalize.getTotalChunks());
                writeString(out, FINALIZE_CHECKSUM, finalize.getFileChecksum());
                out.writeInt64(FINALIZE_TIMESTAMP, finalize.getTimestamp());
                break;
            }
            case UPLOAD_RECEIPT: {
                UploadReceipt receipt = (UploadReceipt) message;
                writeString(out, RECEIPT_SESSION_ID, receipt.getSessionId());
                writeString(out, RECEIPT_STATUS, receipt.getStatus());
                out.writeInt64(RECEIPT_BYTES, receipt.getBytesReceived());
                out.writeUInt32(RECEIPT_CHUNKS, receipt.getChunksReceived());
                writeString(out, RECEIPT_LOCATION, receipt.getLocation());
                out.writeInt64(RECEIPT_TIMESTAMP, receipt.getTimestamp());
                break;
            }
            default:
                throw new CodecException("Unsupported message kind: " + message.getKind());
        }
        out.flush();
        return bytes.toByteArray();
    }

    private TransferMessage decodeBinary(byte[] bytes) throws CodecException {
        try {
            CodedInputStream in = CodedInputStream.newInstance(bytes);
            int tag = in.readTag();
            if (tag >>> 3 != FIELD_KIND) {
                throw new CodecException("Binary message does not start with its kind");
            }
            MessageKind kind = MessageKind.fromWireTag(in.readEnum());
            switch (kind) {
                case CHUNK_UPLOAD:
                    return decodeChunk(in);
                case UPLOAD_FINALIZE:
                    return decodeFinalize(in);
                case UPLOAD_RECEIPT:
                default:
                    return decodeReceipt(in);
            }
        } catch (InvalidProtocolBufferException e) {
            throw new CodecException("Malformed binary message: " + e.getMessage(), e);
        } catch (CodecException e) {
            throw e;
        } catch (IOException e) {
            throw new CodecException("Unreadable binary message: " + e.getMessage(), e);
        }
    }

    private ChunkUploadMessage decodeChunk(CodedInputStream in) throws IOException {
        ChunkUploadMessage message = new ChunkUploadMessage();
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case CHUNK_SESSION_ID: message.setSessionId(in.readString()); break;
                case CHUNK_INDEX: message.setChunkIndex(in.readUInt32()); break;
                case CHUNK_TOTAL: message.setTotalChunks(in.readUInt32()); break;
                case CHUNK_OFFSET: message.setOffset(in.readInt64()); break;
                case CHUNK_SIZE: message.setSize(in.readInt64()); break;
                case CHUNK_CHECKSUM: message.setChecksum(in.readString()); break;
                case CHUNK_DATA: message.setData(in.readByteArray()); break;
                default: in.skipField(tag);
            }
        }
        return message;
    }

    private UploadFinalizeMessage decodeFinalize(CodedInputStream in) throws IOException {
        UploadFinalizeMessage message = new UploadFinalizeMessage();
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case FINALIZE_SESSION_ID: message.setSessionId(in.readString()); break;
                case FINALIZE_FILE_NAME: message.setFileName(in.readString()); break;
                case FINALIZE_TOTAL_BYTES: message.setTotalBytes(in.readInt64()); break;
                case FINALIZE_TOTAL_CHUNKS: message.setTotalChunks(in.readUInt32()); break;
                case FINALIZE_CHECKSUM: message.setFileChecksum(in.readString()); break;
                case FINALIZE_TIMESTAMP: message.setTimestamp(in.readInt64()); break;
                default: in.skipField(tag);
            }
        }
        return message;
    }

    private UploadReceipt decodeReceipt(CodedInputStream in) throws IOException {
        UploadReceipt message = new UploadReceipt();
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case RECEIPT_SESSION_ID: message.setSessionId(in.readString()); break;
                case RECEIPT_STATUS: message.setStatus(in.readString()); break;
                case RECEIPT_BYTES: message.setBytesReceived(in.readInt64()); break;
                case RECEIPT_CHUNKS: message.setChunksReceived(in.readUInt32()); break;
                case RECEIPT_LOCATION: message.setLocation(in.readString()); break;
                case RECEIPT_TIMESTAMP: message.setTimestamp(in.readInt64()); break;
                default: in.skipField(tag);
            }
        }
        return message;
    }

    private static void writeString(CodedOutputStream out, int field, String value) throws IOException {
        if (value != null) {
            out.writeString(field, value);
        }
    }
}
