package io.github.amadeusitgroup.chunkedtransfer;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Length-prefixed frames for the persistent-socket transport. Each frame is a 4-byte big-endian
 * length followed by a protobuf-encoded request or response.
 */
public class TcpFrameCodec {

    static final int MAX_FRAME_BYTES = 64 * 1024 * 1024;

    // request fields
    private static final int REQ_METHOD = 1;
    private static final int REQ_PATH = 2;
    private static final int REQ_HEADER = 3;
    private static final int REQ_BODY = 4;
    private static final int REQ_TIMEOUT = 5;

    // response fields
    private static final int RES_STATUS = 1;
    private static final int RES_HEADER = 2;
    private static final int RES_BODY = 3;

    // header entry fields
    private static final int HEADER_NAME = 1;
    private static final int HEADER_VALUE = 2;

    public byte[] encodeRequest(TransportRequest request) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeString(REQ_METHOD, request.getMethod());
        out.writeString(REQ_PATH, request.getPath());
        for (Map.Entry<String, String> header : request.getHeaders().entrySet()) {
            out.writeByteArray(REQ_HEADER, encodeHeader(header.getKey(), header.getValue()));
        }
        if (request.getBody() != null) {
            out.writeByteArray(REQ_BODY, request.getBody());
        }
        if (request.getTimeoutMs() > 0) {
            out.writeInt64(REQ_TIMEOUT, request.getTimeoutMs());
        }
        out.flush();
        return bytes.toByteArray();
    }

    public TransportRequest decodeRequest(byte[] frame) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(frame);
        String method = null;
        String path = null;
        Map<String, String> headers = new LinkedHashMap<>();
        byte[] body = null;
        long timeoutMs = 0;

        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case REQ_METHOD: method = in.readString(); break;
                case REQ_PATH: path = in.readString(); break;
                case REQ_HEADER: decodeHeader(in.readByteArray(), headers); break;
                case REQ_BODY: body = in.readByteArray(); break;
                case REQ_TIMEOUT: timeoutMs = in.readInt64(); break;
                default: in.skipField(tag);
            }
        }
        if (method == null || path == null) {
            throw new CodecException("Request frame without method or path");
        }

        TransportRequest.Builder builder = TransportRequest.builder(method, path).body(body).timeoutMs(timeoutMs);
        headers.forEach(builder::header);
        return builder.build();
    }

    public byte[] encodeResponse(TransportResponse response) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeUInt32(RES_STATUS, response.getStatusCode());
        for (Map.Entry<String, String> header : response.getHeaders().entrySet()) {
            out.writeByteArray(RES_HEADER, encodeHeader(header.getKey(), header.getValue()));
        }
        out.writeByteArray(RES_BODY, response.getBody());
        out.flush();
        return bytes.toByteArray();
    }

    public TransportResponse decodeResponse(byte[] frame) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(frame);
        int status = -1;
        Map<String, String> headers = new LinkedHashMap<>();
        byte[] body = null;

        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case RES_STATUS: status = in.readUInt32(); break;
                case RES_HEADER: decodeHeader(in.readByteArray(), headers); break;
                case RES_BODY: body = in.readByteArray(); break;
                default: in.skipField(tag);
            }
        }
        if (status < 0) {
            throw new CodecException("Response frame without status");
        }
        return new TransportResponse(status, headers, body);
    }

    public void writeFrame(OutputStream output, byte[] frame) throws IOException {
        DataOutputStream out = new DataOutputStream(output);
        out.writeInt(frame.length);
        out.write(frame);
        out.flush();
    }

    public byte[] readFrame(InputStream input) throws IOException {
        DataInputStream in = new DataInputStream(input);
        int length = in.readInt();
        if (length < 0 || length > MAX_FRAME_BYTES) {
            throw new CodecException("Invalid frame length: " + length);
        }
        byte[] frame = new byte[length];
        in.readFully(frame);
        return frame;
    }

    private byte[] encodeHeader(String name, String value) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        out.writeString(HEADER_NAME, name);
        out.writeString(HEADER_VALUE, value);
        out.flush();
        return bytes.toByteArray();
    }

    private void decodeHeader(byte[] entry, Map<String, String> headers) throws IOException {
        CodedInputStream in = CodedInputStream.newInstance(entry);
        String name = null;
        String value = "";
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (tag >>> 3) {
                case HEADER_NAME: name = in.readString(); break;
                case HEADER_VALUE: value = in.readString(); break;
                default: in.skipField(tag);
            }
        }
        if (name != null) {
            headers.put(name, value);
        }
    }
}
