package io.github.amadeusitgroup.chunkedtransfer;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Locale;

/**
 * Checksum generation and validation for chunks and whole payloads.
 * MD5 is the chunk checksum exchanged with the remote side; SHA-256 is available for whole files.
 */
public class ChecksumHandler {

    public static final String MD5 = "MD5";
    public static final String SHA_256 = "SHA-256";

    private static final int BUFFER_SIZE = 8192;
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    /**
     * MD5 of a whole byte array as lowercase hex.
     */
    public String md5Hex(byte[] data) {
        return checksum(data, 0, data.length, MD5);
    }

    /**
     * Checksum of a slice of a byte array.
     *
     * @param data source bytes
     * @param offset first byte of the slice
     * @param length number of bytes in the slice
     * @param algorithm MessageDigest algorithm name
     * @return lowercase hex digest
     */
    public String checksum(byte[] data, int offset, int length, String algorithm) {
        MessageDigest digest = newDigest(algorithm);
        digest.update(data, offset, length);
        return bytesToHex(digest.digest());
    }

    /**
     * Checksum of a stream read to its end. The stream is not closed.
     */
    public String checksum(InputStream input, String algorithm) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        BufferedInputStream buffered = new BufferedInputStream(input);
        byte[] buffer = new byte[BUFFER_SIZE];
        int bytesRead;
        while ((bytesRead = buffered.read(buffer)) != -1) {
            digest.update(buffer, 0, bytesRead);
        }
        return bytesToHex(digest.digest());
    }

    /**
     * Checksum of everything a chunk source provides, read in bounded slices.
     */
    public String checksum(ChunkSource source, String algorithm) throws IOException {
        MessageDigest digest = newDigest(algorithm);
        long size = source.size();
        long offset = 0;
        int slice = 1024 * 1024;
        while (offset < size) {
            int length = (int) Math.min(slice, size - offset);
            digest.update(source.read(offset, length));
            offset += length;
        }
        return bytesToHex(digest.digest());
    }

    /**
     * Validate data against an expected MD5 checksum, ignoring case.
     */
    public boolean validateMd5(byte[] data, String expectedChecksum) {
        if (expectedChecksum == null) {
            return false;
        }
        return expectedChecksum.trim().equalsIgnoreCase(md5Hex(data));
    }

    /**
     * Whether a string looks like a hex digest.
     */
    public static boolean isHexDigest(String value) {
        if (value == null || value.isEmpty() || value.length() % 2 != 0) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Normalize an MD5 header value to lowercase hex. Accepts hex or the base64 form of
     * {@code Content-MD5}; returns null for anything that is not a 16-byte digest.
     */
    public static String md5HeaderToHex(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() == 32 && isHexDigest(trimmed)) {
            return trimmed.toLowerCase(Locale.ROOT);
        }
        try {
            byte[] digest = Base64.getDecoder().decode(trimmed);
            return digest.length == 16 ? bytesToHex(digest) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported algorithm: " + algorithm, e);
        }
    }

    static String bytesToHex(byte[] bytes) {
        char[] result = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int value = bytes[i] & 0xff;
            result[i * 2] = HEX[value >>> 4];
            result[i * 2 + 1] = HEX[value & 0x0f];
        }
        return new String(result);
    }
}
