package info.isaksson.erland.tracematrix.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;

/** Text decoding helpers shared by the scanners. */
public final class TextFiles {

    private TextFiles() {}

    /**
     * Read a file as UTF-8, failing with {@link CharacterCodingException} on malformed input.
     */
    public static String readStrict(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return stripBom(decoder.decode(ByteBuffer.wrap(bytes)).toString());
    }

    /** Read a file as UTF-8, replacing malformed sequences with U+FFFD. */
    public static String readLossy(Path file) throws IOException {
        return decodeLossy(Files.readAllBytes(file));
    }

    public static String decodeLossy(byte[] bytes) {
        if (bytes == null) return "";
        // new String(..) always substitutes malformed input.
        return stripBom(new String(bytes, StandardCharsets.UTF_8));
    }

    /** Lines of {@code text} with CRLF/CR line endings normalized. A trailing newline adds no empty line. */
    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) return List.of();
        String norm = text.replace("\r\n", "\n").replace('\r', '\n');
        if (norm.endsWith("\n")) norm = norm.substring(0, norm.length() - 1);
        return Arrays.asList(norm.split("\n", -1));
    }

    /** First {@code length} hex chars of the SHA-1 of the UTF-8 encoded text. */
    public static String sha1Prefix(String text, int length) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-1");
            byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : digest) {
                sb.append(String.format("%02x", b));
                if (sb.length() >= length) break;
            }
            return sb.substring(0, Math.min(length, sb.length()));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    public static String stem(String fileName) {
        if (fileName == null) return "";
        int idx = fileName.lastIndexOf('.');
        if (idx <= 0) return fileName;
        return fileName.substring(0, idx);
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
