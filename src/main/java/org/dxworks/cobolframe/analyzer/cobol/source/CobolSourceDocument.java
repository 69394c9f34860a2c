package org.dxworks.cobolframe.analyzer.cobol.source;

import org.dxworks.cobolframe.SourceFormat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Immutable view of one COBOL compilation unit as read from disk.
 * Every offset handed around by the analyzer points into {@link #getText()}.
 */
public final class CobolSourceDocument {

    private final String text;
    private final SourceFormat format;
    private final String absolutePath;
    private final String sha256;
    private final CobolSourceLines lines;

    private CobolSourceDocument(String text, SourceFormat format, String absolutePath, String sha256) {
        this.text = Objects.requireNonNull(text, "text");
        this.format = Objects.requireNonNull(format, "format");
        this.absolutePath = absolutePath == null ? "" : absolutePath;
        this.sha256 = sha256;
        this.lines = new CobolSourceLines(this.text, this.format);
    }

    public static CobolSourceDocument load(Path path, SourceFormat format) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        // Lenient decoding: malformed bytes become U+FFFD instead of failing the run
        String text = new String(bytes, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return new CobolSourceDocument(text, format, path.toAbsolutePath().toString(), sha256(bytes));
    }

    public static CobolSourceDocument of(String text, SourceFormat format, String absolutePath) {
        return new CobolSourceDocument(text, format, absolutePath, sha256(text.getBytes(StandardCharsets.UTF_8)));
    }

    public String getText() {
        return text;
    }

    public SourceFormat getFormat() {
        return format;
    }

    public String getAbsolutePath() {
        return absolutePath;
    }

    /**
     * Hex SHA-256 of the bytes the document was decoded from.
     */
    public String getSha256() {
        return sha256;
    }

    public int length() {
        return text.length();
    }

    public CobolSourceLines lines() {
        return lines;
    }

    private static String sha256(byte[] bytes) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
