package ai.pyperf.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports UTF-8 byte offsets, so node text is always cut
 * from the byte array rather than the String. Also keeps the physical lines for snippet extraction.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private static final char UTF8_BOM = '\uFEFF';

    private final String text;
    private final byte[] utf8Bytes;
    private final int byteLength;
    private final List<String> lines;

    private SourceContent(String text, byte[] utf8Bytes, int byteLength) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
        this.byteLength = byteLength;
        this.lines = text.lines().toList();
    }

    /** Creates a SourceContent for the provided text; a leading byte-order mark is dropped. */
    public static SourceContent of(String src) {
        var stripped = !src.isEmpty() && src.charAt(0) == UTF8_BOM ? src.substring(1) : src;
        byte[] bytes = stripped.getBytes(StandardCharsets.UTF_8);
        return new SourceContent(stripped, bytes, bytes.length);
    }

    /**
     * Safely extracts a substring using UTF-8 byte offsets [startByte, endByte).
     *
     * <ul>
     *   <li>If startByte &lt; 0 or endByte &lt; startByte, returns the empty string and logs a warning.
     *   <li>If startByte is past the end, returns the empty string and logs a warning.
     *   <li>If endByte is past the end, it is truncated (logged at debug).
     * </ul>
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    byteLength,
                    startByte,
                    endByte);
            return "";
        }

        if (startByte >= byteLength) {
            if (startByte > byteLength) {
                log.warn("Start byte offset {} exceeds source byte length {}", startByte, byteLength);
            }
            return "";
        }

        if (endByte > byteLength) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, byteLength);
            endByte = byteLength;
        }

        int len = endByte - startByte;
        if (len == 0) return "";

        return new String(utf8Bytes, startByte, len, StandardCharsets.UTF_8);
    }

    /** Text covered by the node, or the empty string for a null node. */
    public String substringFrom(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    /**
     * Lines {@code startLine..endLine}, 1-based and inclusive, joined with {@code \n}. Out-of-range bounds are clamped.
     */
    public String lineRange(int startLine, int endLine) {
        int from = Math.max(startLine, 1);
        int to = Math.min(endLine, lines.size());
        if (from > to) {
            return "";
        }
        return String.join("\n", lines.subList(from - 1, to));
    }

    public int lineCount() {
        return lines.size();
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return byteLength;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        var that = (SourceContent) obj;
        return Objects.equals(this.text, that.text) && Arrays.equals(this.utf8Bytes, that.utf8Bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, Arrays.hashCode(utf8Bytes));
    }

    @Override
    public String toString() {
        return "SourceContent[lines=" + lines.size() + ", byteLength=" + byteLength + ']';
    }
}
