package vm.engine.codec;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Fixed-length text cells, one byte per character (ISO-8859-1).
 *
 * Writes that encode to more than {@code fixedLength} bytes are silently truncated; shorter values are
 * padded with zero bytes, and trailing zero bytes are stripped again on decode. Characters outside
 * ISO-8859-1 are stored as '?', one byte per code point.
 */
public final class FixedTextCellCodec implements CellCodec<String> {
    private static final Charset CHARSET = StandardCharsets.ISO_8859_1;

    private final int fixedLength;

    public FixedTextCellCodec(int fixedLength) {
        if (fixedLength < 1) {
            throw new IllegalArgumentException("Fixed text length must be >= 1, got " + fixedLength);
        }
        this.fixedLength = fixedLength;
    }

    @Override
    public int width() { return fixedLength; }

    @Override
    public String defaultValue() { return ""; }

    @Override
    public String normalize(String value) {
        // Truncate the encoded bytes, exactly as encode() does, so buffered and reloaded reads agree
        byte[] bytes = value.getBytes(CHARSET);
        return decodeBytes(bytes, 0, Math.min(bytes.length, fixedLength));
    }

    @Override
    public void encode(String value, byte[] dest, int offset) {
        byte[] bytes = value.getBytes(CHARSET);
        int len = Math.min(bytes.length, fixedLength);
        System.arraycopy(bytes, 0, dest, offset, len);
        for (int i = offset + len; i < offset + fixedLength; i++) dest[i] = 0;
    }

    @Override
    public String decode(byte[] src, int offset) {
        return decodeBytes(src, offset, fixedLength);
    }

    private static String decodeBytes(byte[] src, int offset, int length) {
        int end = offset + length;
        while (end > offset && src[end - 1] == 0) end--;
        return new String(src, offset, end - offset, CHARSET);
    }

    @Override
    public String toString() { return "char(" + fixedLength + ")"; }
}
