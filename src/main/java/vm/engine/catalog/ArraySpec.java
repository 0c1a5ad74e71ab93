package vm.engine.catalog;

import java.util.Objects;

// Immutable creation parameters of one virtual array.
// length: only matters for text kinds (characters per cell) else 0.
public record ArraySpec(String filePath, ElementKind kind, long size, int length) {

    public ArraySpec {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(kind, "kind");
        if (size < 0) throw new IllegalArgumentException("Array size must be >= 0, got " + size);
        if (kind.isText() && length < 1) {
            throw new IllegalArgumentException("Text length must be >= 1, got " + length);
        }
        if (!kind.isText()) length = 0;
    }

    public static ArraySpec ints(String filePath, long size) {
        return new ArraySpec(filePath, ElementKind.INT, size, 0);
    }

    public static ArraySpec fixedText(String filePath, long size, int length) {
        return new ArraySpec(filePath, ElementKind.FIXED_TEXT, size, length);
    }

    /** Type tag as typed at the command line: int, char(N) or varchar(N). */
    public String typeTag() {
        return switch (kind) {
            case INT -> "int";
            case FIXED_TEXT -> "char(" + length + ")";
            case VAR_TEXT -> "varchar(" + length + ")";
        };
    }
}
