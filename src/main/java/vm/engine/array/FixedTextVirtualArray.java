package vm.engine.array;

import java.io.IOException;

import vm.engine.catalog.ArraySpec;
import vm.engine.catalog.ElementKind;
import vm.engine.codec.FixedTextCellCodec;

/**
 * Virtual array of text cells of at most {@code fixedLength} characters.
 * Longer writes are truncated without error.
 */
public final class FixedTextVirtualArray extends AbstractVirtualArray<String> {

    public FixedTextVirtualArray(String filePath, long size, int fixedLength) throws IOException {
        this(ArraySpec.fixedText(filePath, size, fixedLength));
    }

    public FixedTextVirtualArray(ArraySpec spec) throws IOException {
        super(requireKind(spec), new FixedTextCellCodec(spec.length()));
    }

    public int fixedLength() { return spec().length(); }

    /** The value as it reads back after being written: truncated and mapped to ISO-8859-1. */
    public String stored(String value) { return codec().normalize(value); }

    private static ArraySpec requireKind(ArraySpec spec) {
        if (spec.kind() != ElementKind.FIXED_TEXT) {
            throw new IllegalArgumentException("Expected a fixed text array spec, got " + spec.typeTag());
        }
        return spec;
    }
}
