package vm.engine.array;

import java.io.IOException;

import vm.engine.catalog.ArraySpec;
import vm.engine.catalog.ElementKind;
import vm.engine.codec.IntCellCodec;

/**
 * Virtual array of 32-bit integers, 512-byte data region per page.
 */
public final class IntVirtualArray extends AbstractVirtualArray<Integer> {

    public IntVirtualArray(String filePath, long size) throws IOException {
        this(ArraySpec.ints(filePath, size));
    }

    public IntVirtualArray(ArraySpec spec) throws IOException {
        super(requireKind(spec), IntCellCodec.INSTANCE);
    }

    public int readInt(long index) throws IOException {
        return read(index);
    }

    public void writeInt(long index, int value) throws IOException {
        write(index, value);
    }

    private static ArraySpec requireKind(ArraySpec spec) {
        if (spec.kind() != ElementKind.INT) {
            throw new IllegalArgumentException("Expected an int array spec, got " + spec.typeTag());
        }
        return spec;
    }
}
