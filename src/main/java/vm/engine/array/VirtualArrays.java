package vm.engine.array;

import java.io.IOException;

import vm.engine.catalog.ArraySpec;

/**
 * Picks the array variant for an {@link ArraySpec}, once, at construction.
 */
public final class VirtualArrays {
    private VirtualArrays() {}

    /**
     * Create the swap file described by {@code spec} if absent, otherwise open and validate it.
     * @throws UnsupportedOperationException for variable-length text, which has no storage format yet
     */
    public static VirtualArray<?> open(ArraySpec spec) throws IOException {
        return switch (spec.kind()) {
            case INT -> new IntVirtualArray(spec);
            case FIXED_TEXT -> new FixedTextVirtualArray(spec);
            case VAR_TEXT -> throw new UnsupportedOperationException("Variable-length text arrays are not implemented");
        };
    }
}
