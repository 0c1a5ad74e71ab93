package vm.engine.codec;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Signed 32-bit integers stored little-endian in 4-byte slots.
 */
public final class IntCellCodec implements CellCodec<Integer> {
    public static final int INT_BYTES = 4;

    public static final IntCellCodec INSTANCE = new IntCellCodec();

    private IntCellCodec() {}

    @Override
    public int width() { return INT_BYTES; }

    @Override
    public Integer defaultValue() { return 0; }

    @Override
    public Integer normalize(Integer value) { return value; }

    @Override
    public void encode(Integer value, byte[] dest, int offset) {
        ByteBuffer.wrap(dest, offset, INT_BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt(value);
    }

    @Override
    public Integer decode(byte[] src, int offset) {
        return ByteBuffer.wrap(src, offset, INT_BYTES).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    @Override
    public String toString() { return "int"; }
}
