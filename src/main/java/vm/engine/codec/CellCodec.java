package vm.engine.codec;

/**
 * Converts one logical element to and from a fixed-width byte slot.
 *
 * Every cell of a page occupies exactly {@link #width()} bytes in the page's data region,
 * so cell i of a page lives at byte offset {@code i * width()}.
 */
public interface CellCodec<T> {

    /** Slot width in bytes. */
    int width();

    /** Value returned for a cell that was never written. */
    T defaultValue();

    /**
     * Value as it will read back after a write/flush/reload cycle. Lossy codecs
     * (e.g. fixed-length text) apply their truncation here.
     */
    T normalize(T value);

    void encode(T value, byte[] dest, int offset);

    T decode(byte[] src, int offset);
}
