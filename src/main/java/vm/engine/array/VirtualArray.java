package vm.engine.array;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;

import vm.engine.catalog.ElementKind;
import vm.engine.storage.BufferStats;

/**
 * Fixed-size array of {@code size()} elements paged through a small in-memory buffer over one swap file.
 *
 * Never-written elements read as the element kind's default (0 or the empty string).
 * Single accessor only: instances are not thread-safe, and two instances must not share a swap file.
 */
public interface VirtualArray<T> extends Closeable {
    long size();

    ElementKind kind();

    Path path();

    /**
     * @throws IndexOutOfBoundsException if index is negative or {@code >= size()}; no I/O is done
     * @throws IOException if the page holding index could not be loaded, or a dirty page could not be evicted
     */
    T read(long index) throws IOException;

    /**
     * Store value at index. The write stays in the buffer until eviction, {@link #flush()} or {@link #close()}.
     * @throws IndexOutOfBoundsException if index is negative or {@code >= size()}; no I/O is done
     */
    void write(long index, T value) throws IOException;

    /** Write every buffered dirty page back to the swap file. */
    void flush() throws IOException;

    BufferStats stats();

    /** Flush, then release the swap file. Further reads and writes fail; closing twice is a no-op. */
    @Override
    void close() throws IOException;
}
