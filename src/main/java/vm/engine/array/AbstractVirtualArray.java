package vm.engine.array;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

import vm.engine.catalog.ArraySpec;
import vm.engine.catalog.ElementKind;
import vm.engine.codec.CellCodec;
import vm.engine.storage.BufferStats;
import vm.engine.storage.Page;
import vm.engine.storage.PageBuffer;
import vm.engine.storage.PageLayout;
import vm.engine.storage.PageStore;

/**
 * Shared paging logic; subclasses only choose the {@link CellCodec}.
 */
public abstract class AbstractVirtualArray<T> implements VirtualArray<T> {
    private final ArraySpec spec;
    private final CellCodec<T> codec;
    private final PageStore<T> store;
    private final PageBuffer<T> buffer;
    private boolean closed;

    protected AbstractVirtualArray(ArraySpec spec, CellCodec<T> codec) throws IOException {
        this.spec = spec;
        this.codec = codec;
        PageLayout layout = PageLayout.of(spec.size(), codec);
        this.store = PageStore.openOrCreate(Path.of(spec.filePath()), layout, codec);
        this.buffer = new PageBuffer<>(store);
    }

    @Override
    public long size() { return spec.size(); }

    @Override
    public ElementKind kind() { return spec.kind(); }

    @Override
    public Path path() { return store.path(); }

    public ArraySpec spec() { return spec; }

    protected CellCodec<T> codec() { return codec; }

    @Override
    public T read(long index) throws IOException {
        ensureOpen();
        checkIndex(index);
        Page<T> page = buffer.locateOrAdmit(pageNumber(index));
        int offset = cellOffset(index);
        return page.isPresent(offset) ? page.cell(offset) : codec.defaultValue();
    }

    @Override
    public void write(long index, T value) throws IOException {
        Objects.requireNonNull(value, "value");
        ensureOpen();
        checkIndex(index);
        Page<T> page = buffer.locateOrAdmit(pageNumber(index));
        page.put(cellOffset(index), codec.normalize(value));
        buffer.touch(page);
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        buffer.flush();
    }

    @Override
    public BufferStats stats() { return buffer.stats(); }

    /**
     * The file handle is released even when the final flush fails; the flush failure is still thrown.
     */
    @Override
    public void close() throws IOException {
        if (closed) return;
        closed = true;
        try {
            buffer.flush();
        } finally {
            store.close();
        }
    }

    public boolean isClosed() { return closed; }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Array is closed: " + spec.filePath());
    }

    private void checkIndex(long index) {
        if (index < 0 || index >= spec.size()) {
            throw new IndexOutOfBoundsException("Index " + index + " out of range for array of size " + spec.size());
        }
    }

    private static int pageNumber(long index) { return (int) (index / PageLayout.CELLS_PER_PAGE); }

    private static int cellOffset(long index) { return (int) (index % PageLayout.CELLS_PER_PAGE); }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{path=" + spec.filePath() + ", type=" + spec.typeTag() + ", size=" + spec.size() + "}";
    }
}
