package vm.engine.storage;

import java.io.Closeable;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import vm.engine.codec.CellCodec;

/**
 * The swap file backing one virtual array: a 2-byte signature followed by one fixed-size
 * bitmap + data slot per page (see {@link PageLayout}).
 *
 * Regions are always read and written whole; a short read is reported as an {@link IOException}
 * and nothing is installed into the target page.
 */
public final class PageStore<T> implements Closeable {
    private final Path path;
    private final PageLayout layout;
    private final CellCodec<T> codec;
    private final RandomAccessFile file;
    private final FileChannel channel;

    private PageStore(Path path, PageLayout layout, CellCodec<T> codec, RandomAccessFile file) {
        this.path = path;
        this.layout = layout;
        this.codec = codec;
        this.file = file;
        this.channel = file.getChannel();
    }

    /** Open the store at {@code path}, creating and zero-filling it first if it does not exist. */
    public static <T> PageStore<T> openOrCreate(Path path, PageLayout layout, CellCodec<T> codec) throws IOException {
        return Files.exists(path) ? open(path, layout, codec) : create(path, layout, codec);
    }

    /**
     * Create a fresh store: signature followed by zero-filled regions for every page.
     * Fails if the file already exists or cannot be created; a partially written file is removed.
     */
    public static <T> PageStore<T> create(Path path, PageLayout layout, CellCodec<T> codec) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.createFile(path);
        RandomAccessFile raf = null;
        try {
            raf = new RandomAccessFile(path.toFile(), "rw");
            PageStore<T> store = new PageStore<>(path, layout, codec, raf);
            store.writeFully(ByteBuffer.wrap(PageLayout.SIGNATURE), 0);
            byte[] zeroSlot = new byte[layout.pageSlotSize()];
            for (int p = 0; p < layout.numPages(); p++) {
                store.writeFully(ByteBuffer.wrap(zeroSlot), layout.pageOffset(p));
            }
            store.channel.force(true);
            return store;
        } catch (IOException e) {
            if (raf != null) closeQuietly(raf, e);
            Files.deleteIfExists(path);
            throw e;
        }
    }

    /**
     * Open an existing store and check it against the declared layout: the signature must be
     * "VM" and the file length must be exactly {@link PageLayout#fileSize()}.
     */
    public static <T> PageStore<T> open(Path path, PageLayout layout, CellCodec<T> codec) throws IOException {
        RandomAccessFile raf = new RandomAccessFile(path.toFile(), "rw");
        try {
            long actual = raf.length();
            if (actual != layout.fileSize()) {
                throw new IOException("Swap file size mismatch for " + path + ": expected " + layout.fileSize()
                    + " bytes for " + layout.numPages() + " pages of " + codec + ", found " + actual);
            }
            byte[] sig = new byte[PageLayout.SIGNATURE.length];
            raf.seek(0);
            raf.readFully(sig);
            if (!Arrays.equals(sig, PageLayout.SIGNATURE)) {
                throw new IOException("Bad swap file signature in " + path);
            }
            return new PageStore<>(path, layout, codec, raf);
        } catch (IOException e) {
            closeQuietly(raf, e);
            throw e;
        }
    }

    public Path path() { return path; }

    /**
     * Read page {@code pageNumber} and install it into {@code target}. Both regions are read and
     * decoded before the slot is touched.
     */
    public void readPage(int pageNumber, Page<T> target, long tick) throws IOException {
        checkPageNumber(pageNumber);
        long offset = layout.pageOffset(pageNumber);

        ByteBuffer bitmap = ByteBuffer.allocate(PageLayout.BITMAP_BYTES);
        readFully(bitmap, offset, "bitmap", pageNumber);
        ByteBuffer data = ByteBuffer.allocate(layout.dataRegionSize());
        readFully(data, offset + PageLayout.BITMAP_BYTES, "data", pageNumber);

        BitSet presence = decodeBitmap(bitmap.array());
        byte[] raw = data.array();
        List<T> cells = new ArrayList<>(PageLayout.CELLS_PER_PAGE);
        for (int i = 0; i < PageLayout.CELLS_PER_PAGE; i++) {
            cells.add(presence.get(i) ? codec.decode(raw, i * layout.cellWidth()) : codec.defaultValue());
        }
        target.load(pageNumber, presence, cells, tick);
    }

    /** Encode {@code page} into its slot and force it to disk. Does not change the page's dirty flag. */
    public void writePage(Page<T> page) throws IOException {
        int pageNumber = page.pageNumber();
        checkPageNumber(pageNumber);
        BitSet presence = page.presence();

        ByteBuffer slot = ByteBuffer.allocate(layout.pageSlotSize());
        byte[] raw = slot.array();
        System.arraycopy(encodeBitmap(presence), 0, raw, 0, PageLayout.BITMAP_BYTES);
        for (int i = 0; i < PageLayout.CELLS_PER_PAGE; i++) {
            // Absent cells stay zero so a never-written cell is byte-identical to a fresh file
            if (presence.get(i)) {
                codec.encode(page.cell(i), raw, PageLayout.BITMAP_BYTES + i * layout.cellWidth());
            }
        }
        writeFully(slot, layout.pageOffset(pageNumber));
        channel.force(false);
    }

    @Override
    public void close() throws IOException {
        file.close();
    }

    /** bit i lives in byte i/8 with value 1 << (i % 8) */
    static byte[] encodeBitmap(BitSet presence) {
        byte[] out = new byte[PageLayout.BITMAP_BYTES];
        for (int i = presence.nextSetBit(0); i >= 0 && i < PageLayout.CELLS_PER_PAGE; i = presence.nextSetBit(i + 1)) {
            out[i / 8] |= (byte) (1 << (i % 8));
        }
        return out;
    }

    static BitSet decodeBitmap(byte[] bytes) {
        BitSet presence = new BitSet(PageLayout.CELLS_PER_PAGE);
        for (int i = 0; i < PageLayout.CELLS_PER_PAGE; i++) {
            if (((bytes[i / 8] >> (i % 8)) & 0x1) == 1) presence.set(i);
        }
        return presence;
    }

    private void checkPageNumber(int pageNumber) {
        if (pageNumber < 0 || pageNumber >= layout.numPages()) {
            throw new IndexOutOfBoundsException("Page " + pageNumber + " out of range [0, " + layout.numPages() + ")");
        }
    }

    private void readFully(ByteBuffer buf, long position, String region, int pageNumber) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) break;
            pos += n;
        }
        if (buf.hasRemaining()) {
            throw new IOException("Short " + region + " read at page " + pageNumber + " of " + path
                + ": expected " + buf.capacity() + " bytes, got " + buf.position());
        }
    }

    private void writeFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += channel.write(buf, pos);
        }
    }

    private static void closeQuietly(RandomAccessFile raf, IOException primary) {
        try {
            raf.close();
        } catch (IOException suppressed) {
            primary.addSuppressed(suppressed);
        }
    }

    @Override
    public String toString() {
        return "PageStore{path=" + path + ", codec=" + codec + ", pages=" + layout.numPages() + "}";
    }
}
