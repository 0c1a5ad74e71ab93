package vm.engine.storage;

import vm.engine.codec.CellCodec;

/**
 * Fixed on-disk geometry of a swap file.
 *
 * Layout:
 * [0..1]   signature "VM"
 * then for every page p in [0, numPages):
 *   16 bytes             presence bitmap, bit i set = cell i written
 *   dataRegionSize bytes cell slots, cell i at i * cellWidth, unused tail zero
 *
 * Page p starts at {@code 2 + p * (16 + dataRegionSize)}.
 */
public record PageLayout(int numPages, int cellWidth, int dataRegionSize) {
    public static final int CELLS_PER_PAGE = 128;
    public static final int BITMAP_BYTES = CELLS_PER_PAGE / 8;
    public static final int STORAGE_GRANULE = 512;
    public static final byte[] SIGNATURE = { 'V', 'M' };

    public PageLayout {
        if (numPages < 0) throw new IllegalArgumentException("numPages must be >= 0, got " + numPages);
        if (cellWidth < 1) throw new IllegalArgumentException("cellWidth must be >= 1, got " + cellWidth);
        if (dataRegionSize < CELLS_PER_PAGE * cellWidth) {
            throw new IllegalArgumentException("Data region of " + dataRegionSize + " bytes cannot hold "
                + CELLS_PER_PAGE + " cells of " + cellWidth + " bytes");
        }
    }

    /** Layout for an array of {@code arraySize} elements encoded by {@code codec}. */
    public static PageLayout of(long arraySize, CellCodec<?> codec) {
        if (arraySize < 0) throw new IllegalArgumentException("Array size must be >= 0, got " + arraySize);
        long pages = (arraySize + CELLS_PER_PAGE - 1) / CELLS_PER_PAGE;
        if (pages > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Array size " + arraySize + " needs more than " + Integer.MAX_VALUE + " pages");
        }
        return new PageLayout((int) pages, codec.width(), dataRegionSize(codec.width()));
    }

    /** ceil(128 * cellWidth / 512) * 512 */
    public static int dataRegionSize(int cellWidth) {
        long raw = (long) CELLS_PER_PAGE * cellWidth;
        long rounded = (raw + STORAGE_GRANULE - 1) / STORAGE_GRANULE * STORAGE_GRANULE;
        if (rounded > Integer.MAX_VALUE) throw new IllegalArgumentException("Cell width too large: " + cellWidth);
        return (int) rounded;
    }

    public int pageSlotSize() { return BITMAP_BYTES + dataRegionSize; }

    public long pageOffset(int pageNumber) {
        return SIGNATURE.length + (long) pageNumber * pageSlotSize();
    }

    /** Expected length of a swap file with this layout. */
    public long fileSize() {
        return SIGNATURE.length + (long) numPages * pageSlotSize();
    }
}
