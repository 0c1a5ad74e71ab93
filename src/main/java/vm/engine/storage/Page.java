package vm.engine.storage;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * One buffer slot: the decoded cells of a single page plus its bookkeeping.
 *
 * Slots are created invalid and become valid on first load. Mutable and owned by a single
 * {@link PageBuffer}; never shared outside the array that owns that buffer.
 */
public final class Page<T> {
    private int pageNumber = -1;
    private final List<T> cells = new ArrayList<>(Collections.nCopies(PageLayout.CELLS_PER_PAGE, null));
    private BitSet presence = new BitSet(PageLayout.CELLS_PER_PAGE);
    private boolean dirty;
    private boolean valid;
    private long lastTouch;

    public int pageNumber() { return pageNumber; }
    public boolean isDirty() { return dirty; }
    public boolean isValid() { return valid; }
    public long lastTouch() { return lastTouch; }

    public boolean isPresent(int offset) { return presence.get(offset); }

    public T cell(int offset) { return cells.get(offset); }

    /** Store a value into a cell, marking it present and the page dirty. */
    public void put(int offset, T value) {
        cells.set(offset, value);
        presence.set(offset);
        dirty = true;
    }

    /** Copy of the presence bits, for write-back. */
    BitSet presence() { return (BitSet) presence.clone(); }

    void touch(long tick) { this.lastTouch = tick; }

    void markClean() { this.dirty = false; }

    /** Install a fully decoded page into this slot. */
    void load(int pageNumber, BitSet presence, List<T> decoded, long tick) {
        for (int i = 0; i < PageLayout.CELLS_PER_PAGE; i++) cells.set(i, decoded.get(i));
        this.presence = presence;
        this.pageNumber = pageNumber;
        this.dirty = false;
        this.valid = true;
        this.lastTouch = tick;
    }

    @Override
    public String toString() {
        return "Page{number=" + pageNumber +
               ", valid=" + valid +
               ", dirty=" + dirty +
               ", lastTouch=" + lastTouch +
               ", present=" + presence.cardinality() + "}";
    }
}
