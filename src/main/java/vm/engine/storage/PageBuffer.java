package vm.engine.storage;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-capacity Least Recently Used (LRU) buffer of pages over a single {@link PageStore}.
 *
 * Slots are scanned linearly; capacity is small and constant. Recency is a logical clock bumped
 * on every touch, so ordering never depends on wall-clock time. At most one valid slot holds a
 * given page number.
 */
public class PageBuffer<T> {
    public static final int DEFAULT_CAPACITY = 3;

    private final PageStore<T> store;
    private final List<Page<T>> slots;
    private long clock;

    private long hits;
    private long misses;
    private long evictions;
    private long writeBacks;

    public PageBuffer(PageStore<T> store) {
        this(store, DEFAULT_CAPACITY);
    }

    public PageBuffer(PageStore<T> store, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("Buffer capacity must be >= 1, got " + capacity);
        this.store = store;
        List<Page<T>> pages = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) pages.add(new Page<>());
        this.slots = Collections.unmodifiableList(pages);
    }

    public int capacity() { return slots.size(); }

    /**
     * Return the slot holding {@code pageNumber}, loading it if needed.
     * Order: hit on a valid slot, else the first invalid slot, else the least recently touched
     * slot (first in scan order on ties), written back first if dirty.
     */
    public Page<T> locateOrAdmit(int pageNumber) throws IOException {
        for (Page<T> p : slots) {
            if (p.isValid() && p.pageNumber() == pageNumber) {
                hits++;
                p.touch(++clock);
                return p;
            }
        }

        Page<T> target = null;
        boolean evicting = false;
        for (Page<T> p : slots) {
            if (!p.isValid()) {
                target = p;
                break;
            }
        }
        if (target == null) {
            target = slots.get(0);
            for (Page<T> p : slots) {
                if (p.lastTouch() < target.lastTouch()) target = p;
            }
            if (target.isDirty()) {
                writeBack(target);
            }
            evicting = true;
        }

        // A failed read leaves the target slot as it was
        store.readPage(pageNumber, target, ++clock);
        misses++;
        if (evicting) evictions++;
        return target;
    }

    /** Refresh the recency of an already located page. */
    public void touch(Page<T> page) {
        page.touch(++clock);
    }

    /** Write back every valid dirty slot. Clean and invalid slots are not touched. */
    public void flush() throws IOException {
        for (Page<T> p : slots) {
            if (p.isValid() && p.isDirty()) {
                writeBack(p);
            }
        }
    }

    /** Read-only view of the slots in scan order. */
    List<Page<T>> slots() { return slots; }

    public BufferStats stats() {
        return new BufferStats(hits, misses, evictions, writeBacks);
    }

    private void writeBack(Page<T> page) throws IOException {
        store.writePage(page);
        page.markClean();
        writeBacks++;
    }
}
