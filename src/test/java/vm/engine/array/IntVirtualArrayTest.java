package vm.engine.array;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import vm.engine.catalog.ElementKind;
import vm.engine.storage.BufferStats;
import vm.engine.storage.PageLayout;

public class IntVirtualArrayTest {

    @TempDir
    Path dir;

    private String swap() { return dir.resolve("swapfile.dat").toString(); }

    private static int intOnDisk(Path file, long index) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        PageLayout layout = new PageLayout((int) (bytes.length / 528), 4, 512);
        int pos = (int) layout.pageOffset((int) (index / 128)) + PageLayout.BITMAP_BYTES + (int) (index % 128) * 4;
        return ByteBuffer.wrap(bytes, pos, 4).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    @Test
    void freshArrayReadsZeros() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 1000)) {
            assertEquals(ElementKind.INT, array.kind());
            assertEquals(1000, array.size());
            for (long i = 0; i < 1000; i += 37) assertEquals(0, array.readInt(i));
            assertEquals(0, array.readInt(999));
        }
        assertEquals(2 + 8 * 528, Files.size(dir.resolve("swapfile.dat")));
    }

    @Test
    void writeThenRead() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 1000)) {
            array.writeInt(5, 123);
            array.writeInt(6, -7);
            array.writeInt(700, Integer.MIN_VALUE);
            array.writeInt(999, Integer.MAX_VALUE);
            assertEquals(123, array.readInt(5));
            assertEquals(-7, array.readInt(6));
            assertEquals(Integer.MIN_VALUE, array.readInt(700));
            assertEquals(Integer.MAX_VALUE, array.readInt(999));
            assertEquals(0, array.readInt(4));

            array.writeInt(5, 321);
            assertEquals(321, array.readInt(5));
        }
    }

    @Test
    void boundsAreCheckedBeforeAnyIo() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 300)) {
            assertThrows(IndexOutOfBoundsException.class, () -> array.readInt(300));
            assertThrows(IndexOutOfBoundsException.class, () -> array.writeInt(300, 1));
            assertThrows(IndexOutOfBoundsException.class, () -> array.readInt(-1));
            assertEquals(new BufferStats(0, 0, 0, 0), array.stats());
            assertEquals(0, array.readInt(299));
        }
    }

    @Test
    void persistsAcrossCloseAndReopen() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 1000)) {
            array.writeInt(0, 1);
            array.writeInt(500, 2);
            array.writeInt(999, 3);
        }
        try (IntVirtualArray array = new IntVirtualArray(swap(), 1000)) {
            assertEquals(1, array.readInt(0));
            assertEquals(2, array.readInt(500));
            assertEquals(3, array.readInt(999));
            assertEquals(0, array.readInt(1));
        }
    }

    @Test
    void fiveThousandIntegersScenario() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 5000)) {
            array.writeInt(4999, 42);
            array.writeInt(0, 7);
            assertEquals(42, array.readInt(4999));
            assertEquals(0, array.readInt(1));
        }
        try (IntVirtualArray array = new IntVirtualArray(swap(), 5000)) {
            assertEquals(42, array.readInt(4999));
            assertEquals(7, array.readInt(0));
        }
    }

    @Test
    void evictedDirtyPageReachesDisk() throws Exception {
        Path file = dir.resolve("swapfile.dat");
        try (IntVirtualArray array = new IntVirtualArray(file.toString(), 4 * 128)) {
            array.writeInt(10, 555);   // page 0, dirty
            array.readInt(128);        // page 1
            array.readInt(256);        // page 2
            assertEquals(0, intOnDisk(file, 10));

            array.readInt(384);        // page 3 evicts page 0
            BufferStats stats = array.stats();
            assertEquals(1, stats.evictions());
            assertEquals(1, stats.writeBacks());
            assertEquals(555, intOnDisk(file, 10));

            // reloading page 0 evicts page 1 and reads the written-back value
            assertEquals(555, array.readInt(10));
            assertEquals(2, array.stats().evictions());
        }
        try (IntVirtualArray array = new IntVirtualArray(file.toString(), 4 * 128)) {
            assertEquals(555, array.readInt(10));
        }
    }

    @Test
    void flushIsIdempotent() throws Exception {
        Path file = dir.resolve("swapfile.dat");
        try (IntVirtualArray array = new IntVirtualArray(file.toString(), 1000)) {
            array.writeInt(3, 33);
            array.writeInt(900, 99);
            array.flush();
            byte[] first = Files.readAllBytes(file);
            long writeBacks = array.stats().writeBacks();

            array.flush();
            assertArrayEquals(first, Files.readAllBytes(file));
            assertEquals(writeBacks, array.stats().writeBacks());
            assertEquals(33, intOnDisk(file, 3));
        }
    }

    @Test
    void explicitZeroIsMarkedPresent() throws Exception {
        Path file = dir.resolve("swapfile.dat");
        try (IntVirtualArray array = new IntVirtualArray(file.toString(), 128)) {
            array.writeInt(9, 0);
        }
        byte[] bytes = Files.readAllBytes(file);
        assertEquals(0x02, bytes[2 + 1]);
    }

    @Test
    void closedArrayRejectsOperations() throws Exception {
        IntVirtualArray array = new IntVirtualArray(swap(), 10);
        array.writeInt(1, 1);
        array.close();
        assertTrue(array.isClosed());
        assertThrows(IllegalStateException.class, () -> array.readInt(1));
        assertThrows(IllegalStateException.class, () -> array.writeInt(1, 2));
        assertThrows(IllegalStateException.class, array::flush);
        array.close();
    }

    @Test
    void reopenWithDifferentSizeFailsEagerly() throws Exception {
        new IntVirtualArray(swap(), 1000).close();
        IOException ex = assertThrows(IOException.class, () -> new IntVirtualArray(swap(), 5000));
        assertTrue(ex.getMessage().contains("size mismatch"), ex.getMessage());
        // same page count is indistinguishable on disk and reopens fine
        new IntVirtualArray(swap(), 1020).close();
    }

    @Test
    void rejectsNullValues() throws Exception {
        try (IntVirtualArray array = new IntVirtualArray(swap(), 10)) {
            assertThrows(NullPointerException.class, () -> array.write(0, null));
        }
    }
}
