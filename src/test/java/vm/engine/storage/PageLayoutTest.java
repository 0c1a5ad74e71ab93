package vm.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import vm.engine.codec.FixedTextCellCodec;
import vm.engine.codec.IntCellCodec;

public class PageLayoutTest {

    @Test
    void intLayout() {
        PageLayout layout = PageLayout.of(5000, IntCellCodec.INSTANCE);
        assertEquals(40, layout.numPages());
        assertEquals(512, layout.dataRegionSize());
        assertEquals(528, layout.pageSlotSize());
        assertEquals(2, layout.pageOffset(0));
        assertEquals(2 + 3 * 528, layout.pageOffset(3));
        assertEquals(2 + 40 * 528, layout.fileSize());
    }

    @Test
    void pageCountRoundsUp() {
        assertEquals(0, PageLayout.of(0, IntCellCodec.INSTANCE).numPages());
        assertEquals(1, PageLayout.of(128, IntCellCodec.INSTANCE).numPages());
        assertEquals(2, PageLayout.of(129, IntCellCodec.INSTANCE).numPages());
        assertEquals(2, PageLayout.of(0, IntCellCodec.INSTANCE).fileSize());
    }

    @Test
    void textRegionRoundsToStorageGranule() {
        assertEquals(512, PageLayout.of(10, new FixedTextCellCodec(1)).dataRegionSize());
        assertEquals(512, PageLayout.of(10, new FixedTextCellCodec(4)).dataRegionSize());
        assertEquals(1024, PageLayout.of(10, new FixedTextCellCodec(5)).dataRegionSize());
        assertEquals(2560, PageLayout.of(10, new FixedTextCellCodec(20)).dataRegionSize());
    }

    @Test
    void rejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> PageLayout.of(-1, IntCellCodec.INSTANCE));
    }
}
