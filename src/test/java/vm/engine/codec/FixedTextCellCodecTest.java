package vm.engine.codec;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class FixedTextCellCodecTest {

    @Test
    void padsWithZerosAndStripsOnDecode() {
        FixedTextCellCodec codec = new FixedTextCellCodec(4);
        byte[] slot = {'x', 'x', 'x', 'x'};
        codec.encode("ab", slot, 0);
        assertArrayEquals(new byte[] {'a', 'b', 0, 0}, slot);
        assertEquals("ab", codec.decode(slot, 0));
    }

    @Test
    void truncatesLongValues() {
        FixedTextCellCodec codec = new FixedTextCellCodec(5);
        assertEquals("Hello", codec.normalize("Hello, world"));
        byte[] slot = new byte[5];
        codec.encode("Hello, world", slot, 0);
        assertEquals("Hello", codec.decode(slot, 0));
    }

    @Test
    void unmappableCharactersBecomeQuestionMarks() {
        FixedTextCellCodec codec = new FixedTextCellCodec(3);
        assertEquals("a?é", codec.normalize("aЖé"));
        byte[] slot = new byte[3];
        codec.encode("aЖé", slot, 0);
        assertEquals(codec.normalize("aЖé"), codec.decode(slot, 0));
    }

    @Test
    void surrogatePairsTruncateByEncodedBytes() {
        FixedTextCellCodec wide = new FixedTextCellCodec(8);
        assertEquals("a?b", wide.normalize("a\uD83D\uDE00b"));

        FixedTextCellCodec narrow = new FixedTextCellCodec(2);
        String emojis = "\uD83D\uDE00\uD83D\uDE00\uD83D\uDE00";
        assertEquals("??", narrow.normalize(emojis));
        byte[] slot = new byte[2];
        narrow.encode(emojis, slot, 0);
        assertEquals(narrow.normalize(emojis), narrow.decode(slot, 0));
    }

    @Test
    void emptyStringIsDefault() {
        FixedTextCellCodec codec = new FixedTextCellCodec(8);
        assertEquals("", codec.defaultValue());
        assertEquals("", codec.decode(new byte[8], 0));
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> new FixedTextCellCodec(0));
    }
}
