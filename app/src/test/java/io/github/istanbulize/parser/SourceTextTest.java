package io.github.istanbulize.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.github.istanbulize.report.Position;
import io.github.istanbulize.syntax.OffsetSpan;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

public class SourceTextTest {

    @Test
    void testAsciiBytesAreChars() {
        var source = new SourceText("let x = 1;");

        assertEquals(10, source.byteLength());
        for (int i = 0; i <= 10; i++) {
            assertEquals(i, source.charOffset(i));
        }
    }

    @Test
    void testMultiByteCharacters() {
        // a: byte 0, é: bytes 1-2, b: byte 3
        var source = new SourceText("aéb");

        assertEquals(4, source.byteLength());
        assertEquals("aéb".getBytes(StandardCharsets.UTF_8).length, source.byteLength());
        assertEquals(1, source.charOffset(1));
        assertEquals(1, source.charOffset(2), "A byte inside a character maps to that character");
        assertEquals(2, source.charOffset(3));
        assertEquals(3, source.charOffset(4));
    }

    @Test
    void testSupplementaryCharacters() {
        // the emoji is 4 UTF-8 bytes and 2 UTF-16 code units
        var text = "a😀b";
        var source = new SourceText(text);

        assertEquals(6, source.byteLength());
        assertEquals(1, source.charOffset(1));
        assertEquals(3, source.charOffset(5));
        assertEquals(4, source.charOffset(6));
        assertEquals("b", source.substring(source.spanOfBytes(5, 6)));
    }

    @Test
    void testSupplementaryCharacterWithSurrogateLikeLowBits() {
        // U+2D800 (CJK Extension F) is a 4-byte character whose low 16 bits fall in the surrogate range
        var text = "a" + new String(Character.toChars(0x2D800)) + "b";
        var source = new SourceText(text);

        assertEquals(text.getBytes(StandardCharsets.UTF_8).length, source.byteLength());
        assertEquals(6, source.byteLength());
        assertEquals(3, source.charOffset(5));
        assertEquals("b", source.substring(source.spanOfBytes(5, 6)));
        assertEquals(new Position(1, 3), source.position(source.charOffset(5)));
    }

    @Test
    void testByteOffsetsAreClamped() {
        var source = new SourceText("aé");

        assertEquals(0, source.charOffset(-3));
        assertEquals(2, source.charOffset(100));
    }

    @Test
    void testPositions() {
        var source = new SourceText("ab\ncd\n");

        assertEquals(3, source.lineCount());
        assertEquals(new Position(1, 0), source.position(0));
        assertEquals(new Position(1, 2), source.position(2), "The newline belongs to the line it ends");
        assertEquals(new Position(2, 0), source.position(3));
        assertEquals(new Position(2, 2), source.position(5));
        assertEquals(new Position(3, 0), source.position(6));
        assertThrows(IndexOutOfBoundsException.class, () -> source.position(7));
        assertThrows(IndexOutOfBoundsException.class, () -> source.position(-1));
    }

    @Test
    void testLineTerminators() {
        var crlf = new SourceText("a\r\nb");
        assertEquals(2, crlf.lineCount());
        assertEquals(new Position(1, 2), crlf.position(2));
        assertEquals(new Position(2, 0), crlf.position(3));

        var cr = new SourceText("a\rb");
        assertEquals(new Position(2, 0), cr.position(2));

        var separators = new SourceText("a\u2028b\u2029c");
        assertEquals(3, separators.lineCount());
        assertEquals(new Position(3, 0), separators.position(4));
    }

    @Test
    void testColumnsCountUtf16Units() {
        var source = new SourceText("x = \"😀\"; y");

        assertEquals(new Position(1, 10), source.position(source.text().indexOf('y')));
    }

    @Test
    void testLocation() {
        var source = new SourceText("function f() {\n  return 1;\n}\n");

        var location = source.location(new OffsetSpan(0, 28));

        assertEquals(new Position(1, 0), location.start());
        assertEquals(new Position(3, 1), location.end());
    }
}
