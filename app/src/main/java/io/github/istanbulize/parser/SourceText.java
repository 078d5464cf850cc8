package io.github.istanbulize.parser;

import io.github.istanbulize.report.Position;
import io.github.istanbulize.report.SourceLocation;
import io.github.istanbulize.syntax.OffsetSpan;
import java.util.Arrays;

/**
 * Offset index over a source text. TreeSitter reports UTF-8 byte offsets, while V8 coverage and Java strings use
 * UTF-16 code units, and Istanbul wants 1-based lines with 0-based UTF-16 columns. This class converts between all
 * three in O(1) (bytes) and O(log lines) (positions) after a single pass over the text.
 */
public final class SourceText {
    private final String text;
    private final int byteLength;
    // byteToChar[b] is the UTF-16 index of the character that starts at or contains UTF-8 byte b
    private final int[] byteToChar;
    private final int[] lineStarts;

    public SourceText(String text) {
        this.text = text;
        this.byteLength = utf8Length(text);
        this.byteToChar = new int[byteLength + 1];
        this.lineStarts = computeLineStarts(text);

        int b = 0;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            int width = utf8Width(cp);
            for (int k = 0; k < width; k++) {
                byteToChar[b + k] = i;
            }
            b += width;
            i += Character.charCount(cp);
        }
        byteToChar[byteLength] = text.length();
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    public int byteLength() {
        return byteLength;
    }

    public int lineCount() {
        return lineStarts.length;
    }

    /** Converts a UTF-8 byte offset to a UTF-16 offset. Offsets past the end clamp to the text length. */
    public int charOffset(int byteOffset) {
        if (byteOffset <= 0) {
            return 0;
        }
        if (byteOffset >= byteLength) {
            return text.length();
        }
        return byteToChar[byteOffset];
    }

    public OffsetSpan spanOfBytes(int startByte, int endByte) {
        return new OffsetSpan(charOffset(startByte), charOffset(endByte));
    }

    /** Line/column of a UTF-16 offset. A line terminator belongs to the line it terminates. */
    public Position position(int charOffset) {
        if (charOffset < 0 || charOffset > text.length()) {
            throw new IndexOutOfBoundsException("Offset " + charOffset + " outside [0, " + text.length() + "]");
        }
        int idx = Arrays.binarySearch(lineStarts, charOffset);
        int line = idx >= 0 ? idx : -idx - 2;
        return new Position(line + 1, charOffset - lineStarts[line]);
    }

    public SourceLocation location(OffsetSpan span) {
        return new SourceLocation(position(span.start()), position(span.end()));
    }

    public String substring(OffsetSpan span) {
        return text.substring(span.start(), span.end());
    }

    private static int[] computeLineStarts(String text) {
        var starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            int next = -1;
            if (c == '\r') {
                next = i + 1 < text.length() && text.charAt(i + 1) == '\n' ? i + 2 : i + 1;
            } else if (c == '\n' || c == '\u2028' || c == '\u2029') {
                next = i + 1;
            }
            if (next < 0) {
                i++;
                continue;
            }
            if (count == starts.length) {
                starts = Arrays.copyOf(starts, count * 2);
            }
            starts[count++] = next;
            i = next;
        }
        return Arrays.copyOf(starts, count);
    }

    private static int utf8Length(String text) {
        int length = 0;
        int i = 0;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            length += utf8Width(cp);
            i += Character.charCount(cp);
        }
        return length;
    }

    // Lone surrogates are encoded as '?' (one byte) by the UTF-8 encoder TreeSitter receives its input from.
    private static int utf8Width(int cp) {
        if (cp < 0x80) {
            return 1;
        } else if (cp < 0x800) {
            return 2;
        } else if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
            return 1;
        } else if (cp < 0x10000) {
            return 3;
        }
        return 4;
    }
}
