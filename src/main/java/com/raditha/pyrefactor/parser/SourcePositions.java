package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.model.Range;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps the UTF-8 byte offsets of syntax tree nodes to character offsets and to
 * 1-based line and column positions of the source string.
 */
final class SourcePositions {

    private final String source;
    private final int[] charAtByte;
    private final int[] lineStarts;

    SourcePositions(String source) {
        this.source = source;
        this.charAtByte = new int[source.getBytes(StandardCharsets.UTF_8).length + 1];
        int b = 0;
        for (int i = 0; i < source.length(); ) {
            int codePoint = source.codePointAt(i);
            int width = utf8Width(codePoint);
            for (int k = 0; k < width; k++) {
                charAtByte[b++] = i;
            }
            i += Character.charCount(codePoint);
        }
        charAtByte[b] = source.length();

        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE) {
            // unpaired surrogate, encoded as '?'
            return 1;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }

    int charOffset(int byteOffset) {
        return charAtByte[Math.min(Math.max(byteOffset, 0), charAtByte.length - 1)];
    }

    int startChar(TSNode node) {
        return charOffset(node.getStartByte());
    }

    int endChar(TSNode node) {
        return charOffset(node.getEndByte());
    }

    String text(TSNode node) {
        return source.substring(startChar(node), endChar(node));
    }

    String slice(int startChar, int endChar) {
        return source.substring(startChar, endChar);
    }

    /**
     * 1-based line of a character offset.
     */
    int line(int charOffset) {
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= charOffset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * 1-based column of a character offset.
     */
    int column(int charOffset) {
        return charOffset - lineStarts[line(charOffset) - 1] + 1;
    }

    Range range(TSNode node) {
        return range(startChar(node), endChar(node));
    }

    Range range(int startChar, int endChar) {
        return new Range(line(startChar), column(startChar), line(endChar), column(endChar));
    }

    /**
     * From the start of {@code first} to the end of {@code last}.
     */
    Range span(TSNode first, TSNode last) {
        return range(startChar(first), endChar(last));
    }

    /**
     * From the start of {@code node} to the end of an already converted range.
     */
    Range span(TSNode node, Range end) {
        int start = startChar(node);
        return new Range(line(start), column(start), end.endLine(), end.endColumn());
    }
}
