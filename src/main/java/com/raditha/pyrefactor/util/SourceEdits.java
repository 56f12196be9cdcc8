package com.raditha.pyrefactor.util;

import com.raditha.pyrefactor.model.Range;
import com.raditha.pyrefactor.model.TextEdit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies a batch of {@link TextEdit}s to a source text in one pass.
 * <p>
 * All edits refer to positions in the original text, so their order in the
 * batch does not matter and none of them shifts another. Insertions at the
 * same position keep their batch order. Overlapping edits are a programming
 * error and raise {@link IllegalStateException}.
 */
public final class SourceEdits {

    private SourceEdits() {
    }

    public static String apply(String source, List<TextEdit> edits) {
        int[] lineStarts = lineStarts(source);
        List<int[]> spans = new ArrayList<>();
        for (int i = 0; i < edits.size(); i++) {
            Range r = edits.get(i).range();
            int start = offset(source, lineStarts, r.startLine(), r.startColumn());
            int end = offset(source, lineStarts, r.endLine(), r.endColumn());
            if (end < start) {
                throw new IllegalStateException("Edit ends before it starts: " + r);
            }
            spans.add(new int[]{start, end, i});
        }
        spans.sort(Comparator.<int[]>comparingInt(s -> s[0]).thenComparingInt(s -> s[1]).thenComparingInt(s -> s[2]));

        StringBuilder out = new StringBuilder(source.length());
        int cursor = 0;
        for (int[] span : spans) {
            if (span[0] < cursor) {
                throw new IllegalStateException("Overlapping edits at " + edits.get(span[2]).range());
            }
            out.append(source, cursor, span[0]);
            out.append(edits.get(span[2]).replacement());
            cursor = span[1];
        }
        out.append(source, cursor, source.length());
        return out.toString();
    }

    /**
     * The text covered by {@code range}.
     */
    public static String slice(String source, Range range) {
        int[] lineStarts = lineStarts(source);
        int start = offset(source, lineStarts, range.startLine(), range.startColumn());
        int end = offset(source, lineStarts, range.endLine(), range.endColumn());
        return source.substring(start, Math.max(start, end));
    }

    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Character offset of a 1-based position. Lines past the end map to the end
     * of the text and columns past the end of a line to the end of that line.
     */
    private static int offset(String source, int[] lineStarts, int line, int column) {
        if (line > lineStarts.length) {
            return source.length();
        }
        int lineStart = lineStarts[line - 1];
        int lineEnd = line < lineStarts.length ? lineStarts[line] - 1 : source.length();
        long target = (long) lineStart + column - 1;
        return (int) Math.min(target, lineEnd);
    }
}
