package com.raditha.pyrefactor.util;

import com.raditha.pyrefactor.model.Range;
import com.raditha.pyrefactor.model.TextEdit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceEditsTest {

    private static final String SOURCE = """
            line one
            line two
            line three
            """;

    @Test
    void testEditsReferToOriginalPositions() {
        List<TextEdit> edits = List.of(
                TextEdit.deleteLines(1, 1),
                TextEdit.insertBeforeLine(3, "inserted\n"),
                TextEdit.replace(new Range(2, 6, 2, 9), "2"));

        assertEquals("line 2\ninserted\nline three\n", SourceEdits.apply(SOURCE, edits));
    }

    @Test
    void testOrderOfBatchDoesNotMatter() {
        TextEdit first = TextEdit.replaceLines(1, 1, "first\n");
        TextEdit last = TextEdit.replaceLines(3, 3, "last\n");

        assertEquals(SourceEdits.apply(SOURCE, List.of(first, last)), SourceEdits.apply(SOURCE, List.of(last, first)));
    }

    @Test
    void testInsertionsAtSamePositionKeepBatchOrder() {
        List<TextEdit> edits = List.of(
                TextEdit.insertBeforeLine(2, "a\n"),
                TextEdit.insertBeforeLine(2, "b\n"));

        assertEquals("line one\na\nb\nline two\nline three\n", SourceEdits.apply(SOURCE, edits));
    }

    @Test
    void testInsertionBeforeDeletionAtSameLine() {
        List<TextEdit> edits = List.of(
                TextEdit.deleteLines(2, 2),
                TextEdit.insertBeforeLine(2, "new\n"));

        assertEquals("line one\nnew\nline three\n", SourceEdits.apply(SOURCE, edits));
    }

    @Test
    void testAppendPastTheEnd() {
        String result = SourceEdits.apply(SOURCE, List.of(TextEdit.insertBeforeLine(4, "line four\n")));

        assertEquals(SOURCE + "line four\n", result);
    }

    @Test
    void testOverlappingEditsAreRejected() {
        List<TextEdit> edits = List.of(
                TextEdit.replaceLines(1, 2, "x\n"),
                TextEdit.replaceLines(2, 3, "y\n"));

        assertThrows(IllegalStateException.class, () -> SourceEdits.apply(SOURCE, edits));
    }

    @Test
    void testNoEditsReturnsSource() {
        assertEquals(SOURCE, SourceEdits.apply(SOURCE, List.of()));
    }

    @Test
    void testSlice() {
        assertEquals("two", SourceEdits.slice(SOURCE, new Range(2, 6, 2, 9)));
        assertEquals("one\nline", SourceEdits.slice(SOURCE, new Range(1, 6, 2, 5)));
        assertEquals("line two", SourceEdits.slice(SOURCE, Range.ofLines(2, 2)));
    }
}
