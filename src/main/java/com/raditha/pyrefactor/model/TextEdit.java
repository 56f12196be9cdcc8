package com.raditha.pyrefactor.model;

/**
 * Replacement of a span of source text. An empty span inserts, an empty
 * replacement deletes.
 *
 * @param range       the span to replace; columns are 1-based, the end column exclusive
 * @param replacement the new text
 */
public record TextEdit(Range range, String replacement) {

    /**
     * Inserts {@code text} at the start of {@code line}. A line one past the end
     * of the file appends.
     */
    public static TextEdit insertBeforeLine(int line, String text) {
        return new TextEdit(new Range(line, 1, line, 1), text);
    }

    /**
     * Replaces the whole lines {@code startLine..endLine} including the newline
     * that ends the last of them.
     */
    public static TextEdit replaceLines(int startLine, int endLine, String text) {
        return new TextEdit(new Range(startLine, 1, endLine + 1, 1), text);
    }

    public static TextEdit deleteLines(int startLine, int endLine) {
        return replaceLines(startLine, endLine, "");
    }

    public static TextEdit replace(Range range, String text) {
        return new TextEdit(range, text);
    }
}
