package com.raditha.pyrefactor.model;

/**
 * Represents a source code range (line and column positions).
 *
 * @param startLine   Starting line number (1-indexed)
 * @param startColumn Starting column number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param endColumn   Ending column number (1-indexed, exclusive)
 */
public record Range(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn) {

    public Range {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid range: " + startLine + "-" + endLine);
        }
    }

    /**
     * Range spanning from the start of {@code first} to the end of {@code last}.
     */
    public static Range between(Range first, Range last) {
        return new Range(first.startLine, first.startColumn, last.endLine, last.endColumn);
    }

    /**
     * Range covering the given whole lines.
     */
    public static Range ofLines(int startLine, int endLine) {
        return new Range(startLine, 1, endLine, Integer.MAX_VALUE);
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    public boolean containsLine(int line) {
        return line >= startLine && line <= endLine;
    }

    /**
     * True when the whole of {@code other} lies inside this range.
     */
    public boolean encloses(Range other) {
        return !other.startsBefore(this) && !this.endsBefore(other);
    }

    /**
     * True when this range starts strictly before {@code other} starts.
     */
    public boolean startsBefore(Range other) {
        return startLine < other.startLine
                || (startLine == other.startLine && startColumn < other.startColumn);
    }

    private boolean endsBefore(Range other) {
        return endLine < other.endLine
                || (endLine == other.endLine && endColumn < other.endColumn);
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
