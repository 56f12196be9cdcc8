package com.raditha.pyrefactor.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Line oriented helpers for moving blocks of source between nesting levels.
 */
public final class Indentation {

    private Indentation() {
    }

    /**
     * Splits on {@code \n}; a trailing newline yields a final empty element.
     */
    public static List<String> lines(String text) {
        return List.of(text.split("\n", -1));
    }

    /**
     * Number of lines in {@code text}, not counting the empty string after a
     * final newline.
     */
    public static int lineCount(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        List<String> lines = lines(text);
        return text.endsWith("\n") ? lines.size() - 1 : lines.size();
    }

    public static boolean isBlank(String line) {
        return line.strip().isEmpty();
    }

    /**
     * The spaces and tabs at the start of {@code line}.
     */
    public static String leadingWhitespace(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return line.substring(0, i);
    }

    /**
     * Removes the longest whitespace prefix shared by every non-blank line.
     * Blank lines come back empty.
     */
    public static List<String> dedent(List<String> lines) {
        String common = null;
        for (String line : lines) {
            if (isBlank(line)) {
                continue;
            }
            String prefix = leadingWhitespace(line);
            common = common == null ? prefix : commonPrefix(common, prefix);
        }
        List<String> result = new ArrayList<>(lines.size());
        int cut = common == null ? 0 : common.length();
        for (String line : lines) {
            result.add(isBlank(line) ? "" : line.substring(cut));
        }
        return result;
    }

    /**
     * Prefixes every non-blank line with {@code indent}.
     */
    public static List<String> indent(List<String> lines, String indent) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(isBlank(line) ? "" : indent + line);
        }
        return result;
    }

    /**
     * Moves lines from one nesting level to another, keeping their indentation
     * relative to {@code fromIndent}. Lines that are not indented at least as
     * far as {@code fromIndent} are left alone.
     */
    public static List<String> reindent(List<String> lines, String fromIndent, String toIndent) {
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (isBlank(line)) {
                result.add("");
            } else if (line.startsWith(fromIndent)) {
                result.add(toIndent + line.substring(fromIndent.length()));
            } else {
                result.add(line);
            }
        }
        return result;
    }

    /**
     * Joins lines, ending each with a newline.
     */
    public static String join(List<String> lines) {
        StringBuilder out = new StringBuilder();
        for (String line : lines) {
            out.append(line).append('\n');
        }
        return out.toString();
    }

    private static String commonPrefix(String a, String b) {
        int n = Math.min(a.length(), b.length());
        int i = 0;
        while (i < n && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return a.substring(0, i);
    }
}
