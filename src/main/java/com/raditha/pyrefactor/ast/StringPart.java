package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;

import java.util.List;

/**
 * A single string literal token: prefix, quote and the raw text between the quotes.
 * Formatted literals also carry their parsed replacement fields in source order.
 */
public record StringPart(Range range, String prefix, String quote, String body,
                         List<FormattedField> fields) implements Node {

    public boolean isFormatted() {
        return prefix.indexOf('f') >= 0 || prefix.indexOf('F') >= 0;
    }

    public String sourceText() {
        return prefix + quote + body + quote;
    }
}
