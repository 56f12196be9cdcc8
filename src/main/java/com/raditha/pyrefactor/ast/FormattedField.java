package com.raditha.pyrefactor.ast;

/**
 * A replacement field inside an f-string. {@code bodyStart} and {@code bodyEnd}
 * delimit the expression text within the enclosing {@link StringPart#body()}.
 */
public record FormattedField(int bodyStart, int bodyEnd, Expr expression) {
}
