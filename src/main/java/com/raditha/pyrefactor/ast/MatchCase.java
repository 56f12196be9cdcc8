package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One {@code case} of a {@code match} statement. The pattern is kept as source
 * text; {@code captures} are the names it binds and {@code values} the dotted
 * names and class names it reads.
 */
public record MatchCase(Range range, String pattern, List<Expr.Name> captures, List<Expr> values,
                        @Nullable Expr guard, List<Stmt> body) implements Node {
}
