package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

/**
 * A keyword argument in a call or class header; {@code arg} is {@code null}
 * for {@code **mapping}.
 */
public record Keyword(Range range, @Nullable String arg, Expr value) implements Node {
}
