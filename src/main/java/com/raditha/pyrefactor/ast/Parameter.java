package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

/**
 * One entry of a parameter list. Markers ({@code *} and {@code /}) are kept as
 * entries so that insertion positions can be computed from the source spans;
 * their name is the marker text itself.
 */
public record Parameter(Range range, String name, ParameterKind kind,
                        @Nullable Expr annotation, @Nullable Expr defaultValue) implements Node {

    public boolean hasDefault() {
        return defaultValue != null;
    }
}
