package com.raditha.pyrefactor.ast;

import org.jspecify.annotations.Nullable;

/**
 * Helpers for reading decorator expressions.
 */
public final class Decorators {

    private Decorators() {
    }

    /**
     * The last dotted component of a decorator, ignoring a call:
     * {@code @abc.abstractmethod} and {@code @cache(maxsize=1)} give
     * {@code abstractmethod} and {@code cache}.
     */
    public static @Nullable String simpleName(Expr decorator) {
        Expr target = decorator instanceof Expr.Call call ? call.func() : decorator;
        if (target instanceof Expr.Name name) {
            return name.id();
        }
        if (target instanceof Expr.Attribute attribute) {
            return attribute.attr();
        }
        return null;
    }

    /**
     * The decorator as a dotted name, e.g. {@code abc.abstractmethod}, or {@code null}
     * when it is not a plain dotted name.
     */
    public static @Nullable String dottedName(Expr decorator) {
        if (decorator instanceof Expr.Name name) {
            return name.id();
        }
        if (decorator instanceof Expr.Attribute attribute) {
            String prefix = dottedName(attribute.value());
            return prefix == null ? null : prefix + "." + attribute.attr();
        }
        return null;
    }
}
