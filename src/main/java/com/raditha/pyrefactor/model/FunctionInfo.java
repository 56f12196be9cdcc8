package com.raditha.pyrefactor.model;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Stmt;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A function examined as a candidate for inlining.
 *
 * @param name          function name
 * @param parameters    parameter names in declaration order
 * @param body          statements that precede the return, without the docstring
 *                      and a trailing {@code pass}
 * @param returnValue   the expression of the single return, if any
 * @param definition    the parsed definition
 * @param unsafeReason  why the function cannot be inlined, {@code null} when it can
 */
public record FunctionInfo(
        String name,
        List<String> parameters,
        List<Stmt> body,
        @Nullable Expr returnValue,
        Stmt.FunctionDef definition,
        @Nullable UnsafeReason unsafeReason,
        @Nullable String unsafeDetail) {

    public boolean isSafe() {
        return unsafeReason == null;
    }

    /**
     * The reason as reported to users, e.g. {@code calls side-effect function 'print'}.
     */
    public @Nullable String describeUnsafeReason() {
        return unsafeReason == null ? null : unsafeReason.describe(unsafeDetail);
    }
}
