package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Stmt;
import org.jspecify.annotations.Nullable;

/**
 * A bare call {@code name(...)} found in a file.
 *
 * @param call      the call expression
 * @param statement the expression statement when the call is the whole statement
 * @param wholeValue whether the call fills a slot that accepts any expression
 *                  without parentheses, such as the value of an assignment or an argument
 */
public record CallSite(Expr.Call call, Stmt.@Nullable ExprStmt statement, boolean wholeValue) {

    public boolean isStatement() {
        return statement != null;
    }
}
