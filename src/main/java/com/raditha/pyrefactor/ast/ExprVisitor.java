package com.raditha.pyrefactor.ast;

/**
 * Dispatch over every {@link Expr} kind.
 *
 * @param <R> result type
 */
public interface ExprVisitor<R> {

    R visitBoolOp(Expr.BoolOp node);

    R visitNamedExpr(Expr.NamedExpr node);

    R visitBinOp(Expr.BinOp node);

    R visitUnaryOp(Expr.UnaryOp node);

    R visitLambda(Expr.Lambda node);

    R visitIfExp(Expr.IfExp node);

    R visitDict(Expr.DictExpr node);

    R visitSet(Expr.SetExpr node);

    R visitListComp(Expr.ListComp node);

    R visitSetComp(Expr.SetComp node);

    R visitDictComp(Expr.DictComp node);

    R visitGeneratorExp(Expr.GeneratorExp node);

    R visitAwait(Expr.Await node);

    R visitYield(Expr.Yield node);

    R visitYieldFrom(Expr.YieldFrom node);

    R visitCompare(Expr.Compare node);

    R visitCall(Expr.Call node);

    R visitConstant(Expr.Constant node);

    R visitStr(Expr.Str node);

    R visitAttribute(Expr.Attribute node);

    R visitSubscript(Expr.Subscript node);

    R visitStarred(Expr.Starred node);

    R visitName(Expr.Name node);

    R visitList(Expr.ListExpr node);

    R visitTuple(Expr.TupleExpr node);

    R visitSlice(Expr.Slice node);
}
