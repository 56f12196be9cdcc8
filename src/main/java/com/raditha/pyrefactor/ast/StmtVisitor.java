package com.raditha.pyrefactor.ast;

/**
 * Dispatch over every {@link Stmt} kind.
 *
 * @param <R> result type
 */
public interface StmtVisitor<R> {

    R visitFunctionDef(Stmt.FunctionDef node);

    R visitClassDef(Stmt.ClassDef node);

    R visitReturn(Stmt.Return node);

    R visitDelete(Stmt.Delete node);

    R visitAssign(Stmt.Assign node);

    R visitAugAssign(Stmt.AugAssign node);

    R visitAnnAssign(Stmt.AnnAssign node);

    R visitFor(Stmt.For node);

    R visitWhile(Stmt.While node);

    R visitIf(Stmt.If node);

    R visitWith(Stmt.With node);

    R visitRaise(Stmt.Raise node);

    R visitTry(Stmt.Try node);

    R visitMatch(Stmt.Match node);

    R visitTypeAlias(Stmt.TypeAlias node);

    R visitAssert(Stmt.Assert node);

    R visitImport(Stmt.Import node);

    R visitImportFrom(Stmt.ImportFrom node);

    R visitGlobal(Stmt.Global node);

    R visitNonlocal(Stmt.Nonlocal node);

    R visitExprStmt(Stmt.ExprStmt node);

    R visitPass(Stmt.Pass node);

    R visitBreak(Stmt.Break node);

    R visitContinue(Stmt.Continue node);
}
