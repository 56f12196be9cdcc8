package com.raditha.pyrefactor.ast;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Visitor that walks every statement and expression below the node it is handed,
 * in evaluation order (the value of an assignment before its targets, the
 * generators of a comprehension before its element). Subclasses override the
 * kinds they care about and call {@code super} to keep descending.
 */
public abstract class TreeScanner implements StmtVisitor<Void>, ExprVisitor<Void> {

    public void scan(Module module) {
        scanStatements(module.body());
    }

    public void scanStatements(List<Stmt> statements) {
        for (Stmt statement : statements) {
            statement.accept(this);
        }
    }

    public void scan(@Nullable Stmt statement) {
        if (statement != null) {
            statement.accept(this);
        }
    }

    public void scan(@Nullable Expr expression) {
        if (expression != null) {
            expression.accept(this);
        }
    }

    public void scanExpressions(List<? extends @Nullable Expr> expressions) {
        for (Expr expression : expressions) {
            scan(expression);
        }
    }

    /**
     * Annotations and default values; the names themselves are bindings of the
     * function's own scope.
     */
    protected void scanParameters(Parameters parameters) {
        for (Parameter parameter : parameters.all()) {
            scan(parameter.annotation());
            scan(parameter.defaultValue());
        }
    }

    protected void scanComprehension(Comprehension comprehension) {
        scan(comprehension.iter());
        scan(comprehension.target());
        scanExpressions(comprehension.ifs());
    }

    protected void scanKeyword(Keyword keyword) {
        scan(keyword.value());
    }

    protected void scanHandler(ExceptHandler handler) {
        scan(handler.type());
        scanStatements(handler.body());
    }

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef node) {
        scanExpressions(node.decorators());
        scanParameters(node.parameters());
        scan(node.returns());
        scanStatements(node.body());
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef node) {
        scanExpressions(node.decorators());
        scanExpressions(node.bases());
        node.keywords().forEach(this::scanKeyword);
        scanStatements(node.body());
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitDelete(Stmt.Delete node) {
        scanExpressions(node.targets());
        return null;
    }

    @Override
    public Void visitAssign(Stmt.Assign node) {
        scan(node.value());
        scanExpressions(node.targets());
        return null;
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign node) {
        scan(node.value());
        scan(node.target());
        return null;
    }

    @Override
    public Void visitAnnAssign(Stmt.AnnAssign node) {
        scan(node.annotation());
        scan(node.value());
        scan(node.target());
        return null;
    }

    @Override
    public Void visitFor(Stmt.For node) {
        scan(node.iter());
        scan(node.target());
        scanStatements(node.body());
        scanStatements(node.orelse());
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While node) {
        scan(node.test());
        scanStatements(node.body());
        scanStatements(node.orelse());
        return null;
    }

    @Override
    public Void visitIf(Stmt.If node) {
        scan(node.test());
        scanStatements(node.body());
        scanStatements(node.orelse());
        return null;
    }

    @Override
    public Void visitWith(Stmt.With node) {
        for (WithItem item : node.items()) {
            scan(item.context());
            scan(item.optionalVars());
        }
        scanStatements(node.body());
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise node) {
        scan(node.exception());
        scan(node.cause());
        return null;
    }

    @Override
    public Void visitTry(Stmt.Try node) {
        scanStatements(node.body());
        node.handlers().forEach(this::scanHandler);
        scanStatements(node.orelse());
        scanStatements(node.finalbody());
        return null;
    }

    @Override
    public Void visitMatch(Stmt.Match node) {
        scan(node.subject());
        node.cases().forEach(this::scanCase);
        return null;
    }

    protected void scanCase(MatchCase matchCase) {
        scanExpressions(matchCase.values());
        scanExpressions(matchCase.captures());
        scan(matchCase.guard());
        scanStatements(matchCase.body());
    }

    @Override
    public Void visitTypeAlias(Stmt.TypeAlias node) {
        scan(node.value());
        scan(node.name());
        return null;
    }

    @Override
    public Void visitAssert(Stmt.Assert node) {
        scan(node.test());
        scan(node.message());
        return null;
    }

    @Override
    public Void visitImport(Stmt.Import node) {
        return null;
    }

    @Override
    public Void visitImportFrom(Stmt.ImportFrom node) {
        return null;
    }

    @Override
    public Void visitGlobal(Stmt.Global node) {
        return null;
    }

    @Override
    public Void visitNonlocal(Stmt.Nonlocal node) {
        return null;
    }

    @Override
    public Void visitExprStmt(Stmt.ExprStmt node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitPass(Stmt.Pass node) {
        return null;
    }

    @Override
    public Void visitBreak(Stmt.Break node) {
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue node) {
        return null;
    }

    @Override
    public Void visitBoolOp(Expr.BoolOp node) {
        scanExpressions(node.values());
        return null;
    }

    @Override
    public Void visitNamedExpr(Expr.NamedExpr node) {
        scan(node.value());
        scan(node.target());
        return null;
    }

    @Override
    public Void visitBinOp(Expr.BinOp node) {
        scan(node.left());
        scan(node.right());
        return null;
    }

    @Override
    public Void visitUnaryOp(Expr.UnaryOp node) {
        scan(node.operand());
        return null;
    }

    @Override
    public Void visitLambda(Expr.Lambda node) {
        scanParameters(node.parameters());
        scan(node.body());
        return null;
    }

    @Override
    public Void visitIfExp(Expr.IfExp node) {
        scan(node.test());
        scan(node.body());
        scan(node.orelse());
        return null;
    }

    @Override
    public Void visitDict(Expr.DictExpr node) {
        for (int i = 0; i < node.values().size(); i++) {
            scan(node.keys().get(i));
            scan(node.values().get(i));
        }
        return null;
    }

    @Override
    public Void visitSet(Expr.SetExpr node) {
        scanExpressions(node.elements());
        return null;
    }

    @Override
    public Void visitListComp(Expr.ListComp node) {
        node.generators().forEach(this::scanComprehension);
        scan(node.element());
        return null;
    }

    @Override
    public Void visitSetComp(Expr.SetComp node) {
        node.generators().forEach(this::scanComprehension);
        scan(node.element());
        return null;
    }

    @Override
    public Void visitDictComp(Expr.DictComp node) {
        node.generators().forEach(this::scanComprehension);
        scan(node.key());
        scan(node.value());
        return null;
    }

    @Override
    public Void visitGeneratorExp(Expr.GeneratorExp node) {
        node.generators().forEach(this::scanComprehension);
        scan(node.element());
        return null;
    }

    @Override
    public Void visitAwait(Expr.Await node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitYield(Expr.Yield node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitYieldFrom(Expr.YieldFrom node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitCompare(Expr.Compare node) {
        scan(node.left());
        scanExpressions(node.comparators());
        return null;
    }

    @Override
    public Void visitCall(Expr.Call node) {
        scan(node.func());
        scanExpressions(node.args());
        node.keywords().forEach(this::scanKeyword);
        return null;
    }

    @Override
    public Void visitConstant(Expr.Constant node) {
        return null;
    }

    @Override
    public Void visitStr(Expr.Str node) {
        for (StringPart part : node.parts()) {
            for (FormattedField field : part.fields()) {
                scan(field.expression());
            }
        }
        return null;
    }

    @Override
    public Void visitAttribute(Expr.Attribute node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitSubscript(Expr.Subscript node) {
        scan(node.value());
        scan(node.slice());
        return null;
    }

    @Override
    public Void visitStarred(Expr.Starred node) {
        scan(node.value());
        return null;
    }

    @Override
    public Void visitName(Expr.Name node) {
        return null;
    }

    @Override
    public Void visitList(Expr.ListExpr node) {
        scanExpressions(node.elements());
        return null;
    }

    @Override
    public Void visitTuple(Expr.TupleExpr node) {
        scanExpressions(node.elements());
        return null;
    }

    @Override
    public Void visitSlice(Expr.Slice node) {
        scan(node.lower());
        scan(node.upper());
        scan(node.step());
        return null;
    }
}
