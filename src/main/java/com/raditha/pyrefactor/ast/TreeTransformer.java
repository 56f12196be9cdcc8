package com.raditha.pyrefactor.ast;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a tree bottom-up. Every visit returns either the node it was given,
 * when nothing below it changed, or a fresh node; the input tree is never
 * modified. Rebuilt nodes keep the range of the node they replace.
 */
public abstract class TreeTransformer implements StmtVisitor<Stmt>, ExprVisitor<Expr> {

    public Expr transform(Expr expression) {
        return expression.accept(this);
    }

    public @Nullable Expr transformNullable(@Nullable Expr expression) {
        return expression == null ? null : expression.accept(this);
    }

    public Stmt transform(Stmt statement) {
        return statement.accept(this);
    }

    public List<Expr> transformExpressions(List<Expr> expressions) {
        List<Expr> result = new ArrayList<>(expressions.size());
        boolean changed = false;
        for (Expr expression : expressions) {
            Expr transformed = transform(expression);
            changed |= transformed != expression;
            result.add(transformed);
        }
        return changed ? result : expressions;
    }

    public List<Stmt> transformStatements(List<Stmt> statements) {
        List<Stmt> result = new ArrayList<>(statements.size());
        boolean changed = false;
        for (Stmt statement : statements) {
            Stmt transformed = transform(statement);
            changed |= transformed != statement;
            result.add(transformed);
        }
        return changed ? result : statements;
    }

    protected Parameters transformParameters(Parameters parameters) {
        List<Parameter> result = new ArrayList<>();
        boolean changed = false;
        for (Parameter p : parameters.all()) {
            Expr annotation = transformNullable(p.annotation());
            Expr defaultValue = transformNullable(p.defaultValue());
            if (annotation != p.annotation() || defaultValue != p.defaultValue()) {
                changed = true;
                result.add(new Parameter(p.range(), p.name(), p.kind(), annotation, defaultValue));
            } else {
                result.add(p);
            }
        }
        return changed ? new Parameters(result, parameters.range()) : parameters;
    }

    protected List<Comprehension> transformGenerators(List<Comprehension> generators) {
        List<Comprehension> result = new ArrayList<>();
        boolean changed = false;
        for (Comprehension c : generators) {
            Expr iter = transform(c.iter());
            Expr target = transform(c.target());
            List<Expr> ifs = transformExpressions(c.ifs());
            if (iter != c.iter() || target != c.target() || ifs != c.ifs()) {
                changed = true;
                result.add(new Comprehension(target, iter, ifs, c.isAsync()));
            } else {
                result.add(c);
            }
        }
        return changed ? result : generators;
    }

    protected List<Keyword> transformKeywords(List<Keyword> keywords) {
        List<Keyword> result = new ArrayList<>();
        boolean changed = false;
        for (Keyword k : keywords) {
            Expr value = transform(k.value());
            if (value != k.value()) {
                changed = true;
                result.add(new Keyword(k.range(), k.arg(), value));
            } else {
                result.add(k);
            }
        }
        return changed ? result : keywords;
    }

    @Override
    public Stmt visitFunctionDef(Stmt.FunctionDef node) {
        List<Expr> decorators = transformExpressions(node.decorators());
        Parameters parameters = transformParameters(node.parameters());
        Expr returns = transformNullable(node.returns());
        List<Stmt> body = transformStatements(node.body());
        if (decorators == node.decorators() && parameters == node.parameters()
                && returns == node.returns() && body == node.body()) {
            return node;
        }
        return new Stmt.FunctionDef(node.range(), node.name(), decorators, node.typeParameters(), parameters,
                returns, body, node.isAsync());
    }

    @Override
    public Stmt visitClassDef(Stmt.ClassDef node) {
        List<Expr> decorators = transformExpressions(node.decorators());
        List<Expr> bases = transformExpressions(node.bases());
        List<Keyword> keywords = transformKeywords(node.keywords());
        List<Stmt> body = transformStatements(node.body());
        if (decorators == node.decorators() && bases == node.bases()
                && keywords == node.keywords() && body == node.body()) {
            return node;
        }
        return new Stmt.ClassDef(node.range(), node.name(), decorators, node.typeParameters(), bases, keywords,
                body);
    }

    @Override
    public Stmt visitReturn(Stmt.Return node) {
        Expr value = transformNullable(node.value());
        return value == node.value() ? node : new Stmt.Return(node.range(), value);
    }

    @Override
    public Stmt visitDelete(Stmt.Delete node) {
        List<Expr> targets = transformExpressions(node.targets());
        return targets == node.targets() ? node : new Stmt.Delete(node.range(), targets);
    }

    @Override
    public Stmt visitAssign(Stmt.Assign node) {
        Expr value = transform(node.value());
        List<Expr> targets = transformExpressions(node.targets());
        if (value == node.value() && targets == node.targets()) {
            return node;
        }
        return new Stmt.Assign(node.range(), targets, value);
    }

    @Override
    public Stmt visitAugAssign(Stmt.AugAssign node) {
        Expr value = transform(node.value());
        Expr target = transform(node.target());
        if (value == node.value() && target == node.target()) {
            return node;
        }
        return new Stmt.AugAssign(node.range(), target, node.op(), value);
    }

    @Override
    public Stmt visitAnnAssign(Stmt.AnnAssign node) {
        Expr annotation = transform(node.annotation());
        Expr value = transformNullable(node.value());
        Expr target = transform(node.target());
        if (annotation == node.annotation() && value == node.value() && target == node.target()) {
            return node;
        }
        return new Stmt.AnnAssign(node.range(), target, annotation, value);
    }

    @Override
    public Stmt visitFor(Stmt.For node) {
        Expr iter = transform(node.iter());
        Expr target = transform(node.target());
        List<Stmt> body = transformStatements(node.body());
        List<Stmt> orelse = transformStatements(node.orelse());
        if (iter == node.iter() && target == node.target() && body == node.body() && orelse == node.orelse()) {
            return node;
        }
        return new Stmt.For(node.range(), target, iter, body, orelse, node.isAsync());
    }

    @Override
    public Stmt visitWhile(Stmt.While node) {
        Expr test = transform(node.test());
        List<Stmt> body = transformStatements(node.body());
        List<Stmt> orelse = transformStatements(node.orelse());
        if (test == node.test() && body == node.body() && orelse == node.orelse()) {
            return node;
        }
        return new Stmt.While(node.range(), test, body, orelse);
    }

    @Override
    public Stmt visitIf(Stmt.If node) {
        Expr test = transform(node.test());
        List<Stmt> body = transformStatements(node.body());
        List<Stmt> orelse = transformStatements(node.orelse());
        if (test == node.test() && body == node.body() && orelse == node.orelse()) {
            return node;
        }
        return new Stmt.If(node.range(), test, body, orelse);
    }

    @Override
    public Stmt visitWith(Stmt.With node) {
        List<WithItem> items = new ArrayList<>();
        boolean changed = false;
        for (WithItem item : node.items()) {
            Expr context = transform(item.context());
            Expr vars = transformNullable(item.optionalVars());
            if (context != item.context() || vars != item.optionalVars()) {
                changed = true;
                items.add(new WithItem(context, vars));
            } else {
                items.add(item);
            }
        }
        List<Stmt> body = transformStatements(node.body());
        if (!changed && body == node.body()) {
            return node;
        }
        return new Stmt.With(node.range(), changed ? items : node.items(), body, node.isAsync());
    }

    @Override
    public Stmt visitRaise(Stmt.Raise node) {
        Expr exception = transformNullable(node.exception());
        Expr cause = transformNullable(node.cause());
        if (exception == node.exception() && cause == node.cause()) {
            return node;
        }
        return new Stmt.Raise(node.range(), exception, cause);
    }

    @Override
    public Stmt visitTry(Stmt.Try node) {
        List<Stmt> body = transformStatements(node.body());
        List<ExceptHandler> handlers = new ArrayList<>();
        boolean changed = false;
        for (ExceptHandler h : node.handlers()) {
            Expr type = transformNullable(h.type());
            List<Stmt> handlerBody = transformStatements(h.body());
            if (type != h.type() || handlerBody != h.body()) {
                changed = true;
                handlers.add(new ExceptHandler(h.range(), type, h.name(), handlerBody, h.isGroup()));
            } else {
                handlers.add(h);
            }
        }
        List<Stmt> orelse = transformStatements(node.orelse());
        List<Stmt> finalbody = transformStatements(node.finalbody());
        if (!changed && body == node.body() && orelse == node.orelse() && finalbody == node.finalbody()) {
            return node;
        }
        return new Stmt.Try(node.range(), body, changed ? handlers : node.handlers(), orelse, finalbody);
    }

    /**
     * Patterns are source text, so their captures and value names are left as they are.
     */
    @Override
    public Stmt visitMatch(Stmt.Match node) {
        Expr subject = transform(node.subject());
        List<MatchCase> cases = new ArrayList<>();
        boolean changed = false;
        for (MatchCase c : node.cases()) {
            Expr guard = transformNullable(c.guard());
            List<Stmt> body = transformStatements(c.body());
            if (guard != c.guard() || body != c.body()) {
                changed = true;
                cases.add(new MatchCase(c.range(), c.pattern(), c.captures(), c.values(), guard, body));
            } else {
                cases.add(c);
            }
        }
        if (!changed && subject == node.subject()) {
            return node;
        }
        return new Stmt.Match(node.range(), subject, changed ? cases : node.cases());
    }

    @Override
    public Stmt visitTypeAlias(Stmt.TypeAlias node) {
        Expr value = transform(node.value());
        if (value == node.value()) {
            return node;
        }
        return new Stmt.TypeAlias(node.range(), node.name(), node.typeParameters(), value);
    }

    @Override
    public Stmt visitAssert(Stmt.Assert node) {
        Expr test = transform(node.test());
        Expr message = transformNullable(node.message());
        if (test == node.test() && message == node.message()) {
            return node;
        }
        return new Stmt.Assert(node.range(), test, message);
    }

    @Override
    public Stmt visitImport(Stmt.Import node) {
        return node;
    }

    @Override
    public Stmt visitImportFrom(Stmt.ImportFrom node) {
        return node;
    }

    @Override
    public Stmt visitGlobal(Stmt.Global node) {
        return node;
    }

    @Override
    public Stmt visitNonlocal(Stmt.Nonlocal node) {
        return node;
    }

    @Override
    public Stmt visitExprStmt(Stmt.ExprStmt node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Stmt.ExprStmt(node.range(), value);
    }

    @Override
    public Stmt visitPass(Stmt.Pass node) {
        return node;
    }

    @Override
    public Stmt visitBreak(Stmt.Break node) {
        return node;
    }

    @Override
    public Stmt visitContinue(Stmt.Continue node) {
        return node;
    }

    @Override
    public Expr visitBoolOp(Expr.BoolOp node) {
        List<Expr> values = transformExpressions(node.values());
        return values == node.values() ? node : new Expr.BoolOp(node.range(), node.op(), values);
    }

    @Override
    public Expr visitNamedExpr(Expr.NamedExpr node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Expr.NamedExpr(node.range(), node.target(), value);
    }

    @Override
    public Expr visitBinOp(Expr.BinOp node) {
        Expr left = transform(node.left());
        Expr right = transform(node.right());
        if (left == node.left() && right == node.right()) {
            return node;
        }
        return new Expr.BinOp(node.range(), left, node.op(), right);
    }

    @Override
    public Expr visitUnaryOp(Expr.UnaryOp node) {
        Expr operand = transform(node.operand());
        return operand == node.operand() ? node : new Expr.UnaryOp(node.range(), node.op(), operand);
    }

    @Override
    public Expr visitLambda(Expr.Lambda node) {
        Parameters parameters = transformParameters(node.parameters());
        Expr body = transform(node.body());
        if (parameters == node.parameters() && body == node.body()) {
            return node;
        }
        return new Expr.Lambda(node.range(), parameters, body);
    }

    @Override
    public Expr visitIfExp(Expr.IfExp node) {
        Expr test = transform(node.test());
        Expr body = transform(node.body());
        Expr orelse = transform(node.orelse());
        if (test == node.test() && body == node.body() && orelse == node.orelse()) {
            return node;
        }
        return new Expr.IfExp(node.range(), test, body, orelse);
    }

    @Override
    public Expr visitDict(Expr.DictExpr node) {
        List<@Nullable Expr> keys = new ArrayList<>();
        boolean changed = false;
        for (Expr key : node.keys()) {
            Expr transformed = transformNullable(key);
            changed |= transformed != key;
            keys.add(transformed);
        }
        List<Expr> values = transformExpressions(node.values());
        if (!changed && values == node.values()) {
            return node;
        }
        return new Expr.DictExpr(node.range(), changed ? keys : node.keys(), values);
    }

    @Override
    public Expr visitSet(Expr.SetExpr node) {
        List<Expr> elements = transformExpressions(node.elements());
        return elements == node.elements() ? node : new Expr.SetExpr(node.range(), elements);
    }

    @Override
    public Expr visitListComp(Expr.ListComp node) {
        List<Comprehension> generators = transformGenerators(node.generators());
        Expr element = transform(node.element());
        if (generators == node.generators() && element == node.element()) {
            return node;
        }
        return new Expr.ListComp(node.range(), element, generators);
    }

    @Override
    public Expr visitSetComp(Expr.SetComp node) {
        List<Comprehension> generators = transformGenerators(node.generators());
        Expr element = transform(node.element());
        if (generators == node.generators() && element == node.element()) {
            return node;
        }
        return new Expr.SetComp(node.range(), element, generators);
    }

    @Override
    public Expr visitDictComp(Expr.DictComp node) {
        List<Comprehension> generators = transformGenerators(node.generators());
        Expr key = transform(node.key());
        Expr value = transform(node.value());
        if (generators == node.generators() && key == node.key() && value == node.value()) {
            return node;
        }
        return new Expr.DictComp(node.range(), key, value, generators);
    }

    @Override
    public Expr visitGeneratorExp(Expr.GeneratorExp node) {
        List<Comprehension> generators = transformGenerators(node.generators());
        Expr element = transform(node.element());
        if (generators == node.generators() && element == node.element()) {
            return node;
        }
        return new Expr.GeneratorExp(node.range(), element, generators);
    }

    @Override
    public Expr visitAwait(Expr.Await node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Expr.Await(node.range(), value);
    }

    @Override
    public Expr visitYield(Expr.Yield node) {
        Expr value = transformNullable(node.value());
        return value == node.value() ? node : new Expr.Yield(node.range(), value);
    }

    @Override
    public Expr visitYieldFrom(Expr.YieldFrom node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Expr.YieldFrom(node.range(), value);
    }

    @Override
    public Expr visitCompare(Expr.Compare node) {
        Expr left = transform(node.left());
        List<Expr> comparators = transformExpressions(node.comparators());
        if (left == node.left() && comparators == node.comparators()) {
            return node;
        }
        return new Expr.Compare(node.range(), left, node.ops(), comparators);
    }

    @Override
    public Expr visitCall(Expr.Call node) {
        Expr func = transform(node.func());
        List<Expr> args = transformExpressions(node.args());
        List<Keyword> keywords = transformKeywords(node.keywords());
        if (func == node.func() && args == node.args() && keywords == node.keywords()) {
            return node;
        }
        return new Expr.Call(node.range(), func, args, keywords);
    }

    @Override
    public Expr visitConstant(Expr.Constant node) {
        return node;
    }

    @Override
    public Expr visitStr(Expr.Str node) {
        List<StringPart> parts = new ArrayList<>();
        boolean changed = false;
        for (StringPart part : node.parts()) {
            List<FormattedField> fields = new ArrayList<>();
            boolean partChanged = false;
            for (FormattedField field : part.fields()) {
                Expr expression = transform(field.expression());
                if (expression != field.expression()) {
                    partChanged = true;
                    fields.add(new FormattedField(field.bodyStart(), field.bodyEnd(), expression));
                } else {
                    fields.add(field);
                }
            }
            if (partChanged) {
                changed = true;
                parts.add(new StringPart(part.range(), part.prefix(), part.quote(), part.body(), fields));
            } else {
                parts.add(part);
            }
        }
        return changed ? new Expr.Str(node.range(), parts) : node;
    }

    @Override
    public Expr visitAttribute(Expr.Attribute node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Expr.Attribute(node.range(), value, node.attr(), node.context());
    }

    @Override
    public Expr visitSubscript(Expr.Subscript node) {
        Expr value = transform(node.value());
        Expr slice = transform(node.slice());
        if (value == node.value() && slice == node.slice()) {
            return node;
        }
        return new Expr.Subscript(node.range(), value, slice, node.context());
    }

    @Override
    public Expr visitStarred(Expr.Starred node) {
        Expr value = transform(node.value());
        return value == node.value() ? node : new Expr.Starred(node.range(), value, node.context());
    }

    @Override
    public Expr visitName(Expr.Name node) {
        return node;
    }

    @Override
    public Expr visitList(Expr.ListExpr node) {
        List<Expr> elements = transformExpressions(node.elements());
        return elements == node.elements() ? node : new Expr.ListExpr(node.range(), elements, node.context());
    }

    @Override
    public Expr visitTuple(Expr.TupleExpr node) {
        List<Expr> elements = transformExpressions(node.elements());
        return elements == node.elements() ? node : new Expr.TupleExpr(node.range(), elements, node.context());
    }

    @Override
    public Expr visitSlice(Expr.Slice node) {
        Expr lower = transformNullable(node.lower());
        Expr upper = transformNullable(node.upper());
        Expr step = transformNullable(node.step());
        if (lower == node.lower() && upper == node.upper() && step == node.step()) {
            return node;
        }
        return new Expr.Slice(node.range(), lower, upper, step);
    }
}
