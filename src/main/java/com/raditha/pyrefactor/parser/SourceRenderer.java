package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.ast.Alias;
import com.raditha.pyrefactor.ast.Comprehension;
import com.raditha.pyrefactor.ast.ConstantKind;
import com.raditha.pyrefactor.ast.ExceptHandler;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.ExprVisitor;
import com.raditha.pyrefactor.ast.FormattedField;
import com.raditha.pyrefactor.ast.Keyword;
import com.raditha.pyrefactor.ast.MatchCase;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.Parameters;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.StmtVisitor;
import com.raditha.pyrefactor.ast.StringPart;
import com.raditha.pyrefactor.ast.WithItem;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns syntax trees back into Python source.
 * <p>
 * Parentheses are emitted only where the precedence of a sub-expression is
 * lower than its position requires, so rendering a parsed tree and parsing the
 * result gives back the same structure. String literals are reproduced from
 * their source text, with f-string replacement fields re-rendered in place.
 * Comments and the original spacing are not preserved.
 */
public class SourceRenderer {

    /**
     * Binding strength of expression positions, weakest first.
     */
    public enum Precedence {
        NAMED_EXPR,
        TUPLE,
        YIELD,
        TEST,
        OR,
        AND,
        NOT,
        CMP,
        BOR,
        BXOR,
        BAND,
        SHIFT,
        ARITH,
        TERM,
        FACTOR,
        POWER,
        AWAIT,
        ATOM;

        Precedence next() {
            return this == ATOM ? ATOM : values()[ordinal() + 1];
        }
    }

    private final String indentUnit;

    public SourceRenderer() {
        this("    ");
    }

    public SourceRenderer(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    /**
     * Renders an expression standing on its own, as the value of an
     * expression statement would be.
     */
    public String render(Expr expression) {
        return render(expression, Precedence.TUPLE);
    }

    /**
     * Renders an expression for a position that binds with {@code context};
     * the result is parenthesized when the expression binds more loosely.
     */
    public String render(Expr expression, Precedence context) {
        ExprRenderer renderer = new ExprRenderer();
        String text = expression.accept(renderer);
        return precedenceOf(expression).compareTo(context) < 0 ? "(" + text + ")" : text;
    }

    /**
     * Renders statements, each line starting with {@code indent} and ending with a newline.
     */
    public String render(List<Stmt> statements, String indent) {
        StringBuilder out = new StringBuilder();
        for (Stmt statement : statements) {
            statement.accept(new StmtRenderer(out, indent));
        }
        return out.toString();
    }

    public String render(Stmt statement, String indent) {
        return render(List.of(statement), indent);
    }

    public String renderParameters(Parameters parameters) {
        return parameters.all().stream().map(this::renderParameter).collect(Collectors.joining(", "));
    }

    private String renderParameter(Parameter parameter) {
        String annotation = parameter.annotation() == null
                ? "" : ": " + render(parameter.annotation(), Precedence.TEST);
        switch (parameter.kind()) {
            case SLASH:
            case BARE_STAR:
                return parameter.name();
            case VAR_POSITIONAL:
                return "*" + parameter.name() + annotation;
            case VAR_KEYWORD:
                return "**" + parameter.name() + annotation;
            default:
                if (parameter.defaultValue() == null) {
                    return parameter.name() + annotation;
                }
                String equals = annotation.isEmpty() ? "=" : " = ";
                return parameter.name() + annotation + equals + render(parameter.defaultValue(), Precedence.TEST);
        }
    }

    /**
     * How tightly an expression binds when rendered without parentheses.
     */
    public static Precedence precedenceOf(Expr expression) {
        if (expression instanceof Expr.NamedExpr) {
            return Precedence.NAMED_EXPR;
        }
        if (expression instanceof Expr.TupleExpr tuple) {
            return tuple.elements().isEmpty() ? Precedence.ATOM : Precedence.TUPLE;
        }
        if (expression instanceof Expr.Yield || expression instanceof Expr.YieldFrom) {
            return Precedence.YIELD;
        }
        if (expression instanceof Expr.IfExp || expression instanceof Expr.Lambda) {
            return Precedence.TEST;
        }
        if (expression instanceof Expr.BoolOp boolOp) {
            return boolOp.op().equals("or") ? Precedence.OR : Precedence.AND;
        }
        if (expression instanceof Expr.UnaryOp unaryOp) {
            return unaryOp.op().equals("not") ? Precedence.NOT : Precedence.FACTOR;
        }
        if (expression instanceof Expr.Compare) {
            return Precedence.CMP;
        }
        if (expression instanceof Expr.BinOp binOp) {
            return binaryPrecedence(binOp.op());
        }
        if (expression instanceof Expr.Await) {
            return Precedence.AWAIT;
        }
        return Precedence.ATOM;
    }

    private static Precedence binaryPrecedence(String op) {
        switch (op) {
            case "|":
                return Precedence.BOR;
            case "^":
                return Precedence.BXOR;
            case "&":
                return Precedence.BAND;
            case "<<":
            case ">>":
                return Precedence.SHIFT;
            case "+":
            case "-":
                return Precedence.ARITH;
            case "**":
                return Precedence.POWER;
            default:
                return Precedence.TERM;
        }
    }

    private String join(List<Expr> expressions, Precedence context) {
        List<String> parts = new ArrayList<>();
        for (Expr expression : expressions) {
            parts.add(render(expression, context));
        }
        return String.join(", ", parts);
    }

    private class ExprRenderer implements ExprVisitor<String> {

        @Override
        public String visitBoolOp(Expr.BoolOp node) {
            Precedence operand = precedenceOf(node).next();
            List<String> parts = new ArrayList<>();
            for (Expr value : node.values()) {
                parts.add(render(value, operand));
            }
            return String.join(" " + node.op() + " ", parts);
        }

        @Override
        public String visitNamedExpr(Expr.NamedExpr node) {
            return node.target().id() + " := " + render(node.value(), Precedence.TEST);
        }

        @Override
        public String visitBinOp(Expr.BinOp node) {
            Precedence own = binaryPrecedence(node.op());
            if (node.op().equals("**")) {
                return render(node.left(), own.next()) + " ** " + render(node.right(), Precedence.FACTOR);
            }
            return render(node.left(), own) + " " + node.op() + " " + render(node.right(), own.next());
        }

        @Override
        public String visitUnaryOp(Expr.UnaryOp node) {
            if (node.op().equals("not")) {
                return "not " + render(node.operand(), Precedence.NOT);
            }
            return node.op() + render(node.operand(), Precedence.FACTOR);
        }

        @Override
        public String visitLambda(Expr.Lambda node) {
            String parameters = renderParameters(node.parameters());
            return "lambda" + (parameters.isEmpty() ? "" : " " + parameters) + ": "
                    + render(node.body(), Precedence.TEST);
        }

        @Override
        public String visitIfExp(Expr.IfExp node) {
            return render(node.body(), Precedence.OR) + " if " + render(node.test(), Precedence.OR)
                    + " else " + render(node.orelse(), Precedence.TEST);
        }

        @Override
        public String visitDict(Expr.DictExpr node) {
            List<String> entries = new ArrayList<>();
            for (int i = 0; i < node.values().size(); i++) {
                Expr key = node.keys().get(i);
                Expr value = node.values().get(i);
                if (key == null) {
                    entries.add("**" + render(value, Precedence.BOR));
                } else {
                    entries.add(render(key, Precedence.TEST) + ": " + render(value, Precedence.TEST));
                }
            }
            return "{" + String.join(", ", entries) + "}";
        }

        @Override
        public String visitSet(Expr.SetExpr node) {
            return "{" + join(node.elements(), Precedence.TEST) + "}";
        }

        @Override
        public String visitListComp(Expr.ListComp node) {
            return "[" + render(node.element(), Precedence.TEST) + generators(node.generators()) + "]";
        }

        @Override
        public String visitSetComp(Expr.SetComp node) {
            return "{" + render(node.element(), Precedence.TEST) + generators(node.generators()) + "}";
        }

        @Override
        public String visitDictComp(Expr.DictComp node) {
            return "{" + render(node.key(), Precedence.TEST) + ": " + render(node.value(), Precedence.TEST)
                    + generators(node.generators()) + "}";
        }

        @Override
        public String visitGeneratorExp(Expr.GeneratorExp node) {
            return "(" + render(node.element(), Precedence.TEST) + generators(node.generators()) + ")";
        }

        private String generators(List<Comprehension> generators) {
            StringBuilder out = new StringBuilder();
            for (Comprehension c : generators) {
                out.append(c.isAsync() ? " async for " : " for ")
                        .append(render(c.target(), Precedence.TUPLE))
                        .append(" in ")
                        .append(render(c.iter(), Precedence.OR));
                for (Expr condition : c.ifs()) {
                    out.append(" if ").append(render(condition, Precedence.OR));
                }
            }
            return out.toString();
        }

        @Override
        public String visitAwait(Expr.Await node) {
            return "await " + render(node.value(), Precedence.ATOM);
        }

        @Override
        public String visitYield(Expr.Yield node) {
            return node.value() == null ? "yield" : "yield " + render(node.value(), Precedence.TUPLE);
        }

        @Override
        public String visitYieldFrom(Expr.YieldFrom node) {
            return "yield from " + render(node.value(), Precedence.TEST);
        }

        @Override
        public String visitCompare(Expr.Compare node) {
            StringBuilder out = new StringBuilder(render(node.left(), Precedence.BOR));
            for (int i = 0; i < node.ops().size(); i++) {
                out.append(' ').append(node.ops().get(i)).append(' ')
                        .append(render(node.comparators().get(i), Precedence.BOR));
            }
            return out.toString();
        }

        @Override
        public String visitCall(Expr.Call node) {
            List<String> arguments = new ArrayList<>();
            for (Expr arg : node.args()) {
                arguments.add(render(arg, Precedence.TEST));
            }
            for (Keyword keyword : node.keywords()) {
                String value = render(keyword.value(), Precedence.TEST);
                arguments.add(keyword.arg() == null ? "**" + value : keyword.arg() + "=" + value);
            }
            return render(node.func(), Precedence.ATOM) + "(" + String.join(", ", arguments) + ")";
        }

        @Override
        public String visitConstant(Expr.Constant node) {
            return node.text();
        }

        @Override
        public String visitStr(Expr.Str node) {
            List<String> parts = new ArrayList<>();
            for (StringPart part : node.parts()) {
                parts.add(renderPart(part));
            }
            return String.join(" ", parts);
        }

        private String renderPart(StringPart part) {
            if (part.fields().isEmpty()) {
                return part.sourceText();
            }
            StringBuilder body = new StringBuilder(part.body());
            List<FormattedField> fields = new ArrayList<>(part.fields());
            fields.sort((a, b) -> Integer.compare(b.bodyStart(), a.bodyStart()));
            for (FormattedField field : fields) {
                String text = render(field.expression(), Precedence.TEST);
                if (text.startsWith("{")) {
                    text = " " + text;
                }
                body.replace(field.bodyStart(), field.bodyEnd(), text);
            }
            return part.prefix() + part.quote() + body + part.quote();
        }

        @Override
        public String visitAttribute(Expr.Attribute node) {
            String value = render(node.value(), Precedence.ATOM);
            if (node.value() instanceof Expr.Constant constant && constant.kind() == ConstantKind.NUMBER
                    && constant.text().chars().allMatch(Character::isDigit)) {
                value = "(" + value + ")";
            }
            return value + "." + node.attr();
        }

        @Override
        public String visitSubscript(Expr.Subscript node) {
            return render(node.value(), Precedence.ATOM) + "[" + renderSlice(node.slice()) + "]";
        }

        private String renderSlice(Expr slice) {
            if (slice instanceof Expr.TupleExpr tuple && !tuple.elements().isEmpty()) {
                List<String> parts = new ArrayList<>();
                for (Expr element : tuple.elements()) {
                    parts.add(render(element, Precedence.TEST));
                }
                return tuple.elements().size() == 1 ? parts.get(0) + "," : String.join(", ", parts);
            }
            return render(slice, Precedence.TUPLE);
        }

        @Override
        public String visitStarred(Expr.Starred node) {
            return "*" + render(node.value(), Precedence.BOR);
        }

        @Override
        public String visitName(Expr.Name node) {
            return node.id();
        }

        @Override
        public String visitList(Expr.ListExpr node) {
            return "[" + join(node.elements(), Precedence.TEST) + "]";
        }

        @Override
        public String visitTuple(Expr.TupleExpr node) {
            if (node.elements().isEmpty()) {
                return "()";
            }
            String text = join(node.elements(), Precedence.TEST);
            return node.elements().size() == 1 ? text + "," : text;
        }

        @Override
        public String visitSlice(Expr.Slice node) {
            StringBuilder out = new StringBuilder();
            if (node.lower() != null) {
                out.append(render(node.lower(), Precedence.TEST));
            }
            out.append(':');
            if (node.upper() != null) {
                out.append(render(node.upper(), Precedence.TEST));
            }
            if (node.step() != null) {
                out.append(':').append(render(node.step(), Precedence.TEST));
            }
            return out.toString();
        }
    }

    private class StmtRenderer implements StmtVisitor<Void> {

        private final StringBuilder out;
        private final String indent;

        StmtRenderer(StringBuilder out, String indent) {
            this.out = out;
            this.indent = indent;
        }

        private void line(String text) {
            out.append(indent).append(text).append('\n');
        }

        private void body(List<Stmt> statements) {
            if (statements.isEmpty()) {
                out.append(indent).append(indentUnit).append("pass\n");
                return;
            }
            out.append(SourceRenderer.this.render(statements, indent + indentUnit));
        }

        private void block(String header, List<Stmt> statements) {
            line(header + ":");
            body(statements);
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node) {
            for (Expr decorator : node.decorators()) {
                line("@" + render(decorator, Precedence.TEST));
            }
            String returns = node.returns() == null ? "" : " -> " + render(node.returns(), Precedence.TEST);
            String typeParameters = node.typeParameters() == null ? "" : node.typeParameters();
            block((node.isAsync() ? "async def " : "def ") + node.name() + typeParameters
                    + "(" + renderParameters(node.parameters()) + ")" + returns, node.body());
            return null;
        }

        @Override
        public Void visitClassDef(Stmt.ClassDef node) {
            for (Expr decorator : node.decorators()) {
                line("@" + render(decorator, Precedence.TEST));
            }
            List<String> arguments = new ArrayList<>();
            for (Expr base : node.bases()) {
                arguments.add(render(base, Precedence.TEST));
            }
            for (Keyword keyword : node.keywords()) {
                String value = render(keyword.value(), Precedence.TEST);
                arguments.add(keyword.arg() == null ? "**" + value : keyword.arg() + "=" + value);
            }
            String header = arguments.isEmpty() ? "" : "(" + String.join(", ", arguments) + ")";
            String typeParameters = node.typeParameters() == null ? "" : node.typeParameters();
            block("class " + node.name() + typeParameters + header, node.body());
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            line(node.value() == null ? "return" : "return " + render(node.value(), Precedence.TUPLE));
            return null;
        }

        @Override
        public Void visitDelete(Stmt.Delete node) {
            line("del " + join(node.targets(), Precedence.TEST));
            return null;
        }

        @Override
        public Void visitAssign(Stmt.Assign node) {
            StringBuilder text = new StringBuilder();
            for (Expr target : node.targets()) {
                text.append(render(target, Precedence.TUPLE)).append(" = ");
            }
            line(text.append(render(node.value(), Precedence.TUPLE)).toString());
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            line(render(node.target(), Precedence.TUPLE) + " " + node.op() + "= "
                    + render(node.value(), Precedence.TUPLE));
            return null;
        }

        @Override
        public Void visitAnnAssign(Stmt.AnnAssign node) {
            String value = node.value() == null ? "" : " = " + render(node.value(), Precedence.TUPLE);
            line(render(node.target(), Precedence.TEST) + ": " + render(node.annotation(), Precedence.TEST) + value);
            return null;
        }

        @Override
        public Void visitFor(Stmt.For node) {
            block((node.isAsync() ? "async for " : "for ") + render(node.target(), Precedence.TUPLE)
                    + " in " + render(node.iter(), Precedence.TUPLE), node.body());
            if (!node.orelse().isEmpty()) {
                block("else", node.orelse());
            }
            return null;
        }

        @Override
        public Void visitWhile(Stmt.While node) {
            block("while " + render(node.test(), Precedence.NAMED_EXPR), node.body());
            if (!node.orelse().isEmpty()) {
                block("else", node.orelse());
            }
            return null;
        }

        @Override
        public Void visitIf(Stmt.If node) {
            block("if " + render(node.test(), Precedence.NAMED_EXPR), node.body());
            List<Stmt> orelse = node.orelse();
            while (orelse.size() == 1 && orelse.get(0) instanceof Stmt.If elif) {
                block("elif " + render(elif.test(), Precedence.NAMED_EXPR), elif.body());
                orelse = elif.orelse();
            }
            if (!orelse.isEmpty()) {
                block("else", orelse);
            }
            return null;
        }

        @Override
        public Void visitWith(Stmt.With node) {
            List<String> items = new ArrayList<>();
            for (WithItem item : node.items()) {
                String context = render(item.context(), Precedence.TEST);
                items.add(item.optionalVars() == null
                        ? context : context + " as " + render(item.optionalVars(), Precedence.TEST));
            }
            block((node.isAsync() ? "async with " : "with ") + String.join(", ", items), node.body());
            return null;
        }

        @Override
        public Void visitRaise(Stmt.Raise node) {
            StringBuilder text = new StringBuilder("raise");
            if (node.exception() != null) {
                text.append(' ').append(render(node.exception(), Precedence.TEST));
            }
            if (node.cause() != null) {
                text.append(" from ").append(render(node.cause(), Precedence.TEST));
            }
            line(text.toString());
            return null;
        }

        @Override
        public Void visitTry(Stmt.Try node) {
            block("try", node.body());
            for (ExceptHandler handler : node.handlers()) {
                StringBuilder header = new StringBuilder(handler.isGroup() ? "except*" : "except");
                if (handler.type() != null) {
                    header.append(' ').append(render(handler.type(), Precedence.TEST));
                }
                if (handler.name() != null) {
                    header.append(" as ").append(handler.name());
                }
                block(header.toString(), handler.body());
            }
            if (!node.orelse().isEmpty()) {
                block("else", node.orelse());
            }
            if (!node.finalbody().isEmpty()) {
                block("finally", node.finalbody());
            }
            return null;
        }

        @Override
        public Void visitMatch(Stmt.Match node) {
            line("match " + render(node.subject(), Precedence.TUPLE) + ":");
            StmtRenderer cases = new StmtRenderer(out, indent + indentUnit);
            for (MatchCase matchCase : node.cases()) {
                String guard = matchCase.guard() == null
                        ? "" : " if " + render(matchCase.guard(), Precedence.NAMED_EXPR);
                cases.block("case " + matchCase.pattern() + guard, matchCase.body());
            }
            return null;
        }

        @Override
        public Void visitTypeAlias(Stmt.TypeAlias node) {
            String typeParameters = node.typeParameters() == null ? "" : node.typeParameters();
            line("type " + node.name().id() + typeParameters + " = " + render(node.value(), Precedence.TEST));
            return null;
        }

        @Override
        public Void visitAssert(Stmt.Assert node) {
            String message = node.message() == null ? "" : ", " + render(node.message(), Precedence.TEST);
            line("assert " + render(node.test(), Precedence.TEST) + message);
            return null;
        }

        @Override
        public Void visitImport(Stmt.Import node) {
            line("import " + aliases(node.names()));
            return null;
        }

        @Override
        public Void visitImportFrom(Stmt.ImportFrom node) {
            String module = ".".repeat(node.level()) + (node.module() == null ? "" : node.module());
            line("from " + module + " import " + aliases(node.names()));
            return null;
        }

        private String aliases(List<Alias> names) {
            return names.stream()
                    .map(a -> a.asname() == null ? a.name() : a.name() + " as " + a.asname())
                    .collect(Collectors.joining(", "));
        }

        @Override
        public Void visitGlobal(Stmt.Global node) {
            line("global " + String.join(", ", node.names()));
            return null;
        }

        @Override
        public Void visitNonlocal(Stmt.Nonlocal node) {
            line("nonlocal " + String.join(", ", node.names()));
            return null;
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt node) {
            line(render(node.value(), Precedence.TUPLE));
            return null;
        }

        @Override
        public Void visitPass(Stmt.Pass node) {
            line("pass");
            return null;
        }

        @Override
        public Void visitBreak(Stmt.Break node) {
            line("break");
            return null;
        }

        @Override
        public Void visitContinue(Stmt.Continue node) {
            line("continue");
            return null;
        }
    }
}
