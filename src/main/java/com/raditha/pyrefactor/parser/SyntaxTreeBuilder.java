package com.raditha.pyrefactor.parser;

import com.raditha.pyrefactor.ast.Alias;
import com.raditha.pyrefactor.ast.Comprehension;
import com.raditha.pyrefactor.ast.ConstantKind;
import com.raditha.pyrefactor.ast.ExceptHandler;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.ExprContext;
import com.raditha.pyrefactor.ast.FormattedField;
import com.raditha.pyrefactor.ast.Keyword;
import com.raditha.pyrefactor.ast.MatchCase;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.ParameterKind;
import com.raditha.pyrefactor.ast.Parameters;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.StringPart;
import com.raditha.pyrefactor.ast.WithItem;
import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the {@link Stmt} and {@link Expr} model from an error-free
 * tree-sitter-python syntax tree.
 * <p>
 * The grammar accepts a few constructs that Python itself rejects. Those are
 * checked here: {@code break}/{@code continue} outside a loop, assignments to
 * calls and literals, a parameter without a default after one with a default,
 * duplicate parameter names, positional arguments after keyword arguments and
 * the Python 2 {@code print}/{@code exec} statements and {@code <>} operator.
 * <p>
 * Compound statements end where their last nested statement ends, so trailing
 * comments and blank lines are never part of a statement. A parenthesized
 * expression keeps the span of the expression inside the parentheses, while
 * an enclosing node starts at the opening parenthesis.
 */
final class SyntaxTreeBuilder {

    private final SourcePositions positions;
    private int loopDepth;

    SyntaxTreeBuilder(SourcePositions positions) {
        this.positions = positions;
    }

    Module module(TSNode root) throws PythonSyntaxException {
        return new Module(statements(root));
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> statements(TSNode container) throws PythonSyntaxException {
        List<Stmt> result = new ArrayList<>();
        for (TSNode child : namedChildren(container)) {
            result.add(statement(child));
        }
        return result;
    }

    private List<Stmt> block(@Nullable TSNode block, TSNode owner) throws PythonSyntaxException {
        List<Stmt> body = block == null ? List.of() : statements(block);
        if (body.isEmpty()) {
            throw error("expected an indented block", block == null ? owner : block);
        }
        return body;
    }

    private List<Stmt> loopBody(@Nullable TSNode block, TSNode owner) throws PythonSyntaxException {
        loopDepth++;
        try {
            return block(block, owner);
        } finally {
            loopDepth--;
        }
    }

    private Stmt statement(TSNode node) throws PythonSyntaxException {
        switch (node.getType()) {
            case "expression_statement":
                return expressionStatement(node);
            case "return_statement": {
                List<TSNode> value = namedChildren(node);
                return new Stmt.Return(range(node), value.isEmpty() ? null : expression(value.get(0)));
            }
            case "delete_statement":
                return deleteStatement(node);
            case "raise_statement":
                return raiseStatement(node);
            case "pass_statement":
                return new Stmt.Pass(range(node));
            case "break_statement":
                if (loopDepth == 0) {
                    throw error("'break' outside loop", node);
                }
                return new Stmt.Break(range(node));
            case "continue_statement":
                if (loopDepth == 0) {
                    throw error("'continue' not properly in loop", node);
                }
                return new Stmt.Continue(range(node));
            case "global_statement":
                return new Stmt.Global(range(node), identifiers(node));
            case "nonlocal_statement":
                return new Stmt.Nonlocal(range(node), identifiers(node));
            case "assert_statement": {
                List<TSNode> parts = namedChildren(node);
                Expr message = parts.size() > 1 ? expression(parts.get(1)) : null;
                return new Stmt.Assert(range(node), expression(parts.get(0)), message);
            }
            case "import_statement":
                return new Stmt.Import(range(node), aliases(node));
            case "import_from_statement":
                return importFrom(node);
            case "future_import_statement":
                return new Stmt.ImportFrom(range(node), "__future__", aliases(node), 0);
            case "type_alias_statement":
                return typeAlias(node);
            case "if_statement":
                return ifStatement(node);
            case "for_statement":
                return forStatement(node);
            case "while_statement":
                return whileStatement(node);
            case "try_statement":
                return tryStatement(node);
            case "with_statement":
                return withStatement(node);
            case "function_definition":
                return functionDefinition(node, List.of());
            case "class_definition":
                return classDefinition(node, List.of());
            case "decorated_definition":
                return decoratedDefinition(node);
            case "match_statement":
                return matchStatement(node);
            default:
                throw error("invalid syntax", node);
        }
    }

    private Stmt expressionStatement(TSNode node) throws PythonSyntaxException {
        List<TSNode> parts = namedChildren(node);
        if (parts.size() > 1) {
            return new Stmt.ExprStmt(range(node), new Expr.TupleExpr(range(node), expressions(parts),
                    ExprContext.LOAD));
        }
        TSNode only = parts.get(0);
        switch (only.getType()) {
            case "assignment":
                return assignment(node, only);
            case "augmented_assignment":
                return augmentedAssignment(node, only);
            default:
                return new Stmt.ExprStmt(range(node), expression(only));
        }
    }

    private Stmt assignment(TSNode statement, TSNode node) throws PythonSyntaxException {
        TSNode left = required(node, "left");
        TSNode annotation = field(node, "type");
        TSNode right = field(node, "right");
        if (annotation != null) {
            Expr target = expression(left);
            if (target instanceof Expr.TupleExpr) {
                throw error("only single target (not tuple) can be annotated", left);
            }
            if (!isSingleTarget(target)) {
                throw error("illegal target for annotation", left);
            }
            Expr value = right == null ? null : expression(right);
            return new Stmt.AnnAssign(range(statement), toStore(target, ExprContext.STORE), typeExpression(annotation),
                    value);
        }
        List<Expr> targets = new ArrayList<>();
        targets.add(toStore(expression(left), ExprContext.STORE));
        TSNode value = right == null ? node : right;
        while ("assignment".equals(value.getType())) {
            TSNode next = field(value, "right");
            if (next == null || field(value, "type") != null) {
                throw error("invalid syntax", value);
            }
            targets.add(toStore(expression(required(value, "left")), ExprContext.STORE));
            value = next;
        }
        if ("augmented_assignment".equals(value.getType())) {
            throw error("invalid syntax", value);
        }
        return new Stmt.Assign(range(statement), targets, expression(value));
    }

    private Stmt augmentedAssignment(TSNode statement, TSNode node) throws PythonSyntaxException {
        TSNode left = required(node, "left");
        Expr target = expression(left);
        if (!isSingleTarget(target)) {
            throw error("'" + describe(target) + "' is an illegal expression for augmented assignment", left);
        }
        String operator = required(node, "operator").getType();
        Expr value = expression(required(node, "right"));
        return new Stmt.AugAssign(range(statement), toStore(target, ExprContext.STORE),
                operator.substring(0, operator.length() - 1), value);
    }

    private static boolean isSingleTarget(Expr target) {
        return target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript;
    }

    private Stmt deleteStatement(TSNode node) throws PythonSyntaxException {
        TSNode operand = namedChildren(node).get(0);
        List<TSNode> items = "expression_list".equals(operand.getType()) ? namedChildren(operand) : List.of(operand);
        List<Expr> targets = new ArrayList<>();
        for (TSNode item : items) {
            targets.add(toStore(expression(item), ExprContext.DEL));
        }
        return new Stmt.Delete(range(node), targets);
    }

    private Stmt raiseStatement(TSNode node) throws PythonSyntaxException {
        TSNode cause = field(node, "cause");
        Expr exception = null;
        for (TSNode child : namedChildren(node)) {
            if (cause == null || child.getStartByte() != cause.getStartByte()) {
                exception = expression(child);
                break;
            }
        }
        return new Stmt.Raise(range(node), exception, cause == null ? null : expression(cause));
    }

    private List<String> identifiers(TSNode node) {
        List<String> names = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            names.add(positions.text(child));
        }
        return names;
    }

    private List<Alias> aliases(TSNode node) {
        List<Alias> names = new ArrayList<>();
        for (TSNode name : fieldChildren(node, "name")) {
            if ("aliased_import".equals(name.getType())) {
                TSNode alias = field(name, "alias");
                names.add(new Alias(dottedName(field(name, "name")), alias == null ? null : positions.text(alias)));
            } else {
                names.add(new Alias(dottedName(name), null));
            }
        }
        return names;
    }

    private String dottedName(@Nullable TSNode node) {
        if (node == null) {
            return "";
        }
        List<TSNode> parts = namedChildren(node);
        if (parts.isEmpty()) {
            return positions.text(node);
        }
        StringBuilder name = new StringBuilder();
        for (TSNode part : parts) {
            if (name.length() > 0) {
                name.append('.');
            }
            name.append(positions.text(part));
        }
        return name.toString();
    }

    private Stmt importFrom(TSNode node) throws PythonSyntaxException {
        TSNode moduleName = required(node, "module_name");
        int level = 0;
        String module = null;
        if ("relative_import".equals(moduleName.getType())) {
            for (TSNode part : namedChildren(moduleName)) {
                if ("import_prefix".equals(part.getType())) {
                    level = (int) positions.text(part).chars().filter(c -> c == '.').count();
                } else {
                    module = dottedName(part);
                }
            }
        } else {
            module = dottedName(moduleName);
        }
        List<Alias> names = hasChild(node, "wildcard_import") ? List.of(new Alias("*", null)) : aliases(node);
        return new Stmt.ImportFrom(range(node), module, names, level);
    }

    /**
     * {@code type Name[T] = value}. The alias name and its type parameters come
     * from the left-hand type, which is a plain name or a generic one.
     */
    private Stmt typeAlias(TSNode node) throws PythonSyntaxException {
        List<TSNode> parts = namedChildren(node);
        TSNode head = unwrapType(parts.get(0));
        TSNode nameNode = head;
        if ("generic_type".equals(head.getType())) {
            nameNode = namedChildren(head).get(0);
        } else if ("subscript".equals(head.getType())) {
            nameNode = required(head, "value");
        }
        if (!isIdentifier(nameNode)) {
            throw error("invalid syntax", head);
        }
        String typeParameters = nameNode == head ? null
                : positions.slice(positions.endChar(nameNode), positions.endChar(head));
        Expr.Name name = new Expr.Name(range(nameNode), positions.text(nameNode), ExprContext.STORE);
        return new Stmt.TypeAlias(range(node), name, typeParameters,
                typeExpression(parts.get(parts.size() - 1)));
    }

    private TSNode unwrapType(TSNode node) {
        if ("type".equals(node.getType())) {
            List<TSNode> inner = namedChildren(node);
            if (inner.size() == 1) {
                return inner.get(0);
            }
        }
        return node;
    }

    /**
     * {@code if}/{@code elif}/{@code else}; each {@code elif} becomes an
     * {@code If} in the {@code orelse} of its predecessor, spanning to the end
     * of the chain.
     */
    private Stmt.If ifStatement(TSNode node) throws PythonSyntaxException {
        Expr test = expression(required(node, "condition"));
        List<Stmt> body = block(field(node, "consequence"), node);

        List<TSNode> clauses = new ArrayList<>();
        List<Expr> tests = new ArrayList<>();
        List<List<Stmt>> bodies = new ArrayList<>();
        List<Stmt> orelse = List.of();
        for (TSNode alternative : fieldChildren(node, "alternative")) {
            if ("elif_clause".equals(alternative.getType())) {
                clauses.add(alternative);
                tests.add(expression(required(alternative, "condition")));
                bodies.add(block(field(alternative, "consequence"), alternative));
            } else {
                orelse = block(field(alternative, "body"), alternative);
            }
        }
        for (int i = clauses.size() - 1; i >= 0; i--) {
            List<Stmt> tail = orelse.isEmpty() ? bodies.get(i) : orelse;
            orelse = List.of(new Stmt.If(positions.span(clauses.get(i), last(tail).range()), tests.get(i),
                    bodies.get(i), orelse));
        }
        return new Stmt.If(positions.span(node, last(orelse.isEmpty() ? body : orelse).range()), test, body, orelse);
    }

    private Stmt forStatement(TSNode node) throws PythonSyntaxException {
        boolean isAsync = hasChild(node, "async");
        Expr target = toStore(expression(required(node, "left")), ExprContext.STORE);
        Expr iter = expression(required(node, "right"));
        List<Stmt> body = loopBody(field(node, "body"), node);
        List<Stmt> orelse = elseBlock(node);
        return new Stmt.For(positions.span(node, last(orelse.isEmpty() ? body : orelse).range()), target, iter,
                body, orelse, isAsync);
    }

    private Stmt whileStatement(TSNode node) throws PythonSyntaxException {
        Expr test = expression(required(node, "condition"));
        List<Stmt> body = loopBody(field(node, "body"), node);
        List<Stmt> orelse = elseBlock(node);
        return new Stmt.While(positions.span(node, last(orelse.isEmpty() ? body : orelse).range()), test, body,
                orelse);
    }

    private List<Stmt> elseBlock(TSNode node) throws PythonSyntaxException {
        TSNode alternative = field(node, "alternative");
        return alternative == null ? List.of() : block(field(alternative, "body"), alternative);
    }

    private Stmt tryStatement(TSNode node) throws PythonSyntaxException {
        List<Stmt> body = block(field(node, "body"), node);
        List<ExceptHandler> handlers = new ArrayList<>();
        List<Stmt> orelse = List.of();
        List<Stmt> finalbody = List.of();
        Range end = last(body).range();
        for (TSNode clause : namedChildren(node)) {
            switch (clause.getType()) {
                case "except_clause":
                case "except_group_clause": {
                    ExceptHandler handler = handler(clause, "except_group_clause".equals(clause.getType()));
                    handlers.add(handler);
                    end = handler.range();
                    break;
                }
                case "else_clause":
                    orelse = block(field(clause, "body"), clause);
                    end = last(orelse).range();
                    break;
                case "finally_clause":
                    finalbody = block(childOfType(clause, "block"), clause);
                    end = last(finalbody).range();
                    break;
                default:
                    break;
            }
        }
        return new Stmt.Try(positions.span(node, end), body, handlers, orelse, finalbody);
    }

    private ExceptHandler handler(TSNode node, boolean group) throws PythonSyntaxException {
        Expr type = null;
        String name = null;
        TSNode body = null;
        boolean afterAs = false;
        for (TSNode child : children(node)) {
            String kind = child.getType();
            if ("block".equals(kind)) {
                body = child;
            } else if ("as".equals(kind)) {
                afterAs = true;
            } else if (",".equals(kind)) {
                throw error("multiple exception types must be parenthesized", child);
            } else if ("as_pattern".equals(kind)) {
                type = expression(namedChildren(child).get(0));
                name = aliasName(child);
            } else if (child.isNamed()) {
                if (afterAs) {
                    if (!isIdentifier(child)) {
                        throw error("invalid syntax", child);
                    }
                    name = positions.text(child);
                } else {
                    type = expression(child);
                }
            }
        }
        List<Stmt> handlerBody = block(body, node);
        return new ExceptHandler(positions.span(node, last(handlerBody).range()), type, name, handlerBody, group);
    }

    private String aliasName(TSNode asPattern) throws PythonSyntaxException {
        TSNode target = aliasTarget(asPattern);
        if (!isIdentifier(target)) {
            throw error("invalid syntax", target);
        }
        return positions.text(target);
    }

    /**
     * The node after {@code as}, unwrapped from its target wrapper.
     */
    private static TSNode aliasTarget(TSNode asPattern) {
        TSNode target = field(asPattern, "alias");
        if (target == null) {
            List<TSNode> named = namedChildren(asPattern);
            target = named.get(named.size() - 1);
        }
        if ("as_pattern_target".equals(target.getType())) {
            List<TSNode> inner = namedChildren(target);
            return inner.isEmpty() ? target : inner.get(0);
        }
        return target;
    }

    private Stmt withStatement(TSNode node) throws PythonSyntaxException {
        boolean isAsync = hasChild(node, "async");
        List<WithItem> items = new ArrayList<>();
        TSNode clause = childOfType(node, "with_clause");
        for (TSNode item : clause == null ? List.<TSNode>of() : namedChildren(clause)) {
            if (!"with_item".equals(item.getType())) {
                continue;
            }
            TSNode value = field(item, "value");
            if (value == null) {
                value = namedChildren(item).get(0);
            }
            if ("as_pattern".equals(value.getType())) {
                Expr context = expression(namedChildren(value).get(0));
                Expr target = toStore(expression(aliasTarget(value)), ExprContext.STORE);
                items.add(new WithItem(context, target));
            } else {
                items.add(new WithItem(expression(value), null));
            }
        }
        if (items.isEmpty()) {
            throw error("invalid syntax", node);
        }
        List<Stmt> body = block(field(node, "body"), node);
        return new Stmt.With(positions.span(node, last(body).range()), items, body, isAsync);
    }

    private Stmt decoratedDefinition(TSNode node) throws PythonSyntaxException {
        List<Expr> decorators = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            if ("decorator".equals(child.getType())) {
                decorators.add(expression(namedChildren(child).get(0)));
            }
        }
        TSNode definition = required(node, "definition");
        if ("class_definition".equals(definition.getType())) {
            return classDefinition(definition, decorators);
        }
        return functionDefinition(definition, decorators);
    }

    private Stmt.FunctionDef functionDefinition(TSNode node, List<Expr> decorators) throws PythonSyntaxException {
        String name = positions.text(required(node, "name"));
        String typeParameters = typeParameters(node);
        TSNode parameterList = required(node, "parameters");
        Parameters parameters = new Parameters(parameters(parameterList), range(parameterList));
        TSNode returnType = field(node, "return_type");
        Expr returns = returnType == null ? null : typeExpression(returnType);

        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        List<Stmt> body;
        try {
            body = block(field(node, "body"), node);
        } finally {
            loopDepth = savedLoopDepth;
        }
        return new Stmt.FunctionDef(positions.span(node, last(body).range()), name, decorators, typeParameters,
                parameters, returns, body, hasChild(node, "async"));
    }

    private Stmt.ClassDef classDefinition(TSNode node, List<Expr> decorators) throws PythonSyntaxException {
        String name = positions.text(required(node, "name"));
        String typeParameters = typeParameters(node);
        TSNode superclasses = field(node, "superclasses");
        CallArguments arguments = superclasses == null
                ? new CallArguments(List.of(), List.of()) : callArguments(superclasses);

        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        List<Stmt> body;
        try {
            body = block(field(node, "body"), node);
        } finally {
            loopDepth = savedLoopDepth;
        }
        return new Stmt.ClassDef(positions.span(node, last(body).range()), name, decorators, typeParameters,
                arguments.positional(), arguments.keywords(), body);
    }

    private @Nullable String typeParameters(TSNode definition) {
        TSNode list = field(definition, "type_parameters");
        if (list == null) {
            list = childOfType(definition, "type_parameter");
        }
        return list == null ? null : positions.text(list);
    }

    // ---------------------------------------------------------------- parameters

    private List<Parameter> parameters(TSNode list) throws PythonSyntaxException {
        List<Parameter> parameters = new ArrayList<>();
        Set<String> names = new HashSet<>();
        boolean seenDefault = false;
        boolean seenStar = false;
        boolean seenSlash = false;

        for (TSNode node : namedChildren(list)) {
            if (!parameters.isEmpty() && parameters.get(parameters.size() - 1).kind() == ParameterKind.VAR_KEYWORD) {
                throw error("arguments cannot follow var-keyword argument", node);
            }
            Range range = range(node);
            switch (node.getType()) {
                case "positional_separator":
                    if (seenSlash || seenStar || parameters.isEmpty()) {
                        throw error("invalid syntax", node);
                    }
                    seenSlash = true;
                    parameters.replaceAll(p -> new Parameter(p.range(), p.name(), ParameterKind.POSITIONAL_ONLY,
                            p.annotation(), p.defaultValue()));
                    parameters.add(new Parameter(range, "/", ParameterKind.SLASH, null, null));
                    break;
                case "keyword_separator":
                    if (seenStar) {
                        throw error("* argument may appear only once", node);
                    }
                    seenStar = true;
                    parameters.add(new Parameter(range, "*", ParameterKind.BARE_STAR, null, null));
                    break;
                case "list_splat_pattern":
                case "dictionary_splat_pattern":
                case "typed_parameter": {
                    TSNode pattern = "typed_parameter".equals(node.getType()) ? namedChildren(node).get(0) : node;
                    TSNode type = field(node, "type");
                    Expr annotation = type == null ? null : typeExpression(type);
                    if ("list_splat_pattern".equals(pattern.getType())) {
                        if (seenStar) {
                            throw error("* argument may appear only once", node);
                        }
                        seenStar = true;
                        addParameter(parameters, names, new Parameter(range, splatName(pattern),
                                ParameterKind.VAR_POSITIONAL, annotation, null), pattern);
                    } else if ("dictionary_splat_pattern".equals(pattern.getType())) {
                        addParameter(parameters, names, new Parameter(range, splatName(pattern),
                                ParameterKind.VAR_KEYWORD, annotation, null), pattern);
                    } else {
                        seenDefault = checkDefaultOrder(seenDefault, seenStar, false, node);
                        addParameter(parameters, names, new Parameter(range, identifierText(pattern),
                                seenStar ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL, annotation, null),
                                pattern);
                    }
                    break;
                }
                case "default_parameter":
                case "typed_default_parameter": {
                    TSNode nameNode = required(node, "name");
                    TSNode type = field(node, "type");
                    Expr annotation = type == null ? null : typeExpression(type);
                    Expr defaultValue = expression(required(node, "value"));
                    seenDefault = checkDefaultOrder(seenDefault, seenStar, true, node);
                    addParameter(parameters, names, new Parameter(range, identifierText(nameNode),
                            seenStar ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL, annotation,
                            defaultValue), nameNode);
                    break;
                }
                case "identifier":
                    seenDefault = checkDefaultOrder(seenDefault, seenStar, false, node);
                    addParameter(parameters, names, new Parameter(range, positions.text(node),
                            seenStar ? ParameterKind.KEYWORD_ONLY : ParameterKind.POSITIONAL, null, null), node);
                    break;
                default:
                    throw error("invalid syntax", node);
            }
        }

        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).kind() == ParameterKind.BARE_STAR) {
                boolean lastParameter = i == parameters.size() - 1;
                if (lastParameter || parameters.get(i + 1).kind() == ParameterKind.VAR_KEYWORD) {
                    Range r = parameters.get(i).range();
                    throw new PythonSyntaxException("named arguments must follow bare *", r.startLine(),
                            r.startColumn());
                }
            }
        }
        return parameters;
    }

    /**
     * Returns whether a default has been seen, counting this parameter.
     */
    private boolean checkDefaultOrder(boolean seenDefault, boolean seenStar, boolean hasDefault, TSNode node)
            throws PythonSyntaxException {
        if (seenStar) {
            return seenDefault;
        }
        if (!hasDefault && seenDefault) {
            throw error("non-default argument follows default argument", node);
        }
        return seenDefault || hasDefault;
    }

    private void addParameter(List<Parameter> parameters, Set<String> names, Parameter parameter, TSNode at)
            throws PythonSyntaxException {
        if (!names.add(parameter.name())) {
            throw error("duplicate argument '" + parameter.name() + "' in function definition", at);
        }
        parameters.add(parameter);
    }

    private String splatName(TSNode pattern) throws PythonSyntaxException {
        List<TSNode> inner = namedChildren(pattern);
        if (inner.size() != 1) {
            throw error("invalid syntax", pattern);
        }
        return identifierText(inner.get(0));
    }

    private String identifierText(TSNode node) throws PythonSyntaxException {
        if (!isIdentifier(node)) {
            throw error("invalid syntax", node);
        }
        return positions.text(node);
    }

    private static boolean isIdentifier(TSNode node) {
        String type = node.getType();
        return "identifier".equals(type) || "keyword_identifier".equals(type);
    }

    // --------------------------------------------------------------------- match

    private Stmt matchStatement(TSNode node) throws PythonSyntaxException {
        List<TSNode> subjects = fieldChildren(node, "subject");
        Expr subject = subjects.size() == 1 && !hasChild(node, ",")
                ? expression(subjects.get(0))
                : new Expr.TupleExpr(positions.span(subjects.get(0), subjects.get(subjects.size() - 1)),
                        expressions(subjects), ExprContext.LOAD);
        List<MatchCase> cases = new ArrayList<>();
        TSNode body = field(node, "body");
        for (TSNode clause : body == null ? List.<TSNode>of() : namedChildren(body)) {
            if ("case_clause".equals(clause.getType())) {
                cases.add(matchCase(clause));
            }
        }
        if (cases.isEmpty()) {
            throw error("expected an indented block", node);
        }
        return new Stmt.Match(positions.span(node, cases.get(cases.size() - 1).range()), subject, cases);
    }

    private MatchCase matchCase(TSNode node) throws PythonSyntaxException {
        List<TSNode> patterns = new ArrayList<>();
        int patternEnd = -1;
        for (TSNode child : children(node)) {
            String type = child.getType();
            if ("case_pattern".equals(type)) {
                patterns.add(child);
                patternEnd = positions.endChar(child);
            } else if (",".equals(type) && !patterns.isEmpty()) {
                patternEnd = positions.endChar(child);
            } else if ("if_clause".equals(type) || ":".equals(type)) {
                break;
            }
        }
        if (patterns.isEmpty()) {
            throw error("invalid syntax", node);
        }
        String pattern = positions.slice(positions.startChar(patterns.get(0)), patternEnd);
        List<Expr.Name> captures = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        for (TSNode p : patterns) {
            collectPattern(p, captures, values);
        }
        TSNode guardNode = field(node, "guard");
        if (guardNode == null) {
            guardNode = childOfType(node, "if_clause");
        }
        Expr guard = guardNode == null ? null : expression(namedChildren(guardNode).get(0));
        List<Stmt> body = block(field(node, "consequence"), node);
        return new MatchCase(positions.span(node, last(body).range()), pattern, captures, values, guard, body);
    }

    /**
     * Sorts the names of a pattern into captures, which it binds, and value
     * names, which it reads.
     */
    private void collectPattern(TSNode node, List<Expr.Name> captures, List<Expr> values) {
        switch (node.getType()) {
            case "dotted_name": {
                List<TSNode> parts = namedChildren(node);
                if (parts.size() == 1) {
                    capture(parts.get(0), captures);
                } else {
                    values.add(dottedExpression(node));
                }
                return;
            }
            case "identifier":
                capture(node, captures);
                return;
            case "as_pattern_target":
                if (namedChildren(node).isEmpty()) {
                    capture(node, captures);
                    return;
                }
                break;
            case "class_pattern": {
                List<TSNode> parts = namedChildren(node);
                values.add(dottedExpression(parts.get(0)));
                for (int i = 1; i < parts.size(); i++) {
                    collectPattern(parts.get(i), captures, values);
                }
                return;
            }
            case "keyword_pattern": {
                List<TSNode> parts = namedChildren(node);
                for (int i = 1; i < parts.size(); i++) {
                    collectPattern(parts.get(i), captures, values);
                }
                return;
            }
            case "dict_pattern":
                for (int i = 0; i < node.getChildCount(); i++) {
                    TSNode child = node.getChild(i);
                    if (!child.isNamed() || isExtra(child)) {
                        continue;
                    }
                    if ("key".equals(node.getFieldNameForChild(i)) && "dotted_name".equals(child.getType())) {
                        values.add(dottedExpression(child));
                    } else {
                        collectPattern(child, captures, values);
                    }
                }
                return;
            case "string":
            case "concatenated_string":
            case "integer":
            case "float":
            case "complex_pattern":
            case "true":
            case "false":
            case "none":
                return;
            default:
                break;
        }
        for (TSNode child : namedChildren(node)) {
            collectPattern(child, captures, values);
        }
    }

    private void capture(TSNode node, List<Expr.Name> captures) {
        String name = positions.text(node);
        if (!"_".equals(name)) {
            captures.add(new Expr.Name(range(node), name, ExprContext.STORE));
        }
    }

    private Expr dottedExpression(TSNode node) {
        List<TSNode> parts = namedChildren(node);
        if (parts.isEmpty()) {
            return new Expr.Name(range(node), positions.text(node), ExprContext.LOAD);
        }
        Expr result = new Expr.Name(range(parts.get(0)), positions.text(parts.get(0)), ExprContext.LOAD);
        for (int i = 1; i < parts.size(); i++) {
            result = new Expr.Attribute(positions.span(parts.get(0), parts.get(i)), result,
                    positions.text(parts.get(i)), ExprContext.LOAD);
        }
        return result;
    }

    // --------------------------------------------------------------- expressions

    private List<Expr> expressions(List<TSNode> nodes) throws PythonSyntaxException {
        List<Expr> result = new ArrayList<>();
        for (TSNode node : nodes) {
            result.add(expression(node));
        }
        return result;
    }

    private Expr expression(TSNode node) throws PythonSyntaxException {
        Range range = range(node);
        switch (node.getType()) {
            case "identifier":
            case "keyword_identifier":
                return new Expr.Name(range, positions.text(node), ExprContext.LOAD);
            case "integer":
            case "float":
                return new Expr.Constant(range, ConstantKind.NUMBER, positions.text(node));
            case "true":
                return new Expr.Constant(range, ConstantKind.TRUE, "True");
            case "false":
                return new Expr.Constant(range, ConstantKind.FALSE, "False");
            case "none":
                return new Expr.Constant(range, ConstantKind.NONE, "None");
            case "ellipsis":
                return new Expr.Constant(range, ConstantKind.ELLIPSIS, "...");
            case "string":
                return new Expr.Str(range, List.of(stringPart(node)));
            case "concatenated_string": {
                List<StringPart> parts = new ArrayList<>();
                for (TSNode part : namedChildren(node)) {
                    parts.add(stringPart(part));
                }
                return new Expr.Str(range, parts);
            }
            case "parenthesized_expression":
                return expression(namedChildren(node).get(0));
            case "tuple":
            case "tuple_pattern":
            case "pattern_list":
            case "expression_list":
                return new Expr.TupleExpr(range, expressions(namedChildren(node)), ExprContext.LOAD);
            case "list":
            case "list_pattern":
                return new Expr.ListExpr(range, expressions(namedChildren(node)), ExprContext.LOAD);
            case "set":
                return new Expr.SetExpr(range, expressions(namedChildren(node)));
            case "dictionary":
                return dictionary(node);
            case "list_splat":
            case "list_splat_pattern":
                return new Expr.Starred(range, expression(namedChildren(node).get(0)), ExprContext.LOAD);
            case "attribute":
                return new Expr.Attribute(range, expression(required(node, "object")),
                        positions.text(required(node, "attribute")), ExprContext.LOAD);
            case "subscript":
                return subscript(node);
            case "slice":
                return slice(node);
            case "call":
                return call(node);
            case "binary_operator":
                return new Expr.BinOp(range, expression(required(node, "left")),
                        required(node, "operator").getType(), expression(required(node, "right")));
            case "unary_operator":
                return new Expr.UnaryOp(range, required(node, "operator").getType(),
                        expression(required(node, "argument")));
            case "not_operator":
                return new Expr.UnaryOp(range, "not", expression(required(node, "argument")));
            case "boolean_operator": {
                String op = required(node, "operator").getType();
                List<Expr> values = new ArrayList<>();
                collectBooleanOperands(node, op, values);
                return new Expr.BoolOp(range, op, values);
            }
            case "comparison_operator":
                return comparison(node);
            case "conditional_expression": {
                List<TSNode> parts = namedChildren(node);
                Expr body = expression(parts.get(0));
                Expr test = expression(parts.get(1));
                return new Expr.IfExp(range, test, body, expression(parts.get(2)));
            }
            case "named_expression": {
                TSNode name = required(node, "name");
                Expr.Name target = new Expr.Name(range(name), positions.text(name), ExprContext.STORE);
                return new Expr.NamedExpr(range, target, expression(required(node, "value")));
            }
            case "lambda":
                return lambda(node);
            case "await":
                return new Expr.Await(range, expression(namedChildren(node).get(0)));
            case "yield": {
                List<TSNode> value = namedChildren(node);
                if (hasChild(node, "from")) {
                    return new Expr.YieldFrom(range, expression(value.get(0)));
                }
                return new Expr.Yield(range, value.isEmpty() ? null : expression(value.get(0)));
            }
            case "list_comprehension":
            case "set_comprehension":
            case "dictionary_comprehension":
            case "generator_expression":
                return comprehension(node, range);
            case "as_pattern_target": {
                List<TSNode> inner = namedChildren(node);
                return inner.isEmpty()
                        ? new Expr.Name(range, positions.text(node), ExprContext.LOAD)
                        : expression(inner.get(0));
            }
            case "type":
            case "generic_type":
            case "union_type":
            case "member_type":
            case "splat_type":
            case "constrained_type":
                return typeExpression(node);
            default:
                throw error("invalid syntax", node);
        }
    }

    private void collectBooleanOperands(TSNode node, String op, List<Expr> values) throws PythonSyntaxException {
        for (TSNode operand : List.of(required(node, "left"), required(node, "right"))) {
            if ("boolean_operator".equals(operand.getType()) && op.equals(required(operand, "operator").getType())) {
                collectBooleanOperands(operand, op, values);
            } else {
                values.add(expression(operand));
            }
        }
    }

    private Expr comparison(TSNode node) throws PythonSyntaxException {
        Expr left = null;
        List<String> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        for (TSNode child : children(node)) {
            if (child.isNamed()) {
                Expr operand = expression(child);
                if (left == null) {
                    left = operand;
                } else {
                    comparators.add(operand);
                }
            } else {
                String op = child.getType().replaceAll("\\s+", " ");
                if ("<>".equals(op)) {
                    throw error("invalid syntax", child);
                }
                ops.add(op);
            }
        }
        if (left == null || ops.size() != comparators.size()) {
            throw error("invalid syntax", node);
        }
        return new Expr.Compare(range(node), left, ops, comparators);
    }

    private Expr lambda(TSNode node) throws PythonSyntaxException {
        TSNode list = field(node, "parameters");
        List<Parameter> parameters = list == null ? List.of() : parameters(list);
        Parameters signature = parameters.isEmpty()
                ? Parameters.empty()
                : new Parameters(parameters, Range.between(parameters.get(0).range(),
                        parameters.get(parameters.size() - 1).range()));
        return new Expr.Lambda(range(node), signature, expression(required(node, "body")));
    }

    private Expr dictionary(TSNode node) throws PythonSyntaxException {
        List<@Nullable Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        for (TSNode item : namedChildren(node)) {
            if ("pair".equals(item.getType())) {
                keys.add(expression(required(item, "key")));
                values.add(expression(required(item, "value")));
            } else if ("dictionary_splat".equals(item.getType())) {
                keys.add(null);
                values.add(expression(namedChildren(item).get(0)));
            } else {
                throw error("invalid syntax", item);
            }
        }
        return new Expr.DictExpr(range(node), keys, values);
    }

    /**
     * Several subscripts, or one followed by a comma, form a tuple.
     */
    private Expr subscript(TSNode node) throws PythonSyntaxException {
        Expr value = expression(required(node, "value"));
        List<TSNode> subscripts = fieldChildren(node, "subscript");
        Expr slice;
        if (subscripts.size() == 1 && !hasChild(node, ",")) {
            slice = expression(subscripts.get(0));
        } else {
            TSNode lastToken = subscripts.get(subscripts.size() - 1);
            for (TSNode child : children(node)) {
                if (",".equals(child.getType())) {
                    lastToken = child;
                }
            }
            slice = new Expr.TupleExpr(positions.span(subscripts.get(0), lastToken), expressions(subscripts),
                    ExprContext.LOAD);
        }
        return new Expr.Subscript(range(node), value, slice, ExprContext.LOAD);
    }

    private Expr slice(TSNode node) throws PythonSyntaxException {
        Expr[] bounds = new Expr[3];
        int colons = 0;
        for (TSNode child : children(node)) {
            if (":".equals(child.getType())) {
                colons++;
            } else if (child.isNamed() && colons < bounds.length) {
                bounds[colons] = expression(child);
            }
        }
        return new Expr.Slice(range(node), bounds[0], bounds[1], bounds[2]);
    }

    private Expr call(TSNode node) throws PythonSyntaxException {
        Expr func = expression(required(node, "function"));
        TSNode arguments = required(node, "arguments");
        if ("generator_expression".equals(arguments.getType())) {
            List<TSNode> parts = namedChildren(arguments);
            Range inside = positions.span(parts.get(0), parts.get(parts.size() - 1));
            return new Expr.Call(range(node), func, List.of(comprehension(arguments, inside)), List.of());
        }
        CallArguments parsed = callArguments(arguments);
        return new Expr.Call(range(node), func, parsed.positional(), parsed.keywords());
    }

    private record CallArguments(List<Expr> positional, List<Keyword> keywords) {
    }

    private CallArguments callArguments(TSNode list) throws PythonSyntaxException {
        List<Expr> positional = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        Set<String> keywordNames = new HashSet<>();
        boolean seenKeyword = false;
        boolean seenKeywordUnpacking = false;

        for (TSNode item : namedChildren(list)) {
            switch (item.getType()) {
                case "keyword_argument": {
                    String name = positions.text(required(item, "name"));
                    if (!keywordNames.add(name)) {
                        throw error("keyword argument repeated: " + name, item);
                    }
                    keywords.add(new Keyword(range(item), name, expression(required(item, "value"))));
                    seenKeyword = true;
                    break;
                }
                case "dictionary_splat":
                    keywords.add(new Keyword(range(item), null, expression(namedChildren(item).get(0))));
                    seenKeywordUnpacking = true;
                    break;
                case "list_splat":
                    if (seenKeywordUnpacking) {
                        throw error("iterable argument unpacking follows keyword argument unpacking", item);
                    }
                    positional.add(expression(item));
                    break;
                default: {
                    Expr value = expression(item);
                    if (seenKeywordUnpacking) {
                        throw error("positional argument follows keyword argument unpacking", item);
                    }
                    if (seenKeyword) {
                        throw error("positional argument follows keyword argument", item);
                    }
                    positional.add(value);
                    break;
                }
            }
        }
        return new CallArguments(positional, keywords);
    }

    private Expr comprehension(TSNode node, Range range) throws PythonSyntaxException {
        TSNode body = required(node, "body");
        List<Comprehension> generators = new ArrayList<>();
        List<TSNode> clauses = namedChildren(node);
        for (int i = 0; i < clauses.size(); i++) {
            TSNode clause = clauses.get(i);
            if (!"for_in_clause".equals(clause.getType())) {
                continue;
            }
            Expr target = toStore(expression(required(clause, "left")), ExprContext.STORE);
            List<TSNode> iterables = fieldChildren(clause, "right");
            Expr iter = iterables.size() == 1 && !hasChild(clause, ",")
                    ? expression(iterables.get(0))
                    : new Expr.TupleExpr(positions.span(iterables.get(0), iterables.get(iterables.size() - 1)),
                            expressions(iterables), ExprContext.LOAD);
            List<Expr> ifs = new ArrayList<>();
            while (i + 1 < clauses.size() && "if_clause".equals(clauses.get(i + 1).getType())) {
                i++;
                ifs.add(expression(namedChildren(clauses.get(i)).get(0)));
            }
            generators.add(new Comprehension(target, iter, ifs, hasChild(clause, "async")));
        }
        switch (node.getType()) {
            case "list_comprehension":
                return new Expr.ListComp(range, expression(body), generators);
            case "set_comprehension":
                return new Expr.SetComp(range, expression(body), generators);
            case "dictionary_comprehension":
                return new Expr.DictComp(range, expression(required(body, "key")), expression(required(body, "value")),
                        generators);
            default:
                return new Expr.GeneratorExp(range, expression(body), generators);
        }
    }

    /**
     * Annotations. Generic, union and member types map onto subscripts, the
     * {@code |} operator and attributes.
     */
    private Expr typeExpression(TSNode node) throws PythonSyntaxException {
        List<TSNode> parts = namedChildren(node);
        switch (node.getType()) {
            case "type":
            case "constrained_type":
                if (parts.isEmpty()) {
                    throw error("invalid syntax", node);
                }
                return typeExpression(parts.get(0));
            case "generic_type": {
                Expr base = expression(parts.get(0));
                List<TSNode> arguments = namedChildren(parts.get(parts.size() - 1));
                List<Expr> converted = new ArrayList<>();
                for (TSNode argument : arguments) {
                    converted.add(typeExpression(argument));
                }
                Expr slice = converted.size() == 1 ? converted.get(0)
                        : new Expr.TupleExpr(positions.span(arguments.get(0), arguments.get(arguments.size() - 1)),
                                converted, ExprContext.LOAD);
                return new Expr.Subscript(range(node), base, slice, ExprContext.LOAD);
            }
            case "union_type":
                return new Expr.BinOp(range(node), typeExpression(parts.get(0)), "|", typeExpression(parts.get(1)));
            case "member_type":
                return new Expr.Attribute(range(node), typeExpression(parts.get(0)), positions.text(parts.get(1)),
                        ExprContext.LOAD);
            case "splat_type":
                return new Expr.Starred(range(node), expression(parts.get(0)), ExprContext.LOAD);
            default:
                return expression(node);
        }
    }

    // ------------------------------------------------------------------- strings

    private StringPart stringPart(TSNode node) throws PythonSyntaxException {
        TSNode start = childOfType(node, "string_start");
        TSNode end = childOfType(node, "string_end");
        if (start == null || end == null) {
            throw error("invalid syntax", node);
        }
        String opening = positions.text(start);
        int q = 0;
        while (q < opening.length() && Character.isLetter(opening.charAt(q))) {
            q++;
        }
        int bodyStart = positions.endChar(start);
        String body = positions.slice(bodyStart, positions.startChar(end));
        List<FormattedField> fields = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            if ("interpolation".equals(child.getType())) {
                addField(child, bodyStart, fields);
            }
        }
        return new StringPart(range(node), opening.substring(0, q), opening.substring(q), body, fields);
    }

    /**
     * Adds the field of an interpolation, then those nested in its format
     * specification.
     */
    private void addField(TSNode interpolation, int bodyStart, List<FormattedField> fields)
            throws PythonSyntaxException {
        TSNode expression = field(interpolation, "expression");
        if (expression == null) {
            throw error("f-string: valid expression required before '}'", interpolation);
        }
        fields.add(new FormattedField(positions.startChar(expression) - bodyStart,
                positions.endChar(expression) - bodyStart, expression(expression)));
        TSNode spec = field(interpolation, "format_specifier");
        if (spec != null) {
            for (TSNode nested : namedChildren(spec)) {
                if ("interpolation".equals(nested.getType()) || "format_expression".equals(nested.getType())) {
                    addField(nested, bodyStart, fields);
                }
            }
        }
    }

    // ------------------------------------------------------------------- targets

    private Expr toStore(Expr expression, ExprContext context) throws PythonSyntaxException {
        if (expression instanceof Expr.Name name) {
            return new Expr.Name(name.range(), name.id(), context);
        }
        if (expression instanceof Expr.Attribute attribute) {
            return new Expr.Attribute(attribute.range(), attribute.value(), attribute.attr(), context);
        }
        if (expression instanceof Expr.Subscript subscript) {
            return new Expr.Subscript(subscript.range(), subscript.value(), subscript.slice(), context);
        }
        if (expression instanceof Expr.Starred starred && context == ExprContext.STORE) {
            return new Expr.Starred(starred.range(), toStore(starred.value(), context), context);
        }
        if (expression instanceof Expr.TupleExpr tuple) {
            List<Expr> elements = new ArrayList<>();
            for (Expr element : tuple.elements()) {
                elements.add(toStore(element, context));
            }
            return new Expr.TupleExpr(tuple.range(), elements, context);
        }
        if (expression instanceof Expr.ListExpr list) {
            List<Expr> elements = new ArrayList<>();
            for (Expr element : list.elements()) {
                elements.add(toStore(element, context));
            }
            return new Expr.ListExpr(list.range(), elements, context);
        }
        String verb = context == ExprContext.DEL ? "delete " : "assign to ";
        Range r = expression.range();
        throw new PythonSyntaxException("cannot " + verb + describe(expression), r.startLine(), r.startColumn());
    }

    private static String describe(Expr expression) {
        if (expression instanceof Expr.Call) {
            return "function call";
        }
        if (expression instanceof Expr.Constant constant) {
            return constant.kind() == ConstantKind.NUMBER || constant.kind() == ConstantKind.ELLIPSIS
                    ? "literal" : constant.text();
        }
        if (expression instanceof Expr.Str) {
            return "literal";
        }
        if (expression instanceof Expr.Lambda) {
            return "lambda";
        }
        if (expression instanceof Expr.ListComp || expression instanceof Expr.SetComp
                || expression instanceof Expr.DictComp || expression instanceof Expr.GeneratorExp) {
            return "comprehension";
        }
        if (expression instanceof Expr.Starred) {
            return "starred";
        }
        if (expression instanceof Expr.TupleExpr) {
            return "tuple";
        }
        return "expression";
    }

    // ------------------------------------------------------------------- helpers

    private static boolean isExtra(TSNode node) {
        String type = node.getType();
        return "comment".equals(type) || "line_continuation".equals(type);
    }

    private static List<TSNode> children(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!isExtra(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!isExtra(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<TSNode> fieldChildren(TSNode node, String fieldName) {
        List<TSNode> result = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    private static @Nullable TSNode field(TSNode node, String fieldName) {
        TSNode child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    private TSNode required(TSNode node, String fieldName) throws PythonSyntaxException {
        TSNode child = field(node, fieldName);
        if (child == null) {
            throw error("invalid syntax", node);
        }
        return child;
    }

    private static @Nullable TSNode childOfType(TSNode node, String type) {
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static boolean hasChild(TSNode node, String type) {
        return childOfType(node, type) != null;
    }

    private static Stmt last(List<Stmt> statements) {
        return statements.get(statements.size() - 1);
    }

    private Range range(TSNode node) {
        return positions.range(node);
    }

    private PythonSyntaxException error(String reason, TSNode at) {
        int start = positions.startChar(at);
        return new PythonSyntaxException(reason, positions.line(start), positions.column(start));
    }
}
