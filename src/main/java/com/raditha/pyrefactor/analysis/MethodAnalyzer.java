package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Decorators;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.ExprContext;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.model.MethodInfo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Describes the methods of a class: how they are declared and what they use
 * through their receiver.
 */
public class MethodAnalyzer {

    public MethodInfo analyze(Stmt.FunctionDef method) {
        List<Parameter> named = method.parameters().named();
        String receiver = receiverName(method);
        List<String> parameters = new ArrayList<>();
        for (int i = 0; i < named.size(); i++) {
            if (i == 0 && named.get(0).name().equals(receiver)) {
                continue;
            }
            parameters.add(named.get(i).name());
        }

        Set<String> selfReferences = new TreeSet<>();
        Set<String> methodCalls = new TreeSet<>();
        new TreeScanner() {
            @Override
            public Void visitAttribute(Expr.Attribute node) {
                if (node.context() == ExprContext.LOAD && isReceiver(node.value(), receiver)) {
                    selfReferences.add(node.attr());
                }
                return super.visitAttribute(node);
            }

            @Override
            public Void visitCall(Expr.Call node) {
                if (node.func() instanceof Expr.Attribute attribute && isReceiver(attribute.value(), receiver)) {
                    methodCalls.add(attribute.attr());
                }
                return super.visitCall(node);
            }
        }.scanStatements(method.body());

        return new MethodInfo(method.name(), parameters, method.fullRange(),
                isAbstract(method), method.hasDecorator("staticmethod"), method.hasDecorator("classmethod"),
                selfReferences, methodCalls, methodCalls);
    }

    /**
     * The first parameter when it is called {@code self} or {@code cls}, else {@code self}.
     */
    public static String receiverName(Stmt.FunctionDef method) {
        List<Parameter> named = method.parameters().named();
        if (!named.isEmpty()) {
            String first = named.get(0).name();
            if (first.equals("self") || first.equals("cls")) {
                return first;
            }
        }
        return "self";
    }

    public static boolean isAbstract(Stmt.FunctionDef method) {
        for (Expr decorator : method.decorators()) {
            if ("abstractmethod".equals(Decorators.simpleName(decorator)) && !(decorator instanceof Expr.Call)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Names defined directly in the class body: methods, nested classes and
     * class-level attributes.
     */
    public Set<String> memberNames(Stmt.ClassDef owner) {
        Set<String> names = new LinkedHashSet<>();
        for (Stmt statement : owner.body()) {
            if (statement instanceof Stmt.FunctionDef function) {
                names.add(function.name());
            } else if (statement instanceof Stmt.ClassDef nested) {
                names.add(nested.name());
            } else if (statement instanceof Stmt.Assign assign) {
                assign.targets().forEach(target -> collectNames(target, names));
            } else if (statement instanceof Stmt.AnnAssign annotated) {
                collectNames(annotated.target(), names);
            }
        }
        return names;
    }

    /**
     * Whether the class still has something besides a docstring and {@code pass}
     * once {@code removedMethod} is gone.
     */
    public boolean keepsMembersWithout(Stmt.ClassDef owner, String removedMethod) {
        for (Stmt statement : owner.body()) {
            if (statement instanceof Stmt.Pass || isDocstring(statement)) {
                continue;
            }
            if (statement instanceof Stmt.FunctionDef function && function.name().equals(removedMethod)) {
                continue;
            }
            return true;
        }
        return false;
    }

    /**
     * A body that holds nothing but {@code pass} statements and an optional docstring.
     */
    public static boolean isPlaceholderBody(List<Stmt> body) {
        return body.stream().allMatch(s -> s instanceof Stmt.Pass || isDocstring(s))
                && body.stream().anyMatch(s -> s instanceof Stmt.Pass);
    }

    static boolean isDocstring(Stmt statement) {
        return statement instanceof Stmt.ExprStmt expression && expression.value() instanceof Expr.Str;
    }

    private static boolean isReceiver(Expr expression, String receiver) {
        return expression instanceof Expr.Name name && name.id().equals(receiver);
    }

    private static void collectNames(Expr target, Set<String> names) {
        if (target instanceof Expr.Name name) {
            names.add(name.id());
        } else if (target instanceof Expr.TupleExpr tuple) {
            tuple.elements().forEach(e -> collectNames(e, names));
        } else if (target instanceof Expr.ListExpr list) {
            list.elements().forEach(e -> collectNames(e, names));
        } else if (target instanceof Expr.Starred starred) {
            collectNames(starred.value(), names);
        }
    }
}
