package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.model.FunctionInfo;
import com.raditha.pyrefactor.model.UnsafeReason;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a function is simple enough to be substituted at its call
 * sites without changing behaviour.
 * <p>
 * The checks run in a fixed order and the first failing one is reported:
 * default arguments, variadic parameters, recursion, generators,
 * {@code global}, {@code nonlocal}, calls to side-effect functions, attribute
 * and subscript stores, return structure and finally the shape of the
 * statements before the return.
 */
public class SideEffectChecker {

    private static final Logger logger = LoggerFactory.getLogger(SideEffectChecker.class);

    static final Set<String> SIDE_EFFECT_FUNCTIONS = Set.of("print", "open", "write", "input", "exec", "eval");

    public FunctionInfo analyze(Stmt.FunctionDef function) {
        List<Stmt> statements = stripDocstringAndPass(function.body());
        Stmt.Return onlyReturn = null;
        List<Stmt> beforeReturn = statements;
        if (!statements.isEmpty() && statements.get(statements.size() - 1) instanceof Stmt.Return last) {
            onlyReturn = last;
            beforeReturn = statements.subList(0, statements.size() - 1);
        }
        Expr returnValue = onlyReturn == null ? null : onlyReturn.value();

        Finding finding = check(function, statements, beforeReturn, returnValue);
        if (finding != null) {
            logger.debug("Function '{}' cannot be inlined: {}", function.name(), finding.reason.describe(finding.detail));
        }
        return new FunctionInfo(function.name(), function.parameters().names(), List.copyOf(beforeReturn),
                returnValue, function,
                finding == null ? null : finding.reason,
                finding == null ? null : finding.detail);
    }

    private @Nullable Finding check(Stmt.FunctionDef function, List<Stmt> statements, List<Stmt> beforeReturn,
                                    @Nullable Expr returnValue) {
        if (function.parameters().hasDefaults()) {
            return new Finding(UnsafeReason.HAS_DEFAULT_ARGUMENTS, null);
        }
        if (function.parameters().hasVariadic()) {
            return new Finding(UnsafeReason.HAS_VARIADIC_PARAMETERS, null);
        }

        BodyScanner scanner = new BodyScanner(function.name());
        scanner.scanStatements(function.body());
        if (scanner.recursive) {
            return new Finding(UnsafeReason.RECURSIVE, null);
        }
        if (scanner.generator) {
            return new Finding(UnsafeReason.GENERATOR, null);
        }
        if (scanner.usesGlobal) {
            return new Finding(UnsafeReason.USES_GLOBAL, null);
        }
        if (scanner.usesNonlocal) {
            return new Finding(UnsafeReason.USES_NONLOCAL, null);
        }
        if (scanner.sideEffectCall != null) {
            return new Finding(UnsafeReason.SIDE_EFFECT_CALL, scanner.sideEffectCall);
        }
        if (scanner.modifiesAttribute) {
            return new Finding(UnsafeReason.MODIFIES_ATTRIBUTES, null);
        }
        if (scanner.modifiesSubscript) {
            return new Finding(UnsafeReason.MODIFIES_SUBSCRIPT, null);
        }
        if (scanner.returns > 1) {
            return new Finding(UnsafeReason.MULTIPLE_RETURNS, null);
        }
        if (scanner.returns == 1 && !(statements.get(statements.size() - 1) instanceof Stmt.Return)) {
            return new Finding(UnsafeReason.EARLY_RETURN, null);
        }
        if (returnValue != null) {
            for (Stmt statement : beforeReturn) {
                if (!isSimpleBinding(statement)) {
                    return new Finding(UnsafeReason.UNSUPPORTED_STATEMENTS, null);
                }
            }
        } else if (scanner.definesNested || scanner.matches) {
            return new Finding(UnsafeReason.UNSUPPORTED_STATEMENTS, null);
        }
        return null;
    }

    /**
     * {@code name = expr} with a single plain name target.
     */
    static boolean isSimpleBinding(Stmt statement) {
        return statement instanceof Stmt.Assign assign
                && assign.targets().size() == 1
                && assign.targets().get(0) instanceof Expr.Name;
    }

    static List<Stmt> stripDocstringAndPass(List<Stmt> body) {
        List<Stmt> result = new ArrayList<>(body);
        if (!result.isEmpty() && result.get(0) instanceof Stmt.ExprStmt first
                && first.value() instanceof Expr.Str str && !str.isFormatted()) {
            result.remove(0);
        }
        if (!result.isEmpty() && result.get(result.size() - 1) instanceof Stmt.Pass) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    private record Finding(UnsafeReason reason, @Nullable String detail) {
    }

    /**
     * Walks the body without entering nested definitions, except for
     * recursion and side-effect calls which are searched everywhere, lambdas
     * included.
     */
    private static final class BodyScanner extends TreeScanner {
        private final String functionName;
        private int nestedDepth;
        private boolean recursive;
        private boolean generator;
        private boolean usesGlobal;
        private boolean usesNonlocal;
        private boolean modifiesAttribute;
        private boolean modifiesSubscript;
        private boolean definesNested;
        private boolean matches;
        private int returns;
        private @Nullable String sideEffectCall;

        BodyScanner(String functionName) {
            this.functionName = functionName;
        }

        private boolean direct() {
            return nestedDepth == 0;
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node) {
            definesNested = true;
            nestedDepth++;
            super.visitFunctionDef(node);
            nestedDepth--;
            return null;
        }

        @Override
        public Void visitClassDef(Stmt.ClassDef node) {
            definesNested = true;
            nestedDepth++;
            super.visitClassDef(node);
            nestedDepth--;
            return null;
        }

        @Override
        public Void visitLambda(Expr.Lambda node) {
            nestedDepth++;
            super.visitLambda(node);
            nestedDepth--;
            return null;
        }

        @Override
        public Void visitMatch(Stmt.Match node) {
            // capture patterns are kept as text and cannot be renamed
            matches |= direct();
            return super.visitMatch(node);
        }

        @Override
        public Void visitCall(Expr.Call node) {
            String callee = node.calleeName();
            if (functionName.equals(callee)) {
                recursive = true;
            }
            if (callee != null && sideEffectCall == null && SIDE_EFFECT_FUNCTIONS.contains(callee)) {
                sideEffectCall = callee;
            }
            return super.visitCall(node);
        }

        @Override
        public Void visitYield(Expr.Yield node) {
            generator |= direct();
            return super.visitYield(node);
        }

        @Override
        public Void visitYieldFrom(Expr.YieldFrom node) {
            generator |= direct();
            return super.visitYieldFrom(node);
        }

        @Override
        public Void visitGlobal(Stmt.Global node) {
            usesGlobal |= direct();
            return null;
        }

        @Override
        public Void visitNonlocal(Stmt.Nonlocal node) {
            usesNonlocal |= direct();
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            if (direct()) {
                returns++;
            }
            return super.visitReturn(node);
        }

        @Override
        public Void visitAssign(Stmt.Assign node) {
            if (direct()) {
                node.targets().forEach(this::checkStoreTarget);
            }
            return super.visitAssign(node);
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            if (direct()) {
                checkStoreTarget(node.target());
            }
            return super.visitAugAssign(node);
        }

        private void checkStoreTarget(Expr target) {
            if (target instanceof Expr.Attribute) {
                modifiesAttribute = true;
            } else if (target instanceof Expr.Subscript) {
                modifiesSubscript = true;
            } else if (target instanceof Expr.TupleExpr tuple) {
                tuple.elements().forEach(this::checkStoreTarget);
            } else if (target instanceof Expr.ListExpr list) {
                list.elements().forEach(this::checkStoreTarget);
            } else if (target instanceof Expr.Starred starred) {
                checkStoreTarget(starred.value());
            }
        }
    }
}
