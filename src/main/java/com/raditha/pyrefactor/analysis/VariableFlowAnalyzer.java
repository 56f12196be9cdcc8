package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Alias;
import com.raditha.pyrefactor.ast.ExceptHandler;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.ExprContext;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.model.VariableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Determines which names a block of statements reads, binds and leaves live,
 * so that the block can become a function with the right parameters and
 * return values.
 */
public class VariableFlowAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(VariableFlowAnalyzer.class);

    private final BuiltinNames builtins;

    public VariableFlowAnalyzer(BuiltinNames builtins) {
        this.builtins = builtins;
    }

    /**
     * Collects the name facts of {@code statements}. Bodies of nested function
     * and class definitions are not entered; only the names they bind count.
     */
    public NameUsage analyze(List<Stmt> statements) {
        FlowScanner scanner = new FlowScanner();
        scanner.scanStatements(statements);
        return new NameUsage(scanner.used, scanner.defined, scanner.assigned, scanner.readFirst);
    }

    /**
     * Names read after {@code endLine} anywhere in {@code scope}, the body of
     * the function that encloses the block or the module's statements.
     */
    public Set<String> usedAfter(List<Stmt> scope, int endLine) {
        Set<String> names = new TreeSet<>();
        new TreeScanner() {
            @Override
            public Void visitName(Expr.Name node) {
                if (node.context() == ExprContext.LOAD && node.range().startLine() > endLine) {
                    names.add(node.id());
                }
                return null;
            }

            @Override
            public Void visitAugAssign(Stmt.AugAssign node) {
                if (node.target() instanceof Expr.Name target && target.range().startLine() > endLine) {
                    names.add(target.id());
                }
                return super.visitAugAssign(node);
            }
        }.scanStatements(scope);
        return names;
    }

    /**
     * Classifies the names of an extracted block.
     *
     * @param fragment  the statements being extracted
     * @param usedAfter names read after the block in its scope
     */
    public VariableSet classify(List<Stmt> fragment, Set<String> usedAfter) {
        NameUsage usage = analyze(fragment);
        Set<String> inputs = new TreeSet<>(usage.used());
        inputs.removeAll(usage.defined());
        inputs.addAll(usage.readFirst());
        inputs.removeIf(builtins::contains);
        VariableSet result = VariableSet.classify(inputs, usage.defined(), usage.assigned(), usedAfter);
        logger.debug("Flow: inputs={} outputs={} locals={}", result.inputs(), result.outputs(), result.locals());
        return result;
    }

    private static final class FlowScanner extends TreeScanner {
        private final Set<String> used = new HashSet<>();
        private final Set<String> defined = new HashSet<>();
        private final Set<String> assigned = new HashSet<>();
        private final Set<String> readFirst = new HashSet<>();
        private final Deque<Set<String>> shadowed = new ArrayDeque<>();

        private void read(String name) {
            if (isShadowed(name)) {
                return;
            }
            used.add(name);
            if (!defined.contains(name)) {
                readFirst.add(name);
            }
        }

        private void bind(String name, boolean byAssignment) {
            if (isShadowed(name)) {
                return;
            }
            defined.add(name);
            if (byAssignment) {
                assigned.add(name);
            }
        }

        private boolean isShadowed(String name) {
            for (Set<String> names : shadowed) {
                if (names.contains(name)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public Void visitName(Expr.Name node) {
            if (node.context() == ExprContext.LOAD) {
                read(node.id());
            } else if (node.context() == ExprContext.STORE) {
                bind(node.id(), true);
            }
            return null;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            scan(node.value());
            if (node.target() instanceof Expr.Name target) {
                read(target.id());
            }
            scan(node.target());
            return null;
        }

        @Override
        public Void visitFunctionDef(Stmt.FunctionDef node) {
            scanExpressions(node.decorators());
            scanParameters(node.parameters());
            scan(node.returns());
            bind(node.name(), false);
            return null;
        }

        @Override
        public Void visitClassDef(Stmt.ClassDef node) {
            scanExpressions(node.decorators());
            scanExpressions(node.bases());
            node.keywords().forEach(this::scanKeyword);
            bind(node.name(), false);
            return null;
        }

        @Override
        public Void visitLambda(Expr.Lambda node) {
            scanParameters(node.parameters());
            shadowed.push(new HashSet<>(node.parameters().names()));
            scan(node.body());
            shadowed.pop();
            return null;
        }

        @Override
        public Void visitImport(Stmt.Import node) {
            for (Alias alias : node.names()) {
                bind(alias.boundName(), false);
            }
            return null;
        }

        @Override
        public Void visitImportFrom(Stmt.ImportFrom node) {
            for (Alias alias : node.names()) {
                if (!alias.name().equals("*")) {
                    bind(alias.boundName(), false);
                }
            }
            return null;
        }

        @Override
        protected void scanHandler(ExceptHandler handler) {
            scan(handler.type());
            if (handler.name() != null) {
                bind(handler.name(), false);
            }
            scanStatements(handler.body());
        }
    }
}
