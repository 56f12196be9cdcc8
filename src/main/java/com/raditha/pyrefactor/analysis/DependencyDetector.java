package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Keyword;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.parser.SourceRenderer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds collaborators that a constructor instantiates itself, the pattern
 * {@code self.attr = Type(args)} in the body of {@code __init__}.
 * <p>
 * Only the constructor's own statements count: assignments inside nested
 * functions or classes run at another time and are ignored. Calls of builtin
 * names such as {@code dict()} are not dependencies.
 */
public class DependencyDetector {

    private static final Logger logger = LoggerFactory.getLogger(DependencyDetector.class);

    private final BuiltinNames builtins;
    private final SourceRenderer renderer;

    public DependencyDetector(BuiltinNames builtins, SourceRenderer renderer) {
        this.builtins = builtins;
        this.renderer = renderer;
    }

    /**
     * Dependencies per class, for classes that have any, in file order.
     */
    public Map<String, List<DependencyInfo>> analyze(Module module) {
        Map<String, List<DependencyInfo>> result = new LinkedHashMap<>();
        for (Stmt.ClassDef owner : Scopes.allClasses(module)) {
            List<DependencyInfo> dependencies = analyzeClass(owner);
            if (!dependencies.isEmpty()) {
                result.putIfAbsent(owner.name(), dependencies);
            }
        }
        logger.debug("Found dependencies in {} classes", result.size());
        return result;
    }

    public List<DependencyInfo> analyzeClass(Stmt.ClassDef owner) {
        Stmt.FunctionDef constructor = constructor(owner);
        if (constructor == null) {
            return List.of();
        }
        String receiver = receiver(constructor);
        List<DependencyInfo> found = new ArrayList<>();
        new TreeScanner() {
            @Override
            public Void visitFunctionDef(Stmt.FunctionDef node) {
                return null;
            }

            @Override
            public Void visitClassDef(Stmt.ClassDef node) {
                return null;
            }

            @Override
            public Void visitAssign(Stmt.Assign node) {
                for (Expr target : node.targets()) {
                    if (target instanceof Expr.Attribute attribute
                            && attribute.value() instanceof Expr.Name name && name.id().equals(receiver)) {
                        DependencyInfo dependency = describe(owner.name(), attribute.attr(), node);
                        if (dependency != null) {
                            found.add(dependency);
                        }
                    }
                }
                return null;
            }
        }.scanStatements(constructor.body());
        return found;
    }

    /**
     * The {@code __init__} defined directly in the class body.
     */
    public static Stmt.@Nullable FunctionDef constructor(Stmt.ClassDef owner) {
        return Scopes.findMethod(owner, "__init__");
    }

    /**
     * The name the constructor uses for the instance being built.
     */
    public static String receiver(Stmt.FunctionDef constructor) {
        List<Parameter> named = constructor.parameters().named();
        return named.isEmpty() ? "self" : named.get(0).name();
    }

    private @Nullable DependencyInfo describe(String className, String attributeName, Stmt.Assign assignment) {
        if (!(assignment.value() instanceof Expr.Call call)) {
            return null;
        }
        String type = call.calleeName();
        if (type == null || builtins.contains(type)) {
            return null;
        }
        List<String> arguments = new ArrayList<>();
        for (Expr argument : call.args()) {
            arguments.add(renderer.render(argument));
        }
        for (Keyword keyword : call.keywords()) {
            if (keyword.arg() != null) {
                arguments.add(keyword.arg() + "=" + renderer.render(keyword.value()));
            }
        }
        boolean hasParameters = !call.args().isEmpty() || !call.keywords().isEmpty();
        return new DependencyInfo(className, type, attributeName, assignment.range().startLine(),
                renderer.render(call), arguments, hasParameters, false);
    }
}
