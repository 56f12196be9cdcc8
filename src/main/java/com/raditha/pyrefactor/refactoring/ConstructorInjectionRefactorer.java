package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.BuiltinNames;
import com.raditha.pyrefactor.analysis.DependencyDetector;
import com.raditha.pyrefactor.analysis.Scopes;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.ParameterKind;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.model.Range;
import com.raditha.pyrefactor.model.TextEdit;
import com.raditha.pyrefactor.util.SourceEdits;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns collaborators that a constructor instantiates itself into
 * constructor parameters, and generates a container that wires them.
 */
public class ConstructorInjectionRefactorer extends AbstractRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(ConstructorInjectionRefactorer.class);

    public static final String KIND = "constructor_injection";

    private final DependencyDetector detector;
    private final DependencyContainerGenerator containerGenerator;

    public ConstructorInjectionRefactorer(RefactoringConfig config, FixHistory history, BuiltinNames builtins) {
        super(config, history);
        this.detector = new DependencyDetector(builtins, renderer);
        this.containerGenerator = new DependencyContainerGenerator(config.indentUnit());
    }

    /**
     * Hard-coded instantiations per class.
     */
    public RefactorResult<Map<String, List<DependencyInfo>>> analyzeDependencies(Path file) {
        return inspect(file, (source, module) -> detector.analyze(module));
    }

    public RefactorResult<Map<String, List<DependencyInfo>>> analyzeSource(String source) {
        try {
            return new RefactorResult.Success<>(detector.analyze(validator.parseSource(source)), null);
        } catch (RefactoringException e) {
            return new RefactorResult.Failure<>(e.getError());
        }
    }

    /**
     * @param dependencyNames attributes to inject, all detected ones when {@code null} or empty
     * @param keepDefaults    make the parameters optional and fall back to the old instantiation
     */
    public RefactorResult<InjectedDependencies> refactorToConstructorInjection(Path file, String className,
                                                                                @Nullable Collection<String> dependencyNames,
                                                                                boolean keepDefaults, boolean dryRun) {
        return execute(file, KIND, dryRun,
                (source, module) -> inject(source, module, className, dependencyNames, keepDefaults));
    }

    public RefactorResult<InjectedDependencies> refactorToConstructorInjection(Path file, String className) {
        return refactorToConstructorInjection(file, className, null, true, false);
    }

    private Change<InjectedDependencies> inject(String source, Module module, String className,
                                                @Nullable Collection<String> dependencyNames, boolean keepDefaults)
            throws RefactoringException {
        Stmt.ClassDef owner = Scopes.findClass(module, className);
        if (owner == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND, "Class '" + className + "' not found");
        }
        Stmt.FunctionDef constructor = DependencyDetector.constructor(owner);
        if (constructor == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND,
                    "Class '" + className + "' has no __init__ method");
        }
        List<DependencyInfo> detected = detector.analyzeClass(owner);
        if (detected.isEmpty()) {
            throw new RefactoringException(ErrorKind.NO_DEPENDENCIES_FOUND,
                    "No hardcoded dependencies found in '" + className + "'");
        }
        List<DependencyInfo> selected = detected.stream()
                .filter(d -> dependencyNames == null || dependencyNames.isEmpty()
                        || dependencyNames.contains(d.attributeName()))
                .toList();
        if (selected.isEmpty()) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND,
                    "None of " + dependencyNames + " is a dependency of '" + className + "'");
        }
        List<DependencyInfo> injected = firstPerAttribute(selected);

        List<TextEdit> edits = new ArrayList<>();
        TextEdit parameters = parameterInsertion(constructor, injected, keepDefaults);
        if (parameters != null) {
            edits.add(parameters);
        }
        edits.addAll(assignmentRewrites(source, constructor, selected, keepDefaults));
        String newContent = SourceEdits.apply(source, edits);

        String container = containerGenerator.generate(className, injected);
        validator.validateOutput(container);

        logger.debug("Injecting {} into {}", injected.stream().map(DependencyInfo::attributeName).toList(),
                className);
        InjectedDependencies result = new InjectedDependencies(className, injected, container, newContent);
        return new Change<>(result, newContent, "Injected " + injected.size() + " dependencies into '"
                + className + "' constructor");
    }

    private static List<DependencyInfo> firstPerAttribute(List<DependencyInfo> dependencies) {
        Map<String, DependencyInfo> byAttribute = new LinkedHashMap<>();
        for (DependencyInfo dependency : dependencies) {
            byAttribute.putIfAbsent(dependency.attributeName(), dependency);
        }
        return List.copyOf(byAttribute.values());
    }

    /**
     * Adds a parameter per dependency that the constructor does not already
     * take. Optional parameters go in front of the first star parameter,
     * required ones in front of the first defaulted parameter.
     */
    private static @Nullable TextEdit parameterInsertion(Stmt.FunctionDef constructor,
                                                         List<DependencyInfo> dependencies, boolean keepDefaults) {
        Set<String> existing = Set.copyOf(constructor.parameters().names());
        List<String> added = new ArrayList<>();
        for (DependencyInfo dependency : dependencies) {
            if (existing.contains(dependency.attributeName())) {
                continue;
            }
            String type = dependency.dependencyType();
            added.add(keepDefaults
                    ? dependency.attributeName() + ": " + type + " | None = None"
                    : dependency.attributeName() + ": " + type);
        }
        if (added.isEmpty()) {
            return null;
        }
        String text = String.join(", ", added);

        List<Parameter> all = constructor.parameters().all();
        for (Parameter parameter : all) {
            if (isStarred(parameter.kind()) || (!keepDefaults && parameter.hasDefault())) {
                Range at = parameter.range();
                return TextEdit.replace(new Range(at.startLine(), at.startColumn(), at.startLine(), at.startColumn()),
                        text + ", ");
            }
        }
        if (all.isEmpty()) {
            Range parens = constructor.parameters().range();
            int column = parens.startColumn() + 1;
            return TextEdit.replace(new Range(parens.startLine(), column, parens.startLine(), column), text);
        }
        Range last = all.get(all.size() - 1).range();
        return TextEdit.replace(new Range(last.endLine(), last.endColumn(), last.endLine(), last.endColumn()),
                ", " + text);
    }

    private static boolean isStarred(ParameterKind kind) {
        return kind == ParameterKind.BARE_STAR || kind == ParameterKind.VAR_POSITIONAL
                || kind == ParameterKind.KEYWORD_ONLY || kind == ParameterKind.VAR_KEYWORD;
    }

    /**
     * Replaces the instantiating value of each selected assignment with the
     * parameter, or with {@code param or Type(...)} when defaults are kept.
     */
    private static List<TextEdit> assignmentRewrites(String source, Stmt.FunctionDef constructor,
                                                     List<DependencyInfo> selected, boolean keepDefaults) {
        String receiver = DependencyDetector.receiver(constructor);
        Map<Integer, List<String>> attributesByLine = selected.stream()
                .collect(Collectors.groupingBy(DependencyInfo::line,
                        Collectors.mapping(DependencyInfo::attributeName, Collectors.toList())));
        List<TextEdit> edits = new ArrayList<>();
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
                List<String> attributes = attributesByLine.getOrDefault(node.range().startLine(), List.of());
                for (Expr target : node.targets()) {
                    if (target instanceof Expr.Attribute attribute
                            && attribute.value() instanceof Expr.Name name && name.id().equals(receiver)
                            && attributes.contains(attribute.attr())) {
                        String parameter = attribute.attr();
                        String value = keepDefaults
                                ? parameter + " or " + SourceEdits.slice(source, node.value().range())
                                : parameter;
                        edits.add(TextEdit.replace(node.value().range(), value));
                        break;
                    }
                }
                return null;
            }
        }.scanStatements(constructor.body());
        return edits;
    }
}
