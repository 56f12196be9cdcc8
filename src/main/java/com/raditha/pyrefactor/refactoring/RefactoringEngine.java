package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.BuiltinNames;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.history.InMemoryFixHistory;
import com.raditha.pyrefactor.history.JsonFixHistory;
import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.model.MethodInfo;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point to the refactorings. Builds the refactorers from one
 * configuration so that they share the builtin names and the history.
 */
public class RefactoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(RefactoringEngine.class);

    private final RefactoringConfig config;
    private final FixHistory history;
    private final ExtractFunctionRefactorer extractFunction;
    private final InlineFunctionRefactorer inlineFunction;
    private final MoveMethodRefactorer moveMethod;
    private final ConstructorInjectionRefactorer constructorInjection;
    private final DiffGenerator diffGenerator;

    public RefactoringEngine(RefactoringConfig config) {
        this(config, createHistory(config));
    }

    public RefactoringEngine(RefactoringConfig config, FixHistory history) {
        this.config = config;
        this.history = history;
        BuiltinNames builtins = BuiltinNames.standard().with(config.extraBuiltins());
        this.extractFunction = new ExtractFunctionRefactorer(config, history, builtins);
        this.inlineFunction = new InlineFunctionRefactorer(config, history);
        this.moveMethod = new MoveMethodRefactorer(config, history);
        this.constructorInjection = new ConstructorInjectionRefactorer(config, history, builtins);
        this.diffGenerator = new DiffGenerator(config.diffContextLines());
    }

    private static FixHistory createHistory(RefactoringConfig config) {
        if (config.historyFile() == null) {
            return new InMemoryFixHistory();
        }
        logger.debug("Recording history in {}", config.historyFile());
        return new JsonFixHistory(config.historyFile());
    }

    public RefactorResult<ExtractedFunction> extractFunction(Path file, int startLine, int endLine,
                                                             String functionName, boolean addReturn, boolean dryRun) {
        return extractFunction.extractFunction(file, startLine, endLine, functionName, addReturn, dryRun);
    }

    public RefactorResult<List<ExtractionCandidate>> analyzeExtractionCandidates(Path file) {
        return extractFunction.analyzeExtractionCandidates(file, config.extractionCandidateMinLines());
    }

    public InlineCheck canInline(Path file, String functionName) {
        return inlineFunction.canInline(file, functionName);
    }

    public RefactorResult<InlinedFunction> inlineFunction(Path file, String functionName, boolean removeFunction,
                                                          boolean dryRun) {
        return inlineFunction.inlineFunction(file, functionName, removeFunction, dryRun);
    }

    public RefactorResult<MovedMethod> moveMethod(Path file, String sourceClass, String methodName,
                                                  String targetClass, @Nullable String targetInstanceName,
                                                  boolean updateCallSites, boolean dryRun) {
        return moveMethod.moveMethod(file, sourceClass, methodName, targetClass, targetInstanceName,
                updateCallSites, dryRun);
    }

    public Optional<MethodInfo> analyzeMethodDependencies(Path file, String className, String methodName) {
        return moveMethod.analyzeMethodDependencies(file, className, methodName);
    }

    public List<TargetSuggestion> suggestTargetClasses(Path file, String sourceClass, String methodName) {
        return moveMethod.suggestTargetClasses(file, sourceClass, methodName);
    }

    public RefactorResult<Map<String, List<DependencyInfo>>> analyzeDependencies(Path file) {
        return constructorInjection.analyzeDependencies(file);
    }

    public RefactorResult<Map<String, List<DependencyInfo>>> analyzeDependencies(String source) {
        return constructorInjection.analyzeSource(source);
    }

    public RefactorResult<InjectedDependencies> refactorToConstructorInjection(Path file, String className,
                                                                                @Nullable Collection<String> dependencyNames,
                                                                                boolean keepDefaults, boolean dryRun) {
        return constructorInjection.refactorToConstructorInjection(file, className, dependencyNames, keepDefaults,
                dryRun);
    }

    /**
     * Unified diff from the current content of {@code file} to {@code newContent}.
     */
    public String preview(Path file, String newContent) throws IOException {
        return diffGenerator.generateUnifiedDiff(file, newContent);
    }

    public FixHistory getHistory() {
        return history;
    }

    public RefactoringConfig getConfig() {
        return config;
    }
}
