package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.MethodAnalyzer;
import com.raditha.pyrefactor.analysis.Scopes;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.model.MethodInfo;
import com.raditha.pyrefactor.model.Range;
import com.raditha.pyrefactor.model.TextEdit;
import com.raditha.pyrefactor.model.UnsafeReason;
import com.raditha.pyrefactor.util.Identifiers;
import com.raditha.pyrefactor.util.Indentation;
import com.raditha.pyrefactor.util.SourceEdits;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Moves a method from one class of a file to another.
 * <p>
 * The method text is re-indented for the target body and appended to it.
 * Calls through the receiver in the remaining methods of the source class
 * can be redirected to an attribute holding an instance of the target class.
 * Insertion, deletion and call rewrites are collected as edits on the
 * original text and applied together.
 */
public class MoveMethodRefactorer extends AbstractRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(MoveMethodRefactorer.class);

    public static final String KIND = "move_method";

    private final MethodAnalyzer analyzer = new MethodAnalyzer();

    public MoveMethodRefactorer(RefactoringConfig config, FixHistory history) {
        super(config, history);
    }

    /**
     * @param targetInstanceName attribute of the source class that holds the target
     *                           instance, the snake_case target class name when {@code null}
     * @param updateCallSites    rewrite {@code self.method(...)} in the source class
     */
    public RefactorResult<MovedMethod> moveMethod(Path file, String sourceClass, String methodName,
                                                  String targetClass, @Nullable String targetInstanceName,
                                                  boolean updateCallSites, boolean dryRun) {
        String instanceName = targetInstanceName != null ? targetInstanceName : Identifiers.toSnakeCase(targetClass);
        return execute(file, KIND, dryRun,
                source -> validateIdentifier(instanceName, "instance name"),
                (source, module) -> move(source, module, sourceClass, methodName, targetClass, instanceName,
                        updateCallSites));
    }

    public RefactorResult<MovedMethod> moveMethod(Path file, String sourceClass, String methodName,
                                                  String targetClass) {
        return moveMethod(file, sourceClass, methodName, targetClass, null, true, false);
    }

    /**
     * What the method uses through its receiver, empty when the file, the
     * class or the method cannot be found.
     */
    public Optional<MethodInfo> analyzeMethodDependencies(Path file, String className, String methodName) {
        RefactorResult<Optional<MethodInfo>> result = inspect(file, (source, module) -> {
            Stmt.ClassDef owner = Scopes.findClass(module, className);
            Stmt.FunctionDef method = owner == null ? null : Scopes.findMethod(owner, methodName);
            return method == null ? Optional.<MethodInfo>empty() : Optional.of(analyzer.analyze(method));
        });
        return result.isSuccess() ? result.getValue() : Optional.empty();
    }

    /**
     * The other classes of the file, best home for the method first. A class
     * scores by the share of the method's receiver attributes and calls that
     * it defines itself.
     */
    public List<TargetSuggestion> suggestTargetClasses(Path file, String sourceClass, String methodName) {
        RefactorResult<List<TargetSuggestion>> result = inspect(file, (source, module) -> {
            Stmt.ClassDef owner = Scopes.findClass(module, sourceClass);
            Stmt.FunctionDef method = owner == null ? null : Scopes.findMethod(owner, methodName);
            Set<String> used = new TreeSet<>();
            if (method != null) {
                MethodInfo info = analyzer.analyze(method);
                used.addAll(info.selfReferences());
                used.addAll(info.methodCalls());
            }
            List<TargetSuggestion> suggestions = new ArrayList<>();
            for (Stmt.ClassDef candidate : Scopes.allClasses(module)) {
                if (candidate.name().equals(sourceClass)
                        || suggestions.stream().anyMatch(s -> s.className().equals(candidate.name()))) {
                    continue;
                }
                Set<String> members = analyzer.memberNames(candidate);
                long shared = used.stream().filter(members::contains).count();
                double score = used.isEmpty() ? 0.0 : (double) shared / used.size();
                suggestions.add(new TargetSuggestion(candidate.name(), score));
            }
            suggestions.sort(Comparator.comparingDouble(TargetSuggestion::score).reversed());
            return suggestions;
        });
        return result.isSuccess() ? result.getValue() : List.of();
    }

    private Change<MovedMethod> move(String source, Module module, String sourceClass, String methodName,
                                     String targetClass, String instanceName, boolean updateCallSites)
            throws RefactoringException {
        Stmt.ClassDef from = Scopes.findClass(module, sourceClass);
        if (from == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND, "Source class '" + sourceClass + "' not found");
        }
        Stmt.ClassDef to = Scopes.findClass(module, targetClass);
        if (to == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND, "Target class '" + targetClass + "' not found");
        }
        Stmt.FunctionDef method = Scopes.findMethod(from, methodName);
        if (method == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND,
                    "Method '" + methodName + "' not found in '" + sourceClass + "'");
        }
        if (MethodAnalyzer.isAbstract(method)) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    "Cannot move '" + methodName + "': " + UnsafeReason.ABSTRACT_METHOD.describe(null));
        }
        if (analyzer.memberNames(to).contains(methodName)) {
            throw new RefactoringException(ErrorKind.ALREADY_EXISTS,
                    "Class '" + targetClass + "' already has a member named '" + methodName + "'");
        }
        Range methodRange = method.fullRange();
        if (methodRange.encloses(to.range())) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    "Target class '" + targetClass + "' is defined inside '" + methodName + "'");
        }

        List<String> lines = Indentation.lines(source);
        String sourceIndent = Indentation.leadingWhitespace(lines.get(methodRange.startLine() - 1));
        String targetIndent = bodyIndent(lines, to);
        List<String> methodLines = lines.subList(methodRange.startLine() - 1, method.range().endLine());
        String methodText = Indentation.join(Indentation.reindent(methodLines, sourceIndent, targetIndent));

        List<TextEdit> edits = new ArrayList<>();
        edits.add(insertion(source, lines, to, targetIndent, methodText));
        edits.add(removal(lines, from, method, sourceIndent));
        int rewritten = 0;
        if (updateCallSites) {
            List<TextEdit> rewrites = callSiteRewrites(from, method, instanceName);
            rewritten = rewrites.size();
            edits.addAll(rewrites);
        }
        String newContent = SourceEdits.apply(source, edits);

        logger.debug("Moving {}.{} to {} with {} call sites rewritten", sourceClass, methodName, targetClass,
                rewritten);
        MovedMethod result = new MovedMethod(methodText, rewritten, analyzer.analyze(method), newContent);
        return new Change<>(result, newContent,
                "Moved method '" + methodName + "' from '" + sourceClass + "' to '" + targetClass + "'");
    }

    /**
     * Indentation of the statements in the body of {@code owner}.
     */
    private String bodyIndent(List<String> lines, Stmt.ClassDef owner) {
        Stmt first = owner.body().get(0);
        String classIndent = Indentation.leadingWhitespace(lines.get(owner.range().startLine() - 1));
        if (first.range().startLine() == owner.range().startLine()) {
            return classIndent + config.indentUnit();
        }
        return Indentation.leadingWhitespace(lines.get(first.range().startLine() - 1));
    }

    /**
     * Adds the method after the last statement of the target body, or in place
     * of a body that is only a placeholder.
     */
    private static TextEdit insertion(String source, List<String> lines, Stmt.ClassDef target, String targetIndent,
                                      String methodText) {
        List<Stmt> body = target.body();
        Stmt first = body.get(0);
        Stmt last = body.get(body.size() - 1);
        boolean placeholder = MethodAnalyzer.isPlaceholderBody(body);

        if (first.range().startLine() == target.range().startLine()) {
            // class Target: pass
            String header = lines.get(first.range().startLine() - 1);
            int column = first.range().startColumn();
            while (column > 1 && Character.isWhitespace(header.charAt(column - 2))) {
                column--;
            }
            Range inline = new Range(first.range().startLine(), column, last.range().endLine() + 1, 1);
            String kept = placeholder ? "" : targetIndent + SourceEdits.slice(source, Range.between(first.range(),
                    last.range())) + "\n\n";
            return TextEdit.replace(inline, "\n" + kept + methodText);
        }
        if (placeholder) {
            int firstPass = body.stream().filter(s -> s instanceof Stmt.Pass)
                    .mapToInt(s -> s.range().startLine()).min().orElseThrow();
            String separator = firstPass > first.range().startLine() ? "\n" : "";
            return TextEdit.replaceLines(firstPass, last.range().endLine(), separator + methodText);
        }
        int after = last.range().endLine();
        boolean lastLineOpen = after >= Indentation.lineCount(source) && !source.endsWith("\n");
        return TextEdit.insertBeforeLine(after + 1, (lastLineOpen ? "\n" : "") + "\n" + methodText);
    }

    /**
     * Deletes the method. A class left without members gets a {@code pass}.
     * Blank lines after the method go with it unless they separate the class
     * from what follows.
     */
    private TextEdit removal(List<String> lines, Stmt.ClassDef owner, Stmt.FunctionDef method, String indent) {
        int start = method.fullRange().startLine();
        int end = method.range().endLine();
        if (!analyzer.keepsMembersWithout(owner, method.name())) {
            return TextEdit.replaceLines(start, end, indent + "pass\n");
        }
        int next = end;
        while (next < lines.size() && Indentation.isBlank(lines.get(next))) {
            next++;
        }
        if (next < owner.range().endLine()) {
            end = next;
        }
        return TextEdit.deleteLines(start, end);
    }

    private static List<TextEdit> callSiteRewrites(Stmt.ClassDef owner, Stmt.FunctionDef moved, String instanceName) {
        List<TextEdit> edits = new ArrayList<>();
        for (Stmt member : owner.body()) {
            if (!(member instanceof Stmt.FunctionDef function) || function == moved) {
                continue;
            }
            String receiver = MethodAnalyzer.receiverName(function);
            new TreeScanner() {
                @Override
                public Void visitCall(Expr.Call node) {
                    if (node.func() instanceof Expr.Attribute attribute
                            && attribute.attr().equals(moved.name())
                            && attribute.value() instanceof Expr.Name name && name.id().equals(receiver)) {
                        edits.add(TextEdit.replace(attribute.range(),
                                receiver + "." + instanceName + "." + moved.name()));
                    }
                    return super.visitCall(node);
                }
            }.scanStatements(function.body());
        }
        return edits;
    }
}
