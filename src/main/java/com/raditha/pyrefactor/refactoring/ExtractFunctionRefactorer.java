package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.BuiltinNames;
import com.raditha.pyrefactor.analysis.Scopes;
import com.raditha.pyrefactor.analysis.VariableFlowAnalyzer;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.model.TextEdit;
import com.raditha.pyrefactor.model.VariableSet;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import com.raditha.pyrefactor.util.Indentation;
import com.raditha.pyrefactor.util.SourceEdits;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves a range of whole statements into a new function and replaces them
 * with a call.
 * <p>
 * Names the block reads before defining them become parameters, names it
 * assigns that are read later in the same scope become return values. The new
 * function is placed in front of the outermost definition that is not a
 * method, so that it is visible from the call site.
 */
public class ExtractFunctionRefactorer extends AbstractRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(ExtractFunctionRefactorer.class);

    public static final String KIND = "extract_function";

    private final VariableFlowAnalyzer flowAnalyzer;

    public ExtractFunctionRefactorer(RefactoringConfig config, FixHistory history, BuiltinNames builtins) {
        super(config, history);
        this.flowAnalyzer = new VariableFlowAnalyzer(builtins);
    }

    /**
     * @param file         the Python file
     * @param startLine    first line to extract, 1-based
     * @param endLine      last line to extract, inclusive
     * @param functionName name of the new function
     * @param addReturn    return the names that are used after the block
     * @param dryRun       compute and validate without writing
     */
    public RefactorResult<ExtractedFunction> extractFunction(Path file, int startLine, int endLine,
                                                             String functionName, boolean addReturn,
                                                             boolean dryRun) {
        return execute(file, KIND, dryRun,
                source -> {
                    validateRange(source, startLine, endLine);
                    validateFunctionName(functionName);
                },
                (source, module) -> extract(source, module, startLine, endLine, functionName, addReturn));
    }

    public RefactorResult<ExtractedFunction> extractFunction(Path file, int startLine, int endLine,
                                                             String functionName) {
        return extractFunction(file, startLine, endLine, functionName, true, false);
    }

    /**
     * Functions whose definition spans more than {@code minLines} lines.
     */
    public RefactorResult<List<ExtractionCandidate>> analyzeExtractionCandidates(Path file, int minLines) {
        return inspect(file, (source, module) -> {
            List<ExtractionCandidate> candidates = new ArrayList<>();
            for (Stmt.FunctionDef function : Scopes.allFunctions(module)) {
                int length = function.range().endLine() - function.range().startLine();
                if (length > minLines) {
                    candidates.add(new ExtractionCandidate(function.name(), function.range().startLine(),
                            function.range().endLine(),
                            "Long function '" + function.name() + "' (" + length + " lines)"));
                }
            }
            return candidates;
        });
    }

    private Change<ExtractedFunction> extract(String source, Module module, int startLine, int endLine,
                                              String functionName, boolean addReturn) throws RefactoringException {
        List<String> lines = Indentation.lines(source);
        List<String> selected = lines.subList(startLine - 1, endLine);
        List<String> dedented = Indentation.dedent(selected);
        List<Stmt> fragment = parseFragment(dedented, startLine, endLine);
        checkStatementBoundaries(module, startLine, endLine);
        checkNoExits(fragment);

        List<Stmt> enclosing = strictlyEnclosing(module, startLine, endLine);
        Stmt.FunctionDef scopeFunction = innermostFunction(enclosing);
        List<Stmt> scope = scopeFunction == null ? module.body() : scopeFunction.body();
        VariableSet variables = flowAnalyzer.classify(fragment, flowAnalyzer.usedAfter(scope, endLine));

        Insertion insertion = insertionPoint(module, lines, enclosing, startLine);
        checkNameFree(insertion.scopeBody(), functionName);

        List<String> outputs = addReturn ? new ArrayList<>(variables.outputs()) : List.of();
        String definition = buildDefinition(functionName, variables, dedented, outputs);
        String call = buildCall(functionName, variables, outputs);
        String callIndent = firstIndent(selected);

        List<String> definitionLines = Indentation.indent(Indentation.lines(definition.stripTrailing()), insertion.indent());
        String separator = insertion.indent().isEmpty() ? "\n\n" : "\n";
        String insertedText = Indentation.join(definitionLines) + separator;

        List<TextEdit> edits = List.of(
                TextEdit.insertBeforeLine(insertion.line(), insertedText),
                TextEdit.replaceLines(startLine, endLine, callIndent + call + "\n"));
        String newContent = SourceEdits.apply(source, edits);

        logger.debug("Extracting lines {}-{} into {} before line {}", startLine, endLine, functionName,
                insertion.line());
        ExtractedFunction result = new ExtractedFunction(functionName, definition, call, variables, newContent);
        return new Change<>(result, newContent,
                "Extracted lines " + startLine + "-" + endLine + " into function '" + functionName + "'");
    }

    private static void validateRange(String source, int startLine, int endLine) throws RefactoringException {
        int lineCount = Indentation.lineCount(source);
        if (startLine < 1 || endLine > lineCount || startLine > endLine) {
            throw new RefactoringException(ErrorKind.INVALID_RANGE,
                    "Invalid line range " + startLine + "-" + endLine + " for a file of " + lineCount + " lines");
        }
    }

    private void validateFunctionName(String functionName) throws RefactoringException {
        validateIdentifier(functionName, "function name");
        if (config.rejectPrivateNames() && functionName.startsWith("_")) {
            throw new RefactoringException(ErrorKind.INVALID_IDENTIFIER,
                    "'" + functionName + "' starts with an underscore");
        }
    }

    private static List<Stmt> parseFragment(List<String> dedented, int startLine, int endLine)
            throws RefactoringException {
        try {
            List<Stmt> statements = PythonParser.parse(Indentation.join(dedented)).body();
            if (statements.isEmpty()) {
                throw new RefactoringException(ErrorKind.INVALID_RANGE,
                        "Lines " + startLine + "-" + endLine + " contain no statements");
            }
            return statements;
        } catch (PythonSyntaxException e) {
            throw new RefactoringException(ErrorKind.INVALID_RANGE,
                    "Lines " + startLine + "-" + endLine + " do not form complete statements: " + e.getMessage(), e);
        }
    }

    /**
     * Every statement touching the range either lies inside it or encloses it
     * from a line above.
     */
    private static void checkStatementBoundaries(Module module, int startLine, int endLine)
            throws RefactoringException {
        for (Stmt statement : Scopes.flatten(module.body())) {
            int first = statement instanceof Stmt.FunctionDef f ? f.fullRange().startLine()
                    : statement instanceof Stmt.ClassDef c ? c.fullRange().startLine()
                    : statement.range().startLine();
            int last = statement.range().endLine();
            boolean overlaps = first <= endLine && last >= startLine;
            boolean inside = first >= startLine && last <= endLine;
            boolean encloses = first < startLine && last >= endLine;
            if (overlaps && !inside && !encloses) {
                throw new RefactoringException(ErrorKind.INVALID_RANGE,
                        "Lines " + startLine + "-" + endLine + " cut through the statement at line " + first);
            }
        }
    }

    /**
     * A {@code return} or {@code yield} would change meaning once moved into
     * another function.
     */
    private static void checkNoExits(List<Stmt> fragment) throws RefactoringException {
        boolean[] found = new boolean[1];
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
            public Void visitLambda(Expr.Lambda node) {
                return null;
            }

            @Override
            public Void visitReturn(Stmt.Return node) {
                found[0] = true;
                return null;
            }

            @Override
            public Void visitYield(Expr.Yield node) {
                found[0] = true;
                return null;
            }

            @Override
            public Void visitYieldFrom(Expr.YieldFrom node) {
                found[0] = true;
                return null;
            }
        }.scanStatements(fragment);
        if (found[0]) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    "the selected lines contain a return or yield statement");
        }
    }

    /**
     * Definitions that start above the range and end at or below it, outermost first.
     */
    private static List<Stmt> strictlyEnclosing(Module module, int startLine, int endLine) {
        List<Stmt> result = new ArrayList<>();
        for (Stmt definition : Scopes.enclosing(module, startLine)) {
            int first = definition instanceof Stmt.FunctionDef f ? f.fullRange().startLine()
                    : ((Stmt.ClassDef) definition).fullRange().startLine();
            if (first < startLine && definition.range().endLine() >= endLine) {
                result.add(definition);
            }
        }
        return result;
    }

    private static Stmt.@Nullable FunctionDef innermostFunction(List<Stmt> enclosing) {
        Stmt.FunctionDef result = null;
        for (Stmt definition : enclosing) {
            if (definition instanceof Stmt.FunctionDef function) {
                result = function;
            }
        }
        return result;
    }

    private record Insertion(int line, String indent, List<Stmt> scopeBody) {
    }

    private static Insertion insertionPoint(Module module, List<String> lines, List<Stmt> enclosing, int startLine) {
        for (int i = enclosing.size() - 1; i >= 0; i--) {
            @Nullable Stmt parent = i == 0 ? null : enclosing.get(i - 1);
            if (parent instanceof Stmt.ClassDef) {
                continue;
            }
            Stmt definition = enclosing.get(i);
            int line = definition instanceof Stmt.FunctionDef f ? f.fullRange().startLine()
                    : ((Stmt.ClassDef) definition).fullRange().startLine();
            List<Stmt> scopeBody = parent == null ? module.body() : ((Stmt.FunctionDef) parent).body();
            return new Insertion(line, Indentation.leadingWhitespace(lines.get(line - 1)), scopeBody);
        }

        for (Stmt statement : module.body()) {
            if (statement instanceof Stmt.FunctionDef function && function.fullRange().startLine() < startLine) {
                return new Insertion(function.fullRange().startLine(), "", module.body());
            }
            if (statement instanceof Stmt.ClassDef owner && owner.fullRange().startLine() < startLine) {
                return new Insertion(owner.fullRange().startLine(), "", module.body());
            }
        }

        int line = 1;
        List<Stmt> body = module.body();
        for (int i = 0; i < body.size(); i++) {
            Stmt statement = body.get(i);
            boolean docstring = i == 0 && statement instanceof Stmt.ExprStmt e && e.value() instanceof Expr.Str;
            if (docstring || statement instanceof Stmt.Import || statement instanceof Stmt.ImportFrom) {
                line = statement.range().endLine() + 1;
            } else {
                break;
            }
        }
        return new Insertion(Math.min(line, startLine), "", module.body());
    }

    private static void checkNameFree(List<Stmt> scopeBody, String functionName) throws RefactoringException {
        for (Stmt statement : scopeBody) {
            String existing = statement instanceof Stmt.FunctionDef f ? f.name()
                    : statement instanceof Stmt.ClassDef c ? c.name() : null;
            if (functionName.equals(existing)) {
                throw new RefactoringException(ErrorKind.ALREADY_EXISTS,
                        "'" + functionName + "' is already defined at line " + statement.range().startLine());
            }
        }
    }

    private String buildDefinition(String functionName, VariableSet variables, List<String> dedented,
                                   List<String> outputs) {
        StringBuilder definition = new StringBuilder();
        definition.append("def ").append(functionName)
                .append('(').append(String.join(", ", variables.inputs())).append("):\n");
        List<String> body = new ArrayList<>(dedented);
        while (!body.isEmpty() && Indentation.isBlank(body.get(body.size() - 1))) {
            body.remove(body.size() - 1);
        }
        definition.append(Indentation.join(Indentation.indent(body, config.indentUnit())));
        if (!outputs.isEmpty()) {
            definition.append(config.indentUnit()).append("return ").append(String.join(", ", outputs)).append('\n');
        }
        return definition.toString();
    }

    private static String buildCall(String functionName, VariableSet variables, List<String> outputs) {
        String call = functionName + "(" + String.join(", ", variables.inputs()) + ")";
        return outputs.isEmpty() ? call : String.join(", ", outputs) + " = " + call;
    }

    private static String firstIndent(List<String> selected) {
        for (String line : selected) {
            if (!Indentation.isBlank(line)) {
                return Indentation.leadingWhitespace(line);
            }
        }
        return "";
    }
}
