package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.analysis.CallSite;
import com.raditha.pyrefactor.analysis.CallSiteFinder;
import com.raditha.pyrefactor.analysis.Scopes;
import com.raditha.pyrefactor.analysis.SideEffectChecker;
import com.raditha.pyrefactor.ast.ConstantKind;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Keyword;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Parameter;
import com.raditha.pyrefactor.ast.ParameterKind;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeTransformer;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.model.FunctionInfo;
import com.raditha.pyrefactor.model.Range;
import com.raditha.pyrefactor.model.TextEdit;
import com.raditha.pyrefactor.model.UnsafeReason;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import com.raditha.pyrefactor.parser.SourceRenderer.Precedence;
import com.raditha.pyrefactor.util.Indentation;
import com.raditha.pyrefactor.util.SourceEdits;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces every call of a function with the function's body.
 * <p>
 * Only functions that {@link SideEffectChecker} accepts are inlined. For a
 * function that returns a value, the local bindings that precede the return
 * are folded into the returned expression and the parameters are replaced by
 * the call's arguments, giving one expression per call site. A function
 * without a return contributes its statements when the call is a statement
 * of its own and {@code None} anywhere else.
 */
public class InlineFunctionRefactorer extends AbstractRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(InlineFunctionRefactorer.class);

    public static final String KIND = "inline_function";

    private final SideEffectChecker checker = new SideEffectChecker();
    private final CallSiteFinder callSiteFinder = new CallSiteFinder();

    public InlineFunctionRefactorer(RefactoringConfig config, FixHistory history) {
        super(config, history);
    }

    /**
     * Whether {@code functionName} can be inlined. Problems reading or parsing
     * the file are reported as the reason.
     */
    public InlineCheck canInline(Path file, String functionName) {
        RefactorResult<InlineCheck> result = inspect(file, (source, module) -> {
            Stmt.FunctionDef function = Scopes.findFunction(module, functionName);
            if (function == null) {
                return InlineCheck.no("Function '" + functionName + "' not found");
            }
            FunctionInfo info = checker.analyze(function);
            return info.isSafe() ? InlineCheck.yes() : InlineCheck.no(info.describeUnsafeReason());
        });
        return result.isSuccess() ? result.getValue() : InlineCheck.no(result.getError().toString());
    }

    /**
     * @param removeFunction delete the definition once every call is replaced
     */
    public RefactorResult<InlinedFunction> inlineFunction(Path file, String functionName, boolean removeFunction,
                                                          boolean dryRun) {
        return execute(file, KIND, dryRun, (source, module) -> inline(source, module, functionName, removeFunction));
    }

    public RefactorResult<InlinedFunction> inlineFunction(Path file, String functionName, boolean removeFunction) {
        return inlineFunction(file, functionName, removeFunction, false);
    }

    private Change<InlinedFunction> inline(String source, Module module, String functionName, boolean removeFunction)
            throws RefactoringException {
        Stmt.FunctionDef function = Scopes.findFunction(module, functionName);
        if (function == null) {
            throw new RefactoringException(ErrorKind.TARGET_NOT_FOUND, "Function '" + functionName + "' not found");
        }
        FunctionInfo info = checker.analyze(function);
        if (!info.isSafe()) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    "Function cannot be inlined: " + info.describeUnsafeReason());
        }
        List<CallSite> sites = callSiteFinder.find(module, functionName);
        if (sites.isEmpty()) {
            throw new RefactoringException(ErrorKind.NO_CALL_SITES,
                    "No call sites found for function '" + functionName + "'");
        }
        for (CallSite site : sites) {
            bind(function, site.call());
        }

        CallInliner inliner = new CallInliner(function, info);
        List<TextEdit> edits = new ArrayList<>();
        for (CallSite site : callSiteFinder.outermost(sites)) {
            edits.add(replacementFor(source, site, info, inliner));
        }
        if (removeFunction) {
            edits.add(removal(source, function));
        }
        String newContent = SourceEdits.apply(source, edits);

        logger.debug("Inlined {} call sites of {}", sites.size(), functionName);
        InlinedFunction result = new InlinedFunction(functionName, sites.size(), removeFunction, newContent);
        return new Change<>(result, newContent,
                "Inlined " + sites.size() + " calls to function '" + functionName + "'");
    }

    private TextEdit replacementFor(String source, CallSite site, FunctionInfo info, CallInliner inliner)
            throws RefactoringException {
        Expr.Call call = site.call();
        if (info.returnValue() == null && site.isStatement()) {
            return spliceStatements(source, site, info, inliner);
        }
        Expr replacement = inliner.transform(call);
        Precedence context = site.wholeValue() ? Precedence.TEST : Precedence.ATOM;
        String text = renderer.render(replacement, context);
        if (!parsesAsExpression(text)) {
            text = substituteText(source, info, call, context);
        }
        return TextEdit.replace(call.range(), text);
    }

    /**
     * Replaces a call statement with the function's statements.
     */
    private TextEdit spliceStatements(String source, CallSite site, FunctionInfo info, CallInliner inliner)
            throws RefactoringException {
        Stmt.ExprStmt statement = site.statement();
        Range range = statement.range();
        List<String> lines = Indentation.lines(source);
        String line = lines.get(range.startLine() - 1);
        String indent = Indentation.leadingWhitespace(line);

        NameSubstitution substitution = new NameSubstitution(inliner.arguments(site.call()));
        List<Stmt> body = new ArrayList<>();
        for (Stmt original : info.body()) {
            body.add(inliner.transform(substitution.transform(original)));
        }
        if (body.isEmpty()) {
            return TextEdit.replace(range, "pass");
        }
        if (body.size() > 1 && !aloneOnLines(lines, range)) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    "the call at line " + range.startLine() + " shares its line with other statements");
        }
        String rendered = renderer.render(body, indent);
        String text = rendered.substring(indent.length(), rendered.length() - 1);
        return TextEdit.replace(range, text);
    }

    private static boolean aloneOnLines(List<String> lines, Range range) {
        String first = lines.get(range.startLine() - 1);
        String last = lines.get(range.endLine() - 1);
        String before = first.substring(0, Math.min(first.length(), range.startColumn() - 1));
        String after = range.endColumn() - 1 < last.length() ? last.substring(range.endColumn() - 1).strip() : "";
        return before.isBlank() && (after.isEmpty() || after.startsWith("#"));
    }

    /**
     * Text substitution on the source of the returned expression, used only
     * when structured rendering did not produce a parseable expression and
     * only for arguments that are plain names or literals.
     */
    private String substituteText(String source, FunctionInfo info, Expr.Call call, Precedence context)
            throws RefactoringException {
        Map<String, Expr> arguments = new CallInliner(info.definition(), info).arguments(call);
        boolean simple = info.body().isEmpty() && info.returnValue() != null
                && arguments.values().stream().allMatch(a -> a instanceof Expr.Name || a instanceof Expr.Constant
                || (a instanceof Expr.Str str && !str.isFormatted()));
        if (!simple) {
            throw new RefactoringException(ErrorKind.SYNTAX_ERROR_IN_GENERATED_OUTPUT,
                    "inlined expression at line " + call.range().startLine() + " does not parse");
        }
        String text = SourceEdits.slice(source, info.returnValue().range());
        for (Map.Entry<String, Expr> entry : arguments.entrySet()) {
            String argument = SourceEdits.slice(source, entry.getValue().range());
            text = Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b")
                    .matcher(text).replaceAll(Matcher.quoteReplacement(argument));
        }
        logger.warn("Falling back to text substitution at line {}", call.range().startLine());
        return context == Precedence.ATOM ? "(" + text + ")" : text;
    }

    private static boolean parsesAsExpression(String text) {
        try {
            PythonParser.parseExpression(text);
            return true;
        } catch (PythonSyntaxException e) {
            logger.debug("Rendered replacement does not parse: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Deletes the definition, decorators included, and the blank lines after it.
     */
    private static TextEdit removal(String source, Stmt.FunctionDef function) {
        List<String> lines = Indentation.lines(source);
        int end = function.range().endLine();
        int lineCount = Indentation.lineCount(source);
        while (end < lineCount && Indentation.isBlank(lines.get(end))) {
            end++;
        }
        return TextEdit.deleteLines(function.fullRange().startLine(), end);
    }

    /**
     * Maps each parameter to the argument the call passes for it.
     *
     * @throws RefactoringException when the call unpacks arguments, or passes
     *                              too many, too few or unknown ones
     */
    static Map<String, Expr> bind(Stmt.FunctionDef function, Expr.Call call) throws RefactoringException {
        Map<String, Expr> bound = tryBind(function, call);
        if (bound == null) {
            throw new RefactoringException(ErrorKind.UNSAFE_OPERATION,
                    UnsafeReason.ARGUMENT_MISMATCH.describe(null) + " at line " + call.range().startLine());
        }
        return bound;
    }

    private static @Nullable Map<String, Expr> tryBind(Stmt.FunctionDef function, Expr.Call call) {
        List<Parameter> parameters = function.parameters().named();
        Map<String, Expr> bound = new LinkedHashMap<>();
        int position = 0;
        for (Expr argument : call.args()) {
            if (argument instanceof Expr.Starred) {
                return null;
            }
            while (position < parameters.size() && parameters.get(position).kind() == ParameterKind.KEYWORD_ONLY) {
                position++;
            }
            if (position >= parameters.size()) {
                return null;
            }
            bound.put(parameters.get(position).name(), argument);
            position++;
        }
        for (Keyword keyword : call.keywords()) {
            if (keyword.arg() == null || bound.containsKey(keyword.arg())) {
                return null;
            }
            Parameter parameter = parameters.stream()
                    .filter(p -> p.name().equals(keyword.arg()))
                    .findFirst()
                    .orElse(null);
            if (parameter == null || parameter.kind() == ParameterKind.POSITIONAL_ONLY) {
                return null;
            }
            bound.put(keyword.arg(), keyword.value());
        }
        return bound.size() == parameters.size() ? bound : null;
    }

    /**
     * Rewrites calls of the inlined function inside an expression, innermost
     * first, so that nested calls such as {@code f(f(x))} are fully expanded.
     */
    private static final class CallInliner extends TreeTransformer {
        private final Stmt.FunctionDef function;
        private final FunctionInfo info;

        CallInliner(Stmt.FunctionDef function, FunctionInfo info) {
            this.function = function;
            this.info = info;
        }

        @Override
        public Expr visitCall(Expr.Call node) {
            Expr.Call call = (Expr.Call) super.visitCall(node);
            if (!function.name().equals(call.calleeName())) {
                return call;
            }
            if (info.returnValue() == null) {
                return new Expr.Constant(node.range(), ConstantKind.NONE, "None");
            }
            Map<String, Expr> environment = arguments(call);
            for (Stmt statement : info.body()) {
                Stmt.Assign binding = (Stmt.Assign) statement;
                String name = ((Expr.Name) binding.targets().get(0)).id();
                Map<String, Expr> next = new HashMap<>(environment);
                next.put(name, new NameSubstitution(environment).transform(binding.value()));
                environment = next;
            }
            return new NameSubstitution(environment).transform(info.returnValue());
        }

        /**
         * The binding of an already validated call, with nested calls inlined.
         */
        Map<String, Expr> arguments(Expr.Call call) {
            Map<String, Expr> bound = tryBind(function, call);
            if (bound == null) {
                throw new IllegalStateException("Unvalidated call site at line " + call.range().startLine());
            }
            Map<String, Expr> result = new LinkedHashMap<>();
            bound.forEach((name, argument) -> result.put(name, transform(argument)));
            return result;
        }
    }
}
