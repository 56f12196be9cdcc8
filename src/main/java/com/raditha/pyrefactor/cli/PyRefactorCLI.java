package com.raditha.pyrefactor.cli;

import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.config.RefactoringSettings;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.history.FixRecord;
import com.raditha.pyrefactor.history.HistoryStatistics;
import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.model.VariableSet;
import com.raditha.pyrefactor.refactoring.ExtractedFunction;
import com.raditha.pyrefactor.refactoring.ExtractionCandidate;
import com.raditha.pyrefactor.refactoring.InjectedDependencies;
import com.raditha.pyrefactor.refactoring.InlineCheck;
import com.raditha.pyrefactor.refactoring.InlinedFunction;
import com.raditha.pyrefactor.refactoring.MovedMethod;
import com.raditha.pyrefactor.refactoring.RefactorResult;
import com.raditha.pyrefactor.refactoring.RefactoringEngine;
import com.raditha.pyrefactor.refactoring.TargetSuggestion;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface for the refactoring engine.
 * <p>
 * Usage:
 * java -jar pyrefactor.jar [options] &lt;command&gt; [command options]
 * <p>
 * Configuration priority: CLI arguments > pyrefactor.yml > defaults
 */
@Command(name = "pyrefactor", mixinStandardHelpOptions = true, version = "pyrefactor 1.0.0",
        description = "Deterministic refactorings for Python source files",
        subcommands = {
                PyRefactorCLI.Extract.class,
                PyRefactorCLI.Candidates.class,
                PyRefactorCLI.Inline.class,
                PyRefactorCLI.CanInline.class,
                PyRefactorCLI.Move.class,
                PyRefactorCLI.Suggest.class,
                PyRefactorCLI.Inject.class,
                PyRefactorCLI.Deps.class,
                PyRefactorCLI.History.class,
                PyRefactorCLI.Rollback.class
        })
public class PyRefactorCLI implements Callable<Integer> {

    static final Path DEFAULT_HISTORY_FILE = Path.of(".pyrefactor", "fix_history.json");

    // Global Options
    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private Path configFile;

    @Option(names = "--history-file", description = "JSON file that records applied refactorings", paramLabel = "<path>")
    private Path historyFile;

    @Option(names = "--indent", description = "Indentation unit for generated code (default: 4 spaces)", paramLabel = "<text>")
    private String indentUnit;

    @Option(names = "--allow-private-names", description = "Accept extracted function names that start with '_'")
    private boolean allowPrivateNames = false;

    @Spec
    private CommandSpec spec;

    private RefactoringEngine engine;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * The engine for this invocation, built on first use from the global options.
     */
    RefactoringEngine engine() {
        if (engine == null) {
            RefactoringSettings.Overrides overrides = new RefactoringSettings.Overrides(
                    indentUnit,
                    allowPrivateNames ? Boolean.FALSE : null,
                    historyFile,
                    null);
            RefactoringConfig config = RefactoringSettings.loadConfig(configFile, overrides);
            if (config.historyFile() == null) {
                config = config.withHistoryFile(DEFAULT_HISTORY_FILE);
            }
            engine = new RefactoringEngine(config);
        }
        return engine;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * The command line with the exit code mapping: 2 for configuration and
     * usage errors, 3 for I/O errors, 1 for anything else.
     */
    public static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new PyRefactorCLI());

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("Configuration error: " + ex.getMessage());
                return 2;
            } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
                commandLine.getErr().println("I/O error: " + ex.getMessage());
                return 3;
            } else {
                commandLine.getErr().println("Error: " + ex.getMessage());
                ex.printStackTrace(commandLine.getErr());
                return 1;
            }
        });

        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.getErr().print(failed.getUsageMessage(colorScheme));
            return 2;
        });
        return cmd;
    }

    abstract static class Subcommand implements Callable<Integer> {

        @ParentCommand
        PyRefactorCLI parent;

        @Spec
        CommandSpec spec;

        PrintWriter out() {
            return spec.commandLine().getOut();
        }

        PrintWriter err() {
            return spec.commandLine().getErr();
        }
    }

    /**
     * Shared handling of a refactoring result: print the summary, or the diff
     * for a dry run, or the error.
     */
    abstract static class RefactoringCommand extends Subcommand {

        @Option(names = "--dry-run", description = "Print a unified diff instead of writing the file")
        boolean dryRun = false;

        <T> int report(Path file, RefactorResult<T> result, Function<T, String> newContent,
                       Function<T, String> summary) throws IOException {
            if (result instanceof RefactorResult.Failure<T> failure) {
                err().println(failure.error());
                return 1;
            }
            RefactorResult.Success<T> success = (RefactorResult.Success<T>) result;
            if (dryRun) {
                out().println(parent.engine().preview(file, newContent.apply(success.value())));
            } else {
                out().println(summary.apply(success.value()));
                if (success.fixId() != null) {
                    out().println("Fix id: " + success.fixId());
                }
            }
            return 0;
        }
    }

    @Command(name = "extract", description = "Extract a range of lines into a new function")
    static class Extract extends RefactoringCommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<start-line>")
        int startLine;

        @Parameters(index = "2", paramLabel = "<end-line>")
        int endLine;

        @Parameters(index = "3", paramLabel = "<function-name>")
        String functionName;

        @Option(names = "--no-return", description = "Do not return the variables used after the block")
        boolean noReturn = false;

        @Override
        public Integer call() throws IOException {
            RefactorResult<ExtractedFunction> result = parent.engine()
                    .extractFunction(file, startLine, endLine, functionName, !noReturn, dryRun);
            return report(file, result, ExtractedFunction::newContent, extracted -> {
                VariableSet variables = extracted.variables();
                return "Extracted function '" + extracted.functionName() + "'"
                        + System.lineSeparator() + "  inputs:  " + variables.inputs()
                        + System.lineSeparator() + "  outputs: " + variables.outputs()
                        + System.lineSeparator() + "  locals:  " + variables.locals();
            });
        }
    }

    @Command(name = "candidates", description = "List functions long enough to be split")
    static class Candidates extends Subcommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Override
        public Integer call() {
            RefactorResult<List<ExtractionCandidate>> result = parent.engine().analyzeExtractionCandidates(file);
            if (!result.isSuccess()) {
                err().println(result.getError());
                return 1;
            }
            for (ExtractionCandidate candidate : result.getValue()) {
                out().printf("%d-%d  %s%n", candidate.startLine(), candidate.endLine(), candidate.reason());
            }
            return 0;
        }
    }

    @Command(name = "inline", description = "Replace every call of a function with its body")
    static class Inline extends RefactoringCommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<function-name>")
        String functionName;

        @Option(names = "--keep-function", description = "Keep the definition after inlining")
        boolean keepFunction = false;

        @Override
        public Integer call() throws IOException {
            RefactorResult<InlinedFunction> result = parent.engine()
                    .inlineFunction(file, functionName, !keepFunction, dryRun);
            return report(file, result, InlinedFunction::newContent, inlined ->
                    "Inlined " + inlined.inlinedCount() + " calls to '" + inlined.functionName() + "'"
                            + (inlined.functionRemoved() ? " and removed the definition" : ""));
        }
    }

    @Command(name = "can-inline", description = "Check whether a function can be inlined")
    static class CanInline extends Subcommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<function-name>")
        String functionName;

        @Override
        public Integer call() {
            InlineCheck check = parent.engine().canInline(file, functionName);
            if (check.canInline()) {
                out().println("'" + functionName + "' can be inlined");
                return 0;
            }
            out().println("'" + functionName + "' cannot be inlined: " + check.reason());
            return 1;
        }
    }

    @Command(name = "move", description = "Move a method to another class of the same file")
    static class Move extends RefactoringCommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<source-class>")
        String sourceClass;

        @Parameters(index = "2", paramLabel = "<method>")
        String methodName;

        @Parameters(index = "3", paramLabel = "<target-class>")
        String targetClass;

        @Option(names = "--instance-name", description = "Attribute of the source class holding the target instance", paramLabel = "<name>")
        String instanceName;

        @Option(names = "--no-update-call-sites", description = "Leave self.<method>() calls in the source class alone")
        boolean noUpdateCallSites = false;

        @Override
        public Integer call() throws IOException {
            RefactorResult<MovedMethod> result = parent.engine().moveMethod(file, sourceClass, methodName,
                    targetClass, instanceName, !noUpdateCallSites, dryRun);
            return report(file, result, MovedMethod::newContent, moved ->
                    "Moved '" + methodName + "' from '" + sourceClass + "' to '" + targetClass + "', "
                            + moved.callSitesUpdated() + " call sites updated");
        }
    }

    @Command(name = "suggest", description = "Rank the classes a method could move to")
    static class Suggest extends Subcommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<class>")
        String className;

        @Parameters(index = "2", paramLabel = "<method>")
        String methodName;

        @Override
        public Integer call() {
            parent.engine().analyzeMethodDependencies(file, className, methodName).ifPresent(info -> {
                out().println("self references: " + info.selfReferences());
                out().println("method calls:    " + info.methodCalls());
            });
            for (TargetSuggestion suggestion : parent.engine().suggestTargetClasses(file, className, methodName)) {
                out().printf("%-30s %.2f%n", suggestion.className(), suggestion.score());
            }
            return 0;
        }
    }

    @Command(name = "inject", description = "Turn instantiations in a constructor into constructor parameters")
    static class Inject extends RefactoringCommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Parameters(index = "1", paramLabel = "<class>")
        String className;

        @Option(names = "--dependency", description = "Attribute to inject, repeatable (default: all)", paramLabel = "<attr>")
        List<String> dependencies;

        @Option(names = "--no-defaults", description = "Make the new parameters required")
        boolean noDefaults = false;

        @Override
        public Integer call() throws IOException {
            RefactorResult<InjectedDependencies> result = parent.engine()
                    .refactorToConstructorInjection(file, className, dependencies, !noDefaults, dryRun);
            int code = report(file, result, InjectedDependencies::newContent, injected ->
                    "Injected " + injected.dependencies().stream().map(DependencyInfo::attributeName).toList()
                            + " into '" + injected.className() + "'");
            if (result.isSuccess()) {
                out().println();
                out().print(result.getValue().containerCode());
            }
            return code;
        }
    }

    @Command(name = "deps", description = "List instantiations performed in constructors")
    static class Deps extends Subcommand {

        @Parameters(index = "0", paramLabel = "<file>")
        Path file;

        @Override
        public Integer call() {
            RefactorResult<Map<String, List<DependencyInfo>>> result = parent.engine().analyzeDependencies(file);
            if (!result.isSuccess()) {
                err().println(result.getError());
                return 1;
            }
            result.getValue().forEach((owner, dependencies) -> {
                out().println(owner + ":");
                for (DependencyInfo dependency : dependencies) {
                    out().printf("  line %d: self.%s = %s%n", dependency.line(), dependency.attributeName(),
                            dependency.instantiation());
                }
            });
            return 0;
        }
    }

    @Command(name = "history", description = "Show applied refactorings, newest first")
    static class History extends Subcommand {

        @Option(names = "--file", description = "Only refactorings of this file", paramLabel = "<path>")
        Path file;

        @Option(names = "--stats", description = "Print counts instead of records")
        boolean stats = false;

        @Override
        public Integer call() {
            FixHistory history = parent.engine().getHistory();
            if (stats) {
                HistoryStatistics statistics = history.getStatistics();
                out().println("Total fixes: " + statistics.totalFixes());
                out().println("Files fixed: " + statistics.filesFixed());
                statistics.fixesByKind().forEach((kind, count) -> out().println("  " + kind + ": " + count));
                return 0;
            }
            List<FixRecord> records = file == null
                    ? history.getAllFixes()
                    : history.getFixesForFile(file.toAbsolutePath().toString());
            for (FixRecord record : records) {
                out().printf("%s  %s  %s  %s%n", record.id(), record.timestamp(), record.kind(),
                        record.description());
            }
            return 0;
        }
    }

    @Command(name = "rollback", description = "Restore the content a refactoring replaced")
    static class Rollback extends Subcommand {

        @Parameters(index = "0", paramLabel = "<fix-id>")
        String fixId;

        @Override
        public Integer call() {
            if (parent.engine().getHistory().rollback(fixId)) {
                out().println("Rolled back " + fixId);
                return 0;
            }
            err().println("Cannot roll back " + fixId);
            return 1;
        }
    }
}
