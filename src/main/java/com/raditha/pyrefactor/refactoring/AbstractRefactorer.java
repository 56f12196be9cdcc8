package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.FixHistory;
import com.raditha.pyrefactor.history.FixIds;
import com.raditha.pyrefactor.history.FixRecord;
import com.raditha.pyrefactor.parser.SourceRenderer;
import com.raditha.pyrefactor.util.Identifiers;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;

/**
 * Shared life cycle of a single file refactoring: read, parse, transform,
 * re-parse the result, write it atomically and record it.
 * <p>
 * Any {@link RefactoringException} raised on the way becomes a
 * {@link RefactorResult.Failure} and leaves the file untouched.
 */
public abstract class AbstractRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractRefactorer.class);

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    protected final RefactoringConfig config;
    protected final FixHistory history;
    protected final SourceValidator validator;
    protected final SourceRenderer renderer;

    protected AbstractRefactorer(RefactoringConfig config, FixHistory history) {
        this.config = config;
        this.history = history;
        this.validator = new SourceValidator();
        this.renderer = new SourceRenderer(config.indentUnit());
    }

    /**
     * The new content of a file together with the payload to return.
     */
    protected record Change<T>(T value, String newContent, String description) {
    }

    /**
     * Checks that only need the raw text, run before parsing.
     */
    @FunctionalInterface
    protected interface Precheck {
        void check(String source) throws RefactoringException;
    }

    /**
     * File content without its byte order mark, which is put back on write.
     */
    protected record SourceText(String text, boolean byteOrderMark) {

        String restore(String content) {
            return byteOrderMark ? BYTE_ORDER_MARK + content : content;
        }
    }

    @FunctionalInterface
    protected interface Transformation<T> {
        Change<T> apply(String source, Module module) throws RefactoringException;
    }

    @FunctionalInterface
    protected interface Inspection<T> {
        T apply(String source, Module module) throws RefactoringException;
    }

    /**
     * Runs {@code transformation} on {@code file}.
     *
     * @param kind   tag stored in the history, e.g. {@code extract_function}
     * @param dryRun compute and validate without writing or recording
     */
    protected <T> RefactorResult<T> execute(Path file, String kind, boolean dryRun,
                                            Precheck precheck, Transformation<T> transformation) {
        try {
            SourceText read = readSource(file);
            String source = read.text();
            precheck.check(source);
            Module module = validator.parseSource(source);
            Change<T> change = transformation.apply(source, module);
            validator.validateOutput(change.newContent());
            if (dryRun) {
                logger.info("Dry run: {} on {} not written", kind, file);
                return new RefactorResult.Success<>(change.value(), null);
            }
            writeAtomically(file, read.restore(change.newContent()));
            String fixId = recordFix(file, kind, read, change);
            logger.info("{} applied to {}: {}", kind, file, change.description());
            return new RefactorResult.Success<>(change.value(), fixId);
        } catch (RefactoringException e) {
            logger.warn("{} rejected for {}: {}", kind, file, e.getMessage());
            return new RefactorResult.Failure<>(e.getError());
        }
    }

    protected <T> RefactorResult<T> execute(Path file, String kind, boolean dryRun,
                                            Transformation<T> transformation) {
        return execute(file, kind, dryRun, source -> {
        }, transformation);
    }

    /**
     * Read-only analysis of {@code file}: read and parse, nothing is written.
     */
    protected <T> RefactorResult<T> inspect(Path file, Inspection<T> inspection) {
        try {
            String source = readSource(file).text();
            Module module = validator.parseSource(source);
            return new RefactorResult.Success<>(inspection.apply(source, module), null);
        } catch (RefactoringException e) {
            logger.debug("Analysis of {} failed: {}", file, e.getMessage());
            return new RefactorResult.Failure<>(e.getError());
        }
    }

    protected SourceText readSource(Path file) throws RefactoringException {
        if (!Files.exists(file)) {
            throw new RefactoringException(ErrorKind.FILE_NOT_FOUND, "File not found: " + file);
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.startsWith(BYTE_ORDER_MARK)) {
                logger.debug("Stripped UTF-8 BOM from {}", file);
                return new SourceText(content.substring(BYTE_ORDER_MARK.length()), true);
            }
            return new SourceText(content, false);
        } catch (NoSuchFileException e) {
            throw new RefactoringException(ErrorKind.FILE_NOT_FOUND, "File not found: " + file, e);
        } catch (IOException e) {
            throw new RefactoringException(ErrorKind.IO_ERROR, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes {@code content} to a temporary sibling of {@code file} and moves it
     * over the original, so that readers never observe a partial file.
     */
    protected void writeAtomically(Path file, String content) throws RefactoringException {
        Path target = file.toAbsolutePath();
        Path temp = null;
        try {
            temp = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, replacing instead", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RefactoringException(ErrorKind.IO_ERROR, "Cannot write " + file + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    private void deleteQuietly(@Nullable Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private @Nullable String recordFix(Path file, String kind, SourceText original, Change<?> change) {
        FixRecord record = new FixRecord(FixIds.generate(), file.toAbsolutePath().toString(), kind,
                original.restore(original.text()), original.restore(change.newContent()), Instant.now(),
                change.description(), true);
        try {
            history.record(record);
            return record.id();
        } catch (UncheckedIOException e) {
            logger.error("Refactoring written but not recorded in history: {}", e.getMessage());
            return null;
        }
    }

    protected void validateIdentifier(String name, String what) throws RefactoringException {
        if (!Identifiers.isIdentifier(name)) {
            throw new RefactoringException(ErrorKind.INVALID_IDENTIFIER, "'" + name + "' is not a valid " + what);
        }
        if (Identifiers.isKeyword(name)) {
            throw new RefactoringException(ErrorKind.INVALID_IDENTIFIER, "'" + name + "' is a reserved keyword");
        }
    }
}
