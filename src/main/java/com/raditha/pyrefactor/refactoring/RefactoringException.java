package com.raditha.pyrefactor.refactoring;

/**
 * Raised inside a refactorer to abandon the operation. It never leaves the
 * public API; {@link AbstractRefactorer} turns it into a
 * {@link RefactorResult.Failure}.
 */
public class RefactoringException extends Exception {

    private final transient RefactoringError error;

    public RefactoringException(ErrorKind kind, String message) {
        super(kind.getDisplayName() + ": " + message);
        this.error = new RefactoringError(kind, message);
    }

    public RefactoringException(ErrorKind kind, String message, Throwable cause) {
        super(kind.getDisplayName() + ": " + message, cause);
        this.error = new RefactoringError(kind, message);
    }

    public RefactoringError getError() {
        return error;
    }
}
