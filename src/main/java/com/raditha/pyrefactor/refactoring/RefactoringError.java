package com.raditha.pyrefactor.refactoring;

/**
 * A refused refactoring, returned as data.
 *
 * @param kind    the category
 * @param message details for people
 */
public record RefactoringError(ErrorKind kind, String message) {

    @Override
    public String toString() {
        return kind.getDisplayName() + ": " + message;
    }
}
