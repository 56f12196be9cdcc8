package com.raditha.pyrefactor.refactoring;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of a refactoring: the payload on success, the error otherwise.
 *
 * @param <T> payload type
 */
public sealed interface RefactorResult<T> {

    boolean isSuccess();

    /**
     * @param value the payload
     * @param fixId id of the history record, {@code null} for a dry run
     */
    record Success<T>(T value, @Nullable String fixId) implements RefactorResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T>(RefactoringError error) implements RefactorResult<T> {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }

    /**
     * The payload, or an {@link IllegalStateException} for a failure.
     */
    default T getValue() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value: " + ((Failure<T>) this).error());
    }

    /**
     * The error, or an {@link IllegalStateException} for a success.
     */
    default RefactoringError getError() {
        if (this instanceof Failure<T> failure) {
            return failure.error();
        }
        throw new IllegalStateException("Refactoring succeeded");
    }
}
