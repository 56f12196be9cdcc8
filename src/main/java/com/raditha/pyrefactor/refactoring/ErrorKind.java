package com.raditha.pyrefactor.refactoring;

/**
 * Why a refactoring was refused. The display names are stable and are what
 * the command line prints.
 */
public enum ErrorKind {
    FILE_NOT_FOUND("FileNotFound"),
    SYNTAX_ERROR_IN_SOURCE("SyntaxError-in-source"),
    SYNTAX_ERROR_IN_GENERATED_OUTPUT("SyntaxError-in-generated-output"),
    TARGET_NOT_FOUND("TargetNotFound"),
    ALREADY_EXISTS("AlreadyExists"),
    INVALID_RANGE("InvalidRange"),
    INVALID_IDENTIFIER("InvalidIdentifier"),
    NO_DEPENDENCIES_FOUND("NoDependenciesFound"),
    NO_CALL_SITES("NoCallSites"),
    UNSAFE_OPERATION("UnsafeOperation"),
    IO_ERROR("IOError");

    private final String displayName;

    ErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
