package com.raditha.pyrefactor.ast;

/**
 * Position of a parameter in a function signature.
 * {@link #BARE_STAR} and {@link #SLASH} are the {@code *} and {@code /} markers,
 * which bind no name.
 */
public enum ParameterKind {
    POSITIONAL_ONLY,
    POSITIONAL,
    VAR_POSITIONAL,
    KEYWORD_ONLY,
    VAR_KEYWORD,
    BARE_STAR,
    SLASH;

    public boolean isMarker() {
        return this == BARE_STAR || this == SLASH;
    }

    public boolean isVariadic() {
        return this == VAR_POSITIONAL || this == VAR_KEYWORD;
    }
}
