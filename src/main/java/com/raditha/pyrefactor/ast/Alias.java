package com.raditha.pyrefactor.ast;

import org.jspecify.annotations.Nullable;

/**
 * {@code name as asname} in an import statement.
 */
public record Alias(String name, @Nullable String asname) {

    /**
     * The name this alias binds in the importing scope.
     */
    public String boundName() {
        if (asname != null) {
            return asname;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
