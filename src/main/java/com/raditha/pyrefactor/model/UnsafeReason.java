package com.raditha.pyrefactor.model;

import org.jspecify.annotations.Nullable;

/**
 * Why a refactoring would not preserve behaviour. The descriptions are stable
 * and meant to be shown to users verbatim.
 */
public enum UnsafeReason {
    HAS_DEFAULT_ARGUMENTS("has default arguments"),
    HAS_VARIADIC_PARAMETERS("has *args or **kwargs"),
    RECURSIVE("is recursive"),
    GENERATOR("is a generator function"),
    USES_GLOBAL("uses global statement"),
    USES_NONLOCAL("uses nonlocal statement"),
    SIDE_EFFECT_CALL("calls side-effect function '%s'"),
    MODIFIES_ATTRIBUTES("modifies object attributes"),
    MODIFIES_SUBSCRIPT("modifies subscript"),
    MULTIPLE_RETURNS("has multiple return statements"),
    EARLY_RETURN("has early return"),
    UNSUPPORTED_STATEMENTS("has statements that cannot be inlined"),
    ARGUMENT_MISMATCH("call site arguments do not match parameters"),
    ABSTRACT_METHOD("abstract method");

    private final String description;

    UnsafeReason(String description) {
        this.description = description;
    }

    /**
     * @param detail the value substituted into the description, used by
     *               {@link #SIDE_EFFECT_CALL} for the function name
     */
    public String describe(@Nullable String detail) {
        return description.contains("%s") ? String.format(description, detail) : description;
    }
}
