package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A parameter list. For a {@code def} the range spans the parentheses; for a
 * lambda it spans the parameters only and is {@code null} when there are none.
 */
public record Parameters(List<Parameter> all, @Nullable Range range) {

    public static Parameters empty() {
        return new Parameters(List.of(), null);
    }

    /**
     * Parameters that bind a name, in declaration order.
     */
    public List<Parameter> named() {
        return all.stream().filter(p -> !p.kind().isMarker()).toList();
    }

    public List<String> names() {
        return named().stream().map(Parameter::name).toList();
    }

    public boolean hasDefaults() {
        return all.stream().anyMatch(Parameter::hasDefault);
    }

    public boolean hasVariadic() {
        return all.stream().anyMatch(p -> p.kind().isVariadic());
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }
}
