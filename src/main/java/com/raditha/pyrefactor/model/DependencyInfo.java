package com.raditha.pyrefactor.model;

import java.util.List;

/**
 * A collaborator that a constructor creates for itself, e.g.
 * {@code self.db = Database(url)}.
 *
 * @param className          class whose constructor creates the collaborator
 * @param dependencyType     the instantiated class, {@code Database}
 * @param attributeName      the attribute it is stored in, {@code db}
 * @param line               line of the assignment
 * @param instantiation      source text of the call, {@code Database(url)}
 * @param arguments          positional arguments followed by {@code key=value} keyword arguments
 * @param hasParameters      whether the call passes any argument
 * @param isOptional         always false for detected instantiations
 */
public record DependencyInfo(
        String className,
        String dependencyType,
        String attributeName,
        int line,
        String instantiation,
        List<String> arguments,
        boolean hasParameters,
        boolean isOptional) {

    public DependencyInfo {
        arguments = List.copyOf(arguments);
    }
}
