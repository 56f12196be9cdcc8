package com.raditha.pyrefactor.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A method of a class as seen by the move-method analysis.
 *
 * @param name           method name
 * @param parameters     parameter names without the receiver
 * @param range          source span, decorators included
 * @param isAbstract     decorated with {@code abstractmethod}
 * @param isStatic       decorated with {@code staticmethod}
 * @param isClassmethod  decorated with {@code classmethod}
 * @param selfReferences attributes read through the receiver
 * @param methodCalls    methods called through the receiver
 * @param dependencies   methods of the same class this method relies on
 */
public record MethodInfo(
        String name,
        List<String> parameters,
        Range range,
        boolean isAbstract,
        boolean isStatic,
        boolean isClassmethod,
        Set<String> selfReferences,
        Set<String> methodCalls,
        Set<String> dependencies) {

    public MethodInfo {
        parameters = List.copyOf(parameters);
        selfReferences = Collections.unmodifiableSortedSet(new TreeSet<>(selfReferences));
        methodCalls = Collections.unmodifiableSortedSet(new TreeSet<>(methodCalls));
        dependencies = Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }
}
