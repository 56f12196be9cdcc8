package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.model.DependencyInfo;

import java.util.List;

/**
 * @param className     the class whose constructor now receives its collaborators
 * @param dependencies  the collaborators turned into parameters
 * @param containerCode generated container class that wires them up
 * @param newContent    the file after the change
 */
public record InjectedDependencies(
        String className,
        List<DependencyInfo> dependencies,
        String containerCode,
        String newContent) {

    public InjectedDependencies {
        dependencies = List.copyOf(dependencies);
    }
}
