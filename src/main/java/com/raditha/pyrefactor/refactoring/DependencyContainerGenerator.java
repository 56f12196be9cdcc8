package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.util.Identifiers;
import com.raditha.pyrefactor.util.Indentation;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes the container class that accompanies a constructor injection: one
 * lazily created instance per dependency and a factory for the refactored
 * class.
 */
public class DependencyContainerGenerator {

    private final String indentUnit;

    public DependencyContainerGenerator(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public static String containerName(String className) {
        return className + "DIContainer";
    }

    public static String factoryName(String className) {
        return "create_" + Identifiers.toSnakeCase(className);
    }

    /**
     * @param dependencies one entry per attribute, in constructor order
     */
    public String generate(String className, List<DependencyInfo> dependencies) {
        String one = indentUnit;
        String two = indentUnit.repeat(2);
        String three = indentUnit.repeat(3);

        List<String> lines = new ArrayList<>();
        lines.add("\"\"\"Dependency Injection Container.\"\"\"");
        lines.add("");
        lines.add("");
        lines.add("class " + containerName(className) + ":");
        lines.add(one + "\"\"\"Dependency container for " + className + ".\"\"\"");
        lines.add("");
        lines.add(one + "def __init__(self) -> None:");
        lines.add(two + "\"\"\"Initialize the container.\"\"\"");
        if (dependencies.isEmpty()) {
            lines.add(two + "pass");
        }
        for (DependencyInfo dependency : dependencies) {
            lines.add(two + "self._" + dependency.attributeName() + ": " + dependency.dependencyType()
                    + " | None = None");
        }
        lines.add("");

        for (DependencyInfo dependency : dependencies) {
            String slot = "self._" + dependency.attributeName();
            lines.add(one + "@property");
            lines.add(one + "def " + dependency.attributeName() + "(self) -> " + dependency.dependencyType() + ":");
            lines.add(two + "\"\"\"Get or create the " + dependency.dependencyType() + " dependency.\"\"\"");
            lines.add(two + "if " + slot + " is None:");
            lines.add(three + slot + " = " + dependency.dependencyType()
                    + "(" + String.join(", ", dependency.arguments()) + ")");
            lines.add(two + "return " + slot);
            lines.add("");
        }

        lines.add(one + "def " + factoryName(className) + "(self) -> " + className + ":");
        lines.add(two + "\"\"\"Create an instance of " + className + " with injected dependencies.\"\"\"");
        lines.add(two + "return " + className + "(");
        for (int i = 0; i < dependencies.size(); i++) {
            String name = dependencies.get(i).attributeName();
            lines.add(three + name + "=self." + name + (i < dependencies.size() - 1 ? "," : ""));
        }
        lines.add(two + ")");
        return Indentation.join(lines);
    }
}
