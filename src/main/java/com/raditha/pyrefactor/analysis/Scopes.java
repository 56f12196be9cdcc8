package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Lookups of function and class definitions by position and by name.
 */
public final class Scopes {

    private Scopes() {
    }

    /**
     * The function and class definitions whose span (decorators included)
     * contains {@code line}, outermost first.
     */
    public static List<Stmt> enclosing(Module module, int line) {
        List<Stmt> chain = new ArrayList<>();
        new TreeScanner() {
            @Override
            public Void visitFunctionDef(Stmt.FunctionDef node) {
                if (node.fullRange().containsLine(line)) {
                    chain.add(node);
                    scanStatements(node.body());
                }
                return null;
            }

            @Override
            public Void visitClassDef(Stmt.ClassDef node) {
                if (node.fullRange().containsLine(line)) {
                    chain.add(node);
                    scanStatements(node.body());
                }
                return null;
            }
        }.scan(module);
        return chain;
    }

    /**
     * The innermost function enclosing {@code line}, or {@code null} at module level.
     */
    public static Stmt.@Nullable FunctionDef enclosingFunction(Module module, int line) {
        Stmt.FunctionDef result = null;
        for (Stmt definition : enclosing(module, line)) {
            if (definition instanceof Stmt.FunctionDef function) {
                result = function;
            }
        }
        return result;
    }

    /**
     * Every function definition in the file, in source order, nested ones included.
     */
    public static List<Stmt.FunctionDef> allFunctions(Module module) {
        List<Stmt.FunctionDef> functions = new ArrayList<>();
        new TreeScanner() {
            @Override
            public Void visitFunctionDef(Stmt.FunctionDef node) {
                functions.add(node);
                return super.visitFunctionDef(node);
            }
        }.scan(module);
        return functions;
    }

    /**
     * Every class definition in the file, in source order, nested ones included.
     */
    public static List<Stmt.ClassDef> allClasses(Module module) {
        List<Stmt.ClassDef> classes = new ArrayList<>();
        new TreeScanner() {
            @Override
            public Void visitClassDef(Stmt.ClassDef node) {
                classes.add(node);
                return super.visitClassDef(node);
            }
        }.scan(module);
        return classes;
    }

    public static Stmt.@Nullable ClassDef findClass(Module module, String name) {
        return allClasses(module).stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * A function of the given name, preferring one defined at module level over
     * nested functions and methods.
     */
    public static Stmt.@Nullable FunctionDef findFunction(Module module, String name) {
        for (Stmt statement : module.body()) {
            if (statement instanceof Stmt.FunctionDef function && function.name().equals(name)) {
                return function;
            }
        }
        return allFunctions(module).stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * A method defined directly in the body of {@code owner}.
     */
    public static Stmt.@Nullable FunctionDef findMethod(Stmt.ClassDef owner, String name) {
        for (Stmt statement : owner.body()) {
            if (statement instanceof Stmt.FunctionDef function && function.name().equals(name)) {
                return function;
            }
        }
        return null;
    }

    /**
     * The statement lists nested directly inside {@code statement}: bodies,
     * {@code else} and {@code finally} blocks and exception handlers.
     */
    public static List<List<Stmt>> blocks(Stmt statement) {
        List<List<Stmt>> blocks = new ArrayList<>();
        if (statement instanceof Stmt.FunctionDef function) {
            blocks.add(function.body());
        } else if (statement instanceof Stmt.ClassDef owner) {
            blocks.add(owner.body());
        } else if (statement instanceof Stmt.For loop) {
            blocks.add(loop.body());
            blocks.add(loop.orelse());
        } else if (statement instanceof Stmt.While loop) {
            blocks.add(loop.body());
            blocks.add(loop.orelse());
        } else if (statement instanceof Stmt.If conditional) {
            blocks.add(conditional.body());
            blocks.add(conditional.orelse());
        } else if (statement instanceof Stmt.With with) {
            blocks.add(with.body());
        } else if (statement instanceof Stmt.Try attempt) {
            blocks.add(attempt.body());
            attempt.handlers().forEach(h -> blocks.add(h.body()));
            blocks.add(attempt.orelse());
            blocks.add(attempt.finalbody());
        }
        return blocks;
    }

    /**
     * Every statement in {@code statements} and the blocks nested in them,
     * outer statements before their children.
     */
    public static List<Stmt> flatten(List<Stmt> statements) {
        List<Stmt> result = new ArrayList<>();
        for (Stmt statement : statements) {
            result.add(statement);
            for (List<Stmt> block : blocks(statement)) {
                result.addAll(flatten(block));
            }
        }
        return result;
    }
}
