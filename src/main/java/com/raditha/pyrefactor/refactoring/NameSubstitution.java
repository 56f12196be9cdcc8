package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.ast.Comprehension;
import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.ExprContext;
import com.raditha.pyrefactor.ast.TreeTransformer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces reads of names with expression trees. Names bound by a lambda or a
 * comprehension inside the tree hide the outer binding and are left alone.
 */
class NameSubstitution extends TreeTransformer {

    private final Map<String, Expr> replacements;
    private final Deque<Set<String>> shadowed = new ArrayDeque<>();

    NameSubstitution(Map<String, Expr> replacements) {
        this.replacements = Map.copyOf(replacements);
    }

    @Override
    public Expr visitName(Expr.Name node) {
        if (node.context() != ExprContext.LOAD || isShadowed(node.id())) {
            return node;
        }
        Expr replacement = replacements.get(node.id());
        return replacement == null ? node : replacement;
    }

    @Override
    public Expr visitLambda(Expr.Lambda node) {
        shadowed.push(new HashSet<>(node.parameters().names()));
        try {
            return super.visitLambda(node);
        } finally {
            shadowed.pop();
        }
    }

    @Override
    public Expr visitListComp(Expr.ListComp node) {
        shadowed.push(targets(node.generators()));
        try {
            return super.visitListComp(node);
        } finally {
            shadowed.pop();
        }
    }

    @Override
    public Expr visitSetComp(Expr.SetComp node) {
        shadowed.push(targets(node.generators()));
        try {
            return super.visitSetComp(node);
        } finally {
            shadowed.pop();
        }
    }

    @Override
    public Expr visitDictComp(Expr.DictComp node) {
        shadowed.push(targets(node.generators()));
        try {
            return super.visitDictComp(node);
        } finally {
            shadowed.pop();
        }
    }

    @Override
    public Expr visitGeneratorExp(Expr.GeneratorExp node) {
        shadowed.push(targets(node.generators()));
        try {
            return super.visitGeneratorExp(node);
        } finally {
            shadowed.pop();
        }
    }

    private boolean isShadowed(String name) {
        return shadowed.stream().anyMatch(names -> names.contains(name));
    }

    private static Set<String> targets(List<Comprehension> generators) {
        Set<String> names = new HashSet<>();
        for (Comprehension generator : generators) {
            collect(generator.target(), names);
        }
        return names;
    }

    private static void collect(Expr target, Set<String> names) {
        if (target instanceof Expr.Name name) {
            names.add(name.id());
        } else if (target instanceof Expr.TupleExpr tuple) {
            tuple.elements().forEach(e -> collect(e, names));
        } else if (target instanceof Expr.ListExpr list) {
            list.elements().forEach(e -> collect(e, names));
        } else if (target instanceof Expr.Starred starred) {
            collect(starred.value(), names);
        }
    }
}
