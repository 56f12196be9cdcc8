package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Keyword;
import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.ast.TreeScanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Finds the calls of a function by its bare name.
 */
public class CallSiteFinder {

    /**
     * Every call of {@code name} in source order, nested calls included.
     */
    public List<CallSite> find(Module module, String name) {
        Finder finder = new Finder(name);
        finder.scan(module);
        return finder.sites;
    }

    /**
     * The sites that are not inside the arguments of another site.
     */
    public List<CallSite> outermost(List<CallSite> sites) {
        List<CallSite> result = new ArrayList<>();
        for (CallSite site : sites) {
            boolean nested = false;
            for (CallSite other : sites) {
                if (other != site && other.call().range().encloses(site.call().range())
                        && !other.call().range().equals(site.call().range())) {
                    nested = true;
                    break;
                }
            }
            if (!nested) {
                result.add(site);
            }
        }
        return result;
    }

    private static final class Finder extends TreeScanner {
        private final String name;
        private final List<CallSite> sites = new ArrayList<>();
        private final Set<Expr> wholeValues = Collections.newSetFromMap(new IdentityHashMap<>());
        private final IdentityHashMap<Expr, Stmt.ExprStmt> owners = new IdentityHashMap<>();

        Finder(String name) {
            this.name = name;
        }

        @Override
        public Void visitExprStmt(Stmt.ExprStmt node) {
            owners.put(node.value(), node);
            wholeValues.add(node.value());
            return super.visitExprStmt(node);
        }

        @Override
        public Void visitAssign(Stmt.Assign node) {
            wholeValues.add(node.value());
            return super.visitAssign(node);
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign node) {
            wholeValues.add(node.value());
            return super.visitAugAssign(node);
        }

        @Override
        public Void visitAnnAssign(Stmt.AnnAssign node) {
            if (node.value() != null) {
                wholeValues.add(node.value());
            }
            return super.visitAnnAssign(node);
        }

        @Override
        public Void visitReturn(Stmt.Return node) {
            if (node.value() != null) {
                wholeValues.add(node.value());
            }
            return super.visitReturn(node);
        }

        @Override
        protected void scanKeyword(Keyword keyword) {
            if (keyword.arg() != null) {
                wholeValues.add(keyword.value());
            }
            super.scanKeyword(keyword);
        }

        @Override
        public Void visitCall(Expr.Call node) {
            for (Expr argument : node.args()) {
                if (!(argument instanceof Expr.Starred)) {
                    wholeValues.add(argument);
                }
            }
            if (name.equals(node.calleeName())) {
                sites.add(new CallSite(node, owners.get(node), wholeValues.contains(node)));
            }
            return super.visitCall(node);
        }
    }
}
