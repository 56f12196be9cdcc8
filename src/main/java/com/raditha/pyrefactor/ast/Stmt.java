package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Python statements. The set of kinds is closed; every consumer dispatches
 * through {@link StmtVisitor} so a new kind cannot be silently ignored.
 */
public sealed interface Stmt extends Node {

    <R> R accept(StmtVisitor<R> visitor);

    /**
     * {@code def} or {@code async def}. The range starts at the {@code def}
     * keyword; {@link #fullRange()} includes the decorators.
     * {@code typeParameters} is the bracketed type parameter list as written.
     */
    record FunctionDef(Range range, String name, List<Expr> decorators, @Nullable String typeParameters,
                       Parameters parameters, @Nullable Expr returns, List<Stmt> body,
                       boolean isAsync) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }

        public Range fullRange() {
            return decorators.isEmpty() ? range : Range.between(decorators.get(0).range(), range);
        }

        public boolean hasDecorator(String decoratorName) {
            return decorators.stream().anyMatch(d -> decoratorName.equals(Decorators.simpleName(d)));
        }
    }

    record ClassDef(Range range, String name, List<Expr> decorators, @Nullable String typeParameters,
                    List<Expr> bases, List<Keyword> keywords, List<Stmt> body) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitClassDef(this);
        }

        public Range fullRange() {
            return decorators.isEmpty() ? range : Range.between(decorators.get(0).range(), range);
        }
    }

    record Return(Range range, @Nullable Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    record Delete(Range range, List<Expr> targets) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitDelete(this);
        }
    }

    /**
     * {@code a = b = value}; one entry in {@code targets} per {@code =}.
     */
    record Assign(Range range, List<Expr> targets, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * {@code target op= value}; {@code op} is the binary operator without the {@code =}.
     */
    record AugAssign(Range range, Expr target, String op, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }
    }

    record AnnAssign(Range range, Expr target, Expr annotation, @Nullable Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }
    }

    record For(Range range, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse,
               boolean isAsync) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }

    record While(Range range, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * {@code if}; an {@code elif} chain is an {@code orelse} holding a single {@code If}.
     */
    record If(Range range, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record With(Range range, List<WithItem> items, List<Stmt> body, boolean isAsync) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitWith(this);
        }
    }

    record Raise(Range range, @Nullable Expr exception, @Nullable Expr cause) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitRaise(this);
        }
    }

    record Try(Range range, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse,
               List<Stmt> finalbody) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitTry(this);
        }
    }

    /**
     * {@code match subject:}; several subjects form a tuple.
     */
    record Match(Range range, Expr subject, List<MatchCase> cases) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitMatch(this);
        }
    }

    /**
     * {@code type Name[params] = value}.
     */
    record TypeAlias(Range range, Expr.Name name, @Nullable String typeParameters, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitTypeAlias(this);
        }
    }

    record Assert(Range range, Expr test, @Nullable Expr message) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitAssert(this);
        }
    }

    record Import(Range range, List<Alias> names) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitImport(this);
        }
    }

    /**
     * {@code from ..module import names}; {@code level} counts the leading dots.
     */
    record ImportFrom(Range range, @Nullable String module, List<Alias> names, int level) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }
    }

    record Global(Range range, List<String> names) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitGlobal(this);
        }
    }

    record Nonlocal(Range range, List<String> names) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitNonlocal(this);
        }
    }

    record ExprStmt(Range range, Expr value) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }
    }

    record Pass(Range range) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitPass(this);
        }
    }

    record Break(Range range) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    record Continue(Range range) implements Stmt {
        public <R> R accept(StmtVisitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }
}
