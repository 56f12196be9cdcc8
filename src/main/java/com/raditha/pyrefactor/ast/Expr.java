package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Python expressions. Closed set of kinds dispatched through {@link ExprVisitor}.
 */
public sealed interface Expr extends Node {

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * {@code a and b and c} / {@code a or b}.
     */
    record BoolOp(Range range, String op, List<Expr> values) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }
    }

    record NamedExpr(Range range, Name target, Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNamedExpr(this);
        }
    }

    record BinOp(Range range, Expr left, String op, Expr right) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }
    }

    /**
     * {@code not x}, {@code -x}, {@code +x}, {@code ~x}.
     */
    record UnaryOp(Range range, String op, Expr operand) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }
    }

    record Lambda(Range range, Parameters parameters, Expr body) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }
    }

    record IfExp(Range range, Expr test, Expr body, Expr orelse) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIfExp(this);
        }
    }

    /**
     * Dict display. A {@code null} key marks a {@code **mapping} entry.
     */
    record DictExpr(Range range, List<@Nullable Expr> keys, List<Expr> values) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDict(this);
        }
    }

    record SetExpr(Range range, List<Expr> elements) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSet(this);
        }
    }

    record ListComp(Range range, Expr element, List<Comprehension> generators) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitListComp(this);
        }
    }

    record SetComp(Range range, Expr element, List<Comprehension> generators) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSetComp(this);
        }
    }

    record DictComp(Range range, Expr key, Expr value, List<Comprehension> generators) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDictComp(this);
        }
    }

    record GeneratorExp(Range range, Expr element, List<Comprehension> generators) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGeneratorExp(this);
        }
    }

    record Await(Range range, Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAwait(this);
        }
    }

    record Yield(Range range, @Nullable Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitYield(this);
        }
    }

    record YieldFrom(Range range, Expr value) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitYieldFrom(this);
        }
    }

    /**
     * {@code a < b <= c}; {@code ops} holds the operators in source order
     * ({@code "not in"} and {@code "is not"} are single entries).
     */
    record Compare(Range range, Expr left, List<String> ops, List<Expr> comparators) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }
    }

    record Call(Range range, Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        /**
         * The called name when this is a bare call such as {@code f(x)}, else {@code null}.
         */
        public @Nullable String calleeName() {
            return func instanceof Name name ? name.id() : null;
        }
    }

    /**
     * Numbers, {@code None}, {@code True}, {@code False} and {@code ...};
     * {@code text} is the literal exactly as written.
     */
    record Constant(Range range, ConstantKind kind, String text) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /**
     * One string literal, possibly made of several adjacent pieces
     * ({@code "a" f"{b}"}).
     */
    record Str(Range range, List<StringPart> parts) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStr(this);
        }

        public boolean isFormatted() {
            return parts.stream().anyMatch(StringPart::isFormatted);
        }
    }

    record Attribute(Range range, Expr value, String attr, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAttribute(this);
        }
    }

    record Subscript(Range range, Expr value, Expr slice, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    record Starred(Range range, Expr value, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStarred(this);
        }
    }

    record Name(Range range, String id, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitName(this);
        }
    }

    record ListExpr(Range range, List<Expr> elements, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record TupleExpr(Range range, List<Expr> elements, ExprContext context) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record Slice(Range range, @Nullable Expr lower, @Nullable Expr upper, @Nullable Expr step) implements Expr {
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSlice(this);
        }
    }
}
