package Engine;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Expression tree of the analysed language. Statements are expressions too.
 * Every analysis goes through {@link Visitor}, so a new variant has to be handled everywhere.
 */
public sealed interface Expr
        permits Expr.Const, Expr.Var, Expr.Symbolic, Expr.Let, Expr.Block, Expr.If,
                Expr.Comparison, Expr.Arithmetic, Expr.Assert {

    Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    <T> T accept(Visitor<T> visitor);

    /** Rendering used when the node labels a tree node. */
    default String toShortString() {
        return toString();
    }

    interface Visitor<T> {
        T visitConst(Const expr);
        T visitVar(Var expr);
        T visitSymbolic(Symbolic expr);
        T visitLet(Let expr);
        T visitBlock(Block expr);
        T visitIf(If expr);
        T visitEq(Eq expr);
        T visitNEq(NEq expr);
        T visitPlus(Plus expr);
        T visitMinus(Minus expr);
        T visitMul(Mul expr);
        T visitAssert(Assert expr);
    }

    /** Eq and NEq. */
    sealed interface Comparison extends Expr permits Eq, NEq {
        Expr left();
        Expr right();
    }

    /** Plus, Minus and Mul. */
    sealed interface Arithmetic extends Expr permits Plus, Minus, Mul {
        Expr left();
        Expr right();
    }

    private static String checkName(String name) {
        Objects.requireNonNull(name, "name");
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a plain identifier: '" + name + "'");
        }
        return name;
    }

    // ------------------------------------------------------------------

    record Const(BigInteger value) implements Expr {
        public Const {
            Objects.requireNonNull(value, "value");
        }

        public static Const of(long value) {
            return new Const(BigInteger.valueOf(value));
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitConst(this);
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Var(String name) implements Expr {
        public Var {
            checkName(name);
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** Placeholder for an unknown program input. */
    record Symbolic(String name) implements Expr {
        public Symbolic {
            checkName(name);
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitSymbolic(this);
        }

        @Override
        public String toString() {
            return "Sym(" + name + ")";
        }
    }

    record Let(Var target, Expr value) implements Expr {
        public Let {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitLet(this);
        }

        @Override
        public String toString() {
            return "let " + target + " = " + value;
        }
    }

    record Block(List<Expr> statements) implements Expr {
        public Block {
            statements = List.copyOf(statements);
        }

        public Block(Expr... statements) {
            this(Arrays.asList(statements));
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitBlock(this);
        }

        @Override
        public String toString() {
            return statements.stream().map(Expr::toString).collect(Collectors.joining("\n", "{", "}"));
        }
    }

    /** {@code elseBranch} is {@code null} for a one-armed if. */
    record If(Expr condition, Expr thenBranch, Expr elseBranch) implements Expr {
        public If {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(thenBranch, "thenBranch");
        }

        public If(Expr condition, Expr thenBranch) {
            this(condition, thenBranch, null);
        }

        public boolean hasElse() {
            return elseBranch != null;
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public String toString() {
            return "if (" + condition + ") " + thenBranch + (elseBranch != null ? " else " + elseBranch : "");
        }

        @Override
        public String toShortString() {
            return "if (" + condition + ")";
        }
    }

    record Eq(Expr left, Expr right) implements Comparison {
        public Eq {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitEq(this);
        }

        @Override
        public String toString() {
            return left + " == " + right;
        }
    }

    record NEq(Expr left, Expr right) implements Comparison {
        public NEq {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitNEq(this);
        }

        @Override
        public String toString() {
            return left + " != " + right;
        }
    }

    record Plus(Expr left, Expr right) implements Arithmetic {
        public Plus {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitPlus(this);
        }

        @Override
        public String toString() {
            return "(" + left + " + " + right + ")";
        }
    }

    record Minus(Expr left, Expr right) implements Arithmetic {
        public Minus {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitMinus(this);
        }

        @Override
        public String toString() {
            return "(" + left + " - " + right + ")";
        }
    }

    record Mul(Expr left, Expr right) implements Arithmetic {
        public Mul {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitMul(this);
        }

        @Override
        public String toString() {
            return "(" + left + " * " + right + ")";
        }
    }

    record Assert(Expr constraint) implements Expr {
        public Assert {
            Objects.requireNonNull(constraint, "constraint");
        }

        public <T> T accept(Visitor<T> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public String toString() {
            return "assert(" + constraint + ")";
        }
    }
}
