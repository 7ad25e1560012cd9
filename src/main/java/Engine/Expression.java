package Engine;

import Engine.Expr.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static analyses over {@link Expr}. Result sets keep first-occurrence order.
 */
public class Expression {

    /**
     * Variables referenced without being bound by an earlier {@code let}.
     * Inside a block a variable read before its own {@code let} is still free; later reads are not.
     */
    public static Set<Var> freeVariables(Expr expr) {
        return Collections.unmodifiableSet(expr.accept(FREE_VARIABLES));
    }

    public static Set<Symbolic> symbolicVariables(Expr expr) {
        return Collections.unmodifiableSet(expr.accept(SYMBOLIC_VARIABLES));
    }

    /**
     * Swaps {@code ==} and {@code !=}. Only defined for comparisons.
     */
    public static Comparison negate(Expr expr) {
        if (expr instanceof Eq eq) {
            return new NEq(eq.left(), eq.right());
        }
        if (expr instanceof NEq neq) {
            return new Eq(neq.left(), neq.right());
        }
        throw new AnalysisException(AnalysisException.Kind.INVALID_NEGATION, "Cannot negate " + expr);
    }

    public static boolean isComparison(Expr expr) {
        return expr instanceof Comparison;
    }

    /**
     * Replaces every symbolic input that has a value in {@code values} by that constant.
     */
    public static Expr substitute(Expr expr, Map<String, BigInteger> values) {
        return expr.accept(new Substitution(values));
    }

    /*   ------------------------------------------------   */
    /*                     Substitution                     */
    /*   ------------------------------------------------   */

    private static final class Substitution implements Visitor<Expr> {
        private final Map<String, BigInteger> values;

        Substitution(Map<String, BigInteger> values) {
            this.values = values;
        }

        public Expr visitConst(Const expr) {
            return expr;
        }

        public Expr visitVar(Var expr) {
            return expr;
        }

        public Expr visitSymbolic(Symbolic expr) {
            BigInteger value = values.get(expr.name());
            return value != null ? new Const(value) : expr;
        }

        public Expr visitLet(Let expr) {
            return new Let(expr.target(), expr.value().accept(this));
        }

        public Expr visitBlock(Block expr) {
            List<Expr> stmts = new ArrayList<>();
            for (Expr stmt : expr.statements()) {
                stmts.add(stmt.accept(this));
            }
            return new Block(stmts);
        }

        public Expr visitIf(If expr) {
            Expr elseBranch = expr.hasElse() ? expr.elseBranch().accept(this) : null;
            return new If(expr.condition().accept(this), expr.thenBranch().accept(this), elseBranch);
        }

        public Expr visitEq(Eq expr) {
            return new Eq(expr.left().accept(this), expr.right().accept(this));
        }

        public Expr visitNEq(NEq expr) {
            return new NEq(expr.left().accept(this), expr.right().accept(this));
        }

        public Expr visitPlus(Plus expr) {
            return new Plus(expr.left().accept(this), expr.right().accept(this));
        }

        public Expr visitMinus(Minus expr) {
            return new Minus(expr.left().accept(this), expr.right().accept(this));
        }

        public Expr visitMul(Mul expr) {
            return new Mul(expr.left().accept(this), expr.right().accept(this));
        }

        public Expr visitAssert(Assert expr) {
            return new Assert(expr.constraint().accept(this));
        }
    }

    /*   ------------------------------------------------   */
    /*                    Free variables                    */
    /*   ------------------------------------------------   */

    private static final Visitor<Set<Var>> FREE_VARIABLES = new Visitor<>() {
        public Set<Var> visitConst(Const expr) {
            return new LinkedHashSet<>();
        }

        public Set<Var> visitVar(Var expr) {
            Set<Var> vars = new LinkedHashSet<>();
            vars.add(expr);
            return vars;
        }

        public Set<Var> visitSymbolic(Symbolic expr) {
            return new LinkedHashSet<>();
        }

        public Set<Var> visitLet(Let expr) {
            Set<Var> vars = expr.value().accept(this);
            vars.remove(expr.target());
            return vars;
        }

        public Set<Var> visitBlock(Block expr) {
            Set<Var> bound = new LinkedHashSet<>();
            Set<Var> free = new LinkedHashSet<>();
            for (Expr stmt : expr.statements()) {
                if (stmt instanceof Let let) {
                    bound.add(let.target());
                }
                // subtract per statement: a variable may be free before it is bound
                Set<Var> vars = stmt.accept(this);
                vars.removeAll(bound);
                free.addAll(vars);
            }
            return free;
        }

        public Set<Var> visitIf(If expr) {
            Set<Var> vars = expr.condition().accept(this);
            vars.addAll(expr.thenBranch().accept(this));
            if (expr.hasElse()) {
                vars.addAll(expr.elseBranch().accept(this));
            }
            return vars;
        }

        public Set<Var> visitEq(Eq expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Var> visitNEq(NEq expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Var> visitPlus(Plus expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Var> visitMinus(Minus expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Var> visitMul(Mul expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Var> visitAssert(Assert expr) {
            return expr.constraint().accept(this);
        }

        private Set<Var> union(Expr left, Expr right) {
            Set<Var> vars = left.accept(this);
            vars.addAll(right.accept(this));
            return vars;
        }
    };

    /*   ------------------------------------------------   */
    /*                   Symbolic values                    */
    /*   ------------------------------------------------   */

    private static final Visitor<Set<Symbolic>> SYMBOLIC_VARIABLES = new Visitor<>() {
        public Set<Symbolic> visitConst(Const expr) {
            return new LinkedHashSet<>();
        }

        public Set<Symbolic> visitVar(Var expr) {
            return new LinkedHashSet<>();
        }

        public Set<Symbolic> visitSymbolic(Symbolic expr) {
            Set<Symbolic> syms = new LinkedHashSet<>();
            syms.add(expr);
            return syms;
        }

        public Set<Symbolic> visitLet(Let expr) {
            return expr.value().accept(this);
        }

        public Set<Symbolic> visitBlock(Block expr) {
            Set<Symbolic> syms = new LinkedHashSet<>();
            for (Expr stmt : expr.statements()) {
                syms.addAll(stmt.accept(this));
            }
            return syms;
        }

        public Set<Symbolic> visitIf(If expr) {
            Set<Symbolic> syms = expr.condition().accept(this);
            syms.addAll(expr.thenBranch().accept(this));
            if (expr.hasElse()) {
                syms.addAll(expr.elseBranch().accept(this));
            }
            return syms;
        }

        public Set<Symbolic> visitEq(Eq expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Symbolic> visitNEq(NEq expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Symbolic> visitPlus(Plus expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Symbolic> visitMinus(Minus expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Symbolic> visitMul(Mul expr) {
            return union(expr.left(), expr.right());
        }

        public Set<Symbolic> visitAssert(Assert expr) {
            return expr.constraint().accept(this);
        }

        private Set<Symbolic> union(Expr left, Expr right) {
            Set<Symbolic> syms = left.accept(this);
            syms.addAll(right.accept(this));
            return syms;
        }
    };
}
