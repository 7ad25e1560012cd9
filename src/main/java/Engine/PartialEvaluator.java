package Engine;

import Engine.Expr.*;

import java.math.BigInteger;
import java.util.Map;
import java.util.function.BinaryOperator;

/**
 * Reduces an expression to one over constants and symbolic values.
 * Arithmetic on two constants folds; comparisons are only decided inside {@code if}.
 */
public class PartialEvaluator implements Visitor<Expr> {

    private final Map<Var, Expr> store;

    private PartialEvaluator(Map<Var, Expr> store) {
        this.store = store;
    }

    /**
     * Evaluates {@code expr}. Each {@code let} updates {@code store} for what follows it.
     *
     * @return the simplified expression, or {@code null} when a constant-false {@code if} without
     *         an else branch is the value
     * @throws AnalysisException on unbound variables, non-comparison conditions or empty blocks
     */
    public static Expr evaluate(Expr expr, Map<Var, Expr> store) {
        return expr.accept(new PartialEvaluator(store));
    }

    /**
     * Decides a comparison whose operands are both constants.
     *
     * @return the truth value, or {@code null} if an operand is not constant
     */
    public static Boolean decide(Comparison cond) {
        if (cond.left() instanceof Const l && cond.right() instanceof Const r) {
            boolean equal = l.value().equals(r.value());
            return cond instanceof Eq ? equal : !equal;
        }
        return null;
    }

    private Expr valueOf(Expr expr) {
        Expr result = expr.accept(this);
        if (result == null) {
            throw AnalysisException.missingValue(expr);
        }
        return result;
    }

    public Expr visitConst(Const expr) {
        return expr;
    }

    public Expr visitVar(Var expr) {
        Expr value = store.get(expr);
        if (value == null) {
            throw AnalysisException.unboundVariable(expr, store);
        }
        return value;
    }

    public Expr visitSymbolic(Symbolic expr) {
        return expr;
    }

    public Expr visitLet(Let expr) {
        Expr value = valueOf(expr.value());
        store.put(expr.target(), value);
        return value;
    }

    public Expr visitBlock(Block expr) {
        if (expr.statements().isEmpty()) {
            throw new AnalysisException(AnalysisException.Kind.EMPTY_BLOCK, "Cannot evaluate empty block");
        }
        Expr result = null;
        for (Expr stmt : expr.statements()) {
            result = stmt.accept(this);
        }
        return result;
    }

    public Expr visitIf(If expr) {
        Expr cond = expr.condition().accept(this);
        if (!(cond instanceof Comparison comparison)) {
            throw AnalysisException.invalidCondition(cond != null ? cond : expr.condition());
        }
        Boolean taken = decide(comparison);
        if (taken != null) {
            if (taken) {
                return expr.thenBranch().accept(this);
            }
            return expr.hasElse() ? expr.elseBranch().accept(this) : null;
        }
        // forking is the tree builder's job; the else branch stays as written
        return new If(comparison, valueOf(expr.thenBranch()), expr.elseBranch());
    }

    public Expr visitEq(Eq expr) {
        return new Eq(valueOf(expr.left()), valueOf(expr.right()));
    }

    public Expr visitNEq(NEq expr) {
        return new NEq(valueOf(expr.left()), valueOf(expr.right()));
    }

    public Expr visitPlus(Plus expr) {
        return fold(expr, BigInteger::add);
    }

    public Expr visitMinus(Minus expr) {
        return fold(expr, BigInteger::subtract);
    }

    public Expr visitMul(Mul expr) {
        return fold(expr, BigInteger::multiply);
    }

    public Expr visitAssert(Assert expr) {
        return new Assert(valueOf(expr.constraint()));
    }

    private Expr fold(Arithmetic expr, BinaryOperator<BigInteger> op) {
        Expr left = valueOf(expr.left());
        Expr right = valueOf(expr.right());
        if (left instanceof Const l && right instanceof Const r) {
            return new Const(op.apply(l.value(), r.value()));
        }
        if (expr instanceof Plus) {
            return new Plus(left, right);
        } else if (expr instanceof Minus) {
            return new Minus(left, right);
        }
        return new Mul(left, right);
    }
}
