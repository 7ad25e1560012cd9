package solver;

import Engine.AnalysisException;
import Engine.Expr.*;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntSort;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Translates simplified expressions into Z3 integer formulas.
 * Only constants, declared symbolic inputs, arithmetic and comparisons are translatable.
 */
public class Z3FormulaTranslator implements Visitor<Expr<?>> {

    private final Context ctx;
    private final Map<String, IntExpr> variables;

    public Z3FormulaTranslator(Context ctx, Map<String, IntExpr> variables) {
        this.ctx = ctx;
        this.variables = variables;
    }

    /** One integer constant per symbolic name. */
    public static Map<String, IntExpr> declare(Context ctx, Collection<String> names) {
        Map<String, IntExpr> vars = new LinkedHashMap<>();
        for (String name : names) {
            vars.put(name, ctx.mkIntConst(name));
        }
        return vars;
    }

    public BoolExpr toFormula(Engine.Expr expr) {
        Expr<?> result = expr.accept(this);
        if (!(result instanceof BoolExpr)) {
            throw untranslatable(expr, "not a boolean formula");
        }
        return (BoolExpr) result;
    }

    @SuppressWarnings("unchecked")
    private ArithExpr<IntSort> term(Engine.Expr expr) {
        Expr<?> result = expr.accept(this);
        if (!(result instanceof ArithExpr)) {
            throw untranslatable(expr, "not an integer term");
        }
        return (ArithExpr<IntSort>) result;
    }

    private static AnalysisException untranslatable(Engine.Expr expr, String why) {
        return new AnalysisException(AnalysisException.Kind.UNTRANSLATABLE,
                "Cannot convert " + expr + " to a formula: " + why);
    }

    public Expr<?> visitConst(Const expr) {
        return ctx.mkInt(expr.value().toString());
    }

    public Expr<?> visitVar(Var expr) {
        throw untranslatable(expr, "expression should only contain symbolic variables but contains the regular variable "
                + expr.name());
    }

    public Expr<?> visitSymbolic(Symbolic expr) {
        IntExpr v = variables.get(expr.name());
        if (v == null) {
            throw new AnalysisException(AnalysisException.Kind.UNKNOWN_SYMBOL, "Unknown variable " + expr.name());
        }
        return v;
    }

    public Expr<?> visitLet(Let expr) {
        throw untranslatable(expr, "let is a statement");
    }

    public Expr<?> visitBlock(Block expr) {
        throw untranslatable(expr, "block is a statement");
    }

    public Expr<?> visitIf(If expr) {
        throw untranslatable(expr, "if is a statement");
    }

    public Expr<?> visitEq(Eq expr) {
        return ctx.mkEq(term(expr.left()), term(expr.right()));
    }

    public Expr<?> visitNEq(NEq expr) {
        return ctx.mkNot(ctx.mkEq(term(expr.left()), term(expr.right())));
    }

    public Expr<?> visitPlus(Plus expr) {
        return ctx.mkAdd(term(expr.left()), term(expr.right()));
    }

    public Expr<?> visitMinus(Minus expr) {
        return ctx.mkSub(term(expr.left()), term(expr.right()));
    }

    public Expr<?> visitMul(Mul expr) {
        return ctx.mkMul(term(expr.left()), term(expr.right()));
    }

    public Expr<?> visitAssert(Assert expr) {
        throw untranslatable(expr, "an assertion is checked through its negated constraint");
    }
}
