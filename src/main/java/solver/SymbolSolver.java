package solver;

import Engine.Expr;
import Engine.Obligation;
import init.Config;
import utils.Log;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Z3 backed {@link SolverBridge}. Every symbolic input becomes an unbounded integer constant,
 * matching the arbitrary precision folding of the evaluator.
 */
public class SymbolSolver implements SolverBridge, AutoCloseable {

    private final Z3ContextPool contextPool;
    private final int timeoutMs;

    public SymbolSolver() {
        this(Config.contextPoolSize, Config.solverTimeoutMs);
    }

    public SymbolSolver(int poolSize, int timeoutMs) {
        this.contextPool = new Z3ContextPool(poolSize);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public SolveResult solve(Obligation obligation) {
        Context ctx = contextPool.borrowContext();
        try {
            return solve(ctx, obligation);
        } catch (Z3Exception e) {
            Log.errorStack("Z3 failed on " + obligation, e);
            return SolveResult.unknown(e.getMessage());
        } finally {
            contextPool.returnContext(ctx);
        }
    }

    private SolveResult solve(Context ctx, Obligation obligation) {
        Map<String, IntExpr> vars = Z3FormulaTranslator.declare(ctx, obligation.symbolicVariables());
        Z3FormulaTranslator translator = new Z3FormulaTranslator(ctx, vars);

        Solver solver = ctx.mkSolver();
        if (timeoutMs > 0) {
            Params params = ctx.mkParams();
            params.add("timeout", timeoutMs);
            solver.setParameters(params);
        }
        for (Expr constraint : obligation.constraintExprs()) {
            BoolExpr formula = translator.toFormula(constraint);
            Log.debug("Constraint: " + Z3ExpressionFormatter.formatConstraint(formula));
            solver.add(formula);
        }

        Status status = solver.check();
        if (status == Status.UNSATISFIABLE) {
            Log.debug("unsat: " + obligation);
            return SolveResult.unsatisfiable();
        }
        if (status == Status.UNKNOWN) {
            String reason = solver.getReasonUnknown();
            Log.warn("Solver returned unknown for " + obligation + ": " + reason);
            return SolveResult.unknown(reason);
        }

        Model model = solver.getModel();
        Map<String, BigInteger> values = new LinkedHashMap<>();
        for (Map.Entry<String, IntExpr> entry : vars.entrySet()) {
            // completion gives unconstrained inputs a value as well
            IntExpr value = (IntExpr) model.eval(entry.getValue(), true);
            if (!(value instanceof IntNum)) {
                return SolveResult.unknown("No numeral for " + entry.getKey() + " in model: " + value);
            }
            values.put(entry.getKey(), ((IntNum) value).getBigInteger());
            Log.debug(Z3ExpressionFormatter.formatModelValue(model, entry.getValue()));
        }
        return SolveResult.satisfiable(values);
    }

    @Override
    public void close() {
        Log.debug("Closing " + contextPool.getPoolStatus());
        contextPool.close();
    }
}
