package solver;

import com.microsoft.z3.*;

import java.util.Map;

/**
 * Infix rendering of the integer formulas produced by {@link Z3FormulaTranslator}, for logs.
 */
public class Z3ExpressionFormatter {

    private static final Map<String, String> OPERATOR_MAP = Map.of(
            "+", "+",
            "-", "-",
            "*", "*",
            "=", "==",
            "distinct", "!=",
            "<=", "<=",
            ">=", ">=",
            "<", "<",
            ">", ">");

    public static String formatExpression(Expr<?> expr) {
        if (expr == null) return "";

        if (expr instanceof BoolExpr) {
            return formatBoolExpr((BoolExpr) expr);
        } else if (expr instanceof IntNum) {
            return ((IntNum) expr).getBigInteger().toString();
        } else if (expr.isConst()) {
            return expr.getFuncDecl().getName().toString();
        }
        return formatApp(expr);
    }

    private static String formatBoolExpr(BoolExpr expr) {
        if (expr.isTrue()) return "true";
        if (expr.isFalse()) return "false";

        String declName = expr.getFuncDecl().getName().toString();
        if (declName.equals("not")) {
            Expr<?> arg = expr.getArgs()[0];
            if (arg.isEq()) {
                return formatBinaryOp(arg, "!=");
            }
            return "NOT " + formatExpression(arg);
        }
        if (declName.equals("and")) {
            return formatNaryOp(expr, "AND");
        }
        return formatApp(expr);
    }

    private static String formatApp(Expr<?> expr) {
        String declName = expr.getFuncDecl().getName().toString();
        String op = OPERATOR_MAP.get(declName);
        if (op != null && expr.getNumArgs() == 2) {
            return formatBinaryOp(expr, op);
        }
        if (op != null && expr.getNumArgs() > 2) {
            return formatNaryOp(expr, op);
        }
        if (declName.equals("-") && expr.getNumArgs() == 1) {
            return "-" + parenthesize(expr.getArgs()[0]);
        }

        StringBuilder result = new StringBuilder();
        result.append(declName).append("(");
        Expr<?>[] args = expr.getArgs();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) result.append(", ");
            result.append(formatExpression(args[i]));
        }
        return result.append(")").toString();
    }

    private static String formatBinaryOp(Expr<?> expr, String operator) {
        Expr<?>[] args = expr.getArgs();
        return parenthesize(args[0]) + " " + operator + " " + parenthesize(args[1]);
    }

    private static String formatNaryOp(Expr<?> expr, String operator) {
        StringBuilder result = new StringBuilder();
        Expr<?>[] args = expr.getArgs();
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                result.append(" ").append(operator).append(" ");
            }
            result.append(parenthesize(args[i]));
        }
        return result.toString();
    }

    // compound arithmetic operands are always bracketed
    private static String parenthesize(Expr<?> expr) {
        String s = formatExpression(expr);
        if (expr.getNumArgs() > 0 && !(expr instanceof BoolExpr)) {
            return "(" + s + ")";
        }
        return s;
    }

    public static String formatModelValue(Model model, Expr<?> expr) {
        Expr<?> value = model.eval(expr, false);
        if (value == null) return formatExpression(expr) + " = undefined";
        return formatExpression(expr) + " = " + formatExpression(value);
    }

    public static String formatConstraint(BoolExpr expr) {
        return formatExpression(expr);
    }
}
