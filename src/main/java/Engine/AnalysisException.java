package Engine;

/**
 * Fatal analysis failure. Signals a malformed program or a broken caller contract; never retried.
 */
public class AnalysisException extends RuntimeException {

    public enum Kind {
        UNBOUND_VARIABLE,
        INVALID_CONDITION,
        INVALID_NEGATION,
        EMPTY_BLOCK,
        MISSING_VALUE,
        UNKNOWN_SYMBOL,
        UNTRANSLATABLE,
        DEPTH_LIMIT
    }

    private final Kind kind;

    public AnalysisException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static AnalysisException unboundVariable(Expr.Var var, Object store) {
        return new AnalysisException(Kind.UNBOUND_VARIABLE, "Variable " + var.name() + " not found in state " + store);
    }

    public static AnalysisException invalidCondition(Expr cond) {
        return new AnalysisException(Kind.INVALID_CONDITION, "Invalid condition " + cond + ", must be Eq or NEq");
    }

    public static AnalysisException missingValue(Expr expr) {
        return new AnalysisException(Kind.MISSING_VALUE, "Expression yields no value: " + expr);
    }
}
