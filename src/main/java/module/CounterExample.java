package module;

import Engine.Expr;
import Engine.Expr.Comparison;
import Engine.Expression;
import Engine.Obligation;
import Engine.PartialEvaluator;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;

/**
 * Concrete inputs that reach an assertion and make it fail.
 */
public final class CounterExample {
    private final Obligation obligation;
    private final SortedMap<String, BigInteger> inputs;

    public CounterExample(Obligation obligation, SortedMap<String, BigInteger> inputs) {
        this.obligation = Objects.requireNonNull(obligation, "obligation");
        this.inputs = Collections.unmodifiableSortedMap(inputs);
    }

    public Obligation getObligation() {
        return obligation;
    }

    public SortedMap<String, BigInteger> getInputs() {
        return inputs;
    }

    public BigInteger valueOf(String input) {
        return inputs.get(input);
    }

    /**
     * Replays the inputs: true iff every path constraint holds and the assertion is violated.
     */
    public boolean confirms() {
        for (Expr c : obligation.getPathConstraints()) {
            if (!Boolean.TRUE.equals(decide(c))) {
                return false;
            }
        }
        return Boolean.FALSE.equals(decide(obligation.getAssertion().constraint()));
    }

    private Boolean decide(Expr expr) {
        Expr reduced = PartialEvaluator.evaluate(Expression.substitute(expr, inputs), Collections.emptyMap());
        if (!(reduced instanceof Comparison comparison)) {
            return null;
        }
        return PartialEvaluator.decide(comparison);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        inputs.forEach((name, value) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(name).append(": ").append(value);
        });
        return sb.append("]").toString();
    }
}
