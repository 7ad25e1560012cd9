package Engine;

import Engine.Expr.Assert;
import Engine.Expr.Symbolic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A reachable assertion together with the constraints of the path reaching it.
 * Its formulas are satisfiable exactly when the path can be taken and the assertion fails.
 */
public final class Obligation {
    private final Assert assertion;
    private final List<Expr> pathConstraints;

    public Obligation(Assert assertion, List<Expr> pathConstraints) {
        this.assertion = Objects.requireNonNull(assertion, "assertion");
        this.pathConstraints = List.copyOf(pathConstraints);
    }

    public Assert getAssertion() {
        return assertion;
    }

    public List<Expr> getPathConstraints() {
        return pathConstraints;
    }

    /** The negated assertion followed by every path constraint. */
    public Set<Expr> constraintExprs() {
        Set<Expr> exprs = new LinkedHashSet<>();
        exprs.add(Expression.negate(assertion.constraint()));
        exprs.addAll(pathConstraints);
        return Collections.unmodifiableSet(exprs);
    }

    /** Names of the symbolic inputs the formulas mention. */
    public Set<String> symbolicVariables() {
        Set<String> names = new LinkedHashSet<>();
        for (Expr e : constraintExprs()) {
            for (Symbolic s : Expression.symbolicVariables(e)) {
                names.add(s.name());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Obligation)) return false;
        Obligation that = (Obligation) o;
        return assertion.equals(that.assertion) && pathConstraints.equals(that.pathConstraints);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assertion, pathConstraints);
    }

    @Override
    public String toString() {
        return assertion + " under " + pathConstraints;
    }
}
