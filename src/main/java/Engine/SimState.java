package Engine;

import Engine.Expr.Symbolic;
import Engine.Expr.Var;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State of one explored path: the symbolic store and the path constraints.
 * Forks work on {@link #copy()}; sibling paths never share a store.
 */
public class SimState {
    private final Map<Var, Expr> store;
    private final List<Expr> constraints;

    public SimState() {
        this.store = new LinkedHashMap<>();
        this.constraints = new ArrayList<>();
    }

    private SimState(Map<Var, Expr> store, List<Expr> constraints) {
        this.store = new LinkedHashMap<>(store);
        this.constraints = new ArrayList<>(constraints);
    }

    /**
     * Initial state of a program: every free variable maps to a symbolic input of the same name.
     */
    public static SimState initial(Expr program) {
        SimState state = new SimState();
        for (Var v : Expression.freeVariables(program)) {
            state.bind(v, new Symbolic(v.name()));
        }
        return state;
    }

    public void bind(Var v, Expr value) {
        this.store.put(v, value);
    }

    public void addConstraint(Expr c) {
        this.constraints.add(c);
    }

    /** Mutable view handed to the evaluator. Callers own the state they pass. */
    public Map<Var, Expr> getStore() {
        return this.store;
    }

    public List<Expr> getConstraints() {
        return Collections.unmodifiableList(this.constraints);
    }

    public SimState copy() {
        return new SimState(this.store, this.constraints);
    }

    public SimState withBinding(Var v, Expr value) {
        SimState next = copy();
        next.bind(v, value);
        return next;
    }

    public SimState withConstraint(Expr c) {
        SimState next = copy();
        next.addConstraint(c);
        return next;
    }

    @Override
    public String toString() {
        return "σ: " + store + ", π: " + constraints;
    }
}
