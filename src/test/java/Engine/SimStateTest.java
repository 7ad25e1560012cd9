package Engine;

import static Engine.Programs.*;
import static org.junit.jupiter.api.Assertions.*;

import Engine.Expr.*;
import java.util.List;
import org.junit.jupiter.api.Test;

public class SimStateTest {

    @Test
    public void initialStateMapsInputsToSymbols() {
        SimState state = SimState.initial(assertingExample());
        assertEquals(sym("a"), state.getStore().get(v("a")));
        assertEquals(sym("b"), state.getStore().get(v("b")));
        assertNull(state.getStore().get(v("x")));
        assertTrue(state.getConstraints().isEmpty());
    }

    /** A fork never sees the bindings or constraints of its sibling. */
    @Test
    public void copiesAreIndependent() {
        SimState state = new SimState();
        state.bind(v("x"), c(1));

        SimState left = state.withBinding(v("x"), c(2)).withConstraint(new Eq(sym("a"), c(0)));
        SimState right = state.withConstraint(new NEq(sym("a"), c(0)));
        right.bind(v("y"), c(3));

        assertEquals(c(1), state.getStore().get(v("x")));
        assertNull(state.getStore().get(v("y")));
        assertTrue(state.getConstraints().isEmpty());
        assertEquals(c(2), left.getStore().get(v("x")));
        assertNull(left.getStore().get(v("y")));
        assertEquals(List.of(new Eq(sym("a"), c(0))), left.getConstraints());
        assertEquals(List.of(new NEq(sym("a"), c(0))), right.getConstraints());
    }

    @Test
    public void rebindingKeepsInsertionOrder() {
        SimState state = new SimState();
        state.bind(v("x"), c(1));
        state.bind(v("y"), c(2));
        state.bind(v("x"), c(3));
        assertEquals("{x=3, y=2}", state.getStore().toString());
    }
}
