package Engine;

import static Engine.Programs.*;
import static org.junit.jupiter.api.Assertions.*;

import Engine.Expr.*;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ExpressionTest {

    /** Every referenced variable is free when nothing binds it. */
    @Test
    public void freeVariablesIncludesFreeVariables() {
        Set<Var> free = Expression.freeVariables(new Block(
                v("x1"),
                new Eq(v("x2"), v("x3")),
                new If(new NEq(v("x4"), v("x5")),
                        new Plus(new Minus(v("x6"), v("x7")), v("x8")),
                        new Let(v("y"), v("x9")))));
        assertEquals(
                List.of(v("x1"), v("x2"), v("x3"), v("x4"), v("x5"), v("x6"), v("x7"), v("x8"), v("x9")),
                List.copyOf(free));
    }

    @Test
    public void boundVariableNotFree() {
        Set<Var> free = Expression.freeVariables(new Block(new Let(v("x"), v("y")), v("x")));
        assertEquals(Set.of(v("y")), free);
    }

    /** A read before the let that binds it counts as free. */
    @Test
    public void variableFreeBeforeBound() {
        Set<Var> free = Expression.freeVariables(new Block(v("x"), new Let(v("x"), v("y"))));
        assertEquals(Set.of(v("x"), v("y")), free);
    }

    @Test
    public void letDoesNotBindItsOwnValue() {
        assertEquals(Set.of(v("x")), Expression.freeVariables(new Let(v("y"), new Plus(v("x"), c(1)))));
        assertEquals(Set.of(), Expression.freeVariables(new Let(v("x"), new Plus(v("x"), c(1)))));
    }

    @Test
    public void symbolicValueNotFree() {
        assertTrue(Expression.freeVariables(sym("x")).isEmpty());
    }

    @Test
    public void freeVariablesLookIntoAssertions() {
        assertEquals(Set.of(v("a")), Expression.freeVariables(new Assert(new NEq(v("a"), c(0)))));
        Set<Var> free = Expression.freeVariables(new Block(
                new Let(v("x"), c(1)),
                new Assert(new Eq(new Plus(v("x"), v("b")), c(2)))));
        assertEquals(Set.of(v("b")), free);
    }

    @Test
    public void freeVariablesOfExampleAreItsInputs() {
        assertEquals(List.of(v("a"), v("b")), List.copyOf(Expression.freeVariables(assertingExample())));
    }

    @Test
    public void symbolicVariablesLookIntoAssertions() {
        Expr e = new Block(
                new Let(v("x"), sym("a")),
                new Assert(new Eq(new Mul(sym("b"), v("x")), sym("a"))));
        assertEquals(List.of(sym("a"), sym("b")), List.copyOf(Expression.symbolicVariables(e)));
    }

    @Test
    public void negateSwapsComparison() {
        assertEquals(new NEq(v("a"), c(1)), Expression.negate(new Eq(v("a"), c(1))));
        assertEquals(new Eq(v("a"), c(1)), Expression.negate(new NEq(v("a"), c(1))));
    }

    @Test
    public void negateRejectsNonComparison() {
        AnalysisException e = assertThrows(AnalysisException.class,
                () -> Expression.negate(new Plus(c(1), c(2))));
        assertEquals(AnalysisException.Kind.INVALID_NEGATION, e.getKind());
    }

    @Test
    public void namesMustBeIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> new Var("1x"));
        assertThrows(IllegalArgumentException.class, () -> new Symbolic("a b"));
        assertEquals(new Var("x_1"), new Var("x_1"));
        assertNotEquals(new Var("x"), new Symbolic("x"));
    }

    @Test
    public void substituteReplacesOnlyKnownInputs() {
        Expr e = new Eq(new Plus(sym("a"), sym("b")), v("x"));
        Expr replaced = Expression.substitute(e, Map.of("a", BigInteger.TWO));
        assertEquals(new Eq(new Plus(c(2), sym("b")), v("x")), replaced);
    }

    @Test
    public void rendering() {
        assertEquals("let x = (2 * (a + Sym(b)))",
                new Let(v("x"), new Mul(c(2), new Plus(v("a"), sym("b")))).toString());
        If ifStmt = new If(new Eq(v("a"), c(0)), c(1), c(2));
        assertEquals("if (a == 0) 1 else 2", ifStmt.toString());
        assertEquals("if (a == 0)", ifStmt.toShortString());
        assertEquals("{1\nassert(x != 0)}", new Block(c(1), new Assert(new NEq(v("x"), c(0)))).toString());
    }
}
