package module;

import static Engine.Programs.*;
import static org.junit.jupiter.api.Assertions.*;

import Engine.ExecTreeBuilder;
import Engine.ExecTreeNode;
import Engine.Expr;
import Engine.Expr.*;
import Engine.Obligation;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import solver.SolveResult;
import solver.SolverBridge;
import solver.SymbolSolver;

public class CounterExampleFinderTest {

    private static SymbolSolver solver;
    private final ExecTreeBuilder builder = new ExecTreeBuilder();

    @BeforeAll
    public static void setUp() {
        solver = new SymbolSolver(4, 10_000);
    }

    @AfterAll
    public static void tearDown() {
        solver.close();
    }

    @Test
    public void testFindCounterExample() {
        Optional<CounterExample> ce = new CounterExampleFinder(solver, false, 1)
                .findFirst(builder.build(assertingExample()));
        assertTrue(ce.isPresent());
        assertEquals("[a: 2, b: 0]", ce.get().toString());
        assertEquals(BigInteger.TWO, ce.get().valueOf("a"));
        assertTrue(ce.get().confirms());
    }

    @Test
    public void findAllKeepsOnlySatisfiableObligations() {
        List<CounterExample> found = new CounterExampleFinder(solver, false, 1)
                .findAll(builder.build(assertingExample()));
        assertEquals(1, found.size());
        assertEquals(List.of(new NEq(sym("a"), c(0)), new Eq(sym("b"), c(0))),
                found.get(0).getObligation().getPathConstraints());
    }

    @Test
    public void parallelSolvingKeepsObligationOrder() {
        Expr program = new Block(
                new If(new Eq(v("a"), c(1)), new Assert(new NEq(v("b"), c(10)))),
                new If(new Eq(v("a"), c(2)), new Assert(new NEq(v("b"), c(20)))),
                new Assert(new NEq(v("a"), c(3))));
        ExecTreeNode tree = builder.build(program);

        List<CounterExample> sequential = new CounterExampleFinder(solver, false, 1).findAll(tree);
        List<CounterExample> parallel = new CounterExampleFinder(solver, true, 4).findAll(tree);

        assertEquals(sequential.size(), parallel.size());
        for (int i = 0; i < sequential.size(); i++) {
            assertEquals(sequential.get(i).getObligation(), parallel.get(i).getObligation());
            assertTrue(parallel.get(i).confirms());
        }
    }

    @Test
    public void unreachableAssertionHasNoCounterExample() {
        CounterExampleFinder finder = new CounterExampleFinder(solver);
        ExecTreeNode tree = builder.build(unreachableAssertion());
        assertTrue(finder.findAll(tree).isEmpty());
        assertFalse(finder.findFirst(tree).isPresent());
    }

    @Test
    public void noTreeNoCounterExamples() {
        assertTrue(new CounterExampleFinder(solver).findAll((ExecTreeNode) null).isEmpty());
    }

    @Test
    public void undecidedObligationsAreSkipped() {
        AtomicInteger calls = new AtomicInteger();
        SolverBridge undecided = obligation -> {
            calls.incrementAndGet();
            return SolveResult.unknown("timeout");
        };
        List<CounterExample> found = new CounterExampleFinder(undecided, false, 1)
                .findAll(builder.build(assertingExample()));
        assertTrue(found.isEmpty());
        assertEquals(3, calls.get());
    }

    @Test
    public void solverFailureSurfacesFromParallelRun() {
        SolverBridge broken = obligation -> {
            throw new IllegalStateException("boom");
        };
        CounterExampleFinder finder = new CounterExampleFinder(broken, true, 2);
        ExecTreeNode tree = builder.build(assertingExample());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> finder.findAll(tree));
        assertEquals("boom", e.getMessage());
    }

    @Test
    public void wrongInputsDoNotConfirm() {
        Obligation obligation = new CounterExampleFinder(solver, false, 1)
                .findFirst(builder.build(assertingExample())).orElseThrow().getObligation();

        TreeMap<String, BigInteger> inputs = new TreeMap<>();
        inputs.put("a", BigInteger.valueOf(3));
        inputs.put("b", BigInteger.ZERO);
        assertFalse(new CounterExample(obligation, inputs).confirms());

        inputs.put("a", BigInteger.TWO);
        inputs.put("b", BigInteger.ONE);
        assertFalse(new CounterExample(obligation, inputs).confirms());

        inputs.put("b", BigInteger.ZERO);
        assertTrue(new CounterExample(obligation, inputs).confirms());
    }
}
