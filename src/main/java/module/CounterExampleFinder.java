package module;

import Engine.ConstraintExtractor;
import Engine.ExecTreeNode;
import Engine.Obligation;
import init.Config;
import solver.SolveResult;
import solver.SolverBridge;
import utils.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Sends the obligations of an execution tree to a solver and keeps the satisfiable ones.
 */
public class CounterExampleFinder {

    private final SolverBridge solver;
    private final boolean parallel;
    private final int threads;

    public CounterExampleFinder(SolverBridge solver) {
        this(solver, Config.parallelSolve, Config.threads);
    }

    public CounterExampleFinder(SolverBridge solver, boolean parallel, int threads) {
        this.solver = solver;
        this.parallel = parallel;
        this.threads = threads;
    }

    public List<CounterExample> findAll(ExecTreeNode tree) {
        return findAll(ConstraintExtractor.collectObligations(tree));
    }

    public Optional<CounterExample> findFirst(ExecTreeNode tree) {
        for (Obligation obligation : ConstraintExtractor.collectObligations(tree)) {
            CounterExample ce = toCounterExample(obligation, solver.solve(obligation));
            if (ce != null) {
                return Optional.of(ce);
            }
        }
        return Optional.empty();
    }

    /**
     * Counterexamples in obligation order, whether solved sequentially or on the pool.
     */
    public List<CounterExample> findAll(List<Obligation> obligations) {
        long startTime = System.currentTimeMillis();
        List<SolveResult> results = parallel && obligations.size() > 1
                ? solveParallel(obligations)
                : solveSequential(obligations);

        List<CounterExample> found = new ArrayList<>();
        for (int i = 0; i < obligations.size(); i++) {
            CounterExample ce = toCounterExample(obligations.get(i), results.get(i));
            if (ce != null) {
                found.add(ce);
            }
        }
        Log.printTime("[+] Solved " + obligations.size() + " obligations, " + found.size() + " counter examples", startTime);
        return found;
    }

    private List<SolveResult> solveSequential(List<Obligation> obligations) {
        List<SolveResult> results = new ArrayList<>(obligations.size());
        for (Obligation obligation : obligations) {
            results.add(solver.solve(obligation));
        }
        return results;
    }

    private List<SolveResult> solveParallel(List<Obligation> obligations) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, obligations.size()));
        try {
            List<Future<SolveResult>> futures = new ArrayList<>(obligations.size());
            for (Obligation obligation : obligations) {
                futures.add(executor.submit(() -> solver.solve(obligation)));
            }
            List<SolveResult> results = new ArrayList<>(futures.size());
            for (Future<SolveResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while solving obligations", e);
        } catch (ExecutionException e) {
            Log.error("Solver task failed: " + e.getCause());
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Solver task failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static CounterExample toCounterExample(Obligation obligation, SolveResult result) {
        switch (result.getStatus()) {
            case SATISFIABLE:
                Log.info("[+] Counter example " + result + " violates " + obligation.getAssertion());
                return new CounterExample(obligation, result.getModel());
            case UNKNOWN:
                Log.warn("[-] Undecided: " + obligation + " (" + result.getReason() + ")");
                return null;
            default:
                return null;
        }
    }
}
