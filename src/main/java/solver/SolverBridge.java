package solver;

import Engine.Obligation;

/**
 * Satisfiability backend. One call per obligation, each call independent of the others,
 * so callers may dispatch obligations concurrently.
 */
public interface SolverBridge {

    /**
     * Checks whether the obligation's path can be taken while its assertion fails.
     * Malformed formulas raise {@link Engine.AnalysisException}; backend failures come back as
     * {@link SolveResult.Status#UNKNOWN}.
     */
    SolveResult solve(Obligation obligation);
}
