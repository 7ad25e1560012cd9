package solver;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

public final class SolveResult {

    public enum Status {
        SATISFIABLE,
        UNSATISFIABLE,
        UNKNOWN
    }

    private static final SolveResult UNSAT = new SolveResult(Status.UNSATISFIABLE, Collections.emptySortedMap(), null);

    private final Status status;
    private final SortedMap<String, BigInteger> model;
    private final String reason;

    private SolveResult(Status status, SortedMap<String, BigInteger> model, String reason) {
        this.status = status;
        this.model = model;
        this.reason = reason;
    }

    public static SolveResult satisfiable(Map<String, BigInteger> model) {
        return new SolveResult(Status.SATISFIABLE, Collections.unmodifiableSortedMap(new TreeMap<>(model)), null);
    }

    public static SolveResult unsatisfiable() {
        return UNSAT;
    }

    public static SolveResult unknown(String reason) {
        return new SolveResult(Status.UNKNOWN, Collections.emptySortedMap(), reason);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSatisfiable() {
        return status == Status.SATISFIABLE;
    }

    /** Value per symbolic input, ordered by name. Empty unless satisfiable. */
    public SortedMap<String, BigInteger> getModel() {
        return model;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        switch (status) {
            case SATISFIABLE:
                return model.entrySet().stream()
                        .map(e -> e.getKey() + ": " + e.getValue())
                        .collect(Collectors.joining(", ", "[", "]"));
            case UNSATISFIABLE:
                return "UNSAT";
            default:
                return "UNKNOWN(" + reason + ")";
        }
    }
}
