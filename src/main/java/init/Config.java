package init;

public class Config {

    // Basic Config
    public static int threads = Math.max(1, Runtime.getRuntime().availableProcessors());
    public static String logLevel = "INFO";

    // Analysis Config
    public static int maxTreeDepth = 2048;

    // Solver Config
    public static boolean parallelSolve = false;
    public static int solverTimeoutMs = 10_000; // 0 = no timeout
    public static int contextPoolSize = 4;

    private static final String PREFIX = "symexec.";

    // -Dsymexec.<field>=<value> overrides the defaults above
    public static void load() {
        threads = Integer.getInteger(PREFIX + "threads", threads);
        logLevel = System.getProperty(PREFIX + "logLevel", logLevel);
        maxTreeDepth = Integer.getInteger(PREFIX + "maxTreeDepth", maxTreeDepth);
        solverTimeoutMs = Integer.getInteger(PREFIX + "solverTimeoutMs", solverTimeoutMs);
        contextPoolSize = Integer.getInteger(PREFIX + "contextPoolSize", contextPoolSize);
        String parallel = System.getProperty(PREFIX + "parallelSolve");
        if (parallel != null) {
            parallelSolve = Boolean.parseBoolean(parallel);
        }
    }
}
