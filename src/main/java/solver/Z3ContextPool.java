package solver;

import com.microsoft.z3.Context;
import utils.Log;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of Z3 contexts. A context is not thread safe, so every concurrent
 * query borrows its own and hands it back when done.
 */
public class Z3ContextPool implements AutoCloseable {
    private final BlockingQueue<Context> pool;
    private final int maxSize;
    private final AtomicInteger createdCount;
    private final Map<String, String> defaultConfig;
    private volatile boolean closed;

    public Z3ContextPool(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Pool size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.pool = new LinkedBlockingQueue<>(maxSize);
        this.createdCount = new AtomicInteger(0);
        this.defaultConfig = Map.of("model", "true");
        Log.debug("Z3ContextPool initialized with max size: " + maxSize);
    }

    /**
     * Takes an idle context, creates one while below the limit, otherwise waits.
     */
    public Context borrowContext() {
        if (closed) {
            throw new IllegalStateException("Z3ContextPool is closed");
        }
        Context context = pool.poll();
        if (context != null) {
            return context;
        }
        if (createdCount.incrementAndGet() <= maxSize) {
            Log.debug("Created new Z3 context, total created: " + createdCount.get());
            return new Context(defaultConfig);
        }
        createdCount.decrementAndGet();
        try {
            context = pool.take();
            Log.debug("Waited for available Z3 context");
            return context;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for Z3 context", e);
        }
    }

    public void returnContext(Context context) {
        if (context == null) {
            return;
        }
        if (closed || !pool.offer(context)) {
            context.close();
            createdCount.decrementAndGet();
            Log.debug("Closed surplus Z3 context");
        }
    }

    @Override
    public void close() {
        closed = true;
        Context context;
        int closedCount = 0;
        while ((context = pool.poll()) != null) {
            try {
                context.close();
                closedCount++;
            } catch (RuntimeException e) {
                Log.errorStack("Error closing Z3 context during shutdown", e);
            }
        }
        Log.debug("Z3ContextPool shutdown complete, closed " + closedCount + " contexts");
    }

    public String getPoolStatus() {
        return String.format("Z3ContextPool[available=%d, created=%d, maxSize=%d]",
                pool.size(), createdCount.get(), maxSize);
    }
}
