package solver;

import static org.junit.jupiter.api.Assertions.*;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;

public class Z3ContextPoolTest {

    @Test
    public void reusesReturnedContexts() {
        try (Z3ContextPool pool = new Z3ContextPool(1)) {
            Context first = pool.borrowContext();
            pool.returnContext(first);
            assertSame(first, pool.borrowContext());
            pool.returnContext(first);
            assertTrue(pool.getPoolStatus().contains("available=1"));
        }
    }

    @Test
    public void closedPoolRefusesToLend() {
        Z3ContextPool pool = new Z3ContextPool(1);
        pool.close();
        assertThrows(IllegalStateException.class, pool::borrowContext);
    }

    @Test
    public void sizeMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new Z3ContextPool(0));
    }
}
