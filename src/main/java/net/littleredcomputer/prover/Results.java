package net.littleredcomputer.prover;

import javax.annotation.Nullable;

/**
 * The results of expanding a formula, computed as they are asked for. The bindings a result
 * depends on stay in force until the next call, which retracts them before looking further.
 */
public interface Results {
    /** @return the next result, or null once there are no more */
    @Nullable
    Result next();

    static Results none() {
        return () -> null;
    }

    static Results of(Result r) {
        return new Results() {
            private boolean done = false;

            @Override
            public Result next() {
                if (done) return null;
                done = true;
                return r;
            }
        };
    }
}
