package net.littleredcomputer.prover;

import com.google.common.base.Stopwatch;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import net.littleredcomputer.prover.logic.Formula;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Decides whether a formula follows from a set of axioms by refuting its negation, with
 * iterative deepening: when an attempt runs into the depth limit without closing, it is
 * started over from scratch with a larger limit.
 *
 * <p>A false answer means only that no proof was found. For formulas outside the decidable
 * part of the logic the search may not terminate unless {@link #setMaxDepthLimit} is used.
 *
 * <p>Expansion recurses about as deep as the depth limit, which grows with every retry, so
 * each attempt runs on its own daemon thread with a large stack (see {@link #setStackSize});
 * the calling thread waits for it. Interrupting the caller cancels the attempt.
 */
public class Prover {
    private static final Logger log = LogManager.getFormatterLogger(Prover.class);
    public static final int DEFAULT_DEPTH_LIMIT = 500;
    public static final int DEFAULT_DEPTH_INCREMENT = 500;
    public static final long DEFAULT_STACK_SIZE = 256L << 20;
    private int initialDepthLimit = DEFAULT_DEPTH_LIMIT;
    private int depthIncrement = DEFAULT_DEPTH_INCREMENT;
    private int maxDepthLimit = 0;
    private long stackSize = DEFAULT_STACK_SIZE;
    private Duration logInterval = Duration.ofMillis(1000);
    private Set<Expander.Trace> tracing = EnumSet.noneOf(Expander.Trace.class);

    public Prover setInitialDepthLimit(int limit) {
        if (limit < 1) throw new IllegalArgumentException("initial depth limit must be positive");
        initialDepthLimit = limit;
        return this;
    }

    public Prover setDepthIncrement(int increment) {
        if (increment < 1) throw new IllegalArgumentException("depth increment must be positive");
        depthIncrement = increment;
        return this;
    }

    /** Give up, answering false, rather than search beyond this depth. Zero means never give up. */
    public Prover setMaxDepthLimit(int limit) {
        if (limit < 0) throw new IllegalArgumentException("maximum depth limit must not be negative");
        maxDepthLimit = limit;
        return this;
    }

    public Prover setStackSize(long bytes) {
        if (bytes < 1) throw new IllegalArgumentException("stack size must be positive");
        stackSize = bytes;
        return this;
    }

    public Prover setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    public Prover setTracing(Set<Expander.Trace> categories) {
        tracing = categories;
        return this;
    }

    public boolean prove(Formula f) {
        return prove(ImmutableList.of(), f);
    }

    /**
     * @param axioms formulas true in every world; they may not mention knowledge
     * @param f the formula to prove
     * @return true if f was proved
     * @throws UnsupportedQuantifierException if an existential quantifier turns up in positive scope
     */
    public boolean prove(List<Formula> axioms, Formula f) {
        Stopwatch stopwatch = Stopwatch.createStarted();
        Formula negated = Formula.not(f);
        for (int limit = initialDepthLimit; ; limit += depthIncrement) {
            if (maxDepthLimit > 0 && limit > maxDepthLimit) {
                log.warn("giving up on %s: depth limit %d would exceed %d", f, limit, maxDepthLimit);
                return false;
            }
            Expander expander = new Expander(limit).setLogInterval(logInterval).setTracing(tracing);
            Result r = attempt(expander, axioms, negated);
            if (r.isClosed()) {
                log.debug("proved at depth %d (limit %d) after %d steps in %s", expander.maxDepth(), limit, expander.stepCount(), stopwatch);
                return true;
            }
            if (!expander.depthLimitExceeded()) {
                log.debug("not proved after %d steps in %s", expander.stepCount(), stopwatch);
                return false;
            }
            log.debug("not proved at depth limit %d; retrying", limit);
        }
    }

    private Result attempt(Expander expander, List<Formula> axioms, Formula negated) {
        FutureTask<Result> task = new FutureTask<>(() -> expander.refute(axioms, negated));
        Thread worker = new Thread(null, task, "prover", stackSize);
        worker.setDaemon(true);
        worker.start();
        try {
            return task.get();
        } catch (ExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while proving", e);
        }
    }
}
