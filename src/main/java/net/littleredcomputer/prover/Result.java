package net.littleredcomputer.prover;

import com.google.common.collect.ImmutableList;

/**
 * The outcome of expanding a formula on a branch: either the branch stays open, or it closes
 * provided the listed disequalities are respected by everything done afterwards.
 */
public final class Result {
    public static final Result OPEN = new Result(false, ImmutableList.of());
    private static final Result CLOSED = new Result(true, ImmutableList.of());
    private final boolean closed;
    private final ImmutableList<Disequality> disequalities;

    private Result(boolean closed, ImmutableList<Disequality> disequalities) {
        this.closed = closed;
        this.disequalities = disequalities;
    }

    public static Result closed(ImmutableList<Disequality> disequalities) {
        return disequalities.isEmpty() ? CLOSED : new Result(true, disequalities);
    }

    public static Result closed() {
        return CLOSED;
    }

    public boolean isClosed() {
        return closed;
    }

    public ImmutableList<Disequality> disequalities() {
        return disequalities;
    }

    @Override
    public String toString() {
        return closed ? "closed" + disequalities : "open";
    }
}
