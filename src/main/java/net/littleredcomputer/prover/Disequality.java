package net.littleredcomputer.prover;

import net.littleredcomputer.prover.logic.Term;

/**
 * A pair of terms that must not be made to unify for the rest of a proof attempt. The
 * pair is unordered.
 */
public final class Disequality {
    private final Term left;
    private final Term right;

    public Disequality(Term left, Term right) {
        this.left = left;
        this.right = right;
    }

    public Term left() {
        return left;
    }

    public Term right() {
        return right;
    }

    @Override
    public String toString() {
        return left + " ~= " + right;
    }
}
