package net.littleredcomputer.prover.logic;

/**
 * A first-order term: either a {@link Variable} or a {@link Compound}. Terms are immutable;
 * the values of variables are held elsewhere (see {@code net.littleredcomputer.prover.Trail}).
 */
public abstract class Term {
    Term() {}
}
