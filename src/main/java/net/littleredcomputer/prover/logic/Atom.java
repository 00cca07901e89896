package net.littleredcomputer.prover.logic;

import com.google.common.collect.ImmutableList;

import java.util.Objects;
import java.util.function.UnaryOperator;

/** A predicate symbol applied to zero or more terms. */
public final class Atom extends Formula {
    private final String predicate;
    private final ImmutableList<Term> args;

    Atom(String predicate, ImmutableList<Term> args) {
        if (predicate == null || predicate.isEmpty()) throw new IllegalArgumentException("predicate must be named");
        this.predicate = predicate;
        this.args = args;
    }

    public String predicate() {
        return predicate;
    }

    public ImmutableList<Term> args() {
        return args;
    }

    /**
     * The atom viewed as a term, so that two atoms can be unified like any other pair of
     * terms.
     */
    public Compound asTerm() {
        return Compound.of(predicate, args);
    }

    @Override
    public Connective connective() {
        return Connective.ATOM;
    }

    @Override
    public Formula mapTerms(UnaryOperator<Term> f) {
        if (args.isEmpty()) return this;
        ImmutableList.Builder<Term> b = ImmutableList.builderWithExpectedSize(args.size());
        for (Term a : args) b.add(f.apply(a));
        return new Atom(predicate, b.build());
    }

    @Override
    int precedence() {
        return 5;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Atom)) return false;
        Atom a = (Atom) o;
        return predicate.equals(a.predicate) && args.equals(a.args);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, args);
    }

    @Override
    public String toString() {
        return asTerm().toString();
    }
}
